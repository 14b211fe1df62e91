package mta.shop.product.repository;

import mta.shop.product.model.product.Product;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * JDBC access to the products table.
 * Stock changes are single conditional UPDATE statements so concurrent
 * deductions cannot take the quantity below zero.
 */
@Repository
public class ProductRepository {

    private static final Logger logger = LoggerFactory.getLogger(ProductRepository.class);

    private static final String COLUMNS =
            "product_id, name, description, price, stock_quantity, image_url, created_at, updated_at";

    private static final RowMapper<Product> PRODUCT_ROW_MAPPER = (rs, rowNum) -> new Product(
            rs.getLong("product_id"),
            rs.getString("name"),
            rs.getString("description"),
            rs.getBigDecimal("price"),
            rs.getInt("stock_quantity"),
            rs.getString("image_url"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
    );

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public ProductRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Product insert(Product product) {
        String sql = "INSERT INTO products (name, description, price, stock_quantity, image_url, created_at, updated_at) "
                + "VALUES (:name, :description, :price, :stockQuantity, :imageUrl, :createdAt, :updatedAt)";

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("name", product.name())
                .addValue("description", product.description())
                .addValue("price", product.price())
                .addValue("stockQuantity", product.stockQuantity())
                .addValue("imageUrl", product.imageUrl())
                .addValue("createdAt", Timestamp.from(product.createdAt()))
                .addValue("updatedAt", Timestamp.from(product.updatedAt()));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(sql, params, keyHolder, new String[]{"product_id"});
        long id = keyHolder.getKey().longValue();
        logger.debug("Inserted product id={} name='{}'", id, product.name());

        return new Product(id, product.name(), product.description(), product.price(),
                product.stockQuantity(), product.imageUrl(), product.createdAt(), product.updatedAt());
    }

    public Optional<Product> findById(long productId) {
        List<Product> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM products WHERE product_id = :id",
                new MapSqlParameterSource("id", productId),
                PRODUCT_ROW_MAPPER);
        return rows.stream().findFirst();
    }

    /**
     * Page through products ordered by id. A non-blank search term matches
     * name or description case-insensitively.
     */
    public List<Product> findAll(int skip, int limit, String search) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("limit", limit)
                .addValue("skip", skip);

        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM products");
        if (search != null && !search.isBlank()) {
            sql.append(" WHERE LOWER(name) LIKE :pattern OR LOWER(COALESCE(description, '')) LIKE :pattern");
            params.addValue("pattern", "%" + escapeLike(search.trim().toLowerCase(Locale.ROOT)) + "%");
        }
        sql.append(" ORDER BY product_id LIMIT :limit OFFSET :skip");

        return jdbcTemplate.query(sql.toString(), params, PRODUCT_ROW_MAPPER);
    }

    /**
     * Sets only the non-null columns, plus updated_at. Stock is never
     * written back from a previously read row, so a deduction running
     * concurrently is not lost.
     *
     * @return false if the row no longer exists
     */
    public boolean update(long productId, String name, String description, BigDecimal price,
                          Integer stockQuantity, String imageUrl, Instant updatedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", productId)
                .addValue("updatedAt", Timestamp.from(updatedAt));
        List<String> assignments = new ArrayList<>();
        if (name != null) {
            assignments.add("name = :name");
            params.addValue("name", name);
        }
        if (description != null) {
            assignments.add("description = :description");
            params.addValue("description", description);
        }
        if (price != null) {
            assignments.add("price = :price");
            params.addValue("price", price);
        }
        if (stockQuantity != null) {
            assignments.add("stock_quantity = :stockQuantity");
            params.addValue("stockQuantity", stockQuantity);
        }
        if (imageUrl != null) {
            assignments.add("image_url = :imageUrl");
            params.addValue("imageUrl", imageUrl);
        }
        assignments.add("updated_at = :updatedAt");

        String sql = "UPDATE products SET " + String.join(", ", assignments) + " WHERE product_id = :id";
        return jdbcTemplate.update(sql, params) == 1;
    }

    public boolean updateImageUrl(long productId, String imageUrl, Instant updatedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", productId)
                .addValue("imageUrl", imageUrl)
                .addValue("updatedAt", Timestamp.from(updatedAt));
        return jdbcTemplate.update(
                "UPDATE products SET image_url = :imageUrl, updated_at = :updatedAt WHERE product_id = :id",
                params) == 1;
    }

    /**
     * Subtracts quantity only when enough stock is left.
     *
     * @return false if the product is missing or its stock is below quantity
     */
    public boolean deductStock(long productId, int quantity, Instant updatedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", productId)
                .addValue("quantity", quantity)
                .addValue("updatedAt", Timestamp.from(updatedAt));
        int updated = jdbcTemplate.update(
                "UPDATE products SET stock_quantity = stock_quantity - :quantity, updated_at = :updatedAt "
                        + "WHERE product_id = :id AND stock_quantity >= :quantity",
                params);
        return updated == 1;
    }

    /**
     * Adds quantity unless the result would not fit in the INTEGER column.
     *
     * @return false if the product is missing or the sum would overflow
     */
    public boolean addStock(long productId, int quantity, Instant updatedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", productId)
                .addValue("quantity", quantity)
                .addValue("ceiling", Integer.MAX_VALUE - quantity)
                .addValue("updatedAt", Timestamp.from(updatedAt));
        return jdbcTemplate.update(
                "UPDATE products SET stock_quantity = stock_quantity + :quantity, updated_at = :updatedAt "
                        + "WHERE product_id = :id AND stock_quantity <= :ceiling",
                params) == 1;
    }

    public boolean deleteById(long productId) {
        return jdbcTemplate.update("DELETE FROM products WHERE product_id = :id",
                new MapSqlParameterSource("id", productId)) == 1;
    }

    private static String escapeLike(String term) {
        return term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
