package mta.shop.order.repository;

import mta.shop.order.model.order.Order;
import mta.shop.order.model.order.OrderItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC access to the orders and order_items tables.
 * An order and its items are always written and deleted together.
 */
@Repository
public class OrderRepository {

    private static final Logger logger = LoggerFactory.getLogger(OrderRepository.class);

    private static final String ORDER_COLUMNS =
            "order_id, user_id, order_date, status, total_amount, shipping_address, created_at, updated_at";

    private static final String ITEM_COLUMNS =
            "order_item_id, order_id, product_id, quantity, price_at_purchase, item_total";

    private static final RowMapper<Order> ORDER_ROW_MAPPER = (rs, rowNum) -> new Order(
            rs.getLong("order_id"),
            rs.getLong("user_id"),
            toInstant(rs.getTimestamp("order_date")),
            rs.getString("status"),
            rs.getBigDecimal("total_amount"),
            rs.getString("shipping_address"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at")),
            List.of()
    );

    private static final RowMapper<OrderItem> ITEM_ROW_MAPPER = (rs, rowNum) -> new OrderItem(
            rs.getLong("order_item_id"),
            rs.getLong("order_id"),
            rs.getLong("product_id"),
            rs.getInt("quantity"),
            rs.getBigDecimal("price_at_purchase"),
            rs.getBigDecimal("item_total")
    );

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public OrderRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Inserts the order header and all of its items in one transaction.
     *
     * @return the order with generated ids filled in
     */
    @Transactional
    public Order insert(Order order) {
        String sql = "INSERT INTO orders (user_id, order_date, status, total_amount, shipping_address, created_at, updated_at) "
                + "VALUES (:userId, :orderDate, :status, :totalAmount, :shippingAddress, :createdAt, :updatedAt)";

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", order.userId())
                .addValue("orderDate", Timestamp.from(order.orderDate()))
                .addValue("status", order.status())
                .addValue("totalAmount", order.totalAmount())
                .addValue("shippingAddress", order.shippingAddress())
                .addValue("createdAt", Timestamp.from(order.createdAt()))
                .addValue("updatedAt", Timestamp.from(order.updatedAt()));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(sql, params, keyHolder, new String[]{"order_id"});
        long orderId = keyHolder.getKey().longValue();

        List<OrderItem> savedItems = new ArrayList<>();
        for (OrderItem item : order.items()) {
            savedItems.add(insertItem(orderId, item));
        }
        logger.debug("Inserted order id={} with {} item(s)", orderId, savedItems.size());

        return new Order(orderId, order.userId(), order.orderDate(), order.status(), order.totalAmount(),
                order.shippingAddress(), order.createdAt(), order.updatedAt(), List.copyOf(savedItems));
    }

    private OrderItem insertItem(long orderId, OrderItem item) {
        String sql = "INSERT INTO order_items (order_id, product_id, quantity, price_at_purchase, item_total) "
                + "VALUES (:orderId, :productId, :quantity, :priceAtPurchase, :itemTotal)";

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("orderId", orderId)
                .addValue("productId", item.productId())
                .addValue("quantity", item.quantity())
                .addValue("priceAtPurchase", item.priceAtPurchase())
                .addValue("itemTotal", item.itemTotal());

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(sql, params, keyHolder, new String[]{"order_item_id"});
        return new OrderItem(keyHolder.getKey().longValue(), orderId, item.productId(), item.quantity(),
                item.priceAtPurchase(), item.itemTotal());
    }

    public Optional<Order> findById(long orderId) {
        List<Order> rows = jdbcTemplate.query(
                "SELECT " + ORDER_COLUMNS + " FROM orders WHERE order_id = :id",
                new MapSqlParameterSource("id", orderId),
                ORDER_ROW_MAPPER);
        return rows.stream().findFirst().map(order -> order.withItems(findItems(orderId)));
    }

    /**
     * Newest orders first, optionally filtered by user and by status.
     * Items for the whole page are loaded with a single query.
     */
    public List<Order> findAll(int skip, int limit, Long userId, String status) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("limit", limit)
                .addValue("skip", skip);

        List<String> conditions = new ArrayList<>();
        if (userId != null) {
            conditions.add("user_id = :userId");
            params.addValue("userId", userId);
        }
        if (status != null) {
            conditions.add("status = :status");
            params.addValue("status", status);
        }

        StringBuilder sql = new StringBuilder("SELECT ").append(ORDER_COLUMNS).append(" FROM orders");
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        sql.append(" ORDER BY created_at DESC, order_id DESC LIMIT :limit OFFSET :skip");

        List<Order> orders = jdbcTemplate.query(sql.toString(), params, ORDER_ROW_MAPPER);
        if (orders.isEmpty()) {
            return orders;
        }

        Map<Long, List<OrderItem>> itemsByOrder = new LinkedHashMap<>();
        orders.forEach(order -> itemsByOrder.put(order.orderId(), new ArrayList<>()));
        jdbcTemplate.query(
                "SELECT " + ITEM_COLUMNS + " FROM order_items WHERE order_id IN (:ids) ORDER BY order_item_id",
                new MapSqlParameterSource("ids", List.copyOf(itemsByOrder.keySet())),
                ITEM_ROW_MAPPER
        ).forEach(item -> itemsByOrder.get(item.orderId()).add(item));

        return orders.stream()
                .map(order -> order.withItems(List.copyOf(itemsByOrder.get(order.orderId()))))
                .toList();
    }

    public List<OrderItem> findItems(long orderId) {
        return jdbcTemplate.query(
                "SELECT " + ITEM_COLUMNS + " FROM order_items WHERE order_id = :id ORDER BY order_item_id",
                new MapSqlParameterSource("id", orderId),
                ITEM_ROW_MAPPER);
    }

    /**
     * Moves an order to a new status only if it is still in the expected one.
     *
     * @return false if the order is gone or another request changed its status first
     */
    public boolean updateStatus(long orderId, String expectedStatus, String newStatus, Instant updatedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", orderId)
                .addValue("expected", expectedStatus)
                .addValue("status", newStatus)
                .addValue("updatedAt", Timestamp.from(updatedAt));
        return jdbcTemplate.update(
                "UPDATE orders SET status = :status, updated_at = :updatedAt WHERE order_id = :id AND status = :expected",
                params) == 1;
    }

    @Transactional
    public boolean deleteById(long orderId) {
        MapSqlParameterSource params = new MapSqlParameterSource("id", orderId);
        jdbcTemplate.update("DELETE FROM order_items WHERE order_id = :id", params);
        return jdbcTemplate.update("DELETE FROM orders WHERE order_id = :id", params) == 1;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
