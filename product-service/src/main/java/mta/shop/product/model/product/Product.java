package mta.shop.product.model.product;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Product - A catalogue entry as stored in the products table.
 */
public record Product(
    @JsonProperty("product_id")
    Long productId,

    @JsonProperty("name")
    String name,

    @JsonProperty("description")
    String description,

    @JsonProperty("price")
    BigDecimal price,

    @JsonProperty("stock_quantity")
    int stockQuantity,

    @JsonProperty("image_url")
    String imageUrl,

    @JsonProperty("created_at")
    Instant createdAt,

    @JsonProperty("updated_at")
    Instant updatedAt
) {}
