package mta.shop.order.model.product;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * The fields of a product-service product that order placement needs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProductSnapshot(
    @JsonProperty("product_id")
    long productId,

    @JsonProperty("name")
    String name,

    @JsonProperty("price")
    BigDecimal price,

    @JsonProperty("stock_quantity")
    int stockQuantity
) {}
