package mta.shop.order.model.order;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record OrderItem(
    @JsonProperty("order_item_id")
    Long orderItemId,

    @JsonProperty("order_id")
    Long orderId,

    @JsonProperty("product_id")
    long productId,

    @JsonProperty("quantity")
    int quantity,

    @JsonProperty("price_at_purchase")
    BigDecimal priceAtPurchase,

    @JsonProperty("item_total")
    BigDecimal itemTotal
) {}
