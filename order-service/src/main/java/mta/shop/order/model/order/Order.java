package mta.shop.order.model.order;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record Order(
    @JsonProperty("order_id")
    Long orderId,

    @JsonProperty("user_id")
    long userId,

    @JsonProperty("order_date")
    Instant orderDate,

    @JsonProperty("status")
    String status,

    @JsonProperty("total_amount")
    BigDecimal totalAmount,

    @JsonProperty("shipping_address")
    String shippingAddress,

    @JsonProperty("created_at")
    Instant createdAt,

    @JsonProperty("updated_at")
    Instant updatedAt,

    @JsonProperty("items")
    List<OrderItem> items
) {

    public Order withStatus(String newStatus, Instant when) {
        return new Order(orderId, userId, orderDate, newStatus, totalAmount, shippingAddress, createdAt, when, items);
    }

    public Order withItems(List<OrderItem> newItems) {
        return new Order(orderId, userId, orderDate, status, totalAmount, shippingAddress, createdAt, updatedAt, newItems);
    }
}
