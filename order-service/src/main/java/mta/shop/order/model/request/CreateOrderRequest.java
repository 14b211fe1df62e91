package mta.shop.order.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * CreateOrderRequest - DTO for POST /orders
 * Input: user id, optional shipping address and 1..100 order lines.
 */
public record CreateOrderRequest(

    @NotNull(message = "user_id is required")
    @Min(value = 1, message = "user_id must be positive")
    @JsonProperty("user_id")
    Long userId,

    @Size(max = 1000, message = "shipping_address must not exceed 1000 characters")
    @JsonProperty("shipping_address")
    String shippingAddress,

    @NotNull(message = "items list is required")
    @NotEmpty(message = "items list must contain at least one item")
    @Size(max = 100, message = "items list must not exceed 100 lines")
    @Valid
    @JsonProperty("items")
    List<OrderItemRequest> items
) {}
