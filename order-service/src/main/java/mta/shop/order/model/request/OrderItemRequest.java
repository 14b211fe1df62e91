package mta.shop.order.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * One order line: which product and how many units.
 */
public record OrderItemRequest(

    @NotNull(message = "product_id is required")
    @Min(value = 1, message = "product_id must be positive")
    @JsonProperty("product_id")
    Long productId,

    @NotNull(message = "quantity is required")
    @Min(value = 1, message = "quantity must be at least 1")
    @JsonProperty("quantity")
    Integer quantity
) {}
