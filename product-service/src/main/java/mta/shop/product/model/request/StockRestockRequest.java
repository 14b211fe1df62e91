package mta.shop.product.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * StockRestockRequest - DTO for PATCH /products/{id}/restock
 */
public record StockRestockRequest(

    @NotNull(message = "quantity is required")
    @Min(value = 1, message = "quantity must be at least 1")
    @JsonProperty("quantity")
    Integer quantity
) {}
