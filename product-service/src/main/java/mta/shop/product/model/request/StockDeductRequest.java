package mta.shop.product.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * StockDeductRequest - DTO for PATCH /products/{id}/deduct-stock
 */
public record StockDeductRequest(

    @NotNull(message = "quantity_to_deduct is required")
    @Min(value = 1, message = "quantity_to_deduct must be at least 1")
    @JsonProperty("quantity_to_deduct")
    Integer quantityToDeduct
) {}
