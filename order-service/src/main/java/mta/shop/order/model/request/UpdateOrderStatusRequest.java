package mta.shop.order.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * UpdateOrderStatusRequest - DTO for PATCH /orders/{id}/status
 */
public record UpdateOrderStatusRequest(

    @NotBlank(message = "status is required")
    @JsonProperty("status")
    String status
) {}
