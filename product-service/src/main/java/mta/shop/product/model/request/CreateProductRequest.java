package mta.shop.product.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * CreateProductRequest - DTO for POST /products
 * Input: name, optional description, price (greater than zero) and initial stock.
 */
public record CreateProductRequest(

    @NotBlank(message = "name is required")
    @Size(max = 255, message = "name must not exceed 255 characters")
    @JsonProperty("name")
    String name,

    @Size(max = 1000, message = "description must not exceed 1000 characters")
    @JsonProperty("description")
    String description,

    @NotNull(message = "price is required")
    @DecimalMin(value = "0.0", inclusive = false, message = "price must be greater than zero")
    @Digits(integer = 8, fraction = 2, message = "price must have at most 8 integer digits and 2 decimals")
    @JsonProperty("price")
    BigDecimal price,

    @NotNull(message = "stock_quantity is required")
    @Min(value = 0, message = "stock_quantity must not be negative")
    @JsonProperty("stock_quantity")
    Integer stockQuantity,

    @Size(max = 2048, message = "image_url must not exceed 2048 characters")
    @JsonProperty("image_url")
    String imageUrl
) {}
