package mta.shop.product.exception;

import lombok.Getter;

/**
 * ProductNotFoundException
 * Thrown when a product id does not exist in the catalogue.
 */
@Getter
public class ProductNotFoundException extends RuntimeException {

    private final long productId;

    public ProductNotFoundException(long productId) {
        super("Product with ID " + productId + " not found");
        this.productId = productId;
    }
}
