package mta.shop.order.exception;

import lombok.Getter;

/**
 * ProductNotFoundException
 * Thrown when an order line names a product the product service does not know.
 */
@Getter
public class ProductNotFoundException extends RuntimeException {

    private final long productId;

    public ProductNotFoundException(long productId) {
        super("Product with ID " + productId + " not found");
        this.productId = productId;
    }
}
