package mta.shop.product.exception;

import lombok.Getter;

/**
 * InsufficientStockException
 * Thrown when a stock deduction asks for more units than are available.
 */
@Getter
public class InsufficientStockException extends RuntimeException {

    private final long productId;
    private final int available;
    private final int requested;

    public InsufficientStockException(long productId, int available, int requested) {
        super("Insufficient stock for product " + productId
                + ": available " + available + ", requested " + requested);
        this.productId = productId;
        this.available = available;
        this.requested = requested;
    }
}
