package mta.shop.order.exception;

import lombok.Getter;

/**
 * InsufficientStockException
 * Thrown when an order line asks for more units than the product has.
 * available is -1 when the product service did not report it.
 */
@Getter
public class InsufficientStockException extends RuntimeException {

    private final long productId;
    private final int available;
    private final int requested;

    public InsufficientStockException(long productId, int available, int requested) {
        super("Insufficient stock for product " + productId
                + (available >= 0 ? ": available " + available + ", requested " + requested : ": requested " + requested));
        this.productId = productId;
        this.available = available;
        this.requested = requested;
    }
}
