package mta.shop.product.exception;

import lombok.Getter;

/**
 * StockLimitExceededException
 * Thrown when a restock would push the stock past the largest storable quantity.
 */
@Getter
public class StockLimitExceededException extends RuntimeException {

    private final long productId;
    private final int current;
    private final int requested;

    public StockLimitExceededException(long productId, int current, int requested) {
        super("Restocking product " + productId + " by " + requested
                + " would exceed the maximum stock of " + Integer.MAX_VALUE + " (current " + current + ")");
        this.productId = productId;
        this.current = current;
        this.requested = requested;
    }
}
