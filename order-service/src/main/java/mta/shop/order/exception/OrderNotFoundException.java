package mta.shop.order.exception;

import lombok.Getter;

/**
 * OrderNotFoundException
 * Thrown when an order is not found in the system.
 */
@Getter
public class OrderNotFoundException extends RuntimeException {

    private final long orderId;

    public OrderNotFoundException(long orderId) {
        super("Order with ID " + orderId + " not found");
        this.orderId = orderId;
    }
}
