package mta.shop.order.exception;

import lombok.Getter;

/**
 * InvalidStatusTransitionException
 * Thrown when an order cannot move from its current status to the requested one.
 * Results in an HTTP 409 response.
 */
@Getter
public class InvalidStatusTransitionException extends RuntimeException {

    private final long orderId;
    private final String currentStatus;
    private final String requestedStatus;

    public InvalidStatusTransitionException(long orderId, String currentStatus, String requestedStatus) {
        super("Cannot change order " + orderId + " from '" + currentStatus + "' to '" + requestedStatus + "'");
        this.orderId = orderId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }
}
