package mta.shop.order.exception;

import lombok.Getter;

/**
 * InvalidStatusException
 * Thrown when a status name is not one the order status machine knows.
 */
@Getter
public class InvalidStatusException extends RuntimeException {

    private final String status;

    public InvalidStatusException(String status) {
        super("Invalid status '" + status + "'. Allowed: pending, confirmed, shipped, delivered, cancelled");
        this.status = status;
    }
}
