package mta.shop.order.exception;

import lombok.Getter;

/**
 * InvalidOrderException
 * Thrown when an order passes field validation but cannot be stored as a whole,
 * such as merged quantities or a total beyond what the order tables hold.
 * Results in an HTTP 400 response.
 */
@Getter
public class InvalidOrderException extends RuntimeException {

    private final String field;

    public InvalidOrderException(String field, String message) {
        super(message);
        this.field = field;
    }
}
