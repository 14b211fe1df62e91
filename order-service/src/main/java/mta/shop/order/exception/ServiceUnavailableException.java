package mta.shop.order.exception;

import lombok.Getter;

/**
 * ServiceUnavailableException
 * Thrown when a downstream service (the product service) cannot be reached or keeps failing.
 * Results in an HTTP 503 response.
 */
@Getter
public class ServiceUnavailableException extends RuntimeException {

    private final String type;

    public ServiceUnavailableException(String type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }
}
