package mta.shop.product.exception;

/**
 * StorageUnavailableException
 * Thrown when image storage is used without an account, key and container configured.
 * Results in an HTTP 503 response.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message) {
        super(message);
    }
}
