package mta.shop.product.exception;

/**
 * InvalidImageException
 * Thrown when an uploaded file is empty or is not an image.
 */
public class InvalidImageException extends RuntimeException {

    public InvalidImageException(String reason) {
        super(reason);
    }
}
