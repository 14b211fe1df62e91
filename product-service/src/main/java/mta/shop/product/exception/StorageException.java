package mta.shop.product.exception;

import lombok.Getter;

/**
 * StorageException
 * Raised when the blob store rejects or fails an upload.
 */
@Getter
public class StorageException extends RuntimeException {

    private final String blobName;

    public StorageException(String blobName, String message, Throwable cause) {
        super(message, cause);
        this.blobName = blobName;
    }
}
