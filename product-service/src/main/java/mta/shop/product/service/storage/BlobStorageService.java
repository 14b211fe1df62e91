package mta.shop.product.service.storage;

import com.azure.core.util.BinaryData;
import com.azure.storage.blob.BlobClient;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobServiceClientBuilder;
import com.azure.storage.blob.models.BlobHttpHeaders;
import com.azure.storage.blob.sas.BlobSasPermission;
import com.azure.storage.blob.sas.BlobServiceSasSignatureValues;
import com.azure.storage.common.StorageSharedKeyCredential;
import mta.shop.product.exception.StorageException;
import mta.shop.product.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;

/**
 * BlobStorageService
 * Stores product images in an Azure Blob Storage container and hands out
 * read-only SAS URLs for them.
 * The container client is created on first use, so the service starts
 * without storage credentials and only uploads are refused.
 */
@Service
public class BlobStorageService {

    private static final Logger logger = LoggerFactory.getLogger(BlobStorageService.class);

    private final String accountName;
    private final String accountKey;
    private final String containerName;
    private final int sasExpiryHours;
    private final String endpoint;

    private volatile BlobContainerClient containerClient;

    public BlobStorageService(
            @Value("${azure.storage.account-name:}") String accountName,
            @Value("${azure.storage.account-key:}") String accountKey,
            @Value("${azure.storage.container-name:}") String containerName,
            @Value("${azure.storage.sas-expiry-hours:24}") int sasExpiryHours,
            @Value("${azure.storage.endpoint:}") String endpoint) {
        this.accountName = accountName;
        this.accountKey = accountKey;
        this.containerName = containerName;
        this.sasExpiryHours = sasExpiryHours;
        this.endpoint = endpoint.isBlank()
                ? "https://" + accountName + ".blob.core.windows.net"
                : endpoint;
    }

    /**
     * True when account name, key and container are all set.
     */
    public boolean isConfigured() {
        return !accountName.isBlank() && !accountKey.isBlank() && !containerName.isBlank();
    }

    /**
     * Uploads the bytes under blobName, replacing any existing blob.
     *
     * @return the blob URL with a read-only SAS query string appended
     * @throws StorageUnavailableException if storage is not configured
     * @throws StorageException if the upload or SAS generation fails
     */
    public String upload(String blobName, byte[] content, String contentType) {
        BlobContainerClient container = container();
        try {
            BlobClient blob = container.getBlobClient(blobName);
            blob.upload(BinaryData.fromBytes(content), true);
            blob.setHttpHeaders(new BlobHttpHeaders().setContentType(contentType));

            BlobSasPermission permission = new BlobSasPermission().setReadPermission(true);
            BlobServiceSasSignatureValues sasValues = new BlobServiceSasSignatureValues(
                    OffsetDateTime.now().plusHours(sasExpiryHours), permission);
            String sasToken = blob.generateSas(sasValues);

            logger.info("Uploaded blob '{}' ({} bytes) to container '{}', SAS valid for {}h",
                    blobName, content.length, containerName, sasExpiryHours);
            return blob.getBlobUrl() + "?" + sasToken;
        } catch (RuntimeException e) {
            throw new StorageException(blobName, "Upload to container '" + containerName + "' failed: " + e.getMessage(), e);
        }
    }

    /**
     * Removes the blob if it exists.
     *
     * @throws StorageException if the delete fails
     */
    public void delete(String blobName) {
        BlobContainerClient container = container();
        try {
            boolean deleted = container.getBlobClient(blobName).deleteIfExists();
            logger.info("Blob '{}' delete requested, existed={}", blobName, deleted);
        } catch (RuntimeException e) {
            throw new StorageException(blobName, "Delete from container '" + containerName + "' failed: " + e.getMessage(), e);
        }
    }

    private BlobContainerClient container() {
        if (!isConfigured()) {
            throw new StorageUnavailableException(
                    "Image storage is not configured (account name, key and container are required)");
        }
        BlobContainerClient client = containerClient;
        if (client != null) {
            return client;
        }
        synchronized (this) {
            if (containerClient == null) {
                try {
                    BlobContainerClient created = new BlobServiceClientBuilder()
                            .endpoint(endpoint)
                            .credential(new StorageSharedKeyCredential(accountName, accountKey))
                            .buildClient()
                            .getBlobContainerClient(containerName);
                    created.createIfNotExists();
                    containerClient = created;
                    logger.info("Connected to blob container '{}' at {}", containerName, endpoint);
                } catch (RuntimeException e) {
                    throw new StorageException(null, "Cannot open blob container '" + containerName + "': " + e.getMessage(), e);
                }
            }
            return containerClient;
        }
    }
}
