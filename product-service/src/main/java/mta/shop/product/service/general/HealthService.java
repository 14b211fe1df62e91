package mta.shop.product.service.general;

import mta.shop.product.model.response.HealthCheck;
import mta.shop.product.service.db.DatabaseConnectivityService;
import mta.shop.product.service.storage.BlobStorageService;
import org.springframework.stereotype.Service;

/**
 * HealthService
 * Builds health check entries from the connectivity monitor.
 */
@Service
public class HealthService {

    private final DatabaseConnectivityService databaseConnectivityService;
    private final BlobStorageService blobStorageService;

    public HealthService(DatabaseConnectivityService databaseConnectivityService,
                         BlobStorageService blobStorageService) {
        this.databaseConnectivityService = databaseConnectivityService;
        this.blobStorageService = blobStorageService;
    }

    /**
     * Pings the database once and reports the refreshed status.
     */
    public HealthCheck getDatabaseStatus() {
        boolean healthy = databaseConnectivityService.pingDatabase();
        return new HealthCheck(
                healthy ? "UP" : "DOWN",
                databaseConnectivityService.getDetailedStatus()
        );
    }

    /**
     * Image storage is optional, so this check never makes the service unready.
     */
    public HealthCheck getStorageStatus() {
        return blobStorageService.isConfigured()
                ? new HealthCheck("UP", "Blob storage configured")
                : new HealthCheck("DOWN", "Blob storage not configured; image uploads disabled");
    }

    public HealthCheck getServiceStatus() {
        return new HealthCheck("UP", "Product Service is running and responsive");
    }
}
