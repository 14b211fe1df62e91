package mta.shop.order.service.general;

import mta.shop.order.client.ProductServiceClient;
import mta.shop.order.model.response.HealthCheck;
import mta.shop.order.service.db.DatabaseConnectivityService;
import org.springframework.stereotype.Service;

/**
 * HealthService
 * Builds health check entries for the order service.
 */
@Service
public class HealthService {

    private final DatabaseConnectivityService databaseConnectivityService;
    private final ProductServiceClient productServiceClient;

    public HealthService(DatabaseConnectivityService databaseConnectivityService,
                         ProductServiceClient productServiceClient) {
        this.databaseConnectivityService = databaseConnectivityService;
        this.productServiceClient = productServiceClient;
    }

    public HealthCheck getDatabaseStatus() {
        boolean healthy = databaseConnectivityService.pingDatabase();
        return new HealthCheck(
                healthy ? "UP" : "DOWN",
                databaseConnectivityService.getDetailedStatus()
        );
    }

    /**
     * Informational only: orders can still be read while the product service is down.
     */
    public HealthCheck getProductServiceStatus() {
        return productServiceClient.isReachable()
                ? new HealthCheck("UP", "Product service reachable")
                : new HealthCheck("DOWN", "Product service unreachable; order placement will fail");
    }

    public HealthCheck getServiceStatus() {
        return new HealthCheck("UP", "Order Service is running and responsive");
    }
}
