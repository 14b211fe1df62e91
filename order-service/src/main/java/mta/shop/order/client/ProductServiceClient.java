package mta.shop.order.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import mta.shop.order.exception.InsufficientStockException;
import mta.shop.order.exception.ProductNotFoundException;
import mta.shop.order.exception.ServiceUnavailableException;
import mta.shop.order.model.product.ProductSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.function.Supplier;

/**
 * ProductServiceClient
 * Calls the product service for product lookups and stock movements.
 * 404 becomes ProductNotFoundException, a 400 on deduction becomes
 * InsufficientStockException. Exhausted retries and any other 4xx become
 * ServiceUnavailableException.
 */
public class ProductServiceClient {

    private static final Logger logger = LoggerFactory.getLogger(ProductServiceClient.class);

    public static final String TYPE_UNREACHABLE = "PRODUCT_SERVICE_UNREACHABLE";
    public static final String TYPE_ERROR = "PRODUCT_SERVICE_ERROR";
    public static final String TYPE_REJECTED = "PRODUCT_SERVICE_REJECTED";

    private static final ObjectMapper ERROR_READER = new ObjectMapper();

    private final RestClient restClient;
    private final Retry readRetry;
    private final Retry writeRetry;

    public ProductServiceClient(RestClient restClient, Retry readRetry, Retry writeRetry) {
        this.restClient = restClient;
        this.readRetry = readRetry;
        this.writeRetry = writeRetry;
    }

    public ProductSnapshot getProduct(long productId) {
        return call("getProduct", productId, readRetry, () -> restClient.get()
                .uri("/products/{id}", productId)
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(), (request, response) -> {
                    throw new ProductNotFoundException(productId);
                })
                .body(ProductSnapshot.class));
    }

    /**
     * @return the product as it is after the deduction
     */
    public ProductSnapshot deductStock(long productId, int quantity) {
        return call("deductStock", productId, writeRetry, () -> restClient.patch()
                .uri("/products/{id}/deduct-stock", productId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("quantity_to_deduct", quantity))
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(), (request, response) -> {
                    throw new ProductNotFoundException(productId);
                })
                .onStatus(status -> status.value() == HttpStatus.BAD_REQUEST.value(), (request, response) -> {
                    throw new InsufficientStockException(productId, readAvailable(response.getBody()), quantity);
                })
                .body(ProductSnapshot.class));
    }

    public ProductSnapshot restock(long productId, int quantity) {
        return call("restock", productId, writeRetry, () -> restClient.patch()
                .uri("/products/{id}/restock", productId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("quantity", quantity))
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(), (request, response) -> {
                    throw new ProductNotFoundException(productId);
                })
                .body(ProductSnapshot.class));
    }

    /**
     * Single liveness probe against the product service, no retries.
     */
    public boolean isReachable() {
        try {
            restClient.get().uri("/health/live").retrieve().toBodilessEntity();
            return true;
        } catch (RestClientException e) {
            logger.debug("Product service liveness probe failed: {}", e.getMessage());
            return false;
        }
    }

    private <T> T call(String operation, long productId, Retry retry, Supplier<T> request) {
        try {
            return Retry.decorateSupplier(retry, request).get();
        } catch (ResourceAccessException e) {
            throw new ServiceUnavailableException(TYPE_UNREACHABLE,
                    "Product service unreachable during " + operation + " for product " + productId + ": " + e.getMessage(), e);
        } catch (HttpServerErrorException e) {
            throw new ServiceUnavailableException(TYPE_ERROR,
                    "Product service failed " + operation + " for product " + productId + " with " + e.getStatusCode().value(), e);
        } catch (HttpClientErrorException e) {
            // 4xx without a domain mapping, e.g. from a proxy in front of the service
            throw new ServiceUnavailableException(TYPE_REJECTED,
                    "Product service rejected " + operation + " for product " + productId + " with " + e.getStatusCode().value(), e);
        }
    }

    private static int readAvailable(InputStream body) {
        try {
            JsonNode available = ERROR_READER.readTree(body).path("details").path("available");
            return available.isInt() ? available.asInt() : -1;
        } catch (IOException e) {
            logger.debug("Unreadable insufficient-stock response: {}", e.getMessage());
            return -1;
        }
    }
}
