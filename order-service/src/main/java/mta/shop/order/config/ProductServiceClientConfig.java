package mta.shop.order.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import mta.shop.order.client.ProductServiceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.net.ConnectException;

/**
 * Wires the HTTP client for the product service.
 * Reads are retried on I/O errors and 5xx responses. Writes (stock changes)
 * are retried only when the connection was refused, since any other failure
 * may have reached the product service already.
 */
@Configuration
public class ProductServiceClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(ProductServiceClientConfig.class);

    @Value("${product-service.url:http://localhost:8000}")
    private String productServiceUrl;

    @Value("${product-service.timeout.ms:3000}")
    private int timeoutMs;

    @Value("${product-service.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${product-service.retry.initial-interval-ms:200}")
    private long initialIntervalMs;

    @Bean
    public ProductServiceClient productServiceClient(RestClient.Builder restClientBuilder,
                                                     ObjectProvider<RetryRegistry> retryRegistry) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);

        RestClient restClient = restClientBuilder
                .baseUrl(productServiceUrl)
                .requestFactory(requestFactory)
                .build();

        RetryRegistry registry = retryRegistry.getIfAvailable(RetryRegistry::ofDefaults);

        Retry readRetry = registry.retry("product-service-read", RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialIntervalMs, 2.0))
                .retryOnException(e -> e instanceof ResourceAccessException || e instanceof HttpServerErrorException)
                .build());

        Retry writeRetry = registry.retry("product-service-write", RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialIntervalMs, 2.0))
                .retryOnException(ProductServiceClientConfig::isConnectionRefused)
                .build());

        for (Retry retry : new Retry[]{readRetry, writeRetry}) {
            retry.getEventPublisher().onRetry(event -> logger.warn(
                    "Product service call retry #{} ({}): {}",
                    event.getNumberOfRetryAttempts(),
                    event.getName(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "Unknown error"));
        }

        logger.info("Product service client targeting {} (timeout={}ms, maxAttempts={})",
                productServiceUrl, timeoutMs, maxAttempts);
        return new ProductServiceClient(restClient, readRetry, writeRetry);
    }

    /**
     * True when any cause in the chain is a refused TCP connection, meaning the request never left.
     */
    public static boolean isConnectionRefused(Throwable e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof ConnectException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
