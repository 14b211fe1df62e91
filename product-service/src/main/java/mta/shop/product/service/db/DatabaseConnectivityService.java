package mta.shop.product.service.db;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * DatabaseConnectivityService - Tracks PostgreSQL availability for the readiness probe.
 * Features:
 * - Background monitoring started with the application
 * - Exponential backoff retry with Resilience4j while the database is down
 * - Cached status so health endpoints answer without waiting on a dead connection
 * - On-demand single-attempt ping for readiness checks
 */
@Service
public class DatabaseConnectivityService {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseConnectivityService.class);

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    @Getter
    private final String tableName;
    private final int timeoutSeconds;
    private final Retry databaseRetry;
    private final ScheduledExecutorService scheduler;

    private final AtomicBoolean databaseConnected = new AtomicBoolean(false);
    private final AtomicBoolean tableReady = new AtomicBoolean(false);
    private final AtomicBoolean monitoringActive = new AtomicBoolean(false);
    private final AtomicReference<String> lastError = new AtomicReference<>("Initializing...");

    public DatabaseConnectivityService(
            DataSource dataSource,
            @Value("${db.health.table:products}") String tableName,
            @Value("${db.health.timeout.seconds:2}") int timeoutSeconds,
            @Autowired(required = false) RetryRegistry retryRegistry) {
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout(timeoutSeconds);
        this.tableName = tableName;
        this.timeoutSeconds = timeoutSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "db-connectivity-monitor");
            t.setDaemon(true);
            return t;
        });

        RetryRegistry registry = (retryRegistry != null) ? retryRegistry : RetryRegistry.ofDefaults();

        // 100ms, 200ms, 400ms ... capped at 5s, never gives up
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Integer.MAX_VALUE)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(100, 2.0, 5000))
                .retryOnException(e -> true)
                .failAfterMaxAttempts(false)
                .build();

        this.databaseRetry = registry.retry("database-connectivity", retryConfig);

        databaseRetry.getEventPublisher()
                .onRetry(event -> logger.debug(
                        "Database retry #{}: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "Unknown error"
                ));
    }

    @PostConstruct
    public void startMonitoring() {
        logger.info("Initializing database connectivity monitoring for table '{}'", tableName);
        monitoringActive.set(true);
        scheduleNextCheck(0);
    }

    @PreDestroy
    public void stopMonitoring() {
        logger.info("Stopping database connectivity monitoring");
        monitoringActive.set(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void scheduleNextCheck(long delayMs) {
        if (monitoringActive.get()) {
            scheduler.schedule(this::checkDatabaseConnectivity, delayMs, TimeUnit.MILLISECONDS);
        }
    }

    private void checkDatabaseConnectivity() {
        try {
            databaseRetry.executeRunnable(this::connectAndCheckTable);
        } catch (Exception e) {
            logger.debug("Database retry cycle ended: {}", e.getMessage());
        }
        // Probe quickly until ready, then back off
        scheduleNextCheck(isHealthy() ? 30000 : 1000);
    }

    /**
     * Called through Resilience4j; throws while the database is unusable so the retry backs off.
     */
    private void connectAndCheckTable() {
        if (!pingDatabase()) {
            throw new IllegalStateException(lastError.get());
        }
    }

    /**
     * One connection attempt plus a table probe, no retries.
     * Updates the cached state and logs transitions.
     *
     * @return true if the database is reachable and the table exists
     */
    public boolean pingDatabase() {
        boolean isConnected = testConnection();
        boolean wasConnected = databaseConnected.getAndSet(isConnected);
        if (isConnected && !wasConnected) {
            logger.info("✓ Database connection established");
        } else if (!isConnected && wasConnected) {
            logger.warn("✗ Database connection lost: {}", lastError.get());
        }

        if (!isConnected) {
            tableReady.set(false);
            return false;
        }

        boolean tableExists = verifyTableExists();
        boolean wasReady = tableReady.getAndSet(tableExists);
        if (tableExists && !wasReady) {
            logger.info("✓ Table '{}' ready for use", tableName);
        } else if (!tableExists && wasReady) {
            logger.warn("✗ Table '{}' became unavailable: {}", tableName, lastError.get());
        }
        if (tableExists) {
            lastError.set(null);
        }
        return tableExists;
    }

    private boolean testConnection() {
        try (Connection connection = dataSource.getConnection()) {
            if (connection.isValid(timeoutSeconds)) {
                return true;
            }
            lastError.set("Connection validation timed out after " + timeoutSeconds + "s");
            return false;
        } catch (Exception e) {
            lastError.set("Cannot connect to database: " + e.getMessage());
            logger.debug("Database connectivity test failed: {}", e.getMessage());
            return false;
        }
    }

    private boolean verifyTableExists() {
        try {
            jdbcTemplate.queryForList("SELECT 1 FROM " + tableName + " WHERE 1 = 0");
            return true;
        } catch (Exception e) {
            lastError.set("Table '" + tableName + "' is not available: " + e.getMessage());
            logger.debug("Table verification failed for '{}': {}", tableName, e.getMessage());
            return false;
        }
    }

    public boolean isDatabaseConnected() {
        return databaseConnected.get();
    }

    public boolean isHealthy() {
        return databaseConnected.get() && tableReady.get();
    }

    public String getLastError() {
        return lastError.get();
    }

    public String getDetailedStatus() {
        if (!databaseConnected.get()) {
            String error = lastError.get();
            return error != null ? error : "Cannot connect to database";
        }
        if (!tableReady.get()) {
            return "Connected to database but table '" + tableName + "' not ready";
        }
        return "Database reachable and table '" + tableName + "' exists";
    }
}
