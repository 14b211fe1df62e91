package mta.shop.product.service.product;

import mta.shop.product.exception.InsufficientStockException;
import mta.shop.product.model.product.Product;
import mta.shop.product.model.request.UpdateProductRequest;
import mta.shop.product.repository.ProductRepository;
import mta.shop.product.service.storage.BlobStorageService;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Stock movements against a real H2 database from several threads at once.
 */
class ProductStockConcurrencyTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final int THREADS = 8;

    private NamedParameterJdbcTemplate jdbcTemplate;
    private ProductRepository repository;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:product_stock;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        ds.setUser("sa");
        ds.setPassword("");
        jdbcTemplate = new NamedParameterJdbcTemplate(ds);

        jdbcTemplate.getJdbcTemplate().execute("DROP ALL OBJECTS");
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(ds);

        repository = new ProductRepository(jdbcTemplate);
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private long insert(int stock) {
        return repository.insert(new Product(null, "Headphones", null, new BigDecimal("60.00"), stock, null, T0, T0))
                .productId();
    }

    private ProductService service(ProductRepository repo) {
        return new ProductService(repo, new BlobStorageService("", "", "", 24, ""));
    }

    private void runTogether(List<Runnable> tasks) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (Runnable task : tasks) {
            futures.add(executor.submit(() -> {
                start.await();
                task.run();
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
    }

    @Test
    void concurrentDeductions_ShouldNeverOversell() throws Exception {
        long id = insert(10);
        ProductService productService = service(repository);
        AtomicInteger successes = new AtomicInteger();
        List<Throwable> unexpected = Collections.synchronizedList(new ArrayList<>());

        List<Runnable> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            tasks.add(() -> {
                try {
                    productService.deductStock(id, 3);
                    successes.incrementAndGet();
                } catch (InsufficientStockException e) {
                    // out of stock for this caller
                } catch (RuntimeException e) {
                    unexpected.add(e);
                }
            });
        }
        runTogether(tasks);

        int finalStock = repository.findById(id).orElseThrow().stockQuantity();
        assertTrue(unexpected.isEmpty(), () -> "Unexpected failures: " + unexpected);
        assertTrue(successes.get() * 3 <= 10);
        assertTrue(finalStock >= 0);
        assertEquals(10 - successes.get() * 3, finalStock);
        assertEquals(3, successes.get());
    }

    @Test
    void deductionsRacingRenames_ShouldNotLoseStock() throws Exception {
        long id = insert(20);
        ProductService productService = service(repository);
        AtomicInteger deducted = new AtomicInteger();
        List<Throwable> unexpected = Collections.synchronizedList(new ArrayList<>());

        List<Runnable> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            int n = i;
            tasks.add(() -> {
                try {
                    for (int round = 0; round < 5; round++) {
                        if (n % 2 == 0) {
                            productService.deductStock(id, 1);
                            deducted.incrementAndGet();
                        } else {
                            productService.updateProduct(id,
                                    new UpdateProductRequest("Headphones v" + n + "." + round, null, null, null, null));
                        }
                    }
                } catch (RuntimeException e) {
                    unexpected.add(e);
                }
            });
        }
        runTogether(tasks);

        assertTrue(unexpected.isEmpty(), () -> "Unexpected failures: " + unexpected);
        assertEquals(20, deducted.get());
        assertEquals(0, repository.findById(id).orElseThrow().stockQuantity());
    }

    @Test
    void deductionBetweenReadAndWriteOfRename_ShouldBeKept() {
        long id = insert(5);
        ProductRepository interleaving = new ProductRepository(jdbcTemplate) {
            @Override
            public boolean update(long productId, String name, String description, BigDecimal price,
                                  Integer stockQuantity, String imageUrl, Instant updatedAt) {
                // another order takes 3 units just before the rename is written
                assertTrue(deductStock(productId, 3, updatedAt));
                return super.update(productId, name, description, price, stockQuantity, imageUrl, updatedAt);
            }
        };

        Product renamed = service(interleaving).updateProduct(id,
                new UpdateProductRequest("Renamed", null, null, null, null));

        assertEquals("Renamed", renamed.name());
        assertEquals(2, renamed.stockQuantity());
        assertEquals(2, repository.findById(id).orElseThrow().stockQuantity());
    }
}
