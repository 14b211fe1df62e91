package mta.shop.order.repository;

import mta.shop.order.model.order.Order;
import mta.shop.order.model.order.OrderItem;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrderRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private NamedParameterJdbcTemplate jdbcTemplate;
    private OrderRepository repository;

    @BeforeEach
    void setUp() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:order_repo;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        ds.setPassword("");
        jdbcTemplate = new NamedParameterJdbcTemplate(ds);

        jdbcTemplate.getJdbcTemplate().execute("DROP ALL OBJECTS");
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(ds);

        repository = new OrderRepository(jdbcTemplate);
    }

    private Order insert(long userId, String status, Instant createdAt, long... productIds) {
        List<OrderItem> items = Arrays.stream(productIds)
                .mapToObj(pid -> new OrderItem(null, null, pid, 2, new BigDecimal("1.50"), new BigDecimal("3.00")))
                .toList();
        BigDecimal total = new BigDecimal("3.00").multiply(BigDecimal.valueOf(items.size()));
        return repository.insert(new Order(null, userId, createdAt, status, total, "Somewhere 1",
                createdAt, createdAt, items));
    }

    @Test
    void insert_ShouldAssignIdsToOrderAndItems() {
        Order saved = insert(3L, "pending", T0, 10L, 20L);

        assertNotNull(saved.orderId());
        assertEquals(2, saved.items().size());
        saved.items().forEach(item -> {
            assertNotNull(item.orderItemId());
            assertEquals(saved.orderId(), item.orderId());
        });

        Order loaded = repository.findById(saved.orderId()).orElseThrow();
        assertEquals(3L, loaded.userId());
        assertEquals("pending", loaded.status());
        assertEquals(0, new BigDecimal("6.00").compareTo(loaded.totalAmount()));
        assertEquals("Somewhere 1", loaded.shippingAddress());
        assertEquals(T0, loaded.orderDate());
        assertEquals(List.of(10L, 20L), loaded.items().stream().map(OrderItem::productId).toList());
        assertEquals(0, new BigDecimal("1.50").compareTo(loaded.items().get(0).priceAtPurchase()));
    }

    @Test
    void findById_Missing_ShouldBeEmpty() {
        assertTrue(repository.findById(12345L).isEmpty());
        assertTrue(repository.findItems(12345L).isEmpty());
    }

    @Test
    void findAll_ShouldReturnNewestFirstWithItems() {
        Order older = insert(1L, "pending", T0, 10L);
        Order newer = insert(1L, "pending", T0.plusSeconds(60), 20L, 30L);

        List<Order> orders = repository.findAll(0, 10, null, null);

        assertEquals(List.of(newer.orderId(), older.orderId()), orders.stream().map(Order::orderId).toList());
        assertEquals(2, orders.get(0).items().size());
        assertEquals(1, orders.get(1).items().size());
        assertEquals(10L, orders.get(1).items().get(0).productId());
    }

    @Test
    void findAll_ShouldFilterByUserAndStatusAndPage() {
        insert(1L, "pending", T0, 10L);
        insert(1L, "shipped", T0.plusSeconds(1), 10L);
        insert(2L, "pending", T0.plusSeconds(2), 10L);

        assertEquals(2, repository.findAll(0, 10, 1L, null).size());
        assertEquals(2, repository.findAll(0, 10, null, "pending").size());
        assertEquals(1, repository.findAll(0, 10, 1L, "shipped").size());
        assertEquals(0, repository.findAll(0, 10, 3L, null).size());

        List<Order> page = repository.findAll(1, 1, null, null);
        assertEquals(1, page.size());
        assertEquals("shipped", page.get(0).status());
    }

    @Test
    void updateStatus_ShouldOnlyApplyFromExpectedStatus() {
        Order saved = insert(1L, "pending", T0, 10L);
        Instant later = T0.plusSeconds(300);

        assertTrue(repository.updateStatus(saved.orderId(), "pending", "confirmed", later));
        assertFalse(repository.updateStatus(saved.orderId(), "pending", "cancelled", later));

        Order loaded = repository.findById(saved.orderId()).orElseThrow();
        assertEquals("confirmed", loaded.status());
        assertEquals(later, loaded.updatedAt());
        assertEquals(T0, loaded.createdAt());
    }

    @Test
    void deleteById_ShouldRemoveOrderAndItems() {
        Order saved = insert(1L, "pending", T0, 10L, 20L);

        assertTrue(repository.deleteById(saved.orderId()));
        assertFalse(repository.deleteById(saved.orderId()));

        Integer remaining = jdbcTemplate.getJdbcTemplate()
                .queryForObject("SELECT COUNT(*) FROM order_items", Integer.class);
        assertEquals(0, remaining);
    }
}
