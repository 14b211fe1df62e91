package mta.shop.order.service.order;

import mta.shop.order.client.ProductServiceClient;
import mta.shop.order.config.ProductServiceClientConfig;
import mta.shop.order.exception.InsufficientStockException;
import mta.shop.order.exception.InvalidStatusException;
import mta.shop.order.exception.InvalidStatusTransitionException;
import mta.shop.order.exception.OrderNotFoundException;
import mta.shop.order.exception.ServiceUnavailableException;
import mta.shop.order.model.order.Order;
import mta.shop.order.model.order.OrderItem;
import mta.shop.order.model.product.ProductSnapshot;
import mta.shop.order.model.request.CreateOrderRequest;
import mta.shop.order.repository.OrderRepository;
import mta.shop.order.service.util.OrderUtils;
import mta.shop.order.service.util.StatusMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OrderService
 * Places orders against the product service and manages their lifecycle.
 *
 * Placement is a saga without a coordinator: stock is deducted line by line
 * and every completed deduction is restocked if a later step fails.
 * Restocks that fail are written to the failed-compensations log for manual recovery.
 */
@Service
public class OrderService {

    private static final Logger logger = LoggerFactory.getLogger(OrderService.class);
    private static final Logger failedCompensationsLogger = LoggerFactory.getLogger("FAILED_COMPENSATIONS_LOGGER");

    private final OrderRepository orderRepository;
    private final ProductServiceClient productServiceClient;
    private final Clock clock;

    @Autowired
    public OrderService(OrderRepository orderRepository, ProductServiceClient productServiceClient) {
        this(orderRepository, productServiceClient, Clock.systemUTC());
    }

    OrderService(OrderRepository orderRepository, ProductServiceClient productServiceClient, Clock clock) {
        this.orderRepository = orderRepository;
        this.productServiceClient = productServiceClient;
        this.clock = clock;
    }

    public Order createOrder(CreateOrderRequest request) {
        Map<Long, Integer> lines = OrderUtils.mergeLines(request.items());
        logger.info("Placing order for user={} with {} product line(s)", request.userId(), lines.size());

        // Validate everything before touching stock
        Map<Long, ProductSnapshot> products = new LinkedHashMap<>();
        for (Map.Entry<Long, Integer> line : lines.entrySet()) {
            ProductSnapshot product = productServiceClient.getProduct(line.getKey());
            if (product.stockQuantity() < line.getValue()) {
                throw new InsufficientStockException(line.getKey(), product.stockQuantity(), line.getValue());
            }
            products.put(line.getKey(), product);
        }

        List<OrderItem> items = new ArrayList<>();
        for (Map.Entry<Long, Integer> line : lines.entrySet()) {
            BigDecimal price = OrderUtils.roundToTwoDecimals(products.get(line.getKey()).price());
            items.add(new OrderItem(null, null, line.getKey(), line.getValue(),
                    price, OrderUtils.calculateItemTotal(price, line.getValue())));
        }
        BigDecimal totalAmount = OrderUtils.calculateTotalAmount(items);
        OrderUtils.requireStorableTotal(totalAmount);

        Map<Long, Integer> deducted = new LinkedHashMap<>();
        for (Map.Entry<Long, Integer> line : lines.entrySet()) {
            try {
                productServiceClient.deductStock(line.getKey(), line.getValue());
                deducted.put(line.getKey(), line.getValue());
            } catch (ServiceUnavailableException e) {
                if (mayHaveBeenApplied(e)) {
                    failedCompensationsLogger.error(
                            "UNCERTAIN_DEDUCTION | User: {} | ProductId: {} | Quantity: {} | Reason: {}",
                            request.userId(), line.getKey(), line.getValue(), e.getMessage());
                }
                compensate(deducted, request.userId(), "deduction failed for product " + line.getKey());
                throw e;
            } catch (RuntimeException e) {
                compensate(deducted, request.userId(), "deduction failed for product " + line.getKey());
                throw e;
            }
        }

        Instant now = clock.instant();
        Order order = new Order(
                null,
                request.userId(),
                now,
                StatusMachine.STATUS_PENDING,
                totalAmount,
                normalizeAddress(request.shippingAddress()),
                now,
                now,
                items
        );

        Order saved;
        try {
            saved = orderRepository.insert(order);
        } catch (RuntimeException e) {
            logger.error("Failed to persist order for user={}: {}", request.userId(), e.getMessage());
            compensate(deducted, request.userId(), "order could not be saved");
            throw e;
        }

        logger.info("Order placed: orderId={}, user={}, total={}, items={}",
                saved.orderId(), saved.userId(), saved.totalAmount(), saved.items().size());
        return saved;
    }

    public List<Order> listOrders(int skip, int limit, Long userId, String status) {
        String statusFilter = null;
        if (status != null && !status.isBlank()) {
            statusFilter = StatusMachine.normalize(status);
            if (statusFilter == null) {
                throw new InvalidStatusException(status);
            }
        }
        List<Order> orders = orderRepository.findAll(skip, limit, userId, statusFilter);
        logger.debug("Listed {} orders (skip={}, limit={}, user={}, status={})",
                orders.size(), skip, limit, userId, statusFilter);
        return orders;
    }

    public Order getOrder(long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    public List<OrderItem> getOrderItems(long orderId) {
        return getOrder(orderId).items();
    }

    /**
     * Moves the order along the status machine. Cancelling returns the
     * stock of every item to the product service.
     */
    public Order updateStatus(long orderId, String requestedStatus) {
        String newStatus = StatusMachine.normalize(requestedStatus);
        if (newStatus == null) {
            throw new InvalidStatusException(requestedStatus);
        }

        Order order = getOrder(orderId);
        if (!StatusMachine.isValidTransition(order.status(), newStatus)) {
            throw new InvalidStatusTransitionException(orderId, order.status(), newStatus);
        }

        Instant now = clock.instant();
        if (!orderRepository.updateStatus(orderId, order.status(), newStatus, now)) {
            // Lost a race with another update or a delete
            Order current = getOrder(orderId);
            throw new InvalidStatusTransitionException(orderId, current.status(), newStatus);
        }
        logger.info("Order {} status changed: {} -> {}", orderId, order.status(), newStatus);

        if (StatusMachine.STATUS_CANCELLED.equals(newStatus)) {
            Map<Long, Integer> toRestock = new LinkedHashMap<>();
            order.items().forEach(item -> toRestock.merge(item.productId(), item.quantity(), Integer::sum));
            compensate(toRestock, order.userId(), "order " + orderId + " cancelled");
        }

        return order.withStatus(newStatus, now);
    }

    /**
     * Removes the order and its items. Stock is left untouched.
     */
    public void deleteOrder(long orderId) {
        if (!orderRepository.deleteById(orderId)) {
            throw new OrderNotFoundException(orderId);
        }
        logger.info("Deleted order {}", orderId);
    }

    /**
     * Restocks each product. A failed restock is recorded and the rest still run.
     */
    private void compensate(Map<Long, Integer> quantities, long userId, String reason) {
        if (quantities.isEmpty()) {
            return;
        }
        logger.warn("Returning stock for {} product(s): {}", quantities.size(), reason);
        for (Map.Entry<Long, Integer> entry : quantities.entrySet()) {
            try {
                productServiceClient.restock(entry.getKey(), entry.getValue());
                logger.info("Restocked productId={} quantity={}", entry.getKey(), entry.getValue());
            } catch (RuntimeException e) {
                logger.error("Restock failed for productId={} quantity={}: {}",
                        entry.getKey(), entry.getValue(), e.getMessage());
                failedCompensationsLogger.error(
                        "FAILED_RESTOCK | User: {} | ProductId: {} | Quantity: {} | Reason: {} | Error: {}",
                        userId, entry.getKey(), entry.getValue(), reason, e.getMessage());
            }
        }
    }

    /**
     * False when the product service never saw the request (refused connection)
     * or answered with a rejection, true for timeouts and server errors.
     */
    static boolean mayHaveBeenApplied(ServiceUnavailableException e) {
        if (ProductServiceClient.TYPE_REJECTED.equals(e.getType())) {
            return false;
        }
        return !ProductServiceClientConfig.isConnectionRefused(e);
    }

    private static String normalizeAddress(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        return address.trim();
    }
}
