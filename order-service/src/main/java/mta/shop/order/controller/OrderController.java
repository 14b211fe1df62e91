package mta.shop.order.controller;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import mta.shop.order.model.order.Order;
import mta.shop.order.model.order.OrderItem;
import mta.shop.order.model.request.CreateOrderRequest;
import mta.shop.order.model.request.UpdateOrderStatusRequest;
import mta.shop.order.model.response.HealthCheck;
import mta.shop.order.model.response.HealthResponse;
import mta.shop.order.service.general.HealthService;
import mta.shop.order.service.order.OrderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OrderController
 * REST API endpoints for placing and managing orders.
 */
@RestController
public class OrderController {

    private static final Logger logger = LoggerFactory.getLogger(OrderController.class);

    private static final String SERVICE_NAME = "Order Service";

    private final OrderService orderService;
    private final HealthService healthService;

    public OrderController(OrderService orderService, HealthService healthService) {
        this.orderService = orderService;
        this.healthService = healthService;
    }

    /**
     * Server metadata endpoint - exposes service info and available endpoints.
     * GET /
     */
    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        logger.debug("Root endpoint accessed");

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", SERVICE_NAME);
        response.put("version", "0.0.1-SNAPSHOT");
        response.put("timestamp", Instant.now().toString());

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("live", endpoint("GET", "/health/live", "Liveness probe - service process is running",
                Map.of("200", "Service is alive")));
        health.put("ready", endpoint("GET", "/health/ready", "Readiness probe - database reachable and orders table present",
                Map.of("200", "Service ready", "503", "Database unavailable")));

        Map<String, Object> orders = new LinkedHashMap<>();
        orders.put("createOrder", endpoint("POST", "/orders", "Place an order; stock is deducted from the product service",
                Map.of("201", "Order created", "400", "Validation error or insufficient stock",
                        "404", "Unknown product", "503", "Product service unavailable")));
        orders.put("listOrders", endpoint("GET", "/orders?skip=0&limit=100&user_id=&status=", "List orders, newest first",
                Map.of("200", "List of orders", "400", "Invalid paging or status filter")));
        orders.put("getOrder", endpoint("GET", "/orders/{order_id}", "Fetch an order with its items",
                Map.of("200", "Order", "404", "Order not found")));
        orders.put("getOrderItems", endpoint("GET", "/orders/{order_id}/items", "Fetch the items of an order",
                Map.of("200", "Order items", "404", "Order not found")));
        orders.put("updateOrderStatus", endpoint("PATCH", "/orders/{order_id}/status",
                "Move an order along pending -> confirmed -> shipped -> delivered, or cancel it",
                Map.of("200", "Updated order", "400", "Unknown status", "404", "Order not found",
                        "409", "Transition not allowed")));
        orders.put("deleteOrder", endpoint("DELETE", "/orders/{order_id}", "Delete an order and its items",
                Map.of("204", "Deleted", "404", "Order not found")));

        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("health", health);
        endpoints.put("orders", orders);
        response.put("endpoints", endpoints);

        return ResponseEntity.ok(response);
    }

    /**
     * Liveness - app is running (does not touch the database).
     * GET /health/live
     */
    @GetMapping("/health/live")
    public ResponseEntity<HealthResponse> live() {
        HealthResponse response = new HealthResponse(
                SERVICE_NAME,
                "liveness",
                "UP",
                Instant.now().toString(),
                Map.of("service", healthService.getServiceStatus())
        );
        return ResponseEntity.ok(response);
    }

    /**
     * Readiness - 200 when the database is usable, otherwise 503.
     * GET /health/ready
     */
    @GetMapping("/health/ready")
    public ResponseEntity<HealthResponse> ready() {
        HealthCheck databaseStatus = healthService.getDatabaseStatus();
        boolean isDatabaseUp = "UP".equals(databaseStatus.status());

        Map<String, HealthCheck> checks = new LinkedHashMap<>();
        checks.put("service", healthService.getServiceStatus());
        checks.put("database", databaseStatus);
        checks.put("product_service", healthService.getProductServiceStatus());

        HealthResponse response = new HealthResponse(
                SERVICE_NAME,
                "readiness",
                isDatabaseUp ? "UP" : "DOWN",
                Instant.now().toString(),
                checks
        );

        return ResponseEntity.status(isDatabaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    /**
     * Place an order.
     * POST /orders
     * Body: { "user_id": number, "shipping_address": string?, "items": [{ "product_id": number, "quantity": number }] }
     */
    @PostMapping("/orders")
    public ResponseEntity<Order> createOrder(@Valid @RequestBody CreateOrderRequest request) {
        logger.info("Received create order request: user={}, lines={}", request.userId(), request.items().size());
        return ResponseEntity.status(HttpStatus.CREATED).body(orderService.createOrder(request));
    }

    @GetMapping("/orders")
    public ResponseEntity<List<Order>> listOrders(
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(100) int limit,
            @RequestParam(name = "user_id", required = false) @Min(1) Long userId,
            @RequestParam(required = false) String status) {
        return ResponseEntity.ok(orderService.listOrders(skip, limit, userId, status));
    }

    @GetMapping("/orders/{orderId}")
    public ResponseEntity<Order> getOrder(@PathVariable long orderId) {
        return ResponseEntity.ok(orderService.getOrder(orderId));
    }

    @GetMapping("/orders/{orderId}/items")
    public ResponseEntity<List<OrderItem>> getOrderItems(@PathVariable long orderId) {
        return ResponseEntity.ok(orderService.getOrderItems(orderId));
    }

    /**
     * Update order status.
     * PATCH /orders/{id}/status
     * Body: { "status": "confirmed" }
     */
    @PatchMapping("/orders/{orderId}/status")
    public ResponseEntity<Order> updateOrderStatus(@PathVariable long orderId,
                                                   @Valid @RequestBody UpdateOrderStatusRequest request) {
        logger.info("Received status update: orderId={}, status='{}'", orderId, request.status());
        return ResponseEntity.ok(orderService.updateStatus(orderId, request.status()));
    }

    @DeleteMapping("/orders/{orderId}")
    public ResponseEntity<Void> deleteOrder(@PathVariable long orderId) {
        logger.info("Received delete order request: orderId={}", orderId);
        orderService.deleteOrder(orderId);
        return ResponseEntity.noContent().build();
    }

    private static Map<String, Object> endpoint(String method, String path, String description, Map<String, String> responses) {
        Map<String, Object> endpoint = new LinkedHashMap<>();
        endpoint.put("method", method);
        endpoint.put("path", path);
        endpoint.put("description", description);
        endpoint.put("responses", responses);
        return endpoint;
    }
}
