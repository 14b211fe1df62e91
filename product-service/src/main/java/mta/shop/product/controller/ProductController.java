package mta.shop.product.controller;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import mta.shop.product.model.product.Product;
import mta.shop.product.model.request.CreateProductRequest;
import mta.shop.product.model.request.StockDeductRequest;
import mta.shop.product.model.request.StockRestockRequest;
import mta.shop.product.model.request.UpdateProductRequest;
import mta.shop.product.model.response.HealthCheck;
import mta.shop.product.model.response.HealthResponse;
import mta.shop.product.service.general.HealthService;
import mta.shop.product.service.product.ProductService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ProductController
 * REST API endpoints for the product catalogue.
 */
@RestController
public class ProductController {

    private static final Logger logger = LoggerFactory.getLogger(ProductController.class);

    private static final String SERVICE_NAME = "Product Service";

    private final ProductService productService;
    private final HealthService healthService;

    public ProductController(ProductService productService, HealthService healthService) {
        this.productService = productService;
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
        health.put("ready", endpoint("GET", "/health/ready", "Readiness probe - database reachable and products table present",
                Map.of("200", "Service ready", "503", "Database unavailable")));

        Map<String, Object> products = new LinkedHashMap<>();
        products.put("createProduct", endpoint("POST", "/products", "Create a product",
                Map.of("201", "Product created", "400", "Validation error")));
        products.put("listProducts", endpoint("GET", "/products?skip=0&limit=100&search=", "List products, optionally filtered by name/description",
                Map.of("200", "List of products", "400", "Invalid paging parameters")));
        products.put("getProduct", endpoint("GET", "/products/{product_id}", "Fetch a single product",
                Map.of("200", "Product", "404", "Product not found")));
        products.put("updateProduct", endpoint("PUT", "/products/{product_id}", "Update the provided fields of a product",
                Map.of("200", "Updated product", "400", "Validation error", "404", "Product not found")));
        products.put("deleteProduct", endpoint("DELETE", "/products/{product_id}", "Delete a product",
                Map.of("204", "Deleted", "404", "Product not found")));
        products.put("deductStock", endpoint("PATCH", "/products/{product_id}/deduct-stock", "Remove units from stock",
                Map.of("200", "Updated product", "400", "Insufficient stock", "404", "Product not found")));
        products.put("restock", endpoint("PATCH", "/products/{product_id}/restock", "Return units to stock",
                Map.of("200", "Updated product", "404", "Product not found")));
        products.put("uploadImage", endpoint("POST", "/products/{product_id}/upload-image", "Upload a product image (multipart field 'file')",
                Map.of("200", "Product with image_url", "400", "Not an image", "404", "Product not found",
                        "502", "Storage failure", "503", "Storage not configured")));

        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("health", health);
        endpoints.put("products", products);
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
     * Storage is reported but does not gate readiness.
     * GET /health/ready
     */
    @GetMapping("/health/ready")
    public ResponseEntity<HealthResponse> ready() {
        HealthCheck databaseStatus = healthService.getDatabaseStatus();
        boolean isDatabaseUp = "UP".equals(databaseStatus.status());

        Map<String, HealthCheck> checks = new LinkedHashMap<>();
        checks.put("service", healthService.getServiceStatus());
        checks.put("database", databaseStatus);
        checks.put("storage", healthService.getStorageStatus());

        HealthResponse response = new HealthResponse(
                SERVICE_NAME,
                "readiness",
                isDatabaseUp ? "UP" : "DOWN",
                Instant.now().toString(),
                checks
        );

        return ResponseEntity.status(isDatabaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    @PostMapping("/products")
    public ResponseEntity<Product> createProduct(@Valid @RequestBody CreateProductRequest request) {
        logger.info("Received create product request: name='{}', price={}, stock={}",
                request.name(), request.price(), request.stockQuantity());
        return ResponseEntity.status(HttpStatus.CREATED).body(productService.createProduct(request));
    }

    @GetMapping("/products")
    public ResponseEntity<List<Product>> listProducts(
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(100) int limit,
            @RequestParam(required = false) String search) {
        return ResponseEntity.ok(productService.listProducts(skip, limit, search));
    }

    @GetMapping("/products/{productId}")
    public ResponseEntity<Product> getProduct(@PathVariable long productId) {
        return ResponseEntity.ok(productService.getProduct(productId));
    }

    @PutMapping("/products/{productId}")
    public ResponseEntity<Product> updateProduct(@PathVariable long productId,
                                                 @Valid @RequestBody UpdateProductRequest request) {
        logger.info("Received update product request: productId={}", productId);
        return ResponseEntity.ok(productService.updateProduct(productId, request));
    }

    @DeleteMapping("/products/{productId}")
    public ResponseEntity<Void> deleteProduct(@PathVariable long productId) {
        logger.info("Received delete product request: productId={}", productId);
        productService.deleteProduct(productId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Deduct stock, called by the order service when an order is placed.
     * PATCH /products/{id}/deduct-stock
     * Body: { "quantity_to_deduct": number }
     */
    @PatchMapping("/products/{productId}/deduct-stock")
    public ResponseEntity<Product> deductStock(@PathVariable long productId,
                                               @Valid @RequestBody StockDeductRequest request) {
        logger.info("Received deduct stock request: productId={}, quantity={}", productId, request.quantityToDeduct());
        return ResponseEntity.ok(productService.deductStock(productId, request.quantityToDeduct()));
    }

    /**
     * Return stock, called by the order service on cancellation or failed placement.
     * PATCH /products/{id}/restock
     * Body: { "quantity": number }
     */
    @PatchMapping("/products/{productId}/restock")
    public ResponseEntity<Product> restock(@PathVariable long productId,
                                           @Valid @RequestBody StockRestockRequest request) {
        logger.info("Received restock request: productId={}, quantity={}", productId, request.quantity());
        return ResponseEntity.ok(productService.restock(productId, request.quantity()));
    }

    @PostMapping(value = "/products/{productId}/upload-image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Product> uploadImage(@PathVariable long productId,
                                               @RequestParam("file") MultipartFile file) {
        logger.info("Received image upload: productId={}, filename='{}', contentType={}, size={}",
                productId, file.getOriginalFilename(), file.getContentType(), file.getSize());
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read uploaded file", e);
        }
        return ResponseEntity.ok(productService.uploadImage(productId, file.getOriginalFilename(), file.getContentType(), content));
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
