package mta.shop.order.exception;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GlobalExceptionHandler
 * Maps order errors to HTTP responses using a consistent envelope:
 * {timestamp, error, message, path, details?}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private Map<String, Object> errorBody(HttpServletRequest request, String error, String message, Map<String, Object> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("error", error);
        body.put("message", message);
        body.put("path", request != null ? request.getRequestURI() : "");
        if (details != null && !details.isEmpty()) {
            body.put("details", details);
        }
        return body;
    }

    /**
     * Handle request body validation errors (400).
     * Nested line errors keep their path, e.g. items[0].quantity.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(err ->
                fieldErrors.putIfAbsent(err.getField(), err.getDefaultMessage())
        );
        logger.warn("Validation failed: {}", fieldErrors);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field_errors", fieldErrors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "VALIDATION_ERROR", "Validation error", details));
    }

    @ExceptionHandler({HandlerMethodValidationException.class, ConstraintViolationException.class})
    public ResponseEntity<Map<String, Object>> handleParameterValidation(Exception ex, HttpServletRequest request) {
        logger.warn("Parameter validation failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "VALIDATION_ERROR", "Invalid request parameters", null));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedJson(HttpMessageNotReadableException ex, HttpServletRequest request) {
        String errorMsg = ex.getMessage() != null ? ex.getMessage() : "";
        logger.warn("Malformed JSON or invalid request body: {}", errorMsg);

        String message = "Invalid request body";
        if (errorMsg.contains("JSON parse error") || errorMsg.contains("Unexpected character")) {
            message = "Malformed JSON syntax";
        } else if (errorMsg.contains("Required request body is missing")) {
            message = "Request body is required";
        } else if (errorMsg.contains("Cannot deserialize")) {
            message = "Invalid data format in request body";
        }

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "MALFORMED_REQUEST", message, null));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        logger.warn("Invalid value '{}' for parameter '{}'", ex.getValue(), ex.getName());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("parameter", ex.getName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "INVALID_PARAMETER", "Invalid value for parameter '" + ex.getName() + "'", details));
    }

    @ExceptionHandler(InvalidOrderException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidOrder(InvalidOrderException ex, HttpServletRequest request) {
        logger.warn("Order rejected: {}", ex.getMessage());
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        fieldErrors.put(ex.getField(), ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field_errors", fieldErrors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "VALIDATION_ERROR", "Validation error", details));
    }

    @ExceptionHandler(OrderNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleOrderNotFound(OrderNotFoundException ex, HttpServletRequest request) {
        logger.info("Order not found: {}", ex.getOrderId());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("order_id", ex.getOrderId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(errorBody(request, "NOT_FOUND", ex.getMessage(), details));
    }

    /**
     * An order line names a product the product service does not know (404).
     */
    @ExceptionHandler(ProductNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleProductNotFound(ProductNotFoundException ex, HttpServletRequest request) {
        logger.info("Order references unknown product: {}", ex.getProductId());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("product_id", ex.getProductId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(errorBody(request, "NOT_FOUND", ex.getMessage(), details));
    }

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<Map<String, Object>> handleInsufficientStock(InsufficientStockException ex, HttpServletRequest request) {
        logger.warn("Order rejected for insufficient stock: productId={}, available={}, requested={}",
                ex.getProductId(), ex.getAvailable(), ex.getRequested());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("product_id", ex.getProductId());
        if (ex.getAvailable() >= 0) {
            details.put("available", ex.getAvailable());
        }
        details.put("requested", ex.getRequested());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "INSUFFICIENT_STOCK", ex.getMessage(), details));
    }

    @ExceptionHandler(InvalidStatusException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidStatus(InvalidStatusException ex, HttpServletRequest request) {
        logger.warn("Unknown order status: '{}'", ex.getStatus());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", ex.getStatus());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "INVALID_STATUS", ex.getMessage(), details));
    }

    /**
     * Handle status changes the status machine does not allow (409).
     */
    @ExceptionHandler(InvalidStatusTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidTransition(InvalidStatusTransitionException ex, HttpServletRequest request) {
        logger.warn("Rejected status transition: orderId={}, {} -> {}",
                ex.getOrderId(), ex.getCurrentStatus(), ex.getRequestedStatus());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("order_id", ex.getOrderId());
        details.put("current_status", ex.getCurrentStatus());
        details.put("requested_status", ex.getRequestedStatus());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(errorBody(request, "INVALID_STATUS_TRANSITION", ex.getMessage(), details));
    }

    /**
     * Handle an unreachable or failing product service (503).
     */
    @ExceptionHandler(ServiceUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleServiceUnavailable(ServiceUnavailableException ex, HttpServletRequest request) {
        logger.error("Dependency unavailable [{}]: {}", ex.getType(), ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", ex.getType());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(errorBody(request, "SERVICE_UNAVAILABLE", "Product service is unavailable. Please try again later.", details));
    }

    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<Map<String, Object>> handleRequestErrors(Exception ex, HttpServletRequest request) {
        HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
        logger.info("Request rejected with {}: {}", status.value(), ex.getMessage());
        String error = status.value() == 404 ? "NOT_FOUND" : "BAD_REQUEST";
        return ResponseEntity.status(status)
                .body(errorBody(request, error, ex.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(request, "INTERNAL_ERROR", "An unexpected error occurred. Please try again later.", null));
    }
}
