package mta.shop.product.exception;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GlobalExceptionHandler
 * Maps catalogue errors to HTTP responses using a consistent envelope:
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
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(err ->
                fieldErrors.put(err.getField(), err.getDefaultMessage())
        );
        logger.warn("Validation failed: {}", fieldErrors);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field_errors", fieldErrors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "VALIDATION_ERROR", "Validation error", details));
    }

    /**
     * Handle constraint violations on query parameters such as skip/limit (400).
     */
    @ExceptionHandler({HandlerMethodValidationException.class, ConstraintViolationException.class})
    public ResponseEntity<Map<String, Object>> handleParameterValidation(Exception ex, HttpServletRequest request) {
        logger.warn("Parameter validation failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "VALIDATION_ERROR", "Invalid request parameters", null));
    }

    /**
     * Handle malformed JSON or a missing request body (400).
     */
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

    /**
     * Handle non-numeric ids and mistyped query parameters (400).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        logger.warn("Invalid value '{}' for parameter '{}'", ex.getValue(), ex.getName());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("parameter", ex.getName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "INVALID_PARAMETER", "Invalid value for parameter '" + ex.getName() + "'", details));
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<Map<String, Object>> handleMissingPart(MissingServletRequestPartException ex, HttpServletRequest request) {
        logger.warn("Missing multipart part: {}", ex.getRequestPartName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "INVALID_IMAGE", "Multipart part '" + ex.getRequestPartName() + "' is required", null));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleUploadTooLarge(MaxUploadSizeExceededException ex, HttpServletRequest request) {
        logger.warn("Upload rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(errorBody(request, "INVALID_IMAGE", "Uploaded file is too large", null));
    }

    /**
     * Handle unknown product ids (404).
     */
    @ExceptionHandler(ProductNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleProductNotFound(ProductNotFoundException ex, HttpServletRequest request) {
        logger.info("Product not found: {}", ex.getProductId());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("product_id", ex.getProductId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(errorBody(request, "NOT_FOUND", ex.getMessage(), details));
    }

    /**
     * Handle stock deductions larger than the available stock (400).
     */
    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<Map<String, Object>> handleInsufficientStock(InsufficientStockException ex, HttpServletRequest request) {
        logger.warn("Insufficient stock: productId={}, available={}, requested={}",
                ex.getProductId(), ex.getAvailable(), ex.getRequested());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("product_id", ex.getProductId());
        details.put("available", ex.getAvailable());
        details.put("requested", ex.getRequested());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "INSUFFICIENT_STOCK", ex.getMessage(), details));
    }

    @ExceptionHandler(StockLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleStockLimit(StockLimitExceededException ex, HttpServletRequest request) {
        logger.warn("Restock rejected: productId={}, current={}, requested={}",
                ex.getProductId(), ex.getCurrent(), ex.getRequested());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("product_id", ex.getProductId());
        details.put("current", ex.getCurrent());
        details.put("requested", ex.getRequested());
        details.put("max_stock", Integer.MAX_VALUE);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "STOCK_LIMIT_EXCEEDED", ex.getMessage(), details));
    }

    @ExceptionHandler(InvalidImageException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidImage(InvalidImageException ex, HttpServletRequest request) {
        logger.warn("Rejected image upload: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "INVALID_IMAGE", ex.getMessage(), null));
    }

    /**
     * Handle uploads while blob storage is not configured (503).
     */
    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleStorageUnavailable(StorageUnavailableException ex, HttpServletRequest request) {
        logger.warn("Image storage unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(errorBody(request, "STORAGE_NOT_CONFIGURED", ex.getMessage(), null));
    }

    /**
     * Handle blob store failures (502).
     */
    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorageFailure(StorageException ex, HttpServletRequest request) {
        logger.error("Image storage failed for blob={}: {}", ex.getBlobName(), ex.getMessage(), ex);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("blob_name", ex.getBlobName());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(errorBody(request, "STORAGE_ERROR", "Failed to store image", details));
    }

    /**
     * Handle framework-level request errors (unknown endpoint, wrong method, missing parameter)
     * with the status Spring assigns to them.
     */
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

    /**
     * Handle all other unhandled exceptions (500).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(request, "INTERNAL_ERROR", "An unexpected error occurred. Please try again later.", null));
    }
}
