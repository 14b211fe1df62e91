package mta.shop.product.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import mta.shop.product.model.request.CreateProductRequest;
import mta.shop.product.model.request.StockDeductRequest;
import mta.shop.product.model.request.StockRestockRequest;
import mta.shop.product.model.request.UpdateProductRequest;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Constraint checks for the request records.
 */
class ValidationTest {

    private static Validator validator;

    @BeforeAll
    static void setUp() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    private static <T> boolean violates(Set<ConstraintViolation<T>> violations, String property) {
        return violations.stream().anyMatch(v -> v.getPropertyPath().toString().equals(property));
    }

    // ==================== CreateProductRequest ====================

    @Test
    void testCreateProductRequest_Valid() {
        CreateProductRequest request = new CreateProductRequest("Pen", null, new BigDecimal("1.25"), 0, null);
        assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    void testCreateProductRequest_BlankName() {
        CreateProductRequest request = new CreateProductRequest("  ", null, new BigDecimal("1.25"), 1, null);
        assertTrue(violates(validator.validate(request), "name"));
    }

    @Test
    void testCreateProductRequest_ZeroPrice() {
        CreateProductRequest request = new CreateProductRequest("Pen", null, BigDecimal.ZERO, 1, null);
        assertTrue(violates(validator.validate(request), "price"));
    }

    @Test
    void testCreateProductRequest_TooManyDecimals() {
        CreateProductRequest request = new CreateProductRequest("Pen", null, new BigDecimal("1.255"), 1, null);
        assertTrue(violates(validator.validate(request), "price"));
    }

    @Test
    void testCreateProductRequest_NegativeOrMissingStock() {
        assertTrue(violates(validator.validate(
                new CreateProductRequest("Pen", null, BigDecimal.ONE, -1, null)), "stockQuantity"));
        assertTrue(violates(validator.validate(
                new CreateProductRequest("Pen", null, BigDecimal.ONE, null, null)), "stockQuantity"));
    }

    // ==================== UpdateProductRequest ====================

    @Test
    void testUpdateProductRequest_AllNullIsValid() {
        assertTrue(validator.validate(new UpdateProductRequest(null, null, null, null, null)).isEmpty());
    }

    @Test
    void testUpdateProductRequest_BlankNameRejected() {
        assertTrue(violates(validator.validate(
                new UpdateProductRequest("   ", null, null, null, null)), "name"));
    }

    // ==================== Stock requests ====================

    @Test
    void testStockRequests_QuantityMustBePositive() {
        assertTrue(violates(validator.validate(new StockDeductRequest(0)), "quantityToDeduct"));
        assertTrue(violates(validator.validate(new StockDeductRequest(null)), "quantityToDeduct"));
        assertTrue(validator.validate(new StockDeductRequest(2)).isEmpty());
        assertTrue(violates(validator.validate(new StockRestockRequest(-3)), "quantity"));
        assertTrue(validator.validate(new StockRestockRequest(1)).isEmpty());
    }
}
