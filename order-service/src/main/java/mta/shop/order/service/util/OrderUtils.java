package mta.shop.order.service.util;

import mta.shop.order.exception.InvalidOrderException;
import mta.shop.order.model.order.OrderItem;
import mta.shop.order.model.request.OrderItemRequest;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class OrderUtils {

    /** Largest value of the NUMERIC(12,2) amount columns. */
    public static final BigDecimal MAX_AMOUNT = new BigDecimal("9999999999.99");

    private OrderUtils() {}

    /**
     * Price times quantity, rounded half-up to cents.
     */
    public static BigDecimal calculateItemTotal(BigDecimal price, int quantity) {
        return roundToTwoDecimals(price.multiply(BigDecimal.valueOf(quantity)));
    }

    /**
     * Sum of the item totals, rounded half-up to cents.
     */
    public static BigDecimal calculateTotalAmount(List<OrderItem> items) {
        BigDecimal total = items.stream()
                .map(OrderItem::itemTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return roundToTwoDecimals(total);
    }

    public static BigDecimal roundToTwoDecimals(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Folds lines naming the same product into one, summing quantities.
     * Keeps the order in which products first appear.
     *
     * @return product id to total quantity
     * @throws InvalidOrderException if a product's total quantity does not fit an int
     */
    public static Map<Long, Integer> mergeLines(List<OrderItemRequest> lines) {
        Map<Long, Integer> merged = new LinkedHashMap<>();
        for (OrderItemRequest line : lines) {
            Integer previous = merged.get(line.productId());
            try {
                merged.put(line.productId(),
                        previous == null ? line.quantity() : Math.addExact(previous, line.quantity()));
            } catch (ArithmeticException e) {
                throw new InvalidOrderException("items", "Total quantity for product " + line.productId()
                        + " exceeds " + Integer.MAX_VALUE);
            }
        }
        return merged;
    }

    /**
     * @throws InvalidOrderException if the amount is larger than the amount columns hold
     */
    public static void requireStorableTotal(BigDecimal totalAmount) {
        if (totalAmount.compareTo(MAX_AMOUNT) > 0) {
            throw new InvalidOrderException("items", "Order total " + totalAmount.toPlainString()
                    + " exceeds the maximum of " + MAX_AMOUNT.toPlainString());
        }
    }
}
