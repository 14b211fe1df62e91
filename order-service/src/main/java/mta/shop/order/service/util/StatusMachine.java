package mta.shop.order.service.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * StatusMachine: allowed status progression for orders.
 *
 * PENDING (0) → CONFIRMED (1) → SHIPPED (2) → DELIVERED (3)
 *      ↓             ↓              ↓
 *                CANCELLED (4)
 *
 * Rules:
 * 1. PENDING is the status of every newly placed order
 * 2. Forward moves are strictly one step at a time
 * 3. CANCELLED is reachable from PENDING, CONFIRMED and SHIPPED
 * 4. DELIVERED and CANCELLED are terminal
 * 5. Re-applying the current status is not a transition
 */
public final class StatusMachine {

    private static final Logger logger = LoggerFactory.getLogger(StatusMachine.class);

    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_CONFIRMED = "confirmed";
    public static final String STATUS_SHIPPED = "shipped";
    public static final String STATUS_DELIVERED = "delivered";
    public static final String STATUS_CANCELLED = "cancelled";
    public static final String STATUS_CANCELED = "canceled";

    private StatusMachine() {}

    /**
     * Canonical lower-case name of a status, with "canceled" folded into "cancelled".
     *
     * @return the canonical name, or null if the status is unknown
     */
    public static String normalize(String status) {
        if (status == null) {
            return null;
        }
        String lower = status.trim().toLowerCase(Locale.ROOT);
        return switch (lower) {
            case STATUS_PENDING, STATUS_CONFIRMED, STATUS_SHIPPED, STATUS_DELIVERED, STATUS_CANCELLED -> lower;
            case STATUS_CANCELED -> STATUS_CANCELLED;
            default -> null;
        };
    }

    /**
     * Position of a status in the progression, or -1 for null/unknown.
     */
    public static int getStatusOrder(String status) {
        String normalized = normalize(status);
        if (normalized == null) {
            return -1;
        }
        return switch (normalized) {
            case STATUS_PENDING -> 0;
            case STATUS_CONFIRMED -> 1;
            case STATUS_SHIPPED -> 2;
            case STATUS_DELIVERED -> 3;
            default -> 4;
        };
    }

    public static boolean isTerminal(String status) {
        String normalized = normalize(status);
        return STATUS_DELIVERED.equals(normalized) || STATUS_CANCELLED.equals(normalized);
    }

    public static boolean isValidTransition(String currentStatus, String newStatus) {
        int currentOrder = getStatusOrder(currentStatus);
        int newOrder = getStatusOrder(newStatus);

        if (currentOrder == -1 || newOrder == -1) {
            logger.warn("Cannot validate transition with unknown status. Current: '{}' → New: '{}'",
                    currentStatus, newStatus);
            return false;
        }

        if (isTerminal(currentStatus)) {
            logger.warn("Invalid transition: '{}' is terminal, cannot move to '{}'", currentStatus, newStatus);
            return false;
        }

        if (STATUS_CANCELLED.equals(normalize(newStatus))) {
            return true;
        }

        boolean isValid = newOrder == currentOrder + 1;
        if (!isValid) {
            logger.warn("Invalid transition: {} ({}) → {} ({}). Status must move one step at a time or to cancelled",
                    currentStatus, currentOrder, newStatus, newOrder);
        }
        return isValid;
    }
}
