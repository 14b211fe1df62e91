package mta.shop.order.service.util;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StatusMachine to ensure strict sequential transitions
 */
class StatusMachineTest {

    @Test
    void testValidSequentialTransitions() {
        assertTrue(StatusMachine.isValidTransition("pending", "confirmed"));
        assertTrue(StatusMachine.isValidTransition("confirmed", "shipped"));
        assertTrue(StatusMachine.isValidTransition("shipped", "delivered"));
    }

    @Test
    void testInvalidSkippingTransitions() {
        assertFalse(StatusMachine.isValidTransition("pending", "shipped"),
                "Should NOT allow PENDING → SHIPPED (must go through CONFIRMED)");
        assertFalse(StatusMachine.isValidTransition("pending", "delivered"));
        assertFalse(StatusMachine.isValidTransition("confirmed", "delivered"),
                "Should NOT allow CONFIRMED → DELIVERED (must go through SHIPPED)");
    }

    @Test
    void testCancelledReachableFromNonTerminalStates() {
        assertTrue(StatusMachine.isValidTransition("pending", "cancelled"));
        assertTrue(StatusMachine.isValidTransition("confirmed", "cancelled"));
        assertTrue(StatusMachine.isValidTransition("shipped", "canceled"));
    }

    @Test
    void testTerminalStatesCannotMove() {
        assertFalse(StatusMachine.isValidTransition("delivered", "cancelled"));
        assertFalse(StatusMachine.isValidTransition("cancelled", "pending"));
        assertFalse(StatusMachine.isValidTransition("canceled", "confirmed"));
        assertTrue(StatusMachine.isTerminal("delivered"));
        assertTrue(StatusMachine.isTerminal("Canceled"));
        assertFalse(StatusMachine.isTerminal("shipped"));
    }

    @Test
    void testBackwardAndRepeatedTransitionsNotAllowed() {
        assertFalse(StatusMachine.isValidTransition("shipped", "confirmed"));
        assertFalse(StatusMachine.isValidTransition("confirmed", "pending"));
        assertFalse(StatusMachine.isValidTransition("pending", "pending"));
    }

    @Test
    void testInvalidStatusesRejected() {
        assertFalse(StatusMachine.isValidTransition("pending", "processing"));
        assertFalse(StatusMachine.isValidTransition("new", "confirmed"));
        assertFalse(StatusMachine.isValidTransition(null, "pending"));
    }

    @Test
    void testCaseInsensitivityAndNormalization() {
        assertTrue(StatusMachine.isValidTransition("PENDING", "Confirmed"));
        assertEquals("cancelled", StatusMachine.normalize(" Canceled "));
        assertEquals("shipped", StatusMachine.normalize("SHIPPED"));
        assertNull(StatusMachine.normalize("dispatched"));
        assertNull(StatusMachine.normalize(null));
    }

    @Test
    void testStatusOrdering() {
        assertEquals(0, StatusMachine.getStatusOrder("pending"));
        assertEquals(1, StatusMachine.getStatusOrder("confirmed"));
        assertEquals(2, StatusMachine.getStatusOrder("shipped"));
        assertEquals(3, StatusMachine.getStatusOrder("delivered"));
        assertEquals(4, StatusMachine.getStatusOrder("cancelled"));
        assertEquals(4, StatusMachine.getStatusOrder("canceled")); // American spelling
        assertEquals(-1, StatusMachine.getStatusOrder("invalid"));
        assertEquals(-1, StatusMachine.getStatusOrder(null));
    }
}
