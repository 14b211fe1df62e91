package mta.shop.order.config;

import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ProductServiceClientConfigTest {

    @Test
    void isConnectionRefused_ShouldFindConnectExceptionInCauseChain() {
        ResourceAccessException refused = new ResourceAccessException("I/O error",
                new ConnectException("Connection refused"));
        assertTrue(ProductServiceClientConfig.isConnectionRefused(refused));
    }

    @Test
    void isConnectionRefused_OtherFailures_ShouldNotCount() {
        assertFalse(ProductServiceClientConfig.isConnectionRefused(
                new ResourceAccessException("I/O error", new SocketTimeoutException("Read timed out"))));
        assertFalse(ProductServiceClientConfig.isConnectionRefused(new IOException("reset")));
        assertFalse(ProductServiceClientConfig.isConnectionRefused(new IllegalStateException()));
    }
}
