package com.ryuqq.gatekeeper.core.model;

import com.ryuqq.gatekeeper.core.protection.CircuitBreakerOpenException;
import com.ryuqq.gatekeeper.core.protection.CircuitBreakerState;
import com.ryuqq.gatekeeper.core.protection.event.StateChangeEvent;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BreakerName Value Object 테스트.
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
class BreakerNameTest {

    @Test
    void of_ValidValue_CreatesBreakerName() {
        // Given
        String value = "payment-api";

        // When
        BreakerName name = BreakerName.of(value);

        // Then
        assertNotNull(name);
        assertEquals(value, name.getValue());
        assertEquals(value, name.toString());
    }

    @Test
    void of_ValueWithDotsAndUnderscores_CreatesBreakerName() {
        // When
        BreakerName name = BreakerName.of("billing.v2_invoices");

        // Then
        assertEquals("billing.v2_invoices", name.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> BreakerName.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> BreakerName.of("   "));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        // Given
        String value = "a".repeat(256);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> BreakerName.of(value)
        );
        assertTrue(exception.getMessage().contains("255"));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> BreakerName.of("payment api"));
        assertThrows(IllegalArgumentException.class, () -> BreakerName.of("payment/api"));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        // Given
        BreakerName a = BreakerName.of("inventory");
        BreakerName b = BreakerName.of("inventory");

        // Then
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, BreakerName.of("pricing"));
    }

    @Test
    void forHost_UsesLowerCasedHostWithoutPort() {
        // Given
        URI uri = URI.create("https://Payments.Example.com:8443/charges?id=1");

        // When
        BreakerName name = BreakerName.forHost(uri);

        // Then
        assertEquals("payments.example.com", name.getValue());
        assertEquals(BreakerName.forHost(URI.create("http://payments.example.com/refunds")), name);
    }

    @Test
    void forHost_UriWithoutHost_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> BreakerName.forHost(URI.create("mailto:ops@example.com"))
        );
        assertTrue(exception.getMessage().contains("no host"));
        assertThrows(IllegalArgumentException.class, () -> BreakerName.forHost(null));
    }

    @Test
    void name_IsRenderedVerbatimInRejectionMessage() {
        // Given
        BreakerName name = BreakerName.forHost(URI.create("https://inventory.internal/items"));

        // When
        CircuitBreakerOpenException exception = new CircuitBreakerOpenException(name, CircuitBreakerState.OPEN);

        // Then
        assertEquals("circuit breaker 'inventory.internal' is OPEN", exception.getMessage());
        assertSame(name, exception.getBreakerName());
    }

    @Test
    void name_IdentifiesBreakerInStateChangeEvent() {
        // Given
        BreakerName name = BreakerName.of("pricing");

        // When
        StateChangeEvent event = new StateChangeEvent(
            name, CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN, 2L, Instant.EPOCH);

        // Then
        assertEquals(BreakerName.of("pricing"), event.breakerName());
        assertEquals("pricing", String.valueOf(event.breakerName()));
    }
}
