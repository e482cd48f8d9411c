package com.questrail.taskchannel.internal.reconnect;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReconnectPolicyTest
 * -----------------------------------------------------------------------------
 * Backoff formula, cap and validation.
 */
class ReconnectPolicyTest {

    @Test
    void defaultsMatchDocumentedValues() {
        ReconnectPolicy policy = ReconnectPolicy.defaults();

        assertEquals(Duration.ofSeconds(1), policy.baseDelay());
        assertEquals(2.0, policy.backoffMultiplier());
        assertEquals(Duration.ofSeconds(30), policy.maxDelay());
        assertEquals(5, policy.maxAttempts());
    }

    @Test
    void delayGrowsGeometricallyFromBaseDelay() {
        ReconnectPolicy policy = ReconnectPolicy.defaults();

        assertEquals(Duration.ofSeconds(1), policy.nextDelay(1));
        assertEquals(Duration.ofSeconds(2), policy.nextDelay(2));
        assertEquals(Duration.ofSeconds(4), policy.nextDelay(3));
        assertEquals(Duration.ofSeconds(8), policy.nextDelay(4));
        assertEquals(Duration.ofSeconds(16), policy.nextDelay(5));
    }

    @Test
    void delayIsCappedAtMaxDelay() {
        ReconnectPolicy policy = ReconnectPolicy.defaults();

        assertEquals(Duration.ofSeconds(30), policy.nextDelay(6));
        assertEquals(Duration.ofSeconds(30), policy.nextDelay(50));
    }

    @Test
    void delayIsNonDecreasingAcrossAttempts() {
        ReconnectPolicy policy = new ReconnectPolicy(Duration.ofMillis(250), 1.5, Duration.ofSeconds(10), 100);

        Duration previous = Duration.ZERO;
        for (int attempt = 1; attempt <= 100; attempt++) {
            Duration delay = policy.nextDelay(attempt);
            assertTrue(delay.compareTo(previous) >= 0, "attempt " + attempt + " went backwards");
            assertTrue(delay.compareTo(Duration.ofSeconds(10)) <= 0);
            previous = delay;
        }
    }

    @Test
    void multiplierOfOneGivesConstantDelay() {
        ReconnectPolicy policy = new ReconnectPolicy(Duration.ofMillis(500), 1.0, null, 3);

        assertEquals(Duration.ofMillis(500), policy.nextDelay(1));
        assertEquals(Duration.ofMillis(500), policy.nextDelay(10));
    }

    @Test
    void uncappedDelaySaturatesInsteadOfOverflowing() {
        ReconnectPolicy policy = new ReconnectPolicy(Duration.ofSeconds(1), 10.0, null, 1000);

        assertTrue(policy.maxDelayCap().isEmpty());
        assertEquals(Duration.ofNanos(Long.MAX_VALUE), policy.nextDelay(500));
    }

    @Test
    void exhaustionStartsAfterMaxAttempts() {
        ReconnectPolicy policy = ReconnectPolicy.defaults();

        assertFalse(policy.isExhausted(1));
        assertFalse(policy.isExhausted(5));
        assertTrue(policy.isExhausted(6));
    }

    @Test
    void zeroMaxAttemptsIsExhaustedImmediately() {
        ReconnectPolicy policy = new ReconnectPolicy(Duration.ofSeconds(1), 2.0, null, 0);

        assertTrue(policy.isExhausted(1));
    }

    @Test
    void rejectsAttemptBelowOne() {
        assertThrows(IllegalArgumentException.class, () -> ReconnectPolicy.defaults().nextDelay(0));
    }

    @Test
    void rejectsNullBaseDelay() {
        assertThrows(NullPointerException.class, () -> new ReconnectPolicy(null, 2.0, null, 5));
    }

    @Test
    void rejectsNegativeBaseDelay() {
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofMillis(-1), 2.0, null, 5));
    }

    @Test
    void rejectsMultiplierBelowOne() {
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(1), 0.5, null, 5));
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(1), Double.NaN, null, 5));
    }

    @Test
    void rejectsMaxDelayBelowBaseDelay() {
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(2), 2.0, Duration.ofSeconds(1), 5));
    }

    @Test
    void rejectsNegativeMaxAttempts() {
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(1), 2.0, null, -1));
    }
}
