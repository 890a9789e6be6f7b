/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.breaker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Consecutive-failure breaker semantics
 *
 * @author hal.hildebrand
 */
@DisplayName("Tile Circuit Breaker Tests")
class TileCircuitBreakerTest {

    private TileCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        breaker = new TileCircuitBreaker();
    }

    @Test
    @DisplayName("Trips on the tenth consecutive rejection, not the ninth")
    void testTripsAtThreshold() {
        for (int i = 0; i < 9; i++) {
            assertFalse(breaker.recordRejection(RejectionReason.EPOCH_EXPIRED));
        }
        assertFalse(breaker.isTripped());
        assertEquals(1.0, breaker.getFallbackScaleReduction());

        assertTrue(breaker.recordRejection(RejectionReason.SCALE_MISMATCH), "tenth rejection trips");
        assertTrue(breaker.isTripped());
        assertTrue(breaker.shouldUseFallback());
        assertEquals(2.0, breaker.getFallbackScaleReduction());

        assertFalse(breaker.recordRejection(RejectionReason.EPOCH_EXPIRED), "already tripped");
        assertEquals(1, breaker.getStats().trips());
    }

    @Test
    @DisplayName("A success resets the run and closes the breaker")
    void testSuccessResets() {
        for (int i = 0; i < 10; i++) {
            breaker.recordRejection(RejectionReason.EPOCH_EXPIRED);
        }
        assertTrue(breaker.isTripped());

        breaker.recordSuccess();
        assertFalse(breaker.isTripped());
        assertEquals(0, breaker.getConsecutiveFailures());
        assertEquals(1.0, breaker.getFallbackScaleReduction());
        assertEquals(10, breaker.getStats().rejections(RejectionReason.EPOCH_EXPIRED), "histogram survives");
    }

    @Test
    @DisplayName("Interleaved successes keep the breaker closed")
    void testInterleaved() {
        for (int i = 0; i < 50; i++) {
            breaker.recordRejection(RejectionReason.SCALE_MISMATCH);
            if (i % 5 == 4) {
                breaker.recordSuccess();
            }
            assertFalse(breaker.isTripped());
        }
        var stats = breaker.getStats();
        assertEquals(50, stats.totalRejections());
        assertEquals(10, stats.totalSuccesses());
        assertEquals(50, stats.rejections(RejectionReason.SCALE_MISMATCH));
        assertEquals(0, stats.rejections(RejectionReason.EPOCH_EXPIRED));
    }

    @Test
    @DisplayName("State view reports threshold and run length")
    void testState() {
        var custom = new TileCircuitBreaker(TileCircuitBreaker.Config.defaults().withThreshold(3));
        custom.recordRejection(RejectionReason.EPOCH_EXPIRED);
        custom.recordRejection(RejectionReason.EPOCH_EXPIRED);
        assertEquals(new TileCircuitBreaker.BreakerState(false, 2, 3), custom.getState());
        custom.recordRejection(RejectionReason.EPOCH_EXPIRED);
        assertTrue(custom.getState().isTripped());
    }

    @Test
    @DisplayName("Reset zeroes counters and histogram")
    void testReset() {
        for (int i = 0; i < 12; i++) {
            breaker.recordRejection(RejectionReason.EPOCH_EXPIRED);
        }
        breaker.reset();
        assertFalse(breaker.isTripped());
        var stats = breaker.getStats();
        assertEquals(0, stats.totalRejections());
        assertEquals(0, stats.trips());
        assertTrue(stats.rejectionsByReason().isEmpty());
    }

    @Test
    @DisplayName("Configuration is validated")
    void testConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> new TileCircuitBreaker.Config(0, 2));
        assertThrows(IllegalArgumentException.class, () -> new TileCircuitBreaker.Config(5, 0.5));
        assertThrows(IllegalArgumentException.class, () -> breaker.recordRejection(null));
    }
}
