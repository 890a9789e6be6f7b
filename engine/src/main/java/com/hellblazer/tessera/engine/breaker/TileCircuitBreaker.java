/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Tessera.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.tessera.engine.breaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Consecutive-failure circuit breaker for tile result rejection.
 * <p>
 * Repeated stale-epoch or scale-mismatch rejections mean the renderer cannot keep up with the viewport. Retrying at
 * the same scale would loop forever without putting anything on screen. Once {@code threshold} consecutive
 * rejections accumulate the breaker trips, and callers divide their requested scale by
 * {@link #getFallbackScaleReduction()} to get something valid at a lower resolution. The next recorded success
 * closes it again.
 * <p>
 * This is a pure counter, not a time-windowed breaker: there is no half-open state and no cool-down.
 *
 * @author hal.hildebrand
 */
public class TileCircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(TileCircuitBreaker.class);

    /**
     * Breaker configuration.
     *
     * @param threshold         consecutive rejections that trip the breaker
     * @param fallbackReduction scale divisor applied while tripped
     */
    public record Config(int threshold, double fallbackReduction) {
        public static final int    DEFAULT_THRESHOLD          = 10;
        public static final double DEFAULT_FALLBACK_REDUCTION = 2.0;

        public Config {
            if (threshold <= 0) {
                throw new IllegalArgumentException("Threshold must be positive: " + threshold);
            }
            if (!(fallbackReduction >= 1) || Double.isInfinite(fallbackReduction)) {
                throw new IllegalArgumentException("Fallback reduction must be >= 1: " + fallbackReduction);
            }
        }

        public static Config defaults() {
            return new Config(DEFAULT_THRESHOLD, DEFAULT_FALLBACK_REDUCTION);
        }

        public Config withThreshold(int threshold) {
            return new Config(threshold, fallbackReduction);
        }

        public Config withFallbackReduction(double fallbackReduction) {
            return new Config(threshold, fallbackReduction);
        }
    }

    /**
     * Read-only view of the breaker's trip state.
     */
    public record BreakerState(boolean isTripped, int consecutiveFailures, int threshold) {
    }

    /**
     * Read-only rejection statistics accumulated since construction or the last {@link #reset()}.
     */
    public record BreakerStats(Map<RejectionReason, Long> rejectionsByReason, long totalRejections,
                               long totalSuccesses, long trips) {
        public BreakerStats {
            rejectionsByReason = Map.copyOf(rejectionsByReason);
        }

        public long rejections(RejectionReason reason) {
            return rejectionsByReason.getOrDefault(reason, 0L);
        }

        @Override
        public String toString() {
            return String.format("Breaker[rejections=%d, successes=%d, trips=%d, byReason=%s]", totalRejections,
                                 totalSuccesses, trips, rejectionsByReason);
        }
    }

    private final Config                         config;
    private final EnumMap<RejectionReason, Long> rejectionsByReason = new EnumMap<>(RejectionReason.class);

    private int  consecutiveFailures;
    private long totalRejections;
    private long totalSuccesses;
    private long trips;

    public TileCircuitBreaker() {
        this(Config.defaults());
    }

    public TileCircuitBreaker(Config config) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        this.config = config;
    }

    /**
     * Record a rejected tile result.
     *
     * @param reason why it was rejected
     * @return true if this rejection tripped the breaker
     */
    public synchronized boolean recordRejection(RejectionReason reason) {
        if (reason == null) {
            throw new IllegalArgumentException("Reason cannot be null");
        }
        boolean wasTripped = isTripped();
        consecutiveFailures++;
        totalRejections++;
        rejectionsByReason.merge(reason, 1L, Long::sum);

        if (!wasTripped && isTripped()) {
            trips++;
            log.warn("Tile circuit breaker tripped after {} consecutive rejections (last: {}), falling back by {}x",
                     consecutiveFailures, reason.label(), config.fallbackReduction());
            return true;
        }
        return false;
    }

    /**
     * Record an accepted tile result. Clears the consecutive failure count and closes the breaker; the per-reason
     * histogram is kept.
     */
    public synchronized void recordSuccess() {
        if (isTripped()) {
            log.info("Tile circuit breaker closed after {} consecutive rejections", consecutiveFailures);
        }
        consecutiveFailures = 0;
        totalSuccesses++;
    }

    public synchronized boolean isTripped() {
        return consecutiveFailures >= config.threshold();
    }

    /**
     * @return true if callers should request a lower scale instead of retrying the target
     */
    public boolean shouldUseFallback() {
        return isTripped();
    }

    /**
     * @return the configured reduction factor while tripped, otherwise 1
     */
    public synchronized double getFallbackScaleReduction() {
        return isTripped() ? config.fallbackReduction() : 1.0;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized BreakerState getState() {
        return new BreakerState(isTripped(), consecutiveFailures, config.threshold());
    }

    public synchronized BreakerStats getStats() {
        return new BreakerStats(rejectionsByReason, totalRejections, totalSuccesses, trips);
    }

    public Config getConfig() {
        return config;
    }

    /**
     * Zero everything, including the reason histogram.
     */
    public synchronized void reset() {
        consecutiveFailures = 0;
        totalRejections = 0;
        totalSuccesses = 0;
        trips = 0;
        rejectionsByReason.clear();
    }
}
