/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.config;

import com.hellblazer.tessera.engine.breaker.TileCircuitBreaker;
import com.hellblazer.tessera.engine.cache.CacheConfiguration;
import com.hellblazer.tessera.engine.scale.ScaleConfiguration;

/**
 * Engine limits for one device memory class.
 *
 * @param name              profile name, e.g. {@code low}, {@code medium}, {@code high}
 * @param minDeviceMemoryGB smallest device memory this profile applies to
 * @param deviceMaxTier     highest scale tier the device may render
 * @param l1MaxEntries      hot cache level entry limit
 * @param l2MaxEntries      warm cache level entry limit
 * @param l2MaxBytes        warm cache level byte budget
 * @param breakerThreshold  consecutive rejections that trip the circuit breaker
 * @author hal.hildebrand
 */
public record EngineProfile(String name, double minDeviceMemoryGB, double deviceMaxTier, int l1MaxEntries,
                            int l2MaxEntries, long l2MaxBytes, int breakerThreshold) {

    public EngineProfile {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Profile name cannot be empty");
        }
        if (minDeviceMemoryGB < 0) {
            throw new IllegalArgumentException("Minimum device memory must be non-negative: " + minDeviceMemoryGB);
        }
    }

    /**
     * Built-in profile matching the defaults of every component.
     */
    public static EngineProfile defaults() {
        var cache = CacheConfiguration.defaults();
        return new EngineProfile("default", 0, ScaleConfiguration.defaultConfig().deviceMaxTier(),
                                 cache.l1MaxEntries(), cache.l2MaxEntries(), cache.l2MaxBytes(),
                                 TileCircuitBreaker.Config.DEFAULT_THRESHOLD);
    }

    public ScaleConfiguration scaleConfiguration() {
        return ScaleConfiguration.defaultConfig().withDeviceMaxTier(deviceMaxTier);
    }

    public CacheConfiguration cacheConfiguration() {
        return CacheConfiguration.defaults().withL1MaxEntries(l1MaxEntries).withL2Limits(l2MaxEntries, l2MaxBytes);
    }

    public TileCircuitBreaker.Config breakerConfig() {
        return TileCircuitBreaker.Config.defaults().withThreshold(breakerThreshold);
    }
}
