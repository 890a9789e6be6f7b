/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.cache;

/**
 * Tile cache limits.
 *
 * @param l1MaxEntries hot level entry limit
 * @param l2MaxEntries warm level entry limit
 * @param l2MaxBytes   warm level byte budget
 * @param l3Enabled    whether page metadata is retained
 * @author hal.hildebrand
 */
public record CacheConfiguration(int l1MaxEntries, int l2MaxEntries, long l2MaxBytes, boolean l3Enabled) {

    public static final int  DEFAULT_L1_ENTRIES = 200;
    public static final int  DEFAULT_L2_ENTRIES = 360;
    public static final long DEFAULT_L2_BYTES   = 360L * 1024 * 1024;

    public CacheConfiguration {
        if (l1MaxEntries <= 0 || l2MaxEntries <= 0) {
            throw new IllegalArgumentException(
            "Entry limits must be positive: l1=" + l1MaxEntries + ", l2=" + l2MaxEntries);
        }
        if (l2MaxBytes <= 0) {
            throw new IllegalArgumentException("L2 byte budget must be positive: " + l2MaxBytes);
        }
    }

    public static CacheConfiguration defaults() {
        return new CacheConfiguration(DEFAULT_L1_ENTRIES, DEFAULT_L2_ENTRIES, DEFAULT_L2_BYTES, true);
    }

    public CacheConfiguration withL1MaxEntries(int l1MaxEntries) {
        return new CacheConfiguration(l1MaxEntries, l2MaxEntries, l2MaxBytes, l3Enabled);
    }

    public CacheConfiguration withL2Limits(int l2MaxEntries, long l2MaxBytes) {
        return new CacheConfiguration(l1MaxEntries, l2MaxEntries, l2MaxBytes, l3Enabled);
    }

    public CacheConfiguration withL3Enabled(boolean l3Enabled) {
        return new CacheConfiguration(l1MaxEntries, l2MaxEntries, l2MaxBytes, l3Enabled);
    }
}
