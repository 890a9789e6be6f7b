/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.scale;

import java.util.Arrays;

/**
 * Discrete rendering scales above 1x. Every tile is rendered and cached at one of these values (or one of the
 * sub-unit buckets 0.25, 0.5, 1 used when zoomed far out).
 *
 * @author hal.hildebrand
 */
public enum ScaleLadder {
    /** Octave steps only. Fewest distinct tiers, highest cache reuse. */
    POWER_OF_2(1, 2, 4, 8, 16, 32, 64),
    /** Half-octave steps up to 32. */
    FINE_GRAINED(2, 3, 4, 6, 8, 12, 16, 24, 32, 64),
    /** Integer steps up to 16. Smallest cssStretch, lowest cache reuse. */
    ULTRA_FINE(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16, 24, 32, 64);

    private final double[] tiers;

    ScaleLadder(double... tiers) {
        this.tiers = tiers;
    }

    /**
     * @return ladder values in ascending order
     */
    public double[] tiers() {
        return tiers.clone();
    }

    public boolean contains(double scale) {
        return Arrays.binarySearch(tiers, scale) >= 0;
    }

    public double max() {
        return tiers[tiers.length - 1];
    }
}
