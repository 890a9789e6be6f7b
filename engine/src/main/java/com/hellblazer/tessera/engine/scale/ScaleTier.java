/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.scale;

/**
 * A render tier together with the visual stretch needed to display it at the ideal scale.
 *
 * @param tier       quantized scale used for both the render request and the cache key
 * @param cssStretch exact scale divided by tier; 1 when the tier is the ideal scale
 */
public record ScaleTier(double tier, double cssStretch) {

    public ScaleTier {
        if (!(tier > 0) || Double.isInfinite(tier)) {
            throw new IllegalArgumentException("Tier must be positive and finite: " + tier);
        }
        if (!(cssStretch > 0) || Double.isInfinite(cssStretch)) {
            throw new IllegalArgumentException("cssStretch must be positive and finite: " + cssStretch);
        }
    }

    public boolean isExact() {
        return cssStretch == 1.0;
    }
}
