/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.zoom;

/**
 * Render priority of a tile relative to the gesture focal point, most urgent first.
 */
public enum TilePriority {
    /** Within one tile of the focal point */
    CRITICAL,
    /** Within two tiles */
    HIGH,
    /** Within four tiles, or no focal point known */
    MEDIUM,
    LOW;

    /**
     * Classify by distance from the focal point, measured in the same units as {@code tileSpan}.
     */
    public static TilePriority forDistance(double distance, double tileSpan) {
        if (distance < tileSpan) {
            return CRITICAL;
        }
        if (distance < tileSpan * 2) {
            return HIGH;
        }
        if (distance < tileSpan * 4) {
            return MEDIUM;
        }
        return LOW;
    }
}
