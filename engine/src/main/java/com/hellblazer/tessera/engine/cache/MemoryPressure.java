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
package com.hellblazer.tessera.engine.cache;

/**
 * Host memory pressure levels and the tile cache's response to each.
 *
 * <p>Default utilization thresholds and response:
 * <ul>
 *   <li>NONE: below 75%, full L2 limits</li>
 *   <li>MODERATE: 75-85%, L2 limits at 75%</li>
 *   <li>HIGH: 85-95%, L2 limits at 50%, L1 cleared</li>
 *   <li>CRITICAL: 95% and up, L2 limits at 25%, L1 cleared</li>
 * </ul>
 *
 * @see TileCache#handleMemoryPressure(MemoryPressure)
 */
public enum MemoryPressure {
    NONE(0.0, 1.0, 0.0),
    MODERATE(0.75, 0.75, 0.25),
    HIGH(0.85, 0.5, 0.5),
    CRITICAL(0.95, 0.25, 0.9);

    private final double threshold;
    private final double l2Fraction;
    private final double priorityEvictionFraction;

    MemoryPressure(double threshold, double l2Fraction, double priorityEvictionFraction) {
        this.threshold = threshold;
        this.l2Fraction = l2Fraction;
        this.priorityEvictionFraction = priorityEvictionFraction;
    }

    /**
     * Pressure level for a utilization in {@code [0, 1]}.
     */
    public static MemoryPressure fromUtilization(double utilization) {
        if (utilization >= CRITICAL.threshold) {
            return CRITICAL;
        } else if (utilization >= HIGH.threshold) {
            return HIGH;
        } else if (utilization >= MODERATE.threshold) {
            return MODERATE;
        }
        return NONE;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * Fraction of the configured L2 limits kept at this level.
     */
    public double getL2Fraction() {
        return l2Fraction;
    }

    /**
     * Fraction of cached tiles evicted lowest-priority-first when a priority function is installed.
     */
    public double getPriorityEvictionFraction() {
        return priorityEvictionFraction;
    }

    public boolean shouldEvict() {
        return this.ordinal() >= MODERATE.ordinal();
    }

    public boolean clearsL1() {
        return this.ordinal() >= HIGH.ordinal();
    }
}
