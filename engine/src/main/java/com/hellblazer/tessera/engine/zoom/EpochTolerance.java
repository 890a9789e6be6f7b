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
package com.hellblazer.tessera.engine.zoom;

/**
 * Zoom-dependent epoch tolerance for tile results.
 * <p>
 * High-zoom tiles take longer to rasterize, so more epochs pass while they are in flight. A fixed tolerance would
 * reject tiles that are merely slow. The bound still has to reject tiles from a genuinely different viewport, so it
 * stays within {@code [MIN_TOLERANCE, MAX_TOLERANCE]} for every input.
 *
 * <pre>
 * zoom &lt;= 4        -&gt;  5
 * 4 &lt; zoom &lt;= 16   -&gt; 10
 * zoom &gt; 16        -&gt; 15
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class EpochTolerance {

    public static final int MIN_TOLERANCE = 5;
    public static final int MID_TOLERANCE = 10;
    public static final int MAX_TOLERANCE = 15;

    private static final double LOW_ZOOM_LIMIT = 4;
    private static final double MID_ZOOM_LIMIT = 16;

    private EpochTolerance() {
    }

    /**
     * @param zoom current zoom; NaN, zero and negative values get the minimum tolerance, +infinity the maximum
     * @return number of epochs a tile result may lag behind and still be accepted
     */
    public static int of(double zoom) {
        if (Double.isNaN(zoom) || zoom <= LOW_ZOOM_LIMIT) {
            return MIN_TOLERANCE;
        }
        if (zoom <= MID_ZOOM_LIMIT) {
            return MID_TOLERANCE;
        }
        return MAX_TOLERANCE;
    }

    /**
     * @return true if {@code |currentEpoch - tileEpoch| <= of(zoom)}
     */
    public static boolean isWithinTolerance(long currentEpoch, long tileEpoch, double zoom) {
        return Math.abs(currentEpoch - tileEpoch) <= of(zoom);
    }
}
