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

import com.hellblazer.tessera.engine.scale.ScaleMath;
import com.hellblazer.tessera.engine.telemetry.TileRef;

/**
 * Identity of a rendered tile: page, grid position, scale tier and tile size. Equality is exact on all five.
 * <p>
 * Build identities through {@link #of(int, int, int, double, int, ScaleMath)} so the scale goes through the same
 * quantization step on the request path and on the lookup path.
 *
 * @param page     page index, {@code >= 0}
 * @param tileX    grid column
 * @param tileY    grid row
 * @param scale    scale tier, positive and finite
 * @param tileSize tile edge in device pixels
 * @author hal.hildebrand
 */
public record TileIdentity(int page, int tileX, int tileY, double scale, int tileSize) {

    public TileIdentity {
        if (page < 0) {
            throw new IllegalArgumentException("Page must be non-negative: " + page);
        }
        if (!(scale > 0) || Double.isInfinite(scale)) {
            throw new IllegalArgumentException("Scale must be positive and finite: " + scale);
        }
        if (tileSize <= 0) {
            throw new IllegalArgumentException("Tile size must be positive: " + tileSize);
        }
    }

    /**
     * Identity for a raw scale, quantized through {@link ScaleMath#scaleForCacheKey(double)}.
     */
    public static TileIdentity of(int page, int tileX, int tileY, double rawScale, int tileSize,
                                  ScaleMath scaleMath) {
        return new TileIdentity(page, tileX, tileY, scaleMath.scaleForCacheKey(rawScale), tileSize);
    }

    /**
     * @return {@code p{page}-t{x}x{y}-s{scale}-ts{tileSize}}
     */
    public String key() {
        return "p" + page + "-t" + tileX + "x" + tileY + "-s" + ScaleMath.formatScale(scale) + "-ts" + tileSize;
    }

    /**
     * Same tile position at another scale and tile size.
     */
    public TileIdentity withScale(double scale, int tileSize) {
        return new TileIdentity(page, tileX, tileY, scale, tileSize);
    }

    /**
     * Edge length of this tile in page units.
     */
    public double pageSpan() {
        return tileSize / scale;
    }

    public TileRef toRef() {
        return new TileRef(key(), page, tileX, tileY, scale, tileSize);
    }

    @Override
    public String toString() {
        return key();
    }
}
