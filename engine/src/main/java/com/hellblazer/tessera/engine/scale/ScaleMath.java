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
package com.hellblazer.tessera.engine.scale;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.TreeSet;

/**
 * The single place where render scales are computed.
 * <p>
 * A raw scale (zoom times device pixel ratio) is turned into a <i>tier</i> by capping it against a hardware
 * ceiling, the device ceiling, the tile-size pixel budget and the zoom limit, and then rounding it onto the tier
 * ladder. The same tier is used for the render request and for the cache key, so the two can never disagree.
 * <p>
 * Rounding rule: nearest ladder value by arithmetic midpoint between neighbours, with an exact midpoint rounding
 * up. Values below 1.5 fall into the sub-unit buckets {0.25, 0.5, 1}. Nothing rounds above the device max tier.
 * <p>
 * Instances are immutable and thread-safe.
 *
 * @author hal.hildebrand
 */
public final class ScaleMath {

    /** Highest scale the rasterizer can safely produce, independent of zoom or device. */
    public static final double GPU_SAFE_MAX_SCALE = 64;
    /** Maximum rendered tile edge in device pixels. */
    public static final int    MAX_TILE_PIXELS    = 8192;

    private static final double[] SUB_UNIT_BUCKETS = { 0.25, 0.5, 1.0 };

    private final ScaleConfiguration config;
    private final double[]           tiers;

    public ScaleMath() {
        this(ScaleConfiguration.defaultConfig());
    }

    /**
     * Scale math for the default ladder with the device max tier chosen by device memory.
     */
    public static ScaleMath forDeviceMemory(double deviceMemoryGB) {
        return new ScaleMath(ScaleConfiguration.defaultConfig().withDeviceMemoryGB(deviceMemoryGB));
    }

    public ScaleMath(ScaleConfiguration config) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        this.config = config;

        var all = new TreeSet<Double>();
        for (var bucket : SUB_UNIT_BUCKETS) {
            all.add(bucket);
        }
        for (var tier : config.ladder().tiers()) {
            if (tier <= config.deviceMaxTier()) {
                all.add(tier);
            }
        }
        this.tiers = all.stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * Ideal scale for the given zoom, with no capping or quantization. Informational: never use it as a cache key.
     *
     * @return {@code zoom * pixelRatio} rounded to 0.01, or 1 for invalid input
     */
    public double exactTargetScale(double zoom, double pixelRatio) {
        double exact = zoom * sanitizePixelRatio(pixelRatio);
        if (!Double.isFinite(exact) || exact <= 0) {
            return 1.0;
        }
        return Math.round(exact * 100.0) / 100.0;
    }

    /**
     * Same as {@link #exactTargetScale(double, double)}. The zoom limit is accepted for call-site symmetry with
     * {@link #targetScaleTier(double, double, double)} and does not cap the result.
     */
    public double exactTargetScale(double zoom, double pixelRatio, double maxZoom) {
        return exactTargetScale(zoom, pixelRatio);
    }

    /**
     * Tier to render and cache at for the given zoom, with the stretch needed to display it at the ideal scale.
     *
     * @param zoom       current zoom
     * @param pixelRatio device pixel ratio
     * @param maxZoom    configured zoom limit, or a non-positive value for none
     * @return tier and cssStretch
     */
    public ScaleTier targetScaleTier(double zoom, double pixelRatio, double maxZoom) {
        if (!Double.isFinite(zoom) || zoom <= 0) {
            return new ScaleTier(1.0, 1.0);
        }
        double exact = zoom * sanitizePixelRatio(pixelRatio);
        double tier = applyScaleCaps(exact, pixelRatio, maxZoom);
        return new ScaleTier(tier, exact / tier);
    }

    /**
     * Cap a scale against every ceiling and quantize it onto the ladder. Idempotent: the result is a ladder value
     * no greater than any ceiling that applies to it.
     *
     * @param scale      raw scale; non-positive or non-finite values are treated as 1
     * @param pixelRatio device pixel ratio
     * @param maxZoom    configured zoom limit, or a non-positive value for none
     * @return capped tier
     */
    public double applyScaleCaps(double scale, double pixelRatio, double maxZoom) {
        double s = (!Double.isFinite(scale) || scale <= 0) ? 1.0 : scale;
        double ceiling = ceilingFor(s, pixelRatio, maxZoom);
        double quantized = quantizeScale(Math.min(s, ceiling));
        return quantized > ceiling ? floorTier(ceiling) : quantized;
    }

    /**
     * Round a scale to the nearest ladder tier, never exceeding the device max tier.
     */
    public double quantizeScale(double scale) {
        if (Double.isNaN(scale) || scale <= tiers[0]) {
            return tiers[0];
        }
        double top = tiers[tiers.length - 1];
        if (scale >= top) {
            return top;
        }
        int idx = Arrays.binarySearch(tiers, scale);
        if (idx >= 0) {
            return tiers[idx];
        }
        int upper = -idx - 1;
        double lo = tiers[upper - 1];
        double hi = tiers[upper];
        return scale < (lo + hi) / 2.0 ? lo : hi;
    }

    /**
     * Scale to embed in a cache key. Deliberately identical to {@link #quantizeScale(double)}; it exists so that
     * the cache-key call site and the request call site both name the step they depend on.
     */
    public double scaleForCacheKey(double scale) {
        return quantizeScale(scale);
    }

    /**
     * Reduce a tier by {@code factor} and re-cap it; used when falling back to a cheaper render.
     */
    public double reduceTier(double tier, double factor, double pixelRatio, double maxZoom) {
        if (!(factor > 1)) {
            return applyScaleCaps(tier, pixelRatio, maxZoom);
        }
        return applyScaleCaps(tier / factor, pixelRatio, maxZoom);
    }

    /**
     * Tile edge length appropriate for the scale: large tiles when few are needed, small ones when each tile holds
     * a lot of device pixels.
     */
    public int adaptiveTileSize(double zoom, double pixelRatio) {
        double needed = zoom * sanitizePixelRatio(pixelRatio);
        if (!Double.isFinite(needed) || needed <= 8) {
            return 512;
        }
        if (config.largeTilesAtHighZoom()) {
            return 256;
        }
        return needed <= 16 ? 256 : 128;
    }

    /**
     * Highest scale at which a tile of the given size stays within {@link #MAX_TILE_PIXELS}.
     */
    public static double tileSizeCap(int tileSize) {
        if (tileSize <= 0) {
            throw new IllegalArgumentException("Tile size must be positive: " + tileSize);
        }
        return (double) MAX_TILE_PIXELS / tileSize;
    }

    /**
     * @return true if the value is exactly one of this instance's tiers
     */
    public boolean isTier(double scale) {
        return Arrays.binarySearch(tiers, scale) >= 0;
    }

    /**
     * @return every tier this instance can produce, ascending
     */
    public double[] tiers() {
        return tiers.clone();
    }

    public double maxTier() {
        return tiers[tiers.length - 1];
    }

    public ScaleConfiguration getConfig() {
        return config;
    }

    /**
     * Shortest exact decimal rendering of a tier: {@code 32}, {@code 0.25}, {@code 1.5}.
     */
    public static String formatScale(double scale) {
        return BigDecimal.valueOf(scale).stripTrailingZeros().toPlainString();
    }

    private double ceilingFor(double scale, double pixelRatio, double maxZoom) {
        double ceiling = Math.min(GPU_SAFE_MAX_SCALE, config.deviceMaxTier());
        ceiling = Math.min(ceiling, tileSizeCap(tileSizeForScale(scale)));
        if (Double.isFinite(maxZoom) && maxZoom > 0) {
            ceiling = Math.min(ceiling, maxZoom * sanitizePixelRatio(pixelRatio));
        }
        return ceiling;
    }

    // Tile size as a function of the scale alone, so the tile-size cap of a capped tier never drops below it
    private int tileSizeForScale(double scale) {
        if (scale <= 8) {
            return 512;
        }
        if (config.largeTilesAtHighZoom() || scale <= 16) {
            return 256;
        }
        return 128;
    }

    private double floorTier(double ceiling) {
        for (int i = tiers.length - 1; i >= 0; i--) {
            if (tiers[i] <= ceiling) {
                return tiers[i];
            }
        }
        return tiers[0];
    }

    private static double sanitizePixelRatio(double pixelRatio) {
        return (Double.isFinite(pixelRatio) && pixelRatio > 0) ? pixelRatio : 1.0;
    }
}
