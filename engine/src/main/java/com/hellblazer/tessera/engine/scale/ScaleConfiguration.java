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

/**
 * Configuration for scale quantization and capping.
 *
 * @param ladder               tier ladder used above 1x
 * @param deviceMaxTier        highest tier this device may render; must lie on the ladder
 * @param largeTilesAtHighZoom prefer 512/256 pixel tiles instead of 512/256/128
 * @author hal.hildebrand
 */
public record ScaleConfiguration(ScaleLadder ladder, double deviceMaxTier, boolean largeTilesAtHighZoom) {

    public static final double DEFAULT_DEVICE_MAX_TIER = 64;

    public ScaleConfiguration {
        if (ladder == null) {
            throw new IllegalArgumentException("Ladder cannot be null");
        }
        if (!(deviceMaxTier >= 1) || !ladder.contains(deviceMaxTier)) {
            throw new IllegalArgumentException(
            "Device max tier " + deviceMaxTier + " is not on the " + ladder + " ladder");
        }
    }

    public static ScaleConfiguration defaultConfig() {
        return new ScaleConfiguration(ScaleLadder.FINE_GRAINED, DEFAULT_DEVICE_MAX_TIER, false);
    }

    /**
     * Device max tier chosen from available device memory: 8GB and up may render 64x, 4GB and up 32x, anything
     * smaller 16x.
     *
     * @param deviceMemoryGB reported device memory in gigabytes
     * @return max tier for the device
     */
    public static double deviceMaxTierFor(double deviceMemoryGB) {
        if (deviceMemoryGB >= 8) {
            return 64;
        }
        if (deviceMemoryGB >= 4) {
            return 32;
        }
        return 16;
    }

    public ScaleConfiguration withLadder(ScaleLadder ladder) {
        return new ScaleConfiguration(ladder, deviceMaxTier, largeTilesAtHighZoom);
    }

    public ScaleConfiguration withDeviceMaxTier(double deviceMaxTier) {
        return new ScaleConfiguration(ladder, deviceMaxTier, largeTilesAtHighZoom);
    }

    public ScaleConfiguration withDeviceMemoryGB(double deviceMemoryGB) {
        return withDeviceMaxTier(deviceMaxTierFor(deviceMemoryGB));
    }

    public ScaleConfiguration withLargeTilesAtHighZoom(boolean largeTilesAtHighZoom) {
        return new ScaleConfiguration(ladder, deviceMaxTier, largeTilesAtHighZoom);
    }
}
