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
package com.hellblazer.tessera.engine.camera;

import java.time.Clock;

/**
 * Camera state frozen at tile request time.
 * <p>
 * Tiles are placed using the snapshot taken when they were requested, not the live camera, because the live camera
 * keeps moving during the debounce and render window. The record holds only primitives and no reference back to
 * the state it was copied from, so nothing done to the source camera can reach it.
 *
 * @param x         horizontal translation, clamped to {@code >= 0}; non-finite values become 0
 * @param y         vertical translation, clamped to {@code >= 0}; non-finite values become 0
 * @param zoom      zoom, clamped to {@code [MIN_ZOOM, MAX_ZOOM]}
 * @param timestamp capture time in milliseconds since epoch
 * @author hal.hildebrand
 */
public record CameraSnapshot(double x, double y, double zoom, long timestamp) implements CameraView {

    public static final double MIN_ZOOM = 0.1;
    public static final double MAX_ZOOM = 64.0;

    public CameraSnapshot {
        x = Double.isFinite(x) ? Math.max(0, x) : 0;
        y = Double.isFinite(y) ? Math.max(0, y) : 0;
        zoom = Double.isNaN(zoom) ? 1.0 : Math.min(Math.max(zoom, MIN_ZOOM), MAX_ZOOM);
    }

    /**
     * Capture the current state of a camera.
     *
     * @param camera camera to copy
     * @param clock  time source for the capture timestamp
     * @return the snapshot
     */
    public static CameraSnapshot capture(CameraView camera, Clock clock) {
        if (camera == null) {
            throw new IllegalArgumentException("Camera cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        return new CameraSnapshot(camera.x(), camera.y(), camera.zoom(), clock.millis());
    }

    /**
     * @return milliseconds elapsed since capture
     */
    public long ageMillis(Clock clock) {
        return clock.millis() - timestamp;
    }
}
