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

import com.hellblazer.tessera.engine.camera.CameraSnapshot;

/**
 * Zoom authority state frozen at tile request time, paired with the camera that was current then.
 * <p>
 * The id has the form {@code epoch-scale-mode}, so two snapshots with the same id were taken against the same
 * viewport and may share a render.
 *
 * @param id        {@code epoch-scale-mode}
 * @param epoch     epoch at capture
 * @param zoom      zoom at capture
 * @param scale     tier at capture
 * @param mode      render mode at capture
 * @param phase     gesture phase at capture
 * @param camera    camera at capture
 * @param timestamp capture time in milliseconds since epoch
 * @author hal.hildebrand
 */
public record ZoomSnapshot(String id, long epoch, double zoom, double scale, RenderMode mode, GesturePhase phase,
                           CameraSnapshot camera, long timestamp) {

    public ZoomSnapshot {
        if (id == null || mode == null || phase == null || camera == null) {
            throw new IllegalArgumentException("Snapshot fields cannot be null");
        }
    }
}
