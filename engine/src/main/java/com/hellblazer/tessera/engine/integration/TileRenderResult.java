/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.integration;

import com.hellblazer.tessera.engine.cache.CachedTileData;
import com.hellblazer.tessera.engine.cache.TileIdentity;
import com.hellblazer.tessera.engine.camera.CameraSnapshot;

/**
 * A completed render handed back for integration.
 *
 * @param tile           identity the render was requested under
 * @param epoch          authority epoch stamped on the request
 * @param requestedScale scale the render was requested at
 * @param camera         camera frozen at request time
 * @param data           rendered payload
 * @author hal.hildebrand
 */
public record TileRenderResult(TileIdentity tile, long epoch, double requestedScale, CameraSnapshot camera,
                               CachedTileData data) {

    public TileRenderResult {
        if (tile == null) {
            throw new IllegalArgumentException("Tile cannot be null");
        }
        if (camera == null) {
            throw new IllegalArgumentException("Camera snapshot cannot be null");
        }
    }
}
