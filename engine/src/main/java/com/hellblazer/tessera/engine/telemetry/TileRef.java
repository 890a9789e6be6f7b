/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.telemetry;

/**
 * Flattened tile reference carried by telemetry events. Decoupled from the cache's own identity type so that
 * telemetry consumers never hold cache internals.
 *
 * @param tileKey  cache key of the tile, e.g. {@code p1-t2x3-s16-ts256}
 * @param page     page number
 * @param tileX    tile column
 * @param tileY    tile row
 * @param scale    quantized scale tier
 * @param tileSize tile edge length in pixels
 */
public record TileRef(String tileKey, int page, int tileX, int tileY, double scale, int tileSize) {

    public TileRef {
        if (tileKey == null) {
            throw new IllegalArgumentException("Tile key cannot be null");
        }
    }

    @Override
    public String toString() {
        return tileKey;
    }
}
