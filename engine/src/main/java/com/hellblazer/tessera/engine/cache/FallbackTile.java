/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.cache;

/**
 * Best cached stand-in for a requested tile.
 *
 * @param requested  the identity asked for
 * @param source     the identity actually found; differs from {@code requested} in scale, and possibly tile size
 *                   and grid position, when this is a fallback
 * @param data       the cached data of {@code source}
 * @param cssStretch display stretch {@code requested.scale / source.scale}; below 1 downscales a sharper tile
 */
public record FallbackTile(TileIdentity requested, TileIdentity source, CachedTileData data, double cssStretch) {

    public boolean isExact() {
        return requested.equals(source);
    }
}
