/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.cache;

import com.hellblazer.tessera.engine.zoom.TilePriority;

/**
 * Ranks cached tiles for pressure-driven eviction; the least urgent priority is evicted first.
 */
@FunctionalInterface
public interface TilePriorityFunction {
    TilePriority priorityOf(TileIdentity tile);
}
