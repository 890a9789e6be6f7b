/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.telemetry;

/**
 * Tile cache levels. L1 holds hot tiles, L2 the larger working set and L3 page metadata only.
 */
public enum CacheLevel {
    L1, L2, L3
}
