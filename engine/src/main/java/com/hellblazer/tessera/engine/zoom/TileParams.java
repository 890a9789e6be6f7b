/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.zoom;

/**
 * Everything a caller needs to issue a tile request for the current viewport.
 *
 * @param scale      tier to render at
 * @param cssStretch display stretch from {@code scale} to the ideal scale
 * @param tileSize   tile edge length in device pixels
 * @param epoch      epoch to stamp on the request
 * @param renderMode render mode in effect
 */
public record TileParams(double scale, double cssStretch, int tileSize, long epoch, RenderMode renderMode) {
}
