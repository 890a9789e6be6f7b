/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.zoom;

/**
 * Point-in-time view of the zoom authority handed to listeners.
 *
 * @author hal.hildebrand
 */
public record ZoomState(double zoom, double scale, long epoch, GesturePhase phase, RenderMode renderMode) {
}
