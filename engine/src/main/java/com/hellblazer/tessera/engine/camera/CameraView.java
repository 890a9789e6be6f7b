/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.camera;

/**
 * Read-only view of a 2D pan/zoom camera. {@code x}/{@code y} translate canvas space, {@code zoom} scales it
 * uniformly.
 *
 * @author hal.hildebrand
 */
public interface CameraView {

    double x();

    double y();

    double zoom();
}
