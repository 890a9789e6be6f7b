/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.zoom;

import com.hellblazer.tessera.engine.scale.ScaleTier;

/**
 * Callbacks from {@link ZoomScaleAuthority}. All methods default to no-ops so implementors pick what they need.
 *
 * @author hal.hildebrand
 */
public interface ZoomScaleListener {

    /**
     * Zoom, epoch or phase changed.
     */
    default void onStateChange(ZoomState state) {
    }

    default void onRenderModeChange(RenderMode from, RenderMode to) {
    }

    /**
     * The gesture has settled and the refresh render should be dispatched at {@code tier}.
     */
    default void onSettlingComplete(ScaleTier tier, double zoom) {
    }
}
