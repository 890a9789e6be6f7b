/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.zoom;

/**
 * Page presentation strategy derived from zoom. Transitions use hysteresis around the thresholds so that zoom
 * jitter near a boundary does not flip the mode back and forth.
 *
 * @author hal.hildebrand
 */
public enum RenderMode {
    FULL_PAGE, ADAPTIVE, TILED;

    public static final double FULL_TO_ADAPTIVE = 1.5;
    public static final double ADAPTIVE_TO_TILED = 4.0;
    public static final double HYSTERESIS = 0.1;

    /**
     * Derive the mode for {@code zoom} given the mode currently in effect.
     *
     * @param zoom    new zoom level
     * @param current mode currently in effect
     * @return the new mode, possibly unchanged
     */
    public static RenderMode derive(double zoom, RenderMode current) {
        double upAdaptive = FULL_TO_ADAPTIVE * (1 + HYSTERESIS);
        double upTiled = ADAPTIVE_TO_TILED * (1 + HYSTERESIS);
        double downFull = FULL_TO_ADAPTIVE * (1 - HYSTERESIS);
        double downAdaptive = ADAPTIVE_TO_TILED * (1 - HYSTERESIS);

        return switch (current) {
            case FULL_PAGE -> zoom > upTiled ? TILED : zoom > upAdaptive ? ADAPTIVE : FULL_PAGE;
            case ADAPTIVE -> zoom < downFull ? FULL_PAGE : zoom > upTiled ? TILED : ADAPTIVE;
            case TILED -> zoom < downFull ? FULL_PAGE : zoom < downAdaptive ? ADAPTIVE : TILED;
        };
    }
}
