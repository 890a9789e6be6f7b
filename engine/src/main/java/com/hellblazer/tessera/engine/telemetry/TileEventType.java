/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.telemetry;

/**
 * Tile lifecycle event types, in the order a tile normally passes through them.
 *
 * @author hal.hildebrand
 */
public enum TileEventType {
    REQUEST("request"),
    RENDER_START("render-start"),
    RENDER_COMPLETE("render-complete"),
    RENDER_ERROR("render-error"),
    CACHE_STORE("cache-store"),
    CACHE_HIT("cache-hit"),
    CACHE_EVICT("cache-evict"),
    FALLBACK_USED("fallback-used"),
    DROP("drop"),
    RETRY_QUEUE("retry-queue"),
    RETRY_ATTEMPT("retry-attempt"),
    RETRY_SUCCESS("retry-success"),
    RETRY_EXPIRED("retry-expired"),
    ABORT("abort");

    private final String label;

    TileEventType(String label) {
        this.label = label;
    }

    /**
     * Stable external name used in diagnostics output.
     */
    public String label() {
        return label;
    }
}
