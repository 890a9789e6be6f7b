/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.telemetry;

/**
 * Why a tile left the cache. Every eviction carries exactly one reason.
 *
 * @author hal.hildebrand
 */
public enum EvictionReason {
    /** Capacity (entry count or byte budget) exceeded */
    LRU("lru"),
    /** Cache limits shrunk in response to memory pressure */
    MEMORY_PRESSURE("memory-pressure"),
    /** Scale of the tile no longer useful after a significant zoom change */
    ZOOM_CHANGE("zoom-change"),
    /** Display mode changed, hot tiles belong to the old viewport */
    MODE_TRANSITION("mode-transition"),
    /** Document switched */
    DOCUMENT_SWITCH("document-switch"),
    /** Explicit clear or per-page eviction */
    MANUAL("manual");

    private final String label;

    EvictionReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
