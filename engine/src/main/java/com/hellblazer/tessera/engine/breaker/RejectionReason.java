/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.breaker;

/**
 * Why a completed tile render was not accepted.
 */
public enum RejectionReason {
    /** Tile epoch is further from the current epoch than the zoom-dependent tolerance allows */
    EPOCH_EXPIRED("epoch_expired"),
    /** Tile was rendered at a tier that is no longer the target tier */
    SCALE_MISMATCH("scale_mismatch");

    private final String label;

    RejectionReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
