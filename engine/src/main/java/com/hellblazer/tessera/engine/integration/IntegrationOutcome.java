/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.integration;

import com.hellblazer.tessera.engine.breaker.RejectionReason;
import com.hellblazer.tessera.engine.cache.TileIdentity;

/**
 * Result of integrating a tile render: cached and counted as a success, or dropped and counted as a rejection.
 * Never both.
 */
public sealed interface IntegrationOutcome {

    TileIdentity tile();

    default boolean isAccepted() {
        return this instanceof Accepted;
    }

    record Accepted(TileIdentity tile) implements IntegrationOutcome {
    }

    record Rejected(TileIdentity tile, RejectionReason reason) implements IntegrationOutcome {
    }
}
