/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Tessera.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.tessera.engine.telemetry;

import com.hellblazer.tessera.engine.zoom.GesturePhase;
import com.hellblazer.tessera.engine.zoom.RenderMode;

/**
 * Sealed hierarchy of telemetry events emitted by the tile engine.
 * <p>
 * Every event type has its own structured payload; there is no free-form detail map. The set is closed and
 * versioned through {@link #SCHEMA_VERSION}: adding, removing or reshaping a record is a schema change and bumps
 * the version so that downstream collectors can tell payload generations apart.
 * <p>
 * Tile events all implement {@link TileEvent} and carry a {@link TileRef}. Phase and mode transitions describe
 * the viewport rather than a tile.
 *
 * @author hal.hildebrand
 */
public sealed interface TileTelemetryEvent
permits TileTelemetryEvent.TileEvent, TileTelemetryEvent.PhaseTransition, TileTelemetryEvent.ModeTransition {

    int SCHEMA_VERSION = 1;

    /**
     * Event timestamp in milliseconds since epoch.
     *
     * @return event timestamp
     */
    long timestamp();

    default int schemaVersion() {
        return SCHEMA_VERSION;
    }

    /**
     * Events about a single tile.
     */
    sealed interface TileEvent extends TileTelemetryEvent
    permits TileRequested, RenderStarted, RenderCompleted, RenderFailed, CacheStored, CacheHit, Eviction,
            FallbackUsed, TileDropped, RetryQueued, RetryAttempted, RetrySucceeded, RetryExpired, RenderAborted {

        TileRef tile();

        TileEventType type();
    }

    /**
     * Why a fallback tile was shown instead of the requested one.
     */
    enum FallbackReason {
        NOT_CACHED, RENDER_PENDING, RENDER_FAILED, CIRCUIT_OPEN
    }

    record TileRequested(long timestamp, TileRef tile) implements TileEvent {
        @Override
        public TileEventType type() {
            return TileEventType.REQUEST;
        }
    }

    record RenderStarted(long timestamp, TileRef tile) implements TileEvent {
        @Override
        public TileEventType type() {
            return TileEventType.RENDER_START;
        }
    }

    /**
     * @param durationMs wall time between render start and completion
     */
    record RenderCompleted(long timestamp, TileRef tile, long durationMs) implements TileEvent {
        @Override
        public TileEventType type() {
            return TileEventType.RENDER_COMPLETE;
        }
    }

    record RenderFailed(long timestamp, TileRef tile, String message) implements TileEvent {
        @Override
        public TileEventType type() {
            return TileEventType.RENDER_ERROR;
        }
    }

    record CacheStored(long timestamp, TileRef tile, CacheLevel level, long bytes) implements TileEvent {
        @Override
        public TileEventType type() {
            return TileEventType.CACHE_STORE;
        }
    }

    record CacheHit(long timestamp, TileRef tile, CacheLevel level) implements TileEvent {
        @Override
        public TileEventType type() {
            return TileEventType.CACHE_HIT;
        }
    }

    /**
     * A tile left a cache level.
     *
     * @param level      level the tile was removed from
     * @param reason     why it was removed
     * @param bytesFreed payload size released
     */
    record Eviction(long timestamp, TileRef tile, CacheLevel level, EvictionReason reason, long bytesFreed)
    implements TileEvent {
        @Override
        public TileEventType type() {
            return TileEventType.CACHE_EVICT;
        }
    }

    /**
     * A cached tile at another scale stood in for the requested one.
     *
     * @param tile           the requested tile
     * @param fallback       the tile actually shown
     * @param requestedScale tier that was asked for
     * @param fallbackScale  tier of the stand-in
     * @param cssStretch     visual stretch applied to the stand-in
     * @param reason         why the requested tile was unavailable
     */
    record FallbackUsed(long timestamp, TileRef tile, TileRef fallback, double requestedScale, double fallbackScale,
                        double cssStretch, FallbackReason reason) implements TileEvent {
        @Override
        public TileEventType type() {
            return TileEventType.FALLBACK_USED;
        }
    }

    record TileDropped(long timestamp, TileRef tile, String reason) implements TileEvent {
        @Override
        public TileEventType type() {
            return TileEventType.DROP;
        }
    }

    record RetryQueued(long timestamp, TileRef tile) implements TileEvent {
        @Override
        public TileEventType type() {
            return TileEventType.RETRY_QUEUE;
        }
    }

    record RetryAttempted(long timestamp, TileRef tile, int attempt) implements TileEvent {
        @Override
        public TileEventType type() {
            return TileEventType.RETRY_ATTEMPT;
        }
    }

    record RetrySucceeded(long timestamp, TileRef tile, int attempt) implements TileEvent {
        @Override
        public TileEventType type() {
            return TileEventType.RETRY_SUCCESS;
        }
    }

    record RetryExpired(long timestamp, TileRef tile) implements TileEvent {
        @Override
        public TileEventType type() {
            return TileEventType.RETRY_EXPIRED;
        }
    }

    record RenderAborted(long timestamp, TileRef tile, String reason) implements TileEvent {
        @Override
        public TileEventType type() {
            return TileEventType.ABORT;
        }
    }

    /**
     * Gesture phase changed.
     *
     * @param from       phase left
     * @param to         phase entered
     * @param durationMs time spent in {@code from}
     * @param trigger    what caused the transition, e.g. {@code gesture-start} or {@code watchdog}
     * @param zoom       zoom at the transition
     * @param scale      scale tier at the transition
     */
    record PhaseTransition(long timestamp, GesturePhase from, GesturePhase to, long durationMs, String trigger,
                           double zoom, double scale) implements TileTelemetryEvent {
        public PhaseTransition {
            if (from == null || to == null) {
                throw new IllegalArgumentException("Phases cannot be null");
            }
        }
    }

    /**
     * Render mode changed.
     */
    record ModeTransition(long timestamp, RenderMode from, RenderMode to, double zoom, long epoch)
    implements TileTelemetryEvent {
    }
}
