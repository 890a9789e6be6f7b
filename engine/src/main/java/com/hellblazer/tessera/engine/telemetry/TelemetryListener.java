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

/**
 * Functional interface for receiving tile engine telemetry.
 *
 * Telemetry is best-effort. The engine emits on its own timeline and never waits on, or fails because of, a
 * listener; exceptions thrown by listeners registered through {@link TelemetryDispatcher} are caught and logged.
 *
 * Example usage:
 * <pre>
 * TelemetryListener listener = event -> {
 *     if (event instanceof TileTelemetryEvent.Eviction e) {
 *         evictions.merge(e.reason(), 1, Integer::sum);
 *     }
 * };
 * dispatcher.addListener(listener);
 * </pre>
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface TelemetryListener {

    /**
     * Listener that discards everything. Used when no telemetry collaborator is present.
     */
    TelemetryListener NOOP = event -> {
    };

    /**
     * Called when a telemetry event occurs. Implementations should be fast and non-blocking.
     *
     * @param event the event
     */
    void onEvent(TileTelemetryEvent event);
}
