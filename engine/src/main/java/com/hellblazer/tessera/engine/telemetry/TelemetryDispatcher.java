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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans telemetry out to registered listeners. The engine components hold a dispatcher as their single
 * {@link TelemetryListener}; a failing listener is logged and skipped, never propagated back into the engine.
 *
 * @author hal.hildebrand
 */
public class TelemetryDispatcher implements TelemetryListener {
    private static final Logger log = LoggerFactory.getLogger(TelemetryDispatcher.class);

    private final List<TelemetryListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean           enabled   = new AtomicBoolean(true);
    private final AtomicLong              dispatched = new AtomicLong();
    private final AtomicLong              failures  = new AtomicLong();

    public void addListener(TelemetryListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        listeners.add(listener);
    }

    public boolean removeListener(TelemetryListener listener) {
        return listeners.remove(listener);
    }

    public void setEnabled(boolean enabled) {
        this.enabled.set(enabled);
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    @Override
    public void onEvent(TileTelemetryEvent event) {
        if (!enabled.get() || listeners.isEmpty()) {
            return;
        }
        dispatched.incrementAndGet();
        for (var listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                failures.incrementAndGet();
                log.warn("Telemetry listener failed on {}", event.getClass().getSimpleName(), e);
            }
        }
    }

    /**
     * @return number of events delivered to at least one listener
     */
    public long getDispatchedCount() {
        return dispatched.get();
    }

    /**
     * @return number of listener invocations that threw
     */
    public long getFailureCount() {
        return failures.get();
    }

    public int getListenerCount() {
        return listeners.size();
    }

    /**
     * Remove all listeners and zero the counters.
     */
    public void clear() {
        listeners.clear();
        dispatched.set(0);
        failures.set(0);
    }
}
