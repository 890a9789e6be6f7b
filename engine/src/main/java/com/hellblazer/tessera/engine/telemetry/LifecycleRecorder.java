/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.telemetry;

import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.CacheHit;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.Eviction;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.ModeTransition;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.PhaseTransition;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.RenderCompleted;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.TileEvent;
import com.hellblazer.tessera.engine.zoom.GesturePhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory telemetry collector. Keeps the most recent tile events and phase transitions in bounded ring buffers
 * and aggregates running counters over everything it has seen since the last {@link #reset()}.
 * <p>
 * Counters are not bounded by the buffers: evicting an old event from the ring does not roll back the totals.
 *
 * @author hal.hildebrand
 */
public class LifecycleRecorder implements TelemetryListener {
    private static final Logger log = LoggerFactory.getLogger(LifecycleRecorder.class);

    public static final int DEFAULT_MAX_EVENTS       = 1000;
    public static final int DEFAULT_MAX_PHASE_EVENTS = 500;
    private static final int RENDER_TIME_WINDOW      = 100;

    private final int maxEvents;
    private final int maxPhaseEvents;

    private final Deque<TileTelemetryEvent> events      = new ArrayDeque<>();
    private final Deque<PhaseTransition>    phaseEvents = new ArrayDeque<>();
    private final Deque<Long>               renderTimes = new ArrayDeque<>();

    private final Map<TileEventType, Long>  eventsByType       = new EnumMap<>(TileEventType.class);
    private final Map<EvictionReason, Long> evictionsByReason  = new EnumMap<>(EvictionReason.class);
    private final Map<CacheLevel, Long>     hitsByLevel        = new EnumMap<>(CacheLevel.class);
    private final Map<GesturePhase, Long>   phaseDurationTotal = new EnumMap<>(GesturePhase.class);
    private final Map<GesturePhase, Long>   phaseDurationCount = new EnumMap<>(GesturePhase.class);

    private long totalEvents;
    private long modeTransitions;
    private long firstTimestamp = -1;
    private long lastTimestamp  = -1;

    public LifecycleRecorder() {
        this(DEFAULT_MAX_EVENTS, DEFAULT_MAX_PHASE_EVENTS);
    }

    public LifecycleRecorder(int maxEvents, int maxPhaseEvents) {
        if (maxEvents <= 0 || maxPhaseEvents <= 0) {
            throw new IllegalArgumentException("Buffer sizes must be positive");
        }
        this.maxEvents = maxEvents;
        this.maxPhaseEvents = maxPhaseEvents;
    }

    @Override
    public synchronized void onEvent(TileTelemetryEvent event) {
        totalEvents++;
        if (firstTimestamp < 0) {
            firstTimestamp = event.timestamp();
        }
        lastTimestamp = Math.max(lastTimestamp, event.timestamp());

        append(events, event, maxEvents);

        if (event instanceof TileEvent tileEvent) {
            eventsByType.merge(tileEvent.type(), 1L, Long::sum);
        }
        if (event instanceof Eviction eviction) {
            evictionsByReason.merge(eviction.reason(), 1L, Long::sum);
        } else if (event instanceof CacheHit hit) {
            hitsByLevel.merge(hit.level(), 1L, Long::sum);
        } else if (event instanceof RenderCompleted completed) {
            append(renderTimes, completed.durationMs(), RENDER_TIME_WINDOW);
        } else if (event instanceof PhaseTransition phase) {
            append(phaseEvents, phase, maxPhaseEvents);
            phaseDurationTotal.merge(phase.from(), phase.durationMs(), Long::sum);
            phaseDurationCount.merge(phase.from(), 1L, Long::sum);
            log.debug("Phase {} -> {} after {}ms ({})", phase.from(), phase.to(), phase.durationMs(),
                      phase.trigger());
        } else if (event instanceof ModeTransition) {
            modeTransitions++;
        }
    }

    /**
     * @return the retained events, oldest first
     */
    public synchronized List<TileTelemetryEvent> getEvents() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    /**
     * @return retained events about the given tile key, oldest first
     */
    public synchronized List<TileEvent> getEventsForTile(String tileKey) {
        var result = new ArrayList<TileEvent>();
        for (var event : events) {
            if (event instanceof TileEvent tileEvent && tileEvent.tile().tileKey().equals(tileKey)) {
                result.add(tileEvent);
            }
        }
        return result;
    }

    public synchronized List<PhaseTransition> getPhaseEvents() {
        return List.copyOf(phaseEvents);
    }

    public synchronized TelemetryStats getStats() {
        long requests = count(TileEventType.REQUEST);
        long retryAttempts = count(TileEventType.RETRY_ATTEMPT);

        var avgPhase = new EnumMap<GesturePhase, Double>(GesturePhase.class);
        for (var entry : phaseDurationTotal.entrySet()) {
            avgPhase.put(entry.getKey(), (double) entry.getValue() / phaseDurationCount.get(entry.getKey()));
        }

        double avgRender = renderTimes.stream().mapToLong(Long::longValue).average().orElse(0.0);
        long phaseTransitions = phaseDurationCount.values().stream().mapToLong(Long::longValue).sum();
        long span = firstTimestamp < 0 ? 0 : lastTimestamp - firstTimestamp;

        return new TelemetryStats(totalEvents, new EnumMap<>(eventsByType), new EnumMap<>(hitsByLevel),
                                  new EnumMap<>(evictionsByReason), avgPhase, phaseTransitions, modeTransitions,
                                  ratio(count(TileEventType.FALLBACK_USED), requests),
                                  ratio(count(TileEventType.DROP), requests),
                                  ratio(count(TileEventType.RETRY_SUCCESS), retryAttempts), avgRender, span);
    }

    public synchronized void reset() {
        events.clear();
        phaseEvents.clear();
        renderTimes.clear();
        eventsByType.clear();
        evictionsByReason.clear();
        hitsByLevel.clear();
        phaseDurationTotal.clear();
        phaseDurationCount.clear();
        totalEvents = 0;
        modeTransitions = 0;
        firstTimestamp = -1;
        lastTimestamp = -1;
    }

    private long count(TileEventType type) {
        return eventsByType.getOrDefault(type, 0L);
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }

    private static <T> void append(Deque<T> ring, T value, int capacity) {
        if (ring.size() == capacity) {
            ring.removeFirst();
        }
        ring.addLast(value);
    }

    /**
     * Aggregated telemetry snapshot
     */
    public record TelemetryStats(long totalEvents, Map<TileEventType, Long> eventsByType,
                                 Map<CacheLevel, Long> hitsByLevel, Map<EvictionReason, Long> evictionsByReason,
                                 Map<GesturePhase, Double> avgPhaseDurationMs, long phaseTransitions,
                                 long modeTransitions, double fallbackUsageRate, double dropRate,
                                 double retrySuccessRate, double avgRenderTimeMs, long recordingDurationMs) {
        public TelemetryStats {
            eventsByType = Collections.unmodifiableMap(eventsByType);
            hitsByLevel = Collections.unmodifiableMap(hitsByLevel);
            evictionsByReason = Collections.unmodifiableMap(evictionsByReason);
            avgPhaseDurationMs = Collections.unmodifiableMap(avgPhaseDurationMs);
        }

        public long evictions(EvictionReason reason) {
            return evictionsByReason.getOrDefault(reason, 0L);
        }

        public long events(TileEventType type) {
            return eventsByType.getOrDefault(type, 0L);
        }

        @Override
        public String toString() {
            return String.format(
            "Telemetry[events=%d, phases=%d, modes=%d, fallback=%.1f%%, drop=%.1f%%, avgRender=%.1fms, span=%dms]",
            totalEvents, phaseTransitions, modeTransitions, fallbackUsageRate * 100, dropRate * 100,
            avgRenderTimeMs, recordingDurationMs);
        }
    }
}
