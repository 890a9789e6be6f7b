/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.telemetry;

import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.CacheHit;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.Eviction;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.FallbackReason;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.FallbackUsed;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.ModeTransition;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.PhaseTransition;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.RenderCompleted;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.RetryAttempted;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.RetrySucceeded;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.TileDropped;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.TileRequested;
import com.hellblazer.tessera.engine.zoom.GesturePhase;
import com.hellblazer.tessera.engine.zoom.RenderMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Lifecycle Recorder Tests")
class LifecycleRecorderTest {

    private static TileRef ref(int x) {
        return new TileRef("p0-t" + x + "x0-s8-ts256", 0, x, 0, 8, 256);
    }

    @Test
    @DisplayName("Ring buffers keep only the newest events")
    void testRingBound() {
        var recorder = new LifecycleRecorder(3, 2);
        for (int i = 0; i < 5; i++) {
            recorder.onEvent(new TileRequested(i, ref(i)));
        }
        var events = recorder.getEvents();
        assertEquals(3, events.size());
        assertEquals(2, events.get(0).timestamp());
        assertEquals(4, events.get(2).timestamp());
        assertEquals(5, recorder.getStats().totalEvents(), "aggregates see every event");

        for (int i = 0; i < 3; i++) {
            recorder.onEvent(new PhaseTransition(10 + i, GesturePhase.IDLE, GesturePhase.ACTIVE, 100, "t", 1, 2));
        }
        assertEquals(2, recorder.getPhaseEvents().size());
        assertThrows(UnsupportedOperationException.class, () -> recorder.getEvents().clear());
    }

    @Test
    @DisplayName("Rates are relative to requests and retry attempts")
    void testRates() {
        var recorder = new LifecycleRecorder();
        for (int i = 0; i < 4; i++) {
            recorder.onEvent(new TileRequested(i, ref(i)));
        }
        recorder.onEvent(new FallbackUsed(5, ref(0), ref(9), 8, 12, 8.0 / 12, FallbackReason.NOT_CACHED));
        recorder.onEvent(new TileDropped(6, ref(1), "epoch-expired"));
        recorder.onEvent(new TileDropped(7, ref(2), "scale-mismatch"));
        recorder.onEvent(new RetryAttempted(8, ref(1), 1));
        recorder.onEvent(new RetryAttempted(9, ref(2), 1));
        recorder.onEvent(new RetrySucceeded(10, ref(1), 1));

        var stats = recorder.getStats();
        assertEquals(0.25, stats.fallbackUsageRate());
        assertEquals(0.5, stats.dropRate());
        assertEquals(0.5, stats.retrySuccessRate());
        assertEquals(10, stats.recordingDurationMs());
        assertEquals(4, stats.events(TileEventType.REQUEST));
    }

    @Test
    @DisplayName("Cache, render, phase and mode aggregates")
    void testAggregates() {
        var recorder = new LifecycleRecorder();
        recorder.onEvent(new CacheHit(1, ref(0), CacheLevel.L1));
        recorder.onEvent(new CacheHit(2, ref(0), CacheLevel.L2));
        recorder.onEvent(new CacheHit(3, ref(0), CacheLevel.L2));
        recorder.onEvent(new Eviction(4, ref(1), CacheLevel.L2, EvictionReason.LRU, 64));
        recorder.onEvent(new RenderCompleted(5, ref(2), 10));
        recorder.onEvent(new RenderCompleted(6, ref(3), 30));
        recorder.onEvent(new PhaseTransition(7, GesturePhase.ACTIVE, GesturePhase.SETTLING, 400, "gesture-end", 4, 8));
        recorder.onEvent(new PhaseTransition(8, GesturePhase.ACTIVE, GesturePhase.SETTLING, 200, "gesture-end", 4, 8));
        recorder.onEvent(new ModeTransition(9, RenderMode.FULL_PAGE, RenderMode.ADAPTIVE, 2, 3));

        var stats = recorder.getStats();
        assertEquals(2, stats.hitsByLevel().get(CacheLevel.L2));
        assertEquals(1, stats.evictions(EvictionReason.LRU));
        assertEquals(20.0, stats.avgRenderTimeMs());
        assertEquals(300.0, stats.avgPhaseDurationMs().get(GesturePhase.ACTIVE));
        assertEquals(2, stats.phaseTransitions());
        assertEquals(1, stats.modeTransitions());
        assertEquals(3, recorder.getEventsForTile(ref(0).tileKey()).size());
    }

    @Test
    @DisplayName("Reset clears everything")
    void testReset() {
        var recorder = new LifecycleRecorder();
        recorder.onEvent(new TileRequested(1, ref(0)));
        recorder.reset();
        assertTrue(recorder.getEvents().isEmpty());
        assertEquals(0, recorder.getStats().totalEvents());
        assertEquals(0, recorder.getStats().recordingDurationMs());
        assertEquals(0.0, recorder.getStats().dropRate());
    }
}
