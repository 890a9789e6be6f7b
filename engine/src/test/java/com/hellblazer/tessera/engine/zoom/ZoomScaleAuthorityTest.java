/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.zoom;

import com.hellblazer.tessera.engine.MutableClock;
import com.hellblazer.tessera.engine.camera.CameraState;
import com.hellblazer.tessera.engine.scale.ScaleMath;
import com.hellblazer.tessera.engine.scale.ScaleTier;
import com.hellblazer.tessera.engine.telemetry.TelemetryListener;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.PhaseTransition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import javax.vecmath.Point2d;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Phase machine, epoch, velocity and focal point behavior of the zoom authority
 *
 * @author hal.hildebrand
 */
@DisplayName("Zoom Scale Authority Tests")
class ZoomScaleAuthorityTest {

    private MutableClock       clock;
    private TelemetryListener  telemetry;
    private ZoomScaleAuthority authority;
    private CameraState        camera;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        telemetry = mock(TelemetryListener.class);
        authority = new ZoomScaleAuthority(ZoomConfiguration.defaults(), new ScaleMath(), clock, telemetry);
        camera = new CameraState();
    }

    /** Zoom slowly enough that velocity reduction does not apply. */
    private void slowGesture(double zoom) {
        clock.advanceMillis(10_000);
        camera.setZoom(zoom);
        authority.onZoomGesture(zoom, new Point2d(0, 0), camera);
    }

    @Test
    @DisplayName("Initial state")
    void testInitialState() {
        assertEquals(0, authority.getEpoch());
        assertEquals(GesturePhase.IDLE, authority.getGesturePhase());
        assertEquals(1.0, authority.getZoom());
        assertEquals(RenderMode.FULL_PAGE, authority.getRenderMode());
        assertTrue(authority.getFocalPoint().isEmpty());
        assertEquals(2.0, authority.getScale());
    }

    @Test
    @DisplayName("A full gesture cycle advances the epoch on every step")
    void testFullCycle() {
        slowGesture(2);
        assertEquals(GesturePhase.ACTIVE, authority.getGesturePhase());
        assertEquals(2, authority.getEpoch(), "phase transition plus zoom change");

        assertTrue(authority.endGesture());
        assertEquals(GesturePhase.SETTLING, authority.getGesturePhase());
        assertEquals(3, authority.getEpoch());

        assertTrue(authority.beginRendering());
        assertEquals(GesturePhase.RENDERING, authority.getGesturePhase());
        assertEquals(4, authority.getEpoch());

        assertTrue(authority.completeRenderPhase());
        assertEquals(GesturePhase.IDLE, authority.getGesturePhase());
        assertEquals(5, authority.getEpoch());
    }

    @Test
    @DisplayName("Invalid transitions are ignored and leave the epoch alone")
    void testInvalidTransitions() {
        assertFalse(authority.completeRenderPhase());
        assertFalse(authority.endGesture());
        assertFalse(authority.beginRendering());
        assertEquals(0, authority.getEpoch());
        assertEquals(GesturePhase.IDLE, authority.getGesturePhase());
        assertFalse(authority.forceIdle("already idle"));
    }

    @Test
    @DisplayName("Clock-driven gesture end, settle and render dispatch")
    void testUpdateDrivesPhases() {
        var listener = mock(ZoomScaleListener.class);
        authority.subscribe(listener);
        slowGesture(4);

        clock.advanceMillis(299);
        assertEquals(GesturePhase.ACTIVE, authority.update());
        clock.advanceMillis(1);
        assertEquals(GesturePhase.SETTLING, authority.update());

        clock.advanceMillis(199);
        assertEquals(GesturePhase.SETTLING, authority.update());
        clock.advanceMillis(1);
        assertEquals(GesturePhase.RENDERING, authority.update());

        verify(listener).onSettlingComplete(eq(new ScaleTier(8, 1.0)), eq(4.0));
    }

    @Test
    @DisplayName("Watchdog forces a stuck phase to idle")
    void testWatchdog() {
        slowGesture(4);
        authority.endGesture();
        authority.beginRendering();
        clock.advanceMillis(2999);
        assertEquals(GesturePhase.RENDERING, authority.update());
        clock.advanceMillis(1);
        assertEquals(GesturePhase.IDLE, authority.update());

        var captor = ArgumentCaptor.forClass(TileTelemetryEvent.class);
        verify(telemetry, atLeastOnce()).onEvent(captor.capture());
        var last = (PhaseTransition) captor.getAllValues().get(captor.getAllValues().size() - 1);
        assertEquals("watchdog", last.trigger());
        assertEquals(GesturePhase.RENDERING, last.from());
        assertEquals(3000, last.durationMs());
    }

    @Test
    @DisplayName("Watchdog wins over a settle that was never polled")
    void testWatchdogBeatsSettle() {
        slowGesture(4);
        authority.endGesture();
        clock.advanceMillis(5000);
        assertEquals(GesturePhase.IDLE, authority.update());
    }

    @Test
    @DisplayName("Gesture input resumes a settle and interrupts a render")
    void testResumeAndInterrupt() {
        slowGesture(2);
        authority.endGesture();
        slowGesture(3);
        assertEquals(GesturePhase.ACTIVE, authority.getGesturePhase());

        authority.endGesture();
        authority.beginRendering();
        slowGesture(4);
        assertEquals(GesturePhase.ACTIVE, authority.getGesturePhase());

        var captor = ArgumentCaptor.forClass(TileTelemetryEvent.class);
        verify(telemetry, atLeastOnce()).onEvent(captor.capture());
        var triggers = captor.getAllValues()
                             .stream()
                             .filter(e -> e instanceof PhaseTransition)
                             .map(e -> ((PhaseTransition) e).trigger())
                             .toList();
        assertEquals(List.of("gesture-start", "gesture-end", "gesture-resume", "gesture-end", "settle-complete",
                             "gesture-interrupt"), triggers);
    }

    @Test
    @DisplayName("Fast zoom renders at a reduced tier until the gesture ends")
    void testVelocityReduction() {
        clock.advanceMillis(100);
        authority.onZoomGesture(4, null, null);
        assertTrue(authority.getVelocity() > 4, "two octaves in 100ms");
        assertEquals(8, authority.getScaleTier().tier());
        assertEquals(4, authority.getScale());

        authority.endGesture();
        assertEquals(8, authority.getScale(), "reconverges once settling");
    }

    @Test
    @DisplayName("Slow zoom renders at the static tier")
    void testSlowZoomNoReduction() {
        slowGesture(8);
        assertTrue(authority.getVelocity() < 4);
        assertEquals(16, authority.getScale());
    }

    @Test
    @DisplayName("Pan commits advance the epoch")
    void testPanCommit() {
        camera.setPosition(50, 50);
        assertEquals(1, authority.syncFromCamera(camera));
        assertEquals(2, authority.onPan(camera));
        assertEquals(3, authority.incrementEpoch());
        assertEquals(GesturePhase.IDLE, authority.getGesturePhase());
    }

    @Test
    @DisplayName("Zoom is clamped to the configured range")
    void testZoomLimits() {
        slowGesture(100);
        assertEquals(32, authority.getZoom());
        assertTrue(authority.isAtMaxZoom());
        slowGesture(0.01);
        assertEquals(0.1, authority.getZoom(), 1e-12);
        assertTrue(authority.isAtMinZoom());
    }

    @Test
    @DisplayName("Soft constraint damps overshoot")
    void testSoftConstraint() {
        assertEquals(35, authority.constrainZoom(42, true), 1e-12);
        assertEquals(32, authority.constrainZoom(42, false));
        assertEquals(0.085, authority.constrainZoom(0.05, true), 1e-12);
        assertEquals(5, authority.constrainZoom(5, true));
    }

    @Test
    @DisplayName("Focal point is kept in canvas space")
    void testFocalPoint() {
        clock.advanceMillis(10_000);
        var cam = new CameraState(10, 20, 2);
        authority.onZoomGesture(2, new Point2d(100, 60), cam);
        assertEquals(new Point2d(40, 10), authority.getFocalPoint().orElseThrow());

        authority.getFocalPoint().orElseThrow().set(0, 0);
        assertEquals(new Point2d(40, 10), authority.getFocalPoint().orElseThrow(), "returned copies");
    }

    @Test
    @DisplayName("Tile priority by distance from the focal point")
    void testTilePriority() {
        clock.advanceMillis(10_000);
        authority.onZoomGesture(2, new Point2d(100, 60), new CameraState(10, 20, 2));

        assertEquals(TilePriority.CRITICAL, authority.getTilePriority(0, 0, 256, 2, null));
        assertEquals(TilePriority.HIGH, authority.getTilePriority(1, 0, 256, 2, null));
        assertEquals(TilePriority.MEDIUM, authority.getTilePriority(3, 0, 256, 2, null));
        assertEquals(TilePriority.LOW, authority.getTilePriority(5, 5, 256, 2, null));

        authority.forceIdle("test");
        assertEquals(TilePriority.MEDIUM, authority.getTilePriority(0, 0, 256, 2, null), "idle is neutral");
    }

    @Test
    @DisplayName("Snapshot id and epoch validation")
    void testSnapshot() {
        slowGesture(2);
        var snapshot = authority.captureSnapshot();
        assertEquals("2-4-adaptive", snapshot.id());
        assertEquals(2.0, snapshot.camera().zoom());

        for (int i = 0; i < 5; i++) {
            authority.incrementEpoch();
        }
        assertTrue(authority.validateSnapshot(snapshot), "five behind at zoom 2");
        authority.incrementEpoch();
        assertFalse(authority.validateSnapshot(snapshot), "six behind at zoom 2");
    }

    @Test
    @DisplayName("Listeners hear state and mode changes until unsubscribed")
    void testListeners() {
        var listener = mock(ZoomScaleListener.class);
        var subscription = authority.subscribe(listener);
        slowGesture(2);
        verify(listener).onRenderModeChange(RenderMode.FULL_PAGE, RenderMode.ADAPTIVE);
        verify(listener, atLeast(2)).onStateChange(any(ZoomState.class));

        subscription.close();
        clearInvocations(listener);
        slowGesture(8);
        verifyNoInteractions(listener);
    }

    @Test
    @DisplayName("A throwing listener does not break the authority")
    void testListenerFailureIsolated() {
        var listener = mock(ZoomScaleListener.class);
        doThrow(new IllegalStateException("boom")).when(listener).onStateChange(any());
        authority.subscribe(listener);
        slowGesture(2);
        assertEquals(2.0, authority.getZoom());
        assertEquals(GesturePhase.ACTIVE, authority.getGesturePhase());
    }

    @Test
    @DisplayName("Phase statistics record completed stays")
    void testPhaseStats() {
        clock.advanceMillis(1000);
        authority.onZoomGesture(2, null, null);
        clock.advanceMillis(500);
        authority.endGesture();

        var stats = authority.getPhaseStats();
        assertEquals(1, stats.get(GesturePhase.IDLE).entries());
        assertEquals(1000, stats.get(GesturePhase.IDLE).totalMs());
        assertEquals(500, stats.get(GesturePhase.ACTIVE).maxMs());
        assertEquals(0, stats.get(GesturePhase.RENDERING).entries());
    }

    @Test
    @DisplayName("Reset restores the initial state; close rejects input")
    void testResetAndClose() {
        slowGesture(8);
        authority.reset();
        assertEquals(0, authority.getEpoch());
        assertEquals(1.0, authority.getZoom());
        assertEquals(GesturePhase.IDLE, authority.getGesturePhase());
        assertTrue(authority.getFocalPoint().isEmpty());

        authority.close();
        assertTrue(authority.isClosed());
        assertThrows(IllegalStateException.class, () -> authority.onZoomGesture(2, null, null));
        authority.reset();
        assertFalse(authority.isClosed());
    }

    @Test
    @DisplayName("Tile params carry tier, stretch, tile size and epoch")
    void testTileParams() {
        slowGesture(5);
        var params = authority.getTileParams();
        assertEquals(12, params.scale());
        assertEquals(10.0 / 12, params.cssStretch(), 1e-12);
        assertEquals(256, params.tileSize());
        assertEquals(authority.getEpoch(), params.epoch());
        assertEquals(RenderMode.TILED, params.renderMode());
        verify(telemetry, atLeastOnce()).onEvent(any(TileTelemetryEvent.ModeTransition.class));
    }
}
