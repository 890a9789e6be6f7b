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
package com.hellblazer.tessera.engine;

import com.hellblazer.tessera.engine.breaker.RejectionReason;
import com.hellblazer.tessera.engine.cache.CachedTileData.RawPixels;
import com.hellblazer.tessera.engine.cache.TileIdentity;
import com.hellblazer.tessera.engine.camera.CameraState;
import com.hellblazer.tessera.engine.config.EngineProfileLoader;
import com.hellblazer.tessera.engine.integration.IntegrationOutcome;
import com.hellblazer.tessera.engine.integration.TileRenderResult;
import com.hellblazer.tessera.engine.telemetry.CacheLevel;
import com.hellblazer.tessera.engine.telemetry.EvictionReason;
import com.hellblazer.tessera.engine.telemetry.LifecycleRecorder;
import com.hellblazer.tessera.engine.telemetry.TileEventType;
import com.hellblazer.tessera.engine.zoom.GesturePhase;
import com.hellblazer.tessera.engine.zoom.RenderMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point2d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end behavior of a wired engine
 *
 * @author hal.hildebrand
 */
@DisplayName("Tile Engine Tests")
class TileEngineTest {

    private MutableClock      clock;
    private CameraState       camera;
    private LifecycleRecorder recorder;
    private TileEngine        engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        camera = new CameraState();
        recorder = new LifecycleRecorder();
        engine = TileEngine.builder().clock(clock).build();
        engine.telemetry().addListener(recorder);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private void zoomTo(double zoom) {
        clock.advanceMillis(10_000);
        camera.setZoom(zoom);
        engine.authority().onZoomGesture(zoom, new Point2d(400, 300), camera);
    }

    private TileRenderResult render(TileIdentity tile) {
        var snapshot = engine.authority().captureSnapshot();
        return new TileRenderResult(tile, snapshot.epoch(), snapshot.scale(), snapshot.camera(),
                                    RawPixels.blank(4, 4));
    }

    @Test
    @DisplayName("Gesture, settle, render and integrate")
    void testLifecycle() {
        zoomTo(4);
        var authority = engine.authority();
        clock.advanceMillis(300);
        authority.update();
        clock.advanceMillis(200);
        assertEquals(GesturePhase.RENDERING, authority.update());

        var tile = engine.integrator().requestTile(0, 2, 3);
        assertEquals(8, tile.scale());
        var outcome = engine.integrator().integrate(render(tile));
        assertTrue(outcome.isAccepted());
        assertTrue(authority.completeRenderPhase());
        assertEquals(GesturePhase.IDLE, authority.getGesturePhase());

        assertTrue(engine.cache().getBestAvailable(tile).orElseThrow().isExact());
        var stats = recorder.getStats();
        assertEquals(1, stats.events(TileEventType.REQUEST));
        assertEquals(1, stats.events(TileEventType.CACHE_STORE));
        assertEquals(4, stats.phaseTransitions());
    }

    @Test
    @DisplayName("A render that outlives a pan storm is dropped")
    void testPanStormDropsStaleRender() {
        zoomTo(2);
        var tile = engine.integrator().requestTile(0, 0, 0);
        var result = render(tile);
        for (int i = 0; i < 6; i++) {
            camera.pan(10, 0);
            engine.authority().onPan(camera);
        }
        var outcome = engine.integrator().integrate(result);
        assertEquals(RejectionReason.EPOCH_EXPIRED, ((IntegrationOutcome.Rejected) outcome).reason());
        assertFalse(engine.cache().has(tile));
    }

    @Test
    @DisplayName("A render mode change clears the hot level")
    void testModeChangeClearsL1() {
        engine.cache().set(new TileIdentity(0, 0, 0, 2, 512), RawPixels.blank(4, 4), CacheLevel.L1);
        zoomTo(2);
        assertEquals(RenderMode.ADAPTIVE, engine.authority().getRenderMode());
        var stats = engine.cache().getStats();
        assertEquals(0, stats.l1Count());
        assertEquals(1, stats.l2Count());
        assertEquals(1, stats.evictions(EvictionReason.MODE_TRANSITION));
    }

    @Test
    @DisplayName("A large zoom out trims high scales from the warm level")
    void testZoomOutTrimsL2() {
        zoomTo(16);
        var cache = engine.cache();
        cache.set(new TileIdentity(0, 0, 0, 32, 128), RawPixels.blank(4, 4), CacheLevel.L2);
        cache.set(new TileIdentity(0, 0, 0, 8, 512), RawPixels.blank(4, 4), CacheLevel.L2);

        zoomTo(4);
        assertEquals(RenderMode.TILED, engine.authority().getRenderMode());
        assertFalse(cache.has(new TileIdentity(0, 0, 0, 32, 128)));
        assertTrue(cache.has(new TileIdentity(0, 0, 0, 8, 512)));
        assertEquals(1, cache.getStats().evictions(EvictionReason.ZOOM_CHANGE));
    }

    @Test
    @DisplayName("Profiles configure every component")
    void testProfile() {
        var profile = new EngineProfileLoader().getProfile("low").orElseThrow();
        try (var low = TileEngine.builder().clock(clock).profile(profile).build()) {
            assertEquals(16, low.scaleMath().maxTier());
            assertEquals(6, low.breaker().getConfig().threshold());
            assertEquals(180, low.cache().getConfig().l2MaxEntries());
        }
    }

    @Test
    @DisplayName("Engines share no state")
    void testIndependentInstances() {
        try (var other = TileEngine.builder().clock(clock).build()) {
            zoomTo(8);
            engine.cache().set(new TileIdentity(0, 0, 0, 16, 256), RawPixels.blank(4, 4), CacheLevel.L1);
            engine.breaker().recordRejection(RejectionReason.SCALE_MISMATCH);

            assertEquals(1.0, other.authority().getZoom());
            assertEquals(0, other.authority().getEpoch());
            assertFalse(other.cache().has(new TileIdentity(0, 0, 0, 16, 256)));
            assertEquals(0, other.breaker().getConsecutiveFailures());
        }
    }

    @Test
    @DisplayName("Reset restores every component")
    void testReset() {
        zoomTo(8);
        engine.cache().set(new TileIdentity(0, 0, 0, 16, 256), RawPixels.blank(4, 4), CacheLevel.L1);
        engine.breaker().recordRejection(RejectionReason.EPOCH_EXPIRED);

        engine.reset();
        assertEquals(0, engine.authority().getEpoch());
        assertEquals(1.0, engine.authority().getZoom());
        assertEquals(0, engine.cache().getStats().l2Count());
        assertEquals(0, engine.breaker().getConsecutiveFailures());
        assertEquals(1, engine.telemetry().getListenerCount());

        engine.cache().set(new TileIdentity(0, 0, 0, 2, 512), RawPixels.blank(4, 4), CacheLevel.L1);
        zoomTo(2);
        assertEquals(1, engine.cache().getStats().evictions(EvictionReason.MODE_TRANSITION), "cache still wired");
        assertEquals(2, engine.authority().getEpoch());
    }

    @Test
    @DisplayName("Close detaches everything")
    void testClose() {
        engine.close();
        assertTrue(engine.authority().isClosed());
        assertEquals(0, engine.telemetry().getListenerCount());
        assertThrows(IllegalStateException.class, () -> engine.authority().onZoomGesture(2, null, null));
    }

    @Test
    @DisplayName("Builder rejects missing collaborators")
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> TileEngine.builder().clock(null).build());
        assertThrows(IllegalArgumentException.class, () -> TileEngine.builder().zoomConfig(null).build());
        assertThrows(IllegalArgumentException.class, () -> TileEngine.builder().profile(null));
    }
}
