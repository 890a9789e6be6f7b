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
package com.hellblazer.tessera.engine.zoom;

import com.hellblazer.tessera.engine.camera.CameraSnapshot;
import com.hellblazer.tessera.engine.camera.CameraView;
import com.hellblazer.tessera.engine.camera.CoordinateTransform;
import com.hellblazer.tessera.engine.scale.ScaleMath;
import com.hellblazer.tessera.engine.scale.ScaleTier;
import com.hellblazer.tessera.engine.telemetry.TelemetryListener;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2d;
import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The single owner of zoom, epoch, gesture phase, focal point and render mode for one viewport.
 * <p>
 * The epoch is a monotonically increasing counter that advances on every phase transition, every zoom change and
 * every pan commit. Tile requests are stamped with it, and a result is only accepted while the authority's epoch is
 * within {@link EpochTolerance} of the stamp.
 * <p>
 * There are no timers. Time-driven transitions (gesture end after quiet time, settle completion, the phase
 * watchdog) happen when the owner calls {@link #update()}, measured against the injected {@link Clock}.
 * <p>
 * All state is guarded by the instance monitor. Listener and telemetry callbacks run on the calling thread while
 * the monitor is held; they may read the authority but should not block.
 *
 * @author hal.hildebrand
 */
public class ZoomScaleAuthority implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ZoomScaleAuthority.class);

    /** Fraction of an overshoot kept when constraining zoom softly. */
    public static final double SOFT_RESISTANCE = 0.3;
    /** Tolerance for the zoom limit checks. */
    public static final double ZOOM_EPSILON    = 1e-4;

    /**
     * Handle returned by {@link #subscribe(ZoomScaleListener)}; closing it removes the listener.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private final ZoomConfiguration       config;
    private final ScaleMath               scaleMath;
    private final Clock                   clock;
    private final TelemetryListener       telemetry;
    private final List<ZoomScaleListener> listeners  = new CopyOnWriteArrayList<>();
    private final Map<GesturePhase, PhaseStats> phaseStats = new EnumMap<>(GesturePhase.class);

    private double         zoom;
    private RenderMode     renderMode;
    private GesturePhase   phase;
    private long           epoch;
    private long           phaseEnteredAt;
    private long           lastGestureAt;
    private long           lastZoomAt;
    private double         velocity;
    private Point2d        focalPoint;
    private CameraSnapshot camera;
    private boolean        closed;

    public ZoomScaleAuthority(ZoomConfiguration config, ScaleMath scaleMath, Clock clock) {
        this(config, scaleMath, clock, TelemetryListener.NOOP);
    }

    public ZoomScaleAuthority(ZoomConfiguration config, ScaleMath scaleMath, Clock clock,
                              TelemetryListener telemetry) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        if (scaleMath == null) {
            throw new IllegalArgumentException("Scale math cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.config = config;
        this.scaleMath = scaleMath;
        this.clock = clock;
        this.telemetry = telemetry == null ? TelemetryListener.NOOP : telemetry;
        initialize();
    }

    // ===== Gesture input =====

    /**
     * Apply a zoom gesture sample. Starts the gesture from IDLE, resumes it from SETTLING and interrupts a pending
     * render. The zoom is clamped to the configured range.
     *
     * @param newZoom      requested zoom
     * @param focalScreen  focal point in screen space, or null to keep the previous focal point
     * @param cameraView   camera the focal point was measured against, or null
     * @return true if the zoom changed
     */
    public synchronized boolean onZoomGesture(double newZoom, Point2d focalScreen, CameraView cameraView) {
        checkOpen();
        if (Double.isNaN(newZoom)) {
            log.warn("Ignoring NaN zoom gesture");
            return false;
        }
        long now = clock.millis();
        lastGestureAt = now;

        switch (phase) {
            case IDLE -> transition(GesturePhase.ACTIVE, "gesture-start", false);
            case SETTLING -> transition(GesturePhase.ACTIVE, "gesture-resume", false);
            case RENDERING -> transition(GesturePhase.ACTIVE, "gesture-interrupt", false);
            case ACTIVE -> {
            }
        }

        if (cameraView != null) {
            camera = CameraSnapshot.capture(cameraView, clock);
            if (focalScreen != null) {
                focalPoint = CoordinateTransform.screenToCanvas(focalScreen, cameraView);
            }
        }

        double clamped = constrainZoom(newZoom, false);
        if (Math.abs(clamped - zoom) < ZOOM_EPSILON) {
            return false;
        }
        long dt = Math.max(1, now - lastZoomAt);
        velocity = (Math.log(clamped / zoom) / Math.log(2)) / (dt / 1000.0);
        zoom = clamped;
        lastZoomAt = now;
        epoch++;
        log.debug("Zoom -> {} (epoch {}, velocity {} oct/s)", zoom, epoch, velocity);
        updateRenderMode();
        notifyStateChange();
        return true;
    }

    /**
     * Commit a pan (or any camera change made outside a zoom gesture). Always advances the epoch, since every
     * in-flight tile was positioned against the old camera.
     *
     * @return the new epoch
     */
    public synchronized long syncFromCamera(CameraView cameraView) {
        checkOpen();
        if (cameraView == null) {
            throw new IllegalArgumentException("Camera cannot be null");
        }
        camera = CameraSnapshot.capture(cameraView, clock);
        double clamped = constrainZoom(cameraView.zoom(), false);
        boolean zoomChanged = Math.abs(clamped - zoom) >= ZOOM_EPSILON;
        if (zoomChanged) {
            zoom = clamped;
        }
        epoch++;
        if (zoomChanged) {
            updateRenderMode();
        }
        notifyStateChange();
        return epoch;
    }

    /**
     * Pan commit; same as {@link #syncFromCamera(CameraView)}.
     */
    public long onPan(CameraView cameraView) {
        return syncFromCamera(cameraView);
    }

    public synchronized long incrementEpoch() {
        checkOpen();
        return ++epoch;
    }

    // ===== Phase machine =====

    /**
     * Gesture input stopped: ACTIVE -> SETTLING.
     *
     * @return true if the transition happened
     */
    public synchronized boolean endGesture() {
        return endGesture("gesture-end");
    }

    /**
     * Settle complete: SETTLING -> RENDERING. Fires {@link ZoomScaleListener#onSettlingComplete} with the tier the
     * refresh render should use.
     *
     * @return true if the transition happened
     */
    public synchronized boolean beginRendering() {
        return beginRendering("settle-complete");
    }

    /**
     * The dispatched refresh render was accepted: RENDERING -> IDLE.
     *
     * @return true if the transition happened
     */
    public synchronized boolean completeRenderPhase() {
        return transition(GesturePhase.IDLE, "render-complete", false);
    }

    /**
     * Force IDLE from any phase.
     *
     * @param reason recorded as the transition trigger
     * @return true if the phase was not already IDLE
     */
    public synchronized boolean forceIdle(String reason) {
        return transition(GesturePhase.IDLE, reason == null ? "forced" : reason, true);
    }

    /**
     * Drive time-based transitions against the clock: gesture end after the quiet period, settle completion after
     * the settling delay, and the watchdog that forces SETTLING or RENDERING to IDLE when they last too long.
     *
     * @return the phase after the update
     */
    public synchronized GesturePhase update() {
        if (closed) {
            return phase;
        }
        long now = clock.millis();
        long inPhase = now - phaseEnteredAt;

        if ((phase == GesturePhase.SETTLING || phase == GesturePhase.RENDERING)
        && inPhase >= config.phaseWatchdogMs()) {
            log.warn("Phase {} exceeded watchdog ({}ms >= {}ms), forcing idle", phase, inPhase,
                     config.phaseWatchdogMs());
            transition(GesturePhase.IDLE, "watchdog", true);
            return phase;
        }
        if (phase == GesturePhase.ACTIVE && now - lastGestureAt >= config.gestureEndDelayMs()) {
            endGesture("gesture-timeout");
            inPhase = 0;
        }
        if (phase == GesturePhase.SETTLING && inPhase >= config.settlingDelayMs()) {
            beginRendering("settle-timeout");
        }
        return phase;
    }

    // ===== Scale =====

    /**
     * Tier and stretch for the current zoom, ignoring gesture velocity.
     */
    public synchronized ScaleTier getScaleTier() {
        return scaleMath.targetScaleTier(zoom, config.pixelRatio(), config.maxZoom());
    }

    /**
     * Tier to render at right now. While a fast gesture is ACTIVE this is the static tier reduced by the velocity
     * reduction; in every other phase it is the static tier.
     */
    public synchronized double getScale() {
        double tier = getScaleTier().tier();
        if (phase == GesturePhase.ACTIVE && Math.abs(velocity) > config.velocityThreshold()) {
            return scaleMath.reduceTier(tier, config.velocityReduction(), config.pixelRatio(), config.maxZoom());
        }
        return tier;
    }

    public synchronized TileParams getTileParams() {
        double scale = getScale();
        double exact = zoom * config.pixelRatio();
        return new TileParams(scale, exact / scale, scaleMath.adaptiveTileSize(zoom, config.pixelRatio()), epoch,
                              renderMode);
    }

    /**
     * Freeze the current state for a tile request.
     */
    public synchronized ZoomSnapshot captureSnapshot() {
        double scale = getScale();
        String id = epoch + "-" + ScaleMath.formatScale(scale) + "-" + renderMode.name().toLowerCase();
        return new ZoomSnapshot(id, epoch, zoom, scale, renderMode, phase, camera, clock.millis());
    }

    // ===== Epoch validation =====

    /**
     * @return true if a tile stamped with {@code tileEpoch} is still within tolerance at the current zoom
     */
    public synchronized boolean isEpochValid(long tileEpoch) {
        return EpochTolerance.isWithinTolerance(epoch, tileEpoch, zoom);
    }

    public boolean validateSnapshot(ZoomSnapshot snapshot) {
        return snapshot != null && isEpochValid(snapshot.epoch());
    }

    // ===== Zoom limits =====

    public synchronized boolean isAtMaxZoom() {
        return zoom >= config.maxZoom() - ZOOM_EPSILON;
    }

    public synchronized boolean isAtMinZoom() {
        return zoom <= config.minZoom() + ZOOM_EPSILON;
    }

    /**
     * Constrain a zoom to the configured range.
     *
     * @param requested requested zoom
     * @param soft      if true, an overshoot is damped to {@link #SOFT_RESISTANCE} of its size instead of clipped
     */
    public double constrainZoom(double requested, boolean soft) {
        double min = config.minZoom();
        double max = config.maxZoom();
        if (Double.isNaN(requested)) {
            return min;
        }
        if (requested > max) {
            return soft && Double.isFinite(requested) ? max + (requested - max) * SOFT_RESISTANCE : max;
        }
        if (requested < min) {
            return soft ? Math.max(min - (min - requested) * SOFT_RESISTANCE, min * (1 - SOFT_RESISTANCE)) : min;
        }
        return requested;
    }

    // ===== Focal point and priority =====

    /**
     * @return the gesture focal point in canvas space, if one is known
     */
    public synchronized Optional<Point2d> getFocalPoint() {
        return focalPoint == null ? Optional.empty() : Optional.of(new Point2d(focalPoint));
    }

    /**
     * Set the focal point directly in canvas space; null clears it.
     */
    public synchronized void setFocalPoint(Point2d canvasPoint) {
        focalPoint = canvasPoint == null ? null : new Point2d(canvasPoint);
    }

    /**
     * Priority of a tile by distance from its centre to the focal point, in units of the tile's canvas span.
     *
     * @param tileCenter tile centre in canvas space
     * @param tileSpan   tile edge length in canvas space
     */
    public synchronized TilePriority getTilePriority(Point2d tileCenter, double tileSpan) {
        if (focalPoint == null || phase == GesturePhase.IDLE || tileCenter == null || !(tileSpan > 0)) {
            return TilePriority.MEDIUM;
        }
        return TilePriority.forDistance(focalPoint.distance(tileCenter), tileSpan);
    }

    /**
     * Priority of a tile addressed by grid position on a page whose top-left corner is at {@code pageOrigin} in
     * canvas space.
     */
    public TilePriority getTilePriority(int tileX, int tileY, int tileSize, double scale, Point2d pageOrigin) {
        if (!(scale > 0) || tileSize <= 0) {
            return TilePriority.MEDIUM;
        }
        double span = tileSize / scale;
        double ox = pageOrigin == null ? 0 : pageOrigin.x;
        double oy = pageOrigin == null ? 0 : pageOrigin.y;
        return getTilePriority(new Point2d(ox + (tileX + 0.5) * span, oy + (tileY + 0.5) * span), span);
    }

    // ===== Accessors =====

    public synchronized long getEpoch() {
        return epoch;
    }

    public synchronized GesturePhase getGesturePhase() {
        return phase;
    }

    public synchronized double getZoom() {
        return zoom;
    }

    public synchronized RenderMode getRenderMode() {
        return renderMode;
    }

    /**
     * @return zoom speed of the last gesture sample in octaves per second
     */
    public synchronized double getVelocity() {
        return velocity;
    }

    public ZoomConfiguration getConfig() {
        return config;
    }

    public ScaleMath getScaleMath() {
        return scaleMath;
    }

    /**
     * @return completed-stay statistics for every phase
     */
    public synchronized Map<GesturePhase, PhaseStats> getPhaseStats() {
        return Collections.unmodifiableMap(new EnumMap<>(phaseStats));
    }

    public synchronized ZoomState getState() {
        return new ZoomState(zoom, getScale(), epoch, phase, renderMode);
    }

    // ===== Listeners and lifecycle =====

    public Subscription subscribe(ZoomScaleListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Restore the initial state: zoom, epoch, phase, focal point, velocity and statistics. Listeners stay
     * subscribed.
     */
    public synchronized void reset() {
        initialize();
        closed = false;
    }

    /**
     * Drop every listener and stop reacting to input. A closed authority can be revived with {@link #reset()}.
     */
    @Override
    public synchronized void close() {
        listeners.clear();
        closed = true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private void initialize() {
        long now = clock.millis();
        zoom = config.initialZoom();
        renderMode = RenderMode.derive(zoom, RenderMode.FULL_PAGE);
        phase = GesturePhase.IDLE;
        epoch = 0;
        phaseEnteredAt = now;
        lastGestureAt = now;
        lastZoomAt = now;
        velocity = 0;
        focalPoint = null;
        camera = new CameraSnapshot(0, 0, zoom, now);
        phaseStats.clear();
        for (var p : GesturePhase.values()) {
            phaseStats.put(p, new PhaseStats(p, 0, 0, 0));
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Zoom authority is closed");
        }
    }

    private boolean endGesture(String trigger) {
        if (!transition(GesturePhase.SETTLING, trigger, false)) {
            return false;
        }
        velocity = 0;
        return true;
    }

    private boolean beginRendering(String trigger) {
        if (!transition(GesturePhase.RENDERING, trigger, false)) {
            return false;
        }
        var tier = getScaleTier();
        for (var listener : listeners) {
            try {
                listener.onSettlingComplete(tier, zoom);
            } catch (Exception e) {
                log.error("Error in settling listener", e);
            }
        }
        return true;
    }

    private boolean transition(GesturePhase next, String trigger, boolean forced) {
        if (phase == next) {
            return false;
        }
        if (!forced && !phase.canTransitionTo(next)) {
            log.warn("Ignoring invalid phase transition {} -> {} ({})", phase, next, trigger);
            return false;
        }
        long now = clock.millis();
        long duration = Math.max(0, now - phaseEnteredAt);
        var from = phase;
        phaseStats.put(from, phaseStats.get(from).record(duration));
        phase = next;
        phaseEnteredAt = now;
        epoch++;
        log.debug("Phase {} -> {} after {}ms ({}), epoch {}", from, next, duration, trigger, epoch);
        emit(new TileTelemetryEvent.PhaseTransition(now, from, next, duration, trigger, zoom, getScale()));
        notifyStateChange();
        return true;
    }

    private void updateRenderMode() {
        var next = RenderMode.derive(zoom, renderMode);
        if (next == renderMode) {
            return;
        }
        var from = renderMode;
        renderMode = next;
        log.info("Render mode {} -> {} at zoom {}", from, next, zoom);
        emit(new TileTelemetryEvent.ModeTransition(clock.millis(), from, next, zoom, epoch));
        for (var listener : listeners) {
            try {
                listener.onRenderModeChange(from, next);
            } catch (Exception e) {
                log.error("Error in render mode listener", e);
            }
        }
    }

    private void notifyStateChange() {
        if (listeners.isEmpty()) {
            return;
        }
        var state = new ZoomState(zoom, getScale(), epoch, phase, renderMode);
        for (var listener : listeners) {
            try {
                listener.onStateChange(state);
            } catch (Exception e) {
                log.error("Error in zoom state listener", e);
            }
        }
    }

    private void emit(TileTelemetryEvent event) {
        try {
            telemetry.onEvent(event);
        } catch (Exception e) {
            log.warn("Telemetry listener failed on {}: {}", event.getClass().getSimpleName(), e.getMessage());
        }
    }
}
