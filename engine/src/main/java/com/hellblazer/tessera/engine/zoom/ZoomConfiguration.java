/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.zoom;

/**
 * Zoom authority configuration.
 *
 * @param pixelRatio          device pixel ratio
 * @param minZoom             lower zoom bound
 * @param maxZoom             upper zoom bound
 * @param initialZoom         zoom after construction and {@code reset()}
 * @param gestureEndDelayMs   quiet time after the last gesture input before ACTIVE becomes SETTLING
 * @param settlingDelayMs     time spent SETTLING before the refresh render is dispatched
 * @param phaseWatchdogMs     longest SETTLING or RENDERING may last before being forced to IDLE
 * @param velocityThreshold   zoom speed in octaves per second above which an active gesture renders at a reduced
 *                            tier
 * @param velocityReduction   tier divisor applied while above the velocity threshold
 * @author hal.hildebrand
 */
public record ZoomConfiguration(double pixelRatio, double minZoom, double maxZoom, double initialZoom,
                                long gestureEndDelayMs, long settlingDelayMs, long phaseWatchdogMs,
                                double velocityThreshold, double velocityReduction) {

    public ZoomConfiguration {
        if (!(pixelRatio > 0) || Double.isInfinite(pixelRatio)) {
            throw new IllegalArgumentException("Pixel ratio must be positive and finite: " + pixelRatio);
        }
        if (!(minZoom > 0) || !(maxZoom >= minZoom) || Double.isInfinite(maxZoom)) {
            throw new IllegalArgumentException("Zoom bounds must satisfy 0 < min <= max: [" + minZoom + ", " + maxZoom
                                               + "]");
        }
        if (!(initialZoom >= minZoom && initialZoom <= maxZoom)) {
            throw new IllegalArgumentException("Initial zoom must be within bounds: " + initialZoom);
        }
        if (gestureEndDelayMs < 0 || settlingDelayMs < 0 || phaseWatchdogMs <= 0) {
            throw new IllegalArgumentException("Delays must be non-negative and the watchdog positive");
        }
        if (!(velocityThreshold > 0)) {
            throw new IllegalArgumentException("Velocity threshold must be positive: " + velocityThreshold);
        }
        if (!(velocityReduction >= 1) || Double.isInfinite(velocityReduction)) {
            throw new IllegalArgumentException("Velocity reduction must be >= 1: " + velocityReduction);
        }
    }

    public static ZoomConfiguration defaults() {
        return new ZoomConfiguration(2.0, 0.1, 32.0, 1.0, 300, 200, 3000, 4.0, 2.0);
    }

    public ZoomConfiguration withPixelRatio(double pixelRatio) {
        return new ZoomConfiguration(pixelRatio, minZoom, maxZoom, initialZoom, gestureEndDelayMs, settlingDelayMs,
                                     phaseWatchdogMs, velocityThreshold, velocityReduction);
    }

    public ZoomConfiguration withZoomRange(double minZoom, double maxZoom) {
        double initial = Math.min(Math.max(initialZoom, minZoom), maxZoom);
        return new ZoomConfiguration(pixelRatio, minZoom, maxZoom, initial, gestureEndDelayMs, settlingDelayMs,
                                     phaseWatchdogMs, velocityThreshold, velocityReduction);
    }

    public ZoomConfiguration withInitialZoom(double initialZoom) {
        return new ZoomConfiguration(pixelRatio, minZoom, maxZoom, initialZoom, gestureEndDelayMs, settlingDelayMs,
                                     phaseWatchdogMs, velocityThreshold, velocityReduction);
    }

    public ZoomConfiguration withTimings(long gestureEndDelayMs, long settlingDelayMs, long phaseWatchdogMs) {
        return new ZoomConfiguration(pixelRatio, minZoom, maxZoom, initialZoom, gestureEndDelayMs, settlingDelayMs,
                                     phaseWatchdogMs, velocityThreshold, velocityReduction);
    }

    public ZoomConfiguration withVelocity(double velocityThreshold, double velocityReduction) {
        return new ZoomConfiguration(pixelRatio, minZoom, maxZoom, initialZoom, gestureEndDelayMs, settlingDelayMs,
                                     phaseWatchdogMs, velocityThreshold, velocityReduction);
    }
}
