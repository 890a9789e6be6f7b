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
package com.hellblazer.tessera.engine.camera;

import javax.vecmath.Point2d;

/**
 * Live, mutable viewport camera owned by the viewport controller. Anything that must outlive the current frame
 * takes a {@link CameraSnapshot} instead of holding on to this object.
 *
 * @author hal.hildebrand
 */
public class CameraState implements CameraView {

    private double x;
    private double y;
    private double zoom;

    public CameraState() {
        this(0, 0, 1);
    }

    public CameraState(double x, double y, double zoom) {
        set(x, y, zoom);
    }

    @Override
    public double x() {
        return x;
    }

    @Override
    public double y() {
        return y;
    }

    @Override
    public double zoom() {
        return zoom;
    }

    public void set(double x, double y, double zoom) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("Camera position must be finite");
        }
        if (!(zoom > 0) || Double.isInfinite(zoom)) {
            throw new IllegalArgumentException("Camera zoom must be positive and finite: " + zoom);
        }
        this.x = x;
        this.y = y;
        this.zoom = zoom;
    }

    public void setPosition(double x, double y) {
        set(x, y, zoom);
    }

    public void setZoom(double zoom) {
        set(x, y, zoom);
    }

    /**
     * Pan by a screen-space delta. At higher zoom the same finger movement covers less canvas.
     *
     * @param dx screen pixels moved horizontally
     * @param dy screen pixels moved vertically
     */
    public void pan(double dx, double dy) {
        setPosition(x - dx / zoom, y - dy / zoom);
    }

    /**
     * Zoom multiplicatively ({@code zoom *= 1 - delta}) while keeping the canvas point under {@code screenPoint}
     * stationary on screen.
     *
     * @param screenPoint focal point in screen coordinates
     * @param delta       zoom delta; negative zooms in
     * @param minZoom     lower zoom bound
     * @param maxZoom     upper zoom bound
     * @return true if the camera changed
     */
    public boolean zoomToPoint(Point2d screenPoint, double delta, double minZoom, double maxZoom) {
        double newZoom = Math.min(Math.max(zoom * (1 - delta), minZoom), maxZoom);
        if (newZoom == zoom) {
            return false;
        }
        var before = CoordinateTransform.screenToCanvas(screenPoint, this);
        double afterX = screenPoint.x / newZoom - x;
        double afterY = screenPoint.y / newZoom - y;
        set(x + (afterX - before.x), y + (afterY - before.y), newZoom);
        return true;
    }

    @Override
    public String toString() {
        return String.format("Camera[x=%.2f, y=%.2f, zoom=%.3f]", x, y, zoom);
    }
}
