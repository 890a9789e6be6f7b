/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.camera;

import javax.vecmath.Point2d;

/**
 * Screen/canvas affine transform. Screen coordinates are viewport pixels with (0,0) at the top left; canvas
 * coordinates are positions on the unbounded document canvas.
 * <p>
 * All methods return new points and never modify their arguments.
 *
 * @author hal.hildebrand
 */
public final class CoordinateTransform {

    private CoordinateTransform() {
    }

    /**
     * @return canvas point {@code (s.x / zoom - x, s.y / zoom - y)}
     */
    public static Point2d screenToCanvas(Point2d screen, CameraView camera) {
        double z = camera.zoom();
        return new Point2d(screen.x / z - camera.x(), screen.y / z - camera.y());
    }

    /**
     * @return screen point {@code ((c.x + x) * zoom, (c.y + y) * zoom)}
     */
    public static Point2d canvasToScreen(Point2d canvas, CameraView camera) {
        double z = camera.zoom();
        return new Point2d((canvas.x + camera.x()) * z, (canvas.y + camera.y()) * z);
    }
}
