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

/**
 * Where the viewport is in the interact-then-settle cycle.
 * <p>
 * Legal transitions:
 * <pre>
 * IDLE      -> ACTIVE      gesture starts
 * ACTIVE    -> SETTLING    gesture input stops, tile refresh pending
 * SETTLING  -> ACTIVE      gesture resumes before the settle completes
 * SETTLING  -> RENDERING   refresh dispatched
 * RENDERING -> IDLE        dispatched render accepted
 * RENDERING -> ACTIVE      new gesture input interrupts the render
 * any       -> IDLE        forced (watchdog, teardown)
 * </pre>
 *
 * @author hal.hildebrand
 */
public enum GesturePhase {
    IDLE, ACTIVE, SETTLING, RENDERING;

    /**
     * @return true if the ordinary (non-forced) transition from this phase to {@code next} is legal
     */
    public boolean canTransitionTo(GesturePhase next) {
        return switch (this) {
            case IDLE -> next == ACTIVE;
            case ACTIVE -> next == SETTLING;
            case SETTLING -> next == ACTIVE || next == RENDERING;
            case RENDERING -> next == IDLE || next == ACTIVE;
        };
    }

    /**
     * @return true while a gesture is in progress or winding down
     */
    public boolean isGestureActive() {
        return this == ACTIVE || this == SETTLING;
    }

    /**
     * @return true when a fresh render may be dispatched
     */
    public boolean canRender() {
        return this == IDLE || this == RENDERING;
    }
}
