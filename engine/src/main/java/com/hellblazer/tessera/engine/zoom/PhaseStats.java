/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.zoom;

/**
 * Time spent in one gesture phase since construction or the last reset.
 *
 * @param phase   the phase
 * @param entries number of completed stays in the phase
 * @param totalMs total time of all completed stays
 * @param maxMs   longest completed stay
 */
public record PhaseStats(GesturePhase phase, long entries, long totalMs, long maxMs) {

    public double averageMs() {
        return entries == 0 ? 0.0 : (double) totalMs / entries;
    }

    PhaseStats record(long durationMs) {
        return new PhaseStats(phase, entries + 1, totalMs + durationMs, Math.max(maxMs, durationMs));
    }

    @Override
    public String toString() {
        return String.format("%s[entries=%d, avg=%.1fms, max=%dms]", phase, entries, averageMs(), maxMs);
    }
}
