/*
 * Copyright (c) 2026 Hal Hildebrand. All rights reserved.
 * This file is part of Tessera, licensed under the GNU Affero General Public License v3.0 (AGPL-3.0).
 * See LICENSE file for details.
 */

package com.hellblazer.tessera.engine;

/**
 * Sealed exception hierarchy for the tile engine.
 * <p>
 * Only conditions the caller must handle are exceptions. A stale or mismatched tile result is an ordinary outcome
 * and a tripped circuit breaker is a state change; neither is thrown.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link TileDataIntegrityException} - tile data refused at the cache admission gate</li>
 * <li>{@link ProfileLoadException} - an engine profile resource exists but cannot be read</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public sealed class TileEngineException extends RuntimeException
    permits TileEngineException.TileDataIntegrityException,
            TileEngineException.ProfileLoadException {

    public TileEngineException(String message) {
        super(message);
    }

    public TileEngineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Tile data failed validation and was not cached.
     */
    public static final class TileDataIntegrityException extends TileEngineException {

        /**
         * What was wrong with the data.
         */
        public enum Violation {
            ZERO_WIDTH, ZERO_HEIGHT, BUFFER_SIZE_MISMATCH, MISSING_DIMENSIONS
        }

        private final Violation violation;
        private final String    tileKey;

        public TileDataIntegrityException(Violation violation, String tileKey, String detail) {
            super(String.format("Tile %s rejected (%s): %s", tileKey, violation, detail));
            this.violation = violation;
            this.tileKey = tileKey;
        }

        public Violation getViolation() {
            return violation;
        }

        /**
         * @return cache key of the tile being stored, or null if the data was validated outside the cache
         */
        public String getTileKey() {
            return tileKey;
        }
    }

    /**
     * An engine profile resource is present but malformed.
     */
    public static final class ProfileLoadException extends TileEngineException {

        public ProfileLoadException(String message) {
            super(message);
        }

        public ProfileLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
