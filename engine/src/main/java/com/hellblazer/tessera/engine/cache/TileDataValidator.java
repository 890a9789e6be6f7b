/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.cache;

import com.hellblazer.tessera.engine.TileEngineException.TileDataIntegrityException;
import com.hellblazer.tessera.engine.TileEngineException.TileDataIntegrityException.Violation;

import java.util.Optional;

/**
 * Admission gate for tile data. A tile with zero or missing dimensions, or a pixel buffer whose length disagrees
 * with its dimensions, would paint as a blank or sheared tile and must never reach the cache.
 *
 * @author hal.hildebrand
 */
public final class TileDataValidator {

    private TileDataValidator() {
    }

    /**
     * @return the first violation found, or empty if the data may be cached
     */
    public static Optional<Violation> check(CachedTileData data) {
        if (data == null) {
            return Optional.of(Violation.MISSING_DIMENSIONS);
        }
        if (data instanceof CachedTileData.RawPixels raw) {
            var dims = checkDimensions(raw.width(), raw.height());
            if (dims.isPresent()) {
                return dims;
            }
            if (raw.byteSize() != raw.expectedByteSize()) {
                return Optional.of(Violation.BUFFER_SIZE_MISMATCH);
            }
            return Optional.empty();
        }
        if (data instanceof CachedTileData.EncodedImage encoded) {
            return checkDimensions(encoded.width(), encoded.height());
        }
        return Optional.of(Violation.MISSING_DIMENSIONS);
    }

    /**
     * @throws TileDataIntegrityException if the data fails {@link #check(CachedTileData)}
     */
    public static void validate(CachedTileData data, String tileKey) {
        var violation = check(data);
        if (violation.isPresent()) {
            throw new TileDataIntegrityException(violation.get(), tileKey, describe(violation.get(), data));
        }
    }

    private static Optional<Violation> checkDimensions(int width, int height) {
        if (width <= 0) {
            return Optional.of(Violation.ZERO_WIDTH);
        }
        if (height <= 0) {
            return Optional.of(Violation.ZERO_HEIGHT);
        }
        return Optional.empty();
    }

    private static String describe(Violation violation, CachedTileData data) {
        return switch (violation) {
            case ZERO_WIDTH, ZERO_HEIGHT -> "non-positive dimension in " + data;
            case BUFFER_SIZE_MISMATCH -> {
                var raw = (CachedTileData.RawPixels) data;
                yield "expected " + raw.expectedByteSize() + " bytes, got " + raw.byteSize();
            }
            case MISSING_DIMENSIONS -> "no dimensions in " + data;
        };
    }
}
