/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.cache;

import java.util.Arrays;

/**
 * Tile payload as handed to and returned from the cache.
 * <p>
 * Buffers are copied on construction and on access, so neither the producer nor a reader can change what the cache
 * holds. Construction does not validate; invalid data is representable so that the admission gate can reject it.
 *
 * @author hal.hildebrand
 */
public sealed interface CachedTileData
permits CachedTileData.RawPixels, CachedTileData.EncodedImage, CachedTileData.LegacyEncoded {

    /** Bytes per RGBA pixel */
    int BYTES_PER_PIXEL = 4;

    /**
     * @return size of the held buffer in bytes
     */
    long byteSize();

    /**
     * Decoded RGBA pixels. Valid when both dimensions are positive and the buffer holds exactly
     * {@code width * height * 4} bytes.
     */
    record RawPixels(int width, int height, byte[] pixels) implements CachedTileData {
        public RawPixels {
            pixels = pixels == null ? null : pixels.clone();
        }

        public static RawPixels blank(int width, int height) {
            return new RawPixels(width, height, new byte[width * height * BYTES_PER_PIXEL]);
        }

        @Override
        public byte[] pixels() {
            return pixels == null ? null : pixels.clone();
        }

        @Override
        public long byteSize() {
            return pixels == null ? 0 : pixels.length;
        }

        public long expectedByteSize() {
            return (long) width * height * BYTES_PER_PIXEL;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RawPixels other && width == other.width && height == other.height && Arrays.equals(
            pixels, other.pixels);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * width + height) + Arrays.hashCode(pixels);
        }

        @Override
        public String toString() {
            return "RawPixels[" + width + "x" + height + ", " + byteSize() + " bytes]";
        }
    }

    /**
     * Encoded image (PNG, WebP, ...) with known dimensions.
     */
    record EncodedImage(int width, int height, byte[] blob) implements CachedTileData {
        public EncodedImage {
            blob = blob == null ? null : blob.clone();
        }

        @Override
        public byte[] blob() {
            return blob == null ? null : blob.clone();
        }

        @Override
        public long byteSize() {
            return blob == null ? 0 : blob.length;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof EncodedImage other && width == other.width && height == other.height
            && Arrays.equals(blob, other.blob);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * width + height) + Arrays.hashCode(blob);
        }

        @Override
        public String toString() {
            return "EncodedImage[" + width + "x" + height + ", " + byteSize() + " bytes]";
        }
    }

    /**
     * Encoded bytes without dimensions. Never admitted to the cache.
     */
    record LegacyEncoded(byte[] blob) implements CachedTileData {
        public LegacyEncoded {
            blob = blob == null ? null : blob.clone();
        }

        @Override
        public byte[] blob() {
            return blob == null ? null : blob.clone();
        }

        @Override
        public long byteSize() {
            return blob == null ? 0 : blob.length;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof LegacyEncoded other && Arrays.equals(blob, other.blob);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(blob);
        }

        @Override
        public String toString() {
            return "LegacyEncoded[" + byteSize() + " bytes]";
        }
    }
}
