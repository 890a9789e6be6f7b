/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.cache;

/**
 * Per-page metadata kept in the L3 level.
 *
 * @param page         page index
 * @param width        page width in page units
 * @param height       page height in page units
 * @param hasTextLayer whether a text layer is available for the page
 */
public record PageMetadata(int page, double width, double height, boolean hasTextLayer) {

    public PageMetadata {
        if (page < 0) {
            throw new IllegalArgumentException("Page must be non-negative: " + page);
        }
        if (!(width > 0) || !(height > 0)) {
            throw new IllegalArgumentException("Page dimensions must be positive: " + width + "x" + height);
        }
    }
}
