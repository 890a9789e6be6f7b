/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.tessera.engine.cache;

import com.hellblazer.tessera.engine.telemetry.CacheLevel;
import com.hellblazer.tessera.engine.telemetry.EvictionReason;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * One LRU level of the tile cache, bounded by entry count and optionally by bytes.
 * <p>
 * Not thread-safe: {@link TileCache} guards every level with its own lock. {@link #get} reorders the access list,
 * so it needs the write lock.
 *
 * @author hal.hildebrand
 */
class TileLevel {

    /**
     * Receives every entry that leaves the level, whatever the reason.
     */
    @FunctionalInterface
    interface EvictionHandler {
        void onEvicted(CacheLevel level, TileIdentity tile, CachedTileData data, EvictionReason reason);
    }

    private static final float LOAD_FACTOR = 0.75f;

    private final CacheLevel                               level;
    private final LinkedHashMap<TileIdentity, CachedTileData> entries;
    private final EvictionHandler                          onEvict;

    private int  maxEntries;
    private long maxBytes;
    private long bytes;

    /**
     * @param maxBytes byte budget, or {@code Long.MAX_VALUE} for none
     */
    TileLevel(CacheLevel level, int maxEntries, long maxBytes, EvictionHandler onEvict) {
        this.level = level;
        this.maxEntries = maxEntries;
        this.maxBytes = maxBytes;
        this.onEvict = onEvict;
        // access-order for LRU
        this.entries = new LinkedHashMap<>((int) (maxEntries / LOAD_FACTOR) + 1, LOAD_FACTOR, true);
    }

    /**
     * Lookup that marks the entry most recently used.
     */
    CachedTileData get(TileIdentity tile) {
        return entries.get(tile);
    }

    boolean contains(TileIdentity tile) {
        return entries.containsKey(tile);
    }

    /**
     * @return true if the data fits within the byte budget on its own
     */
    boolean fits(CachedTileData data) {
        return data.byteSize() <= maxBytes;
    }

    /**
     * Insert or replace, then evict least recently used entries until both limits hold again. Data that can never
     * fit is refused without touching the level, so the new entry is never the one trimmed.
     *
     * @return false if the data was refused
     */
    boolean put(TileIdentity tile, CachedTileData data) {
        if (!fits(data)) {
            return false;
        }
        var previous = entries.put(tile, data);
        if (previous != null) {
            bytes -= previous.byteSize();
        }
        bytes += data.byteSize();
        trim(EvictionReason.LRU);
        return true;
    }

    boolean remove(TileIdentity tile, EvictionReason reason) {
        var removed = entries.remove(tile);
        if (removed == null) {
            return false;
        }
        bytes -= removed.byteSize();
        onEvict.onEvicted(level, tile, removed, reason);
        return true;
    }

    int removeIf(Predicate<TileIdentity> filter, EvictionReason reason) {
        int removed = 0;
        for (var tile : keys()) {
            if (filter.test(tile) && remove(tile, reason)) {
                removed++;
            }
        }
        return removed;
    }

    int clear(EvictionReason reason) {
        return removeIf(tile -> true, reason);
    }

    /**
     * Change the limits, evicting least recently used entries if the level no longer fits.
     */
    int resize(int maxEntries, long maxBytes, EvictionReason reason) {
        this.maxEntries = maxEntries;
        this.maxBytes = maxBytes;
        return trim(reason);
    }

    /**
     * @return snapshot of the keys, least recently used first
     */
    List<TileIdentity> keys() {
        return new ArrayList<>(entries.keySet());
    }

    int size() {
        return entries.size();
    }

    long bytes() {
        return bytes;
    }

    int maxEntries() {
        return maxEntries;
    }

    long maxBytes() {
        return maxBytes;
    }

    CacheLevel level() {
        return level;
    }

    private int trim(EvictionReason reason) {
        int evicted = 0;
        var it = entries.entrySet().iterator();
        while ((entries.size() > maxEntries || bytes > maxBytes) && it.hasNext()) {
            Map.Entry<TileIdentity, CachedTileData> eldest = it.next();
            it.remove();
            bytes -= eldest.getValue().byteSize();
            onEvict.onEvicted(level, eldest.getKey(), eldest.getValue(), reason);
            evicted++;
        }
        return evicted;
    }
}
