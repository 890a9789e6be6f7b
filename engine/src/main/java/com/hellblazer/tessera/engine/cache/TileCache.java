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
package com.hellblazer.tessera.engine.cache;

import com.hellblazer.tessera.engine.TileEngineException.TileDataIntegrityException;
import com.hellblazer.tessera.engine.scale.ScaleMath;
import com.hellblazer.tessera.engine.telemetry.CacheLevel;
import com.hellblazer.tessera.engine.telemetry.EvictionReason;
import com.hellblazer.tessera.engine.telemetry.TelemetryListener;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent.FallbackReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Three-level tile cache with an integrity gate on admission.
 * <ul>
 * <li>L1: hot tiles for the current viewport, entry-bounded</li>
 * <li>L2: every admitted tile, bounded by entries and bytes; the source of fallbacks</li>
 * <li>L3: per-page metadata</li>
 * </ul>
 * Nothing enters L1 or L2 without passing {@link TileDataValidator}. A rejected tile throws
 * {@link TileDataIntegrityException}, increments the violation counter exactly once and leaves the cache as it was.
 * <p>
 * All levels are guarded by a single {@link ReentrantReadWriteLock}, so admission, clearing and a document switch
 * are atomic to every observer. Lookups take the write lock because they reorder the LRU lists. Every entry that
 * leaves a level is reported as an {@link TileTelemetryEvent.Eviction} with its reason.
 *
 * @author hal.hildebrand
 */
public class TileCache {
    private static final Logger log = LoggerFactory.getLogger(TileCache.class);

    /** Tile sizes a fallback may have been rendered at, preferred first. */
    public static final int[] FALLBACK_TILE_SIZES = { 512, 256, 128 };

    /** Zoom ratios strictly inside these bounds do not trigger zoom eviction. */
    public static final double ZOOM_OUT_RATIO = 0.67;
    public static final double ZOOM_IN_RATIO  = 1.5;

    /** L1 tiles further than this factor from the target scale are evicted on a significant zoom. */
    public static final double L1_SCALE_DIFF_LIMIT  = 3.0;
    /** On zoom out, L2 tiles above this multiple of the target are evicted. */
    public static final double L2_ZOOM_OUT_LIMIT    = 2.0;
    /** The tighter zoom-out limit used when L2 is nearly full. */
    public static final double L2_ZOOM_OUT_LIMIT_HI = 1.5;
    public static final double L2_NEARLY_FULL       = 0.8;

    /**
     * Cache statistics snapshot.
     */
    public record CacheStats(int l1Count, long l1Bytes, int l2Count, long l2Bytes, int l3Count, long hits,
                             long misses, long integrityViolations, Map<EvictionReason, Long> evictions) {
        public CacheStats {
            evictions = Map.copyOf(evictions);
        }

        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }

        public long evictions(EvictionReason reason) {
            return evictions.getOrDefault(reason, 0L);
        }

        @Override
        public String toString() {
            return String.format(
            "TileCache[L1=%d (%,d bytes), L2=%d (%,d bytes), L3=%d, hits=%d, misses=%d, hitRate=%.1f%%, violations=%d]",
            l1Count, l1Bytes, l2Count, l2Bytes, l3Count, hits, misses, hitRate() * 100, integrityViolations);
        }
    }

    private final CacheConfiguration          config;
    private final ScaleMath                   scaleMath;
    private final Clock                       clock;
    private final TelemetryListener           telemetry;
    private final ReadWriteLock               lock       = new ReentrantReadWriteLock();
    private final TileLevel                   l1;
    private final TileLevel                   l2;
    private final Map<Integer, PageMetadata>  l3         = new HashMap<>();
    private final Map<EvictionReason, Long>   evictions  = new EnumMap<>(EvictionReason.class);
    private final AtomicLong                  hits       = new AtomicLong();
    private final AtomicLong                  misses     = new AtomicLong();
    private final AtomicLong                  violations = new AtomicLong();

    private volatile TilePriorityFunction priorityFunction;
    private String                        documentId;

    public TileCache(ScaleMath scaleMath, Clock clock) {
        this(CacheConfiguration.defaults(), scaleMath, clock, TelemetryListener.NOOP);
    }

    public TileCache(CacheConfiguration config, ScaleMath scaleMath, Clock clock, TelemetryListener telemetry) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        if (scaleMath == null) {
            throw new IllegalArgumentException("Scale math cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.config = config;
        this.scaleMath = scaleMath;
        this.clock = clock;
        this.telemetry = telemetry == null ? TelemetryListener.NOOP : telemetry;
        this.l1 = new TileLevel(CacheLevel.L1, config.l1MaxEntries(), Long.MAX_VALUE, this::evicted);
        this.l2 = new TileLevel(CacheLevel.L2, config.l2MaxEntries(), config.l2MaxBytes(), this::evicted);
    }

    // ===== Admission and lookup =====

    /**
     * Validate and store a tile. It always goes to L2, and also to L1 when {@code level} is L1. A tile larger than
     * the current L2 byte budget is refused and the cache is left as it was.
     *
     * @return true if the tile was stored, false if it cannot fit in L2
     * @throws TileDataIntegrityException if the data fails validation; nothing is stored
     */
    public boolean set(TileIdentity requested, CachedTileData data, CacheLevel level) {
        if (requested == null) {
            throw new IllegalArgumentException("Tile cannot be null");
        }
        if (level == null || level == CacheLevel.L3) {
            throw new IllegalArgumentException("Tiles are stored in L1 or L2, not L3");
        }
        var tile = cacheKeyOf(requested);
        try {
            TileDataValidator.validate(data, tile.key());
        } catch (TileDataIntegrityException e) {
            violations.incrementAndGet();
            log.warn("Rejected tile {}: {}", tile.key(), e.getViolation());
            throw e;
        }

        lock.writeLock().lock();
        try {
            if (!l2.fits(data)) {
                log.warn("Refused {}: {} bytes exceeds the L2 budget of {} bytes", tile.key(), data.byteSize(),
                         l2.maxBytes());
                return false;
            }
            l2.put(tile, data);
            if (level == CacheLevel.L1) {
                l1.put(tile, data);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Stored {} in {} ({} bytes)", tile.key(), level, data.byteSize());
        emit(new TileTelemetryEvent.CacheStored(clock.millis(), tile.toRef(), level, data.byteSize()));
        return true;
    }

    public boolean has(TileIdentity requested) {
        var tile = cacheKeyOf(requested);
        lock.readLock().lock();
        try {
            return l1.contains(tile) || l2.contains(tile);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Look up a tile in L1, then L2. An L2 hit is promoted to L1.
     */
    public Optional<CachedTileData> getCachedData(TileIdentity requested) {
        var tile = cacheKeyOf(requested);
        CacheLevel hitLevel;
        CachedTileData data;
        lock.writeLock().lock();
        try {
            data = l1.get(tile);
            hitLevel = CacheLevel.L1;
            if (data == null) {
                data = l2.get(tile);
                hitLevel = CacheLevel.L2;
                if (data != null) {
                    l1.put(tile, data);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (data == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        emit(new TileTelemetryEvent.CacheHit(clock.millis(), tile.toRef(), hitLevel));
        return Optional.of(data);
    }

    /**
     * Cache key for a tile at a raw scale, quantized the same way the request path quantizes it.
     */
    public String getTileKey(int page, int tileX, int tileY, double rawScale, int tileSize) {
        return TileIdentity.of(page, tileX, tileY, rawScale, tileSize, scaleMath).key();
    }

    /**
     * The exact tile if cached, otherwise the closest cached tile covering the same page position. Higher tiers are
     * searched first, nearest first, since downscaling a sharp tile looks better than upscaling a blurry one; then
     * lower tiers, nearest first. Each tier is tried at every tile size in {@link #FALLBACK_TILE_SIZES}.
     */
    public Optional<FallbackTile> getBestAvailable(TileIdentity requested) {
        var tile = cacheKeyOf(requested);
        var exact = getCachedData(tile);
        if (exact.isPresent()) {
            return Optional.of(new FallbackTile(tile, tile, exact.get(), 1.0));
        }

        double[] tiers = scaleMath.tiers();
        double pageX = tile.tileX() * tile.pageSpan();
        double pageY = tile.tileY() * tile.pageSpan();
        Optional<FallbackTile> found = Optional.empty();

        lock.writeLock().lock();
        try {
            for (int i = 0; i < tiers.length && found.isEmpty(); i++) {
                if (tiers[i] > tile.scale()) {
                    found = findCovering(tile, tiers[i], pageX, pageY);
                }
            }
            for (int i = tiers.length - 1; i >= 0 && found.isEmpty(); i--) {
                if (tiers[i] < tile.scale()) {
                    found = findCovering(tile, tiers[i], pageX, pageY);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        found.ifPresent(fallback -> {
            log.debug("Fallback for {}: {} (stretch {})", tile.key(), fallback.source().key(),
                      fallback.cssStretch());
            emit(new TileTelemetryEvent.FallbackUsed(clock.millis(), tile.toRef(), fallback.source().toRef(),
                                                     tile.scale(), fallback.source().scale(),
                                                     fallback.cssStretch(), FallbackReason.NOT_CACHED));
        });
        return found;
    }

    /**
     * @return every tier at which this grid position is cached for the tile size, ascending
     */
    public List<Double> getCachedScales(int page, int tileX, int tileY, int tileSize) {
        var result = new ArrayList<Double>();
        lock.readLock().lock();
        try {
            for (var tier : scaleMath.tiers()) {
                var tile = new TileIdentity(page, tileX, tileY, tier, tileSize);
                if (l1.contains(tile) || l2.contains(tile)) {
                    result.add(tier);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return result;
    }

    /**
     * @return highest cached tier for the grid position, or 0 if none
     */
    public double getHighestCachedScale(int page, int tileX, int tileY, int tileSize) {
        var scales = getCachedScales(page, tileX, tileY, tileSize);
        return scales.isEmpty() ? 0 : scales.get(scales.size() - 1);
    }

    // ===== Eviction policies =====

    /**
     * Evict every tile of a page from L1 and L2.
     *
     * @return number of distinct tiles removed
     */
    public int evictTilesForPage(int page) {
        lock.writeLock().lock();
        try {
            var removed = new HashSet<TileIdentity>();
            for (var level : List.of(l1, l2)) {
                for (var tile : level.keys()) {
                    if (tile.page() == page && level.remove(tile, EvictionReason.MANUAL)) {
                        removed.add(tile);
                    }
                }
            }
            return removed.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * React to a zoom change. Ratios inside {@code (0.67, 1.5)} are ignored. Otherwise L1 tiles more than 3x away
     * from the target scale are evicted, and on a zoom out L2 tiles above 2x the target (1.5x when L2 is nearly
     * full) are evicted too.
     *
     * @param zoomRatio   new zoom divided by old zoom
     * @param targetScale tier the new zoom renders at
     * @return number of evictions
     */
    public int onZoomChange(double zoomRatio, double targetScale) {
        if (!(zoomRatio > 0) || !(targetScale > 0) || (zoomRatio > ZOOM_OUT_RATIO && zoomRatio < ZOOM_IN_RATIO)) {
            return 0;
        }
        lock.writeLock().lock();
        try {
            int evicted = l1.removeIf(
            tile -> Math.max(tile.scale() / targetScale, targetScale / tile.scale()) > L1_SCALE_DIFF_LIMIT,
            EvictionReason.ZOOM_CHANGE);
            if (zoomRatio < ZOOM_OUT_RATIO) {
                double limit = (l2NearlyFull() ? L2_ZOOM_OUT_LIMIT_HI : L2_ZOOM_OUT_LIMIT) * targetScale;
                evicted += l2.removeIf(tile -> tile.scale() > limit, EvictionReason.ZOOM_CHANGE);
            }
            log.debug("Zoom change {}x to scale {}: evicted {}, L1={}, L2={}", zoomRatio, targetScale, evicted,
                      l1.size(), l2.size());
            return evicted;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Render mode changed: the hot level no longer matches the viewport.
     */
    public int onModeTransition() {
        lock.writeLock().lock();
        try {
            return l1.clear(EvictionReason.MODE_TRANSITION);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Shrink the cache in response to memory pressure. With a priority function installed the least urgent tiles
     * go first, drawn from L2 alone under MODERATE and from both levels above it; without one L1 is cleared from
     * HIGH upward. L2 limits drop to the level's fraction of the
     * configured limits. {@link MemoryPressure#NONE} restores them.
     *
     * @return number of evictions
     */
    public int handleMemoryPressure(MemoryPressure pressure) {
        if (pressure == null) {
            throw new IllegalArgumentException("Pressure cannot be null");
        }
        if (!pressure.shouldEvict()) {
            restoreCacheLimits();
            return 0;
        }
        lock.writeLock().lock();
        try {
            int evicted = 0;
            var priority = priorityFunction;
            if (priority != null) {
                var levels = pressure == MemoryPressure.MODERATE ? List.of(l2) : List.of(l1, l2);
                int population = levels.stream().mapToInt(TileLevel::size).sum();
                evicted += evictByPriority(priority, levels,
                                           (int) (population * pressure.getPriorityEvictionFraction()));
            } else if (pressure.clearsL1()) {
                evicted += l1.clear(EvictionReason.MEMORY_PRESSURE);
            }
            int maxEntries = Math.max(1, (int) (config.l2MaxEntries() * pressure.getL2Fraction()));
            long maxBytes = Math.max(1, (long) (config.l2MaxBytes() * pressure.getL2Fraction()));
            evicted += l2.resize(maxEntries, maxBytes, EvictionReason.MEMORY_PRESSURE);
            log.info("Memory pressure {}: L2 limited to {} entries / {} bytes, evicted {}", pressure, maxEntries,
                     maxBytes, evicted);
            return evicted;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Restore the configured L2 limits after pressure subsides.
     */
    public void restoreCacheLimits() {
        lock.writeLock().lock();
        try {
            l2.resize(config.l2MaxEntries(), config.l2MaxBytes(), EvictionReason.MEMORY_PRESSURE);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Install the function ranking tiles for pressure eviction; null removes it.
     */
    public void setPriorityFunction(TilePriorityFunction priorityFunction) {
        this.priorityFunction = priorityFunction;
    }

    /**
     * Switch documents. Tile keys carry no document id, so a switch clears every level atomically.
     *
     * @return true if the document changed
     */
    public boolean setDocument(String docId) {
        lock.writeLock().lock();
        try {
            if (Objects.equals(documentId, docId)) {
                return false;
            }
            int evicted = clearAll(EvictionReason.DOCUMENT_SWITCH);
            log.info("Document switched {} -> {}, cleared {} tiles", documentId, docId, evicted);
            documentId = docId;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<String> getDocumentId() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(documentId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Clear every level.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            clearAll(EvictionReason.MANUAL);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ===== L3 =====

    /**
     * @return false if page metadata retention is disabled
     */
    public boolean setPageMetadata(PageMetadata metadata) {
        if (metadata == null) {
            throw new IllegalArgumentException("Metadata cannot be null");
        }
        if (!config.l3Enabled()) {
            return false;
        }
        lock.writeLock().lock();
        try {
            l3.put(metadata.page(), metadata);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<PageMetadata> getPageMetadata(int page) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(l3.get(page));
        } finally {
            lock.readLock().unlock();
        }
    }

    // ===== Stats and lifecycle =====

    public CacheStats getStats() {
        lock.readLock().lock();
        try {
            synchronized (evictions) {
                return new CacheStats(l1.size(), l1.bytes(), l2.size(), l2.bytes(), l3.size(), hits.get(),
                                      misses.get(), violations.get(), evictions);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getIntegrityViolations() {
        return violations.get();
    }

    public CacheConfiguration getConfig() {
        return config;
    }

    /**
     * Restore the freshly constructed state: empty levels, configured limits, zeroed counters, no document and no
     * priority function. Counters are zeroed after the levels are cleared.
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            clearAll(EvictionReason.MANUAL);
            l2.resize(config.l2MaxEntries(), config.l2MaxBytes(), EvictionReason.MEMORY_PRESSURE);
            documentId = null;
            priorityFunction = null;
            hits.set(0);
            misses.set(0);
            violations.set(0);
            synchronized (evictions) {
                evictions.clear();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Optional<FallbackTile> findCovering(TileIdentity requested, double tier, double pageX, double pageY) {
        for (var tileSize : FALLBACK_TILE_SIZES) {
            double span = tileSize / tier;
            var candidate = new TileIdentity(requested.page(), (int) Math.floor(pageX / span),
                                             (int) Math.floor(pageY / span), tier, tileSize);
            var data = l1.get(candidate);
            if (data == null) {
                data = l2.get(candidate);
            }
            if (data != null) {
                return Optional.of(new FallbackTile(requested, candidate, data, requested.scale() / tier));
            }
        }
        return Optional.empty();
    }

    private int evictByPriority(TilePriorityFunction priority, List<TileLevel> levels, int count) {
        record Candidate(TileLevel level, TileIdentity tile, int rank) {
        }
        var candidates = new ArrayList<Candidate>();
        for (var level : levels) {
            for (var tile : level.keys()) {
                var p = priority.priorityOf(tile);
                candidates.add(new Candidate(level, tile, p == null ? Integer.MAX_VALUE : p.ordinal()));
            }
        }
        // least urgent first; the sort is stable so LRU order breaks ties
        candidates.sort(Comparator.comparingInt(Candidate::rank).reversed());
        int evicted = 0;
        for (var candidate : candidates) {
            if (evicted >= count) {
                break;
            }
            if (candidate.level().remove(candidate.tile(), EvictionReason.MEMORY_PRESSURE)) {
                evicted++;
            }
        }
        return evicted;
    }

    /**
     * The identity with its scale quantized the way the request path quantizes it.
     */
    private TileIdentity cacheKeyOf(TileIdentity tile) {
        if (tile == null) {
            throw new IllegalArgumentException("Tile cannot be null");
        }
        double scale = scaleMath.scaleForCacheKey(tile.scale());
        return scale == tile.scale() ? tile : tile.withScale(scale, tile.tileSize());
    }

    private int clearAll(EvictionReason reason) {
        int evicted = l1.clear(reason) + l2.clear(reason);
        l3.clear();
        return evicted;
    }

    private boolean l2NearlyFull() {
        return l2.size() > l2.maxEntries() * L2_NEARLY_FULL || l2.bytes() > l2.maxBytes() * L2_NEARLY_FULL;
    }

    private void evicted(CacheLevel level, TileIdentity tile, CachedTileData data, EvictionReason reason) {
        synchronized (evictions) {
            evictions.merge(reason, 1L, Long::sum);
        }
        log.debug("Evicted {} from {} ({})", tile.key(), level, reason.label());
        emit(new TileTelemetryEvent.Eviction(clock.millis(), tile.toRef(), level, reason, data.byteSize()));
    }

    private void emit(TileTelemetryEvent event) {
        try {
            telemetry.onEvent(event);
        } catch (Exception e) {
            log.warn("Telemetry listener failed on {}: {}", event.getClass().getSimpleName(), e.getMessage());
        }
    }
}
