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
package com.hellblazer.tessera.engine.integration;

import com.hellblazer.tessera.engine.TileEngineException.TileDataIntegrityException;
import com.hellblazer.tessera.engine.breaker.RejectionReason;
import com.hellblazer.tessera.engine.breaker.TileCircuitBreaker;
import com.hellblazer.tessera.engine.cache.TileCache;
import com.hellblazer.tessera.engine.cache.TileIdentity;
import com.hellblazer.tessera.engine.camera.CameraSnapshot;
import com.hellblazer.tessera.engine.telemetry.CacheLevel;
import com.hellblazer.tessera.engine.telemetry.TelemetryListener;
import com.hellblazer.tessera.engine.telemetry.TileTelemetryEvent;
import com.hellblazer.tessera.engine.zoom.ZoomScaleAuthority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Decides whether a finished render may be shown.
 * <p>
 * A result is accepted only if its epoch is within tolerance of the authority's current epoch and its scale
 * quantizes to both its own identity's tier and a tier the viewport would currently request. Accepted results are
 * cached and recorded as a breaker success; rejected results are dropped and recorded as a breaker rejection. No
 * result does both.
 *
 * @author hal.hildebrand
 */
public class TileResultIntegrator {
    private static final Logger log = LoggerFactory.getLogger(TileResultIntegrator.class);

    private final ZoomScaleAuthority authority;
    private final TileCache          cache;
    private final TileCircuitBreaker breaker;
    private final Clock              clock;
    private final TelemetryListener  telemetry;

    public TileResultIntegrator(ZoomScaleAuthority authority, TileCache cache, TileCircuitBreaker breaker, Clock clock,
                                TelemetryListener telemetry) {
        if (authority == null || cache == null || breaker == null) {
            throw new IllegalArgumentException("Authority, cache and breaker cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.authority = authority;
        this.cache = cache;
        this.breaker = breaker;
        this.clock = clock;
        this.telemetry = telemetry == null ? TelemetryListener.NOOP : telemetry;
    }

    /**
     * Scale to request renders at: the authority's current scale, reduced while the breaker is tripped.
     */
    public double resolveRequestScale() {
        double scale = authority.getScale();
        double reduction = breaker.getFallbackScaleReduction();
        if (reduction <= 1) {
            return scale;
        }
        var config = authority.getConfig();
        return authority.getScaleMath().reduceTier(scale, reduction, config.pixelRatio(), config.maxZoom());
    }

    /**
     * Identity for a new tile request at the resolved scale and the current adaptive tile size.
     */
    public TileIdentity requestTile(int page, int tileX, int tileY) {
        var params = authority.getTileParams();
        var tile = TileIdentity.of(page, tileX, tileY, resolveRequestScale(), params.tileSize(),
                                   authority.getScaleMath());
        emit(new TileTelemetryEvent.TileRequested(clock.millis(), tile.toRef()));
        return tile;
    }

    /**
     * Accept or reject a finished render.
     *
     * @throws TileDataIntegrityException if the result passes the epoch and scale checks but its data fails the
     *                                    cache's integrity gate; the breaker is not touched
     */
    public IntegrationOutcome integrate(TileRenderResult result) {
        if (result == null) {
            throw new IllegalArgumentException("Result cannot be null");
        }
        var tile = result.tile();

        if (!authority.isEpochValid(result.epoch())) {
            return reject(tile, RejectionReason.EPOCH_EXPIRED,
                          "epoch " + result.epoch() + " vs " + authority.getEpoch());
        }
        if (!isAcceptableScale(result)) {
            return reject(tile, RejectionReason.SCALE_MISMATCH,
                          "scale " + result.requestedScale() + " for tier " + tile.scale());
        }

        cache.set(tile, result.data(), CacheLevel.L1);
        breaker.recordSuccess();
        emit(new TileTelemetryEvent.RenderCompleted(clock.millis(), tile.toRef(), age(result.camera())));
        log.debug("Accepted {} at epoch {}", tile.key(), result.epoch());
        return new IntegrationOutcome.Accepted(tile);
    }

    private boolean isAcceptableScale(TileRenderResult result) {
        var scaleMath = authority.getScaleMath();
        double requested = scaleMath.scaleForCacheKey(result.requestedScale());
        if (requested != result.tile().scale()) {
            return false;
        }
        var config = authority.getConfig();
        double target = authority.getScaleTier().tier();
        double reduced = scaleMath.reduceTier(target, breaker.getConfig().fallbackReduction(), config.pixelRatio(),
                                              config.maxZoom());
        return requested == target || requested == reduced || requested == authority.getScale();
    }

    private IntegrationOutcome reject(TileIdentity tile, RejectionReason reason, String detail) {
        breaker.recordRejection(reason);
        log.debug("Rejected {} ({}): {}", tile.key(), reason.label(), detail);
        emit(new TileTelemetryEvent.TileDropped(clock.millis(), tile.toRef(), reason.label()));
        return new IntegrationOutcome.Rejected(tile, reason);
    }

    private long age(CameraSnapshot camera) {
        return Math.max(0, camera.ageMillis(clock));
    }

    private void emit(TileTelemetryEvent event) {
        try {
            telemetry.onEvent(event);
        } catch (Exception e) {
            log.warn("Telemetry listener failed on {}: {}", event.getClass().getSimpleName(), e.getMessage());
        }
    }
}
