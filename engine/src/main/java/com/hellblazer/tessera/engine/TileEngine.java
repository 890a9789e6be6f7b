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
package com.hellblazer.tessera.engine;

import com.hellblazer.tessera.engine.breaker.TileCircuitBreaker;
import com.hellblazer.tessera.engine.cache.CacheConfiguration;
import com.hellblazer.tessera.engine.cache.TileCache;
import com.hellblazer.tessera.engine.config.EngineProfile;
import com.hellblazer.tessera.engine.integration.TileResultIntegrator;
import com.hellblazer.tessera.engine.scale.ScaleConfiguration;
import com.hellblazer.tessera.engine.scale.ScaleMath;
import com.hellblazer.tessera.engine.telemetry.TelemetryDispatcher;
import com.hellblazer.tessera.engine.zoom.RenderMode;
import com.hellblazer.tessera.engine.zoom.ZoomConfiguration;
import com.hellblazer.tessera.engine.zoom.ZoomScaleAuthority;
import com.hellblazer.tessera.engine.zoom.ZoomScaleListener;
import com.hellblazer.tessera.engine.zoom.ZoomState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * One viewport's tile engine: scale math, zoom authority, tile cache, circuit breaker, result integrator and
 * telemetry dispatcher, all owned by this instance. Nothing is global; two engines share no state.
 * <p>
 * The engine wires the cache to the authority: a render mode change clears the hot cache level, and a zoom change
 * runs the cache's zoom eviction against the new target tier.
 * <p>
 * Example usage:
 * <pre>
 * try (var engine = TileEngine.builder().clock(clock).build()) {
 *     engine.authority().onZoomGesture(4.0, focal, camera);
 *     var tile = engine.integrator().requestTile(0, 3, 5);
 *     ...
 *     engine.integrator().integrate(result);
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class TileEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TileEngine.class);

    private final ScaleMath                       scaleMath;
    private final TelemetryDispatcher             telemetry;
    private final ZoomScaleAuthority              authority;
    private final TileCache                       cache;
    private final TileCircuitBreaker              breaker;
    private final TileResultIntegrator            integrator;
    private final CacheMaintenance                cacheMaintenance;
    private final ZoomScaleAuthority.Subscription cacheSubscription;

    private TileEngine(Builder builder) {
        this.scaleMath = new ScaleMath(builder.scaleConfig);
        this.telemetry = new TelemetryDispatcher();
        this.authority = new ZoomScaleAuthority(builder.zoomConfig, scaleMath, builder.clock, telemetry);
        this.cache = new TileCache(builder.cacheConfig, scaleMath, builder.clock, telemetry);
        this.breaker = new TileCircuitBreaker(builder.breakerConfig);
        this.integrator = new TileResultIntegrator(authority, cache, breaker, builder.clock, telemetry);
        this.cacheMaintenance = new CacheMaintenance();
        this.cacheSubscription = authority.subscribe(cacheMaintenance);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ScaleMath scaleMath() {
        return scaleMath;
    }

    public TelemetryDispatcher telemetry() {
        return telemetry;
    }

    public ZoomScaleAuthority authority() {
        return authority;
    }

    public TileCache cache() {
        return cache;
    }

    public TileCircuitBreaker breaker() {
        return breaker;
    }

    public TileResultIntegrator integrator() {
        return integrator;
    }

    /**
     * Restore every component to its freshly built state. Telemetry listeners stay registered.
     */
    public void reset() {
        authority.reset();
        cache.reset();
        breaker.reset();
        cacheMaintenance.lastZoom = authority.getZoom();
        log.debug("Tile engine reset");
    }

    /**
     * Detach the cache from the authority, close the authority and drop telemetry listeners.
     */
    @Override
    public void close() {
        cacheSubscription.close();
        authority.close();
        telemetry.clear();
        log.debug("Tile engine closed");
    }

    /**
     * Keeps the cache consistent with the viewport.
     */
    private class CacheMaintenance implements ZoomScaleListener {
        private double lastZoom = authority.getZoom();

        @Override
        public void onStateChange(ZoomState state) {
            if (state.zoom() != lastZoom) {
                cache.onZoomChange(state.zoom() / lastZoom, authority.getScaleTier().tier());
                lastZoom = state.zoom();
            }
        }

        @Override
        public void onRenderModeChange(RenderMode from, RenderMode to) {
            cache.onModeTransition();
        }
    }

    public static class Builder {
        private ScaleConfiguration         scaleConfig   = ScaleConfiguration.defaultConfig();
        private ZoomConfiguration          zoomConfig    = ZoomConfiguration.defaults();
        private CacheConfiguration         cacheConfig   = CacheConfiguration.defaults();
        private TileCircuitBreaker.Config  breakerConfig = TileCircuitBreaker.Config.defaults();
        private Clock                      clock         = Clock.systemUTC();

        private Builder() {
        }

        public Builder scaleConfig(ScaleConfiguration scaleConfig) {
            this.scaleConfig = scaleConfig;
            return this;
        }

        public Builder zoomConfig(ZoomConfiguration zoomConfig) {
            this.zoomConfig = zoomConfig;
            return this;
        }

        public Builder cacheConfig(CacheConfiguration cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder breakerConfig(TileCircuitBreaker.Config breakerConfig) {
            this.breakerConfig = breakerConfig;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Apply a device profile's scale, cache and breaker limits.
         */
        public Builder profile(EngineProfile profile) {
            if (profile == null) {
                throw new IllegalArgumentException("Profile cannot be null");
            }
            this.scaleConfig = profile.scaleConfiguration();
            this.cacheConfig = profile.cacheConfiguration();
            this.breakerConfig = profile.breakerConfig();
            return this;
        }

        public TileEngine build() {
            if (scaleConfig == null || zoomConfig == null || cacheConfig == null || breakerConfig == null) {
                throw new IllegalArgumentException("Configurations cannot be null");
            }
            if (clock == null) {
                throw new IllegalArgumentException("Clock cannot be null");
            }
            return new TileEngine(this);
        }
    }
}
