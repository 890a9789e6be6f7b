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
package com.hellblazer.tessera.engine.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.tessera.engine.TileEngineException.ProfileLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Loads engine profiles from a JSON classpath resource.
 * <p>
 * Format:
 * <pre>
 * {
 *   "schema_version": 1,
 *   "profiles": {
 *     "medium": { "minDeviceMemoryGB": 4, "deviceMaxTier": 32, "l1MaxEntries": 150, "l2MaxEntries": 270,
 *                 "l2MaxMegabytes": 256, "breakerThreshold": 8 }
 *   }
 * }
 * </pre>
 * A missing resource is not an error: the loader logs a warning and serves {@link EngineProfile#defaults()}. A
 * resource that exists but cannot be parsed, or holds a profile the components would reject, throws
 * {@link ProfileLoadException}.
 *
 * @author hal.hildebrand
 */
public class EngineProfileLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineProfileLoader.class);

    public static final String PROFILE_RESOURCE = "/tile-engine-profiles.json";
    public static final int    SCHEMA_VERSION   = 1;

    private static final long MEGABYTE = 1024L * 1024;

    private final String                     resource;
    private final ObjectMapper               objectMapper = new ObjectMapper();
    private final Map<String, EngineProfile> profiles     = new TreeMap<>();

    public EngineProfileLoader() {
        this(PROFILE_RESOURCE);
    }

    /**
     * @param resource classpath resource to load eagerly
     * @throws ProfileLoadException if the resource exists but is malformed
     */
    public EngineProfileLoader(String resource) {
        if (resource == null) {
            throw new IllegalArgumentException("Resource cannot be null");
        }
        this.resource = resource;
        load();
    }

    /**
     * @param name profile name, case-insensitive
     */
    public Optional<EngineProfile> getProfile(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(name.toLowerCase()));
    }

    /**
     * The profile with the highest memory floor not above {@code deviceMemoryGB}, or the built-in defaults if none
     * applies.
     */
    public EngineProfile profileForDeviceMemory(double deviceMemoryGB) {
        return profiles.values()
                       .stream()
                       .filter(p -> p.minDeviceMemoryGB() <= deviceMemoryGB)
                       .max(Comparator.comparingDouble(EngineProfile::minDeviceMemoryGB))
                       .orElseGet(EngineProfile::defaults);
    }

    /**
     * @return every loaded profile, ordered by memory floor
     */
    public List<EngineProfile> getProfiles() {
        var result = new ArrayList<>(profiles.values());
        result.sort(Comparator.comparingDouble(EngineProfile::minDeviceMemoryGB));
        return result;
    }

    public String getResource() {
        return resource;
    }

    private void load() {
        try (InputStream is = getClass().getResourceAsStream(resource)) {
            if (is == null) {
                log.warn("Profile resource not found: {}, using built-in defaults", resource);
                return;
            }
            var root = objectMapper.readTree(is);
            if (root == null || !root.isObject()) {
                throw new ProfileLoadException("Invalid profile format in " + resource + ": not a JSON object");
            }
            var version = root.path("schema_version").asInt(SCHEMA_VERSION);
            if (version != SCHEMA_VERSION) {
                throw new ProfileLoadException(
                "Unsupported profile schema version " + version + " in " + resource);
            }
            var nodes = root.get("profiles");
            if (nodes == null || !nodes.isObject()) {
                throw new ProfileLoadException("Invalid profile format in " + resource + ": missing profiles object");
            }

            var iterator = nodes.fields();
            while (iterator.hasNext()) {
                var entry = iterator.next();
                var profile = parseProfile(entry.getKey().toLowerCase(), entry.getValue());
                profiles.put(profile.name(), profile);
                log.debug("Loaded profile: {} -> max tier {}, L2 {} entries", profile.name(),
                          profile.deviceMaxTier(), profile.l2MaxEntries());
            }
            log.info("Loaded {} engine profiles from {}", profiles.size(), resource);
        } catch (IOException e) {
            throw new ProfileLoadException("Failed to read engine profiles from " + resource, e);
        }
    }

    private EngineProfile parseProfile(String name, JsonNode node) {
        try {
            var profile = new EngineProfile(name, require(node, name, "minDeviceMemoryGB").asDouble(),
                                            require(node, name, "deviceMaxTier").asDouble(),
                                            require(node, name, "l1MaxEntries").asInt(),
                                            require(node, name, "l2MaxEntries").asInt(),
                                            require(node, name, "l2MaxMegabytes").asLong() * MEGABYTE,
                                            require(node, name, "breakerThreshold").asInt());
            // each component validates its own limits
            profile.scaleConfiguration();
            profile.cacheConfiguration();
            profile.breakerConfig();
            return profile;
        } catch (IllegalArgumentException e) {
            throw new ProfileLoadException("Invalid profile " + name + " in " + resource + ": " + e.getMessage(), e);
        }
    }

    private JsonNode require(JsonNode node, String name, String field) {
        var value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new ProfileLoadException("Profile " + name + " in " + resource + " is missing numeric " + field);
        }
        return value;
    }
}
