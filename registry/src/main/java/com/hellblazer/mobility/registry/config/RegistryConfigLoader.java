/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Mobility registry.
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
package com.hellblazer.mobility.registry.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Loads {@link RegistryConfig} from JSON.
 * <p>
 * Format (every field optional, absent fields take the {@link RegistryConfig} defaults):
 * <pre>
 * {
 *   "capacity": 128,
 *   "notification": {
 *     "mode": "ASYNCHRONOUS",
 *     "queueCapacity": 32,
 *     "overflow": "DROP_OLDEST",
 *     "shutdownTimeoutMs": 2000
 *   }
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class RegistryConfigLoader {
    private static final Logger       log          = LoggerFactory.getLogger(RegistryConfigLoader.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private RegistryConfigLoader() {
    }

    /**
     * Load a configuration file.
     *
     * @throws IOException if the file cannot be read or does not describe a valid configuration
     */
    public static RegistryConfig load(Path file) throws IOException {
        try (var is = Files.newInputStream(file)) {
            var config = load(is);
            log.info("Loaded registry configuration from {}: {}", file, config);
            return config;
        }
    }

    /**
     * Load a configuration from the classpath.
     *
     * @param resourcePath absolute resource path, e.g. "/registry.json"
     * @return the configuration, or empty if the resource does not exist
     * @throws IOException if the resource exists but is not a valid configuration
     */
    public static Optional<RegistryConfig> loadResource(String resourcePath) throws IOException {
        try (var is = RegistryConfigLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                log.debug("Registry configuration not found: {}", resourcePath);
                return Optional.empty();
            }
            var config = load(is);
            log.info("Loaded registry configuration from {}: {}", resourcePath, config);
            return Optional.of(config);
        }
    }

    /**
     * Parse a configuration. The stream is not closed.
     *
     * @throws IOException if the content is not a valid configuration
     */
    public static RegistryConfig load(InputStream is) throws IOException {
        var root = objectMapper.readTree(is);
        if (root == null || !root.isObject()) {
            throw new IOException("Registry configuration must be a JSON object");
        }
        try {
            return parse(root);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid registry configuration: " + e.getMessage(), e);
        }
    }

    private static RegistryConfig parse(JsonNode root) throws IOException {
        var builder = RegistryConfig.builder();
        if (root.has("capacity")) {
            builder.withCapacity(intField(root, "capacity"));
        }

        var notification = root.get("notification");
        if (notification == null || notification.isNull()) {
            return builder.build();
        }
        if (!notification.isObject()) {
            throw new IOException("\"notification\" must be a JSON object");
        }
        if (notification.has("mode")) {
            builder.withDeliveryMode(RegistryConfig.DeliveryMode.valueOf(enumName(notification, "mode")));
        }
        if (notification.has("queueCapacity")) {
            builder.withQueueCapacity(intField(notification, "queueCapacity"));
        }
        if (notification.has("overflow")) {
            builder.withOverflowPolicy(RegistryConfig.OverflowPolicy.valueOf(enumName(notification, "overflow")));
        }
        if (notification.has("shutdownTimeoutMs")) {
            var millis = notification.get("shutdownTimeoutMs");
            if (!millis.canConvertToLong()) {
                throw new IOException("\"shutdownTimeoutMs\" must be an integer");
            }
            builder.withShutdownTimeout(Duration.ofMillis(millis.asLong()));
        }
        return builder.build();
    }

    private static int intField(JsonNode node, String field) throws IOException {
        var value = node.get(field);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new IOException("\"" + field + "\" must be an integer");
        }
        return value.intValue();
    }

    private static String enumName(JsonNode node, String field) throws IOException {
        var value = node.get(field);
        if (!value.isTextual()) {
            throw new IOException("\"" + field + "\" must be a string");
        }
        return value.asText().trim().toUpperCase(Locale.ROOT);
    }
}
