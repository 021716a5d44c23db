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

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class RegistryConfigTest {

    @Test
    public void testDefaults() {
        var config = RegistryConfig.builder().build();
        assertEquals(RegistryConfig.DEFAULT_CAPACITY, config.getCapacity());
        assertEquals(RegistryConfig.DeliveryMode.ASYNCHRONOUS, config.getDeliveryMode());
        assertEquals(64, config.getQueueCapacity());
        assertEquals(RegistryConfig.OverflowPolicy.DROP_OLDEST, config.getOverflowPolicy());
        assertEquals(Duration.ofSeconds(5), config.getShutdownTimeout());
        assertEquals(config, RegistryConfig.withCapacity(1));
    }

    @Test
    public void testBuilder() {
        var config = RegistryConfig.builder()
                                   .withCapacity(32)
                                   .withDeliveryMode(RegistryConfig.DeliveryMode.SYNCHRONOUS)
                                   .withQueueCapacity(3)
                                   .withOverflowPolicy(RegistryConfig.OverflowPolicy.BLOCK)
                                   .withShutdownTimeout(Duration.ZERO)
                                   .build();
        assertEquals(32, config.getCapacity());
        assertEquals(RegistryConfig.DeliveryMode.SYNCHRONOUS, config.getDeliveryMode());
        assertEquals(3, config.getQueueCapacity());
        assertEquals(RegistryConfig.OverflowPolicy.BLOCK, config.getOverflowPolicy());
        assertEquals(Duration.ZERO, config.getShutdownTimeout());
        assertTrue(config.toString().contains("capacity=32"));
    }

    @Test
    public void testValidation() {
        var builder = RegistryConfig.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.withCapacity(0));
        assertThrows(IllegalArgumentException.class, () -> builder.withQueueCapacity(0));
        assertThrows(IllegalArgumentException.class, () -> builder.withDeliveryMode(null));
        assertThrows(IllegalArgumentException.class, () -> builder.withOverflowPolicy(null));
        assertThrows(IllegalArgumentException.class, () -> builder.withShutdownTimeout(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> builder.withShutdownTimeout(null));
    }
}
