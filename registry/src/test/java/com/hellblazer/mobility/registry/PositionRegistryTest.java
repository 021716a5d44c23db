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
package com.hellblazer.mobility.registry;

import com.hellblazer.mobility.registry.config.RegistryConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Position access, membership gating and distance on a single registry.
 *
 * @author hal.hildebrand
 */
public class PositionRegistryTest {

    private static final int CAPACITY = 8;

    private PositionRegistry registry;

    @BeforeEach
    public void setUp() {
        var config = RegistryConfig.builder()
                                   .withCapacity(CAPACITY)
                                   .withDeliveryMode(RegistryConfig.DeliveryMode.SYNCHRONOUS)
                                   .build();
        registry = PositionRegistry.create(config, null);
    }

    @AfterEach
    public void tearDown() {
        registry.close();
    }

    @Test
    public void testFreshSlotsAreDisabled() {
        assertEquals(CAPACITY, registry.capacity());
        assertTrue(registry.enabled().isEmpty());
        for (int i = 0; i < CAPACITY; i++) {
            final int index = i;
            assertFalse(registry.isEnabled(i));
            var e = assertThrows(NodeDisabledException.class, () -> registry.get(index));
            assertEquals(index, e.getIndex());
            assertEquals("node with index " + index + " is disabled", e.getMessage());
        }
    }

    @Test
    public void testEnabledSlotStartsAtOrigin() {
        registry.enable(5);
        assertEquals(Position.ORIGIN, registry.get(5));
    }

    @Test
    public void testSetThenGet() {
        registry.enable(2);
        registry.set(2, 10.5, -3.25, 42.0);
        assertEquals(new Position(10.5, -3.25, 42.0), registry.get(2));

        registry.setPosition(2, new Position(1, 2, 3));
        assertEquals(new Position(1, 2, 3), registry.get(2));
    }

    @Test
    public void testSetOnDisabledNodeFails() {
        var e = assertThrows(NodeDisabledException.class, () -> registry.set(3, 1, 1, 1));
        assertEquals(3, e.getIndex());

        registry.enable(3);
        assertEquals(Position.ORIGIN, registry.get(3), "Rejected write must not have been stored");
    }

    @Test
    public void testOutOfRangeIndices() {
        registry.enable(0);
        registry.set(0, 7, 8, 9);

        for (int bad : new int[] { CAPACITY, CAPACITY + 1, Integer.MAX_VALUE, -1 }) {
            var e = assertThrows(IndexOutOfRangeException.class, () -> registry.get(bad));
            assertEquals(bad, e.getIndex());
            assertEquals(CAPACITY, e.getCapacity());
            assertThrows(IndexOutOfRangeException.class, () -> registry.set(bad, 1, 2, 3));
            assertThrows(IndexOutOfRangeException.class, () -> registry.enable(bad));
            assertThrows(IndexOutOfRangeException.class, () -> registry.disable(bad));
            assertThrows(IndexOutOfRangeException.class, () -> registry.isEnabled(bad));
        }

        assertEquals("invalid index 8. capacity is 8",
                     assertThrows(IndexOutOfRangeException.class, () -> registry.get(8)).getMessage());
        assertEquals(List.of(0), registry.enabled());
        assertEquals(new Position(7, 8, 9), registry.get(0));
    }

    @Test
    public void testDisableKeepsStoredPosition() {
        registry.enable(1);
        registry.set(1, 4, 5, 6);
        registry.disable(1);

        assertThrows(NodeDisabledException.class, () -> registry.get(1));
        assertThrows(NodeDisabledException.class, () -> registry.set(1, 0, 0, 0));

        registry.enable(1);
        assertEquals(new Position(4, 5, 6), registry.get(1));
    }

    @Test
    public void testGetReturnsCopy() {
        registry.enable(0);
        registry.set(0, 1, 1, 1);
        var before = registry.get(0);
        registry.set(0, 2, 2, 2);
        assertEquals(new Position(1, 1, 1), before);
    }

    @Test
    public void testDistance() {
        registry.enable(0);
        registry.enable(1);
        registry.set(0, 0, 0, 0);
        registry.set(1, 3, 4, 12);

        assertEquals(13.0, registry.distance(0, 1), 1e-9);
        assertEquals(13.0, registry.distance(1, 0), 1e-9);
        assertEquals(0.0, registry.distance(1, 1), 0.0);
    }

    @Test
    public void testDistanceToUnreadableNodeIsUnreachable() {
        registry.enable(0);

        assertEquals(PositionRegistry.UNREACHABLE, registry.distance(0, 1), "Disabled endpoint");
        assertEquals(PositionRegistry.UNREACHABLE, registry.distance(1, 0), "Disabled endpoint");
        assertEquals(PositionRegistry.UNREACHABLE, registry.distance(0, CAPACITY), "Out of range endpoint");
        assertEquals(PositionRegistry.UNREACHABLE, registry.distance(-1, 0), "Out of range endpoint");
        assertEquals(Double.MAX_VALUE, PositionRegistry.UNREACHABLE);
    }

    @Test
    public void testEnabledIsAscending() {
        registry.enable(6);
        registry.enable(0);
        registry.enable(3);
        assertEquals(List.of(0, 3, 6), registry.enabled());

        registry.disable(3);
        assertEquals(List.of(0, 6), registry.enabled());
        assertThrows(UnsupportedOperationException.class, () -> registry.enabled().add(1));
    }

    @Test
    public void testAddressOperationsWithoutResolver() {
        assertThrows(IllegalStateException.class, () -> registry.getByAddress("aa:bb"));
        assertThrows(IllegalStateException.class, () -> registry.setByAddress("aa:bb", 1, 2, 3));
    }

    @Test
    public void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> PositionRegistry.create(0));
        assertThrows(IllegalArgumentException.class, () -> new PositionTable(-3));
    }

    @Test
    public void testNullPositionRejected() {
        registry.enable(0);
        registry.set(0, 1, 2, 3);
        assertThrows(NullPointerException.class, () -> registry.setPosition(0, null));
        assertEquals(new Position(1, 2, 3), registry.get(0));
    }
}
