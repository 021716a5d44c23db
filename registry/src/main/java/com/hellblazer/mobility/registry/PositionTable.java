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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Fixed-capacity table of node positions with one read/write lock per slot.
 * <p>
 * Operations on different slots never contend. A slot's three coordinates are written as one unit under its
 * write lock, so readers never observe a partially updated position.
 * <p>
 * Each slot also carries the node's enabled flag. The flag is only written by {@link Membership} while it
 * holds the membership lock; the table reads it as a volatile to gate position access.
 *
 * @author hal.hildebrand
 */
public class PositionTable {

    private static final Logger log = LoggerFactory.getLogger(PositionTable.class);

    /**
     * Storage for one node.
     */
    private static final class Slot {
        private final ReadWriteLock lock = new ReentrantReadWriteLock();
        private double              x;
        private double              y;
        private double              height;
        private volatile boolean    enabled;
    }

    private final Slot[] slots;

    /**
     * Create a table with every slot disabled and at the origin.
     *
     * @param capacity number of slots, at least 1
     */
    public PositionTable(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.slots = new Slot[capacity];
        for (int i = 0; i < capacity; i++) {
            slots[i] = new Slot();
        }
    }

    public int capacity() {
        return slots.length;
    }

    /**
     * Copy of the position stored at the index.
     *
     * @throws IndexOutOfRangeException if the index is outside the table
     * @throws NodeDisabledException    if the node is disabled
     */
    public Position get(int index) {
        var slot = slot(index);
        slot.lock.readLock().lock();
        try {
            if (!slot.enabled) {
                throw new NodeDisabledException(index);
            }
            return new Position(slot.x, slot.y, slot.height);
        } finally {
            slot.lock.readLock().unlock();
        }
    }

    /**
     * Overwrite all three coordinates of the slot.
     *
     * @throws IndexOutOfRangeException if the index is outside the table
     * @throws NodeDisabledException    if the node is disabled
     */
    public void set(int index, double x, double y, double height) {
        var slot = slot(index);
        slot.lock.writeLock().lock();
        try {
            if (!slot.enabled) {
                throw new NodeDisabledException(index);
            }
            slot.x = x;
            slot.y = y;
            slot.height = height;
        } finally {
            slot.lock.writeLock().unlock();
        }
        if (log.isDebugEnabled()) {
            log.debug("position for {} is updated to: ({}, {}, {})", index, x, y, height);
        }
    }

    /**
     * Euclidean distance between two nodes. Unreadable endpoints (out of range or disabled) yield
     * {@link PositionRegistry#UNREACHABLE}.
     */
    public double distance(int index1, int index2) {
        Position p1;
        Position p2;
        try {
            p1 = get(index1);
            p2 = get(index2);
        } catch (PositionRegistryException e) {
            return PositionRegistry.UNREACHABLE;
        }
        return p1.distance(p2);
    }

    /**
     * @throws IndexOutOfRangeException if the index is outside the table
     */
    void checkIndex(int index) {
        if (index < 0 || index >= slots.length) {
            throw new IndexOutOfRangeException(index, slots.length);
        }
    }

    boolean isEnabled(int index) {
        return slot(index).enabled;
    }

    // Callers hold the membership write lock
    void setEnabled(int index, boolean enabled) {
        slot(index).enabled = enabled;
    }

    /**
     * Ascending indices of the enabled slots.
     */
    List<Integer> enabledIndices() {
        var enabled = new ArrayList<Integer>();
        for (int i = 0; i < slots.length; i++) {
            if (slots[i].enabled) {
                enabled.add(i);
            }
        }
        return Collections.unmodifiableList(enabled);
    }

    private Slot slot(int index) {
        checkIndex(index);
        return slots[index];
    }
}
