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
import com.hellblazer.mobility.registry.notify.EnabledSetListener;
import com.hellblazer.mobility.registry.notify.Subscription;

import java.util.List;
import java.util.Objects;

/**
 * Registry of the positions and membership of every node in a simulated network.
 * <p>
 * Nodes occupy dense slots {@code [0, capacity)}. Each slot holds a position guarded by its own read/write
 * lock, so positions of different nodes are read and written in parallel. Independently, each slot has an
 * enabled flag; only enabled nodes can have their position read or written. Enable and disable calls are
 * serialized by a single membership lock and every change is broadcast, with the full ascending enabled
 * set, to the registered {@link EnabledSetListener}s.
 * <p>
 * Nodes can also be addressed by hardware address when the registry was created with an
 * {@link AddressResolver}.
 * <p>
 * Thread Safety: all operations may be called concurrently. There is no ordering between position state and
 * membership state: a node checked with {@link #isEnabled(int)} may be disabled before a following
 * {@link #get(int)}, which then fails with {@link NodeDisabledException}.
 *
 * @author hal.hildebrand
 */
public interface PositionRegistry extends AutoCloseable {

    /**
     * Distance reported when either endpoint cannot be read.
     */
    double UNREACHABLE = Double.MAX_VALUE;

    /**
     * Registry with default notification settings and no address resolution.
     */
    static PositionRegistry create(int capacity) {
        return create(capacity, null);
    }

    /**
     * Registry with default notification settings.
     *
     * @param resolver address resolver, or null to disable address-based operations
     */
    static PositionRegistry create(int capacity, AddressResolver resolver) {
        return new SlottedPositionRegistry(RegistryConfig.withCapacity(capacity), resolver);
    }

    /**
     * @param resolver address resolver, or null to disable address-based operations
     */
    static PositionRegistry create(RegistryConfig config, AddressResolver resolver) {
        return new SlottedPositionRegistry(config, resolver);
    }

    /**
     * @return number of node slots, fixed for the registry's lifetime
     */
    int capacity();

    /**
     * Copy of a node's position.
     *
     * @throws IndexOutOfRangeException if the index is outside {@code [0, capacity)}
     * @throws NodeDisabledException    if the node is disabled
     */
    Position get(int index);

    /**
     * Atomically replace a node's position.
     *
     * @throws IndexOutOfRangeException if the index is outside {@code [0, capacity)}
     * @throws NodeDisabledException    if the node is disabled
     */
    void set(int index, double x, double y, double height);

    /**
     * Atomically replace a node's position.
     *
     * @throws IndexOutOfRangeException if the index is outside {@code [0, capacity)}
     * @throws NodeDisabledException    if the node is disabled
     * @throws NullPointerException     if the position is null
     */
    default void setPosition(int index, Position position) {
        Objects.requireNonNull(position, "Position cannot be null");
        set(index, position.x(), position.y(), position.height());
    }

    /**
     * Euclidean distance between two nodes.
     *
     * @return the distance, or {@link #UNREACHABLE} if either node is out of range or disabled
     */
    double distance(int index1, int index2);

    /**
     * @throws AddressNotFoundException if the address does not resolve
     * @throws IndexOutOfRangeException if the address resolves outside {@code [0, capacity)}
     * @throws NodeDisabledException    if the node is disabled
     * @throws IllegalStateException    if the registry has no address resolver
     */
    Position getByAddress(String address);

    /**
     * @throws AddressNotFoundException if the address does not resolve
     * @throws IndexOutOfRangeException if the address resolves outside {@code [0, capacity)}
     * @throws NodeDisabledException    if the node is disabled
     * @throws IllegalStateException    if the registry has no address resolver
     */
    void setByAddress(String address, double x, double y, double height);

    /**
     * @throws AddressNotFoundException if the address does not resolve
     * @throws IndexOutOfRangeException if the address resolves outside {@code [0, capacity)}
     * @throws NodeDisabledException    if the node is disabled
     * @throws IllegalStateException    if the registry has no address resolver
     */
    default void setPositionByAddress(String address, Position position) {
        Objects.requireNonNull(position, "Position cannot be null");
        setByAddress(address, position.x(), position.y(), position.height());
    }

    /**
     * Mark a node enabled and notify every subscriber, even if the node already was enabled.
     *
     * @throws IndexOutOfRangeException if the index is outside {@code [0, capacity)}
     */
    void enable(int index);

    /**
     * Mark a node disabled and notify every subscriber, even if the node already was disabled. Its stored
     * position is kept.
     *
     * @throws IndexOutOfRangeException if the index is outside {@code [0, capacity)}
     */
    void disable(int index);

    /**
     * @throws IndexOutOfRangeException if the index is outside {@code [0, capacity)}
     */
    boolean isEnabled(int index);

    /**
     * @return ascending, unmodifiable list of the enabled node indices
     */
    List<Integer> enabled();

    /**
     * Register a listener for enabled-set changes. No notification is sent for the current state; call
     * {@link #enabled()} for it.
     *
     * @return handle to cancel the registration
     * @throws IllegalStateException if the registry has been closed
     */
    Subscription registerEnabledChanged(EnabledSetListener listener);

    /**
     * Stop notification delivery. Position and membership operations remain usable.
     */
    @Override
    void close();
}
