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

/**
 * Thrown when an operation addresses a slot index outside {@code [0, capacity)}. The failing operation has
 * no side effect.
 *
 * @author hal.hildebrand
 */
public class IndexOutOfRangeException extends PositionRegistryException {

    private final int index;
    private final int capacity;

    public IndexOutOfRangeException(int index, int capacity) {
        super(String.format("invalid index %d. capacity is %d", index, capacity));
        this.index = index;
        this.capacity = capacity;
    }

    public int getIndex() {
        return index;
    }

    public int getCapacity() {
        return capacity;
    }
}
