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
 * Thrown when a position is read or written for a node that is not currently enabled. The stored position
 * is left untouched.
 *
 * @author hal.hildebrand
 */
public class NodeDisabledException extends PositionRegistryException {

    private final int index;

    public NodeDisabledException(int index) {
        super(String.format("node with index %d is disabled", index));
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
