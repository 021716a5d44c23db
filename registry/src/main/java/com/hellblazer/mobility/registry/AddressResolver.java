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

import java.util.OptionalInt;

/**
 * Maps an opaque hardware/node address to the node's slot index.
 * <p>
 * Owned by the caller. The registry only ever reads from it, so implementations must tolerate concurrent
 * {@link #resolve(String)} calls.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface AddressResolver {

    /**
     * Resolve an address to a slot index.
     *
     * @param address hardware or node address
     * @return the slot index, or empty if the address is unknown
     */
    OptionalInt resolve(String address);
}
