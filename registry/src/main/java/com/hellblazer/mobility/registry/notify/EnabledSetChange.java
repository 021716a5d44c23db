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
package com.hellblazer.mobility.registry.notify;

import java.util.List;

/**
 * Immutable record of one membership change, carrying the full enabled set at the moment of the change.
 * <p>
 * Sequence numbers increase by one for every enable/disable call on a registry. A subscriber seeing a gap
 * knows changes were dropped; the latest record it holds still describes the membership completely.
 *
 * @param sequence     per-registry change number, starting at 1
 * @param index        slot whose flag was written
 * @param kind         whether the slot was enabled or disabled
 * @param enabledNodes ascending indices of all enabled slots after the change
 * @author hal.hildebrand
 */
public record EnabledSetChange(long sequence, int index, Kind kind, List<Integer> enabledNodes) {

    public enum Kind {
        ENABLED, DISABLED
    }

    public EnabledSetChange {
        enabledNodes = List.copyOf(enabledNodes);
    }
}
