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

/**
 * Calls the listener directly in the mutating thread.
 *
 * @author hal.hildebrand
 */
class InlineChannel extends SubscriberChannel {

    InlineChannel(EnabledSetListener listener) {
        super(listener);
    }

    @Override
    public void deliver(EnabledSetChange change) {
        if (isActive()) {
            notifyListener(change);
        }
    }
}
