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
import java.util.Objects;
import java.util.concurrent.BlockingQueue;

/**
 * Receives the enabled set whenever node membership changes.
 * <p>
 * Which thread calls {@link #enabledChanged(EnabledSetChange)} depends on the registry's delivery mode; in
 * either mode a listener receives changes one at a time, in the order the membership changes happened.
 * Exceptions thrown by a listener are caught and logged by the registry, so one failing listener doesn't
 * affect others.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface EnabledSetListener {

    /**
     * Called after a node has been enabled or disabled.
     *
     * @param change the change, including the full ascending enabled set
     */
    void enabledChanged(EnabledSetChange change);

    /**
     * Adapt a blocking queue into a listener. Each change's enabled set is {@code put} into the queue, so a
     * bounded queue that nobody drains holds up delivery. An interrupt does not drop the change: the put is
     * retried and the interrupt status restored afterwards.
     *
     * @param queue destination of the enabled sets
     * @return listener feeding the queue
     */
    static EnabledSetListener forQueue(BlockingQueue<List<Integer>> queue) {
        Objects.requireNonNull(queue, "Queue cannot be null");
        return change -> {
            var interrupted = false;
            try {
                while (true) {
                    try {
                        queue.put(change.enabledNodes());
                        return;
                    } catch (InterruptedException e) {
                        interrupted = true;
                    }
                }
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        };
    }
}
