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

import com.hellblazer.mobility.registry.config.RegistryConfig.OverflowPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded FIFO in front of a listener, drained by a dedicated dispatch task.
 * <p>
 * A single drain task per channel keeps the listener's view strictly ordered. When the queue is full the
 * {@link OverflowPolicy} decides between waiting and dropping the oldest change.
 *
 * @author hal.hildebrand
 */
class QueuedChannel extends SubscriberChannel {
    private static final Logger log              = LoggerFactory.getLogger(QueuedChannel.class);
    private static final long   POLL_INTERVAL_MS = 50;

    private final BlockingQueue<EnabledSetChange> queue;
    private final OverflowPolicy                  overflowPolicy;
    private volatile boolean                      finishing;

    QueuedChannel(EnabledSetListener listener, int queueCapacity, OverflowPolicy overflowPolicy) {
        super(listener);
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.overflowPolicy = overflowPolicy;
    }

    @Override
    public void deliver(EnabledSetChange change) {
        if (!isActive()) {
            return;
        }
        switch (overflowPolicy) {
            case BLOCK -> {
                if (!queue.offer(change)) {
                    awaitRoom(change);
                }
            }
            case DROP_OLDEST -> {
                while (!queue.offer(change)) {
                    var dropped = queue.poll();
                    if (dropped != null) {
                        log.warn("Subscriber queue full, dropped change #{} for {}", dropped.sequence(), listener);
                    }
                }
            }
        }
    }

    /**
     * Wait until the change is queued. Interrupts do not abort the wait; the interrupt status is restored once
     * the change is in the queue. Gives up only when the channel stops being active.
     */
    private void awaitRoom(EnabledSetChange change) {
        var interrupted = false;
        try {
            while (true) {
                try {
                    if (queue.offer(change, POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                        return;
                    }
                    if (!isActive()) {
                        log.warn("Channel for {} stopped while waiting, change #{} not queued", listener,
                                 change.sequence());
                        return;
                    }
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Body of the dispatch task. Runs until the channel is cancelled, or until it is closed and the queue
     * has been emptied.
     */
    void drain() {
        try {
            while (true) {
                if (!isActive() && !finishing) {
                    return;
                }
                var change = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (change == null) {
                    if (finishing) {
                        return;
                    }
                    continue;
                }
                if (isActive() || finishing) {
                    notifyListener(change);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!queue.isEmpty()) {
                log.warn("Dispatch for {} interrupted with {} changes undelivered", listener, queue.size());
            }
        }
    }

    int pending() {
        return queue.size();
    }

    @Override
    protected void discardPending() {
        queue.clear();
    }

    @Override
    void close() {
        finishing = true;
        super.close();
    }
}
