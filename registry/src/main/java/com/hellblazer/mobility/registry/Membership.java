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

import com.hellblazer.mobility.registry.notify.EnabledSetChange;
import com.hellblazer.mobility.registry.notify.EnabledSetListener;
import com.hellblazer.mobility.registry.notify.NotificationDispatcher;
import com.hellblazer.mobility.registry.notify.SubscriberChannel;
import com.hellblazer.mobility.registry.notify.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Enabled flags and enabled-set subscribers of a {@link PositionTable}.
 * <p>
 * One lock guards the flags and the subscriber list together; it is independent of the per-slot position
 * locks. Changes are handed to every subscriber while the lock is held exclusively, which linearizes them:
 * each subscriber sees the enable/disable calls in the order they took effect.
 *
 * @author hal.hildebrand
 */
public class Membership implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Membership.class);

    private final PositionTable           table;
    private final NotificationDispatcher  dispatcher;
    private final List<SubscriberChannel> subscribers = new ArrayList<>();
    private final ReadWriteLock           lock        = new ReentrantReadWriteLock();
    private long                          sequence;
    private boolean                       closed;

    public Membership(PositionTable table, NotificationDispatcher dispatcher) {
        this.table = Objects.requireNonNull(table, "Table cannot be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "Dispatcher cannot be null");
    }

    public void enable(int index) {
        update(index, true);
    }

    public void disable(int index) {
        update(index, false);
    }

    public boolean isEnabled(int index) {
        table.checkIndex(index);
        lock.readLock().lock();
        try {
            return table.isEnabled(index);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return ascending indices of the enabled nodes
     */
    public List<Integer> enabled() {
        lock.readLock().lock();
        try {
            return table.enabledIndices();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Add a subscriber. It receives only changes made after this call returns.
     *
     * @throws IllegalStateException if the membership has been closed
     */
    public Subscription register(EnabledSetListener listener) {
        Objects.requireNonNull(listener, "Listener cannot be null");
        lock.writeLock().lock();
        try {
            if (closed) {
                throw new IllegalStateException("Registry is closed");
            }
            var channel = dispatcher.open(listener);
            channel.onCancel(() -> unregister(channel));
            subscribers.add(channel);
            log.debug("Registered enabled set listener {}, {} subscribers", listener, subscribers.size());
            return channel;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int subscriberCount() {
        lock.readLock().lock();
        try {
            return subscribers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            subscribers.clear();
        } finally {
            lock.writeLock().unlock();
        }
        // Outside the lock: draining listeners may call back into the registry
        dispatcher.close();
    }

    private void update(int index, boolean enabled) {
        table.checkIndex(index);
        lock.writeLock().lock();
        try {
            table.setEnabled(index, enabled);
            var change = new EnabledSetChange(++sequence, index,
                                              enabled ? EnabledSetChange.Kind.ENABLED : EnabledSetChange.Kind.DISABLED,
                                              table.enabledIndices());
            log.debug("node {} {}, enabled set is now {}", index, enabled ? "enabled" : "disabled",
                      change.enabledNodes());
            // Copy: a synchronous listener may cancel its own subscription
            for (var subscriber : List.copyOf(subscribers)) {
                subscriber.deliver(change);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void unregister(SubscriberChannel channel) {
        lock.writeLock().lock();
        try {
            subscribers.remove(channel);
        } finally {
            lock.writeLock().unlock();
        }
        dispatcher.release(channel);
    }
}
