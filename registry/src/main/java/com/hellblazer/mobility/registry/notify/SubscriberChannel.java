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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Delivery path from the registry to one listener.
 * <p>
 * {@link #deliver(EnabledSetChange)} is only called while the membership lock is held exclusively, so calls
 * arrive one at a time and in mutation order.
 *
 * @author hal.hildebrand
 */
public abstract class SubscriberChannel implements Subscription {
    private static final Logger log = LoggerFactory.getLogger(SubscriberChannel.class);

    protected final EnabledSetListener listener;
    private volatile boolean           active = true;
    private volatile Runnable          onCancel;

    protected SubscriberChannel(EnabledSetListener listener) {
        this.listener = Objects.requireNonNull(listener, "Listener cannot be null");
    }

    /**
     * Hand a change to the listener, or to the listener's queue.
     */
    public abstract void deliver(EnabledSetChange change);

    @Override
    public void cancel() {
        if (!active) {
            return;
        }
        active = false;
        discardPending();
        var callback = onCancel;
        if (callback != null) {
            callback.run();
        }
    }

    @Override
    public boolean isActive() {
        return active;
    }

    /**
     * Run once when the channel is cancelled, used by the owner to unregister it.
     */
    public void onCancel(Runnable callback) {
        this.onCancel = callback;
    }

    protected void discardPending() {
    }

    /**
     * Stop accepting changes; queued changes may still be delivered.
     */
    void close() {
        active = false;
    }

    protected void notifyListener(EnabledSetChange change) {
        try {
            listener.enabledChanged(change);
        } catch (RuntimeException e) {
            log.warn("Enabled set listener {} failed on change #{}", listener, change.sequence(), e);
        }
    }
}
