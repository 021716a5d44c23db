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

import com.hellblazer.mobility.registry.config.RegistryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates subscriber channels according to the configured delivery mode and owns the dispatch threads of
 * asynchronous channels.
 *
 * @author hal.hildebrand
 */
public class NotificationDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final RegistryConfig                          config;
    private final ExecutorService                         dispatchExecutor;
    private final CopyOnWriteArrayList<SubscriberChannel> channels    = new CopyOnWriteArrayList<>();
    private final AtomicInteger                           threadCount = new AtomicInteger();
    private volatile boolean                              closed;

    public NotificationDispatcher(RegistryConfig config) {
        this.config = config;
        if (config.getDeliveryMode() == RegistryConfig.DeliveryMode.ASYNCHRONOUS) {
            this.dispatchExecutor = Executors.newCachedThreadPool(r -> {
                var thread = new Thread(r, "EnabledSet-Dispatch-" + threadCount.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
        } else {
            this.dispatchExecutor = null;
        }
    }

    /**
     * Open a channel to a listener.
     *
     * @throws IllegalStateException if the dispatcher has been closed
     */
    public SubscriberChannel open(EnabledSetListener listener) {
        if (closed) {
            throw new IllegalStateException("Notification dispatcher is closed");
        }
        SubscriberChannel channel;
        if (dispatchExecutor == null) {
            channel = new InlineChannel(listener);
        } else {
            var queued = new QueuedChannel(listener, config.getQueueCapacity(), config.getOverflowPolicy());
            dispatchExecutor.execute(queued::drain);
            channel = queued;
        }
        channels.add(channel);
        return channel;
    }

    /**
     * Forget a channel that has been cancelled.
     */
    public void release(SubscriberChannel channel) {
        channels.remove(channel);
    }

    /**
     * Stop all channels. Asynchronous channels get up to the configured shutdown timeout to deliver what they
     * have already queued. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        channels.forEach(SubscriberChannel::close);
        if (dispatchExecutor != null) {
            dispatchExecutor.shutdown();
            try {
                if (!dispatchExecutor.awaitTermination(config.getShutdownTimeout().toMillis(),
                                                       TimeUnit.MILLISECONDS)) {
                    log.warn("Enabled set dispatch did not drain within {}ms, abandoning queued changes",
                             config.getShutdownTimeout().toMillis());
                    dispatchExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                dispatchExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        channels.clear();
        log.info("Notification dispatcher closed");
    }
}
