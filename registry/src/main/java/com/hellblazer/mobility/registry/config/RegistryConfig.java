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
package com.hellblazer.mobility.registry.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Construction settings of a position registry: slot capacity and how membership changes reach subscribers.
 *
 * @author hal.hildebrand
 */
public class RegistryConfig {

    /**
     * How enabled-set changes are handed to subscribers.
     */
    public enum DeliveryMode {
        /**
         * Listeners run in the mutating thread, under the membership lock, before enable/disable returns. A
         * slow listener stalls every membership change.
         */
        SYNCHRONOUS,

        /**
         * Each subscriber has a bounded queue drained by its own dispatch task. Enable/disable only enqueue.
         */
        ASYNCHRONOUS
    }

    /**
     * What an asynchronous subscriber queue does when it is full.
     */
    public enum OverflowPolicy {
        /**
         * The mutator waits until the subscriber makes room.
         */
        BLOCK,

        /**
         * The oldest queued change is discarded. Every change carries the full enabled set, so the newest one
         * still describes the current membership.
         */
        DROP_OLDEST
    }

    public static final int            DEFAULT_CAPACITY         = 1;
    public static final int            DEFAULT_QUEUE_CAPACITY   = 64;
    public static final DeliveryMode   DEFAULT_DELIVERY_MODE    = DeliveryMode.ASYNCHRONOUS;
    public static final OverflowPolicy DEFAULT_OVERFLOW_POLICY  = OverflowPolicy.DROP_OLDEST;
    public static final Duration       DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final int            capacity;
    private final DeliveryMode   deliveryMode;
    private final int            queueCapacity;
    private final OverflowPolicy overflowPolicy;
    private final Duration       shutdownTimeout;

    private RegistryConfig(Builder builder) {
        this.capacity = builder.capacity;
        this.deliveryMode = builder.deliveryMode;
        this.queueCapacity = builder.queueCapacity;
        this.overflowPolicy = builder.overflowPolicy;
        this.shutdownTimeout = builder.shutdownTimeout;
    }

    /**
     * Creates a new builder for RegistryConfig
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default settings for a registry of the given capacity.
     */
    public static RegistryConfig withCapacity(int capacity) {
        return builder().withCapacity(capacity).build();
    }

    public int getCapacity() {
        return capacity;
    }

    public DeliveryMode getDeliveryMode() {
        return deliveryMode;
    }

    /**
     * @return bound of each subscriber's queue in {@link DeliveryMode#ASYNCHRONOUS} mode
     */
    public int getQueueCapacity() {
        return queueCapacity;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    /**
     * @return how long closing the registry waits for queued notifications to drain
     */
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        var that = (RegistryConfig) o;
        return capacity == that.capacity && queueCapacity == that.queueCapacity
               && deliveryMode == that.deliveryMode && overflowPolicy == that.overflowPolicy
               && shutdownTimeout.equals(that.shutdownTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(capacity, deliveryMode, queueCapacity, overflowPolicy, shutdownTimeout);
    }

    @Override
    public String toString() {
        return String.format("RegistryConfig[capacity=%d, delivery=%s, queueCapacity=%d, overflow=%s, shutdown=%dms]",
                             capacity, deliveryMode, queueCapacity, overflowPolicy, shutdownTimeout.toMillis());
    }

    /**
     * Builder class for RegistryConfig
     */
    public static class Builder {
        private int            capacity        = DEFAULT_CAPACITY;
        private DeliveryMode   deliveryMode    = DEFAULT_DELIVERY_MODE;
        private int            queueCapacity   = DEFAULT_QUEUE_CAPACITY;
        private OverflowPolicy overflowPolicy  = DEFAULT_OVERFLOW_POLICY;
        private Duration       shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

        private Builder() {
        }

        /**
         * @param capacity number of node slots
         * @throws IllegalArgumentException if capacity is less than 1
         */
        public Builder withCapacity(int capacity) {
            if (capacity < 1) {
                throw new IllegalArgumentException("Capacity must be positive: " + capacity);
            }
            this.capacity = capacity;
            return this;
        }

        public Builder withDeliveryMode(DeliveryMode mode) {
            if (mode == null) {
                throw new IllegalArgumentException("Delivery mode cannot be null");
            }
            this.deliveryMode = mode;
            return this;
        }

        /**
         * @param queueCapacity per-subscriber queue bound
         * @throws IllegalArgumentException if queueCapacity is less than 1
         */
        public Builder withQueueCapacity(int queueCapacity) {
            if (queueCapacity < 1) {
                throw new IllegalArgumentException("Queue capacity must be positive: " + queueCapacity);
            }
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder withOverflowPolicy(OverflowPolicy policy) {
            if (policy == null) {
                throw new IllegalArgumentException("Overflow policy cannot be null");
            }
            this.overflowPolicy = policy;
            return this;
        }

        public Builder withShutdownTimeout(Duration timeout) {
            if (timeout == null || timeout.isNegative()) {
                throw new IllegalArgumentException("Shutdown timeout must be non-negative");
            }
            this.shutdownTimeout = timeout;
            return this;
        }

        public RegistryConfig build() {
            return new RegistryConfig(this);
        }
    }
}
