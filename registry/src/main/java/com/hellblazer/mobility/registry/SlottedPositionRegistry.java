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

import com.hellblazer.mobility.registry.config.RegistryConfig;
import com.hellblazer.mobility.registry.notify.EnabledSetListener;
import com.hellblazer.mobility.registry.notify.NotificationDispatcher;
import com.hellblazer.mobility.registry.notify.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * {@link PositionRegistry} composed of a {@link PositionTable}, its {@link Membership} and an optional
 * {@link AddressResolver}.
 *
 * @author hal.hildebrand
 */
public class SlottedPositionRegistry implements PositionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SlottedPositionRegistry.class);

    private final PositionTable   table;
    private final Membership      membership;
    private final AddressResolver resolver;

    /**
     * @param config   capacity and notification settings
     * @param resolver address resolver, or null to disable address-based operations
     */
    public SlottedPositionRegistry(RegistryConfig config, AddressResolver resolver) {
        Objects.requireNonNull(config, "Config cannot be null");
        this.table = new PositionTable(config.getCapacity());
        this.membership = new Membership(table, new NotificationDispatcher(config));
        this.resolver = resolver;
        log.info("Created position registry: capacity={}, delivery={}, addressing={}", config.getCapacity(),
                 config.getDeliveryMode(), resolver != null ? "enabled" : "disabled");
    }

    @Override
    public int capacity() {
        return table.capacity();
    }

    @Override
    public Position get(int index) {
        return table.get(index);
    }

    @Override
    public void set(int index, double x, double y, double height) {
        table.set(index, x, y, height);
    }

    @Override
    public double distance(int index1, int index2) {
        return table.distance(index1, index2);
    }

    @Override
    public Position getByAddress(String address) {
        return table.get(resolve(address));
    }

    @Override
    public void setByAddress(String address, double x, double y, double height) {
        table.set(resolve(address), x, y, height);
    }

    @Override
    public void enable(int index) {
        membership.enable(index);
    }

    @Override
    public void disable(int index) {
        membership.disable(index);
    }

    @Override
    public boolean isEnabled(int index) {
        return membership.isEnabled(index);
    }

    @Override
    public List<Integer> enabled() {
        return membership.enabled();
    }

    @Override
    public Subscription registerEnabledChanged(EnabledSetListener listener) {
        return membership.register(listener);
    }

    @Override
    public void close() {
        membership.close();
    }

    private int resolve(String address) {
        if (resolver == null) {
            throw new IllegalStateException("address resolution unavailable: registry has no address resolver");
        }
        return resolver.resolve(address).orElseThrow(() -> new AddressNotFoundException(address));
    }

    @Override
    public String toString() {
        return "SlottedPositionRegistry{capacity=" + table.capacity() + ", enabled=" + membership.enabled().size()
               + ", subscribers=" + membership.subscriberCount() + "}";
    }
}
