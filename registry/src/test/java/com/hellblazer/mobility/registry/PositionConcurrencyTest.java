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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent readers and writers across and within slots.
 */
public class PositionConcurrencyTest {
    private static final Logger log = LoggerFactory.getLogger(PositionConcurrencyTest.class);

    private static final int CAPACITY = 16;

    private PositionRegistry registry;
    private ExecutorService  executor;

    @BeforeEach
    void setUp() {
        registry = PositionRegistry.create(RegistryConfig.builder()
                                                         .withCapacity(CAPACITY)
                                                         .withDeliveryMode(RegistryConfig.DeliveryMode.SYNCHRONOUS)
                                                         .build(), null);
        for (int i = 0; i < CAPACITY; i++) {
            registry.enable(i);
        }
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        registry.close();
    }

    @Test
    void testReadersNeverObserveTornWrites() throws Exception {
        int writers = 3;
        int readers = 4;
        int writesPerWriter = 20_000;
        var torn = new AtomicInteger();
        var writing = new AtomicBoolean(true);
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<?>>();

        for (int w = 0; w < writers; w++) {
            final int writer = w;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < writesPerWriter; i++) {
                    double v = writer * writesPerWriter + i;
                    registry.set(0, v, v, v);
                }
                return null;
            }));
        }
        for (int r = 0; r < readers; r++) {
            executor.submit(() -> {
                start.await();
                while (writing.get()) {
                    var p = registry.get(0);
                    if (p.x() != p.y() || p.y() != p.height()) {
                        torn.incrementAndGet();
                    }
                }
                return null;
            });
        }

        start.countDown();
        for (var future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        writing.set(false);

        assertEquals(0, torn.get(), "Readers observed a mix of old and new coordinates");
        var last = registry.get(0);
        assertEquals(last.x(), last.y());
        assertEquals(last.y(), last.height());
    }

    @Test
    void testConcurrentWritersToSameSlotLeaveOneWrite() throws Exception {
        var attempts = List.of(new Position(1, 2, 3), new Position(4, 5, 6), new Position(7, 8, 9),
                               new Position(-1, -2, -3));
        for (int round = 0; round < 50; round++) {
            var start = new CountDownLatch(1);
            var futures = new ArrayList<Future<?>>();
            for (var attempt : attempts) {
                futures.add(executor.submit(() -> {
                    start.await();
                    registry.setPosition(5, attempt);
                    return null;
                }));
            }
            start.countDown();
            for (var future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
            assertTrue(attempts.contains(registry.get(5)), "Stored " + registry.get(5) + " was never written");
        }
    }

    @Test
    void testDifferentSlotsProceedIndependently() {
        int updates = 50_000;
        assertTimeoutPreemptively(Duration.ofSeconds(30), () -> {
            var start = new CountDownLatch(1);
            var futures = new ArrayList<Future<?>>();
            for (int slot = 0; slot < 8; slot++) {
                final int index = slot;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < updates; i++) {
                        registry.set(index, index, i, -index);
                    }
                    return null;
                }));
            }
            var begin = System.nanoTime();
            start.countDown();
            for (var future : futures) {
                future.get();
            }
            log.info("{} slots x {} updates in {}ms", futures.size(), updates,
                     TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin));
        });

        for (int slot = 0; slot < 8; slot++) {
            assertEquals(new Position(slot, updates - 1, -slot), registry.get(slot));
        }
    }

    @Test
    void testReaderOfOneSlotUnaffectedByChurnOnAnother() throws Exception {
        registry.set(1, 10, 20, 30);
        var churn = new AtomicBoolean(true);
        var churner = executor.submit(() -> {
            while (churn.get()) {
                registry.disable(2);
                registry.enable(2);
                registry.set(2, Math.random(), Math.random(), Math.random());
            }
            return null;
        });
        try {
            for (int i = 0; i < 10_000; i++) {
                assertEquals(new Position(10, 20, 30), registry.get(1));
            }
        } finally {
            churn.set(false);
        }
        churner.get(5, TimeUnit.SECONDS);
    }
}
