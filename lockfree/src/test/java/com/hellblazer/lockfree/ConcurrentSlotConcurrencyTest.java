/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Luciferase.
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
package com.hellblazer.lockfree;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for concurrent access to a slot
 *
 * @author hal.hildebrand
 */
public class ConcurrentSlotConcurrencyTest {

    private static final int TEST_TIMEOUT_SECONDS = 30;

    @Test
    void testNoTornReads() throws Exception {
        final int writers = 4;
        final int readers = 4;
        final int writesPerThread = 5_000;
        var slot = new ConcurrentSlot<>(Tally.TYPE, new Tally(0));
        var executor = Executors.newFixedThreadPool(writers + readers);
        var barrier = new CyclicBarrier(writers + readers);
        var writing = new AtomicBoolean(true);
        var finishedWriters = new AtomicInteger();
        var reads = new AtomicLong();
        var torn = new ConcurrentLinkedQueue<Tally>();

        try {
            var futures = new ArrayList<Future<?>>();
            for (int w = 0; w < writers; w++) {
                final long base = (w + 1) * 1_000_000L;
                futures.add(executor.submit(() -> {
                    await(barrier);
                    for (int i = 0; i < writesPerThread; i++) {
                        slot.store(new Tally(base + i));
                    }
                    if (finishedWriters.incrementAndGet() == writers) {
                        writing.set(false);
                    }
                }));
            }
            for (int r = 0; r < readers; r++) {
                final boolean useRead = r % 2 == 0;
                futures.add(executor.submit(() -> {
                    await(barrier);
                    do {
                        Tally seen = useRead ? slot.read(Tally::new) : slot.load();
                        if (!seen.isConsistent()) {
                            torn.add(seen);
                        }
                        reads.incrementAndGet();
                    } while (writing.get());
                }));
            }

            for (var future : futures) {
                future.get(TEST_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertTrue(torn.isEmpty(), () -> "Torn reads observed: " + torn);
        assertTrue(reads.get() >= readers);
        assertTrue(slot.load().isConsistent());
        assertTrue(slot.load().count >= 1_000_000L, "Final value must be one of the stored values");
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 8, 64 })
    void testNoLostUpdates(int threadCount) throws Exception {
        final int incrementsPerThread = 100;
        var slot = ConcurrentSlot.withStatistics(Tally.TYPE);
        var executor = Executors.newFixedThreadPool(threadCount);
        var barrier = new CyclicBarrier(threadCount);

        try {
            var futures = IntStream.range(0, threadCount).mapToObj(threadId -> executor.submit(() -> {
                await(barrier);
                for (int i = 0; i < incrementsPerThread; i++) {
                    slot.update(Tally::increment);
                }
            })).toList();

            for (var future : futures) {
                future.get(TEST_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        long expected = (long) threadCount * incrementsPerThread;
        assertEquals(new Tally(expected), slot.load());
        assertEquals(expected, slot.statistics().getUpdateCount());
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 8, 64 })
    void testSingleIncrementPerThread(int threadCount) throws Exception {
        var slot = new ConcurrentSlot<>(Tally.TYPE);
        var executor = Executors.newFixedThreadPool(threadCount);
        var start = new CountDownLatch(1);
        var invocations = new AtomicInteger();

        try {
            var futures = IntStream.range(0, threadCount).mapToObj(threadId -> executor.submit(() -> {
                await(start);
                slot.update(value -> {
                    invocations.incrementAndGet();
                    value.increment();
                });
            })).toList();

            start.countDown();
            for (var future : futures) {
                future.get(TEST_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threadCount, slot.load().count);
        assertTrue(invocations.get() >= threadCount);
    }

    @Test
    @Timeout(value = TEST_TIMEOUT_SECONDS, unit = TimeUnit.SECONDS)
    void testRetriedMutationAppliesOnce() throws Exception {
        var slot = ConcurrentSlot.withStatistics(Tally.TYPE);
        var invocations = new AtomicInteger();
        var firstAttemptRunning = new CountDownLatch(1);
        var competitorDone = new CountDownLatch(1);
        Consumer<Tally> increment = value -> {
            invocations.incrementAndGet();
            value.increment();
        };

        var racer = new Thread(() -> slot.update(value -> {
            increment.accept(value);
            if (firstAttemptRunning.getCount() > 0) {
                firstAttemptRunning.countDown();
                await(competitorDone);
            }
        }), "racer");
        racer.start();

        firstAttemptRunning.await();
        slot.update(increment);
        competitorDone.countDown();
        racer.join();

        // The racer's first attempt lost its swap and ran again against the competitor's value
        assertEquals(3, invocations.get());
        assertEquals(new Tally(2), slot.load());

        var stats = slot.statistics();
        assertEquals(2, stats.getUpdateCount());
        assertEquals(1, stats.getRetryCount());
        assertEquals(1, stats.getMaxRetries());
    }

    @Test
    @Timeout(value = TEST_TIMEOUT_SECONDS, unit = TimeUnit.SECONDS)
    void testLosingResultIsDiscarded() throws Exception {
        var slot = new ConcurrentSlot<>(Tally.TYPE, new Tally(10));
        var firstAttemptRunning = new CountDownLatch(1);
        var competitorDone = new CountDownLatch(1);
        var result = new AtomicLong();

        var racer = new Thread(() -> result.set(slot.updateAndReturn(value -> {
            long before = value.count;
            value.increment();
            if (firstAttemptRunning.getCount() > 0) {
                firstAttemptRunning.countDown();
                await(competitorDone);
            }
            return before;
        })), "racer");
        racer.start();

        firstAttemptRunning.await();
        slot.store(new Tally(50));
        competitorDone.countDown();
        racer.join();

        assertEquals(50L, result.get());
        assertEquals(new Tally(51), slot.load());
    }

    @Test
    @Timeout(value = TEST_TIMEOUT_SECONDS, unit = TimeUnit.SECONDS)
    void testReaderKeepsSnapshotWhileWriterReplacesIt() throws Exception {
        var slot = new ConcurrentSlot<>(Tally.TYPE, new Tally(1));
        var reading = new CountDownLatch(1);
        var replaced = new CountDownLatch(1);
        var executor = Executors.newSingleThreadExecutor();

        try {
            var observed = executor.submit(() -> slot.read(value -> {
                var before = new Tally(value);
                reading.countDown();
                await(replaced);
                assertEquals(before, value);
                return value.count;
            }));

            reading.await();
            slot.store(new Tally(2));
            slot.reset();
            replaced.countDown();

            assertEquals(1L, observed.get(TEST_TIMEOUT_SECONDS, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        assertTrue(slot.isEmpty());
    }

    @Test
    void testConcurrentMixedOperations() throws Exception {
        final int threadCount = 8;
        final int operationsPerThread = 2_000;
        var slot = new ConcurrentSlot<>(Tally.TYPE);
        var executor = Executors.newFixedThreadPool(threadCount);
        var barrier = new CyclicBarrier(threadCount);
        var inconsistent = new AtomicInteger();

        try {
            var futures = IntStream.range(0, threadCount).mapToObj(threadId -> executor.submit(() -> {
                var random = ThreadLocalRandom.current();
                await(barrier);
                for (int i = 0; i < operationsPerThread; i++) {
                    switch (random.nextInt(6)) {
                        case 0 -> slot.store(new Tally(random.nextInt(1_000)));
                        case 1 -> slot.update(Tally::increment);
                        case 2 -> slot.reset();
                        case 3 -> slot.load(value -> {
                            if (!value.isConsistent()) {
                                inconsistent.incrementAndGet();
                            }
                        });
                        case 4 -> {
                            if (!slot.read(Tally::isConsistent)) {
                                inconsistent.incrementAndGet();
                            }
                        }
                        default -> slot.compareAndStore(slot.version(), new Tally(i));
                    }
                }
            })).toList();

            for (var future : futures) {
                future.get(TEST_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, inconsistent.get());
        assertTrue(slot.load().isConsistent());
    }

    static void await(CyclicBarrier barrier) {
        try {
            barrier.await(TEST_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        } catch (BrokenBarrierException | TimeoutException e) {
            throw new IllegalStateException(e);
        }
    }

    static void await(CountDownLatch latch) {
        try {
            if (!latch.await(TEST_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Timed out waiting for latch");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
