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

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Contention counters for a single slot. Safe to update from any number of threads; a read of several counters is
 * not an atomic snapshot of all of them.
 *
 * @author hal.hildebrand
 */
public class SlotStatistics {

    private final LongAdder  stores     = new LongAdder();
    private final LongAdder  updates    = new LongAdder();
    private final LongAdder  retries    = new LongAdder();
    private final LongAdder  abandoned  = new LongAdder();
    private final AtomicLong maxRetries = new AtomicLong();

    void recordStore() {
        stores.increment();
    }

    void recordUpdate(int retryCount) {
        updates.increment();
        if (retryCount > 0) {
            maxRetries.accumulateAndGet(retryCount, Math::max);
        }
    }

    void recordRetry() {
        retries.increment();
    }

    void recordAbandoned() {
        abandoned.increment();
    }

    /**
     * @return number of unconditional stores, including {@code init()}
     */
    public long getStoreCount() {
        return stores.sum();
    }

    /**
     * @return number of updates that published a snapshot
     */
    public long getUpdateCount() {
        return updates.sum();
    }

    /**
     * @return number of times an update lost its compare-and-swap and tried again
     */
    public long getRetryCount() {
        return retries.sum();
    }

    /**
     * @return number of bounded updates that gave up
     */
    public long getAbandonedCount() {
        return abandoned.sum();
    }

    /**
     * @return most retries a single successful update needed
     */
    public long getMaxRetries() {
        return maxRetries.get();
    }

    public double getAverageRetries() {
        long count = getUpdateCount();
        return count == 0 ? 0.0 : (double) getRetryCount() / count;
    }

    void reset() {
        stores.reset();
        updates.reset();
        retries.reset();
        abandoned.reset();
        maxRetries.set(0);
    }

    @Override
    public String toString() {
        return String.format("SlotStatistics{stores=%d, updates=%d, retries=%d, avgRetries=%.1f, maxRetries=%d, abandoned=%d}",
                             getStoreCount(), getUpdateCount(), getRetryCount(), getAverageRetries(),
                             getMaxRetries(), getAbandonedCount());
    }
}
