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

/**
 * Retry and backoff configuration for bounded updates.
 *
 * @author hal.hildebrand
 */
public class RetryPolicy {
    public final int  maxRetries;
    public final long baseBackoffNanos;
    public final long maxBackoffNanos;

    /**
     * @param maxRetries       maximum update attempts, at least one
     * @param baseBackoffNanos pause after the first failed attempt, doubled after each further failure
     * @param maxBackoffNanos  upper bound of a single pause
     */
    public RetryPolicy(int maxRetries, long baseBackoffNanos, long maxBackoffNanos) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be positive: " + maxRetries);
        }
        if (baseBackoffNanos < 0 || maxBackoffNanos < baseBackoffNanos) {
            throw new IllegalArgumentException(
            "Invalid backoff bounds: base=" + baseBackoffNanos + ", max=" + maxBackoffNanos);
        }
        this.maxRetries = maxRetries;
        this.baseBackoffNanos = baseBackoffNanos;
        this.maxBackoffNanos = maxBackoffNanos;
    }

    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(10, 1000, 1_000_000);
    }

    /**
     * Retries without pausing between attempts.
     */
    public static RetryPolicy noBackoff(int maxRetries) {
        return new RetryPolicy(maxRetries, 0, 0);
    }

    @Override
    public String toString() {
        return String.format("RetryPolicy{maxRetries=%d, baseBackoff=%dns, maxBackoff=%dns}", maxRetries,
                             baseBackoffNanos, maxBackoffNanos);
    }
}
