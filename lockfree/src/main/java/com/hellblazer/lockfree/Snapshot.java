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

/**
 * Immutable, versioned copy of a slot's value. A new snapshot is created for every write and is never modified after
 * it has been published. Superseded snapshots stay reachable for as long as some reader still holds them and are
 * reclaimed by the collector afterwards.
 *
 * <p>The wrapped value must not be handed out for mutation. {@link ConcurrentSlot} only exposes it to callers through
 * the slot's {@link ValueType#copy(Object)} function.</p>
 *
 * @param <T> the value type
 * @author hal.hildebrand
 */
final class Snapshot<T> {

    /** Version reported for an empty slot */
    static final long EMPTY_VERSION = 0L;

    private static final AtomicLong VERSION_GENERATOR = new AtomicLong(EMPTY_VERSION);

    private final long version;
    private final T    value;

    Snapshot(T value) {
        this.version = VERSION_GENERATOR.incrementAndGet();
        this.value = value;
    }

    /**
     * Version of the given snapshot, {@link #EMPTY_VERSION} for null.
     */
    static long versionOf(Snapshot<?> snapshot) {
        return snapshot == null ? EMPTY_VERSION : snapshot.version;
    }

    long getVersion() {
        return version;
    }

    T getValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("Snapshot{version=%d, value=%s}", version, value);
    }
}
