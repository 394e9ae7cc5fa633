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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Lock-free container for a value shared between threads. The slot is either empty or holds one immutable
 * {@link Snapshot} of the value; every write publishes a fresh snapshot with a single atomic reference swap, so a
 * reader always sees the whole of one write and never a mix of fields from two.
 *
 * <p>Read-modify-write goes through {@link #update(Consumer)} and its variants, which work on a private copy and
 * publish it with compare-and-swap. When another thread publishes first the attempt is discarded and the whole
 * sequence is retried against the newer snapshot, so <b>the mutation function may run more than once per call</b>.
 * It must depend only on its argument, or its side effects must be safe to repeat. The slot publishes a copy of the
 * mutated value, so neither the argument nor anything the function returns is shared with a snapshot.</p>
 *
 * <h2>Progress</h2>
 * <ul>
 *   <li>{@link #store}, {@link #load}, {@link #read}, {@link #reset} and {@link #isEmpty} are wait-free.</li>
 *   <li>{@link #update} and its variants are lock-free: some thread always succeeds, but one thread may retry
 *   without bound under contention. {@link #tryUpdate(Consumer, RetryPolicy)} caps the attempts.</li>
 * </ul>
 *
 * <h2>Memory ordering</h2>
 * Writes publish with release semantics and reads use acquire semantics, which is enough for a reader to see the
 * complete contents of the snapshot it obtained. Nothing is promised about other memory or other slots; callers that
 * need a happens-before edge with unrelated state must synchronize it themselves.
 *
 * <p>A slot cannot be copied and never hands out the live value: everything a caller receives is a copy made by the
 * slot's {@link ValueType}.</p>
 *
 * @param <T> the value type
 * @author hal.hildebrand
 */
public final class ConcurrentSlot<T> implements Supplier<T> {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentSlot.class);

    private final AtomicReference<Snapshot<T>> slot = new AtomicReference<>();
    private final ValueType<T>                 type;
    private final SlotStatistics               stats;

    /**
     * Creates an empty slot.
     *
     * @param type default and copy behavior of the value type
     */
    public ConcurrentSlot(ValueType<T> type) {
        this(type, false);
    }

    /**
     * Creates a slot holding a copy of the initial value.
     *
     * @param type    default and copy behavior of the value type
     * @param initial the initial value
     */
    public ConcurrentSlot(ValueType<T> type, T initial) {
        this(type, false);
        slot.set(new Snapshot<>(copyOf(Objects.requireNonNull(initial, "initial"))));
    }

    private ConcurrentSlot(ValueType<T> type, boolean enableStatistics) {
        this.type = Objects.requireNonNull(type, "type");
        this.stats = enableStatistics ? new SlotStatistics() : null;
    }

    /**
     * Creates a slot holding the type's default value.
     */
    public static <T> ConcurrentSlot<T> initialized(ValueType<T> type) {
        var slot = new ConcurrentSlot<>(type);
        slot.init();
        return slot;
    }

    /**
     * Creates an empty slot that records contention counters, see {@link #statistics()}.
     */
    public static <T> ConcurrentSlot<T> withStatistics(ValueType<T> type) {
        return new ConcurrentSlot<>(type, true);
    }

    /**
     * Replaces the current value with a copy of the given one.
     */
    public void store(T value) {
        Objects.requireNonNull(value, "value");
        slot.setRelease(new Snapshot<>(copyOf(value)));
        if (stats != null) {
            stats.recordStore();
        }
    }

    /**
     * @return a copy of the current value, or the type's default if the slot is empty
     */
    public T load() {
        var current = slot.getAcquire();
        return current == null ? defaultValue() : copyOf(current.getValue());
    }

    /**
     * Passes a copy of the current value to {@code out} unless the slot is empty, in which case {@code out} is not
     * called.
     *
     * @return false if the slot was empty
     */
    public boolean load(Consumer<? super T> out) {
        Objects.requireNonNull(out, "out");
        var current = slot.getAcquire();
        if (current == null) {
            return false;
        }
        out.accept(copyOf(current.getValue()));
        return true;
    }

    /**
     * @return a copy of the current value, empty if the slot is empty
     */
    public Optional<T> tryLoad() {
        var current = slot.getAcquire();
        return current == null ? Optional.empty() : Optional.of(copyOf(current.getValue()));
    }

    /**
     * Same as {@link #load()}.
     */
    @Override
    public T get() {
        return load();
    }

    /**
     * Applies the transform to the current value, or to the type's default if the slot is empty. The snapshot read
     * stays intact for the whole call even if a writer replaces it meanwhile; whatever the transform does to its
     * argument is invisible to other readers.
     *
     * @return the transform's result
     */
    public <R> R read(Function<? super T, ? extends R> transform) {
        Objects.requireNonNull(transform, "transform");
        var current = slot.getAcquire();
        return transform.apply(current == null ? defaultValue() : copyOf(current.getValue()));
    }

    /**
     * Mutates a private copy of the current value (or of the default, if empty) and publishes it, retrying until no
     * other write intervened. The mutation may run more than once.
     */
    public void update(Consumer<? super T> mutate) {
        Objects.requireNonNull(mutate, "mutate");
        updateAndReturn(value -> {
            mutate.accept(value);
            return null;
        });
    }

    /**
     * Like {@link #update(Consumer)}, returning what the successful invocation of {@code mutate} returned. Results
     * of invocations whose publication lost the race are discarded.
     */
    public <R> R updateAndReturn(Function<? super T, ? extends R> mutate) {
        Objects.requireNonNull(mutate, "mutate");
        int retries = 0;
        var current = slot.getAcquire();
        while (true) {
            var working = privateCopy(current);
            R result = mutate.apply(working);
            if (slot.compareAndSet(current, new Snapshot<>(copyOf(working)))) {
                if (stats != null) {
                    stats.recordUpdate(retries);
                }
                return result;
            }
            retries++;
            recordRetry(retries);
            current = slot.getAcquire();
        }
    }

    /**
     * Replacing form of {@link #update(Consumer)} for immutable values: the operator receives the current value (or
     * the default) and returns the value to publish.
     *
     * @return the operator's result, which the published snapshot does not share
     */
    public T updateAndGet(UnaryOperator<T> operator) {
        Objects.requireNonNull(operator, "operator");
        int retries = 0;
        var current = slot.getAcquire();
        while (true) {
            var next = Objects.requireNonNull(operator.apply(privateCopy(current)), "operator returned null");
            if (slot.compareAndSet(current, new Snapshot<>(copyOf(next)))) {
                if (stats != null) {
                    stats.recordUpdate(retries);
                }
                return next;
            }
            retries++;
            recordRetry(retries);
            current = slot.getAcquire();
        }
    }

    /**
     * Runs {@link #update(Consumer)} for at most {@code policy.maxRetries} attempts, backing off exponentially with
     * jitter between them. Nothing is published unless the result is {@link UpdateResult#SUCCESS}.
     */
    public UpdateResult tryUpdate(Consumer<? super T> mutate, RetryPolicy policy) {
        Objects.requireNonNull(mutate, "mutate");
        Objects.requireNonNull(policy, "policy");
        for (int attempt = 0; attempt < policy.maxRetries; attempt++) {
            if (attempt > 0 && !backoff(policy, attempt - 1)) {
                log.debug("Bounded update interrupted after {} attempts", attempt);
                return UpdateResult.INTERRUPTED;
            }
            var current = slot.getAcquire();
            var working = privateCopy(current);
            mutate.accept(working);
            if (slot.compareAndSet(current, new Snapshot<>(copyOf(working)))) {
                if (stats != null) {
                    stats.recordUpdate(attempt);
                }
                return UpdateResult.SUCCESS;
            }
            if (attempt + 1 < policy.maxRetries) {
                recordRetry(attempt + 1);
            }
        }
        if (stats != null) {
            stats.recordAbandoned();
        }
        log.debug("Bounded update abandoned after {} attempts", policy.maxRetries);
        return UpdateResult.MAX_RETRIES_EXCEEDED;
    }

    /**
     * Publishes a copy of the value only if the current snapshot still has the expected version.
     *
     * @param expectedVersion a version previously returned by {@link #version()}; 0 expects an empty slot
     * @return true if the value was published
     */
    public boolean compareAndStore(long expectedVersion, T value) {
        Objects.requireNonNull(value, "value");
        var current = slot.getAcquire();
        if (Snapshot.versionOf(current) != expectedVersion) {
            return false;
        }
        if (slot.compareAndSet(current, new Snapshot<>(copyOf(value)))) {
            if (stats != null) {
                stats.recordUpdate(0);
            }
            return true;
        }
        return false;
    }

    /**
     * Stores the type's default value.
     */
    public void init() {
        store(defaultValue());
    }

    /**
     * Empties the slot. Readers that already obtained the previous value keep it.
     */
    public void reset() {
        slot.setRelease(null);
    }

    public boolean isEmpty() {
        return slot.getOpaque() == null;
    }

    public boolean isPresent() {
        return !isEmpty();
    }

    /**
     * Identifies the current snapshot. Every write produces a new, process-wide unique version; versions do not order
     * writes.
     *
     * @return the current snapshot's version, 0 if empty
     */
    public long version() {
        return Snapshot.versionOf(slot.getAcquire());
    }

    /**
     * @return the contention counters, all zero unless statistics were enabled at construction
     */
    public SlotStatistics statistics() {
        return stats != null ? stats : new SlotStatistics();
    }

    public void resetStatistics() {
        if (stats != null) {
            stats.reset();
        }
    }

    @Override
    public String toString() {
        var current = slot.getAcquire();
        return current == null ? "ConcurrentSlot{empty}"
                               : String.format("ConcurrentSlot{version=%d, value=%s}", current.getVersion(),
                                               current.getValue());
    }

    private boolean backoff(RetryPolicy policy, int attempt) {
        long backoff = Math.min(policy.baseBackoffNanos * (1L << Math.min(attempt, 30)), policy.maxBackoffNanos);
        // Jitter of +/-25%
        long quarter = backoff / 4;
        long jitter = quarter > 0 ? ThreadLocalRandom.current().nextLong(-quarter, quarter) : 0;
        long delay = Math.max(0, backoff + jitter);
        if (delay == 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(delay / 1_000_000, (int) (delay % 1_000_000));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private T copyOf(T value) {
        return Objects.requireNonNull(type.copy(value), "value type copy returned null");
    }

    private T defaultValue() {
        return Objects.requireNonNull(type.create(), "value type default was null");
    }

    private T privateCopy(Snapshot<T> current) {
        return current == null ? defaultValue() : copyOf(current.getValue());
    }

    private void recordRetry(int retries) {
        if (stats != null) {
            stats.recordRetry();
        }
        if (log.isTraceEnabled()) {
            log.trace("Slot changed during update, retry {}", retries);
        }
    }
}
