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

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Describes how a {@link ConcurrentSlot} obtains the default value of its type and how it makes private copies of
 * published values. Every slot constructor requires one, so a slot cannot exist for a type without a default.
 *
 * <p>Neither method may return {@code null}; the slot reserves {@code null} for its empty state.</p>
 *
 * @param <T> the value type
 * @author hal.hildebrand
 */
public interface ValueType<T> {

    /**
     * Value type for immutable values (records, strings, boxed primitives). Copies are the instance itself.
     *
     * @param defaults supplies the default value
     */
    static <T> ValueType<T> immutable(Supplier<? extends T> defaults) {
        Objects.requireNonNull(defaults, "defaults");
        return new ValueType<>() {
            @Override
            public T create() {
                return Objects.requireNonNull(defaults.get(), "default value supplier returned null");
            }

            @Override
            public T copy(T value) {
                return value;
            }
        };
    }

    /**
     * Value type for mutable values.
     *
     * @param defaults supplies the default value
     * @param copier   returns an independent copy of its argument
     */
    static <T> ValueType<T> mutable(Supplier<? extends T> defaults, UnaryOperator<T> copier) {
        Objects.requireNonNull(defaults, "defaults");
        Objects.requireNonNull(copier, "copier");
        return new ValueType<>() {
            @Override
            public T create() {
                return Objects.requireNonNull(defaults.get(), "default value supplier returned null");
            }

            @Override
            public T copy(T value) {
                return Objects.requireNonNull(copier.apply(value), "copier returned null");
            }
        };
    }

    /**
     * Value type for a mutable class whose default is produced by its public no-arg constructor.
     *
     * @param type   the value class
     * @param copier returns an independent copy of its argument
     * @throws IllegalArgumentException if the class is abstract or has no public no-arg constructor
     */
    static <T> ValueType<T> of(Class<T> type, UnaryOperator<T> copier) {
        Objects.requireNonNull(type, "type");
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new IllegalArgumentException(type.getName() + " cannot be instantiated");
        }
        final Constructor<T> constructor;
        try {
            constructor = type.getConstructor();
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(type.getName() + " has no public no-arg constructor", e);
        }
        return mutable(() -> {
            try {
                return constructor.newInstance();
            } catch (InvocationTargetException e) {
                var cause = e.getCause();
                if (cause instanceof RuntimeException re) {
                    throw re;
                }
                if (cause instanceof Error err) {
                    throw err;
                }
                throw new IllegalStateException("Unable to construct default " + type.getName(), cause);
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Unable to construct default " + type.getName(), e);
            }
        }, copier);
    }

    /**
     * @return a new instance holding the type's default value
     */
    T create();

    /**
     * @return a copy of the value that shares no mutable state with it
     */
    T copy(T value);
}
