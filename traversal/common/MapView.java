/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.traversal.common;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.graphmatch.core.common.iterator.FunctionalIterator;
import com.graphmatch.core.common.iterator.Iterators;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A read-only mapping from property names to values. Updates never change a view: {@link #set},
 * {@link #remove} and {@link #merge} return a new view, or fail when the view projects a graph entity.
 */
public interface MapView {

    Optional<Object> get(String key);

    boolean contains(String key);

    /**
     * Iterates the entries in insertion order for literal maps and in the store's enumeration order for
     * graph entities.
     */
    FunctionalIterator<Map.Entry<String, Object>> iterate();

    MapView set(String key, Object value);

    MapView remove(String key);

    MapView merge(MapView other);

    /**
     * Copies {@code values} into a literal view; keys mapped to null are left out.
     */
    static MapView of(Map<String, ?> values) {
        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
        values.forEach((key, value) -> {
            if (value != null) builder.put(key, value);
        });
        return new Literal(builder.build());
    }

    static MapView empty() {
        return new Literal(ImmutableMap.of());
    }

    /**
     * A map written in the query itself, held in memory.
     */
    class Literal implements MapView {

        private final ImmutableMap<String, Object> values;

        Literal(ImmutableMap<String, Object> values) {
            this.values = values;
        }

        @Override
        public Optional<Object> get(String key) {
            return Optional.ofNullable(values.get(key));
        }

        @Override
        public boolean contains(String key) {
            return values.containsKey(key);
        }

        @Override
        public FunctionalIterator<Map.Entry<String, Object>> iterate() {
            return Iterators.iterate(values.entrySet());
        }

        @Override
        public MapView set(String key, Object value) {
            if (value == null) return remove(key);
            Map<String, Object> copy = new LinkedHashMap<>(values);
            copy.put(key, value);
            return new Literal(ImmutableMap.copyOf(copy));
        }

        @Override
        public MapView remove(String key) {
            Map<String, Object> copy = new LinkedHashMap<>(values);
            copy.remove(key);
            return new Literal(ImmutableMap.copyOf(copy));
        }

        @Override
        public MapView merge(MapView other) {
            Map<String, Object> copy = new LinkedHashMap<>(values);
            other.iterate().forEachRemaining(entry -> {
                if (entry.getValue() != null) copy.put(entry.getKey(), entry.getValue());
            });
            return new Literal(ImmutableMap.copyOf(copy));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return values.equals(((Literal) o).values);
        }

        @Override
        public int hashCode() {
            return Objects.hash(values);
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }

    /**
     * A view over a {@link Map} produced outside the engine. Reads go straight to the wrapped map, which is
     * never copied or modified. Keys are seen through {@link String#valueOf(Object)}, and a key mapped to null
     * is contained in the view although {@link #get} finds no value for it.
     */
    class Adapted implements MapView {

        private final Map<?, ?> values;

        Adapted(Map<?, ?> values) {
            this.values = values;
        }

        @Nullable
        private Map.Entry<?, ?> entry(String key) {
            for (Map.Entry<?, ?> entry : values.entrySet()) {
                if (key.equals(String.valueOf(entry.getKey()))) return entry;
            }
            return null;
        }

        @Override
        public Optional<Object> get(String key) {
            Map.Entry<?, ?> entry = entry(key);
            return entry == null ? Optional.empty() : Optional.ofNullable(entry.getValue());
        }

        @Override
        public boolean contains(String key) {
            return entry(key) != null;
        }

        @Override
        public FunctionalIterator<Map.Entry<String, Object>> iterate() {
            return Iterators.iterate(values.entrySet().iterator())
                    .map(entry -> Maps.immutableEntry(String.valueOf(entry.getKey()), (Object) entry.getValue()));
        }

        @Override
        public MapView set(String key, Object value) {
            return copy().set(key, value);
        }

        @Override
        public MapView remove(String key) {
            return copy().remove(key);
        }

        @Override
        public MapView merge(MapView other) {
            return copy().merge(other);
        }

        private MapView copy() {
            Map<String, Object> copy = new LinkedHashMap<>();
            iterate().forEachRemaining(entry -> copy.put(entry.getKey(), entry.getValue()));
            return MapView.of(copy);
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }
}
