/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.traversal.common;

import com.google.common.collect.Maps;
import com.graphmatch.core.common.exception.GraphMatchException;
import com.graphmatch.core.common.iterator.FunctionalIterator;
import com.graphmatch.core.common.iterator.Iterators;
import com.graphmatch.core.graph.Entity;
import com.graphmatch.core.graph.QueryContext;

import java.util.Map;
import java.util.Optional;

import static com.graphmatch.core.common.exception.ErrorMessage.Internal.ILLEGAL_OPERATION_ON_ENTITY_MAP;

/**
 * The properties of a node or relationship seen as a {@link MapView}. Nothing is cached: every read goes
 * back to the store through the entity's {@link QueryContext.Operations}.
 *
 * @param <T> the kind of entity projected
 */
public class EntityMapView<T extends Entity> implements MapView {

    private final T entity;
    private final QueryContext.Operations<T> ops;

    EntityMapView(T entity, QueryContext.Operations<T> ops) {
        this.entity = entity;
        this.ops = ops;
    }

    public T entity() {
        return entity;
    }

    @Override
    public Optional<Object> get(String key) {
        if (ops.hasProperty(entity, key)) return Optional.ofNullable(ops.getProperty(entity, key));
        else return Optional.empty();
    }

    @Override
    public boolean contains(String key) {
        return ops.hasProperty(entity, key);
    }

    @Override
    public FunctionalIterator<Map.Entry<String, Object>> iterate() {
        return Iterators.iterate(ops.propertyKeys(entity)).map(key -> Maps.immutableEntry(key, ops.getProperty(entity, key)));
    }

    @Override
    public MapView set(String key, Object value) {
        throw GraphMatchException.of(ILLEGAL_OPERATION_ON_ENTITY_MAP, "set", entity);
    }

    @Override
    public MapView remove(String key) {
        throw GraphMatchException.of(ILLEGAL_OPERATION_ON_ENTITY_MAP, "remove", entity);
    }

    @Override
    public MapView merge(MapView other) {
        throw GraphMatchException.of(ILLEGAL_OPERATION_ON_ENTITY_MAP, "merge", entity);
    }

    @Override
    public String toString() {
        return "properties of " + entity;
    }
}
