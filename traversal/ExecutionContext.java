/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.traversal;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The bindings of identifiers to values visible while a query row is being evaluated, together with the
 * {@link QueryState} of the query. A context is owned by the evaluation that created it and is never
 * shared between concurrent evaluations.
 */
public class ExecutionContext {

    private final QueryState state;
    private final Map<String, Object> bindings;

    public ExecutionContext(QueryState state) {
        this(state, new LinkedHashMap<>());
    }

    protected ExecutionContext(QueryState state, Map<String, Object> bindings) {
        this.state = state;
        this.bindings = bindings;
    }

    public QueryState state() {
        return state;
    }

    public Optional<Object> get(String identifier) {
        return Optional.ofNullable(bindings.get(identifier));
    }

    public boolean contains(String identifier) {
        return get(identifier).isPresent();
    }

    public ExecutionContext put(String identifier, Object value) {
        bindings.put(identifier, value);
        return this;
    }

    public ExecutionContext newWith(String identifier, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(bindings);
        copy.put(identifier, value);
        return new ExecutionContext(state, copy);
    }

    @Override
    public String toString() {
        return "ExecutionContext" + bindings;
    }
}
