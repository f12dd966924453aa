/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.traversal;

import com.google.common.collect.ImmutableMap;
import com.graphmatch.core.common.exception.GraphMatchException;
import com.graphmatch.core.graph.QueryContext;

import java.util.Map;

import static com.graphmatch.core.common.exception.ErrorMessage.Expression.MISSING_PARAMETER;

/**
 * Ambient state of one running query: store access and the query parameters.
 */
public class QueryState {

    private final QueryContext query;
    private final Map<String, Object> parameters;

    public QueryState(QueryContext query) {
        this(query, ImmutableMap.of());
    }

    public QueryState(QueryContext query, Map<String, Object> parameters) {
        this.query = query;
        this.parameters = ImmutableMap.copyOf(parameters);
    }

    public QueryContext query() {
        return query;
    }

    public Object parameter(String name) {
        if (!parameters.containsKey(name)) throw GraphMatchException.of(MISSING_PARAMETER, name);
        return parameters.get(name);
    }
}
