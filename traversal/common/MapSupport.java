/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.traversal.common;

import com.graphmatch.core.common.exception.GraphMatchException;
import com.graphmatch.core.graph.Node;
import com.graphmatch.core.graph.QueryContext;
import com.graphmatch.core.graph.Relationship;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static com.graphmatch.core.common.exception.ErrorMessage.Expression.NOT_A_MAP;

/**
 * Treats literal maps, foreign {@link Map}s, nodes and relationships uniformly as bags of named values.
 *
 * Classification and binding are separate steps: {@link #castToMap(Object)} decides the shape of a value
 * straight away, but reading the properties of a graph entity needs the {@link QueryContext} of the running
 * query, so the view itself is only built once that context is supplied.
 */
public class MapSupport {

    public enum Shape {
        LITERAL,
        ADAPTED,
        NODE,
        RELATIONSHIP;

        public boolean isEntity() {
            return this == NODE || this == RELATIONSHIP;
        }
    }

    public static Optional<Shape> classify(Object value) {
        if (value instanceof MapView) return Optional.of(Shape.LITERAL);
        else if (value instanceof Map<?, ?>) return Optional.of(Shape.ADAPTED);
        else if (value instanceof Node) return Optional.of(Shape.NODE);
        else if (value instanceof Relationship) return Optional.of(Shape.RELATIONSHIP);
        else return Optional.empty();
    }

    public static boolean isMap(Object value) {
        return classify(value).isPresent();
    }

    public static Function<QueryContext, MapView> castToMap(Object value) {
        Shape shape = classify(value).orElseThrow(() -> GraphMatchException.of(NOT_A_MAP, value, className(value)));
        switch (shape) {
            case LITERAL:
                return query -> (MapView) value;
            case ADAPTED:
                return query -> new MapView.Adapted((Map<?, ?>) value);
            case NODE:
                return query -> new EntityMapView<>((Node) value, query.nodeOps());
            case RELATIONSHIP:
                return query -> new EntityMapView<>((Relationship) value, query.relationshipOps());
            default:
                throw GraphMatchException.of(NOT_A_MAP, value, className(value));
        }
    }

    private static String className(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
