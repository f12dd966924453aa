/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.graph;

import java.util.Iterator;

/**
 * The read capability of the property-graph store, as seen by a running query.
 */
public interface QueryContext {

    /**
     * Returns the relationships attached to {@code node} that travel in {@code direction} and have one of the
     * given {@code types}, or any type when none are given. Implementations stream the result rather than
     * materialising it.
     */
    Iterator<Relationship> relationshipsFor(Node node, Direction direction, String... types);

    Operations<Node> nodeOps();

    Operations<Relationship> relationshipOps();

    interface Operations<T extends Entity> {

        boolean hasProperty(T entity, String key);

        Object getProperty(T entity, String key);

        Iterator<String> propertyKeys(T entity);
    }
}
