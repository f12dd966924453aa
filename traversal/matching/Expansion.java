/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.traversal.matching;

import com.graphmatch.core.common.iterator.FunctionalIterator;
import com.graphmatch.core.graph.Relationship;

import java.util.Optional;

/**
 * The result of expanding one hop from a node: the relationships that qualify, produced lazily, and the step
 * that applies from their far nodes.
 */
public class Expansion {

    private final FunctionalIterator<Relationship> relationships;
    private final Optional<ExpanderStep> continuation;

    public Expansion(FunctionalIterator<Relationship> relationships, Optional<ExpanderStep> continuation) {
        this.relationships = relationships;
        this.continuation = continuation;
    }

    public FunctionalIterator<Relationship> relationships() {
        return relationships;
    }

    public Optional<ExpanderStep> continuation() {
        return continuation;
    }
}
