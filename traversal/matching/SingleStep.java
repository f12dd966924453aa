/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.traversal.matching;

import com.graphmatch.core.graph.Direction;
import com.graphmatch.core.graph.Node;
import com.graphmatch.core.traversal.ExecutionContext;
import com.graphmatch.core.traversal.predicate.Predicate;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;

/**
 * A hop that follows exactly one relationship.
 */
public class SingleStep extends ExpanderStep {

    public SingleStep(int id, List<String> types, Direction direction, Optional<ExpanderStep> next,
                      Predicate relationshipPredicate, Predicate nodePredicate) {
        this(id, types, direction, next.orElse(null), relationshipPredicate, nodePredicate);
    }

    private SingleStep(int id, List<String> types, Direction direction, @Nullable ExpanderStep next,
                       Predicate relationshipPredicate, Predicate nodePredicate) {
        super(id, types, direction, next, relationshipPredicate, nodePredicate);
    }

    @Override
    public Expansion expand(Node node, ExecutionContext context) {
        return new Expansion(matchingRelationships(node, context), next());
    }

    @Override
    public ExpanderStep createCopy(Optional<ExpanderStep> next, Direction direction, Predicate nodePredicate) {
        return new SingleStep(id, types, direction, next, relationshipPredicate, nodePredicate);
    }

    @Override
    public Optional<Integer> size() {
        if (next == null) return Optional.of(1);
        else return next.size().map(size -> size + 1);
    }

    @Override
    public boolean shouldInclude() {
        return false;
    }
}
