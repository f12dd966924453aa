/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.traversal.matching;

import com.google.common.collect.ImmutableList;
import com.graphmatch.core.common.exception.GraphMatchException;
import com.graphmatch.core.common.iterator.FunctionalIterator;
import com.graphmatch.core.graph.Direction;
import com.graphmatch.core.graph.Node;
import com.graphmatch.core.graph.Relationship;
import com.graphmatch.core.traversal.ExecutionContext;
import com.graphmatch.core.traversal.predicate.Predicate;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.graphmatch.core.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;

/**
 * One hop of a pattern chain: which relationships to follow from the current node, which conditions the
 * relationship and the node it leads to must meet, and the step that applies after it.
 *
 * Steps are immutable. Each step owns its continuation, and chains are acyclic.
 */
public abstract class ExpanderStep {

    final int id;
    final List<String> types;
    final Direction direction;
    @Nullable
    final ExpanderStep next;
    final Predicate relationshipPredicate;
    final Predicate nodePredicate;

    ExpanderStep(int id, List<String> types, Direction direction, @Nullable ExpanderStep next,
                 Predicate relationshipPredicate, Predicate nodePredicate) {
        this.id = id;
        this.types = ImmutableList.copyOf(types);
        this.direction = direction;
        this.next = next;
        this.relationshipPredicate = relationshipPredicate;
        this.nodePredicate = nodePredicate;
    }

    public int id() {
        return id;
    }

    /**
     * @return the relationship types to follow; empty when any type is accepted
     */
    public List<String> types() {
        return types;
    }

    public Direction direction() {
        return direction;
    }

    public Optional<ExpanderStep> next() {
        return Optional.ofNullable(next);
    }

    public Predicate relationshipPredicate() {
        return relationshipPredicate;
    }

    public Predicate nodePredicate() {
        return nodePredicate;
    }

    /**
     * Finds the relationships of {@code node} this hop accepts. Direction and types are handed to the store;
     * the predicates run only as the returned relationships are iterated.
     */
    public abstract Expansion expand(Node node, ExecutionContext context);

    public abstract ExpanderStep createCopy(Optional<ExpanderStep> next, Direction direction, Predicate nodePredicate);

    /**
     * @return the number of hops from this step to the end of the chain, or empty if any of them is unbounded
     */
    public abstract Optional<Integer> size();

    /**
     * @return true if this step may be completed at the current node without following a relationship
     */
    public abstract boolean shouldInclude();

    public boolean isVarLength() {
        return false;
    }

    public VarLengthStep asVarLength() {
        throw GraphMatchException.of(ILLEGAL_CAST, getClass().getSimpleName(), VarLengthStep.class.getSimpleName());
    }

    FunctionalIterator<Relationship> matchingRelationships(Node node, ExecutionContext context) {
        Iterator<Relationship> candidates = context.state().query().relationshipsFor(
                node, direction, types.toArray(new String[0])
        );
        return new ExpansionIterator(candidates, node, new Predicate.And(relationshipPredicate, nodePredicate), context);
    }

    public ExpanderStep reverse() {
        return reverse(Predicate.TRUE);
    }

    /**
     * Rebuilds this chain to be walked from its far end. Every node predicate moves to the reversed hop that
     * arrives at the node it constrains; the hop that arrives back at this chain's start node gets
     * {@code startNodePredicate}. The node predicate of the last hop constrains the node the reversed walk
     * starts from, so it is not part of the reversed chain.
     */
    public ExpanderStep reverse(Predicate startNodePredicate) {
        List<ExpanderStep> steps = new ArrayList<>();
        for (ExpanderStep step = this; step != null; step = step.next) steps.add(step);

        Optional<ExpanderStep> reversed = Optional.empty();
        for (int i = 0; i < steps.size(); i++) {
            ExpanderStep step = steps.get(i);
            Predicate arrivalPredicate = i == 0 ? startNodePredicate : steps.get(i - 1).nodePredicate;
            reversed = Optional.of(step.createCopy(reversed, step.direction.reverse(), arrivalPredicate));
        }
        return reversed.get();
    }

    String relationshipInfo() {
        if (types.isEmpty()) return "";
        else return String.format("[:%s {%s,%s}]", String.join("|", types), relationshipPredicate, nodePredicate);
    }

    @Override
    public String toString() {
        String left = direction == Direction.OUTGOING ? "" : "<";
        String right = direction == Direction.INCOMING ? "" : ">";
        String shape = String.format("(%s)%s-%s-%s", id, left, relationshipInfo(), right);
        if (next == null) return shape + "()";
        else return shape + next;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExpanderStep that = (ExpanderStep) o;
        return id == that.id &&
                direction == that.direction &&
                Objects.equals(next, that.next) &&
                types.equals(that.types) &&
                relationshipPredicate.equals(that.relationshipPredicate) &&
                nodePredicate.equals(that.nodePredicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, direction, next, types, relationshipPredicate, nodePredicate);
    }
}
