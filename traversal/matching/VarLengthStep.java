/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.traversal.matching;

import com.graphmatch.core.common.exception.GraphMatchException;
import com.graphmatch.core.graph.Direction;
import com.graphmatch.core.graph.Node;
import com.graphmatch.core.traversal.ExecutionContext;
import com.graphmatch.core.traversal.predicate.Predicate;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.graphmatch.core.common.exception.ErrorMessage.Internal.ILLEGAL_ARGUMENT;

/**
 * A hop repeated between {@code min} and {@code max} times, every repetition matching the same types,
 * direction and predicates. Without a {@code max} the hop is unbounded.
 *
 * Each expansion follows one repetition and continues with this step shortened by one, until the last
 * allowed repetition hands over to {@link #next()}. Once {@code min} reaches zero the step is already
 * satisfied at the current node ({@link #shouldInclude()}), and the matcher also continues with
 * {@link #next()} from there.
 */
public class VarLengthStep extends ExpanderStep {

    private final int min;
    @Nullable
    private final Integer max;

    public VarLengthStep(int id, List<String> types, Direction direction, int min, Optional<Integer> max,
                         Optional<ExpanderStep> next, Predicate relationshipPredicate, Predicate nodePredicate) {
        this(id, types, direction, min, max.orElse(null), next.orElse(null), relationshipPredicate, nodePredicate);
    }

    private VarLengthStep(int id, List<String> types, Direction direction, int min, @Nullable Integer max,
                          @Nullable ExpanderStep next, Predicate relationshipPredicate, Predicate nodePredicate) {
        super(id, types, direction, next, relationshipPredicate, nodePredicate);
        if (min < 0 || (max != null && (max < 1 || max < min))) throw GraphMatchException.of(ILLEGAL_ARGUMENT);
        this.min = min;
        this.max = max;
    }

    public int min() {
        return min;
    }

    public Optional<Integer> max() {
        return Optional.ofNullable(max);
    }

    @Override
    public Expansion expand(Node node, ExecutionContext context) {
        return new Expansion(matchingRelationships(node, context), afterOneRepetition());
    }

    private Optional<ExpanderStep> afterOneRepetition() {
        if (max != null && max == 1) return next();
        return Optional.of(new VarLengthStep(
                id, types, direction, Math.max(0, min - 1), max == null ? null : max - 1,
                next, relationshipPredicate, nodePredicate
        ));
    }

    @Override
    public ExpanderStep createCopy(Optional<ExpanderStep> next, Direction direction, Predicate nodePredicate) {
        return new VarLengthStep(id, types, direction, min, max, next.orElse(null), relationshipPredicate, nodePredicate);
    }

    @Override
    public Optional<Integer> size() {
        if (max == null) return Optional.empty();
        else if (next == null) return Optional.of(max);
        else return next.size().map(size -> size + max);
    }

    @Override
    public boolean shouldInclude() {
        return min == 0;
    }

    @Override
    public boolean isVarLength() {
        return true;
    }

    @Override
    public VarLengthStep asVarLength() {
        return this;
    }

    @Override
    String relationshipInfo() {
        String bounds = "*" + min + ".." + (max == null ? "" : max);
        if (types.isEmpty()) return "[" + bounds + "]";
        else return String.format("[:%s%s {%s,%s}]", String.join("|", types), bounds, relationshipPredicate, nodePredicate);
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        VarLengthStep that = (VarLengthStep) o;
        return min == that.min && Objects.equals(max, that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), min, max);
    }
}
