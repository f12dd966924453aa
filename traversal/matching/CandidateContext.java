/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.traversal.matching;

import com.google.common.collect.ImmutableMap;
import com.graphmatch.core.common.exception.GraphMatchException;
import com.graphmatch.core.graph.Node;
import com.graphmatch.core.graph.Relationship;
import com.graphmatch.core.traversal.ExecutionContext;

import java.util.Optional;

import static com.graphmatch.core.common.exception.ErrorMessage.Internal.ILLEGAL_OPERATION;

/**
 * The bindings a hop's predicates are evaluated against: the candidate relationship as {@code r} and the node
 * it leads to as {@code n}. Any other identifier is looked up in the context the expansion runs in.
 * A candidate context lives for a single predicate evaluation.
 */
public class CandidateContext extends ExecutionContext {

    public static final String RELATIONSHIP = "r";
    public static final String NODE = "n";

    private final Relationship relationship;
    private final Node node;
    private final ExecutionContext outer;

    public CandidateContext(Relationship relationship, Node node, ExecutionContext outer) {
        super(outer.state(), ImmutableMap.of());
        this.relationship = relationship;
        this.node = node;
        this.outer = outer;
    }

    public Relationship relationship() {
        return relationship;
    }

    public Node node() {
        return node;
    }

    @Override
    public Optional<Object> get(String identifier) {
        if (RELATIONSHIP.equals(identifier)) return Optional.of(relationship);
        else if (NODE.equals(identifier)) return Optional.of(node);
        else return outer.get(identifier);
    }

    @Override
    public ExecutionContext put(String identifier, Object value) {
        throw GraphMatchException.of(ILLEGAL_OPERATION);
    }

    @Override
    public ExecutionContext newWith(String identifier, Object value) {
        throw GraphMatchException.of(ILLEGAL_OPERATION);
    }

    @Override
    public String toString() {
        return "CandidateContext{" + RELATIONSHIP + "=" + relationship + ", " + NODE + "=" + node + "}";
    }
}
