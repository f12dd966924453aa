/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.traversal.matching;

import com.google.common.collect.ImmutableList;
import com.graphmatch.core.graph.Node;
import com.graphmatch.core.graph.Relationship;

import java.util.List;
import java.util.Objects;

/**
 * An alternating sequence of nodes and relationships, starting and ending with a node.
 */
public class MatchedPath {

    private final ImmutableList<Node> nodes;
    private final ImmutableList<Relationship> relationships;

    private MatchedPath(ImmutableList<Node> nodes, ImmutableList<Relationship> relationships) {
        assert nodes.size() == relationships.size() + 1;
        this.nodes = nodes;
        this.relationships = relationships;
    }

    public static MatchedPath start(Node node) {
        return new MatchedPath(ImmutableList.of(node), ImmutableList.of());
    }

    /**
     * @return a new path that follows {@code relationship} from the end of this one
     */
    public MatchedPath append(Relationship relationship) {
        return new MatchedPath(
                ImmutableList.<Node>builder().addAll(nodes).add(relationship.other(end())).build(),
                ImmutableList.<Relationship>builder().addAll(relationships).add(relationship).build()
        );
    }

    public Node start() {
        return nodes.get(0);
    }

    public Node end() {
        return nodes.get(nodes.size() - 1);
    }

    public List<Node> nodes() {
        return nodes;
    }

    public List<Relationship> relationships() {
        return relationships;
    }

    public int length() {
        return relationships.size();
    }

    public boolean contains(Relationship relationship) {
        return relationships.contains(relationship);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MatchedPath that = (MatchedPath) o;
        return nodes.equals(that.nodes) && relationships.equals(that.relationships);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, relationships);
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder().append("(").append(start().id()).append(")");
        for (int i = 0; i < relationships.size(); i++) {
            Relationship relationship = relationships.get(i);
            boolean forward = relationship.start().equals(nodes.get(i));
            str.append(forward ? "-[:" : "<-[:").append(relationship.type()).append(forward ? "]->" : "]-");
            str.append("(").append(nodes.get(i + 1).id()).append(")");
        }
        return str.toString();
    }
}
