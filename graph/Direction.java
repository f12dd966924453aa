/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.graph;

/**
 * The direction in which relationships are followed, relative to the node being expanded.
 */
public enum Direction {
    OUTGOING(true, false),
    INCOMING(false, true),
    BOTH(true, true);

    private final boolean followsOut;
    private final boolean followsIn;

    Direction(boolean followsOut, boolean followsIn) {
        this.followsOut = followsOut;
        this.followsIn = followsIn;
    }

    public boolean followsOut() {
        return followsOut;
    }

    public boolean followsIn() {
        return followsIn;
    }

    public Direction reverse() {
        switch (this) {
            case OUTGOING:
                return INCOMING;
            case INCOMING:
                return OUTGOING;
            default:
                return BOTH;
        }
    }

    /**
     * Whether the relationship is travelled in this direction when leaving the given node.
     */
    public boolean matches(Relationship relationship, Node from) {
        return (followsOut && relationship.start().equals(from)) || (followsIn && relationship.end().equals(from));
    }
}
