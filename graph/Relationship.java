/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.graph;

import com.graphmatch.core.common.exception.GraphMatchException;

import static com.graphmatch.core.common.exception.ErrorMessage.Internal.ILLEGAL_ARGUMENT;

public interface Relationship extends Entity {

    String type();

    Node start();

    Node end();

    default Node other(Node node) {
        if (start().equals(node)) return end();
        else if (end().equals(node)) return start();
        else throw GraphMatchException.of(ILLEGAL_ARGUMENT);
    }
}
