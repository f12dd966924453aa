/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.traversal.matching;

import com.graphmatch.core.common.iterator.LookaheadIterator;
import com.graphmatch.core.graph.Node;
import com.graphmatch.core.graph.Relationship;
import com.graphmatch.core.traversal.ExecutionContext;
import com.graphmatch.core.traversal.predicate.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Iterator;

/**
 * Relationships of a node that pass a predicate, checked one at a time as the iterator is pulled. At most one
 * accepted relationship is held ahead of the caller, so store reads made by the predicate never run ahead of
 * consumption. The iterator is single pass.
 */
class ExpansionIterator extends LookaheadIterator<Relationship> {

    private static final Logger LOG = LoggerFactory.getLogger(ExpansionIterator.class);

    private final Iterator<Relationship> source;
    private final Node node;
    private final Predicate predicate;
    private final ExecutionContext context;

    ExpansionIterator(Iterator<Relationship> source, Node node, Predicate predicate, ExecutionContext context) {
        this.source = source;
        this.node = node;
        this.predicate = predicate;
        this.context = context;
    }

    @Nullable
    @Override
    protected Relationship fetch() {
        while (source.hasNext()) {
            Relationship candidate = source.next();
            if (predicate.isMatch(new CandidateContext(candidate, candidate.other(node), context))) return candidate;
            else if (LOG.isTraceEnabled()) LOG.trace("Rejected {} from {}: {} does not hold", candidate, node, predicate);
        }
        return null;
    }
}
