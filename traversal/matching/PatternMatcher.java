/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.traversal.matching;

import com.graphmatch.core.common.iterator.FunctionalIterator;
import com.graphmatch.core.common.settings.Config;
import com.graphmatch.core.graph.Node;
import com.graphmatch.core.traversal.ExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static com.graphmatch.core.common.iterator.Iterators.empty;
import static com.graphmatch.core.common.iterator.Iterators.single;
import static com.graphmatch.core.common.settings.MatchingSettings.MAX_PATH_LENGTH;
import static com.graphmatch.core.common.settings.MatchingSettings.RELATIONSHIP_UNIQUENESS;

/**
 * Walks a chain of {@link ExpanderStep}s from a start node and produces every path that satisfies it.
 *
 * The walk is depth first and pulled by the caller: nothing beyond the path currently being extended is
 * computed until the returned iterator asks for it, and abandoning the iterator early is always safe.
 */
public class PatternMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(PatternMatcher.class);

    private final boolean relationshipUniqueness;
    private final int maxPathLength;

    public PatternMatcher(Config config) {
        this(config.get(RELATIONSHIP_UNIQUENESS), config.get(MAX_PATH_LENGTH));
    }

    public PatternMatcher(boolean relationshipUniqueness, int maxPathLength) {
        this.relationshipUniqueness = relationshipUniqueness;
        this.maxPathLength = maxPathLength;
    }

    public FunctionalIterator<MatchedPath> match(Node start, ExpanderStep chain, ExecutionContext context) {
        LOG.debug("Matching {} from node {}", chain, start.id());
        return extend(MatchedPath.start(start), Optional.of(chain), context);
    }

    private FunctionalIterator<MatchedPath> extend(MatchedPath path, Optional<ExpanderStep> step,
                                                   ExecutionContext context) {
        if (step.isEmpty()) {
            LOG.trace("Matched {}", path);
            return single(path);
        }

        ExpanderStep current = step.get();
        FunctionalIterator<MatchedPath> completedHere = current.shouldInclude()
                ? single(path).flatMap(p -> extend(p, current.next(), context))
                : empty();
        if (path.length() >= maxPathLength) {
            LOG.debug("Pruned {} at the maximum path length of {}", path, maxPathLength);
            return completedHere;
        }

        Expansion expansion = current.expand(path.end(), context);
        FunctionalIterator<MatchedPath> expanded = expansion.relationships()
                .filter(relationship -> !relationshipUniqueness || !path.contains(relationship))
                .flatMap(relationship -> extend(path.append(relationship), expansion.continuation(), context));
        return completedHere.link(expanded);
    }
}
