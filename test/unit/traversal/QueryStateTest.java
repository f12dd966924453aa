/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.traversal;

import com.google.common.collect.ImmutableMap;
import com.graphmatch.core.common.exception.ErrorMessage;
import com.graphmatch.core.common.exception.GraphMatchException;
import com.graphmatch.core.common.settings.SystemProperty;
import com.graphmatch.core.graph.MemoryGraph;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertSame;
import static junit.framework.TestCase.fail;

public class QueryStateTest {

    @Test
    public void creating_a_state_reads_no_configuration() {
        MemoryGraph graph = new MemoryGraph();

        SystemProperty.CONFIGURATION_FILE.set("/does/not/exist/graphmatch.properties");
        try {
            QueryState state = new QueryState(graph);
            assertSame(graph, state.query());
        } finally {
            SystemProperty.CONFIGURATION_FILE.clear();
        }
    }

    @Test
    public void parameters_are_copied_when_the_state_is_created() {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("name", "Alice");
        QueryState state = new QueryState(new MemoryGraph(), parameters);
        parameters.put("name", "Bob");

        assertEquals("Alice", state.parameter("name"));
    }

    @Test
    public void missing_parameters_are_reported() {
        QueryState state = new QueryState(new MemoryGraph(), ImmutableMap.of("name", "Alice"));

        try {
            state.parameter("age");
            fail();
        } catch (GraphMatchException e) {
            assertEquals(ErrorMessage.Expression.MISSING_PARAMETER, e.errorMessage());
        }
    }
}
