/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.traversal.common;

import com.google.common.collect.ImmutableMap;
import com.graphmatch.core.common.exception.ErrorMessage;
import com.graphmatch.core.common.exception.GraphMatchException;
import com.graphmatch.core.graph.MemoryGraph;
import com.graphmatch.core.graph.MemoryGraph.MemoryNode;
import com.graphmatch.core.graph.MemoryGraph.MemoryRelationship;
import com.graphmatch.core.graph.Node;
import com.graphmatch.core.graph.QueryContext;
import org.junit.Before;
import org.junit.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertFalse;
import static junit.framework.TestCase.assertSame;
import static junit.framework.TestCase.assertTrue;
import static junit.framework.TestCase.fail;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

public class MapSupportTest {

    private MemoryGraph graph;
    private MemoryNode alice;
    private MemoryRelationship knows;

    @Before
    public void setup() {
        graph = new MemoryGraph();
        alice = graph.createNode("name", "Alice", "born", 1990);
        knows = graph.createRelationship(alice, "KNOWS", graph.createNode(), "since", 2001);
    }

    private static List<String> keys(MapView view) {
        return view.iterate().map(Map.Entry::getKey).toList();
    }

    @Test
    public void values_are_classified_by_shape() {
        assertEquals(Optional.of(MapSupport.Shape.LITERAL), MapSupport.classify(MapView.empty()));
        assertEquals(Optional.of(MapSupport.Shape.ADAPTED), MapSupport.classify(new HashMap<String, Object>()));
        assertEquals(Optional.of(MapSupport.Shape.NODE), MapSupport.classify(alice));
        assertEquals(Optional.of(MapSupport.Shape.RELATIONSHIP), MapSupport.classify(knows));
        assertEquals(Optional.empty(), MapSupport.classify("a string"));
        assertTrue(MapSupport.Shape.NODE.isEntity());
        assertFalse(MapSupport.Shape.ADAPTED.isEntity());

        assertTrue(MapSupport.isMap(alice));
        assertFalse(MapSupport.isMap(42));
        assertFalse(MapSupport.isMap(null));
    }

    @Test
    public void literal_maps_keep_their_insertion_order() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("a", 1);
        values.put("b", 2);
        MapView literal = MapView.of(values);

        MapView view = MapSupport.castToMap(literal).apply(graph);

        assertSame(literal, view);
        assertEquals(Optional.of(1), view.get("a"));
        assertTrue(view.contains("b"));
        assertFalse(view.contains("c"));
        assertEquals(Optional.empty(), view.get("c"));
        assertThat(keys(view), contains("a", "b"));
    }

    @Test
    public void literal_updates_return_new_views() {
        MapView literal = MapView.of(ImmutableMap.of("a", 1, "b", 2));

        MapView updated = literal.set("c", 3).remove("a");
        MapView merged = literal.merge(MapView.of(ImmutableMap.of("b", 20, "d", 4)));

        assertThat(keys(literal), contains("a", "b"));
        assertThat(keys(updated), contains("b", "c"));
        assertEquals(Optional.of(20), merged.get("b"));
        assertThat(keys(merged), contains("a", "b", "d"));
        assertEquals(MapView.of(ImmutableMap.of("b", 2)), literal.set("a", null));
    }

    @Test
    public void null_values_are_left_out_of_literals() {
        Map<String, Object> values = new HashMap<>();
        values.put("a", null);

        MapView view = MapView.of(values);

        assertFalse(view.contains("a"));
        assertEquals(MapView.empty(), view);
    }

    @Test
    public void foreign_maps_are_wrapped_without_copying() {
        Map<String, Object> foreign = new LinkedHashMap<>();
        foreign.put("x", "1");

        MapView view = MapSupport.castToMap(foreign).apply(graph);
        foreign.put("y", "2");

        assertEquals(Optional.of("2"), view.get("y"));
        assertThat(keys(view), contains("x", "y"));

        MapView updated = view.set("z", "3");
        assertFalse(foreign.containsKey("z"));
        assertEquals(Optional.of("3"), updated.get("z"));
        assertTrue(updated instanceof MapView.Literal);
    }

    @Test
    public void foreign_keys_mapped_to_null_are_still_contained() {
        Map<String, Object> foreign = new HashMap<>();
        foreign.put("k", null);

        MapView view = MapSupport.castToMap(foreign).apply(graph);

        assertTrue(view.contains("k"));
        assertEquals(Optional.empty(), view.get("k"));
        assertThat(keys(view), contains("k"));
        assertFalse(view.contains("other"));
        assertFalse(view.set("x", 1).contains("k"));
    }

    @Test
    public void foreign_keys_are_read_as_strings() {
        Map<Integer, String> foreign = new LinkedHashMap<>();
        foreign.put(1, "one");
        foreign.put(2, "two");

        MapView view = MapSupport.castToMap(foreign).apply(graph);

        assertThat(keys(view), contains("1", "2"));
        assertEquals(Optional.of("two"), view.get("2"));
        assertTrue(view.contains("1"));
        assertEquals(Optional.of("one"), view.remove("2").get("1"));
    }

    @Test
    public void literal_and_foreign_maps_do_not_need_the_store() {
        QueryContext store = mock(QueryContext.class);

        MapSupport.castToMap(MapView.of(ImmutableMap.of("a", 1))).apply(store).get("a");
        MapSupport.castToMap(ImmutableMap.of("a", 1)).apply(store).get("a");

        verifyNoInteractions(store);
    }

    @Test
    public void node_views_read_the_store_on_every_access() {
        MapView view = MapSupport.castToMap(alice).apply(graph);
        assertEquals(0, graph.propertyReads());

        assertEquals(Optional.of("Alice"), view.get("name"));
        assertFalse(view.contains("age"));
        int reads = graph.propertyReads();
        assertTrue(view.contains("name"));
        assertEquals(reads + 1, graph.propertyReads());

        assertThat(keys(view), contains("name", "born"));
        assertEquals(alice, ((EntityMapView<?>) view).entity());
    }

    @Test
    public void relationship_views_read_relationship_properties() {
        MapView view = MapSupport.castToMap(knows).apply(graph);

        assertEquals(Optional.of(2001), view.get("since"));
        assertFalse(view.contains("name"));
    }

    @Test
    public void entity_views_cannot_be_updated() {
        MapView view = MapSupport.castToMap(alice).apply(graph);

        assertEntityMapRejects(() -> view.set("name", "Bob"), "set");
        assertEntityMapRejects(() -> view.remove("name"), "remove");
        assertEntityMapRejects(() -> view.merge(MapView.empty()), "merge");
    }

    private static void assertEntityMapRejects(Runnable update, String operation) {
        try {
            update.run();
            fail();
        } catch (GraphMatchException e) {
            assertTrue(e.isInternal());
            assertEquals(ErrorMessage.Internal.ILLEGAL_OPERATION_ON_ENTITY_MAP, e.errorMessage());
            assertThat(e.getMessage(), containsString("This map is not a real map: '" + operation + "'"));
        }
    }

    @Test
    public void other_values_are_not_maps() {
        try {
            MapSupport.castToMap(42);
            fail();
        } catch (GraphMatchException e) {
            assertFalse(e.isInternal());
            assertEquals(ErrorMessage.Expression.NOT_A_MAP, e.errorMessage());
            assertThat(e.getMessage(), containsString("Integer"));
        }
    }

    @Test
    public void binding_is_deferred_until_the_store_is_supplied() {
        Node node = mock(Node.class);
        QueryContext store = mock(QueryContext.class);

        MapSupport.castToMap(node);

        verifyNoInteractions(node, store);
    }
}
