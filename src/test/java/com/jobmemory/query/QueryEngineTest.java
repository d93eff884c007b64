package com.jobmemory.query;

import com.jobmemory.graph.Entity;
import com.jobmemory.graph.GraphStore;
import com.jobmemory.graph.KnowledgeGraph;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class QueryEngineTest {

    private static final KnowledgeGraph GRAPH = new KnowledgeGraph(List.of(
            new Entity("Python", "skill", List.of()),
            new Entity("Google", "company", List.of()),
            new Entity("Java", "Skill", List.of("7 years"))), List.of());

    @Test
    void entitiesOfTypeMatchesTypeIgnoringCaseInCreationOrder() {
        var names = QueryEngine.entitiesOfType(GRAPH, "skill").stream().map(Entity::name).toList();
        assertEquals(List.of("Python", "Java"), names);
        assertTrue(QueryEngine.entitiesOfType(GRAPH, "role").isEmpty());
    }

    @Test
    void readsGoThroughTheStore() {
        var store = mock(GraphStore.class);
        when(store.readGraph("u1")).thenReturn(GRAPH);
        when(store.searchNodes("u1", "py")).thenReturn(List.of(GRAPH.entities().get(0)));
        var engine = new QueryEngine(store);

        assertEquals(1, engine.entitiesOfType("u1", "company").size());
        assertEquals("Python", engine.searchNodes("u1", "py").get(0).name());
        assertSame(GRAPH, engine.readGraph("u1"));
        verify(store, times(2)).readGraph("u1");
        verify(store, never()).apply(anyString(), any());
    }
}
