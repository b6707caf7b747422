package com.afsun.schemagraph.service;

import com.afsun.schemagraph.SchemaFixtures;
import com.afsun.schemagraph.core.inference.DefaultRelationshipInferenceEngine;
import com.afsun.schemagraph.core.model.InferenceResult;
import com.afsun.schemagraph.core.model.SchemaModel;
import com.afsun.schemagraph.core.model.TableInfo;
import com.afsun.schemagraph.export.RelationshipYamlWriter;
import com.afsun.schemagraph.export.SchemaGraphJsonWriter;
import com.afsun.schemagraph.graph.SchemaGraph;
import com.afsun.schemagraph.graph.SchemaGraphBuilder;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 链式会话：调用顺序与会话间隔离
 */
class SchemaGraphSessionTest {

    private SchemaGraphSession newSession() {
        return new SchemaGraphSession(new DefaultRelationshipInferenceEngine(), new SchemaGraphBuilder(),
                new RelationshipYamlWriter(), new SchemaGraphJsonWriter());
    }

    @Test
    void testChain() {
        SchemaGraphSession session = newSession().load(SchemaFixtures.shop());
        InferenceResult relationships = session.inferRelationships();
        SchemaGraph graph = session.buildGraph();

        assertEquals(3, relationships.relationshipCount());
        assertEquals(3, graph.edgeCount());
        assertTrue(session.toYaml().contains("references: customers.customer_id"));
        assertTrue(session.toJson().contains("\"multigraph\" : true"));
    }

    @Test
    void testOutOfOrderCalls() {
        SchemaGraphSession session = newSession();
        assertThrows(IllegalStateException.class, session::inferRelationships);
        assertThrows(IllegalStateException.class, session::buildGraph);
        assertThrows(IllegalStateException.class, session::toYaml);

        session.load(SchemaFixtures.shop());
        assertThrows(IllegalStateException.class, session::buildGraph);
        session.inferRelationships();
        assertThrows(IllegalStateException.class, session::toJson);
    }

    @Test
    void testLoadResetsState() {
        SchemaGraphSession session = newSession().load(SchemaFixtures.shop());
        session.inferRelationships();
        session.buildGraph();

        session.load(SchemaModel.of("other", Collections.singletonList(
                TableInfo.builder("logs").column("log_id", "int", false, true).build())));
        assertNull(session.getRelationships());
        assertNull(session.getGraph());
        assertThrows(IllegalStateException.class, session::toJson);
    }

    @Test
    void testSessionsAreIsolated() {
        SchemaGraphSession first = newSession().load(SchemaFixtures.shop());
        SchemaGraphSession second = newSession().load(SchemaModel.of("other", Collections.singletonList(
                TableInfo.builder("logs").column("log_id", "int", false, true).build())));

        first.inferRelationships();
        second.inferRelationships();
        assertEquals(3, first.getRelationships().relationshipCount());
        assertEquals(0, second.getRelationships().relationshipCount());
        assertEquals("shop", first.buildGraph().getDatabase());
        assertEquals("other", second.buildGraph().getDatabase());
    }
}
