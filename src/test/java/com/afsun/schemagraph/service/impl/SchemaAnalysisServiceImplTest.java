package com.afsun.schemagraph.service.impl;

import com.afsun.schemagraph.SchemaFixtures;
import com.afsun.schemagraph.core.exceptions.InvalidSchemaException;
import com.afsun.schemagraph.core.exceptions.SchemaGraphException;
import com.afsun.schemagraph.core.exceptions.SchemaSourceException;
import com.afsun.schemagraph.core.inference.DefaultRelationshipInferenceEngine;
import com.afsun.schemagraph.core.model.SchemaWarning;
import com.afsun.schemagraph.export.RelationshipYamlWriter;
import com.afsun.schemagraph.export.SchemaGraphJsonWriter;
import com.afsun.schemagraph.export.SchemaGraphNeo4jWriter;
import com.afsun.schemagraph.graph.SchemaGraph;
import com.afsun.schemagraph.graph.SchemaGraphBuilder;
import com.afsun.schemagraph.service.AnalysisResult;
import com.afsun.schemagraph.source.ddl.DdlSchemaReader;
import com.afsun.schemagraph.source.dto.SchemaDescription;
import com.afsun.schemagraph.source.dto.TableDescription;
import com.afsun.schemagraph.source.jdbc.DataSourceSchemaExtractor;
import com.alibaba.druid.DbType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SchemaAnalysisServiceImplTest {

    private DataSourceSchemaExtractor extractor;
    private SchemaGraphNeo4jWriter neo4jWriter;
    private SchemaAnalysisServiceImpl service;

    @BeforeEach
    void setUp() {
        extractor = mock(DataSourceSchemaExtractor.class);
        neo4jWriter = mock(SchemaGraphNeo4jWriter.class);
        service = newService(Optional.of(neo4jWriter));
    }

    private SchemaAnalysisServiceImpl newService(Optional<SchemaGraphNeo4jWriter> writer) {
        return new SchemaAnalysisServiceImpl(new DefaultRelationshipInferenceEngine(), new SchemaGraphBuilder(),
                new DdlSchemaReader(), extractor, new RelationshipYamlWriter(), new SchemaGraphJsonWriter(), writer);
    }

    @Test
    void testAnalyzeDescription() {
        AnalysisResult result = service.analyze(SchemaFixtures.shop());

        assertEquals("shop", result.getDatabase());
        assertEquals("json", result.getSource());
        assertNull(result.getDbType());
        assertTrue(result.getTraceId().startsWith("SG-"));
        assertTrue(result.getElapsedMillis() >= 0);
        assertEquals(3, result.getRelationships().relationshipCount());
        assertEquals(4, result.getGraph().nodeCount());
        assertTrue(result.getWarnings().isEmpty());
        verify(neo4jWriter).save(result.getGraph());
    }

    @Test
    void testAnalyzeDdlCollectsWarnings() {
        String ddl = "CREATE TABLE users (user_id INT PRIMARY KEY);\n" +
                "CREATE TABLE orders (order_id INT PRIMARY KEY, user_id INT, warehouse_id INT, " +
                "FOREIGN KEY (warehouse_id) REFERENCES warehouses(warehouse_id));\n" +
                "CREATE INDEX idx_orders_user ON orders(user_id);";

        AnalysisResult result = newService(Optional.empty()).analyzeDdl(ddl, DbType.mysql);

        assertEquals("ddl", result.getSource());
        assertEquals("mysql", result.getDbType());
        assertEquals(2, result.getRelationships().relationshipCount());
        assertEquals(2, result.getWarnings().size());
        assertEquals(SchemaWarning.SKIPPED_STATEMENT, result.getWarnings().get(0).getCategory());
        assertEquals(SchemaWarning.DANGLING_REFERENCE, result.getWarnings().get(1).getCategory());
        verifyNoInteractions(neo4jWriter);
    }

    @Test
    void testAnalyzeDataSource() {
        when(extractor.extract("warehouse")).thenReturn(SchemaFixtures.shop());

        AnalysisResult result = service.analyzeDataSource("warehouse");
        assertEquals("datasource", result.getSource());
        assertEquals(3, result.getGraph().edgeCount());
    }

    @Test
    void testBusinessExceptionsPropagate() {
        SchemaDescription invalid = new SchemaDescription("db", new ArrayList<>(Arrays.asList(
                new TableDescription("t").column("a", "int", true, false).column("a", "int", true, false))));
        assertThrows(InvalidSchemaException.class, () -> service.analyze(invalid));

        when(extractor.extract("missing")).thenThrow(new SchemaSourceException(
                SchemaSourceException.DATASOURCE_NOT_FOUND, "未配置数据源: {}", "missing"));
        SchemaSourceException e = assertThrows(SchemaSourceException.class, () -> service.analyzeDataSource("missing"));
        assertEquals("未配置数据源: missing", e.getMessage());
        verify(neo4jWriter, never()).save(any());
    }

    @Test
    void testUnexpectedExceptionWrapped() {
        doThrow(new IllegalStateException("neo4j down")).when(neo4jWriter).save(any(SchemaGraph.class));

        SchemaGraphException e = assertThrows(SchemaGraphException.class, () -> service.analyze(SchemaFixtures.shop()));
        assertEquals(SchemaGraphException.INTERNAL_ERROR, e.getErrorCode());
        assertTrue(e.getCause() instanceof IllegalStateException);
    }
}
