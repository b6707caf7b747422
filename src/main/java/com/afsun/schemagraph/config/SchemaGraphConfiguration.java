package com.afsun.schemagraph.config;

import com.afsun.schemagraph.core.inference.DefaultRelationshipInferenceEngine;
import com.afsun.schemagraph.core.inference.RelationshipInferenceEngine;
import com.afsun.schemagraph.core.score.ConfidenceScorer;
import com.afsun.schemagraph.core.score.DefaultConfidenceScorer;
import com.afsun.schemagraph.export.RelationshipYamlWriter;
import com.afsun.schemagraph.export.SchemaGraphJsonWriter;
import com.afsun.schemagraph.export.SchemaGraphNeo4jWriter;
import com.afsun.schemagraph.graph.SchemaGraphBuilder;
import com.afsun.schemagraph.source.ddl.DdlSchemaReader;
import com.afsun.schemagraph.source.jdbc.DataSourceSchemaExtractor;
import com.afsun.schemagraph.source.jdbc.SchemaConnectorRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.neo4j.core.Neo4jClient;

/**
 * 核心组件装配
 *
 * @author afsun
 */
@Configuration
public class SchemaGraphConfiguration {

    @Bean
    public ConfidenceScorer confidenceScorer() {
        return new DefaultConfidenceScorer();
    }

    @Bean
    public RelationshipInferenceEngine relationshipInferenceEngine(ConfidenceScorer confidenceScorer) {
        return new DefaultRelationshipInferenceEngine(confidenceScorer);
    }

    @Bean
    public SchemaGraphBuilder schemaGraphBuilder() {
        return new SchemaGraphBuilder();
    }

    @Bean
    public DdlSchemaReader ddlSchemaReader() {
        return new DdlSchemaReader();
    }

    @Bean
    public SchemaConnectorRegistry schemaConnectorRegistry() {
        return SchemaConnectorRegistry.defaults();
    }

    @Bean
    public DataSourceSchemaExtractor dataSourceSchemaExtractor(SchemaConnectorRegistry registry,
                                                               SchemaGraphProperties properties) {
        return new DataSourceSchemaExtractor(registry, properties.getDatasources());
    }

    @Bean
    public RelationshipYamlWriter relationshipYamlWriter() {
        return new RelationshipYamlWriter();
    }

    @Bean
    public SchemaGraphJsonWriter schemaGraphJsonWriter(ObjectMapper objectMapper) {
        return new SchemaGraphJsonWriter(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "schema.graph.neo4j", name = "enabled", havingValue = "true")
    public SchemaGraphNeo4jWriter schemaGraphNeo4jWriter(Neo4jClient neo4jClient) {
        return new SchemaGraphNeo4jWriter(neo4jClient);
    }
}
