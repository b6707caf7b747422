package com.afsun.schemagraph.service;

import com.afsun.schemagraph.core.inference.RelationshipInferenceEngine;
import com.afsun.schemagraph.core.model.InferenceResult;
import com.afsun.schemagraph.core.model.SchemaModel;
import com.afsun.schemagraph.export.RelationshipYamlWriter;
import com.afsun.schemagraph.export.SchemaGraphJsonWriter;
import com.afsun.schemagraph.graph.SchemaGraph;
import com.afsun.schemagraph.graph.SchemaGraphBuilder;
import com.afsun.schemagraph.source.SchemaModelFactory;
import com.afsun.schemagraph.source.dto.SchemaDescription;

/**
 * 链式调用：load -> inferRelationships -> buildGraph -> toYaml/toJson
 * 中间结果只保存在当前实例中，不同会话互不影响；非线程安全
 *
 * @author afsun
 */
public class SchemaGraphSession {

    private final RelationshipInferenceEngine engine;
    private final SchemaGraphBuilder builder;
    private final RelationshipYamlWriter yamlWriter;
    private final SchemaGraphJsonWriter jsonWriter;

    private SchemaModel schema;
    private InferenceResult relationships;
    private SchemaGraph graph;

    public SchemaGraphSession(RelationshipInferenceEngine engine, SchemaGraphBuilder builder,
                              RelationshipYamlWriter yamlWriter, SchemaGraphJsonWriter jsonWriter) {
        this.engine = engine;
        this.builder = builder;
        this.yamlWriter = yamlWriter;
        this.jsonWriter = jsonWriter;
    }

    public SchemaGraphSession load(SchemaDescription description) {
        return load(SchemaModelFactory.create(description));
    }

    /**
     * 载入新Schema，清空之前的推断结果和图
     */
    public SchemaGraphSession load(SchemaModel schema) {
        this.schema = schema;
        this.relationships = null;
        this.graph = null;
        return this;
    }

    public InferenceResult inferRelationships() {
        if (schema == null) {
            throw new IllegalStateException("请先调用 load 载入Schema");
        }
        relationships = engine.infer(schema);
        graph = null;
        return relationships;
    }

    public SchemaGraph buildGraph() {
        if (relationships == null) {
            throw new IllegalStateException("请先调用 inferRelationships 推断关系");
        }
        graph = builder.build(schema, relationships);
        return graph;
    }

    public String toYaml() {
        if (relationships == null) {
            throw new IllegalStateException("请先调用 inferRelationships 推断关系");
        }
        return yamlWriter.write(relationships);
    }

    public String toJson() {
        if (graph == null) {
            throw new IllegalStateException("请先调用 buildGraph 构建图");
        }
        return jsonWriter.write(graph);
    }

    public SchemaModel getSchema() {
        return schema;
    }

    public InferenceResult getRelationships() {
        return relationships;
    }

    public SchemaGraph getGraph() {
        return graph;
    }
}
