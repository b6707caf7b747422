package com.afsun.schemagraph.service.impl;

import com.afsun.schemagraph.core.exceptions.SchemaGraphException;
import com.afsun.schemagraph.core.inference.RelationshipInferenceEngine;
import com.afsun.schemagraph.core.model.InferenceResult;
import com.afsun.schemagraph.core.model.SchemaModel;
import com.afsun.schemagraph.core.model.SchemaWarning;
import com.afsun.schemagraph.export.RelationshipYamlWriter;
import com.afsun.schemagraph.export.SchemaGraphJsonWriter;
import com.afsun.schemagraph.export.SchemaGraphNeo4jWriter;
import com.afsun.schemagraph.graph.SchemaGraph;
import com.afsun.schemagraph.graph.SchemaGraphBuilder;
import com.afsun.schemagraph.service.AnalysisResult;
import com.afsun.schemagraph.service.SchemaAnalysisService;
import com.afsun.schemagraph.service.SchemaGraphSession;
import com.afsun.schemagraph.source.SchemaModelFactory;
import com.afsun.schemagraph.source.ddl.DdlReadResult;
import com.afsun.schemagraph.source.ddl.DdlSchemaReader;
import com.afsun.schemagraph.source.dto.SchemaDescription;
import com.afsun.schemagraph.source.jdbc.DataSourceSchemaExtractor;
import com.alibaba.druid.DbType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 分析编排：Schema描述 -> SchemaModel -> 关系推断 -> 图构建 (-> Neo4j)
 * 无状态，每次调用返回独立的结果对象
 *
 * @author afsun
 */
@Service
@Slf4j
public class SchemaAnalysisServiceImpl implements SchemaAnalysisService {

    private final RelationshipInferenceEngine inferenceEngine;
    private final SchemaGraphBuilder graphBuilder;
    private final DdlSchemaReader ddlSchemaReader;
    private final DataSourceSchemaExtractor dataSourceSchemaExtractor;
    private final RelationshipYamlWriter yamlWriter;
    private final SchemaGraphJsonWriter jsonWriter;
    private final Optional<SchemaGraphNeo4jWriter> neo4jWriter;

    public SchemaAnalysisServiceImpl(RelationshipInferenceEngine inferenceEngine,
                                     SchemaGraphBuilder graphBuilder,
                                     DdlSchemaReader ddlSchemaReader,
                                     DataSourceSchemaExtractor dataSourceSchemaExtractor,
                                     RelationshipYamlWriter yamlWriter,
                                     SchemaGraphJsonWriter jsonWriter,
                                     Optional<SchemaGraphNeo4jWriter> neo4jWriter) {
        this.inferenceEngine = inferenceEngine;
        this.graphBuilder = graphBuilder;
        this.ddlSchemaReader = ddlSchemaReader;
        this.dataSourceSchemaExtractor = dataSourceSchemaExtractor;
        this.yamlWriter = yamlWriter;
        this.jsonWriter = jsonWriter;
        this.neo4jWriter = neo4jWriter;
    }

    @Override
    public AnalysisResult analyze(SchemaDescription description) {
        return run("json", null, () -> new Source(description, Collections.emptyList()));
    }

    @Override
    public AnalysisResult analyzeDdl(String ddl, DbType dbType) {
        return run("ddl", dbType, () -> {
            DdlReadResult read = ddlSchemaReader.read(ddl, dbType, null);
            return new Source(read.getSchema(), read.getWarnings(), read.getDbType());
        });
    }

    @Override
    public AnalysisResult analyzeDataSource(String name) {
        return run("datasource", null, () -> new Source(dataSourceSchemaExtractor.extract(name),
                Collections.emptyList()));
    }

    @Override
    public SchemaGraphSession newSession() {
        return new SchemaGraphSession(inferenceEngine, graphBuilder, yamlWriter, jsonWriter);
    }

    private AnalysisResult run(String sourceName, DbType dbType, SourceLoader loader) {
        long startTime = System.currentTimeMillis();
        String traceId = "SG-" + startTime;
        try {
            // 1. 读取Schema描述
            Source source = loader.load();
            // 2. 校验并构建不可变模型
            SchemaModel schema = SchemaModelFactory.create(source.description);
            // 3. 推断关系
            InferenceResult relationships = inferenceEngine.infer(schema);
            // 4. 构建图
            SchemaGraph graph = graphBuilder.build(schema, relationships);
            // 5. 可选：写入Neo4j
            neo4jWriter.ifPresent(w -> w.save(graph));

            List<SchemaWarning> warnings = new ArrayList<>(source.warnings);
            warnings.addAll(relationships.getWarnings());
            warnings.addAll(graph.getWarnings());
            DbType resolved = source.dbType != null ? source.dbType : dbType;
            return buildResult(traceId, startTime, sourceName, resolved, schema, relationships, graph, warnings);
        } catch (SchemaGraphException e) {
            // 业务异常：直接重新抛出，由Controller处理
            log.warn("Schema分析业务异常, traceId={}: {}", traceId, e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Schema分析发生未预期异常, traceId={}", traceId, e);
            throw new SchemaGraphException(SchemaGraphException.INTERNAL_ERROR,
                    "Schema分析异常: " + e.getMessage() + ", traceId=" + traceId, null, e);
        }
    }

    private AnalysisResult buildResult(String traceId, long startTime, String sourceName, DbType dbType,
                                       SchemaModel schema, InferenceResult relationships, SchemaGraph graph,
                                       List<SchemaWarning> warnings) {
        long elapsed = System.currentTimeMillis() - startTime;
        AnalysisResult result = new AnalysisResult();
        result.setTraceId(traceId);
        result.setDatabase(schema.getDatabase());
        result.setSource(sourceName);
        result.setDbType(dbType == null ? null : dbType.name());
        result.setRelationships(relationships);
        result.setGraph(graph);
        result.setWarnings(warnings);
        result.setElapsedMillis(elapsed);

        log.info("Schema分析完成, traceId={}, 来源={}, 表={}, 关系={}, 边={}, 警告={}, 耗时={}ms",
                traceId, sourceName, schema.tableCount(), relationships.relationshipCount(),
                graph.edgeCount(), warnings.size(), elapsed);
        return result;
    }

    @FunctionalInterface
    private interface SourceLoader {
        Source load();
    }

    private static final class Source {
        private final SchemaDescription description;
        private final List<SchemaWarning> warnings;
        private final DbType dbType;

        Source(SchemaDescription description, List<SchemaWarning> warnings) {
            this(description, warnings, null);
        }

        Source(SchemaDescription description, List<SchemaWarning> warnings, DbType dbType) {
            this.description = description;
            this.warnings = warnings;
            this.dbType = dbType;
        }
    }
}
