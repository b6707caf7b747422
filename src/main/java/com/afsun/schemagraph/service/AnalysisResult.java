package com.afsun.schemagraph.service;

import com.afsun.schemagraph.core.model.InferenceResult;
import com.afsun.schemagraph.core.model.SchemaWarning;
import com.afsun.schemagraph.graph.SchemaGraph;
import lombok.Data;

import java.util.List;

/**
 * 单次分析的完整结果，由调用方持有
 *
 * @author afsun
 */
@Data
public class AnalysisResult {
    private String database;
    /**
     * 来源：json / ddl / datasource
     */
    private String source;
    /**
     * DDL方言或数据源类型，JSON描述时为null
     */
    private String dbType;
    private InferenceResult relationships;
    private SchemaGraph graph;
    private List<SchemaWarning> warnings;
    private String traceId;
    private long elapsedMillis;
}
