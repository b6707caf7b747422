package com.afsun.schemagraph.export;

import com.afsun.schemagraph.core.exceptions.SchemaGraphException;
import com.afsun.schemagraph.graph.ReferenceEdge;
import com.afsun.schemagraph.graph.SchemaGraph;
import com.afsun.schemagraph.graph.TableNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 将Schema图输出为 node-link 格式的JSON，可直接交给前端图渲染库
 *
 * @author afsun
 */
public class SchemaGraphJsonWriter {

    public static final String EXPORT_ERROR = "EXPORT_ERROR";

    private final ObjectMapper objectMapper;

    public SchemaGraphJsonWriter() {
        this(new ObjectMapper());
    }

    public SchemaGraphJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(SchemaGraph graph) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toNodeLink(graph));
        } catch (JsonProcessingException e) {
            throw new SchemaGraphException(EXPORT_ERROR, "Schema图序列化失败: " + e.getOriginalMessage(), null, e);
        }
    }

    public Map<String, Object> toNodeLink(SchemaGraph graph) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("directed", true);
        doc.put("multigraph", true);
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("database", graph.getDatabase());
        doc.put("graph", meta);

        List<Map<String, Object>> nodes = new ArrayList<>();
        for (TableNode n : graph.getNodes()) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("column_count", n.getColumnCount());
            attributes.put("primary_key", n.getPrimaryKey());
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("id", n.getId());
            node.put("attributes", attributes);
            nodes.add(node);
        }
        doc.put("nodes", nodes);

        List<Map<String, Object>> edges = new ArrayList<>();
        for (ReferenceEdge e : graph.getEdges()) {
            Map<String, Object> edge = new LinkedHashMap<>();
            edge.put("source", e.getSource());
            edge.put("target", e.getTarget());
            edge.put("source_column", e.getSourceColumn());
            edge.put("target_column", e.getTargetColumn());
            edge.put("confidence", e.getConfidence());
            edge.put("basis", e.getBasis().getLabel());
            edge.put("consistent", e.isConsistent());
            edges.add(edge);
        }
        doc.put("edges", edges);
        return doc;
    }
}
