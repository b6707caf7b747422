package com.afsun.schemagraph.export;

import com.afsun.schemagraph.graph.ReferenceEdge;
import com.afsun.schemagraph.graph.SchemaGraph;
import com.afsun.schemagraph.graph.TableNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 将构建完成的Schema图批量写入Neo4j
 * (:Table {database, name})-[:REFERENCES {sourceColumn, targetColumn}]->(:Table)
 *
 * @author afsun
 */
@Slf4j
public class SchemaGraphNeo4jWriter {

    // 批处理大小
    private static final int BATCH_SIZE = 100;

    private static final String TABLE_QUERY = "            UNWIND $tables AS tbl\n" +
            "            MERGE (t:Table {\n" +
            "                database: COALESCE(tbl.database, 'UNKNOWN'),\n" +
            "                name: tbl.name\n" +
            "            })\n" +
            "            SET t.columnCount = tbl.columnCount,\n" +
            "                t.primaryKey = tbl.primaryKey";

    // 悬空外键的目标表不存在，MATCH 不到时该边跳过
    private static final String EDGE_QUERY = "            UNWIND $edges AS edge\n" +
            "            MATCH (src:Table {database: COALESCE(edge.database, 'UNKNOWN'), name: edge.source})\n" +
            "            MATCH (dst:Table {database: COALESCE(edge.database, 'UNKNOWN'), name: edge.target})\n" +
            "            MERGE (src)-[r:REFERENCES {\n" +
            "                sourceColumn: edge.sourceColumn,\n" +
            "                targetColumn: edge.targetColumn\n" +
            "            }]->(dst)\n" +
            "            SET r.confidence = edge.confidence,\n" +
            "                r.basis = edge.basis,\n" +
            "                r.consistent = edge.consistent";

    private final Neo4jClient neo4jClient;

    public SchemaGraphNeo4jWriter(Neo4jClient neo4jClient) {
        this.neo4jClient = neo4jClient;
    }

    @Transactional
    public void save(SchemaGraph graph) {
        if (graph == null) {
            return;
        }
        String database = graph.getDatabase();
        // 1. 批量保存Table节点
        runBatches(TABLE_QUERY, "tables", graph.getNodes().stream()
                .map(n -> tableNodeToMap(database, n))
                .collect(Collectors.toList()));
        // 2. 批量创建REFERENCES关系
        runBatches(EDGE_QUERY, "edges", graph.getEdges().stream()
                .map(e -> edgeToMap(database, e))
                .collect(Collectors.toList()));
        log.info("Schema图已写入Neo4j: database={}, 节点={}, 边={}", database, graph.nodeCount(), graph.edgeCount());
    }

    private void runBatches(String query, String parameter, List<Map<String, Object>> rows) {
        for (int i = 0; i < rows.size(); i += BATCH_SIZE) {
            List<Map<String, Object>> batch = rows.subList(i, Math.min(i + BATCH_SIZE, rows.size()));
            neo4jClient.query(query)
                    .bind(batch).to(parameter)
                    .run();
        }
    }

    static Map<String, Object> tableNodeToMap(String database, TableNode node) {
        Map<String, Object> map = new HashMap<>();
        map.put("database", database);
        map.put("name", node.getId());
        map.put("columnCount", node.getColumnCount());
        map.put("primaryKey", node.getPrimaryKey());
        return map;
    }

    static Map<String, Object> edgeToMap(String database, ReferenceEdge edge) {
        Map<String, Object> map = new HashMap<>();
        map.put("database", database);
        map.put("source", edge.getSource());
        map.put("target", edge.getTarget());
        map.put("sourceColumn", edge.getSourceColumn());
        map.put("targetColumn", edge.getTargetColumn());
        map.put("confidence", edge.getConfidence());
        map.put("basis", edge.getBasis().getLabel());
        map.put("consistent", edge.isConsistent());
        return map;
    }
}
