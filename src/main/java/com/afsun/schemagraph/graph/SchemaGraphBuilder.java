package com.afsun.schemagraph.graph;

import com.afsun.schemagraph.core.model.*;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 由 SchemaModel + 关系推断结果构建 SchemaGraph
 * 无状态：每次调用都从空图开始，构建完成后才返回（不会暴露半成品）
 *
 * @author afsun
 */
@Slf4j
public class SchemaGraphBuilder {

    /**
     * 构建图：
     * 1. 每张表对应一个节点（列数、主键名）
     * 2. 每条关系对应一条边，(源表, 源列, 目标表, 目标列) 唯一
     * 3. 声明关系与推断关系冲突时保留声明关系
     * 4. 自引用边仅保留 Hierarchical 或声明关系
     */
    public SchemaGraph build(SchemaModel schema, InferenceResult relationships) {
        List<TableNode> nodes = new ArrayList<>(schema.tableCount());
        for (TableInfo table : schema.tableList()) {
            nodes.add(new TableNode(table.getName(), table.columnCount(), table.getPrimaryKey()));
        }

        Map<EdgeKey, ReferenceEdge> edges = new LinkedHashMap<>();
        List<SchemaWarning> warnings = new ArrayList<>();
        int dropped = 0;
        for (Relationship r : relationships.getAllRelationships()) {
            if (r.isSelfReference() && r.getBasis() != Basis.HIERARCHICAL && r.getBasis() != Basis.DECLARED) {
                warnings.add(SchemaWarning.of(SchemaWarning.SELF_REFERENCE_DROPPED,
                        "非层级推断的自引用关系已忽略: " + r.getSourceColumn(),
                        r.getSourceTable() + "." + r.getSourceColumn(), "自引用需使用 parent_id 等层级命名"));
                dropped++;
                continue;
            }
            ReferenceEdge edge = ReferenceEdge.from(r);
            ReferenceEdge existing = edges.get(edge.getKey());
            if (existing == null) {
                edges.put(edge.getKey(), edge);
            } else if (existing.getBasis() != Basis.DECLARED && edge.getBasis() == Basis.DECLARED) {
                // 声明关系优先，原位替换以保持边顺序
                edges.put(edge.getKey(), edge);
                dropped++;
            } else {
                dropped++;
            }
        }

        SchemaGraph graph = new SchemaGraph(schema.getDatabase(), nodes, new ArrayList<>(edges.values()), warnings);
        log.debug("图构建完成: 节点={}, 边={}, 丢弃={}", graph.nodeCount(), graph.edgeCount(), dropped);
        return graph;
    }
}
