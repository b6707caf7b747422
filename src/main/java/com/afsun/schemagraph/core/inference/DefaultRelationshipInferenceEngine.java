package com.afsun.schemagraph.core.inference;

import com.afsun.schemagraph.core.model.*;
import com.afsun.schemagraph.core.score.ConfidenceScorer;
import com.afsun.schemagraph.core.score.DefaultConfidenceScorer;
import com.afsun.schemagraph.core.score.ScoredCandidate;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 默认推断实现：
 * 1. 声明外键原样保留（Declared, 1.0）
 * 2. 其余非主键列对所有有主键的表打分
 * 3. 同一列多个候选时取最高分；同分取目标表名较短者，再按字典序
 * 4. 每表外键按列名排序
 *
 * @author afsun
 */
@Slf4j
public class DefaultRelationshipInferenceEngine implements RelationshipInferenceEngine {

    /**
     * 同分候选的确定性排序：分数降序 -> 表名长度升序 -> 表名字典序
     */
    static final Comparator<ScoredCandidate> CANDIDATE_ORDER = Comparator
            .comparingDouble(ScoredCandidate::getScore).reversed()
            .thenComparingInt((ScoredCandidate c) -> c.getTargetTable().length())
            .thenComparing(ScoredCandidate::getTargetTable);

    static final Comparator<Relationship> OUTPUT_ORDER = Comparator
            .comparing(Relationship::getSourceColumn)
            .thenComparing(Relationship::getTargetTable)
            .thenComparing(Relationship::getTargetColumn);

    private final ConfidenceScorer scorer;

    public DefaultRelationshipInferenceEngine() {
        this(new DefaultConfidenceScorer());
    }

    public DefaultRelationshipInferenceEngine(ConfidenceScorer scorer) {
        this.scorer = scorer;
    }

    @Override
    public InferenceResult infer(SchemaModel schema) {
        Map<String, TableRelationships> tables = new LinkedHashMap<>();
        List<SchemaWarning> warnings = new ArrayList<>();

        for (TableInfo table : schema.tableList()) {
            List<Relationship> foreignKeys = new ArrayList<>(declaredRelationships(schema, table, warnings));
            for (ColumnInfo column : table.getColumns()) {
                if (column.getName().equals(table.getPrimaryKey()) || table.hasDeclaredForeignKey(column.getName())) {
                    continue;
                }
                bestCandidate(schema, table, column).ifPresent(c -> foreignKeys.add(
                        Relationship.inferred(table.getName(), column.getName(),
                                c.getTargetTable(), c.getTargetColumn(), c.getScore(), c.getBasis())));
            }
            foreignKeys.sort(OUTPUT_ORDER);
            tables.put(table.getName(), new TableRelationships(table.getName(), table.getPrimaryKey(), foreignKeys));
        }

        InferenceResult result = new InferenceResult(tables, warnings);
        log.debug("关系推断完成: 表={}, 关系={}, 告警={}", tables.size(), result.relationshipCount(), warnings.size());
        return result;
    }

    private List<Relationship> declaredRelationships(SchemaModel schema, TableInfo table, List<SchemaWarning> warnings) {
        List<Relationship> declared = new ArrayList<>();
        for (ForeignKeyRef fk : table.getDeclaredForeignKeys()) {
            boolean consistent = schema.findTable(fk.getReferencesTable())
                    .flatMap(t -> t.findColumn(fk.getReferencesColumn()))
                    .isPresent();
            if (!consistent) {
                warnings.add(SchemaWarning.of(SchemaWarning.DANGLING_REFERENCE,
                        "声明外键引用的目标不存在: " + fk.getReferencesTable() + "." + fk.getReferencesColumn(),
                        table.getName() + "." + fk.getColumn(),
                        "检查目标表是否在本次抽取范围内"));
                log.warn("悬空外键引用: {}.{} -> {}.{}", table.getName(), fk.getColumn(),
                        fk.getReferencesTable(), fk.getReferencesColumn());
            }
            declared.add(Relationship.declared(table.getName(), fk.getColumn(),
                    fk.getReferencesTable(), fk.getReferencesColumn(), consistent));
        }
        return declared;
    }

    private Optional<ScoredCandidate> bestCandidate(SchemaModel schema, TableInfo source, ColumnInfo column) {
        List<ScoredCandidate> candidates = new ArrayList<>();
        for (TableInfo target : schema.tableList()) {
            Optional<ColumnInfo> key = target.primaryKeyColumn();
            if (!key.isPresent()) {
                continue;
            }
            scorer.score(column, source, target, key.get()).ifPresent(candidates::add);
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        candidates.sort(CANDIDATE_ORDER);
        ScoredCandidate best = candidates.get(0);
        log.debug("候选选择: {}.{} -> {}.{} score={} basis={} (共{}个候选)", source.getName(), column.getName(),
                best.getTargetTable(), best.getTargetColumn(), best.getScore(), best.getBasis(), candidates.size());
        return Optional.of(best);
    }
}
