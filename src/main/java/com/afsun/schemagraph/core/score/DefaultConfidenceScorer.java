package com.afsun.schemagraph.core.score;

import com.afsun.schemagraph.core.model.Basis;
import com.afsun.schemagraph.core.model.ColumnInfo;
import com.afsun.schemagraph.core.model.TableInfo;
import com.afsun.schemagraph.core.util.TypeClassifier;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 默认评分规则（按优先级）：
 * 1. 通用列名（id/name/status/type...）不作为推断源
 * 2. 类型门：源列与目标主键的粗粒度类型必须一致
 * 3. 自引用：仅层级命名（parent_id 等）计分，标记为 Hierarchical
 * 4. 精确匹配：词干等于目标表名（单复数）且列名等于目标主键名，0.95~0.98
 * 5. 模式匹配：词干与表名变体/主键词干相似度 >= 0.75，线性映射到 0.50~0.92
 *
 * @author afsun
 */
@Slf4j
public class DefaultConfidenceScorer implements ConfidenceScorer {

    public static final double EXACT_TYPE_MATCH_SCORE = 0.98;
    public static final double EXACT_SCORE = 0.95;
    public static final double PATTERN_MIN_SCORE = 0.50;
    public static final double PATTERN_MAX_SCORE = 0.92;
    public static final double PATTERN_SIMILARITY_THRESHOLD = 0.75;
    public static final double HIERARCHICAL_SCORE = 0.90;
    public static final double HIERARCHICAL_NAMED_SCORE = 0.93;

    private static final Set<String> GENERIC_NAMES = new HashSet<>(Arrays.asList(
            "id", "name", "status", "type", "code", "key", "value", "title", "description",
            "state", "flag", "label", "note", "notes", "comment", "version",
            "created_at", "updated_at", "deleted_at", "created", "updated", "date", "timestamp",
            "uuid", "guid", "pk"));

    private static final Set<String> HIERARCHY_MARKERS = new HashSet<>(Arrays.asList(
            "parent", "manager", "supervisor", "superior", "boss", "predecessor"));

    @Override
    public Optional<ScoredCandidate> score(ColumnInfo sourceColumn,
                                           TableInfo sourceTable,
                                           TableInfo candidateTargetTable,
                                           ColumnInfo candidateTargetKey) {
        String column = sourceColumn.getName();
        if (isGenericName(column)) {
            return Optional.empty();
        }
        if (sourceColumn.getTypeClass() != candidateTargetKey.getTypeClass()) {
            log.debug("类型不一致，排除候选: {}.{}({}) -> {}.{}({})",
                    sourceTable.getName(), column, sourceColumn.getTypeClass(),
                    candidateTargetTable.getName(), candidateTargetKey.getName(), candidateTargetKey.getTypeClass());
            return Optional.empty();
        }

        String target = candidateTargetTable.getName();
        if (sourceTable.getName().equals(target)) {
            return scoreSelfReference(sourceColumn, candidateTargetTable, candidateTargetKey);
        }

        String stem = NameNormalizer.entityStem(column);
        if (stem.isEmpty()) {
            return Optional.empty();
        }
        Set<String> variants = NameNormalizer.tableVariants(target);

        if (variants.contains(stem) && column.equals(candidateTargetKey.getName())) {
            double score = sameDeclaredType(sourceColumn, candidateTargetKey) ? EXACT_TYPE_MATCH_SCORE : EXACT_SCORE;
            return Optional.of(ScoredCandidate.of(target, candidateTargetKey.getName(), score, Basis.EXACT_MATCH));
        }

        double similarity = bestSimilarity(NameNormalizer.stripKeySuffix(column), variants, candidateTargetKey.getName());
        if (similarity < PATTERN_SIMILARITY_THRESHOLD) {
            return Optional.empty();
        }
        double score = PATTERN_MIN_SCORE + (PATTERN_MAX_SCORE - PATTERN_MIN_SCORE)
                * (similarity - PATTERN_SIMILARITY_THRESHOLD) / (1.0 - PATTERN_SIMILARITY_THRESHOLD);
        return Optional.of(ScoredCandidate.of(target, candidateTargetKey.getName(), round(score), Basis.PATTERN_MATCH));
    }

    /**
     * 通用列名，或去掉键后缀后没有实体词干的列名
     */
    public static boolean isGenericName(String columnName) {
        if (columnName == null) {
            return true;
        }
        String lower = columnName.toLowerCase(Locale.ROOT);
        return GENERIC_NAMES.contains(lower) || NameNormalizer.entityStem(columnName).isEmpty();
    }

    public static boolean isHierarchicalName(String columnName) {
        String lower = columnName.toLowerCase(Locale.ROOT);
        if (lower.contains("reports_to") || lower.contains("reportsto")) {
            return true;
        }
        for (String token : NameNormalizer.tokens(columnName)) {
            if (HIERARCHY_MARKERS.contains(token)) {
                return true;
            }
        }
        return false;
    }

    private Optional<ScoredCandidate> scoreSelfReference(ColumnInfo sourceColumn,
                                                         TableInfo table,
                                                         ColumnInfo key) {
        if (sourceColumn.getName().equals(key.getName()) || !isHierarchicalName(sourceColumn.getName())) {
            return Optional.empty();
        }
        String entity = NameNormalizer.singular(NameNormalizer.compact(table.getName()));
        double score = NameNormalizer.compact(sourceColumn.getName()).contains(entity)
                ? HIERARCHICAL_NAMED_SCORE : HIERARCHICAL_SCORE;
        return Optional.of(ScoredCandidate.of(table.getName(), key.getName(), score, Basis.HIERARCHICAL));
    }

    private double bestSimilarity(String stemSource, Set<String> tableVariants, String targetKey) {
        double best = 0.0;
        for (String variant : tableVariants) {
            best = Math.max(best, NameSimilarity.similarity(stemSource, variant));
        }
        String keyStem = NameNormalizer.stripKeySuffix(targetKey);
        if (!NameNormalizer.compact(keyStem).isEmpty()) {
            best = Math.max(best, NameSimilarity.similarity(stemSource, keyStem));
        }
        return best;
    }

    private boolean sameDeclaredType(ColumnInfo a, ColumnInfo b) {
        return TypeClassifier.normalize(a.getRawType()).equals(TypeClassifier.normalize(b.getRawType()));
    }

    private static double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
