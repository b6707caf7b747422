package com.afsun.schemagraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

/**
 * 表间关系：源表.源列 -> 目标表.目标列
 * Declared 关系的置信度恒为 1.0
 *
 * @author afsun
 */
@Data
public class Relationship {
    public static final double DECLARED_CONFIDENCE = 1.0;

    private final String sourceTable;
    private final String sourceColumn;
    private final String targetTable;
    private final String targetColumn;
    private final double confidence;
    private final Basis basis;
    /**
     * 声明外键的目标表/列在当前Schema中不存在时为false
     */
    private final boolean consistent;

    private Relationship(String sourceTable, String sourceColumn, String targetTable, String targetColumn,
                         double confidence, Basis basis, boolean consistent) {
        this.sourceTable = sourceTable;
        this.sourceColumn = sourceColumn;
        this.targetTable = targetTable;
        this.targetColumn = targetColumn;
        this.confidence = confidence;
        this.basis = basis;
        this.consistent = consistent;
    }

    public static Relationship declared(String sourceTable, String sourceColumn,
                                        String targetTable, String targetColumn, boolean consistent) {
        return new Relationship(sourceTable, sourceColumn, targetTable, targetColumn,
                DECLARED_CONFIDENCE, Basis.DECLARED, consistent);
    }

    public static Relationship inferred(String sourceTable, String sourceColumn,
                                        String targetTable, String targetColumn,
                                        double confidence, Basis basis) {
        if (basis == Basis.DECLARED) {
            throw new IllegalArgumentException("推断关系不能使用 Declared 标签");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("置信度超出范围[0,1]: " + confidence);
        }
        return new Relationship(sourceTable, sourceColumn, targetTable, targetColumn, confidence, basis, true);
    }

    /**
     * 引用目标，格式 table.column
     */
    public String references() {
        return targetTable + "." + targetColumn;
    }

    @JsonIgnore
    public boolean isSelfReference() {
        return sourceTable.equals(targetTable);
    }

    @JsonIgnore
    public boolean isDeclared() {
        return basis == Basis.DECLARED;
    }
}
