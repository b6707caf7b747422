package com.afsun.schemagraph.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 关系来源标签
 *
 * @author afsun
 */
@Getter
public enum Basis {
    /**
     * 数据库中声明的外键约束
     */
    DECLARED("Declared"),
    /**
     * 列名与目标表主键名完全一致
     */
    EXACT_MATCH("ExactMatch"),
    /**
     * 列名与目标表名/主键名近似
     */
    PATTERN_MATCH("PatternMatch"),
    /**
     * 表内层级自引用（parent_id 等）
     */
    HIERARCHICAL("Hierarchical");

    @JsonValue
    private final String label;

    Basis(String label) {
        this.label = label;
    }

    public boolean isInferred() {
        return this != DECLARED;
    }
}
