package com.afsun.schemagraph.core.model;

import com.afsun.schemagraph.core.util.TypeClassifier;
import lombok.Data;

/**
 * 列元数据（不可变）
 *
 * @author afsun
 */
@Data
public class ColumnInfo {
    private final String name;
    /**
     * 原始声明类型，如 varchar(64)
     */
    private final String rawType;
    private final TypeClass typeClass;
    private final boolean nullable;
    private final boolean primaryKey;

    private ColumnInfo(String name, String rawType, TypeClass typeClass, boolean nullable, boolean primaryKey) {
        this.name = name;
        this.rawType = rawType;
        this.typeClass = typeClass;
        this.nullable = nullable;
        this.primaryKey = primaryKey;
    }

    public static ColumnInfo of(String name, String rawType, boolean nullable, boolean primaryKey) {
        return new ColumnInfo(name, rawType, TypeClassifier.classify(rawType), nullable, primaryKey);
    }

    ColumnInfo asPrimaryKey() {
        return primaryKey ? this : new ColumnInfo(name, rawType, typeClass, nullable, true);
    }
}
