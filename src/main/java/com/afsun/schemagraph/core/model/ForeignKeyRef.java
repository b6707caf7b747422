package com.afsun.schemagraph.core.model;

import lombok.Data;

/**
 * 声明的外键约束：本表列 -> 目标表.目标列
 *
 * @author afsun
 */
@Data
public class ForeignKeyRef {
    private final String column;
    private final String referencesTable;
    private final String referencesColumn;

    private ForeignKeyRef(String column, String referencesTable, String referencesColumn) {
        this.column = column;
        this.referencesTable = referencesTable;
        this.referencesColumn = referencesColumn;
    }

    public static ForeignKeyRef of(String column, String referencesTable, String referencesColumn) {
        return new ForeignKeyRef(column, referencesTable, referencesColumn);
    }
}
