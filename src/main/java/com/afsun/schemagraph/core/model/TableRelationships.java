package com.afsun.schemagraph.core.model;

import lombok.Data;

import java.util.Collections;
import java.util.List;

/**
 * 单表的关系输出：主键 + 按列名排序的外键序列
 *
 * @author afsun
 */
@Data
public class TableRelationships {
    private final String table;
    private final String primaryKey;
    private final List<Relationship> foreignKeys;

    public TableRelationships(String table, String primaryKey, List<Relationship> foreignKeys) {
        this.table = table;
        this.primaryKey = primaryKey;
        this.foreignKeys = Collections.unmodifiableList(foreignKeys);
    }
}
