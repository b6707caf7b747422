package com.afsun.schemagraph.core.model;

import com.afsun.schemagraph.core.exceptions.InvalidSchemaException;
import lombok.Getter;

import java.util.*;

/**
 * 一次抽取得到的规范化Schema，构建后不再修改
 *
 * @author afsun
 */
@Getter
public class SchemaModel {
    private final String database;
    private final Map<String, TableInfo> tables;

    private SchemaModel(String database, Map<String, TableInfo> tables) {
        this.database = database;
        this.tables = Collections.unmodifiableMap(tables);
    }

    public static SchemaModel of(String database, List<TableInfo> tables) {
        Map<String, TableInfo> byName = new LinkedHashMap<>();
        for (TableInfo t : tables) {
            if (byName.putIfAbsent(t.getName(), t) != null) {
                throw new InvalidSchemaException("表名重复: " + t.getName());
            }
        }
        return new SchemaModel(database, byName);
    }

    public Optional<TableInfo> findTable(String tableName) {
        return Optional.ofNullable(tables.get(tableName));
    }

    public Collection<TableInfo> tableList() {
        return tables.values();
    }

    public int tableCount() {
        return tables.size();
    }
}
