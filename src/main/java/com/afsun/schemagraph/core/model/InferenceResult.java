package com.afsun.schemagraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.util.*;

/**
 * 关系推断结果：表名 -> {主键, 外键序列}，表顺序与Schema一致
 * 每次推断独立生成，调用方持有
 *
 * @author afsun
 */
@Getter
public class InferenceResult {
    private final Map<String, TableRelationships> tables;
    private final List<SchemaWarning> warnings;

    public InferenceResult(Map<String, TableRelationships> tables, List<SchemaWarning> warnings) {
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public Optional<TableRelationships> find(String table) {
        return Optional.ofNullable(tables.get(table));
    }

    public List<Relationship> foreignKeysOf(String table) {
        TableRelationships tr = tables.get(table);
        return tr == null ? Collections.emptyList() : tr.getForeignKeys();
    }

    /**
     * 按表顺序展开的全部关系
     */
    @JsonIgnore
    public List<Relationship> getAllRelationships() {
        List<Relationship> all = new ArrayList<>();
        for (TableRelationships tr : tables.values()) {
            all.addAll(tr.getForeignKeys());
        }
        return all;
    }

    public int relationshipCount() {
        int n = 0;
        for (TableRelationships tr : tables.values()) {
            n += tr.getForeignKeys().size();
        }
        return n;
    }
}
