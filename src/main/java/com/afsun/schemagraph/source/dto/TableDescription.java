package com.afsun.schemagraph.source.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TableDescription {
    private String name;
    private List<ColumnDescription> columns = new ArrayList<>();

    @JsonProperty("primary_key")
    @JsonAlias("primaryKey")
    private String primaryKey;

    @JsonProperty("foreign_keys")
    @JsonAlias("foreignKeys")
    private List<ForeignKeyDescription> foreignKeys = new ArrayList<>();

    public TableDescription(String name) {
        this.name = name;
    }

    public TableDescription column(String columnName, String type, boolean nullable, boolean primaryKey) {
        columns.add(new ColumnDescription(columnName, type, nullable, primaryKey));
        return this;
    }

    public TableDescription foreignKey(String column, String referencesTable, String referencesColumn) {
        foreignKeys.add(new ForeignKeyDescription(column, referencesTable, referencesColumn));
        return this;
    }
}
