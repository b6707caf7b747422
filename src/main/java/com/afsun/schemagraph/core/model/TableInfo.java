package com.afsun.schemagraph.core.model;

import com.afsun.schemagraph.core.exceptions.InvalidSchemaException;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.util.*;

/**
 * 表元数据（不可变），列顺序与来源一致
 *
 * @author afsun
 */
@Data
public class TableInfo {
    private final String name;
    private final List<ColumnInfo> columns;
    /**
     * 单列主键名，复合主键或无主键时为null
     */
    private final String primaryKey;
    private final List<ForeignKeyRef> declaredForeignKeys;

    private TableInfo(String name, List<ColumnInfo> columns, String primaryKey, List<ForeignKeyRef> declaredForeignKeys) {
        this.name = name;
        this.columns = Collections.unmodifiableList(columns);
        this.primaryKey = primaryKey;
        this.declaredForeignKeys = Collections.unmodifiableList(declaredForeignKeys);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Optional<ColumnInfo> findColumn(String columnName) {
        for (ColumnInfo c : columns) {
            if (c.getName().equals(columnName)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    public Optional<ColumnInfo> primaryKeyColumn() {
        return primaryKey == null ? Optional.empty() : findColumn(primaryKey);
    }

    public boolean hasDeclaredForeignKey(String columnName) {
        for (ForeignKeyRef fk : declaredForeignKeys) {
            if (fk.getColumn().equals(columnName)) {
                return true;
            }
        }
        return false;
    }

    public int columnCount() {
        return columns.size();
    }

    public static class Builder {
        private final String name;
        private final List<ColumnInfo> columns = new ArrayList<>();
        private final List<ForeignKeyRef> foreignKeys = new ArrayList<>();
        private String primaryKey;

        private Builder(String name) {
            this.name = name;
        }

        public Builder column(String columnName, String rawType, boolean nullable, boolean primaryKey) {
            if (StringUtils.isBlank(columnName)) {
                throw new InvalidSchemaException("表 " + name + " 存在缺少名称的列");
            }
            if (StringUtils.isBlank(rawType)) {
                throw new InvalidSchemaException("列 " + name + "." + columnName + " 缺少类型");
            }
            columns.add(ColumnInfo.of(columnName, rawType, nullable, primaryKey));
            return this;
        }

        public Builder primaryKey(String columnName) {
            this.primaryKey = StringUtils.isBlank(columnName) ? null : columnName;
            return this;
        }

        public Builder foreignKey(String column, String referencesTable, String referencesColumn) {
            foreignKeys.add(ForeignKeyRef.of(column, referencesTable, referencesColumn));
            return this;
        }

        /**
         * 校验并构建：列名唯一、主键列存在、外键源列存在
         */
        public TableInfo build() {
            if (StringUtils.isBlank(name)) {
                throw new InvalidSchemaException("存在缺少名称的表");
            }
            Set<String> seen = new HashSet<>();
            for (ColumnInfo c : columns) {
                if (!seen.add(c.getName())) {
                    throw new InvalidSchemaException("表 " + name + " 中列名重复: " + c.getName());
                }
            }

            String pk = primaryKey;
            if (pk == null) {
                // 未显式指定时，仅当恰好一列标记为主键才视为单列主键
                List<String> flagged = new ArrayList<>();
                for (ColumnInfo c : columns) {
                    if (c.isPrimaryKey()) {
                        flagged.add(c.getName());
                    }
                }
                pk = flagged.size() == 1 ? flagged.get(0) : null;
            } else if (!seen.contains(pk)) {
                throw new InvalidSchemaException("表 " + name + " 的主键列不存在: " + pk);
            }

            List<ColumnInfo> finalColumns = new ArrayList<>(columns.size());
            for (ColumnInfo c : columns) {
                finalColumns.add(c.getName().equals(pk) ? c.asPrimaryKey() : c);
            }

            for (ForeignKeyRef fk : foreignKeys) {
                if (StringUtils.isAnyBlank(fk.getColumn(), fk.getReferencesTable(), fk.getReferencesColumn())) {
                    throw new InvalidSchemaException("表 " + name + " 的外键定义不完整: " + fk);
                }
                if (!seen.contains(fk.getColumn())) {
                    throw new InvalidSchemaException("表 " + name + " 的外键引用了不存在的列: " + fk.getColumn());
                }
            }
            return new TableInfo(name, finalColumns, pk, new ArrayList<>(foreignKeys));
        }
    }
}
