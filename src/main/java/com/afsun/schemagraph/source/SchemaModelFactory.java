package com.afsun.schemagraph.source;

import com.afsun.schemagraph.core.exceptions.InvalidSchemaException;
import com.afsun.schemagraph.core.model.SchemaModel;
import com.afsun.schemagraph.core.model.TableInfo;
import com.afsun.schemagraph.source.dto.ColumnDescription;
import com.afsun.schemagraph.source.dto.ForeignKeyDescription;
import com.afsun.schemagraph.source.dto.SchemaDescription;
import com.afsun.schemagraph.source.dto.TableDescription;

import java.util.ArrayList;
import java.util.List;

/**
 * Schema描述 -> SchemaModel，校验模型约束
 *
 * @author afsun
 */
public final class SchemaModelFactory {

    private SchemaModelFactory() {
    }

    /**
     * @throws InvalidSchemaException 表名/列名重复、缺少名称或类型、主键或外键源列不存在
     */
    public static SchemaModel create(SchemaDescription description) {
        if (description == null || description.getTables() == null) {
            throw new InvalidSchemaException("Schema描述为空或缺少tables");
        }
        List<TableInfo> tables = new ArrayList<>(description.getTables().size());
        for (TableDescription td : description.getTables()) {
            if (td == null) {
                throw new InvalidSchemaException("tables 中存在空的表定义");
            }
            TableInfo.Builder builder = TableInfo.builder(td.getName());
            if (td.getColumns() != null) {
                for (ColumnDescription cd : td.getColumns()) {
                    if (cd == null) {
                        throw new InvalidSchemaException("表 " + td.getName() + " 中存在空的列定义");
                    }
                    builder.column(cd.getName(), cd.getType(), cd.isNullable(), cd.isPrimaryKey());
                }
            }
            builder.primaryKey(td.getPrimaryKey());
            if (td.getForeignKeys() != null) {
                for (ForeignKeyDescription fk : td.getForeignKeys()) {
                    if (fk == null) {
                        throw new InvalidSchemaException("表 " + td.getName() + " 中存在空的外键定义");
                    }
                    builder.foreignKey(fk.getColumn(), fk.getReferencesTable(), fk.getReferencesColumn());
                }
            }
            tables.add(builder.build());
        }
        return SchemaModel.of(description.getDatabase(), tables);
    }
}
