package com.afsun.schemagraph.source.ddl;

import com.afsun.schemagraph.core.exceptions.SchemaSourceException;
import com.afsun.schemagraph.core.model.SchemaWarning;
import com.afsun.schemagraph.source.dto.ColumnDescription;
import com.afsun.schemagraph.source.dto.SchemaDescription;
import com.afsun.schemagraph.source.dto.TableDescription;
import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLName;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.statement.*;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 从DDL脚本读取Schema描述
 * 支持 CREATE TABLE（列定义、列级/表级主键与外键）以及 ALTER TABLE ADD 主键/外键
 *
 * @author afsun
 */
@Slf4j
public class DdlSchemaReader {

    private static final Set<DbType> SUPPORTED = EnumSet.of(
            DbType.mysql, DbType.mariadb, DbType.postgresql, DbType.sqlserver,
            DbType.oracle, DbType.db2, DbType.h2, DbType.clickhouse);

    public boolean supports(DbType dbType) {
        return SUPPORTED.contains(dbType);
    }

    /**
     * 解析DDL脚本
     *
     * @param ddl DDL文本
     * @param dbType 方言，为null时自动检测
     * @param database 结果中的库名，可为null
     * @return Schema描述与告警
     * @throws SchemaSourceException 方言不支持或语句无法解析
     */
    public DdlReadResult read(String ddl, DbType dbType, String database) {
        String cleaned = DdlScriptUtils.stripComments(ddl == null ? "" : ddl);
        List<String> statements = DdlScriptUtils.splitStatements(cleaned);
        if (dbType == null) {
            dbType = DdlDialectDetector.detect(cleaned);
            log.debug("解析DDL，检测到方言: {}", dbType);
        }
        if (!supports(dbType)) {
            throw new SchemaSourceException(SchemaSourceException.UNSUPPORTED_DIALECT,
                    "数据库类型{}暂不支持DDL解析", dbType);
        }

        ReadContext ctx = new ReadContext();
        for (String stmtText : statements) {
            List<SQLStatement> parsed;
            try {
                parsed = SQLUtils.parseStatements(stmtText, dbType);
            } catch (RuntimeException e) {
                throw new SchemaSourceException(SchemaSourceException.DDL_PARSE_ERROR,
                        "DDL解析失败: {} -> {}", shortSql(stmtText), e.getMessage(), e);
            }
            for (SQLStatement st : parsed) {
                handle(st, ctx);
            }
        }

        SchemaDescription schema = new SchemaDescription(database, ctx.finish());
        log.info("DDL解析完成, 方言={}, 表={}, 语句={}, 跳过={}, 告警={}",
                dbType, schema.getTables().size(), statements.size(), ctx.skipped, ctx.warnings.size());
        return new DdlReadResult(schema, dbType, ctx.warnings, ctx.skipped);
    }

    private void handle(SQLStatement st, ReadContext ctx) {
        if (st instanceof SQLCreateTableStatement) {
            SQLCreateTableStatement ct = (SQLCreateTableStatement) st;
            if (ct.getSelect() != null) {
                ctx.skip(st, "CREATE TABLE ... AS SELECT 不包含列类型定义");
                return;
            }
            handleCreateTable(ct, ctx);
            return;
        }
        if (st instanceof SQLAlterTableStatement) {
            handleAlterTable((SQLAlterTableStatement) st, ctx);
            return;
        }
        ctx.skip(st, "非建表语句: " + st.getClass().getSimpleName());
    }

    private void handleCreateTable(SQLCreateTableStatement ct, ReadContext ctx) {
        TableName tn = TableName.parse(ct.getTableSource().toString());
        TableDescription td = new TableDescription(tn.getTable());
        Set<String> pkColumns = new LinkedHashSet<>();

        for (SQLTableElement elem : ct.getTableElementList()) {
            if (elem instanceof SQLColumnDefinition) {
                readColumn((SQLColumnDefinition) elem, td, pkColumns);
            } else if (elem instanceof SQLPrimaryKey && elem instanceof SQLUnique) {
                for (SQLSelectOrderByItem item : ((SQLUnique) elem).getColumns()) {
                    pkColumns.add(TableName.unquote(item.getExpr().toString()));
                }
            } else if (elem instanceof SQLForeignKeyConstraint) {
                addForeignKey(td, (SQLForeignKeyConstraint) elem, ctx);
            }
        }

        if (td.getColumns().isEmpty()) {
            ctx.warnings.add(SchemaWarning.of(SchemaWarning.EMPTY_CREATE_TABLE,
                    "CREATE TABLE 未包含列定义: " + td.getName(), td.getName(), "该表仅作为孤立节点"));
        }
        if (ctx.tables.put(td.getName(), td) != null) {
            log.warn("重复定义的表，以后出现的为准: {}", td.getName());
        }
        ctx.primaryKeys.put(td.getName(), pkColumns);
        log.debug("读取表定义: {} 列数={} 主键={}", td.getName(), td.getColumns().size(), pkColumns);
    }

    private void readColumn(SQLColumnDefinition colDef, TableDescription td, Set<String> pkColumns) {
        String colName = TableName.unquote(colDef.getColumnName());
        String type = colDef.getDataType() == null ? null : colDef.getDataType().toString();
        boolean nullable = true;
        for (SQLColumnConstraint constraint : colDef.getConstraints()) {
            if (constraint instanceof SQLNotNullConstraint) {
                nullable = false;
            } else if (constraint instanceof SQLColumnPrimaryKey) {
                nullable = false;
                pkColumns.add(colName);
            } else if (constraint instanceof SQLColumnReference) {
                SQLColumnReference ref = (SQLColumnReference) constraint;
                if (ref.getTable() != null && !ref.getColumns().isEmpty()) {
                    td.foreignKey(colName, TableName.unquote(ref.getTable().getSimpleName()),
                            TableName.unquote(ref.getColumns().get(0).getSimpleName()));
                }
            }
        }
        td.getColumns().add(new ColumnDescription(colName, type, nullable, false));
    }

    private void handleAlterTable(SQLAlterTableStatement alter, ReadContext ctx) {
        TableName tn = TableName.parse(alter.getTableSource().toString());
        TableDescription td = ctx.tables.get(tn.getTable());
        if (td == null) {
            ctx.skip(alter, "ALTER TABLE 引用了未定义的表: " + tn.getTable());
            return;
        }
        for (SQLAlterTableItem item : alter.getItems()) {
            if (!(item instanceof SQLAlterTableAddConstraint)) {
                ctx.skip(alter, "不支持的 ALTER TABLE 子句: " + item.getClass().getSimpleName());
                continue;
            }
            SQLConstraint constraint = ((SQLAlterTableAddConstraint) item).getConstraint();
            if (constraint instanceof SQLForeignKeyConstraint) {
                addForeignKey(td, (SQLForeignKeyConstraint) constraint, ctx);
            } else if (constraint instanceof SQLPrimaryKey && constraint instanceof SQLUnique) {
                Set<String> pkColumns = ctx.primaryKeys.computeIfAbsent(td.getName(), k -> new LinkedHashSet<>());
                for (SQLSelectOrderByItem col : ((SQLUnique) constraint).getColumns()) {
                    pkColumns.add(TableName.unquote(col.getExpr().toString()));
                }
            } else {
                ctx.skip(alter, "不支持的约束类型: " + constraint.getClass().getSimpleName());
            }
        }
    }

    /**
     * 多列外键按位置拆成单列外键
     * 未写目标列时（REFERENCES t）指向目标表主键，待全部语句读完后在 finish 中回填
     */
    private void addForeignKey(TableDescription td, SQLForeignKeyConstraint fk, ReadContext ctx) {
        List<String> referencing = new ArrayList<>();
        for (SQLName name : fk.getReferencingColumns()) {
            referencing.add(TableName.unquote(name.getSimpleName()));
        }
        List<SQLName> referenced = fk.getReferencedColumns();
        String targetTable = TableName.unquote(fk.getReferencedTableName().getSimpleName());
        if (referenced == null || referenced.isEmpty()) {
            ctx.pendingForeignKeys.add(new PendingForeignKey(td, referencing, targetTable));
            return;
        }
        for (int i = 0; i < referencing.size() && i < referenced.size(); i++) {
            td.foreignKey(referencing.get(i), targetTable, TableName.unquote(referenced.get(i).getSimpleName()));
        }
    }

    private static String shortSql(String s) {
        String t = s.replaceAll("\\s+", " ").trim();
        if (t.length() <= 200) return t;
        return t.substring(0, 100) + " ... " + t.substring(t.length() - 100);
    }

    /**
     * 单次解析的可变状态
     */
    private static class ReadContext {
        private final Map<String, TableDescription> tables = new LinkedHashMap<>();
        private final Map<String, Set<String>> primaryKeys = new HashMap<>();
        private final List<SchemaWarning> warnings = new ArrayList<>();
        private final List<PendingForeignKey> pendingForeignKeys = new ArrayList<>();
        private int skipped;

        void skip(SQLStatement st, String reason) {
            skipped++;
            warnings.add(SchemaWarning.of(SchemaWarning.SKIPPED_STATEMENT, reason,
                    st.getClass().getSimpleName(), "仅 CREATE TABLE / ALTER TABLE ADD CONSTRAINT 参与建模"));
            log.warn("跳过DDL语句: {}", reason);
        }

        /**
         * 回填主键：单列主键写入 primary_key，复合主键只标记列
         * 再解析未写目标列的外键
         */
        List<TableDescription> finish() {
            for (TableDescription td : tables.values()) {
                Set<String> pk = primaryKeys.getOrDefault(td.getName(), Collections.emptySet());
                for (ColumnDescription cd : td.getColumns()) {
                    if (pk.contains(cd.getName())) {
                        cd.setPrimaryKey(true);
                        cd.setNullable(false);
                    }
                }
                if (pk.size() == 1) {
                    td.setPrimaryKey(pk.iterator().next());
                }
            }
            for (PendingForeignKey pending : pendingForeignKeys) {
                resolve(pending);
            }
            return new ArrayList<>(tables.values());
        }

        /**
         * 按位置对应目标表主键列；目标表未定义或主键列数不一致时告警并丢弃
         */
        private void resolve(PendingForeignKey pending) {
            String position = pending.table.getName() + "." + String.join(",", pending.columns);
            Set<String> targetPk = tables.containsKey(pending.targetTable)
                    ? primaryKeys.getOrDefault(pending.targetTable, Collections.emptySet())
                    : Collections.emptySet();
            if (targetPk.isEmpty() || targetPk.size() != pending.columns.size()) {
                warnings.add(SchemaWarning.of(SchemaWarning.UNRESOLVED_REFERENCE,
                        "外键未指定目标列，且无法从 " + pending.targetTable + " 的主键推出",
                        position, "在 REFERENCES 子句中显式写出目标列"));
                log.warn("无法解析隐式外键目标列: {} -> {}", position, pending.targetTable);
                return;
            }
            Iterator<String> targetColumns = targetPk.iterator();
            for (String column : pending.columns) {
                pending.table.foreignKey(column, pending.targetTable, targetColumns.next());
            }
        }
    }

    private static class PendingForeignKey {
        private final TableDescription table;
        private final List<String> columns;
        private final String targetTable;

        PendingForeignKey(TableDescription table, List<String> columns, String targetTable) {
            this.table = table;
            this.columns = columns;
            this.targetTable = targetTable;
        }
    }
}
