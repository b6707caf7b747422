package com.afsun.schemagraph.source.jdbc;

import com.afsun.schemagraph.source.dto.ColumnDescription;
import com.afsun.schemagraph.source.dto.SchemaDescription;
import com.afsun.schemagraph.source.dto.TableDescription;
import com.alibaba.druid.DbType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.*;

/**
 * 基于 java.sql.DatabaseMetaData 的通用连接器
 * 读取表、列（按序号）、主键和导入外键
 *
 * @author afsun
 */
@Slf4j
public class JdbcMetadataSchemaConnector implements SchemaConnector {

    public static final List<DbType> SUPPORTED = Collections.unmodifiableList(Arrays.asList(
            DbType.postgresql, DbType.mysql, DbType.mariadb, DbType.sqlserver, DbType.oracle, DbType.db2));

    private static final Set<String> EXACT_NUMERIC = new HashSet<>(Arrays.asList(
            "number", "numeric", "decimal"));

    private final DbType dbType;

    public JdbcMetadataSchemaConnector(DbType dbType) {
        this.dbType = Objects.requireNonNull(dbType, "dbType");
    }

    @Override
    public DbType dbType() {
        return dbType;
    }

    @Override
    public SchemaDescription extract(JdbcTemplate jdbcTemplate, DataSourceSettings settings) {
        return jdbcTemplate.execute((ConnectionCallback<SchemaDescription>) con -> read(con, settings));
    }

    private SchemaDescription read(Connection con, DataSourceSettings settings) throws SQLException {
        DatabaseMetaData meta = con.getMetaData();
        String catalog = settings.getCatalog();
        if (catalog == null && (dbType == DbType.mysql || dbType == DbType.mariadb)) {
            catalog = con.getCatalog();
        }
        String schemaPattern = StringUtils.isNotBlank(settings.getSchema())
                ? settings.getSchema() : defaultSchema(settings);

        // 表名 -> 所在schema
        Map<String, String> tables = new LinkedHashMap<>();
        try (ResultSet rs = meta.getTables(catalog, schemaPattern, "%", null)) {
            while (rs.next()) {
                String tableType = rs.getString("TABLE_TYPE");
                if (!"TABLE".equalsIgnoreCase(tableType) && !"BASE TABLE".equalsIgnoreCase(tableType)) {
                    continue;
                }
                String name = rs.getString("TABLE_NAME");
                String schem = rs.getString("TABLE_SCHEM");
                if (tables.putIfAbsent(name, schem) != null) {
                    log.warn("多个schema下存在同名表，仅保留第一个: {}", name);
                }
            }
        }

        List<TableDescription> result = new ArrayList<>();
        for (Map.Entry<String, String> e : tables.entrySet()) {
            result.add(readTable(meta, catalog, e.getValue(), e.getKey()));
        }
        String database = catalog != null ? catalog : schemaPattern;
        log.info("元数据抽取完成: type={}, database={}, 表={}", dbType, database, result.size());
        return new SchemaDescription(database, result);
    }

    private TableDescription readTable(DatabaseMetaData meta, String catalog, String schema, String table)
            throws SQLException {
        TableDescription td = new TableDescription(table);

        TreeMap<Integer, ColumnDescription> ordered = new TreeMap<>();
        try (ResultSet rs = meta.getColumns(catalog, schema, table, "%")) {
            while (rs.next()) {
                String type = typeOf(rs.getString("TYPE_NAME"), rs.getInt("COLUMN_SIZE"),
                        rs.getInt("DECIMAL_DIGITS"), rs.wasNull());
                boolean nullable = rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls;
                ordered.put(rs.getInt("ORDINAL_POSITION"),
                        new ColumnDescription(rs.getString("COLUMN_NAME"), type, nullable, false));
            }
        }
        td.getColumns().addAll(ordered.values());

        List<String> pkColumns = new ArrayList<>();
        try (ResultSet rs = meta.getPrimaryKeys(catalog, schema, table)) {
            while (rs.next()) {
                pkColumns.add(rs.getString("COLUMN_NAME"));
            }
        }
        for (ColumnDescription cd : td.getColumns()) {
            cd.setPrimaryKey(pkColumns.contains(cd.getName()));
        }
        if (pkColumns.size() == 1) {
            td.setPrimaryKey(pkColumns.get(0));
        }

        try (ResultSet rs = meta.getImportedKeys(catalog, schema, table)) {
            while (rs.next()) {
                td.foreignKey(rs.getString("FKCOLUMN_NAME"), rs.getString("PKTABLE_NAME"),
                        rs.getString("PKCOLUMN_NAME"));
            }
        }
        log.debug("读取表结构: {} 列数={} 主键={} 外键={}", table, td.getColumns().size(),
                pkColumns, td.getForeignKeys().size());
        return td;
    }

    /**
     * numeric/decimal 需要带上精度标度，否则无法区分整数与小数
     */
    private static String typeOf(String typeName, int size, int digits, boolean digitsNull) {
        if (typeName == null) {
            return null;
        }
        if (EXACT_NUMERIC.contains(typeName.toLowerCase(Locale.ROOT)) && size > 0) {
            return typeName + "(" + size + "," + (digitsNull ? 0 : digits) + ")";
        }
        return typeName;
    }

    private String defaultSchema(DataSourceSettings settings) {
        switch (dbType) {
            case postgresql:
                return "public";
            case sqlserver:
                return "dbo";
            case h2:
                return "PUBLIC";
            case oracle:
            case db2:
                return settings.getUsername() == null ? null : settings.getUsername().toUpperCase(Locale.ROOT);
            default:
                return null;
        }
    }
}
