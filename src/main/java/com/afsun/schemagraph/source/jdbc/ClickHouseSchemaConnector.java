package com.afsun.schemagraph.source.jdbc;

import com.afsun.schemagraph.source.dto.ColumnDescription;
import com.afsun.schemagraph.source.dto.SchemaDescription;
import com.afsun.schemagraph.source.dto.TableDescription;
import com.alibaba.druid.DbType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.*;

/**
 * ClickHouse连接器
 * 从 system.columns 读取列类型和主键标记，ClickHouse 没有外键
 *
 * @author afsun
 */
@Slf4j
public class ClickHouseSchemaConnector implements SchemaConnector {

    static final String COLUMNS_SQL =
            "SELECT table, name, type, is_in_primary_key " +
            "FROM system.columns " +
            "WHERE database = ? " +
            "ORDER BY table, position";

    @Override
    public DbType dbType() {
        return DbType.clickhouse;
    }

    @Override
    public SchemaDescription extract(JdbcTemplate jdbcTemplate, DataSourceSettings settings) {
        String database = StringUtils.defaultIfBlank(settings.getSchema(), settings.getCatalog());
        if (StringUtils.isBlank(database)) {
            database = jdbcTemplate.queryForObject("SELECT currentDatabase()", String.class);
        }
        log.debug("执行元数据查询: {} [{}]", COLUMNS_SQL, database);

        Map<String, TableDescription> tables = new LinkedHashMap<>();
        Map<String, List<String>> pkColumns = new HashMap<>();
        jdbcTemplate.query(COLUMNS_SQL, rs -> {
            String table = rs.getString("table");
            String column = rs.getString("name");
            String type = rs.getString("type");
            boolean pk = rs.getInt("is_in_primary_key") == 1;

            TableDescription td = tables.computeIfAbsent(table, TableDescription::new);
            td.getColumns().add(new ColumnDescription(column, type,
                    type != null && type.startsWith("Nullable("), pk));
            if (pk) {
                pkColumns.computeIfAbsent(table, k -> new ArrayList<>()).add(column);
            }
        }, database);

        pkColumns.forEach((table, cols) -> {
            if (cols.size() == 1) {
                tables.get(table).setPrimaryKey(cols.get(0));
            }
        });
        log.info("ClickHouse元数据抽取完成: database={}, 表={}, 列={}", database, tables.size(),
                tables.values().stream().mapToInt(t -> t.getColumns().size()).sum());
        return new SchemaDescription(database, new ArrayList<>(tables.values()));
    }
}
