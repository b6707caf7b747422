package com.afsun.schemagraph.source.jdbc;

import com.afsun.schemagraph.source.dto.SchemaDescription;
import com.alibaba.druid.DbType;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * 按数据库类型抽取表结构的连接器
 *
 * @author afsun
 */
public interface SchemaConnector {

    DbType dbType();

    /**
     * 从在线数据库抽取表、列、主键和外键
     *
     * @param jdbcTemplate 目标库的JdbcTemplate
     * @param settings 数据源配置，提供 catalog/schema 过滤条件
     * @return 与连接器无关的Schema描述
     */
    SchemaDescription extract(JdbcTemplate jdbcTemplate, DataSourceSettings settings);
}
