package com.afsun.schemagraph.source.jdbc;

import com.afsun.schemagraph.core.exceptions.SchemaGraphException;
import com.afsun.schemagraph.core.exceptions.SchemaSourceException;
import com.afsun.schemagraph.source.dto.SchemaDescription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.util.Map;

/**
 * 按名称取出已配置的数据源，选择连接器并抽取Schema描述
 * 每次调用新建连接，不做缓存
 *
 * @author afsun
 */
@Slf4j
public class DataSourceSchemaExtractor {

    private final SchemaConnectorRegistry registry;
    private final Map<String, DataSourceSettings> datasources;

    public DataSourceSchemaExtractor(SchemaConnectorRegistry registry, Map<String, DataSourceSettings> datasources) {
        this.registry = registry;
        this.datasources = datasources;
    }

    public SchemaDescription extract(String name) {
        DataSourceSettings settings = datasources.get(name);
        if (settings == null) {
            throw new SchemaSourceException(SchemaSourceException.DATASOURCE_NOT_FOUND,
                    "未配置数据源: {}，已配置: {}", name, datasources.keySet());
        }
        SchemaConnector connector = registry.find(settings.getType());
        log.info("开始抽取数据源 {} ({}) {}", name, settings.getType(), settings.maskedUrl());
        try {
            SchemaDescription description = connector.extract(new JdbcTemplate(createDataSource(settings)), settings);
            if (description.getDatabase() == null) {
                description.setDatabase(name);
            }
            return description;
        } catch (SchemaGraphException e) {
            throw e;
        } catch (Exception e) {
            log.error("数据源 {} 元数据抽取失败: {}", name, settings.maskedUrl(), e);
            throw new SchemaSourceException(SchemaSourceException.CONNECTOR_ERROR,
                    "数据源{}元数据抽取失败: {}", name, e.getMessage(), e);
        }
    }

    protected DataSource createDataSource(DataSourceSettings settings) {
        DriverManagerDataSource ds = new DriverManagerDataSource(settings.getUrl());
        ds.setUsername(settings.getUsername());
        ds.setPassword(settings.getPassword());
        return ds;
    }
}
