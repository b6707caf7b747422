package com.afsun.schemagraph.source.jdbc;

import com.afsun.schemagraph.core.exceptions.SchemaSourceException;
import com.alibaba.druid.DbType;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 数据库类型到连接器的显式注册表
 *
 * @author afsun
 */
@Slf4j
public class SchemaConnectorRegistry {

    private final Map<DbType, SchemaConnector> connectors = new EnumMap<>(DbType.class);

    public SchemaConnectorRegistry register(SchemaConnector connector) {
        SchemaConnector previous = connectors.put(connector.dbType(), connector);
        if (previous != null) {
            log.warn("连接器被覆盖: {} {} -> {}", connector.dbType(),
                    previous.getClass().getSimpleName(), connector.getClass().getSimpleName());
        }
        return this;
    }

    public SchemaConnector find(DbType dbType) {
        SchemaConnector connector = dbType == null ? null : connectors.get(dbType);
        if (connector == null) {
            throw new SchemaSourceException(SchemaSourceException.CONNECTOR_NOT_FOUND,
                    "未注册数据库类型{}的连接器，可用类型: {}", dbType, registeredTypes());
        }
        return connector;
    }

    public boolean supports(DbType dbType) {
        return dbType != null && connectors.containsKey(dbType);
    }

    public List<DbType> registeredTypes() {
        return new ArrayList<>(connectors.keySet());
    }

    /**
     * 内置连接器：通用 DatabaseMetaData 连接器 + ClickHouse
     */
    public static SchemaConnectorRegistry defaults() {
        SchemaConnectorRegistry registry = new SchemaConnectorRegistry();
        for (DbType type : JdbcMetadataSchemaConnector.SUPPORTED) {
            registry.register(new JdbcMetadataSchemaConnector(type));
        }
        registry.register(new ClickHouseSchemaConnector());
        return registry;
    }
}
