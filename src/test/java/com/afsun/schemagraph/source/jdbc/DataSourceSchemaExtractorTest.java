package com.afsun.schemagraph.source.jdbc;

import com.afsun.schemagraph.core.exceptions.SchemaSourceException;
import com.afsun.schemagraph.source.dto.SchemaDescription;
import com.alibaba.druid.DbType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 连接器注册表、数据源抽取与URL脱敏
 */
class DataSourceSchemaExtractorTest {

    private static final String URL = "jdbc:h2:mem:extractor;DB_CLOSE_DELAY=-1";

    private DataSourceSchemaExtractor extractor;

    @BeforeEach
    void setUp() {
        new JdbcTemplate(new DriverManagerDataSource(URL, "sa", ""))
                .execute("CREATE TABLE IF NOT EXISTS regions (region_id INT PRIMARY KEY, label VARCHAR(32))");

        Map<String, DataSourceSettings> datasources = new HashMap<>();
        datasources.put("local", settings(DbType.h2, URL));
        datasources.put("broken", settings(DbType.h2, "jdbc:nosuchdriver://localhost/db"));
        datasources.put("hive", settings(DbType.hive, "jdbc:hive2://localhost:10000"));

        SchemaConnectorRegistry registry = SchemaConnectorRegistry.defaults()
                .register(new JdbcMetadataSchemaConnector(DbType.h2));
        extractor = new DataSourceSchemaExtractor(registry, datasources);
    }

    private static DataSourceSettings settings(DbType type, String url) {
        DataSourceSettings s = new DataSourceSettings();
        s.setType(type);
        s.setUrl(url);
        s.setUsername("sa");
        s.setPassword("");
        return s;
    }

    @Test
    void testExtractConfiguredDataSource() {
        SchemaDescription schema = extractor.extract("local");
        assertEquals(1, schema.getTables().size());
        assertEquals("REGIONS", schema.getTables().get(0).getName());
        assertEquals("REGION_ID", schema.getTables().get(0).getPrimaryKey());
    }

    @Test
    void testErrors() {
        SchemaSourceException notFound = assertThrows(SchemaSourceException.class, () -> extractor.extract("nope"));
        assertEquals(SchemaSourceException.DATASOURCE_NOT_FOUND, notFound.getErrorCode());

        SchemaSourceException noConnector = assertThrows(SchemaSourceException.class, () -> extractor.extract("hive"));
        assertEquals(SchemaSourceException.CONNECTOR_NOT_FOUND, noConnector.getErrorCode());

        SchemaSourceException broken = assertThrows(SchemaSourceException.class, () -> extractor.extract("broken"));
        assertEquals(SchemaSourceException.CONNECTOR_ERROR, broken.getErrorCode());
        assertNotNull(broken.getCause());
    }

    @Test
    void testDefaultRegistry() {
        SchemaConnectorRegistry registry = SchemaConnectorRegistry.defaults();
        assertEquals(7, registry.registeredTypes().size());
        assertTrue(registry.supports(DbType.postgresql));
        assertTrue(registry.supports(DbType.sqlserver));
        assertTrue(registry.find(DbType.clickhouse) instanceof ClickHouseSchemaConnector);
        assertEquals(DbType.mysql, registry.find(DbType.mysql).dbType());
        assertFalse(registry.supports(null));
        assertThrows(SchemaSourceException.class, () -> registry.find(null));
    }

    @Test
    void testMaskUrl() {
        assertEquals("jdbc:mysql://localhost:3306/db?user=***&password=***",
                DataSourceSettings.maskUrl("jdbc:mysql://localhost:3306/db?user=root&password=secret"));
        assertEquals("jdbc:postgresql://***@host:5432/db",
                DataSourceSettings.maskUrl("jdbc:postgresql://bob:pw@host:5432/db"));
        assertEquals("jdbc:h2:mem:x", DataSourceSettings.maskUrl("jdbc:h2:mem:x"));
        assertNull(DataSourceSettings.maskUrl(null));

        DataSourceSettings s = settings(DbType.mysql, "jdbc:mysql://h/db");
        s.setPassword("secret");
        assertFalse(s.toString().contains("secret"));
    }
}
