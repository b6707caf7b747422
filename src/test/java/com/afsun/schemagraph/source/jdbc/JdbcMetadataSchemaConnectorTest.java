package com.afsun.schemagraph.source.jdbc;

import com.afsun.schemagraph.core.inference.DefaultRelationshipInferenceEngine;
import com.afsun.schemagraph.core.model.Basis;
import com.afsun.schemagraph.core.model.InferenceResult;
import com.afsun.schemagraph.core.model.Relationship;
import com.afsun.schemagraph.source.SchemaModelFactory;
import com.afsun.schemagraph.source.dto.SchemaDescription;
import com.afsun.schemagraph.source.dto.TableDescription;
import com.alibaba.druid.DbType;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 基于H2内存库的元数据抽取
 */
class JdbcMetadataSchemaConnectorTest {

    static final String URL = "jdbc:h2:mem:metadata_connector;DB_CLOSE_DELAY=-1";

    private static JdbcTemplate jdbcTemplate;

    @BeforeAll
    static void createTables() {
        jdbcTemplate = new JdbcTemplate(new DriverManagerDataSource(URL, "sa", ""));
        jdbcTemplate.execute("CREATE TABLE customers (customer_id INT PRIMARY KEY, email VARCHAR(128))");
        jdbcTemplate.execute("CREATE TABLE orders (order_id BIGINT PRIMARY KEY, customer_id INT NOT NULL, " +
                "amount NUMERIC(10,2), FOREIGN KEY (customer_id) REFERENCES customers(customer_id))");
        jdbcTemplate.execute("CREATE TABLE products (product_id INT PRIMARY KEY, title VARCHAR(64))");
        jdbcTemplate.execute("CREATE TABLE order_lines (order_id BIGINT, line_no INT, product_id INT, " +
                "PRIMARY KEY (order_id, line_no))");
    }

    private static TableDescription table(SchemaDescription schema, String name) {
        return schema.getTables().stream()
                .filter(t -> name.equals(t.getName()))
                .findFirst()
                .orElseThrow(() -> new AssertionError("表不存在: " + name));
    }

    @Test
    void testExtract() {
        DataSourceSettings settings = new DataSourceSettings();
        settings.setType(DbType.h2);
        SchemaDescription schema = new JdbcMetadataSchemaConnector(DbType.h2).extract(jdbcTemplate, settings);

        assertEquals("PUBLIC", schema.getDatabase());
        assertEquals(4, schema.getTables().size());

        TableDescription orders = table(schema, "ORDERS");
        assertEquals("ORDER_ID", orders.getPrimaryKey());
        assertEquals("ORDER_ID", orders.getColumns().get(0).getName());
        assertEquals("CUSTOMER_ID", orders.getColumns().get(1).getName());
        assertFalse(orders.getColumns().get(1).isNullable());
        assertEquals("NUMERIC(10,2)", orders.getColumns().get(2).getType());
        assertEquals(1, orders.getForeignKeys().size());
        assertEquals("CUSTOMERS", orders.getForeignKeys().get(0).getReferencesTable());
        assertEquals("CUSTOMER_ID", orders.getForeignKeys().get(0).getReferencesColumn());

        TableDescription lines = table(schema, "ORDER_LINES");
        assertNull(lines.getPrimaryKey());
        assertTrue(lines.getColumns().get(0).isPrimaryKey());
        assertTrue(lines.getColumns().get(1).isPrimaryKey());
    }

    @Test
    void testExtractedSchemaFeedsInference() {
        DataSourceSettings settings = new DataSourceSettings();
        settings.setSchema("PUBLIC");
        SchemaDescription schema = new JdbcMetadataSchemaConnector(DbType.h2).extract(jdbcTemplate, settings);
        InferenceResult result = new DefaultRelationshipInferenceEngine().infer(SchemaModelFactory.create(schema));

        List<Relationship> orders = result.foreignKeysOf("ORDERS");
        assertEquals(1, orders.size());
        assertEquals(Basis.DECLARED, orders.get(0).getBasis());

        List<Relationship> lines = result.foreignKeysOf("ORDER_LINES");
        assertTrue(lines.stream().anyMatch(r -> r.getSourceColumn().equals("PRODUCT_ID")
                && r.getTargetTable().equals("PRODUCTS") && r.getBasis() == Basis.EXACT_MATCH));
    }
}
