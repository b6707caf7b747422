package com.afsun.schemagraph.source.ddl;

import com.afsun.schemagraph.core.exceptions.SchemaSourceException;
import com.afsun.schemagraph.core.model.SchemaWarning;
import com.afsun.schemagraph.source.dto.ColumnDescription;
import com.afsun.schemagraph.source.dto.ForeignKeyDescription;
import com.afsun.schemagraph.source.dto.TableDescription;
import com.alibaba.druid.DbType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DdlSchemaReaderTest {

    private DdlSchemaReader reader;

    @BeforeEach
    void setUp() {
        reader = new DdlSchemaReader();
    }

    private static TableDescription table(DdlReadResult result, String name) {
        return result.getSchema().getTables().stream()
                .filter(t -> name.equals(t.getName()))
                .findFirst()
                .orElseThrow(() -> new AssertionError("表不存在: " + name));
    }

    private static ColumnDescription column(TableDescription table, String name) {
        return table.getColumns().stream()
                .filter(c -> name.equals(c.getName()))
                .findFirst()
                .orElseThrow(() -> new AssertionError("列不存在: " + name));
    }

    @Test
    void testMySqlCreateAndAlter() {
        String ddl = "-- shop schema\n" +
                "CREATE TABLE `customers` (\n" +
                "  `customer_id` INT NOT NULL AUTO_INCREMENT,\n" +
                "  `email` VARCHAR(128),\n" +
                "  PRIMARY KEY (`customer_id`)\n" +
                ") ENGINE=InnoDB;\n" +
                "CREATE TABLE `orders` (\n" +
                "  `order_id` BIGINT PRIMARY KEY,\n" +
                "  `customer_id` INT NOT NULL,\n" +
                "  CONSTRAINT `fk_cust` FOREIGN KEY (`customer_id`) REFERENCES `customers` (`customer_id`)\n" +
                ");\n" +
                "CREATE TABLE order_items (\n" +
                "  order_id BIGINT NOT NULL,\n" +
                "  line_no INT NOT NULL,\n" +
                "  sku VARCHAR(32),\n" +
                "  PRIMARY KEY (order_id, line_no)\n" +
                ");\n" +
                "ALTER TABLE order_items ADD CONSTRAINT fk_order FOREIGN KEY (order_id) REFERENCES orders (order_id);\n" +
                "INSERT INTO customers (email) VALUES ('a@b.c');";

        DdlReadResult result = reader.read(ddl, DbType.mysql, "shop");

        assertEquals(DbType.mysql, result.getDbType());
        assertEquals("shop", result.getSchema().getDatabase());
        assertEquals(3, result.getSchema().getTables().size());

        TableDescription customers = table(result, "customers");
        assertEquals("customer_id", customers.getPrimaryKey());
        assertFalse(column(customers, "customer_id").isNullable());
        assertTrue(column(customers, "customer_id").isPrimaryKey());
        assertTrue(column(customers, "email").isNullable());
        assertTrue(column(customers, "email").getType().toLowerCase().startsWith("varchar"));

        TableDescription orders = table(result, "orders");
        assertEquals("order_id", orders.getPrimaryKey());
        assertEquals(1, orders.getForeignKeys().size());
        ForeignKeyDescription fk = orders.getForeignKeys().get(0);
        assertEquals("customer_id", fk.getColumn());
        assertEquals("customers", fk.getReferencesTable());
        assertEquals("customer_id", fk.getReferencesColumn());

        TableDescription items = table(result, "order_items");
        assertNull(items.getPrimaryKey());
        assertTrue(column(items, "order_id").isPrimaryKey());
        assertTrue(column(items, "line_no").isPrimaryKey());
        assertFalse(column(items, "sku").isPrimaryKey());
        assertEquals(1, items.getForeignKeys().size());
        assertEquals("orders", items.getForeignKeys().get(0).getReferencesTable());

        assertEquals(1, result.getSkippedStatements());
        assertEquals(SchemaWarning.SKIPPED_STATEMENT, result.getWarnings().get(0).getCategory());
    }

    @Test
    void testPostgresWithDetection() {
        String ddl = "CREATE TABLE public.users (id serial PRIMARY KEY, email text NOT NULL);\n" +
                "CREATE TABLE public.posts (\n" +
                "  post_id bigserial PRIMARY KEY,\n" +
                "  user_id integer REFERENCES users(id),\n" +
                "  score numeric(5,2)\n" +
                ");";

        DdlReadResult result = reader.read(ddl, null, null);

        assertEquals(DbType.postgresql, result.getDbType());
        TableDescription users = table(result, "users");
        assertEquals("id", users.getPrimaryKey());
        TableDescription posts = table(result, "posts");
        assertEquals("post_id", posts.getPrimaryKey());
        assertEquals(1, posts.getForeignKeys().size());
        assertEquals("users", posts.getForeignKeys().get(0).getReferencesTable());
        assertEquals("id", posts.getForeignKeys().get(0).getReferencesColumn());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    void testForeignKeyWithoutColumnListUsesTargetPrimaryKey() {
        String ddl = "CREATE TABLE orders (order_id integer PRIMARY KEY, buyer integer, seller integer,\n" +
                "  FOREIGN KEY (seller) REFERENCES customers);\n" +
                "CREATE TABLE customers (id integer PRIMARY KEY, name text);\n" +
                "CREATE TABLE audits (audit_id integer PRIMARY KEY, order_id integer,\n" +
                "  FOREIGN KEY (order_id) REFERENCES archive);";

        DdlReadResult result = reader.read(ddl, DbType.postgresql, null);

        TableDescription orders = table(result, "orders");
        assertEquals(1, orders.getForeignKeys().size());
        ForeignKeyDescription fk = orders.getForeignKeys().get(0);
        assertEquals("seller", fk.getColumn());
        assertEquals("customers", fk.getReferencesTable());
        assertEquals("id", fk.getReferencesColumn());

        assertTrue(table(result, "audits").getForeignKeys().isEmpty());
        assertEquals(1, result.getWarnings().size());
        assertEquals(SchemaWarning.UNRESOLVED_REFERENCE, result.getWarnings().get(0).getCategory());
        assertEquals("audits.order_id", result.getWarnings().get(0).getPosition());
    }

    @Test
    void testCreateTableAsSelectSkipped() {
        DdlReadResult result = reader.read(
                "CREATE TABLE a (id INT PRIMARY KEY); CREATE TABLE b AS SELECT * FROM a", DbType.mysql, null);
        assertEquals(1, result.getSchema().getTables().size());
        assertEquals(1, result.getSkippedStatements());
    }

    @Test
    void testEmptyScript() {
        DdlReadResult result = reader.read("  -- nothing here\n", DbType.mysql, null);
        assertTrue(result.getSchema().getTables().isEmpty());
        assertEquals(0, result.getSkippedStatements());
    }

    @Test
    void testParseError() {
        SchemaSourceException e = assertThrows(SchemaSourceException.class,
                () -> reader.read("CREATE TABLE (id int", DbType.mysql, null));
        assertEquals(SchemaSourceException.DDL_PARSE_ERROR, e.getErrorCode());
        assertNotNull(e.getCause());
    }

    @Test
    void testUnsupportedDialect() {
        SchemaSourceException e = assertThrows(SchemaSourceException.class,
                () -> reader.read("CREATE TABLE a (id int)", DbType.hive, null));
        assertEquals(SchemaSourceException.UNSUPPORTED_DIALECT, e.getErrorCode());
        assertFalse(reader.supports(DbType.hive));
        assertTrue(reader.supports(DbType.clickhouse));
    }
}
