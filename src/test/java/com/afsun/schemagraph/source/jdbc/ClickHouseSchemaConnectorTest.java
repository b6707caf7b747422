package com.afsun.schemagraph.source.jdbc;

import com.afsun.schemagraph.source.dto.SchemaDescription;
import com.afsun.schemagraph.source.dto.TableDescription;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;

import java.sql.ResultSet;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ClickHouseSchemaConnectorTest {

    private static ResultSet row(String table, String name, String type, int pk) throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("table")).thenReturn(table);
        when(rs.getString("name")).thenReturn(name);
        when(rs.getString("type")).thenReturn(type);
        when(rs.getInt("is_in_primary_key")).thenReturn(pk);
        return rs;
    }

    @Test
    void testExtractFromSystemColumns() throws SQLException {
        ResultSet[] rows = {
                row("events", "event_id", "UInt64", 1),
                row("events", "user_id", "Nullable(UInt64)", 0),
                row("users", "user_id", "UInt64", 1),
                row("sessions", "user_id", "UInt64", 1),
                row("sessions", "started_at", "DateTime", 1)
        };
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        doAnswer(invocation -> {
            RowCallbackHandler handler = invocation.getArgument(1);
            for (ResultSet rs : rows) {
                handler.processRow(rs);
            }
            return null;
        }).when(jdbcTemplate).query(eq(ClickHouseSchemaConnector.COLUMNS_SQL), any(RowCallbackHandler.class), eq("analytics"));

        DataSourceSettings settings = new DataSourceSettings();
        settings.setSchema("analytics");
        SchemaDescription schema = new ClickHouseSchemaConnector().extract(jdbcTemplate, settings);

        assertEquals("analytics", schema.getDatabase());
        assertEquals(3, schema.getTables().size());
        TableDescription events = schema.getTables().get(0);
        assertEquals("events", events.getName());
        assertEquals("event_id", events.getPrimaryKey());
        assertTrue(events.getColumns().get(1).isNullable());
        assertFalse(events.getColumns().get(0).isNullable());
        assertTrue(events.getForeignKeys().isEmpty());

        TableDescription sessions = schema.getTables().get(2);
        assertNull(sessions.getPrimaryKey());
        assertTrue(sessions.getColumns().get(0).isPrimaryKey());
        verify(jdbcTemplate, never()).queryForObject(anyString(), eq(String.class));
    }
}
