package com.afsun.schemagraph.source.ddl;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 限定表名解析：[catalog.][schema.]table，去掉 `"[] 引号
 *
 * @author afsun
 */
@Data
public class TableName {
    private final String catalog;
    private final String schema;
    private final String table;

    private TableName(String catalog, String schema, String table) {
        this.catalog = catalog;
        this.schema = schema;
        this.table = table;
    }

    public static TableName parse(String full) {
        String[] parts = splitQualified(full.trim());
        if (parts.length >= 3) {
            return new TableName(unquote(parts[parts.length - 3]), unquote(parts[parts.length - 2]),
                    unquote(parts[parts.length - 1]));
        }
        if (parts.length == 2) {
            return new TableName(null, unquote(parts[0]), unquote(parts[1]));
        }
        return new TableName(null, null, unquote(parts[0]));
    }

    /**
     * 去掉标识符两侧的引号：`orders` / "orders" / [orders] -> orders
     */
    public static String unquote(String identifier) {
        if (identifier == null) {
            return null;
        }
        String s = identifier.trim();
        if (s.length() >= 2) {
            char first = s.charAt(0);
            char last = s.charAt(s.length() - 1);
            if ((first == '`' && last == '`') || (first == '"' && last == '"') || (first == '[' && last == ']')) {
                return s.substring(1, s.length() - 1);
            }
        }
        return s;
    }

    /**
     * 按点切分，忽略引号内的点
     */
    private static String[] splitQualified(String full) {
        List<String> parts = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        char open = 0;
        for (char c : full.toCharArray()) {
            if (open == 0 && (c == '`' || c == '"' || c == '[')) {
                open = c == '[' ? ']' : c;
            } else if (open != 0 && c == open) {
                open = 0;
            } else if (open == 0 && c == '.') {
                parts.add(sb.toString());
                sb.setLength(0);
                continue;
            }
            sb.append(c);
        }
        parts.add(sb.toString());
        return parts.toArray(new String[0]);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (catalog != null) sb.append(catalog).append(".");
        if (schema != null) sb.append(schema).append(".");
        sb.append(table);
        return sb.toString();
    }
}
