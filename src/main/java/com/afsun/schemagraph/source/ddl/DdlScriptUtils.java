package com.afsun.schemagraph.source.ddl;

import java.util.ArrayList;
import java.util.List;

/**
 * DDL脚本预处理：去注释、按分号切分
 * 引号内的内容（字符串字面量、带引号的标识符）原样保留
 *
 * @author afsun
 */
public final class DdlScriptUtils {

    private DdlScriptUtils() {
    }

    /**
     * 移除SQL中的注释
     * 支持：
     * - 单行注释：-- comment 或 # comment (MySQL)
     * - 多行注释：/* comment *\/
     *
     * @param sql 原始DDL文本
     * @return 移除注释后的DDL
     */
    public static String stripComments(String sql) {
        if (sql == null || sql.isEmpty()) {
            return sql;
        }
        StringBuilder result = new StringBuilder(sql.length());
        int len = sql.length();
        int i = 0;
        while (i < len) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"' || c == '`') {
                i = copyQuoted(sql, i, result);
                continue;
            }
            if (c == '/' && i + 1 < len && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? len : end + 2;
                // 用空格替代注释，避免前后token粘连
                result.append(' ');
                continue;
            }
            if ((c == '-' && i + 1 < len && sql.charAt(i + 1) == '-') || c == '#') {
                while (i < len && sql.charAt(i) != '\n' && sql.charAt(i) != '\r') {
                    i++;
                }
                continue;
            }
            result.append(c);
            i++;
        }
        return result.toString().trim();
    }

    /**
     * 按分号切分语句，忽略引号内的分号，丢弃空语句
     */
    public static List<String> splitStatements(String text) {
        List<String> list = new ArrayList<>();
        if (text == null) {
            return list;
        }
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"' || c == '`') {
                i = copyQuoted(text, i, sb);
                continue;
            }
            if (c == ';') {
                addIfNotBlank(list, sb);
                sb.setLength(0);
            } else {
                sb.append(c);
            }
            i++;
        }
        addIfNotBlank(list, sb);
        return list;
    }

    /**
     * 复制从 start 开始的引号段（含首尾引号），连续两个引号视为转义
     *
     * @return 引号段之后的下标
     */
    private static int copyQuoted(String s, int start, StringBuilder out) {
        char quote = s.charAt(start);
        out.append(quote);
        int i = start + 1;
        while (i < s.length()) {
            char ch = s.charAt(i);
            out.append(ch);
            if (ch == '\\' && quote == '\'' && i + 1 < s.length()) {
                out.append(s.charAt(i + 1));
                i += 2;
                continue;
            }
            if (ch == quote) {
                if (i + 1 < s.length() && s.charAt(i + 1) == quote) {
                    out.append(quote);
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return i;
    }

    private static void addIfNotBlank(List<String> list, StringBuilder sb) {
        String stmt = sb.toString().trim();
        if (!stmt.isEmpty()) {
            list.add(stmt);
        }
    }
}
