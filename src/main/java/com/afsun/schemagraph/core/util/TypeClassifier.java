package com.afsun.schemagraph.core.util;

import com.afsun.schemagraph.core.model.TypeClass;
import org.apache.commons.lang3.StringUtils;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 将各数据库方言的列类型归一为粗粒度分类
 * 支持：PostgreSQL、MySQL、SQLServer、Oracle、DB2、ClickHouse、H2 常见类型
 *
 * @author afsun
 */
public final class TypeClassifier {

    /**
     * ClickHouse 包装类型，如 Nullable(Int64)、LowCardinality(String)
     */
    private static final Pattern WRAPPER = Pattern.compile("^(nullable|lowcardinality)\\s*\\((.*)\\)$");

    /**
     * 数值类型的精度/标度，如 number(10,0)
     */
    private static final Pattern PRECISION_SCALE = Pattern.compile("\\(\\s*\\d+\\s*(?:,\\s*(-?\\d+)\\s*)?\\)");

    private static final Set<String> UUID_TYPES = new HashSet<>(Arrays.asList(
            "uuid", "uniqueidentifier", "guid"));

    private static final Set<String> TEMPORAL_TYPES = new HashSet<>(Arrays.asList(
            "date", "date32", "time", "timetz", "timestamp", "timestamptz", "datetime", "datetime2",
            "datetime64", "smalldatetime", "datetimeoffset", "interval", "year"));

    private static final Set<String> INTEGER_TYPES = new HashSet<>(Arrays.asList(
            "int", "integer", "int2", "int4", "int8", "bigint", "smallint", "tinyint", "mediumint",
            "serial", "serial2", "serial4", "serial8", "bigserial", "smallserial", "long",
            "int16", "int32", "int64", "int128", "int256",
            "uint8", "uint16", "uint32", "uint64", "uint128", "uint256"));

    private static final Set<String> EXACT_NUMERIC_TYPES = new HashSet<>(Arrays.asList(
            "number", "numeric", "decimal"));

    private static final Set<String> STRING_TYPES = new HashSet<>(Arrays.asList(
            "char", "character", "varchar", "varchar2", "nvarchar", "nvarchar2", "nchar", "bpchar",
            "text", "tinytext", "mediumtext", "longtext", "ntext", "string", "clob", "nclob",
            "citext", "fixedstring", "enum", "enum8", "enum16"));

    private TypeClassifier() {
    }

    public static TypeClass classify(String rawType) {
        String t = normalize(rawType);
        if (t.isEmpty() || t.endsWith("[]")) {
            return TypeClass.OTHER;
        }
        String base = baseName(t);
        if (UUID_TYPES.contains(base)) {
            return TypeClass.UUID;
        }
        if (TEMPORAL_TYPES.contains(base)) {
            return TypeClass.TEMPORAL;
        }
        if (INTEGER_TYPES.contains(base)) {
            return TypeClass.INTEGER;
        }
        if (EXACT_NUMERIC_TYPES.contains(base)) {
            return isZeroScale(t) ? TypeClass.INTEGER : TypeClass.OTHER;
        }
        if (STRING_TYPES.contains(base)) {
            return TypeClass.STRING;
        }
        return TypeClass.OTHER;
    }

    /**
     * 小写、去空白、拆掉 Nullable/LowCardinality 包装
     */
    public static String normalize(String rawType) {
        if (StringUtils.isBlank(rawType)) {
            return "";
        }
        String t = StringUtils.normalizeSpace(rawType.toLowerCase(Locale.ROOT));
        Matcher m = WRAPPER.matcher(t);
        while (m.matches()) {
            t = m.group(2).trim();
            m = WRAPPER.matcher(t);
        }
        return t;
    }

    private static String baseName(String t) {
        int end = 0;
        while (end < t.length()) {
            char c = t.charAt(end);
            if (c == '(' || c == ' ' || c == '[') {
                break;
            }
            end++;
        }
        return t.substring(0, end);
    }

    /**
     * number/numeric/decimal 未声明标度或标度为0时视为整数
     * 标度只按字面判断是否全为0，超长数字不做数值转换
     */
    private static boolean isZeroScale(String t) {
        Matcher m = PRECISION_SCALE.matcher(t);
        if (!m.find()) {
            return true;
        }
        String scale = m.group(1);
        return scale == null || StringUtils.strip(scale, "-0").isEmpty();
    }
}
