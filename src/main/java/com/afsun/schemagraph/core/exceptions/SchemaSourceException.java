package com.afsun.schemagraph.core.exceptions;

import org.apache.commons.lang3.ArrayUtils;
import org.slf4j.helpers.MessageFormatter;

/**
 * Schema来源（DDL脚本、JDBC连接）读取失败
 *
 * @author afsun
 */
public class SchemaSourceException extends SchemaGraphException {

    public static final String DDL_PARSE_ERROR = "DDL_PARSE_ERROR";
    public static final String UNSUPPORTED_DIALECT = "UNSUPPORTED_DIALECT";
    public static final String CONNECTOR_ERROR = "CONNECTOR_ERROR";
    public static final String CONNECTOR_NOT_FOUND = "CONNECTOR_NOT_FOUND";
    public static final String DATASOURCE_NOT_FOUND = "DATASOURCE_NOT_FOUND";

    /**
     * 支持 slf4j 风格占位符，最后一个参数为 Throwable 时作为 cause
     */
    public SchemaSourceException(String errorCode, String message, Object... args) {
        super(errorCode, MessageFormatter.arrayFormat(message, trimLastThrowable(args)).getMessage(),
                null, extractThrowable(args));
    }

    private static Throwable extractThrowable(Object[] args) {
        if (ArrayUtils.isEmpty(args)) {
            return null;
        }
        Object last = args[args.length - 1];
        if (last instanceof Throwable) {
            return (Throwable) last;
        }
        return null;
    }

    private static Object[] trimLastThrowable(Object[] argumentArray) {
        if (ArrayUtils.isEmpty(argumentArray) || extractThrowable(argumentArray) == null) {
            return argumentArray;
        }
        return ArrayUtils.remove(argumentArray, argumentArray.length - 1);
    }
}
