package com.afsun.schemagraph.core.exceptions;

import lombok.Getter;

/**
 * Schema图构建异常基类
 * 提供统一的错误码与错误信息格式
 *
 * @author afsun
 */
@Getter
public class SchemaGraphException extends RuntimeException {

    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    /**
     * 错误码
     */
    private final String errorCode;

    /**
     * 错误详情
     */
    private final String errorDetail;

    /**
     * 建议解决方案
     */
    private final String suggestion;

    public SchemaGraphException(String errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public SchemaGraphException(String errorCode, String message, String suggestion) {
        this(errorCode, message, suggestion, null);
    }

    public SchemaGraphException(String errorCode, String message, String suggestion, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.errorDetail = message;
        this.suggestion = suggestion;
    }

    /**
     * 获取格式化的错误信息
     */
    public String getFormattedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(errorCode).append("] ").append(errorDetail);
        if (suggestion != null && !suggestion.isEmpty()) {
            sb.append("\n建议: ").append(suggestion);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getFormattedMessage();
    }
}
