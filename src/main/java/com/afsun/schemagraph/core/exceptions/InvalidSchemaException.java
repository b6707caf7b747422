package com.afsun.schemagraph.core.exceptions;

/**
 * 输入Schema违反模型约束（表名/列名重复、缺少名称或类型等）
 * 对本次调用是致命的，调用方不得继续推断
 *
 * @author afsun
 */
public class InvalidSchemaException extends SchemaGraphException {

    public static final String CODE = "INVALID_SCHEMA";

    public InvalidSchemaException(String message) {
        super(CODE, message, "检查表名、列名是否唯一，列是否都声明了名称和类型");
    }
}
