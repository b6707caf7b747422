package com.afsun.schemagraph.core.model;

/**
 * 列类型粗粒度分类
 * 推断时源列与目标主键的分类必须一致
 *
 * @author afsun
 */
public enum TypeClass {
    INTEGER,
    STRING,
    UUID,
    TEMPORAL,
    OTHER
}
