package com.afsun.schemagraph.core.inference;

import com.afsun.schemagraph.core.model.InferenceResult;
import com.afsun.schemagraph.core.model.SchemaModel;

/**
 * 外键关系推断引擎
 *
 * @author afsun
 */
public interface RelationshipInferenceEngine {

    /**
     * 推断Schema中未声明的外键关系，并与声明外键合并
     * 相同输入必然得到内容与顺序完全一致的输出；任何输入都不会导致失败
     *
     * @param schema 规范化Schema
     * @return 表名 -> {主键, 外键序列}，以及悬空引用等告警
     */
    InferenceResult infer(SchemaModel schema);
}
