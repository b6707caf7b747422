package com.afsun.schemagraph.service;

import com.afsun.schemagraph.source.dto.SchemaDescription;
import com.alibaba.druid.DbType;

public interface SchemaAnalysisService {

    AnalysisResult analyze(SchemaDescription description);

    /**
     * @param dbType 为null时按DDL内容自动检测
     */
    AnalysisResult analyzeDdl(String ddl, DbType dbType);

    AnalysisResult analyzeDataSource(String name);

    /**
     * 新建链式会话，状态仅属于该会话
     */
    SchemaGraphSession newSession();
}
