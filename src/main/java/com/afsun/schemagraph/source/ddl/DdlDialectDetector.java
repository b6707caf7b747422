package com.afsun.schemagraph.source.ddl;

import com.alibaba.druid.DbType;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * DDL方言检测器
 * 根据建表语句特征识别数据库方言，无明显特征时按MySQL处理
 *
 * @author afsun
 */
@Slf4j
public final class DdlDialectDetector {

    private DdlDialectDetector() {
    }

    public static DbType detect(String ddl) {
        if (ddl == null || ddl.isEmpty()) {
            return DbType.mysql;
        }
        String s = ddl.toLowerCase(Locale.ROOT);

        if (containsClickHouseFeatures(s)) {
            log.debug("检测到ClickHouse方言特征");
            return DbType.clickhouse;
        }
        if (containsPostgreSQLFeatures(s)) {
            log.debug("检测到PostgreSQL方言特征");
            return DbType.postgresql;
        }
        if (containsSQLServerFeatures(s)) {
            log.debug("检测到SQLServer方言特征");
            return DbType.sqlserver;
        }
        if (containsOracleFeatures(s)) {
            log.debug("检测到Oracle方言特征");
            return DbType.oracle;
        }
        log.debug("使用默认MySQL方言");
        return DbType.mysql;
    }

    private static boolean containsClickHouseFeatures(String ddl) {
        return ddl.contains("mergetree") ||
               ddl.contains("nullable(") ||
               ddl.contains("lowcardinality(");
    }

    private static boolean containsPostgreSQLFeatures(String ddl) {
        return ddl.contains("bigserial") ||
               ddl.contains(" serial") ||
               ddl.contains("::") ||
               ddl.contains("timestamptz") ||
               ddl.contains(" uuid") ||
               ddl.contains("jsonb");
    }

    private static boolean containsSQLServerFeatures(String ddl) {
        return ddl.contains("identity(") ||
               ddl.contains("[dbo]") ||
               ddl.contains("uniqueidentifier") ||
               ddl.contains("nvarchar(max)") ||
               ddl.contains("datetime2");
    }

    private static boolean containsOracleFeatures(String ddl) {
        return ddl.contains("varchar2") ||
               ddl.contains("number(") ||
               ddl.contains("sysdate");
    }
}
