package com.afsun.schemagraph.config;

import com.afsun.schemagraph.source.jdbc.DataSourceSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * schema.graph.* 配置
 *
 * @author afsun
 */
@Data
@ConfigurationProperties(prefix = "schema.graph")
public class SchemaGraphProperties {

    /**
     * 上传文件及文本请求体的大小上限（字节），默认10MB
     */
    private long maxFileSize = 10 * 1024 * 1024;

    /**
     * 可在线抽取的数据源，key 为数据源名称
     */
    private Map<String, DataSourceSettings> datasources = new LinkedHashMap<>();

    private Neo4j neo4j = new Neo4j();

    @Data
    public static class Neo4j {
        /**
         * 分析结果是否同时写入Neo4j
         */
        private boolean enabled = false;
    }
}
