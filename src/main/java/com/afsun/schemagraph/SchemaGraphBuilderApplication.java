package com.afsun.schemagraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Schema关系推断与图构建应用主类
 * 数据源按请求临时创建，不使用自动配置的 DataSource
 *
 * @author afsun
 */
@SpringBootApplication(scanBasePackages = "com.afsun.schemagraph", exclude = DataSourceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class SchemaGraphBuilderApplication {
    public static void main(String[] args) {
        SpringApplication.run(SchemaGraphBuilderApplication.class, args);
    }
}
