package com.afsun.schemagraph.source.jdbc;

import com.alibaba.druid.DbType;
import lombok.Data;
import lombok.ToString;

import java.util.regex.Pattern;

/**
 * 单个数据源的连接配置
 *
 * @author afsun
 */
@Data
public class DataSourceSettings {

    private static final Pattern CREDENTIAL_PARAM =
            Pattern.compile("(?i)((?:user|username|password)=)[^&;]*");

    private static final Pattern USER_INFO = Pattern.compile("//[^/@]+@");

    private DbType type;
    private String url;
    private String username;
    @ToString.Exclude
    private String password;
    private String catalog;
    /**
     * schema 匹配模式，为空时按数据库类型取默认值
     */
    private String schema;

    /**
     * 打印日志用，屏蔽URL中的用户名和密码
     */
    public String maskedUrl() {
        return maskUrl(url);
    }

    public static String maskUrl(String url) {
        if (url == null) {
            return null;
        }
        String masked = CREDENTIAL_PARAM.matcher(url).replaceAll("$1***");
        return USER_INFO.matcher(masked).replaceAll("//***@");
    }
}
