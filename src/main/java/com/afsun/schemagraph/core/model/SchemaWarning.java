package com.afsun.schemagraph.core.model;

import lombok.Data;

/**
 * 非致命告警，随结果返回给调用方
 *
 * @author afsun
 */
@Data
public class SchemaWarning {
    public static final String DANGLING_REFERENCE = "DANGLING_REFERENCE";
    public static final String SKIPPED_STATEMENT = "SKIPPED_STATEMENT";
    public static final String EMPTY_CREATE_TABLE = "EMPTY_CREATE_TABLE";
    public static final String SELF_REFERENCE_DROPPED = "SELF_REFERENCE_DROPPED";
    public static final String UNRESOLVED_REFERENCE = "UNRESOLVED_REFERENCE";

    private final String category;
    private final String summary;
    private final String position;
    private final String suggestion;

    private SchemaWarning(String c, String s, String p, String sug) {
        this.category = c;
        this.summary = s;
        this.position = p;
        this.suggestion = sug;
    }

    public static SchemaWarning of(String c, String s, String p, String sug) {
        return new SchemaWarning(c, s, p, sug);
    }
}
