package com.afsun.schemagraph.source.ddl;

import com.afsun.schemagraph.core.model.SchemaWarning;
import com.afsun.schemagraph.source.dto.SchemaDescription;
import com.alibaba.druid.DbType;
import lombok.Data;

import java.util.List;

@Data
public class DdlReadResult {
    private final SchemaDescription schema;
    private final DbType dbType;
    private final List<SchemaWarning> warnings;
    private final int skippedStatements;
}
