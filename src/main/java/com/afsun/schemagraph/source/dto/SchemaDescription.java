package com.afsun.schemagraph.source.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 抽取得到的、与连接器无关的Schema描述
 *
 * @author afsun
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchemaDescription {
    private String database;
    private List<TableDescription> tables = new ArrayList<>();
}
