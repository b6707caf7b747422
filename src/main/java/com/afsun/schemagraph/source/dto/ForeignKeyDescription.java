package com.afsun.schemagraph.source.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ForeignKeyDescription {
    private String column;

    @JsonProperty("references_table")
    @JsonAlias("referencesTable")
    private String referencesTable;

    @JsonProperty("references_column")
    @JsonAlias("referencesColumn")
    private String referencesColumn;
}
