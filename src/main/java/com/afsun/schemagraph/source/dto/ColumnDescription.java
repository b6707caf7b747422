package com.afsun.schemagraph.source.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ColumnDescription {
    private String name;
    private String type;
    private boolean nullable = true;

    @JsonProperty("is_primary_key")
    @JsonAlias({"primary_key", "primaryKey"})
    private boolean primaryKey;
}
