package com.afsun.schemagraph.graph;

import lombok.Data;

/**
 * 边去重键：(源表, 源列, 目标表, 目标列)
 *
 * @author afsun
 */
@Data
public class EdgeKey {
    private final String sourceTable;
    private final String sourceColumn;
    private final String targetTable;
    private final String targetColumn;

    @Override
    public String toString() {
        return sourceTable + "." + sourceColumn + " -> " + targetTable + "." + targetColumn;
    }
}
