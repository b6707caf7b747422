package com.afsun.schemagraph.graph;

import com.afsun.schemagraph.core.model.Basis;
import com.afsun.schemagraph.core.model.Relationship;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

/**
 * 图的有向边：源表 -> 目标表，带源列、置信度与来源标签
 *
 * @author afsun
 */
@Data
public class ReferenceEdge {
    private final String source;
    private final String target;
    private final String sourceColumn;
    private final String targetColumn;
    private final double confidence;
    private final Basis basis;
    private final boolean consistent;

    public static ReferenceEdge from(Relationship r) {
        return new ReferenceEdge(r.getSourceTable(), r.getTargetTable(), r.getSourceColumn(), r.getTargetColumn(),
                r.getConfidence(), r.getBasis(), r.isConsistent());
    }

    @JsonIgnore
    public EdgeKey getKey() {
        return new EdgeKey(source, sourceColumn, target, targetColumn);
    }

    @JsonIgnore
    public boolean isSelfLoop() {
        return source.equals(target);
    }

    @Override
    public String toString() {
        return "ReferenceEdge{" + getKey() + ", confidence=" + confidence + ", basis=" + basis.getLabel() + '}';
    }
}
