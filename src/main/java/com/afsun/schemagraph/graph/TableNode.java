package com.afsun.schemagraph.graph;

import lombok.Data;

import java.util.Objects;

/**
 * 图节点：一张表
 *
 * @author afsun
 */
@Data
public class TableNode {
    private final String id;
    private final int columnCount;
    /**
     * 无单列主键时为null
     */
    private final String primaryKey;

    public TableNode(String id, int columnCount, String primaryKey) {
        this.id = id;
        this.columnCount = columnCount;
        this.primaryKey = primaryKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableNode)) return false;
        TableNode that = (TableNode) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
