package com.afsun.schemagraph.core.score;

import com.afsun.schemagraph.core.model.Basis;
import lombok.Data;

/**
 * 评分后的候选目标
 *
 * @author afsun
 */
@Data
public class ScoredCandidate {
    private final String targetTable;
    private final String targetColumn;
    private final double score;
    private final Basis basis;

    private ScoredCandidate(String targetTable, String targetColumn, double score, Basis basis) {
        this.targetTable = targetTable;
        this.targetColumn = targetColumn;
        this.score = score;
        this.basis = basis;
    }

    public static ScoredCandidate of(String targetTable, String targetColumn, double score, Basis basis) {
        return new ScoredCandidate(targetTable, targetColumn, score, basis);
    }
}
