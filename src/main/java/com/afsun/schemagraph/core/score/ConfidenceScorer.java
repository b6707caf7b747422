package com.afsun.schemagraph.core.score;

import com.afsun.schemagraph.core.model.ColumnInfo;
import com.afsun.schemagraph.core.model.TableInfo;

import java.util.Optional;

/**
 * 候选关系评分器
 * 纯函数：相同输入总是得到相同结果
 *
 * @author afsun
 */
public interface ConfidenceScorer {

    /**
     * 为 (源列, 源表, 候选目标表, 候选目标主键列) 打分
     *
     * @param sourceColumn 源列
     * @param sourceTable 源列所在表
     * @param candidateTargetTable 候选目标表
     * @param candidateTargetKey 候选目标表的主键列
     * @return 分数[0,1]及关系标签；不构成候选时返回 empty
     */
    Optional<ScoredCandidate> score(ColumnInfo sourceColumn,
                                    TableInfo sourceTable,
                                    TableInfo candidateTargetTable,
                                    ColumnInfo candidateTargetKey);
}
