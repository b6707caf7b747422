package com.afsun.schemagraph.core.score;

import org.apache.commons.text.similarity.LevenshteinDistance;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 名称相似度：max(归一化编辑距离相似度, 词元Jaccard系数)，取值[0,1]
 *
 * @author afsun
 */
public final class NameSimilarity {

    private NameSimilarity() {
    }

    public static double similarity(String a, String b) {
        return Math.max(editRatio(NameNormalizer.compact(a), NameNormalizer.compact(b)), tokenJaccard(a, b));
    }

    /**
     * 1 - levenshtein(a, b) / max(|a|, |b|)
     */
    public static double editRatio(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int distance = LevenshteinDistance.getDefaultInstance().apply(a, b);
        return 1.0 - (double) distance / Math.max(a.length(), b.length());
    }

    /**
     * 单数化词元集合的 Jaccard 系数
     */
    public static double tokenJaccard(String a, String b) {
        Set<String> setA = singularTokens(a);
        Set<String> setB = singularTokens(b);
        if (setA.isEmpty() || setB.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(setA);
        intersection.retainAll(setB);
        Set<String> union = new HashSet<>(setA);
        union.addAll(setB);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> singularTokens(String name) {
        List<String> tokens = NameNormalizer.tokens(name);
        Set<String> result = new HashSet<>();
        for (String t : tokens) {
            result.add(NameNormalizer.singular(t));
        }
        return result;
    }
}
