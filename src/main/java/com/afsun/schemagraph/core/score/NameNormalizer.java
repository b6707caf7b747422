package com.afsun.schemagraph.core.score;

import org.apache.commons.lang3.StringUtils;

import java.util.*;

/**
 * 列名/表名规范化工具
 * 列名：小写、去分隔符、去掉 _id/_key/_fk/id 后缀得到实体词干
 * 表名：生成单复数等变体用于匹配
 *
 * @author afsun
 */
public final class NameNormalizer {

    private static final String[] KEY_SUFFIXES = {"_id", "_key", "_fk", "id"};

    private NameNormalizer() {
    }

    /**
     * 小写并去掉分隔符：Order_Items -> orderitems
     */
    public static String compact(String name) {
        if (name == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (char c : name.toLowerCase(Locale.ROOT).toCharArray()) {
            if (Character.isLetterOrDigit(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * 按分隔符与驼峰切分为小写词元：parentCategory_id -> [parent, category, id]
     */
    public static List<String> tokens(String name) {
        List<String> result = new ArrayList<>();
        if (StringUtils.isBlank(name)) {
            return result;
        }
        for (String part : name.split("(?<=[a-z0-9])(?=[A-Z])|[^A-Za-z0-9]+")) {
            if (!part.isEmpty()) {
                result.add(part.toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }

    /**
     * 去掉一个已知的键后缀，保留内部分隔符：customer_ref_id -> customer_ref
     */
    public static String stripKeySuffix(String columnName) {
        String lower = columnName == null ? "" : columnName.toLowerCase(Locale.ROOT).trim();
        for (String suffix : KEY_SUFFIXES) {
            if (lower.endsWith(suffix)) {
                return StringUtils.stripEnd(lower.substring(0, lower.length() - suffix.length()), "_- ");
            }
        }
        return lower;
    }

    /**
     * 实体词干：customer_id -> customer，CustomerID -> customer，id -> ""
     */
    public static String entityStem(String columnName) {
        return compact(stripKeySuffix(columnName));
    }

    public static String singular(String word) {
        if (word.length() > 3 && word.endsWith("ies")) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.endsWith("sses") || word.endsWith("xes") || word.endsWith("ches") || word.endsWith("shes")) {
            return word.substring(0, word.length() - 2);
        }
        if (word.length() > 1 && word.endsWith("s") && !word.endsWith("ss")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    public static String plural(String word) {
        if (word.isEmpty()) {
            return word;
        }
        if (word.endsWith("y") && word.length() > 1 && !isVowel(word.charAt(word.length() - 2))) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        if (word.endsWith("s") || word.endsWith("x") || word.endsWith("ch") || word.endsWith("sh")) {
            return word + "es";
        }
        return word + "s";
    }

    /**
     * 表名变体：整名及其单复数，末段词元及其单复数
     * user_profiles -> {userprofiles, userprofile, profiles, profile}
     */
    public static Set<String> tableVariants(String tableName) {
        Set<String> variants = new LinkedHashSet<>();
        addForms(variants, compact(tableName));
        List<String> parts = tokens(tableName);
        if (parts.size() > 1) {
            addForms(variants, parts.get(parts.size() - 1));
        }
        variants.remove("");
        return variants;
    }

    private static void addForms(Set<String> variants, String word) {
        variants.add(word);
        String singular = singular(word);
        variants.add(singular);
        variants.add(plural(singular));
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(c) >= 0;
    }
}
