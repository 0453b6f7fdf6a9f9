package com.minisql.error;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * SqlSyntaxException - SQL语法错误
 *
 * 无法理解的查询结构。如果出错位置附近是常见的关键字拼写错误,
 * 给出更正建议。
 */
public class SqlSyntaxException extends QueryException {

    /** 常见关键字拼写错误 → 正确关键字 */
    private static final Map<String, String> TYPO_FIXES = new HashMap<>();

    static {
        TYPO_FIXES.put("selec", "SELECT");
        TYPO_FIXES.put("slect", "SELECT");
        TYPO_FIXES.put("form", "FROM");
        TYPO_FIXES.put("fom", "FROM");
        TYPO_FIXES.put("whre", "WHERE");
        TYPO_FIXES.put("wher", "WHERE");
        TYPO_FIXES.put("oder", "ORDER");
        TYPO_FIXES.put("ordr", "ORDER");
        TYPO_FIXES.put("gorup", "GROUP");
        TYPO_FIXES.put("gruop", "GROUP");
    }

    /** 出错位置附近的文本 */
    private final String near;

    public SqlSyntaxException(String message) {
        this(message, null);
    }

    public SqlSyntaxException(String message, String near) {
        super(message, typoSuggestion(near), ErrorSeverity.ERROR, nearContext(near));
        this.near = near;
    }

    public String getNear() {
        return near;
    }

    private static String typoSuggestion(String near) {
        if (near == null) {
            return null;
        }
        String fix = TYPO_FIXES.get(near.toLowerCase(Locale.ROOT));
        return fix != null ? "Did you mean: " + fix + "?" : null;
    }

    private static Map<String, Object> nearContext(String near) {
        Map<String, Object> context = new HashMap<>();
        context.put("near", near);
        return context;
    }
}
