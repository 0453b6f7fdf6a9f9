package com.minisql.parser;

/**
 * QueryType - 语句类型
 *
 * 只有SELECT可以执行,其他类型由执行器报告为不支持的特性。
 */
public enum QueryType {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    UNKNOWN;

    /**
     * 根据首个关键字分类
     */
    public static QueryType fromKeyword(String keyword) {
        if (keyword == null) {
            return UNKNOWN;
        }
        for (QueryType type : values()) {
            if (type != UNKNOWN && type.name().equalsIgnoreCase(keyword)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
