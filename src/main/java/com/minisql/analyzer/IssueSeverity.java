package com.minisql.analyzer;

/**
 * IssueSeverity - 查询问题的严重程度
 */
public enum IssueSeverity {
    INFO,
    WARNING,
    ERROR
}
