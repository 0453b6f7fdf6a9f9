package com.minisql.analyzer;

/**
 * OverallSeverity - 查询整体评级
 *
 * 有ERROR级问题 → CRITICAL, 有WARNING级问题 → WARNING, 否则 → GOOD。
 */
public enum OverallSeverity {
    GOOD,
    WARNING,
    CRITICAL;

    static OverallSeverity of(Iterable<QueryIssue> issues) {
        OverallSeverity overall = GOOD;
        for (QueryIssue issue : issues) {
            if (issue.getSeverity() == IssueSeverity.ERROR) {
                return CRITICAL;
            }
            if (issue.getSeverity() == IssueSeverity.WARNING) {
                overall = WARNING;
            }
        }
        return overall;
    }
}
