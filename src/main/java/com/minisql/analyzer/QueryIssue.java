package com.minisql.analyzer;

/**
 * QueryIssue - 检测到的反模式
 */
public final class QueryIssue {

    private final IssueSeverity severity;

    private final String title;

    private final String description;

    private final String fix;

    public QueryIssue(IssueSeverity severity, String title, String description, String fix) {
        this.severity = severity;
        this.title = title;
        this.description = description;
        this.fix = fix;
    }

    public IssueSeverity getSeverity() {
        return severity;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getFix() {
        return fix;
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + title;
    }
}
