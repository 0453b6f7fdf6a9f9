package com.minisql.explain;

import java.util.Optional;

/**
 * Annotation - EXPLAIN某一列的教学注释
 *
 * 说明某张表的某个EXPLAIN字段意味着什么,严重程度升高时附带可执行的修复建议
 * (通常是一条CREATE INDEX语句)。
 */
public final class Annotation {

    /** 所属表名 */
    private final String table;

    /** EXPLAIN字段: type, key, rows, Extra */
    private final String field;

    private final String value;

    private final String explanation;

    /** 修复建议,可能为null */
    private final String recommendation;

    private final AnnotationSeverity severity;

    public Annotation(String table, String field, String value, String explanation,
                      String recommendation, AnnotationSeverity severity) {
        if (field == null || severity == null) {
            throw new IllegalArgumentException("Annotation field and severity cannot be null");
        }
        this.table = table;
        this.field = field;
        this.value = value;
        this.explanation = explanation;
        this.recommendation = recommendation;
        this.severity = severity;
    }

    public String getTable() {
        return table;
    }

    public String getField() {
        return field;
    }

    public String getValue() {
        return value;
    }

    public String getExplanation() {
        return explanation;
    }

    public Optional<String> getRecommendation() {
        return Optional.ofNullable(recommendation);
    }

    public AnnotationSeverity getSeverity() {
        return severity;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[").append(severity).append("] ")
                .append(table).append('.').append(field).append('=').append(value)
                .append(": ").append(explanation);
        if (recommendation != null) {
            sb.append(" -> ").append(recommendation);
        }
        return sb.toString();
    }
}
