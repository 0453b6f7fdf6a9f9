package com.minisql.explain;

/**
 * AnnotationSeverity - EXPLAIN注释的严重程度
 */
public enum AnnotationSeverity {
    INFO,
    CAUTION,
    WARNING;

    public String label() {
        return name().toLowerCase();
    }
}
