package com.minisql.explain;

import java.util.List;

/**
 * IndexRecommendation - 索引建议
 *
 * 附带可直接执行的CREATE INDEX语句和建议理由。
 */
public final class IndexRecommendation {

    /**
     * 建议类型
     */
    public enum Kind {
        WHERE_FILTER("WHERE filter"),
        ORDER_BY("ORDER BY"),
        COMPOSITE("Composite"),
        COVERING("Covering");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Kind kind;

    private final String table;

    private final List<String> columns;

    private final String sql;

    private final String reason;

    public IndexRecommendation(Kind kind, String table, List<String> columns, String sql, String reason) {
        this.kind = kind;
        this.table = table;
        this.columns = List.copyOf(columns);
        this.sql = sql;
        this.reason = reason;
    }

    public Kind getKind() {
        return kind;
    }

    public String getTable() {
        return table;
    }

    public List<String> getColumns() {
        return columns;
    }

    public String getSql() {
        return sql;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return kind.label() + ": " + sql;
    }
}
