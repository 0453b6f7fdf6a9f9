package com.minisql.result;

import com.minisql.table.Row;
import com.minisql.table.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * QueryResult - 查询结果集
 *
 * 封装查询执行的结果: 行数据、列名、行数、耗时、警告、CTE执行信息和执行阶段。
 * 提供格式化输出功能,便于调试和展示。
 *
 * 设计原则:
 * - "Good taste": 简单的数据容器,没有复杂逻辑
 * - 不可变性:创建后不可修改
 * - 实用主义:提供toString()格式化输出
 *
 * 输出示例:
 * <pre>
 * +----+-------+
 * | id | name  |
 * +----+-------+
 * | 1  | Alice |
 * | 2  | Bob   |
 * +----+-------+
 * 2 rows in set (0.12 ms)
 * </pre>
 */
public class QueryResult {

    /** 列名 */
    private final List<String> columns;

    /** 行数据 */
    private final List<Row> rows;

    /** 执行耗时(毫秒) */
    private final double elapsedMillis;

    /** 原始查询 */
    private final String query;

    private final List<String> warnings;

    private final List<CteExecutionInfo> cteInfo;

    private final List<ExecutionStage> stages;

    public QueryResult(List<String> columns, List<Row> rows, double elapsedMillis, String query,
                       List<String> warnings, List<CteExecutionInfo> cteInfo, List<ExecutionStage> stages) {
        if (columns == null) {
            throw new IllegalArgumentException("Columns cannot be null");
        }
        if (rows == null) {
            throw new IllegalArgumentException("Rows cannot be null");
        }

        this.columns = List.copyOf(columns);
        this.rows = List.copyOf(rows);
        this.elapsedMillis = elapsedMillis;
        this.query = query;
        this.warnings = List.copyOf(warnings);
        this.cteInfo = List.copyOf(cteInfo);
        this.stages = List.copyOf(stages);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Row> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getColumnCount() {
        return columns.size();
    }

    public double getElapsedMillis() {
        return elapsedMillis;
    }

    public String getQuery() {
        return query;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public List<CteExecutionInfo> getCteInfo() {
        return cteInfo;
    }

    public List<ExecutionStage> getStages() {
        return stages;
    }

    /**
     * 取出一列的全部值
     *
     * @param column 列名
     */
    public List<Value> columnValues(String column) {
        return rows.stream().map(row -> row.get(column)).collect(Collectors.toList());
    }

    /**
     * 格式化输出为表格
     *
     * @return 格式化后的表格字符串
     */
    @Override
    public String toString() {
        if (rows.isEmpty()) {
            return "Empty set (" + String.format("%.2f", elapsedMillis) + " ms)";
        }

        // 计算每列的最大宽度
        int[] columnWidths = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            columnWidths[i] = columns.get(i).length();
        }

        for (Row row : rows) {
            for (int i = 0; i < columns.size(); i++) {
                columnWidths[i] = Math.max(columnWidths[i], row.get(columns.get(i)).toString().length());
            }
        }

        String separator = buildSeparator(columnWidths);

        // 表头
        StringBuilder sb = new StringBuilder();
        sb.append(separator).append("\n");
        sb.append("| ");
        for (int i = 0; i < columns.size(); i++) {
            sb.append(padRight(columns.get(i), columnWidths[i]));
            sb.append(" | ");
        }
        sb.append("\n");
        sb.append(separator).append("\n");

        // 数据行
        for (Row row : rows) {
            sb.append("| ");
            for (int i = 0; i < columns.size(); i++) {
                sb.append(padRight(row.get(columns.get(i)).toString(), columnWidths[i]));
                sb.append(" | ");
            }
            sb.append("\n");
        }
        sb.append(separator).append("\n");

        sb.append(rows.size()).append(" row").append(rows.size() > 1 ? "s" : "").append(" in set (")
                .append(String.format("%.2f", elapsedMillis)).append(" ms)");

        for (String warning : warnings) {
            sb.append("\nWarning: ").append(warning);
        }

        return sb.toString();
    }

    private String buildSeparator(int[] columnWidths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : columnWidths) {
            sb.append("-".repeat(width + 2));
            sb.append("+");
        }
        return sb.toString();
    }

    private String padRight(String str, int width) {
        if (str.length() >= width) {
            return str;
        }
        return str + " ".repeat(width - str.length());
    }
}
