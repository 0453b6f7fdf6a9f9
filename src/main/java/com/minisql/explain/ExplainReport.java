package com.minisql.explain;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * ExplainReport - EXPLAIN的完整结果: 每张表一行 + 教学注释
 *
 * format()输出MySQL客户端风格的表格:
 * <pre>
 * +----+-------------+-----------+-------+---------------+---------+---------+-------+------+----------+-------+
 * | id | select_type | table     | type  | possible_keys | key     | key_len | ref   | rows | filtered | Extra |
 * +----+-------------+-----------+-------+---------------+---------+---------+-------+------+----------+-------+
 * | 1  | SIMPLE      | employees | const | PRIMARY       | PRIMARY | 4       | const | 1    | 100.00   |       |
 * +----+-------------+-----------+-------+---------------+---------+---------+-------+------+----------+-------+
 * </pre>
 */
public final class ExplainReport {

    static final List<String> HEADERS = List.of(
            "id", "select_type", "table", "type", "possible_keys", "key",
            "key_len", "ref", "rows", "filtered", "Extra");

    private final List<ExplainRow> rows;

    private final List<Annotation> annotations;

    public ExplainReport(List<ExplainRow> rows, List<Annotation> annotations) {
        this.rows = List.copyOf(rows);
        this.annotations = List.copyOf(annotations);
    }

    public List<ExplainRow> getRows() {
        return rows;
    }

    public List<Annotation> getAnnotations() {
        return annotations;
    }

    /**
     * 按表名查找行
     */
    public Optional<ExplainRow> getRow(String table) {
        return rows.stream().filter(r -> r.getTable().equalsIgnoreCase(table)).findFirst();
    }

    /**
     * 某张表的注释
     */
    public List<Annotation> annotationsFor(String table) {
        List<Annotation> result = new ArrayList<>();
        for (Annotation annotation : annotations) {
            if (table.equalsIgnoreCase(annotation.getTable())) {
                result.add(annotation);
            }
        }
        return result;
    }

    /**
     * 所有行中最差的访问类型评级,没有表时为GOOD
     */
    public AccessType.Rating getWorstRating() {
        AccessType.Rating worst = AccessType.Rating.GOOD;
        for (ExplainRow row : rows) {
            if (row.getTypeRating().ordinal() > worst.ordinal()) {
                worst = row.getTypeRating();
            }
        }
        return worst;
    }

    /**
     * 所有行的估算行数之积(嵌套循环下的组合数)
     */
    public long getEstimatedRowCombinations() {
        long product = 1;
        for (ExplainRow row : rows) {
            product *= Math.max(1, row.getRows());
        }
        return rows.isEmpty() ? 0 : product;
    }

    /**
     * MySQL客户端风格的文本表格
     */
    public String format() {
        int[] widths = new int[HEADERS.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = HEADERS.get(i).length();
        }
        List<List<String>> cells = new ArrayList<>();
        for (ExplainRow row : rows) {
            List<String> rowCells = row.cells();
            for (int i = 0; i < widths.length; i++) {
                widths[i] = Math.max(widths[i], rowCells.get(i).length());
            }
            cells.add(rowCells);
        }

        StringBuilder sb = new StringBuilder();
        String separator = separator(widths);
        sb.append(separator);
        appendLine(sb, HEADERS, widths);
        sb.append(separator);
        for (List<String> rowCells : cells) {
            appendLine(sb, rowCells, widths);
        }
        sb.append(separator);
        return sb.toString();
    }

    private static String separator(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append("-".repeat(width + 2)).append('+');
        }
        return sb.append('\n').toString();
    }

    private static void appendLine(StringBuilder sb, List<String> values, int[] widths) {
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            String value = values.get(i);
            sb.append(' ').append(value).append(" ".repeat(widths[i] - value.length())).append(" |");
        }
        sb.append('\n');
    }

    @Override
    public String toString() {
        return format();
    }
}
