package com.minisql.executor.operator;

import com.minisql.executor.Operator;
import com.minisql.table.Row;
import com.minisql.table.Value;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * ScanOperator - 全表扫描算子
 *
 * 算子树的叶子节点,逐行读取数据集表或CTE虚拟表。
 *
 * 每一列以多个名字写入输出行,供上层算子按任意形式引用:
 * - 裸列名: salary
 * - 引用名限定: e.salary (引用名为别名,无别名时为表名)
 * - 表名限定: employees.salary (仅当有别名时额外写入)
 *
 * MySQL对应:
 * - 全表扫描(扫描聚簇索引的所有叶子节点)
 * - 对应EXPLAIN输出中的type=ALL
 *
 * 使用示例:
 * <pre>
 * Operator scan = new ScanOperator("e", "employees", columns, rows);
 * scan.next().get("e.salary");
 * </pre>
 */
public class ScanOperator implements Operator {

    /** 引用名(别名或表名) */
    private final String reference;

    /** 表名 */
    private final String table;

    /** 表的列名 */
    private final List<String> columns;

    private final List<Row> rows;

    private Iterator<Row> rowIterator;

    /**
     * 创建全表扫描算子
     *
     * @param reference 引用名(别名),null时使用表名
     * @param table 表名
     * @param columns 表的列名
     * @param rows 表的行
     */
    public ScanOperator(String reference, String table, List<String> columns, List<Row> rows) {
        if (table == null) {
            throw new IllegalArgumentException("Table cannot be null");
        }
        if (columns == null || rows == null) {
            throw new IllegalArgumentException("Columns and rows cannot be null");
        }
        this.table = table;
        this.reference = reference != null ? reference : table;
        this.columns = List.copyOf(columns);
        this.rows = rows;
        this.rowIterator = rows.iterator();
    }

    @Override
    public boolean hasNext() {
        return rowIterator.hasNext();
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more rows");
        }
        Row source = rowIterator.next();

        Row.Builder builder = Row.builder();
        for (String column : columns) {
            builder.put(column, source.get(column));
        }
        for (String column : columns) {
            Value value = source.get(column);
            builder.put(reference + "." + column, value);
            if (!reference.equalsIgnoreCase(table)) {
                builder.put(table + "." + column, value);
            }
        }
        return builder.build();
    }

    @Override
    public void reset() {
        rowIterator = rows.iterator();
    }

    /**
     * 本算子输出行的全部列名(外连接补NULL时使用)
     */
    public List<String> outputKeys() {
        return outputKeys(reference, table, columns);
    }

    /**
     * 计算扫描某张表时输出行包含的列名
     */
    public static List<String> outputKeys(String reference, String table, List<String> columns) {
        String ref = reference != null ? reference : table;
        List<String> keys = new ArrayList<>(columns);
        for (String column : columns) {
            keys.add(ref + "." + column);
            if (!ref.equalsIgnoreCase(table)) {
                keys.add(table + "." + column);
            }
        }
        return keys;
    }

    public String getReference() {
        return reference;
    }

    public String getTable() {
        return table;
    }

    public List<String> getColumns() {
        return columns;
    }

    public int getRowCount() {
        return rows.size();
    }

    @Override
    public String toString() {
        return "ScanOperator{" +
                "table=" + table +
                (reference.equals(table) ? "" : ", alias=" + reference) +
                '}';
    }
}
