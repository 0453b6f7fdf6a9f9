package com.minisql.executor;

import com.minisql.table.Row;

import java.util.List;

/**
 * RowSet - 物化的行集合(列名 + 行)
 *
 * 子查询(CTE成员)的执行结果,也是CTE注册表中的虚拟表。
 */
public final class RowSet {

    private final List<String> columns;

    private final List<Row> rows;

    public RowSet(List<String> columns, List<Row> rows) {
        this.columns = List.copyOf(columns);
        this.rows = List.copyOf(rows);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Row> getRows() {
        return rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }
}
