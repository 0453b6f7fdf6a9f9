package com.minisql.executor.operator;

import com.minisql.executor.Operator;
import com.minisql.table.Row;

import java.util.HashSet;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * DistinctOperator - 去重算子
 *
 * 按投影后的整行去重,保留每组重复行中第一次出现的那一行。
 * NULL与NULL视为相同(与GROUP BY一致)。
 *
 * MySQL对应: SELECT DISTINCT, EXPLAIN Extra中的 "Using temporary"
 */
public class DistinctOperator implements Operator {

    private final Operator child;

    private final Set<Row> seen = new HashSet<>();

    private Row currentRow;

    private boolean hasNextRow;

    public DistinctOperator(Operator child) {
        if (child == null) {
            throw new IllegalArgumentException("Child operator cannot be null");
        }
        this.child = child;
    }

    @Override
    public boolean hasNext() {
        if (hasNextRow) {
            return true;
        }
        while (child.hasNext()) {
            Row row = child.next();
            if (seen.add(row)) {
                currentRow = row;
                hasNextRow = true;
                return true;
            }
        }
        return false;
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more rows");
        }
        hasNextRow = false;
        return currentRow;
    }

    @Override
    public void reset() {
        child.reset();
        seen.clear();
        hasNextRow = false;
    }

    @Override
    public String toString() {
        return "DistinctOperator{child=" + child + '}';
    }
}
