package com.minisql.executor.operator;

import com.minisql.executor.Operator;
import com.minisql.table.Row;

import java.util.NoSuchElementException;

/**
 * SingleRowOperator - 单行数据源
 *
 * 无FROM子句的字面量查询(SELECT 1, SELECT 'a' AS x)的数据源,
 * 只产生一个空行,由ProjectOperator在其上计算字面量。
 *
 * MySQL对应: EXPLAIN中的 "No tables used"
 */
public class SingleRowOperator implements Operator {

    private boolean consumed;

    @Override
    public boolean hasNext() {
        return !consumed;
    }

    @Override
    public Row next() {
        if (consumed) {
            throw new NoSuchElementException("No more rows");
        }
        consumed = true;
        return Row.EMPTY;
    }

    @Override
    public void reset() {
        consumed = false;
    }

    @Override
    public String toString() {
        return "SingleRowOperator{}";
    }
}
