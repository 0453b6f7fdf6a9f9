package com.minisql.executor.operator;

import com.minisql.executor.Operator;
import com.minisql.table.Row;

import java.util.NoSuchElementException;

/**
 * LimitOperator - LIMIT/OFFSET算子
 *
 * 跳过前offset行,最多返回limit行。达到limit后不再拉取子算子。
 *
 * MySQL对应: LIMIT offset, count
 */
public class LimitOperator implements Operator {

    private final Operator child;

    /** 最多返回的行数,null表示不限 */
    private final Integer limit;

    private final int offset;

    private int skipped;

    private int returned;

    public LimitOperator(Operator child, Integer limit, int offset) {
        if (child == null) {
            throw new IllegalArgumentException("Child operator cannot be null");
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("LIMIT cannot be negative: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("OFFSET cannot be negative: " + offset);
        }
        this.child = child;
        this.limit = limit;
        this.offset = offset;
    }

    @Override
    public boolean hasNext() {
        if (limit != null && returned >= limit) {
            return false;
        }
        while (skipped < offset && child.hasNext()) {
            child.next();
            skipped++;
        }
        return child.hasNext();
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more rows");
        }
        returned++;
        return child.next();
    }

    @Override
    public void reset() {
        child.reset();
        skipped = 0;
        returned = 0;
    }

    @Override
    public String toString() {
        return "LimitOperator{" +
                "limit=" + limit +
                ", offset=" + offset +
                ", child=" + child +
                '}';
    }
}
