package com.minisql.executor.operator;

import com.minisql.error.TypeMismatchException;
import com.minisql.executor.ExpressionEvaluator;
import com.minisql.executor.Operator;
import com.minisql.parser.Expression;
import com.minisql.table.Row;
import com.minisql.table.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * SortOperator - ORDER BY排序算子
 *
 * 物化子算子的全部行,按排序键稳定排序(键相同的行保持输入顺序)。
 *
 * 排序规则:
 * - 按Value的全序比较,数值跨INTEGER/FLOAT比较
 * - NULL在升序时排在最前,在降序时排在最后
 * - 求值出错的键按NULL处理
 *
 * MySQL对应:
 * - filesort,对应EXPLAIN Extra中的 "Using filesort"
 */
public class SortOperator implements Operator {

    private final Operator child;

    private final List<SortKey> keys;

    private final ExpressionEvaluator evaluator;

    private Iterator<Row> sortedIterator;

    public SortOperator(Operator child, List<SortKey> keys, ExpressionEvaluator evaluator) {
        if (child == null) {
            throw new IllegalArgumentException("Child operator cannot be null");
        }
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("Sort keys cannot be empty");
        }
        this.child = child;
        this.keys = List.copyOf(keys);
        this.evaluator = evaluator;
    }

    @Override
    public boolean hasNext() {
        if (sortedIterator == null) {
            sortedIterator = sort().iterator();
        }
        return sortedIterator.hasNext();
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more rows");
        }
        return sortedIterator.next();
    }

    private List<Row> sort() {
        List<SortEntry> entries = new ArrayList<>();
        while (child.hasNext()) {
            Row row = child.next();
            List<Value> values = new ArrayList<>(keys.size());
            for (SortKey key : keys) {
                values.add(keyValue(key.getExpression(), row));
            }
            entries.add(new SortEntry(row, values));
        }

        // List.sort是稳定排序
        entries.sort(comparator());

        List<Row> rows = new ArrayList<>(entries.size());
        for (SortEntry entry : entries) {
            rows.add(entry.row);
        }
        return rows;
    }

    private Value keyValue(Expression expression, Row row) {
        try {
            return evaluator.evaluate(expression, row);
        } catch (TypeMismatchException e) {
            return Value.NULL;
        }
    }

    private Comparator<SortEntry> comparator() {
        return (a, b) -> {
            for (int i = 0; i < keys.size(); i++) {
                int cmp = a.values.get(i).compareTo(b.values.get(i));
                if (cmp != 0) {
                    return keys.get(i).isDescending() ? -cmp : cmp;
                }
            }
            return 0;
        };
    }

    @Override
    public String toString() {
        return "SortOperator{keys=" + keys + ", child=" + child + '}';
    }

    /**
     * 排序键: 表达式 + 方向
     */
    public static class SortKey {

        private final Expression expression;

        private final boolean descending;

        public SortKey(Expression expression, boolean descending) {
            if (expression == null) {
                throw new IllegalArgumentException("Sort expression cannot be null");
            }
            this.expression = expression;
            this.descending = descending;
        }

        public Expression getExpression() {
            return expression;
        }

        public boolean isDescending() {
            return descending;
        }

        @Override
        public String toString() {
            return expression + (descending ? " DESC" : " ASC");
        }
    }

    private static final class SortEntry {

        private final Row row;

        private final List<Value> values;

        private SortEntry(Row row, List<Value> values) {
            this.row = row;
            this.values = values;
        }
    }
}
