package com.minisql.executor.operator;

import com.minisql.error.TypeMismatchException;
import com.minisql.executor.ConditionEvaluator;
import com.minisql.executor.Operator;
import com.minisql.parser.Condition;
import com.minisql.table.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * FilterOperator - 条件过滤算子
 *
 * 包装子算子,跳过不满足所有谓词(AND连接)的行。
 * 同一个算子同时用于WHERE(聚合前)和HAVING(聚合后)。
 *
 * 设计原则:
 * - "Good taste": 统一的过滤逻辑,WHERE和HAVING没有区别
 * - 责任链模式: 包装子Operator,形成处理管道
 * - 单行求值出错不影响整个查询: 类型不匹配按"不匹配"处理
 *
 * MySQL对应:
 * - WHERE条件过滤,对应EXPLAIN输出中的Filtered列
 *
 * 数据流:
 * 子Operator → Row → ConditionEvaluator.matchesAll()
 * → true → 返回Row
 * → false / 类型不匹配 → 跳过,继续hasNext()
 */
public class FilterOperator implements Operator {

    private static final Logger logger = LoggerFactory.getLogger(FilterOperator.class);

    /** 子算子(数据源) */
    private final Operator child;

    /** 谓词列表(AND) */
    private final List<Condition> conditions;

    private final ConditionEvaluator evaluator;

    /** 当前行(缓存hasNext()找到的符合条件的行) */
    private Row currentRow;

    /** 是否已经找到下一行(用于hasNext()/next()协同) */
    private boolean hasNextRow;

    public FilterOperator(Operator child, List<Condition> conditions, ConditionEvaluator evaluator) {
        if (child == null) {
            throw new IllegalArgumentException("Child operator cannot be null");
        }
        if (conditions == null || conditions.isEmpty()) {
            throw new IllegalArgumentException("Conditions cannot be empty");
        }
        if (evaluator == null) {
            throw new IllegalArgumentException("Evaluator cannot be null");
        }
        this.child = child;
        this.conditions = List.copyOf(conditions);
        this.evaluator = evaluator;
    }

    @Override
    public boolean hasNext() {
        if (hasNextRow) {
            return true;
        }

        while (child.hasNext()) {
            Row row = child.next();
            if (satisfies(row)) {
                currentRow = row;
                hasNextRow = true;
                return true;
            }
        }
        return false;
    }

    private boolean satisfies(Row row) {
        try {
            return evaluator.matchesAll(conditions, row);
        } catch (TypeMismatchException e) {
            logger.trace("Row skipped, {}: {}", e.getMessage(), row);
            return false;
        }
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more rows matching condition");
        }
        hasNextRow = false;
        return currentRow;
    }

    @Override
    public void reset() {
        child.reset();
        hasNextRow = false;
        currentRow = null;
    }

    public Operator getChild() {
        return child;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    @Override
    public String toString() {
        return "FilterOperator{" +
                "conditions=" + conditions +
                ", child=" + child +
                '}';
    }
}
