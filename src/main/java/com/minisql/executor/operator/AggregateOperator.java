package com.minisql.executor.operator;

import com.minisql.error.TypeMismatchException;
import com.minisql.executor.ExpressionEvaluator;
import com.minisql.executor.Operator;
import com.minisql.parser.Expression;
import com.minisql.parser.ExpressionUtils;
import com.minisql.parser.SelectItem;
import com.minisql.parser.expressions.AggregateExpression;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.table.Row;
import com.minisql.table.Value;
import com.minisql.table.ValueType;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * AggregateOperator - 分组聚合算子
 *
 * 物化子算子的全部行,按GROUP BY表达式分组,对每组计算聚合函数。
 * 没有GROUP BY但有聚合函数时,整个输入作为一个隐式分组。
 *
 * 输出行 = 组内第一行的所有列 + 每个聚合的结果(以聚合键命名,如 "count(*)"),
 * 上层的HAVING、ORDER BY、投影都通过聚合键读取结果。
 *
 * 聚合语义(MySQL):
 * - COUNT(*): 组内行数
 * - COUNT(col): 非NULL值的个数
 * - SUM/AVG/MIN/MAX: 忽略NULL,全部为NULL时结果为NULL
 * - DISTINCT: 先对非NULL值去重
 * - SUM的输入全部为整数时结果为整数,否则为浮点数;AVG总是浮点数
 * - 空输入且无GROUP BY: 输出一行,COUNT为0,其他聚合为NULL
 *
 * 分组键中NULL与NULL属于同一组,组的顺序为第一次出现的顺序。
 *
 * MySQL对应:
 * - GROUP BY的临时表分组,对应EXPLAIN Extra中的 "Using temporary"
 */
public class AggregateOperator implements Operator {

    private final Operator child;

    private final List<Expression> groupBy;

    /** 需要计算的聚合(按键去重) */
    private final List<AggregateExpression> aggregates;

    /** 别名 → 含聚合的SELECT表达式(HAVING和ORDER BY可以引用别名) */
    private final Map<String, Expression> aliases = new LinkedHashMap<>();

    private final ExpressionEvaluator evaluator;

    private Iterator<Row> resultIterator;

    /**
     * 创建聚合算子
     *
     * @param child 子算子
     * @param groupBy 分组表达式(可以为空)
     * @param aggregates SELECT/HAVING/ORDER BY中出现的全部聚合
     * @param selectItems SELECT列表(用于别名)
     * @param evaluator 表达式求值器
     */
    public AggregateOperator(Operator child, List<Expression> groupBy, List<AggregateExpression> aggregates,
                             List<SelectItem> selectItems, ExpressionEvaluator evaluator) {
        if (child == null) {
            throw new IllegalArgumentException("Child operator cannot be null");
        }
        this.child = child;
        this.groupBy = List.copyOf(groupBy);
        this.evaluator = evaluator;

        Map<String, AggregateExpression> unique = new LinkedHashMap<>();
        for (AggregateExpression aggregate : aggregates) {
            unique.putIfAbsent(aggregate.getKey(), aggregate);
        }
        this.aggregates = List.copyOf(unique.values());

        for (SelectItem item : selectItems) {
            if (item.getAlias() != null && ExpressionUtils.containsAggregate(item.getExpression())) {
                aliases.put(item.getAlias(), item.getExpression());
            }
        }
    }

    @Override
    public boolean hasNext() {
        if (resultIterator == null) {
            resultIterator = aggregate().iterator();
        }
        return resultIterator.hasNext();
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more groups");
        }
        return resultIterator.next();
    }

    private List<Row> aggregate() {
        Map<List<Value>, List<Row>> groups = new LinkedHashMap<>();
        while (child.hasNext()) {
            Row row = child.next();
            List<Value> key = new ArrayList<>(groupBy.size());
            for (Expression expression : groupBy) {
                key.add(evaluator.evaluate(expression, row));
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }

        List<Row> result = new ArrayList<>();
        if (groups.isEmpty() && groupBy.isEmpty()) {
            result.add(groupRow(Row.EMPTY, List.of()));
            return result;
        }
        for (List<Row> members : groups.values()) {
            result.add(groupRow(members.get(0), members));
        }
        return result;
    }

    private Row groupRow(Row first, List<Row> members) {
        Row.Builder builder = first.toBuilder();
        for (AggregateExpression aggregate : aggregates) {
            builder.put(aggregate.getKey(), compute(aggregate, members));
        }
        Row row = builder.build();
        if (aliases.isEmpty()) {
            return row;
        }

        Row.Builder withAliases = row.toBuilder();
        for (Map.Entry<String, Expression> alias : aliases.entrySet()) {
            withAliases.put(alias.getKey(), evaluator.evaluate(alias.getValue(), row));
        }
        return withAliases.build();
    }

    /**
     * 计算一个聚合函数
     */
    Value compute(AggregateExpression aggregate, List<Row> members) {
        if (aggregate.isCountStar()) {
            return Value.ofInt(members.size());
        }

        List<Value> values = new ArrayList<>();
        for (Row row : members) {
            Value value = evaluator.evaluate(aggregate.getArgument(), row);
            if (!value.isNull()) {
                values.add(value);
            }
        }
        if (aggregate.isDistinct()) {
            Set<Value> distinct = new LinkedHashSet<>(values);
            values = new ArrayList<>(distinct);
        }

        switch (aggregate.getFunction()) {
            case COUNT:
                return Value.ofInt(values.size());
            case SUM:
                return sum(aggregate, values);
            case AVG: {
                if (values.isEmpty()) {
                    return Value.NULL;
                }
                double total = 0;
                for (Value value : values) {
                    total += numeric(aggregate, value).asDouble();
                }
                return Value.ofFloat(total / values.size());
            }
            case MIN:
            case MAX: {
                Value best = null;
                for (Value value : values) {
                    if (best == null) {
                        best = value;
                        continue;
                    }
                    int cmp = value.compareTo(best);
                    if (aggregate.getFunction() == AggregateExpression.Function.MIN ? cmp < 0 : cmp > 0) {
                        best = value;
                    }
                }
                return best != null ? best : Value.NULL;
            }
            default:
                throw new IllegalStateException("Unknown aggregate: " + aggregate.getFunction());
        }
    }

    private static Value sum(AggregateExpression aggregate, List<Value> values) {
        if (values.isEmpty()) {
            return Value.NULL;
        }
        boolean allIntegers = true;
        long longTotal = 0;
        double doubleTotal = 0;
        for (Value value : values) {
            numeric(aggregate, value);
            if (value.getType() == ValueType.INTEGER) {
                longTotal += value.asLong();
            } else {
                allIntegers = false;
            }
            doubleTotal += value.asDouble();
        }
        return allIntegers ? Value.ofInt(longTotal) : Value.ofFloat(doubleTotal);
    }

    private static Value numeric(AggregateExpression aggregate, Value value) {
        if (!value.isNumeric()) {
            String column = aggregate.getArgument() instanceof ColumnExpression
                    ? ((ColumnExpression) aggregate.getArgument()).getFullName()
                    : aggregate.getArgument().toString();
            throw new TypeMismatchException(column, "DOUBLE", value.getType().getSqlName());
        }
        return value;
    }

    public List<AggregateExpression> getAggregates() {
        return aggregates;
    }

    @Override
    public String toString() {
        return "AggregateOperator{" +
                "groupBy=" + groupBy +
                ", aggregates=" + aggregates +
                ", child=" + child +
                '}';
    }
}
