package com.minisql.executor.operator;

import com.minisql.error.NumericOverflowException;
import com.minisql.error.TypeMismatchException;
import com.minisql.executor.ExecutionContext;
import com.minisql.executor.ExpressionEvaluator;
import com.minisql.executor.Operator;
import com.minisql.parser.Expression;
import com.minisql.table.Row;
import com.minisql.table.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * ProjectOperator - 列投影算子
 *
 * 把子算子的宽行(包含裸列名、限定列名、聚合键)投影成最终的输出列:
 * - 列引用: salary, e.salary
 * - 别名: salary AS s
 * - 算术表达式: salary * 1.1
 * - 字面量: SELECT 1, 'a'
 * - 聚合结果: COUNT(*)
 *
 * SELECT * 的展开由执行器在构建算子树时完成,这里只看到普通的投影列表。
 *
 * 算术表达式中类型不匹配时该列输出NULL,并在结果中记录一条警告。
 *
 * MySQL对应:
 * - SELECT列表投影,对应临时表(TempTable)的构建
 */
public class ProjectOperator implements Operator {

    private final Operator child;

    private final List<Projection> projections;

    private final ExpressionEvaluator evaluator;

    /** 用于记录警告 */
    private final ExecutionContext context;

    public ProjectOperator(Operator child, List<Projection> projections,
                           ExpressionEvaluator evaluator, ExecutionContext context) {
        if (child == null) {
            throw new IllegalArgumentException("Child operator cannot be null");
        }
        if (projections == null || projections.isEmpty()) {
            throw new IllegalArgumentException("Projections cannot be empty");
        }
        this.child = child;
        this.projections = List.copyOf(projections);
        this.evaluator = evaluator;
        this.context = context;
    }

    @Override
    public boolean hasNext() {
        return child.hasNext();
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more rows");
        }
        Row source = child.next();

        Row.Builder builder = Row.builder();
        for (Projection projection : projections) {
            builder.put(projection.getName(), evaluate(projection, source));
        }
        return builder.build();
    }

    private Value evaluate(Projection projection, Row row) {
        try {
            return evaluator.evaluate(projection.getExpression(), row);
        } catch (TypeMismatchException e) {
            if (context != null) {
                context.addWarning("Type mismatch in '" + projection.getName() + "': "
                        + e.getMessage() + "; NULL returned");
            }
            return Value.NULL;
        } catch (NumericOverflowException e) {
            if (context != null) {
                context.addWarning("Overflow in '" + projection.getName() + "': "
                        + e.getMessage() + "; NULL returned");
            }
            return Value.NULL;
        }
    }

    @Override
    public void reset() {
        child.reset();
    }

    /**
     * 投影后的列名(保持SELECT列表顺序)
     */
    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(projections.size());
        for (Projection projection : projections) {
            names.add(projection.getName());
        }
        return names;
    }

    @Override
    public String toString() {
        return "ProjectOperator{columns=" + getColumnNames() + ", child=" + child + '}';
    }

    /**
     * 一个输出列: 列名 + 计算它的表达式
     */
    public static class Projection {

        private final String name;

        private final Expression expression;

        public Projection(String name, Expression expression) {
            if (name == null || expression == null) {
                throw new IllegalArgumentException("Projection name and expression cannot be null");
            }
            this.name = name;
            this.expression = expression;
        }

        public String getName() {
            return name;
        }

        public Expression getExpression() {
            return expression;
        }

        @Override
        public String toString() {
            return name + "=" + expression;
        }
    }
}
