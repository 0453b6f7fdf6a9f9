package com.minisql.executor;

import com.minisql.error.SqlSyntaxException;
import com.minisql.error.UnsupportedFeatureException;
import com.minisql.parser.Expression;
import com.minisql.parser.expressions.AggregateExpression;
import com.minisql.parser.expressions.BinaryExpression;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.parser.expressions.FunctionExpression;
import com.minisql.parser.expressions.LiteralExpression;
import com.minisql.parser.expressions.UnparsedExpression;
import com.minisql.table.Row;
import com.minisql.table.Value;

/**
 * ExpressionEvaluator - SQL表达式求值器
 *
 * 递归求值表达式树,返回带类型标签的Value:
 * - 列引用: 先按完整名(e.salary)查找,再按裸列名(salary)查找
 * - 字面量: 直接返回
 * - 算术运算: 委托给Value的运算方法,NULL传播
 * - 聚合函数: 读取分组行中以聚合键命名的列
 *
 * 设计原则:
 * - "Good taste": 递归求值,根据表达式类型分发
 * - 类型严格: 类型不匹配抛TypeMismatchException,由调用方决定如何处理
 * - 零状态: 无状态,可以在算子之间共享
 *
 * MySQL对应:
 * - MySQL Executor中的Item::val_xxx()方法族
 */
public class ExpressionEvaluator {

    /**
     * 求值表达式
     *
     * @param expr 表达式
     * @param row 行数据
     * @return 求值结果
     * @throws com.minisql.error.TypeMismatchException 算术运算的操作数类型不兼容
     */
    public Value evaluate(Expression expr, Row row) {
        if (expr == null) {
            throw new IllegalArgumentException("Expression cannot be null");
        }

        switch (expr.getType()) {
            case COLUMN:
                return evalColumn((ColumnExpression) expr, row);

            case LITERAL:
                return ((LiteralExpression) expr).getValue();

            case BINARY:
                return evalBinary((BinaryExpression) expr, row);

            case AGGREGATE:
                return row.get(((AggregateExpression) expr).getKey());

            case FUNCTION:
                throw new UnsupportedFeatureException(
                        "Function " + ((FunctionExpression) expr).getName().toUpperCase() + "()");

            case UNPARSED:
                throw new SqlSyntaxException("Could not parse expression '" + expr + "'",
                        ((UnparsedExpression) expr).getFirstWord());

            default:
                throw new IllegalStateException("Cannot evaluate expression: " + expr);
        }
    }

    /**
     * 求值列引用
     *
     * 扫描算子为每列同时写入裸列名和带前缀的列名,
     * 所以这里只需要两次查找。
     */
    private Value evalColumn(ColumnExpression expr, Row row) {
        if (expr.isQualified()) {
            String qualified = expr.getQualifier() + "." + expr.getColumnName();
            if (row.contains(qualified)) {
                return row.get(qualified);
            }
            if (row.contains(expr.getFullName())) {
                return row.get(expr.getFullName());
            }
        }
        return row.get(expr.getColumnName());
    }

    private Value evalBinary(BinaryExpression expr, Row row) {
        Value left = evaluate(expr.getLeft(), row);
        Value right = evaluate(expr.getRight(), row);

        switch (expr.getOperator()) {
            case ADD:
                return left.add(right);
            case SUBTRACT:
                return left.subtract(right);
            case MULTIPLY:
                return left.multiply(right);
            case DIVIDE:
                return left.divide(right);
            case MODULO:
                return left.modulo(right);
            default:
                throw new IllegalStateException("Not an arithmetic operator: " + expr.getOperator());
        }
    }
}
