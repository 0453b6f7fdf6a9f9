package com.minisql.parser;

import com.minisql.parser.expressions.AggregateExpression;
import com.minisql.parser.expressions.BinaryExpression;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.parser.expressions.FunctionExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * ExpressionUtils - 表达式树遍历工具
 */
public final class ExpressionUtils {

    private ExpressionUtils() {
    }

    /**
     * 收集表达式中引用的所有列(聚合函数内部的列也算)
     */
    public static List<ColumnExpression> columnsOf(Expression expression) {
        List<ColumnExpression> columns = new ArrayList<>();
        collectColumns(expression, columns);
        return columns;
    }

    private static void collectColumns(Expression expression, List<ColumnExpression> out) {
        if (expression == null) {
            return;
        }
        switch (expression.getType()) {
            case COLUMN:
                out.add((ColumnExpression) expression);
                break;
            case BINARY:
                collectColumns(((BinaryExpression) expression).getLeft(), out);
                collectColumns(((BinaryExpression) expression).getRight(), out);
                break;
            case AGGREGATE:
                collectColumns(((AggregateExpression) expression).getArgument(), out);
                break;
            case FUNCTION:
                for (Expression argument : ((FunctionExpression) expression).getArguments()) {
                    collectColumns(argument, out);
                }
                break;
            default:
                break;
        }
    }

    /**
     * 收集表达式中的聚合函数
     */
    public static List<AggregateExpression> aggregatesOf(Expression expression) {
        List<AggregateExpression> aggregates = new ArrayList<>();
        collectAggregates(expression, aggregates);
        return aggregates;
    }

    private static void collectAggregates(Expression expression, List<AggregateExpression> out) {
        if (expression == null) {
            return;
        }
        switch (expression.getType()) {
            case AGGREGATE:
                out.add((AggregateExpression) expression);
                break;
            case BINARY:
                collectAggregates(((BinaryExpression) expression).getLeft(), out);
                collectAggregates(((BinaryExpression) expression).getRight(), out);
                break;
            case FUNCTION:
                for (Expression argument : ((FunctionExpression) expression).getArguments()) {
                    collectAggregates(argument, out);
                }
                break;
            default:
                break;
        }
    }

    public static boolean containsAggregate(Expression expression) {
        return !aggregatesOf(expression).isEmpty();
    }

    /**
     * 查找第一个非聚合函数调用
     *
     * @return 函数表达式,没有时返回null
     */
    public static FunctionExpression firstFunction(Expression expression) {
        if (expression == null) {
            return null;
        }
        switch (expression.getType()) {
            case FUNCTION:
                return (FunctionExpression) expression;
            case BINARY: {
                FunctionExpression left = firstFunction(((BinaryExpression) expression).getLeft());
                return left != null ? left : firstFunction(((BinaryExpression) expression).getRight());
            }
            case AGGREGATE:
                return firstFunction(((AggregateExpression) expression).getArgument());
            default:
                return null;
        }
    }

    /**
     * 查找第一个无法解析的片段
     *
     * @return 片段,没有时返回null
     */
    public static Expression firstUnparsed(Expression expression) {
        if (expression == null) {
            return null;
        }
        switch (expression.getType()) {
            case UNPARSED:
                return expression;
            case BINARY: {
                Expression left = firstUnparsed(((BinaryExpression) expression).getLeft());
                return left != null ? left : firstUnparsed(((BinaryExpression) expression).getRight());
            }
            case AGGREGATE:
                return firstUnparsed(((AggregateExpression) expression).getArgument());
            case FUNCTION:
                for (Expression argument : ((FunctionExpression) expression).getArguments()) {
                    Expression found = firstUnparsed(argument);
                    if (found != null) {
                        return found;
                    }
                }
                return null;
            default:
                return null;
        }
    }
}
