package com.minisql.parser.expressions;

import com.minisql.parser.Expression;

import java.util.Locale;

/**
 * AggregateExpression - 聚合函数
 *
 * COUNT(*), COUNT(col), COUNT(DISTINCT col), SUM, AVG, MIN, MAX。
 * 除COUNT(*)外都忽略NULL输入。
 *
 * 分组后,聚合结果以{@link #getKey()}为列名写入分组行,
 * HAVING和ORDER BY中出现的同一聚合通过这个键读取结果。
 */
public class AggregateExpression implements Expression {

    /**
     * 聚合函数类型
     */
    public enum Function {
        COUNT,
        SUM,
        AVG,
        MIN,
        MAX;

        /**
         * 按名称查找(忽略大小写)
         *
         * @return 聚合函数,不是聚合函数时返回null
         */
        public static Function fromName(String name) {
            for (Function function : values()) {
                if (function.name().equalsIgnoreCase(name)) {
                    return function;
                }
            }
            return null;
        }
    }

    private final Function function;

    /** 参数(COUNT(*)时为null) */
    private final Expression argument;

    private final boolean distinct;

    public AggregateExpression(Function function, Expression argument, boolean distinct) {
        this.function = function;
        this.argument = argument;
        this.distinct = distinct;
    }

    /**
     * COUNT(*)
     */
    public static AggregateExpression countStar() {
        return new AggregateExpression(Function.COUNT, null, false);
    }

    public Function getFunction() {
        return function;
    }

    public Expression getArgument() {
        return argument;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public boolean isCountStar() {
        return function == Function.COUNT && argument == null;
    }

    /**
     * 分组行中的列名,如"count(*)", "avg(salary)", "count(distinct department_id)"
     */
    public String getKey() {
        return toString().toLowerCase(Locale.ROOT);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.AGGREGATE;
    }

    @Override
    public String toString() {
        String inner = argument == null ? "*" : (distinct ? "DISTINCT " : "") + argument;
        return function.name() + "(" + inner + ")";
    }
}
