package com.minisql.parser.expressions;

import com.minisql.parser.Expression;

/**
 * StarExpression - SELECT * 或 SELECT e.*
 */
public class StarExpression implements Expression {

    /** 前缀(表名或别名),为null表示所有表 */
    private final String qualifier;

    public StarExpression() {
        this(null);
    }

    public StarExpression(String qualifier) {
        this.qualifier = qualifier;
    }

    public String getQualifier() {
        return qualifier;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.STAR;
    }

    @Override
    public String toString() {
        return qualifier == null ? "*" : qualifier + ".*";
    }
}
