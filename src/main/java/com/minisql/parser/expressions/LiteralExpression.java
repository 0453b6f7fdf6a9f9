package com.minisql.parser.expressions;

import com.minisql.parser.Expression;
import com.minisql.table.Value;

/**
 * LiteralExpression - 字面量表达式
 *
 * 表示SQL中的字面量值,包括:
 * - 整数: 42, -100
 * - 浮点数: 3.14
 * - 字符串: 'hello', 'it''s'
 * - 布尔值: TRUE, FALSE
 * - NULL值: NULL
 */
public class LiteralExpression implements Expression {

    private final Value value;

    public LiteralExpression(Value value) {
        this.value = value != null ? value : Value.NULL;
    }

    public Value getValue() {
        return value;
    }

    /**
     * 判断是否为NULL字面量
     */
    public boolean isNull() {
        return value.isNull();
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.LITERAL;
    }

    @Override
    public String toString() {
        return value.toSqlLiteral();
    }
}
