package com.minisql.parser.expressions;

import com.minisql.parser.Expression;

/**
 * BinaryExpression - 算术运算表达式
 *
 * 表示需要两个操作数的算术运算: salary * 12, level + 1, price / 2。
 * 比较运算不在这里,而是由Condition表示。
 *
 * 设计原则:
 * - 不可变对象
 * - 左操作数、运算符、右操作数
 * - 支持嵌套: (salary + bonus) * 12
 */
public class BinaryExpression implements Expression {

    /** 左操作数 */
    private final Expression left;

    /** 运算符 */
    private final Operator operator;

    /** 右操作数 */
    private final Expression right;

    public BinaryExpression(Expression left, Operator operator, Expression right) {
        if (!operator.isArithmetic()) {
            throw new IllegalArgumentException("Not an arithmetic operator: " + operator);
        }
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.BINARY;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
