package com.minisql.parser;

import com.minisql.parser.expressions.Operator;
import com.minisql.parser.expressions.UnparsedExpression;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Condition - WHERE/HAVING中的一个谓词
 *
 * 多个Condition之间是AND关系。右侧操作数的个数由运算符决定:
 * - IS NULL / IS NOT NULL: 0个
 * - 比较、LIKE: 1个
 * - BETWEEN: 2个(下界, 上界)
 * - IN: N个
 *
 * 无法解析的谓词也是Condition,左侧为UnparsedExpression,运算符为null。
 */
public class Condition {

    private final Expression left;

    private final Operator operator;

    private final List<Expression> right;

    /** 原始文本 */
    private final String text;

    public Condition(Expression left, Operator operator, List<Expression> right, String text) {
        if (left == null) {
            throw new IllegalArgumentException("Condition left side cannot be null");
        }
        this.left = left;
        this.operator = operator;
        this.right = List.copyOf(right);
        this.text = text;
    }

    /**
     * 无法解析的谓词
     */
    public static Condition unparsed(String text) {
        return new Condition(new UnparsedExpression(text), null, List.of(), text);
    }

    public boolean isParsed() {
        return operator != null;
    }

    public Expression getLeft() {
        return left;
    }

    public Operator getOperator() {
        return operator;
    }

    public List<Expression> getRight() {
        return right;
    }

    /**
     * 第一个右操作数(没有时返回null)
     */
    public Expression getRightOperand() {
        return right.isEmpty() ? null : right.get(0);
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        if (!isParsed()) {
            return text;
        }
        switch (operator) {
            case IS_NULL:
            case IS_NOT_NULL:
                return left + " " + operator;
            case BETWEEN:
            case NOT_BETWEEN:
                return left + " " + operator + " " + right.get(0) + " AND " + right.get(1);
            case IN:
            case NOT_IN:
                return left + " " + operator + " (" + right.stream()
                        .map(Object::toString)
                        .collect(Collectors.joining(", ")) + ")";
            default:
                return left + " " + operator + " " + getRightOperand();
        }
    }
}
