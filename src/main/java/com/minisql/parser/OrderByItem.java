package com.minisql.parser;

/**
 * OrderByItem - ORDER BY中的一项
 */
public class OrderByItem {

    /**
     * 排序方向
     */
    public enum Direction {
        ASC,
        DESC
    }

    private final Expression expression;

    private final String text;

    private final Direction direction;

    public OrderByItem(Expression expression, String text, Direction direction) {
        this.expression = expression;
        this.text = text;
        this.direction = direction != null ? direction : Direction.ASC;
    }

    public Expression getExpression() {
        return expression;
    }

    /**
     * 排序键原始文本(不含ASC/DESC)
     */
    public String getText() {
        return text;
    }

    public Direction getDirection() {
        return direction;
    }

    public boolean isDescending() {
        return direction == Direction.DESC;
    }

    @Override
    public String toString() {
        return text + " " + direction;
    }
}
