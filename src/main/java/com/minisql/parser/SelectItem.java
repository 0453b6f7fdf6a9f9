package com.minisql.parser;

/**
 * SelectItem - SELECT列表中的一项
 *
 * 结果列名: 有别名时用别名,否则用原始文本(如"e.name", "COUNT(*)")。
 */
public class SelectItem {

    private final Expression expression;

    /** 别名(可能为null) */
    private final String alias;

    /** 去掉别名后的原始文本 */
    private final String text;

    public SelectItem(Expression expression, String alias, String text) {
        this.expression = expression;
        this.alias = alias;
        this.text = text;
    }

    public Expression getExpression() {
        return expression;
    }

    public String getAlias() {
        return alias;
    }

    public String getText() {
        return text;
    }

    /**
     * 结果列名
     */
    public String getOutputName() {
        return alias != null ? alias : text;
    }

    public boolean isStar() {
        return expression.getType() == Expression.ExpressionType.STAR;
    }

    @Override
    public String toString() {
        return alias != null ? text + " AS " + alias : text;
    }
}
