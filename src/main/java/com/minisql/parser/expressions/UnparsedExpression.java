package com.minisql.parser.expressions;

import com.minisql.parser.Expression;

/**
 * UnparsedExpression - 无法解析的片段
 *
 * 解析器从不抛异常,遇到看不懂的结构就保留原文。
 * 执行器在校验阶段把它转换成SqlSyntaxException。
 */
public class UnparsedExpression implements Expression {

    private final String text;

    public UnparsedExpression(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    /**
     * 原文的第一个单词(用于拼写纠错)
     */
    public String getFirstWord() {
        String trimmed = text.trim();
        int space = 0;
        while (space < trimmed.length() && Character.isLetterOrDigit(trimmed.charAt(space))) {
            space++;
        }
        return space == 0 ? trimmed : trimmed.substring(0, space);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.UNPARSED;
    }

    @Override
    public String toString() {
        return text;
    }
}
