package com.minisql.parser;

import java.util.Locale;

/**
 * Token - 词法单元
 *
 * 每个Token记录它在源文本中的位置和所处的括号深度。
 * 子句切分只看depth == 0的Token,嵌套在函数调用、IN列表或子查询里的
 * 逗号和关键字因此不会被误切。
 *
 * 括号本身的深度是它外侧的深度: "(" 和与之匹配的 ")" 深度相同。
 */
public final class Token {

    /**
     * Token类型
     */
    public enum TokenType {
        /** 标识符或关键字 */
        WORD,
        /** 数字字面量 */
        NUMBER,
        /** 字符串字面量(text为去掉引号、处理转义后的内容) */
        STRING,
        /** 比较或算术运算符 */
        OPERATOR,
        LEFT_PAREN,
        RIGHT_PAREN,
        COMMA,
        DOT,
        /** 星号(SELECT * / COUNT(*) / 乘法) */
        STAR,
        SEMICOLON,
        /** 输入结束 */
        EOF
    }

    private final TokenType type;

    private final String text;

    /** 在源文本中的起始位置(包含) */
    private final int start;

    /** 在源文本中的结束位置(不包含) */
    private final int end;

    /** 括号深度 */
    private final int depth;

    /** 引号或反引号是否闭合(其他Token恒为true) */
    private final boolean closed;

    public Token(TokenType type, String text, int start, int end, int depth) {
        this(type, text, start, end, depth, true);
    }

    public Token(TokenType type, String text, int start, int end, int depth, boolean closed) {
        this.type = type;
        this.text = text;
        this.start = start;
        this.end = end;
        this.depth = depth;
        this.closed = closed;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getDepth() {
        return depth;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * 是否为指定关键字(忽略大小写)
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.WORD && text.equalsIgnoreCase(keyword);
    }

    public boolean is(TokenType tokenType) {
        return type == tokenType;
    }

    /**
     * 是否为指定运算符
     */
    public boolean isOperator(String symbol) {
        return type == TokenType.OPERATOR && text.equals(symbol);
    }

    public String upper() {
        return text.toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + start + "/" + depth;
    }
}
