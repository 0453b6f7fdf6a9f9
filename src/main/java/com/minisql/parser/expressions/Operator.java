package com.minisql.parser.expressions;

/**
 * Operator - 运算符
 *
 * 定义WHERE/HAVING中的比较运算符和表达式中的算术运算符。
 */
public enum Operator {

    /** 等于 */
    EQUAL("=", Category.COMPARISON),
    /** 不等于(<> 和 != 都映射到这里) */
    NOT_EQUAL("<>", Category.COMPARISON),
    /** 大于 */
    GREATER_THAN(">", Category.COMPARISON),
    /** 小于 */
    LESS_THAN("<", Category.COMPARISON),
    /** 大于等于 */
    GREATER_EQUAL(">=", Category.COMPARISON),
    /** 小于等于 */
    LESS_EQUAL("<=", Category.COMPARISON),
    /** 模式匹配 */
    LIKE("LIKE", Category.PREDICATE),
    NOT_LIKE("NOT LIKE", Category.PREDICATE),
    /** 列表成员 */
    IN("IN", Category.PREDICATE),
    NOT_IN("NOT IN", Category.PREDICATE),
    /** 空值判断 */
    IS_NULL("IS NULL", Category.PREDICATE),
    IS_NOT_NULL("IS NOT NULL", Category.PREDICATE),
    /** 闭区间 */
    BETWEEN("BETWEEN", Category.PREDICATE),
    NOT_BETWEEN("NOT BETWEEN", Category.PREDICATE),
    /** 加法 */
    ADD("+", Category.ARITHMETIC),
    /** 减法 */
    SUBTRACT("-", Category.ARITHMETIC),
    /** 乘法 */
    MULTIPLY("*", Category.ARITHMETIC),
    /** 除法 */
    DIVIDE("/", Category.ARITHMETIC),
    /** 取模 */
    MODULO("%", Category.ARITHMETIC);

    /**
     * 运算符类别
     */
    public enum Category {
        COMPARISON,
        PREDICATE,
        ARITHMETIC
    }

    /** 运算符字符串表示 */
    private final String symbol;

    private final Category category;

    Operator(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    public String getSymbol() {
        return symbol;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isArithmetic() {
        return category == Category.ARITHMETIC;
    }

    /**
     * 是否为范围谓词(可以走range访问)
     */
    public boolean isRange() {
        return this == GREATER_THAN || this == LESS_THAN || this == GREATER_EQUAL
                || this == LESS_EQUAL || this == BETWEEN;
    }

    /**
     * 是否为否定形式(无法利用索引)
     */
    public boolean isNegated() {
        return this == NOT_EQUAL || this == NOT_LIKE || this == NOT_IN || this == NOT_BETWEEN;
    }

    /**
     * 交换两侧操作数后的等价比较运算符: 5 < id 等价于 id > 5
     *
     * @return 非比较运算符返回自身
     */
    public Operator mirrored() {
        switch (this) {
            case GREATER_THAN:
                return LESS_THAN;
            case LESS_THAN:
                return GREATER_THAN;
            case GREATER_EQUAL:
                return LESS_EQUAL;
            case LESS_EQUAL:
                return GREATER_EQUAL;
            default:
                return this;
        }
    }

    /**
     * 根据符号获取比较运算符
     *
     * @param symbol 运算符符号
     * @return 运算符枚举,如果未知返回null
     */
    public static Operator fromSymbol(String symbol) {
        if ("!=".equals(symbol)) {
            return NOT_EQUAL;
        }
        for (Operator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
