package com.minisql.parser;

/**
 * Expression - SQL表达式接口
 *
 * 表示SQL中的各种表达式,包括:
 * - 列引用: salary, e.name
 * - 字面量: 42, 'Engineering', NULL
 * - 算术运算: salary * 12, level + 1
 * - 聚合函数: COUNT(*), AVG(salary), COUNT(DISTINCT department_id)
 * - 星号: *, e.*
 *
 * 设计原则:
 * - "Good taste": 所有表达式都是Expression,求值时按类型分派
 * - 不可变对象
 * - toString()输出规范化的SQL文本
 *
 * 使用示例:
 * <pre>
 * Expression expr = new BinaryExpression(
 *     new ColumnExpression("salary"),
 *     Operator.MULTIPLY,
 *     new LiteralExpression(Value.ofInt(12))
 * );
 * </pre>
 */
public interface Expression {

    /**
     * 获取表达式类型
     *
     * @return 表达式类型枚举
     */
    ExpressionType getType();

    /**
     * SQL表达式类型枚举
     */
    enum ExpressionType {
        /** 列引用 */
        COLUMN,
        /** 字面量 */
        LITERAL,
        /** 算术运算 */
        BINARY,
        /** 聚合函数 */
        AGGREGATE,
        /** 非聚合函数调用(可解析,不可执行) */
        FUNCTION,
        /** 星号 */
        STAR,
        /** 无法解析的片段 */
        UNPARSED
    }
}
