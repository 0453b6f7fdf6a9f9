package com.minisql.parser.expressions;

import com.minisql.parser.Expression;

import java.util.List;

/**
 * ColumnExpression - 列引用表达式
 *
 * 表示对表中列的引用,支持带表名或别名前缀:
 * - 简单列引用: id, name, salary
 * - 带前缀: employees.id, e.department_id
 *
 * 设计原则:
 * - 不可变对象
 * - 统一表示: 多级列名用List存储,消除特殊情况
 */
public class ColumnExpression implements Expression {

    /** 列名(可能包含表名前缀,如["e", "id"]) */
    private final List<String> columnNameParts;

    public ColumnExpression(String columnName) {
        this.columnNameParts = List.of(columnName);
    }

    public ColumnExpression(List<String> columnNameParts) {
        if (columnNameParts.isEmpty()) {
            throw new IllegalArgumentException("Column name cannot be empty");
        }
        this.columnNameParts = List.copyOf(columnNameParts);
    }

    /**
     * 获取列名(不含前缀)
     */
    public String getColumnName() {
        return columnNameParts.get(columnNameParts.size() - 1);
    }

    /**
     * 获取前缀(表名或别名)
     *
     * @return 前缀,如果没有则返回null
     */
    public String getQualifier() {
        return columnNameParts.size() > 1 ? columnNameParts.get(columnNameParts.size() - 2) : null;
    }

    public boolean isQualified() {
        return columnNameParts.size() > 1;
    }

    /**
     * 获取完整的列名(包含前缀)
     *
     * @return 完整列名,如"e.id"
     */
    public String getFullName() {
        return String.join(".", columnNameParts);
    }

    public List<String> getColumnNameParts() {
        return columnNameParts;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.COLUMN;
    }

    @Override
    public String toString() {
        return getFullName();
    }
}
