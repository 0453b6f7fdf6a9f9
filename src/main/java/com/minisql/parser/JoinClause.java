package com.minisql.parser;

import com.minisql.parser.expressions.ColumnExpression;

import java.util.Optional;

/**
 * JoinClause - JOIN子句
 *
 * 只支持单个等值ON条件: ON a.x = b.y。
 * 没有ON条件的JOIN按笛卡尔积处理。
 */
public class JoinClause {

    /**
     * JOIN类型
     */
    public enum JoinType {
        INNER,
        LEFT,
        RIGHT,
        CROSS
    }

    private final JoinType joinType;

    private final String table;

    private final String alias;

    /** ON左侧列(可能为null) */
    private final ColumnExpression leftColumn;

    /** ON右侧列(可能为null) */
    private final ColumnExpression rightColumn;

    /** ON条件原文(可能为null) */
    private final String onText;

    public JoinClause(JoinType joinType, String table, String alias,
                      ColumnExpression leftColumn, ColumnExpression rightColumn, String onText) {
        if (table == null || table.isEmpty()) {
            throw new IllegalArgumentException("Join table cannot be empty");
        }
        this.joinType = joinType;
        this.table = table;
        this.alias = alias;
        this.leftColumn = leftColumn;
        this.rightColumn = rightColumn;
        this.onText = onText;
    }

    public JoinType getJoinType() {
        return joinType;
    }

    public String getTable() {
        return table;
    }

    public Optional<String> getAlias() {
        return Optional.ofNullable(alias);
    }

    /**
     * 在查询中引用这个表的名字: 别名优先
     */
    public String getReference() {
        return alias != null ? alias : table;
    }

    public boolean hasOnCondition() {
        return leftColumn != null && rightColumn != null;
    }

    public ColumnExpression getLeftColumn() {
        return leftColumn;
    }

    public ColumnExpression getRightColumn() {
        return rightColumn;
    }

    public String getOnText() {
        return onText;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(joinType.name()).append(" JOIN ").append(table);
        if (alias != null) {
            sb.append(' ').append(alias);
        }
        if (hasOnCondition()) {
            sb.append(" ON ").append(leftColumn).append(" = ").append(rightColumn);
        }
        return sb.toString();
    }
}
