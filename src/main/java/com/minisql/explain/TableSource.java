package com.minisql.explain;

import com.minisql.dataset.Dataset;
import com.minisql.dataset.IndexDefinition;
import com.minisql.parser.Condition;
import com.minisql.parser.CteDefinition;
import com.minisql.parser.Expression;
import com.minisql.parser.ExpressionUtils;
import com.minisql.parser.JoinClause;
import com.minisql.parser.OrderByItem;
import com.minisql.parser.ParsedQuery;
import com.minisql.parser.SelectItem;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.parser.expressions.StarExpression;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * TableSource - 查询中出现的一张表(FROM表或JOIN目标)
 *
 * 负责把列引用归属到表: 带前缀的列按别名/表名匹配,
 * 不带前缀的列归属到第一张含有该列的表。
 */
final class TableSource {

    /** 从1开始的位置,即EXPLAIN的id */
    private final int position;

    private final String table;

    private final String reference;

    /** FROM表为null */
    private final JoinClause join;

    /** 是否引用的是CTE */
    private final boolean derived;

    private final List<String> columns;

    private TableSource(int position, String table, String reference, JoinClause join,
                        boolean derived, List<String> columns) {
        this.position = position;
        this.table = table;
        this.reference = reference;
        this.join = join;
        this.derived = derived;
        this.columns = columns;
    }

    /**
     * 按FROM/JOIN顺序列出查询中的表
     */
    static List<TableSource> of(ParsedQuery query, Dataset dataset) {
        List<TableSource> sources = new ArrayList<>();
        if (query.isLiteralSelect()) {
            return sources;
        }
        String primary = query.getPrimaryTable().orElseThrow();
        sources.add(create(1, primary, query.getFromReference(), null, query, dataset));
        int position = 2;
        for (JoinClause join : query.getJoins()) {
            sources.add(create(position++, join.getTable().toLowerCase(Locale.ROOT),
                    join.getReference(), join, query, dataset));
        }
        return sources;
    }

    private static TableSource create(int position, String table, String reference, JoinClause join,
                                      ParsedQuery query, Dataset dataset) {
        boolean derived = !dataset.hasTable(table) && isCte(query, table);
        List<String> columns = derived ? List.of() : dataset.getTableColumns(table);
        return new TableSource(position, table, reference, join, derived, columns);
    }

    static boolean isCte(ParsedQuery query, String table) {
        for (CteDefinition cte : query.getCtes()) {
            if (cte.getName().equalsIgnoreCase(table)) {
                return true;
            }
        }
        return false;
    }

    int getPosition() {
        return position;
    }

    String getTable() {
        return table;
    }

    String getReference() {
        return reference;
    }

    Optional<JoinClause> getJoin() {
        return Optional.ofNullable(join);
    }

    boolean isFirst() {
        return position == 1;
    }

    boolean isDerived() {
        return derived;
    }

    boolean hasColumn(String column) {
        return columns.contains(column.toLowerCase(Locale.ROOT));
    }

    /**
     * 列引用是否属于这张表
     */
    boolean owns(ColumnExpression column, List<TableSource> sources) {
        if (column.isQualified()) {
            String qualifier = column.getQualifier();
            return qualifier.equalsIgnoreCase(reference) || qualifier.equalsIgnoreCase(table);
        }
        for (TableSource source : sources) {
            if (source.hasColumn(column.getColumnName())) {
                return source == this;
            }
        }
        return false;
    }

    /**
     * 左侧是本表列的WHERE条件
     */
    List<Condition> localConditions(ParsedQuery query, List<TableSource> sources) {
        List<Condition> local = new ArrayList<>();
        for (Condition condition : query.getWhereConditions()) {
            if (!condition.isParsed() || condition.getLeft().getType() != Expression.ExpressionType.COLUMN) {
                continue;
            }
            if (owns((ColumnExpression) condition.getLeft(), sources)) {
                local.add(condition);
            }
        }
        return local;
    }

    /**
     * JOIN的ON条件中属于本表的列
     */
    Optional<ColumnExpression> joinColumn(List<TableSource> sources) {
        if (join == null || !join.hasOnCondition()) {
            return Optional.empty();
        }
        if (owns(join.getRightColumn(), sources)) {
            return Optional.of(join.getRightColumn());
        }
        if (owns(join.getLeftColumn(), sources)) {
            return Optional.of(join.getLeftColumn());
        }
        return Optional.empty();
    }

    /**
     * JOIN的ON条件中另一侧的列
     */
    Optional<ColumnExpression> joinPartner(List<TableSource> sources) {
        return joinColumn(sources).map(own -> own == join.getRightColumn()
                ? join.getLeftColumn() : join.getRightColumn());
    }

    /**
     * 查询用到的本表列(小写)
     *
     * @return 列集合; SELECT * 或本表的 q.* 时返回empty(需要整行,无法覆盖)
     */
    Optional<Set<String>> neededColumns(ParsedQuery query, List<TableSource> sources) {
        List<Expression> expressions = new ArrayList<>();
        for (SelectItem item : query.getSelectItems()) {
            if (item.isStar()) {
                String qualifier = ((StarExpression) item.getExpression()).getQualifier();
                if (qualifier == null || qualifier.equalsIgnoreCase(reference) || qualifier.equalsIgnoreCase(table)) {
                    return Optional.empty();
                }
                continue;
            }
            expressions.add(item.getExpression());
        }
        for (Condition condition : query.getWhereConditions()) {
            expressions.add(condition.getLeft());
            expressions.addAll(condition.getRight());
        }
        for (Condition condition : query.getHavingConditions()) {
            expressions.add(condition.getLeft());
            expressions.addAll(condition.getRight());
        }
        expressions.addAll(query.getGroupBy());
        for (OrderByItem item : query.getOrderBy()) {
            expressions.add(item.getExpression());
        }
        for (JoinClause clause : query.getJoins()) {
            if (clause.hasOnCondition()) {
                expressions.add(clause.getLeftColumn());
                expressions.add(clause.getRightColumn());
            }
        }

        Set<String> needed = new LinkedHashSet<>();
        for (Expression expression : expressions) {
            for (ColumnExpression column : ExpressionUtils.columnsOf(expression)) {
                if (owns(column, sources)) {
                    needed.add(column.getColumnName().toLowerCase(Locale.ROOT));
                }
            }
        }
        return Optional.of(needed);
    }

    /**
     * 表的主键列
     */
    Optional<String> primaryKeyColumn(Dataset dataset) {
        for (IndexDefinition index : dataset.getIndexes(table).values()) {
            if (index.isPrimary()) {
                return Optional.of(index.getColumn());
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return reference.equals(table) ? table : table + " " + reference;
    }
}
