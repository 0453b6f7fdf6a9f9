package com.minisql.executor;

import com.minisql.error.NoTablesException;
import com.minisql.error.UnknownColumnException;
import com.minisql.error.UnknownTableException;
import com.minisql.parser.Condition;
import com.minisql.parser.Expression;
import com.minisql.parser.ExpressionUtils;
import com.minisql.parser.JoinClause;
import com.minisql.parser.OrderByItem;
import com.minisql.parser.ParsedQuery;
import com.minisql.parser.SelectItem;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.parser.expressions.StarExpression;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * QueryValidator - 语义校验
 *
 * 在处理任何行之前检查查询引用的表和列是否存在(数据集表 ∪ 已物化的CTE)。
 * 校验失败立即抛出带建议的异常,不浪费执行开销。
 *
 * 校验范围:
 * - FROM/JOIN中的每张表
 * - SELECT、WHERE、ON、GROUP BY、HAVING、ORDER BY中的列引用
 * - 限定列名的前缀必须是FROM/JOIN中的别名或表名
 *
 * GROUP BY、HAVING、ORDER BY可以引用SELECT列表中的别名,ORDER BY还可以引用输出列名。
 *
 * MySQL对应:
 * - Name resolution阶段(setup_tables / setup_fields),
 *   ERROR 1146 (Table doesn't exist) 和 ERROR 1054 (Unknown column)
 */
public class QueryValidator {

    /**
     * 校验查询
     *
     * @param query 解析后的查询
     * @param context 执行上下文(提供表和CTE的列)
     * @throws NoTablesException 没有FROM却引用了列
     * @throws UnknownTableException 表或前缀不存在
     * @throws UnknownColumnException 列不存在
     */
    public void validate(ParsedQuery query, ExecutionContext context) {
        if (query.isLiteralSelect()) {
            validateLiteralSelect(query);
            return;
        }

        for (String table : query.getTables()) {
            if (!context.hasTable(table)) {
                throw new UnknownTableException(table, context.getAvailableTables());
            }
        }

        Scope scope = new Scope(query, context);
        Set<String> selectAliases = selectAliases(query);

        for (SelectItem item : query.getSelectItems()) {
            Expression expression = item.getExpression();
            if (expression instanceof StarExpression) {
                String qualifier = ((StarExpression) expression).getQualifier();
                if (qualifier != null) {
                    scope.resolve(qualifier);
                }
                continue;
            }
            checkColumns(expression, scope, Set.of());
        }

        for (Condition condition : query.getWhereConditions()) {
            checkCondition(condition, scope, Set.of());
        }

        for (JoinClause join : query.getJoins()) {
            if (join.hasOnCondition()) {
                scope.check(join.getLeftColumn());
                scope.check(join.getRightColumn());
            }
        }

        for (Expression expression : query.getGroupBy()) {
            checkColumns(expression, scope, selectAliases);
        }

        for (Condition condition : query.getHavingConditions()) {
            checkCondition(condition, scope, selectAliases);
        }

        Set<String> orderNames = new HashSet<>(selectAliases);
        for (SelectItem item : query.getSelectItems()) {
            orderNames.add(item.getOutputName().toLowerCase(Locale.ROOT));
        }
        for (OrderByItem item : query.getOrderBy()) {
            checkColumns(item.getExpression(), scope, orderNames);
        }
    }

    /**
     * SELECT 1 之类的查询不能引用任何列
     */
    private static void validateLiteralSelect(ParsedQuery query) {
        for (SelectItem item : query.getSelectItems()) {
            if (item.isStar() || !ExpressionUtils.columnsOf(item.getExpression()).isEmpty()) {
                throw new NoTablesException();
            }
        }
    }

    private static Set<String> selectAliases(ParsedQuery query) {
        Set<String> aliases = new HashSet<>();
        for (SelectItem item : query.getSelectItems()) {
            if (item.getAlias() != null) {
                aliases.add(item.getAlias().toLowerCase(Locale.ROOT));
            }
        }
        return aliases;
    }

    private static void checkCondition(Condition condition, Scope scope, Set<String> allowed) {
        if (!condition.isParsed()) {
            return;
        }
        checkColumns(condition.getLeft(), scope, allowed);
        for (Expression expression : condition.getRight()) {
            checkColumns(expression, scope, allowed);
        }
    }

    private static void checkColumns(Expression expression, Scope scope, Set<String> allowed) {
        for (ColumnExpression column : ExpressionUtils.columnsOf(expression)) {
            if (!column.isQualified() && allowed.contains(column.getColumnName().toLowerCase(Locale.ROOT))) {
                continue;
            }
            scope.check(column);
        }
    }

    /**
     * 名字解析作用域: 引用名(别名/表名) → 表名 → 列
     */
    private static final class Scope {

        /** 引用名(小写) → 表名 */
        private final Map<String, String> references = new LinkedHashMap<>();

        /** 表名 → 列名 */
        private final Map<String, List<String>> columns = new LinkedHashMap<>();

        private final String primaryTable;

        private Scope(ParsedQuery query, ExecutionContext context) {
            this.primaryTable = query.getPrimaryTable().orElse(null);
            add(query.getFromReference(), primaryTable, context);
            for (JoinClause join : query.getJoins()) {
                add(join.getReference(), join.getTable(), context);
            }
        }

        private void add(String reference, String table, ExecutionContext context) {
            references.putIfAbsent(reference.toLowerCase(Locale.ROOT), table);
            references.putIfAbsent(table.toLowerCase(Locale.ROOT), table);
            columns.putIfAbsent(table, context.getColumns(table));
        }

        /**
         * 把引用名解析为表名
         */
        private String resolve(String qualifier) {
            String table = references.get(qualifier.toLowerCase(Locale.ROOT));
            if (table == null) {
                throw new UnknownTableException(qualifier, new ArrayList<>(references.keySet()));
            }
            return table;
        }

        private void check(ColumnExpression column) {
            String name = column.getColumnName();
            if (column.isQualified()) {
                String table = resolve(column.getQualifier());
                List<String> tableColumns = columns.get(table);
                if (!containsIgnoreCase(tableColumns, name)) {
                    throw new UnknownColumnException(name, table, tableColumns);
                }
                return;
            }

            List<String> all = new ArrayList<>();
            for (List<String> tableColumns : columns.values()) {
                for (String candidate : tableColumns) {
                    if (!all.contains(candidate)) {
                        all.add(candidate);
                    }
                }
            }
            if (!containsIgnoreCase(all, name)) {
                throw new UnknownColumnException(name, primaryTable, all);
            }
        }

        private static boolean containsIgnoreCase(List<String> names, String name) {
            for (String candidate : names) {
                if (candidate.equalsIgnoreCase(name)) {
                    return true;
                }
            }
            return false;
        }
    }
}
