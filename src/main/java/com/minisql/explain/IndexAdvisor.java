package com.minisql.explain;

import com.minisql.dataset.Dataset;
import com.minisql.dataset.IndexDefinition;
import com.minisql.parser.Condition;
import com.minisql.parser.OrderByItem;
import com.minisql.parser.ParsedQuery;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.table.Row;
import com.minisql.table.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * IndexAdvisor - 索引顾问
 *
 * 根据查询的过滤列、排序列和所需列给出CREATE INDEX建议,
 * 也为访问路径比较构造"假如建了这个索引"的假想索引。
 *
 * 建议顺序(最多3条):
 * 1. WHERE filter: 过滤列上没有索引
 * 2. ORDER BY: 排序列上没有索引
 * 3. Composite: WHERE列 + ORDER BY列
 * 4. Covering: 查询所需的2~5列
 *
 * 使用示例:
 * <pre>
 * IndexAdvisor advisor = new IndexAdvisor(dataset);
 * advisor.recommend(parser.parse("SELECT * FROM employees WHERE salary > 50000"));
 * // WHERE filter: CREATE INDEX idx_employees_salary ON employees(salary);
 * </pre>
 */
public class IndexAdvisor {

    private static final Logger logger = LoggerFactory.getLogger(IndexAdvisor.class);

    public static final int MAX_RECOMMENDATIONS = 3;

    private static final int MAX_COVERING_COLUMNS = 5;

    private final Dataset dataset;

    public IndexAdvisor(Dataset dataset) {
        if (dataset == null) {
            throw new IllegalArgumentException("Dataset cannot be null");
        }
        this.dataset = dataset;
    }

    /**
     * 索引命名: idx_表名_列1_列2
     */
    public static String indexName(String table, List<String> columns) {
        return "idx_" + table + "_" + String.join("_", columns);
    }

    public static String createIndexSql(String indexName, String table, List<String> columns) {
        return "CREATE INDEX " + indexName + " ON " + table + "(" + String.join(", ", columns) + ");";
    }

    public static String createIndexSql(String table, String column) {
        return createIndexSql(indexName(table, List.of(column)), table, List.of(column));
    }

    /**
     * 主表的索引建议
     *
     * @param query 解析后的查询
     * @return 最多3条建议,按WHERE filter, ORDER BY, Composite, Covering的顺序
     */
    public List<IndexRecommendation> recommend(ParsedQuery query) {
        List<TableSource> sources = TableSource.of(query, dataset);
        if (sources.isEmpty() || sources.get(0).isDerived()) {
            return List.of();
        }
        TableSource primary = sources.get(0);
        String table = primary.getTable();
        Set<String> indexed = indexedColumns(table);

        List<String> whereColumns = filterColumns(query, primary, sources);
        List<String> orderColumns = new ArrayList<>();
        for (OrderByItem item : query.getOrderBy()) {
            if (item.getExpression() instanceof ColumnExpression
                    && primary.owns((ColumnExpression) item.getExpression(), sources)) {
                orderColumns.add(lower(((ColumnExpression) item.getExpression()).getColumnName()));
            }
        }

        List<IndexRecommendation> recommendations = new ArrayList<>();
        for (String column : whereColumns) {
            if (!indexed.contains(column)) {
                recommendations.add(new IndexRecommendation(IndexRecommendation.Kind.WHERE_FILTER, table,
                        List.of(column), createIndexSql(table, column),
                        "Query filters on '" + column + "' - an index would speed up row lookup"));
            }
        }
        if (!orderColumns.isEmpty() && !indexed.contains(orderColumns.get(0))) {
            recommendations.add(new IndexRecommendation(IndexRecommendation.Kind.ORDER_BY, table, orderColumns,
                    createIndexSql(indexName(table, orderColumns), table, orderColumns),
                    "Index on ORDER BY columns avoids filesort"));
        }
        if (!whereColumns.isEmpty() && !orderColumns.isEmpty()) {
            Set<String> combined = new LinkedHashSet<>(whereColumns);
            combined.addAll(orderColumns);
            if (combined.size() > 1) {
                List<String> columns = new ArrayList<>(combined);
                recommendations.add(new IndexRecommendation(IndexRecommendation.Kind.COMPOSITE, table, columns,
                        createIndexSql("idx_" + table + "_composite", table, columns),
                        "Composite index covers both WHERE and ORDER BY in one index"));
            }
        }
        Optional<Set<String>> needed = primary.neededColumns(query, sources);
        if (needed.isPresent() && needed.get().size() > 1 && needed.get().size() <= MAX_COVERING_COLUMNS
                && !coveredByExistingIndex(needed.get(), primary)) {
            List<String> columns = new ArrayList<>(needed.get());
            recommendations.add(new IndexRecommendation(IndexRecommendation.Kind.COVERING, table, columns,
                    createIndexSql("idx_" + table + "_covering", table, columns),
                    "Covering index includes all needed columns - query can be answered from index alone"));
        }

        logger.debug("{} index recommendation(s) for {}", recommendations.size(), table);
        return recommendations.size() > MAX_RECOMMENDATIONS
                ? List.copyOf(recommendations.subList(0, MAX_RECOMMENDATIONS))
                : List.copyOf(recommendations);
    }

    /**
     * 为一张表构造顾问会建议的单列假想索引
     *
     * 候选列依次为: 可走索引的过滤列, JOIN列, (FROM表的)第一个ORDER BY列。
     * 已有索引的列跳过。
     */
    Optional<IndexDefinition> hypotheticalIndex(ParsedQuery query, TableSource source, List<TableSource> sources) {
        return hypotheticalColumn(query, source, sources).map(column -> {
            List<Value> values = new ArrayList<>();
            for (Row row : dataset.getTable(source.getTable())) {
                values.add(row.get(column));
            }
            return new IndexDefinition(indexName(source.getTable(), List.of(column)), column, values, false);
        });
    }

    /**
     * 顾问会为这张表建索引的列
     */
    Optional<String> hypotheticalColumn(ParsedQuery query, TableSource source, List<TableSource> sources) {
        if (source.isDerived()) {
            return Optional.empty();
        }
        Set<String> indexed = indexedColumns(source.getTable());
        List<String> candidates = new ArrayList<>(filterColumns(query, source, sources));
        source.joinColumn(sources).ifPresent(c -> candidates.add(lower(c.getColumnName())));
        if (source.isFirst() && !query.getOrderBy().isEmpty()
                && query.getOrderBy().get(0).getExpression() instanceof ColumnExpression) {
            ColumnExpression column = (ColumnExpression) query.getOrderBy().get(0).getExpression();
            if (source.owns(column, sources)) {
                candidates.add(lower(column.getColumnName()));
            }
        }
        for (String candidate : candidates) {
            if (!indexed.contains(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * 本表上索引能利用的过滤列(去重,保持出现顺序)
     */
    private List<String> filterColumns(ParsedQuery query, TableSource source, List<TableSource> sources) {
        Set<String> columns = new LinkedHashSet<>();
        for (Condition condition : source.localConditions(query, sources)) {
            if (AccessPathEstimator.lookupType(condition, false) != null) {
                columns.add(lower(((ColumnExpression) condition.getLeft()).getColumnName()));
            }
        }
        return new ArrayList<>(columns);
    }

    private boolean coveredByExistingIndex(Set<String> needed, TableSource source) {
        Optional<String> primaryKey = source.primaryKeyColumn(dataset);
        for (IndexDefinition index : dataset.getIndexes(source.getTable()).values()) {
            if (AccessPathEstimator.covers(index, primaryKey, needed)) {
                return true;
            }
        }
        return false;
    }

    private Set<String> indexedColumns(String table) {
        Set<String> columns = new LinkedHashSet<>();
        for (IndexDefinition index : dataset.getIndexes(table).values()) {
            columns.add(index.getColumn());
        }
        return columns;
    }

    private static String lower(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
