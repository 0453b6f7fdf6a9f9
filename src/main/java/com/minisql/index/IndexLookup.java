package com.minisql.index;

import com.minisql.config.CommonConstant;
import com.minisql.dataset.Dataset;
import com.minisql.error.UnknownColumnException;
import com.minisql.error.UnknownTableException;
import com.minisql.error.UnsupportedFeatureException;
import com.minisql.parser.Condition;
import com.minisql.parser.Expression;
import com.minisql.parser.ParsedQuery;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.parser.expressions.LiteralExpression;
import com.minisql.parser.expressions.Operator;
import com.minisql.table.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * IndexLookup - 在数据集的一列上建索引并执行一次查找
 *
 * 演示索引查找和全表扫描的差异:
 * 1. 为表的一列构建B+树(跳过NULL)
 * 2. 等值条件走search(),范围条件(>, >=, &lt;, &lt;=, BETWEEN)走rangeSearch()
 * 3. 报告B+树访问的节点数和全表扫描需要的比较次数
 *
 * 等值查找在非唯一列上返回所有匹配的行ID(用范围[v, v]扫描)。
 *
 * 使用示例:
 * <pre>
 * IndexLookup lookup = new IndexLookup(dataset, 4);
 * LookupResult result = lookup.lookup("employees", "salary", Operator.GREATER_EQUAL, Value.ofInt(70000));
 * result.getEfficiency(); // "90% fewer comparisons"
 * </pre>
 */
public class IndexLookup {

    private static final Logger logger = LoggerFactory.getLogger(IndexLookup.class);

    private final Dataset dataset;

    private final int order;

    public IndexLookup(Dataset dataset, int order) {
        if (dataset == null) {
            throw new IllegalArgumentException("Dataset cannot be null");
        }
        this.dataset = dataset;
        this.order = order;
    }

    /**
     * 构建一列的索引
     *
     * @throws UnknownTableException 表不存在
     * @throws UnknownColumnException 列不存在
     */
    public BTree buildIndex(String table, String column) {
        checkColumn(table, column);
        return BTreeIndexBuilder.fromColumn(dataset.getTable(table), column, order);
    }

    /**
     * 单值条件查找
     *
     * @param table 表名
     * @param column 列名
     * @param operator =, &gt;, &gt;=, &lt;, &lt;=
     * @param value 比较值
     */
    public LookupResult lookup(String table, String column, Operator operator, Value value) {
        BTree tree = buildIndex(table, column);
        int rows = dataset.getTable(table).size();
        String predicate = column + " " + operator.getSymbol() + " " + value.toSqlLiteral();

        switch (operator) {
            case EQUAL: {
                SearchResult hit = tree.search(value);
                List<IndexEntry> matches = new ArrayList<>();
                if (hit.isFound()) {
                    matches.addAll(tree.rangeSearch(value, value).getEntries());
                }
                return result(table, column, predicate, tree, matches, hit.getTrace(), rows);
            }
            case GREATER_THAN:
                return range(table, column, predicate, tree, tree.rangeSearch(value, false, null, false), rows);
            case GREATER_EQUAL:
                return range(table, column, predicate, tree, tree.rangeSearch(value, true, null, false), rows);
            case LESS_THAN:
                return range(table, column, predicate, tree, tree.rangeSearch(null, false, value, false), rows);
            case LESS_EQUAL:
                return range(table, column, predicate, tree, tree.rangeSearch(null, false, value, true), rows);
            default:
                throw new UnsupportedFeatureException("Index lookup with " + operator.getSymbol(),
                        "Use =, >, >=, <, <= or BETWEEN on the indexed column");
        }
    }

    /**
     * BETWEEN low AND high 查找
     */
    public LookupResult lookupBetween(String table, String column, Value low, Value high) {
        BTree tree = buildIndex(table, column);
        String predicate = column + " BETWEEN " + low.toSqlLiteral() + " AND " + high.toSqlLiteral();
        return range(table, column, predicate, tree, tree.rangeSearch(low, high), dataset.getTable(table).size());
    }

    /**
     * 按查询的第一个WHERE条件查找;没有可用条件时只构建主键列(id)的索引
     *
     * @param query 解析后的查询
     */
    public LookupResult lookup(ParsedQuery query) {
        String table = query.getPrimaryTable()
                .orElseThrow(() -> new UnknownTableException("", dataset.getTableNames()));

        for (Condition condition : query.getWhereConditions()) {
            if (!condition.isParsed() || !(condition.getLeft() instanceof ColumnExpression)) {
                continue;
            }
            String column = ((ColumnExpression) condition.getLeft()).getColumnName();
            List<Value> values = literals(condition.getRight());
            if (values == null) {
                continue;
            }
            Operator operator = condition.getOperator();
            if (operator == Operator.BETWEEN) {
                return lookupBetween(table, column, values.get(0), values.get(1));
            }
            if (operator == Operator.EQUAL || operator.isRange()) {
                return lookup(table, column, operator, values.get(0));
            }
        }

        String column = CommonConstant.ROW_ID_COLUMN;
        BTree tree = buildIndex(table, column);
        logger.debug("No indexable predicate, built index on {}.{}", table, column);
        return result(table, column, null, tree, List.of(), List.of(), dataset.getTable(table).size());
    }

    private static List<Value> literals(List<Expression> expressions) {
        List<Value> values = new ArrayList<>();
        for (Expression expression : expressions) {
            if (!(expression instanceof LiteralExpression) || ((LiteralExpression) expression).isNull()) {
                return null;
            }
            values.add(((LiteralExpression) expression).getValue());
        }
        return values.isEmpty() ? null : values;
    }

    private LookupResult range(String table, String column, String predicate, BTree tree,
                               RangeResult range, int rows) {
        return result(table, column, predicate, tree, range.getEntries(), range.getTrace(), rows);
    }

    private LookupResult result(String table, String column, String predicate, BTree tree,
                                List<IndexEntry> matches, List<TraversalStep> trace, int rows) {
        LookupResult result = new LookupResult(table, column, predicate, tree, matches, trace, rows);
        logger.debug("Index lookup {}", result);
        return result;
    }

    private void checkColumn(String table, String column) {
        if (!dataset.hasTable(table)) {
            throw new UnknownTableException(table, dataset.getTableNames());
        }
        List<String> columns = dataset.getTableColumns(table);
        for (String candidate : columns) {
            if (candidate.equalsIgnoreCase(column)) {
                return;
            }
        }
        throw new UnknownColumnException(column, table, columns);
    }
}
