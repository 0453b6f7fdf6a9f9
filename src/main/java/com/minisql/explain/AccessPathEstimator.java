package com.minisql.explain;

import com.minisql.dataset.Dataset;
import com.minisql.dataset.IndexDefinition;
import com.minisql.error.SqlSyntaxException;
import com.minisql.error.UnknownTableException;
import com.minisql.error.UnsupportedFeatureException;
import com.minisql.executor.ConditionEvaluator;
import com.minisql.parser.Condition;
import com.minisql.parser.Expression;
import com.minisql.parser.OrderByItem;
import com.minisql.parser.ParseIssue;
import com.minisql.parser.ParsedQuery;
import com.minisql.parser.QueryType;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.parser.expressions.LiteralExpression;
import com.minisql.table.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * AccessPathEstimator - EXPLAIN模拟器
 *
 * 按FROM/JOIN顺序为每张表选择访问方式,估算读取行数和filtered,
 * 生成MySQL风格的EXPLAIN行和带严重程度的教学注释。
 *
 * 分类规则(按优劣挑最好的一个):
 * - JOIN目标的ON列有索引: 唯一索引 → eq_ref, 否则 → ref
 * - WHERE等值条件命中唯一索引 → const, 命中普通索引 → ref
 * - 范围条件(>, <, >=, <=, BETWEEN, IN, LIKE 'abc%')命中索引 → range
 * - 查询所需的本表列都在某个索引里(主键算在每个二级索引里) → index
 * - 否则 → ALL
 *
 * 设计原则:
 * - 启发式,不做真正的基于代价的优化
 * - 行数和代价只由CostModel计算,访问路径比较复用choose(),两边不会不一致
 *
 * MySQL对应: EXPLAIN SELECT ...
 *
 * 使用示例:
 * <pre>
 * AccessPathEstimator estimator = new AccessPathEstimator(dataset);
 * ExplainReport report = estimator.explain(parser.parse("SELECT * FROM employees WHERE id = 5"));
 * report.getRows().get(0).getType(); // CONST
 * </pre>
 */
public class AccessPathEstimator {

    private static final Logger logger = LoggerFactory.getLogger(AccessPathEstimator.class);

    public static final String USING_WHERE = "Using where";

    public static final String USING_INDEX = "Using index";

    public static final String USING_INDEX_CONDITION = "Using index condition";

    public static final String USING_FILESORT = "Using filesort";

    public static final String USING_TEMPORARY = "Using temporary";

    public static final String USING_JOIN_BUFFER = "Using join buffer (Block Nested Loop)";

    public static final String MATERIALIZED_CTE = "Materialized CTE";

    private static final long ROWS_CAUTION_THRESHOLD = 100;

    private final Dataset dataset;

    private final CostModel costModel;

    private final IndexAdvisor advisor;

    public AccessPathEstimator(Dataset dataset) {
        this(dataset, CostModel.DEFAULT);
    }

    public AccessPathEstimator(Dataset dataset, CostModel costModel) {
        if (dataset == null) {
            throw new IllegalArgumentException("Dataset cannot be null");
        }
        if (costModel == null) {
            throw new IllegalArgumentException("CostModel cannot be null");
        }
        this.dataset = dataset;
        this.costModel = costModel;
        this.advisor = new IndexAdvisor(dataset);
    }

    /**
     * 生成EXPLAIN结果
     *
     * @param query 解析后的查询
     * @return 每张表一行 + 注释
     * @throws SqlSyntaxException 无法识别的语句
     * @throws UnsupportedFeatureException 非SELECT语句
     * @throws UnknownTableException 表既不在数据集中也不是CTE
     */
    public ExplainReport explain(ParsedQuery query) {
        List<TableSource> sources = sources(query);
        if (sources.isEmpty()) {
            return new ExplainReport(List.of(), List.of(new Annotation(null, "table", "NULL",
                    "No tables used", null, AnnotationSeverity.INFO)));
        }

        String selectType = query.getCtes().isEmpty() ? "SIMPLE" : "PRIMARY";
        List<ExplainRow> rows = new ArrayList<>();
        List<Annotation> annotations = new ArrayList<>();
        for (TableSource source : sources) {
            if (source.isDerived()) {
                rows.add(new ExplainRow(source.getPosition(), "DERIVED", source.getTable(), AccessType.ALL,
                        List.of(), null, null, null, 0, CostModel.MAX_FILTERED,
                        List.of(MATERIALIZED_CTE), 0));
                annotations.add(new Annotation(source.getTable(), "select_type", "DERIVED",
                        "CTE result is materialized into a temporary table before the main query reads it",
                        null, AnnotationSeverity.INFO));
                continue;
            }

            Collection<IndexDefinition> indexes = dataset.getIndexes(source.getTable()).values();
            AccessPath path = choose(query, source, sources, indexes);
            logger.debug("Access path for {}: {}", source, path);

            List<Condition> local = source.localConditions(query, sources);
            int residual = local.size() - (path.getKeyCondition().isPresent() ? 1 : 0);
            List<String> extra = extra(query, source, sources, path, residual);
            ExplainRow row = new ExplainRow(source.getPosition(), selectType, source.getTable(), path.getType(),
                    possibleKeys(source, sources, local, indexes),
                    path.getKeyName().orElse(null),
                    path.getIndex().map(AccessPathEstimator::keyLength).orElse(null),
                    path.getRef().orElse(null),
                    path.getRows(),
                    costModel.filtered(residual),
                    extra,
                    path.getCost());
            rows.add(row);
            annotations.addAll(annotate(query, source, sources, row, local));
        }
        return new ExplainReport(rows, annotations);
    }

    /**
     * 解析查询中的表并检查它们存在
     */
    List<TableSource> sources(ParsedQuery query) {
        if (query == null) {
            throw new IllegalArgumentException("Query cannot be null");
        }
        if (query.getQueryType() == QueryType.UNKNOWN) {
            List<ParseIssue> issues = query.getParseIssues();
            if (issues.isEmpty()) {
                throw new SqlSyntaxException("Unrecognized statement");
            }
            throw new SqlSyntaxException(issues.get(0).getMessage(), issues.get(0).getNear());
        }
        if (query.getQueryType() != QueryType.SELECT) {
            throw new UnsupportedFeatureException("EXPLAIN of " + query.getQueryType() + " statements",
                    "EXPLAIN works on SELECT queries; rewrite the statement as a SELECT of the affected rows");
        }
        List<TableSource> sources = TableSource.of(query, dataset);
        for (TableSource source : sources) {
            if (!source.isDerived() && !dataset.hasTable(source.getTable())) {
                throw new UnknownTableException(source.getTable(), dataset.getTableNames());
            }
        }
        return sources;
    }

    // ==================== 访问路径选择 ====================

    /**
     * 在给定的索引集合下为一张表选择访问方式
     *
     * 访问路径比较用同一个方法分别传入空集合、单个索引和假想索引。
     */
    AccessPath choose(ParsedQuery query, TableSource source, List<TableSource> sources,
                      Collection<IndexDefinition> indexes) {
        long total = dataset.getTable(source.getTable()).size();
        Optional<Set<String>> needed = source.neededColumns(query, sources);
        Optional<String> primaryKey = source.primaryKeyColumn(dataset);

        AccessPath best = null;
        Optional<ColumnExpression> joinColumn = source.joinColumn(sources);
        if (joinColumn.isPresent()) {
            IndexDefinition index = indexOn(indexes, joinColumn.get().getColumnName());
            if (index != null) {
                AccessType type = index.isUnique() ? AccessType.EQ_REF : AccessType.REF;
                String ref = source.joinPartner(sources).map(ColumnExpression::getFullName).orElse(null);
                best = better(best, path(source, type, index, ref, null, total, needed, primaryKey));
            }
        }

        for (Condition condition : source.localConditions(query, sources)) {
            IndexDefinition index = indexOn(indexes, ((ColumnExpression) condition.getLeft()).getColumnName());
            if (index == null) {
                continue;
            }
            AccessType type = lookupType(condition, index.isUnique());
            if (type != null) {
                String ref = type.isEquality() ? "const" : null;
                best = better(best, path(source, type, index, ref, condition, total, needed, primaryKey));
            }
        }

        if (best == null && needed.isPresent()) {
            IndexDefinition coveringIndex = null;
            for (IndexDefinition index : indexes) {
                if (covers(index, primaryKey, needed.get())
                        && (coveringIndex == null || coveringIndex.isPrimary() && !index.isPrimary())) {
                    coveringIndex = index;
                }
            }
            if (coveringIndex != null) {
                best = path(source, AccessType.INDEX, coveringIndex, null, null, total, needed, primaryKey);
            }
        }

        if (best == null) {
            best = path(source, AccessType.ALL, null, null, null, total, needed, primaryKey);
        }
        return best;
    }

    private AccessPath path(TableSource source, AccessType type, IndexDefinition index, String ref,
                            Condition keyCondition, long total, Optional<Set<String>> needed,
                            Optional<String> primaryKey) {
        long rows = Math.min(costModel.estimateRows(type, total, index), Math.max(total, 1));
        boolean covering = index != null && needed.isPresent() && covers(index, primaryKey, needed.get());
        double cost = costModel.cost(type, rows, covering);
        return new AccessPath(source.getTable(), type, index, ref, keyCondition, rows, cost, covering);
    }

    private static AccessPath better(AccessPath current, AccessPath candidate) {
        if (current == null) {
            return candidate;
        }
        if (candidate.getType().isBetterThan(current.getType())) {
            return candidate;
        }
        if (candidate.getType() == current.getType() && candidate.getCost() < current.getCost()) {
            return candidate;
        }
        return current;
    }

    /**
     * 条件能以哪种方式走索引
     *
     * @param condition WHERE条件(左侧为列)
     * @param unique 索引是否唯一
     * @return 访问类型,无法利用索引时返回null
     */
    static AccessType lookupType(Condition condition, boolean unique) {
        if (!condition.isParsed() || condition.getLeft().getType() != Expression.ExpressionType.COLUMN) {
            return null;
        }
        for (Expression operand : condition.getRight()) {
            if (operand.getType() != Expression.ExpressionType.LITERAL) {
                return null;
            }
        }
        switch (condition.getOperator()) {
            case EQUAL:
                return unique ? AccessType.CONST : AccessType.REF;
            case IS_NULL:
                return AccessType.REF;
            case IN:
                if (condition.getRight().size() == 1) {
                    return unique ? AccessType.CONST : AccessType.REF;
                }
                return AccessType.RANGE;
            case GREATER_THAN:
            case GREATER_EQUAL:
            case LESS_THAN:
            case LESS_EQUAL:
            case BETWEEN:
                return AccessType.RANGE;
            case LIKE: {
                Value pattern = ((LiteralExpression) condition.getRightOperand()).getValue();
                return ConditionEvaluator.isPrefixPattern(pattern) ? AccessType.RANGE : null;
            }
            default:
                return null;
        }
    }

    /**
     * 索引是否覆盖所需的列(InnoDB二级索引的叶子里带着主键)
     */
    static boolean covers(IndexDefinition index, Optional<String> primaryKey, Set<String> needed) {
        for (String column : needed) {
            boolean inIndex = column.equals(index.getColumn())
                    || primaryKey.isPresent() && column.equals(primaryKey.get());
            if (!inIndex) {
                return false;
            }
        }
        return true;
    }

    private static IndexDefinition indexOn(Collection<IndexDefinition> indexes, String column) {
        for (IndexDefinition index : indexes) {
            if (index.getColumn().equalsIgnoreCase(column)) {
                return index;
            }
        }
        return null;
    }

    private static List<String> possibleKeys(TableSource source, List<TableSource> sources,
                                             List<Condition> local, Collection<IndexDefinition> indexes) {
        List<String> keys = new ArrayList<>();
        Optional<ColumnExpression> joinColumn = source.joinColumn(sources);
        for (IndexDefinition index : indexes) {
            boolean usable = joinColumn.isPresent()
                    && joinColumn.get().getColumnName().equalsIgnoreCase(index.getColumn());
            for (Condition condition : local) {
                String column = ((ColumnExpression) condition.getLeft()).getColumnName();
                if (column.equalsIgnoreCase(index.getColumn())) {
                    usable = true;
                }
            }
            if (usable) {
                keys.add(index.getName());
            }
        }
        return keys;
    }

    /**
     * key_len: 按索引列的值类型估算字节数,可为NULL的列多1字节
     */
    static int keyLength(IndexDefinition index) {
        int length = 4;
        for (Value value : index.getSortedValues()) {
            if (value.isNull()) {
                continue;
            }
            switch (value.getType()) {
                case INTEGER:
                    length = 4;
                    break;
                case FLOAT:
                    length = 8;
                    break;
                case BOOLEAN:
                    length = 1;
                    break;
                case DATE:
                    length = 3;
                    break;
                case DATETIME:
                    length = 5;
                    break;
                case TEXT:
                    int longest = 0;
                    for (Value v : index.getSortedValues()) {
                        if (!v.isNull()) {
                            longest = Math.max(longest, v.asText().length());
                        }
                    }
                    // utf8mb4每字符4字节 + 2字节长度前缀
                    length = longest * 4 + 2;
                    break;
                default:
                    break;
            }
            break;
        }
        return index.hasNulls() ? length + 1 : length;
    }

    // ==================== Extra ====================

    private List<String> extra(ParsedQuery query, TableSource source, List<TableSource> sources,
                               AccessPath path, int residual) {
        List<String> extra = new ArrayList<>();
        if (path.getType() == AccessType.RANGE && !path.isCovering()) {
            extra.add(USING_INDEX_CONDITION);
        }
        if (residual > 0) {
            extra.add(USING_WHERE);
        }
        if (path.isCovering()) {
            extra.add(USING_INDEX);
        }
        if (source.isFirst()) {
            if (needsTemporary(query, source, sources, path)) {
                extra.add(USING_TEMPORARY);
            }
            if (needsFilesort(query, source, sources, path)) {
                extra.add(USING_FILESORT);
            }
        } else if (path.getType() == AccessType.ALL) {
            extra.add(USING_JOIN_BUFFER);
        }
        return extra;
    }

    private static boolean needsTemporary(ParsedQuery query, TableSource source, List<TableSource> sources,
                                          AccessPath path) {
        if (!query.getGroupBy().isEmpty()) {
            if (!query.getOrderBy().isEmpty() && !sameColumns(query.getGroupBy(), query.getOrderBy())) {
                return true;
            }
            Expression first = query.getGroupBy().get(0);
            boolean groupedByKey = query.getGroupBy().size() == 1 && sources.size() == 1
                    && first instanceof ColumnExpression
                    && source.owns((ColumnExpression) first, sources)
                    && path.getIndex().map(i -> i.getColumn().equalsIgnoreCase(
                            ((ColumnExpression) first).getColumnName())).orElse(false);
            return !groupedByKey;
        }
        return query.isDistinct() && !path.isCovering();
    }

    private static boolean sameColumns(List<Expression> groupBy, List<OrderByItem> orderBy) {
        if (groupBy.size() != orderBy.size()) {
            return false;
        }
        for (int i = 0; i < groupBy.size(); i++) {
            if (!groupBy.get(i).toString().equalsIgnoreCase(orderBy.get(i).getExpression().toString())) {
                return false;
            }
        }
        return true;
    }

    private static boolean needsFilesort(ParsedQuery query, TableSource source, List<TableSource> sources,
                                         AccessPath path) {
        if (query.getOrderBy().isEmpty()) {
            return false;
        }
        Expression first = query.getOrderBy().get(0).getExpression();
        boolean orderedByKey = query.getOrderBy().size() == 1 && sources.size() == 1
                && path.getType() != AccessType.ALL
                && first instanceof ColumnExpression
                && source.owns((ColumnExpression) first, sources)
                && path.getIndex().map(i -> i.getColumn().equalsIgnoreCase(
                        ((ColumnExpression) first).getColumnName())).orElse(false);
        return !orderedByKey;
    }

    // ==================== 注释 ====================

    private List<Annotation> annotate(ParsedQuery query, TableSource source, List<TableSource> sources,
                                      ExplainRow row, List<Condition> local) {
        List<Annotation> annotations = new ArrayList<>();
        String table = source.getTable();
        Optional<String> remediation = advisor.hypotheticalColumn(query, source, sources)
                .map(column -> IndexAdvisor.createIndexSql(table, column));

        AccessType type = row.getType();
        if (type == AccessType.ALL) {
            String recommendation = remediation.orElse(local.isEmpty()
                    ? "Add a WHERE clause on an indexed column, or a LIMIT if you do not need every row"
                    : "Consider adding an index on filtered columns");
            annotations.add(new Annotation(table, "type", type.label(), type.getExplanation(),
                    recommendation, AnnotationSeverity.WARNING));
        } else if (type == AccessType.INDEX) {
            annotations.add(new Annotation(table, "type", type.label(), type.getExplanation(),
                    null, AnnotationSeverity.CAUTION));
        } else {
            annotations.add(new Annotation(table, "type", type.label(), type.getExplanation(),
                    null, AnnotationSeverity.INFO));
        }

        if (row.getKey().isPresent()) {
            annotations.add(new Annotation(table, "key", row.getKey().get(),
                    "Using index \"" + row.getKey().get() + "\" to find rows", null, AnnotationSeverity.INFO));
        } else if (!row.getPossibleKeys().isEmpty()) {
            annotations.add(new Annotation(table, "key", "NULL",
                    "No index used despite available indexes",
                    "Query conditions may not match index columns", AnnotationSeverity.CAUTION));
        } else if (!local.isEmpty()) {
            String column = ((ColumnExpression) local.get(0).getLeft()).getColumnName();
            annotations.add(new Annotation(table, "key", "NULL",
                    "No index available on filtered column '" + column + "'",
                    remediation.orElse(IndexAdvisor.createIndexSql(table, column.toLowerCase())),
                    AnnotationSeverity.WARNING));
        }

        annotations.add(new Annotation(table, "rows", String.valueOf(row.getRows()),
                "MySQL estimates examining " + row.getRows() + " rows", null,
                row.getRows() > ROWS_CAUTION_THRESHOLD ? AnnotationSeverity.CAUTION : AnnotationSeverity.INFO));

        for (String note : row.getExtra()) {
            annotations.add(extraAnnotation(query, table, sources, note, remediation));
        }
        return annotations;
    }

    private Annotation extraAnnotation(ParsedQuery query, String table, List<TableSource> sources, String note,
                                       Optional<String> remediation) {
        switch (note) {
            case USING_FILESORT:
                return new Annotation(table, "Extra", note,
                        "ORDER BY without a matching index forces an extra sorting pass",
                        orderByIndexSql(query, sources).orElse("Consider adding index that matches ORDER BY"),
                        AnnotationSeverity.CAUTION);
            case USING_TEMPORARY:
                return new Annotation(table, "Extra", note,
                        "MySQL creates a temporary table for this query",
                        "Usually caused by GROUP BY + ORDER BY on different columns",
                        AnnotationSeverity.CAUTION);
            case USING_WHERE:
                return new Annotation(table, "Extra", note,
                        "Rows are filtered after being read from table", null, AnnotationSeverity.INFO);
            case USING_INDEX:
                return new Annotation(table, "Extra", note,
                        "Covering index: every needed column is read from the index without touching table rows",
                        null, AnnotationSeverity.INFO);
            case USING_INDEX_CONDITION:
                return new Annotation(table, "Extra", note,
                        "Index condition pushdown: the range condition is checked on index entries before reading rows",
                        null, AnnotationSeverity.INFO);
            case USING_JOIN_BUFFER:
                return new Annotation(table, "Extra", note,
                        "No usable index on the join column; every row of this table is compared "
                                + "with the buffered rows of the previous tables",
                        remediation.orElse("Add an index on the join column"), AnnotationSeverity.WARNING);
            default:
                return new Annotation(table, "Extra", note, note, null, AnnotationSeverity.INFO);
        }
    }

    private Optional<String> orderByIndexSql(ParsedQuery query, List<TableSource> sources) {
        Expression first = query.getOrderBy().get(0).getExpression();
        if (!(first instanceof ColumnExpression)) {
            return Optional.empty();
        }
        ColumnExpression column = (ColumnExpression) first;
        for (TableSource source : sources) {
            if (!source.isDerived() && source.owns(column, sources)) {
                return Optional.of(IndexAdvisor.createIndexSql(source.getTable(),
                        column.getColumnName().toLowerCase()));
            }
        }
        return Optional.empty();
    }

    public Dataset getDataset() {
        return dataset;
    }

    public CostModel getCostModel() {
        return costModel;
    }

    IndexAdvisor getAdvisor() {
        return advisor;
    }
}
