package com.minisql.executor;

import com.minisql.config.EngineConfig;
import com.minisql.dataset.Dataset;
import com.minisql.error.EmptyQueryException;
import com.minisql.error.SqlSyntaxException;
import com.minisql.error.UnsupportedFeatureException;
import com.minisql.executor.operator.AggregateOperator;
import com.minisql.executor.operator.DistinctOperator;
import com.minisql.executor.operator.FilterOperator;
import com.minisql.executor.operator.JoinOperator;
import com.minisql.executor.operator.LimitOperator;
import com.minisql.executor.operator.ProjectOperator;
import com.minisql.executor.operator.ProjectOperator.Projection;
import com.minisql.executor.operator.ScanOperator;
import com.minisql.executor.operator.SingleRowOperator;
import com.minisql.executor.operator.SortOperator;
import com.minisql.executor.operator.SortOperator.SortKey;
import com.minisql.executor.operator.StageOperator;
import com.minisql.parser.Condition;
import com.minisql.parser.Expression;
import com.minisql.parser.ExpressionUtils;
import com.minisql.parser.JoinClause;
import com.minisql.parser.OrderByItem;
import com.minisql.parser.ParseIssue;
import com.minisql.parser.ParsedQuery;
import com.minisql.parser.QueryType;
import com.minisql.parser.SQLParser;
import com.minisql.parser.SelectItem;
import com.minisql.parser.UnsupportedFeature;
import com.minisql.parser.expressions.AggregateExpression;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.parser.expressions.LiteralExpression;
import com.minisql.parser.expressions.StarExpression;
import com.minisql.result.ExecutionStage;
import com.minisql.result.QueryResult;
import com.minisql.table.Row;
import com.minisql.table.Value;
import com.minisql.table.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * QueryExecutor - 查询执行器
 *
 * 基于火山模型(Volcano Model)的SQL执行引擎: 解析 → 校验 → 构建算子树 → 拉取结果。
 *
 * 执行顺序按SQL的逻辑语义,而不是书写顺序:
 * <pre>
 * WITH (物化CTE) → 校验表和列 → FROM → JOIN → WHERE → GROUP BY → HAVING
 *     → ORDER BY → LIMIT → SELECT
 * </pre>
 * SELECT DISTINCT时改为 SELECT → DISTINCT → ORDER BY → LIMIT。
 *
 * 算子树示例:
 * <pre>
 * SQL: SELECT dept, COUNT(*) FROM employees WHERE salary > 50000
 *      GROUP BY dept HAVING COUNT(*) > 2 ORDER BY dept LIMIT 5
 *
 * ProjectOperator([dept, COUNT(*)])
 *   └─ LimitOperator(5)
 *       └─ SortOperator(dept ASC)
 *           └─ FilterOperator(COUNT(*) > 2)
 *               └─ AggregateOperator(GROUP BY dept)
 *                   └─ FilterOperator(salary > 50000)
 *                       └─ ScanOperator(employees)
 * </pre>
 *
 * 错误处理:
 * - 语法错误、不支持的功能、未知的表和列: 在处理任何行之前抛出
 * - 单行比较的类型不匹配: 按"不匹配"处理,不中断查询
 *
 * 每次execute创建新的ExecutionContext,查询之间不共享可变状态。
 *
 * MySQL对应:
 * - sql_select.cc中的JOIN::exec,火山模型迭代器执行
 *
 * 使用示例:
 * <pre>
 * QueryExecutor executor = new QueryExecutor(dataset, EngineConfig.defaults());
 * QueryResult result = executor.execute("SELECT name FROM employees WHERE salary > 50000");
 * </pre>
 */
public class QueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private static final String READ_ONLY_ALTERNATIVE =
            "Only SELECT queries can be executed; the dataset is read-only";

    private final Dataset dataset;

    private final EngineConfig config;

    private final SQLParser parser = new SQLParser();

    private final QueryValidator validator = new QueryValidator();

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    private final ConditionEvaluator conditionEvaluator = new ConditionEvaluator(evaluator);

    private final CteEvaluator cteEvaluator = new CteEvaluator(parser, this::executeSubquery);

    public QueryExecutor(Dataset dataset) {
        this(dataset, EngineConfig.defaults());
    }

    public QueryExecutor(Dataset dataset, EngineConfig config) {
        if (dataset == null) {
            throw new IllegalArgumentException("Dataset cannot be null");
        }
        this.dataset = dataset;
        this.config = config != null ? config : EngineConfig.defaults();
    }

    /**
     * 执行SQL查询
     *
     * @param sql SQL语句
     * @return 查询结果
     * @throws com.minisql.error.QueryException 查询无法执行
     */
    public QueryResult execute(String sql) {
        long start = System.nanoTime();
        if (sql == null || sql.trim().isEmpty()) {
            throw new EmptyQueryException();
        }

        ParsedQuery query = parser.parse(sql);
        ExecutionContext context = new ExecutionContext(dataset, config);
        List<ExecutionStage> stages = new ArrayList<>();
        RowSet rows = executeQuery(query, context, stages);

        double elapsedMillis = (System.nanoTime() - start) / 1_000_000.0;
        logger.debug("Query returned {} rows in {} ms", rows.size(), elapsedMillis);
        return new QueryResult(rows.getColumns(), rows.getRows(), elapsedMillis, sql,
                context.getWarnings(), context.getCteInfo(), stages);
    }

    /**
     * CTE查询体的执行入口(与主查询共享执行上下文)
     */
    RowSet executeSubquery(String sql, ExecutionContext context) {
        return executeQuery(parser.parse(sql), context, new ArrayList<>());
    }

    private RowSet executeQuery(ParsedQuery query, ExecutionContext context, List<ExecutionStage> stages) {
        checkStatement(query);
        if (!query.getCtes().isEmpty()) {
            cteEvaluator.evaluate(query.getCtes(), context);
        }
        validator.validate(query, context);
        return run(query, context, stages);
    }

    /**
     * 在执行前把解析阶段记录的问题转换为异常
     */
    static void checkStatement(ParsedQuery query) {
        if (query.getQueryType() == QueryType.UNKNOWN) {
            List<ParseIssue> issues = query.getParseIssues();
            if (issues.isEmpty()) {
                throw new SqlSyntaxException("Unrecognized statement");
            }
            throw new SqlSyntaxException(issues.get(0).getMessage(), issues.get(0).getNear());
        }
        if (query.getQueryType() != QueryType.SELECT) {
            throw new UnsupportedFeatureException(query.getQueryType() + " statements", READ_ONLY_ALTERNATIVE);
        }
        if (!query.getUnsupportedFeatures().isEmpty()) {
            UnsupportedFeature feature = query.getUnsupportedFeatures().get(0);
            throw new UnsupportedFeatureException(feature.getFeature(), feature.getAlternative());
        }
        if (!query.getParseIssues().isEmpty()) {
            ParseIssue issue = query.getParseIssues().get(0);
            throw new SqlSyntaxException(issue.getMessage(), issue.getNear());
        }
    }

    // ==================== 算子树构建 ====================

    /**
     * 构建算子树并拉取所有结果行
     */
    private RowSet run(ParsedQuery query, ExecutionContext context, List<ExecutionStage> stages) {
        int sampleSize = config.getStageSampleSize();
        List<StageOperator> recorded = new ArrayList<>();

        Operator current;
        List<String> keys;
        if (query.isLiteralSelect()) {
            current = new SingleRowOperator();
            keys = List.of();
        } else {
            String table = query.getPrimaryTable().orElseThrow();
            ScanOperator scan = new ScanOperator(query.getFromAlias().orElse(null), table,
                    context.getColumns(table), context.getRows(table));
            keys = scan.outputKeys();
            int tableRows = scan.getRowCount();
            current = stage(scan, "FROM", "FROM " + table + query.getFromAlias().map(a -> " " + a).orElse(""),
                    tableRows, recorded, sampleSize);

            for (JoinClause join : query.getJoins()) {
                ScanOperator right = new ScanOperator(join.getAlias().orElse(null), join.getTable(),
                        context.getColumns(join.getTable()), context.getRows(join.getTable()));
                JoinOperator joinOperator = new JoinOperator(current, keys, right, join, evaluator);
                keys = joinOperator.outputKeys();
                current = stage(joinOperator, "JOIN", joinText(join), recorded, sampleSize);
            }
        }

        if (!query.getWhereConditions().isEmpty()) {
            current = stage(new FilterOperator(current, query.getWhereConditions(), conditionEvaluator),
                    "WHERE", "WHERE " + conditionText(query.getWhereConditions()), recorded, sampleSize);
        }

        if (query.isAggregation()) {
            AggregateOperator aggregate = new AggregateOperator(current, query.getGroupBy(),
                    collectAggregates(query), query.getSelectItems(), evaluator);
            String clause = query.getGroupBy().isEmpty()
                    ? "(implicit single group)"
                    : "GROUP BY " + query.getGroupBy().stream().map(Object::toString).collect(Collectors.joining(", "));
            current = stage(aggregate, "GROUP BY", clause, recorded, sampleSize);
        }

        if (!query.getHavingConditions().isEmpty()) {
            current = stage(new FilterOperator(current, query.getHavingConditions(), conditionEvaluator),
                    "HAVING", "HAVING " + conditionText(query.getHavingConditions()), recorded, sampleSize);
        }

        List<Projection> projections = projections(query, context);
        String selectText = "SELECT " + (query.isDistinct() ? "DISTINCT " : "")
                + query.getSelectItems().stream().map(SelectItem::toString).collect(Collectors.joining(", "));
        ProjectOperator project;

        if (query.isDistinct()) {
            project = new ProjectOperator(current, projections, evaluator, context);
            current = stage(project, "SELECT", selectText, recorded, sampleSize);
            current = stage(new DistinctOperator(current), "DISTINCT", "DISTINCT", recorded, sampleSize);
            current = orderAndLimit(query, current, sortKeysAfterProjection(query, projections),
                    recorded, sampleSize);
        } else {
            current = orderAndLimit(query, current, sortKeysBeforeProjection(query, projections),
                    recorded, sampleSize);
            project = new ProjectOperator(current, projections, evaluator, context);
            current = stage(project, "SELECT", selectText, recorded, sampleSize);
        }
        logger.debug("Operator tree: {}", current);

        List<Row> rows = new ArrayList<>();
        while (current.hasNext()) {
            rows.add(current.next());
        }
        current.close();

        for (StageOperator stage : recorded) {
            stages.add(stage.toStage());
        }
        return new RowSet(project.getColumnNames(), rows);
    }

    private Operator orderAndLimit(ParsedQuery query, Operator current, List<SortKey> sortKeys,
                                   List<StageOperator> recorded, int sampleSize) {
        if (!sortKeys.isEmpty()) {
            String clause = "ORDER BY " + query.getOrderBy().stream()
                    .map(OrderByItem::toString).collect(Collectors.joining(", "));
            current = stage(new SortOperator(current, sortKeys, evaluator), "ORDER BY", clause, recorded, sampleSize);
        }
        if (query.getLimit().isPresent() || query.getOffset().isPresent()) {
            Integer limit = query.getLimit().orElse(null);
            int offset = query.getOffset().orElse(0);
            String clause = "LIMIT " + (limit != null ? limit : "ALL") + (offset > 0 ? " OFFSET " + offset : "");
            current = stage(new LimitOperator(current, limit, offset), "LIMIT", clause, recorded, sampleSize);
        }
        return current;
    }

    /**
     * 包装阶段记录算子,输入行数取上一阶段的输出行数
     */
    private static StageOperator stage(Operator operator, String name, String clause,
                                       List<StageOperator> recorded, int sampleSize) {
        StageOperator previous = recorded.isEmpty() ? null : recorded.get(recorded.size() - 1);
        StageOperator stage = new StageOperator(operator, name, clause,
                () -> previous != null ? previous.getOutputRows() : 1, sampleSize);
        recorded.add(stage);
        return stage;
    }

    private static StageOperator stage(Operator operator, String name, String clause, int inputRows,
                                       List<StageOperator> recorded, int sampleSize) {
        StageOperator stage = new StageOperator(operator, name, clause, () -> inputRows, sampleSize);
        recorded.add(stage);
        return stage;
    }

    private static String joinText(JoinClause join) {
        StringBuilder text = new StringBuilder(join.getJoinType() + " JOIN " + join.getTable());
        join.getAlias().ifPresent(alias -> text.append(' ').append(alias));
        if (join.getOnText() != null) {
            text.append(" ON ").append(join.getOnText());
        }
        return text.toString();
    }

    private static String conditionText(List<Condition> conditions) {
        return conditions.stream().map(Condition::getText).collect(Collectors.joining(" AND "));
    }

    /**
     * SELECT、HAVING、ORDER BY中用到的所有聚合
     */
    private static List<AggregateExpression> collectAggregates(ParsedQuery query) {
        List<AggregateExpression> aggregates = new ArrayList<>();
        for (SelectItem item : query.getSelectItems()) {
            aggregates.addAll(ExpressionUtils.aggregatesOf(item.getExpression()));
        }
        for (Condition condition : query.getHavingConditions()) {
            if (condition.isParsed()) {
                aggregates.addAll(ExpressionUtils.aggregatesOf(condition.getLeft()));
                for (Expression expression : condition.getRight()) {
                    aggregates.addAll(ExpressionUtils.aggregatesOf(expression));
                }
            }
        }
        for (OrderByItem item : query.getOrderBy()) {
            aggregates.addAll(ExpressionUtils.aggregatesOf(item.getExpression()));
        }
        return aggregates;
    }

    // ==================== 投影 ====================

    /**
     * 展开SELECT列表: * 展开为表的列,重复的输出列名只保留第一个
     */
    private static List<Projection> projections(ParsedQuery query, ExecutionContext context) {
        List<Projection> projections = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();
        boolean joined = !query.getJoins().isEmpty();

        for (SelectItem item : query.getSelectItems()) {
            if (!(item.getExpression() instanceof StarExpression)) {
                addProjection(projections, names, new Projection(item.getOutputName(), item.getExpression()));
                continue;
            }

            String qualifier = ((StarExpression) item.getExpression()).getQualifier();
            if (qualifier != null) {
                String table = query.resolveTable(qualifier);
                for (String column : context.getColumns(table)) {
                    addProjection(projections, names,
                            new Projection(column, new ColumnExpression(List.of(qualifier, column))));
                }
            } else if (!joined) {
                for (String column : context.getColumns(query.getPrimaryTable().orElseThrow())) {
                    addProjection(projections, names, new Projection(column, new ColumnExpression(column)));
                }
            } else {
                addQualifiedColumns(projections, names, query.getFromReference(),
                        context.getColumns(query.getPrimaryTable().orElseThrow()));
                for (JoinClause join : query.getJoins()) {
                    addQualifiedColumns(projections, names, join.getReference(), context.getColumns(join.getTable()));
                }
            }
        }
        return projections;
    }

    private static void addQualifiedColumns(List<Projection> projections, Set<String> names,
                                            String reference, List<String> columns) {
        for (String column : columns) {
            addProjection(projections, names,
                    new Projection(reference + "." + column, new ColumnExpression(List.of(reference, column))));
        }
    }

    private static void addProjection(List<Projection> projections, Set<String> names, Projection projection) {
        if (names.add(projection.getName().toLowerCase())) {
            projections.add(projection);
        }
    }

    // ==================== 排序键 ====================

    /**
     * 投影前排序: 别名和序号解析为SELECT列表中的表达式
     */
    private static List<SortKey> sortKeysBeforeProjection(ParsedQuery query, List<Projection> projections) {
        List<SortKey> keys = new ArrayList<>();
        for (OrderByItem item : query.getOrderBy()) {
            Expression expression = item.getExpression();
            Projection projection = matchProjection(expression, projections);
            if (projection != null) {
                expression = projection.getExpression();
            }
            keys.add(new SortKey(expression, item.isDescending()));
        }
        return keys;
    }

    /**
     * 投影后排序(DISTINCT): 排序键只能读取输出列
     */
    private static List<SortKey> sortKeysAfterProjection(ParsedQuery query, List<Projection> projections) {
        List<SortKey> keys = new ArrayList<>();
        for (OrderByItem item : query.getOrderBy()) {
            Projection projection = matchProjection(item.getExpression(), projections);
            if (projection == null) {
                for (Projection candidate : projections) {
                    if (candidate.getExpression().toString().equalsIgnoreCase(item.getExpression().toString())) {
                        projection = candidate;
                        break;
                    }
                }
            }
            String name = projection != null ? projection.getName() : item.getExpression().toString();
            keys.add(new SortKey(new ColumnExpression(name), item.isDescending()));
        }
        return keys;
    }

    /**
     * ORDER BY项对应的输出列: 整数序号(ORDER BY 2)或输出列名/别名
     */
    private static Projection matchProjection(Expression expression, List<Projection> projections) {
        if (expression instanceof LiteralExpression) {
            Value value = ((LiteralExpression) expression).getValue();
            if (value.getType() == ValueType.INTEGER) {
                long ordinal = value.asLong();
                if (ordinal >= 1 && ordinal <= projections.size()) {
                    return projections.get((int) ordinal - 1);
                }
            }
            return null;
        }
        if (expression instanceof ColumnExpression) {
            String name = ((ColumnExpression) expression).getFullName();
            for (Projection projection : projections) {
                if (projection.getName().equalsIgnoreCase(name)) {
                    return projection;
                }
            }
        }
        return null;
    }

    public Dataset getDataset() {
        return dataset;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public SQLParser getParser() {
        return parser;
    }
}
