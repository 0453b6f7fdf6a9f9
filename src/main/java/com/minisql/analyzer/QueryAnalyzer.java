package com.minisql.analyzer;

import com.minisql.dataset.Dataset;
import com.minisql.error.EmptyQueryException;
import com.minisql.error.QueryException;
import com.minisql.executor.QueryExecutor;
import com.minisql.explain.AccessPathEstimator;
import com.minisql.explain.AccessType;
import com.minisql.explain.ExplainReport;
import com.minisql.explain.ExplainRow;
import com.minisql.explain.IndexAdvisor;
import com.minisql.explain.IndexRecommendation;
import com.minisql.parser.Condition;
import com.minisql.parser.Expression;
import com.minisql.parser.ExpressionUtils;
import com.minisql.parser.OrderByItem;
import com.minisql.parser.ParsedQuery;
import com.minisql.parser.SelectItem;
import com.minisql.parser.UnsupportedFeature;
import com.minisql.parser.expressions.AggregateExpression;
import com.minisql.parser.expressions.FunctionExpression;
import com.minisql.parser.expressions.LiteralExpression;
import com.minisql.parser.expressions.Operator;
import com.minisql.result.QueryOutcome;
import com.minisql.result.QueryResult;
import com.minisql.table.Value;
import com.minisql.table.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * QueryAnalyzer - 查询分析器
 *
 * 把执行、反模式检测、EXPLAIN和索引建议合成一份报告。
 * 执行失败不会中断分析: 错误放进QueryOutcome,其余部分照常生成。
 *
 * 检测的反模式:
 * - SELECT * (WARNING)
 * - 列上的函数 (ERROR, 索引失效)
 * - 前导通配符LIKE (ERROR, 索引失效)
 * - OR条件 (WARNING)
 * - NOT IN (WARNING)
 * - ORDER BY没有LIMIT (WARNING)
 * - DISTINCT (INFO)
 * - 子查询 (INFO)
 * - 没有WHERE (INFO)
 *
 * 使用示例:
 * <pre>
 * QueryAnalyzer analyzer = new QueryAnalyzer(new QueryExecutor(dataset));
 * QueryAnalysis analysis = analyzer.analyze("SELECT * FROM employees WHERE name LIKE '%son'");
 * analysis.getOverallSeverity(); // CRITICAL
 * </pre>
 */
public class QueryAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(QueryAnalyzer.class);

    public static final String SELECT_STAR = "SELECT * Usage";

    public static final String FUNCTION_ON_COLUMN = "Function on Column";

    public static final String LEADING_WILDCARD = "Leading Wildcard LIKE";

    public static final String OR_CONDITIONS = "OR Conditions";

    public static final String NOT_IN = "NOT IN Usage";

    public static final String ORDER_WITHOUT_LIMIT = "ORDER BY Without LIMIT";

    public static final String DISTINCT = "DISTINCT Usage";

    public static final String SUBQUERY = "Subquery Detected";

    public static final String NO_WHERE = "No WHERE Clause";

    /** 结果超过这么多行时建议加LIMIT */
    private static final int LARGE_RESULT_ROWS = 100;

    private final QueryExecutor executor;

    private final AccessPathEstimator estimator;

    private final IndexAdvisor advisor;

    public QueryAnalyzer(QueryExecutor executor) {
        this(executor, new AccessPathEstimator(executor.getDataset()));
    }

    public QueryAnalyzer(QueryExecutor executor, AccessPathEstimator estimator) {
        if (executor == null || estimator == null) {
            throw new IllegalArgumentException("Executor and estimator cannot be null");
        }
        this.executor = executor;
        this.estimator = estimator;
        this.advisor = new IndexAdvisor(executor.getDataset());
    }

    /**
     * 分析一条查询
     *
     * @param sql SQL文本
     * @return 分析结果(永不抛出QueryException)
     */
    public QueryAnalysis analyze(String sql) {
        ParsedQuery parsed = executor.getParser().parse(sql);
        if (sql == null || sql.trim().isEmpty()) {
            return new QueryAnalysis(parsed, QueryOutcome.failure(new EmptyQueryException()),
                    List.of(), null, List.of(), List.of());
        }

        QueryOutcome outcome;
        try {
            outcome = QueryOutcome.success(executor.execute(sql));
        } catch (QueryException e) {
            logger.debug("Analyzed query failed to execute: {}", e.getMessage());
            outcome = QueryOutcome.failure(e);
        }

        List<QueryIssue> issues = detectIssues(parsed);

        ExplainReport explain = null;
        List<IndexRecommendation> recommendations = List.of();
        if (!parsed.isLiteralSelect()) {
            try {
                explain = estimator.explain(parsed);
                recommendations = advisor.recommend(parsed);
            } catch (QueryException e) {
                logger.debug("EXPLAIN skipped for analyzed query: {}", e.getMessage());
            }
        }

        List<String> tips = tips(issues, explain, outcome);
        QueryAnalysis analysis = new QueryAnalysis(parsed, outcome, issues, explain, recommendations, tips);
        logger.debug("Analysis: {} issue(s), overall {}, access rating {}", issues.size(),
                analysis.getOverallSeverity(), analysis.getAccessRating());
        return analysis;
    }

    // ==================== 反模式检测 ====================

    List<QueryIssue> detectIssues(ParsedQuery query) {
        List<QueryIssue> issues = new ArrayList<>();

        if (query.getSelectItems().stream().anyMatch(SelectItem::isStar)) {
            issues.add(new QueryIssue(IssueSeverity.WARNING, SELECT_STAR,
                    "Fetching all columns when you might only need specific ones.",
                    "List only the columns you need: SELECT id, name, salary FROM ..."));
        }

        FunctionExpression function = functionOnColumn(query);
        if (function != null) {
            String name = function.getName().toUpperCase() + "()";
            issues.add(new QueryIssue(IssueSeverity.ERROR, FUNCTION_ON_COLUMN + ": " + name,
                    "Using functions on columns prevents index usage. MySQL must scan all rows.",
                    "Rewrite to compare the bare column against a range instead of using " + name));
        }

        if (hasLeadingWildcard(query)) {
            issues.add(new QueryIssue(IssueSeverity.ERROR, LEADING_WILDCARD,
                    "LIKE '%value' or LIKE '%value%' cannot use B-tree indexes.",
                    "Use trailing wildcard LIKE 'value%' or consider FULLTEXT index"));
        }

        if (hasUnsupported(query, "OR conditions")) {
            issues.add(new QueryIssue(IssueSeverity.WARNING, OR_CONDITIONS,
                    "OR conditions on different columns often prevent efficient index usage.",
                    "Consider UNION of separate queries, each using its own index"));
        }

        if (query.getWhereConditions().stream().anyMatch(c -> c.getOperator() == Operator.NOT_IN)) {
            issues.add(new QueryIssue(IssueSeverity.WARNING, NOT_IN,
                    "NOT IN can have unexpected behavior with NULL values and may not use indexes efficiently.",
                    "Use NOT EXISTS for safer NULL handling and potentially better performance"));
        }

        if (!query.getOrderBy().isEmpty() && query.getLimit().isEmpty()) {
            issues.add(new QueryIssue(IssueSeverity.WARNING, ORDER_WITHOUT_LIMIT,
                    "Sorting all rows without a LIMIT can be expensive for large tables.",
                    "Add LIMIT to retrieve only the rows you need"));
        }

        if (usesDistinct(query)) {
            issues.add(new QueryIssue(IssueSeverity.INFO, DISTINCT,
                    "DISTINCT requires sorting/hashing all results. Sometimes it indicates a JOIN issue.",
                    "Verify if DISTINCT is necessary or if the JOIN logic can be fixed"));
        }

        if (hasUnsupported(query, "Subqueries")) {
            issues.add(new QueryIssue(IssueSeverity.INFO, SUBQUERY,
                    "Subqueries can sometimes be rewritten as JOINs for better performance.",
                    "Consider whether a JOIN would be more efficient"));
        }

        boolean hasWhere = !query.getWhereConditions().isEmpty() || hasUnsupported(query, "in WHERE");
        if (!hasWhere && !query.isLiteralSelect()) {
            issues.add(new QueryIssue(IssueSeverity.INFO, NO_WHERE,
                    "Query will scan the entire table. This is fine for small tables.",
                    "Add filtering conditions if you need specific rows"));
        }
        return issues;
    }

    /**
     * 第一个作用在列上的非聚合函数
     */
    private static FunctionExpression functionOnColumn(ParsedQuery query) {
        List<Expression> expressions = new ArrayList<>();
        for (Condition condition : query.getWhereConditions()) {
            expressions.add(condition.getLeft());
            expressions.addAll(condition.getRight());
        }
        for (SelectItem item : query.getSelectItems()) {
            expressions.add(item.getExpression());
        }
        expressions.addAll(query.getGroupBy());
        for (OrderByItem item : query.getOrderBy()) {
            expressions.add(item.getExpression());
        }
        for (Expression expression : expressions) {
            FunctionExpression function = ExpressionUtils.firstFunction(expression);
            if (function != null && !ExpressionUtils.columnsOf(function).isEmpty()) {
                return function;
            }
        }
        return null;
    }

    private static boolean hasLeadingWildcard(ParsedQuery query) {
        for (Condition condition : query.getWhereConditions()) {
            if (condition.getOperator() != Operator.LIKE && condition.getOperator() != Operator.NOT_LIKE) {
                continue;
            }
            Expression pattern = condition.getRightOperand();
            if (pattern instanceof LiteralExpression) {
                Value value = ((LiteralExpression) pattern).getValue();
                if (value.getType() == ValueType.TEXT && value.asText().startsWith("%")) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean usesDistinct(ParsedQuery query) {
        if (query.isDistinct()) {
            return true;
        }
        for (SelectItem item : query.getSelectItems()) {
            for (AggregateExpression aggregate : ExpressionUtils.aggregatesOf(item.getExpression())) {
                if (aggregate.isDistinct()) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean hasUnsupported(ParsedQuery query, String feature) {
        for (UnsupportedFeature unsupported : query.getUnsupportedFeatures()) {
            if (unsupported.getFeature().contains(feature)) {
                return true;
            }
        }
        return false;
    }

    // ==================== 提示 ====================

    private static List<String> tips(List<QueryIssue> issues, ExplainReport explain, QueryOutcome outcome) {
        Set<String> tips = new LinkedHashSet<>();
        if (explain != null && explain.getWorstRating() == AccessType.Rating.BAD) {
            tips.add("Consider adding indexes on filtered columns to avoid full table scans");
        }
        if (issues.stream().anyMatch(i -> i.getTitle().equals(SELECT_STAR))) {
            tips.add("Selecting specific columns reduces I/O and memory usage");
        }
        if (explain != null) {
            for (ExplainRow row : explain.getRows()) {
                if (row.hasExtra(AccessPathEstimator.USING_FILESORT)) {
                    tips.add("Add an index that matches your ORDER BY to avoid filesort");
                }
                if (row.hasExtra(AccessPathEstimator.USING_TEMPORARY)) {
                    tips.add("GROUP BY and ORDER BY on different columns causes temporary tables");
                }
            }
        }
        if (outcome.getResult().map(QueryResult::getRowCount).orElse(0) > LARGE_RESULT_ROWS) {
            tips.add("Consider adding LIMIT if you don't need all rows");
        }
        if (tips.isEmpty()) {
            tips.add("Query looks reasonable! Check actual execution time on production data.");
        }
        return new ArrayList<>(tips);
    }

    public Dataset getDataset() {
        return executor.getDataset();
    }
}
