package com.minisql.executor;

import com.minisql.error.SqlSyntaxException;
import com.minisql.error.UnknownTableException;
import com.minisql.parser.CompoundQuery;
import com.minisql.parser.CteDefinition;
import com.minisql.parser.ParsedQuery;
import com.minisql.parser.SQLParser;
import com.minisql.result.CteExecutionInfo;
import com.minisql.table.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * CteEvaluator - CTE物化器
 *
 * 按WITH列表的顺序物化每个CTE,注册到执行上下文中,供后面的CTE和主查询引用。
 *
 * 普通CTE: 查询体执行一次。查询体可以是 UNION [ALL] 连接的多个查询。
 *
 * 递归CTE(不动点迭代):
 * <pre>
 * WITH RECURSIVE n AS (
 *     SELECT 1 AS x                       -- 锚点成员: 执行一次,作为初始工作集
 *     UNION ALL
 *     SELECT x + 1 FROM n WHERE x &lt; 10    -- 递归成员: 每轮读取上一轮的工作集
 * )
 * </pre>
 * 1. 执行锚点成员,结果同时作为工作集和累计结果
 * 2. 把工作集注册为CTE表,执行递归成员
 * 3. 新产生的行追加到累计结果,并成为下一轮的工作集
 * 4. 递归成员不再产生新行,或迭代次数达到上限时停止
 *
 * 设计原则:
 * - 迭代上限总是生效,达到上限时截断结果并给出警告,不抛异常
 * - 列按位置对应: 递归成员的第i列改名为锚点的第i列
 * - UNION(不带ALL)丢弃已经产生过的行,UNION ALL保留重复
 * - WITH列表中不允许引用后面才定义的CTE
 *
 * MySQL对应:
 * - cte_max_recursion_depth系统变量(MySQL超过上限时报错,这里截断并警告)
 */
public class CteEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(CteEvaluator.class);

    private final SQLParser parser;

    /** 子查询执行回调: (SQL, 上下文) → 结果行集 */
    private final BiFunction<String, ExecutionContext, RowSet> runner;

    public CteEvaluator(SQLParser parser, BiFunction<String, ExecutionContext, RowSet> runner) {
        this.parser = parser;
        this.runner = runner;
    }

    /**
     * 按顺序物化所有CTE
     *
     * @param ctes CTE定义(WITH列表顺序)
     * @param context 执行上下文
     * @throws UnknownTableException CTE引用了后面才定义的CTE
     */
    public void evaluate(List<CteDefinition> ctes, ExecutionContext context) {
        checkForwardReferences(ctes);

        for (CteDefinition cte : ctes) {
            CteExecutionInfo info = cte.isSelfReferencing()
                    ? materializeRecursive(cte, context)
                    : materializeSimple(cte, context);
            context.addCteInfo(info);
            logger.debug("Materialized CTE {}", info);
        }
    }

    /**
     * 检查前向引用: 第i个CTE的FROM/JOIN中不能出现第j(j > i)个CTE
     */
    private void checkForwardReferences(List<CteDefinition> ctes) {
        List<String> definedSoFar = new ArrayList<>();
        for (int i = 0; i < ctes.size(); i++) {
            CteDefinition cte = ctes.get(i);
            Set<String> referenced = referencedTables(cte.getQuery());
            for (int j = i + 1; j < ctes.size(); j++) {
                String later = ctes.get(j).getName();
                if (referenced.contains(later.toLowerCase())) {
                    throw UnknownTableException.forwardReference(later, cte.getName(), definedSoFar);
                }
            }
            definedSoFar.add(cte.getName());
        }
    }

    private Set<String> referencedTables(String query) {
        Set<String> tables = new LinkedHashSet<>();
        for (String member : CompoundQuery.split(query).getMembers()) {
            ParsedQuery parsed = parser.parse(member);
            tables.addAll(parsed.getTables());
        }
        return tables;
    }

    private CteExecutionInfo materializeSimple(CteDefinition cte, ExecutionContext context) {
        CompoundQuery body = CompoundQuery.split(cte.getQuery());
        RowSet result = union(cte, body.getMembers(), body.isDistinct(), context);
        RowSet renamed = withExplicitColumns(cte, result);
        context.registerCte(cte.getName(), renamed);
        return new CteExecutionInfo(cte.getName(), renamed.size(), renamed.getColumns(), false, 0, false);
    }

    private CteExecutionInfo materializeRecursive(CteDefinition cte, ExecutionContext context) {
        CompoundQuery body = CompoundQuery.split(cte.getQuery());
        List<String> anchors = new ArrayList<>();
        List<String> recursives = new ArrayList<>();
        for (String member : body.getMembers()) {
            if (CompoundQuery.references(member, cte.getName())) {
                recursives.add(member);
            } else {
                anchors.add(member);
            }
        }
        if (anchors.isEmpty()) {
            throw new SqlSyntaxException("Recursive CTE '" + cte.getName()
                    + "' needs a non-recursive anchor member joined with UNION ALL", cte.getName());
        }

        boolean distinct = body.isDistinct();
        RowSet anchor = withExplicitColumns(cte, union(cte, anchors, distinct, context));
        List<String> columns = anchor.getColumns();

        List<Row> accumulated = new ArrayList<>(anchor.getRows());
        Set<Row> seen = new LinkedHashSet<>(accumulated);
        List<Row> working = anchor.getRows();
        int maxDepth = context.getConfig().getMaxRecursionDepth();
        int iterations = 0;
        boolean truncated = false;

        while (!working.isEmpty()) {
            if (iterations >= maxDepth) {
                truncated = true;
                break;
            }
            context.registerCte(cte.getName(), new RowSet(columns, working));

            List<Row> produced = new ArrayList<>();
            for (String member : recursives) {
                RowSet step = runner.apply(member, context);
                produced.addAll(renamePositionally(cte, step, columns).getRows());
            }
            iterations++;

            if (distinct) {
                produced.removeIf(row -> !seen.add(row));
            }
            if (produced.isEmpty()) {
                break;
            }
            accumulated.addAll(produced);
            working = produced;
        }

        if (truncated) {
            logger.warn("Recursive CTE {} stopped after {} iterations", cte.getName(), maxDepth);
            context.addWarning("Recursive CTE '" + cte.getName() + "' reached the maximum recursion depth ("
                    + maxDepth + "); results were truncated");
        }

        context.registerCte(cte.getName(), new RowSet(columns, accumulated));
        return new CteExecutionInfo(cte.getName(), accumulated.size(), columns, true, iterations, truncated);
    }

    /**
     * 执行 UNION [ALL] 连接的多个查询,列名以第一个查询为准
     */
    private RowSet union(CteDefinition cte, List<String> members, boolean distinct, ExecutionContext context) {
        RowSet first = runner.apply(members.get(0), context);
        if (members.size() == 1 && !distinct) {
            return first;
        }

        List<Row> rows = new ArrayList<>(first.getRows());
        for (int i = 1; i < members.size(); i++) {
            rows.addAll(renamePositionally(cte, runner.apply(members.get(i), context), first.getColumns()).getRows());
        }
        if (distinct) {
            rows = new ArrayList<>(new LinkedHashSet<>(rows));
        }
        return new RowSet(first.getColumns(), rows);
    }

    /**
     * WITH name(a, b) AS (...) 的显式列名
     */
    private static RowSet withExplicitColumns(CteDefinition cte, RowSet rows) {
        if (cte.getColumns().isEmpty()) {
            return rows;
        }
        return renamePositionally(cte, rows, cte.getColumns());
    }

    /**
     * 按位置把行的列改名
     */
    static RowSet renamePositionally(CteDefinition cte, RowSet rows, List<String> columns) {
        if (rows.getColumns().equals(columns)) {
            return rows;
        }
        if (rows.getColumns().size() != columns.size()) {
            throw new SqlSyntaxException("The SELECT statements in CTE '" + cte.getName()
                    + "' have a different number of columns (" + rows.getColumns().size()
                    + " vs " + columns.size() + ")", cte.getName());
        }

        List<Row> renamed = new ArrayList<>(rows.size());
        for (Row row : rows.getRows()) {
            Row.Builder builder = Row.builder();
            for (int i = 0; i < columns.size(); i++) {
                builder.put(columns.get(i), row.get(rows.getColumns().get(i)));
            }
            renamed.add(builder.build());
        }
        return new RowSet(columns, renamed);
    }
}
