package com.minisql;

import com.minisql.analyzer.QueryAnalysis;
import com.minisql.analyzer.QueryAnalyzer;
import com.minisql.config.EngineConfig;
import com.minisql.dataset.Dataset;
import com.minisql.error.QueryException;
import com.minisql.executor.QueryExecutor;
import com.minisql.explain.AccessPathComparison;
import com.minisql.explain.AccessPathEstimator;
import com.minisql.explain.ExplainReport;
import com.minisql.explain.TableAccessComparison;
import com.minisql.index.BTree;
import com.minisql.index.BTreeIndexBuilder;
import com.minisql.index.IndexEntry;
import com.minisql.index.IndexLookup;
import com.minisql.index.LookupResult;
import com.minisql.parser.ParsedQuery;
import com.minisql.parser.SQLParser;
import com.minisql.parser.expressions.Operator;
import com.minisql.result.QueryOutcome;
import com.minisql.result.QueryResult;
import com.minisql.table.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Mini SQL - 引擎入口
 *
 * 内存中的SQL子集引擎: 解析、执行(含递归CTE)、B+树模拟、EXPLAIN估算。
 * 数据集只读,每次调用互相独立,CTE工作表和B+树都只活在一次调用里。
 *
 * 使用示例:
 * <pre>
 * MiniSQL engine = new MiniSQL(dataset);
 *
 * QueryResult result = engine.execute("SELECT name FROM employees WHERE salary > 50000");
 *
 * QueryOutcome outcome = engine.run("SELECT * FROM employes");
 * outcome.getError().get().getSuggestion(); // Did you mean: employees?
 *
 * ExplainReport report = engine.explain("SELECT * FROM employees WHERE id = 5");
 * System.out.println(report.format());
 * </pre>
 */
public class MiniSQL {

    private final Dataset dataset;

    private final EngineConfig config;

    private final QueryExecutor executor;

    private final AccessPathEstimator estimator;

    private final AccessPathComparison comparison;

    private final IndexLookup indexLookup;

    private final QueryAnalyzer analyzer;

    public MiniSQL(Dataset dataset) {
        this(dataset, EngineConfig.load());
    }

    public MiniSQL(Dataset dataset, EngineConfig config) {
        if (dataset == null) {
            throw new IllegalArgumentException("Dataset cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("EngineConfig cannot be null");
        }
        this.dataset = dataset;
        this.config = config;
        this.executor = new QueryExecutor(dataset, config);
        this.estimator = new AccessPathEstimator(dataset);
        this.comparison = new AccessPathComparison(estimator);
        this.indexLookup = new IndexLookup(dataset, config.getDefaultBTreeOrder());
        this.analyzer = new QueryAnalyzer(executor, estimator);
    }

    /**
     * 解析SQL(不抛异常,问题记录在ParsedQuery上)
     */
    public ParsedQuery parse(String sql) {
        return executor.getParser().parse(sql);
    }

    /**
     * 执行查询
     *
     * @throws QueryException 任何查询错误
     */
    public QueryResult execute(String sql) {
        return executor.execute(sql);
    }

    /**
     * 执行查询,结果或错误二者必居其一
     */
    public QueryOutcome run(String sql) {
        try {
            return QueryOutcome.success(executor.execute(sql));
        } catch (QueryException e) {
            return QueryOutcome.failure(e);
        }
    }

    public ExplainReport explain(String sql) {
        return explain(parse(sql));
    }

    public ExplainReport explain(ParsedQuery query) {
        return estimator.explain(query);
    }

    public List<TableAccessComparison> compareAccessPaths(String sql) {
        return comparison.compare(parse(sql));
    }

    /**
     * 用一列值构建B+树,行号(从1开始)作为值,NULL键跳过
     *
     * @param columnValues 列值
     * @param order B+树阶数
     */
    public static BTree buildIndex(List<Value> columnValues, int order) {
        List<IndexEntry> entries = new ArrayList<>();
        for (int i = 0; i < columnValues.size(); i++) {
            entries.add(new IndexEntry(columnValues.get(i), Value.ofInt(i + 1)));
        }
        return BTreeIndexBuilder.build(entries, order);
    }

    /**
     * 为数据集中的一列构建B+树(使用配置的默认阶数)
     */
    public BTree buildIndex(String table, String column) {
        return indexLookup.buildIndex(table, column);
    }

    public LookupResult lookup(String table, String column, Operator operator, Value value) {
        return indexLookup.lookup(table, column, operator, value);
    }

    public LookupResult lookupBetween(String table, String column, Value low, Value high) {
        return indexLookup.lookupBetween(table, column, low, high);
    }

    /**
     * 用查询WHERE中的第一个"列 运算符 字面量"条件做索引查找
     */
    public LookupResult lookup(String sql) {
        return indexLookup.lookup(parse(sql));
    }

    public QueryAnalysis analyze(String sql) {
        return analyzer.analyze(sql);
    }

    public Dataset getDataset() {
        return dataset;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public SQLParser getParser() {
        return executor.getParser();
    }
}
