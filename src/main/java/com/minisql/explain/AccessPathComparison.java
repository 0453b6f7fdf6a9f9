package com.minisql.explain;

import com.minisql.dataset.IndexDefinition;
import com.minisql.parser.ParsedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * AccessPathComparison - 访问路径比较
 *
 * 对每张表分别估算: 全表扫描、只有某一个已有索引、只有顾问建议的假想索引,
 * 按代价从低到高排列,并判断EXPLAIN选的路径是不是已有候选中最便宜的。
 *
 * 行数和代价都来自AccessPathEstimator.choose()和同一个CostModel,
 * 所以这里的"选择的路径"和EXPLAIN行上的rows/cost完全相同。
 *
 * 使用示例:
 * <pre>
 * AccessPathComparison comparison = new AccessPathComparison(estimator);
 * for (TableAccessComparison table : comparison.compare(query)) {
 *     table.getOptions().forEach(System.out::println);
 * }
 * </pre>
 */
public class AccessPathComparison {

    private static final Logger logger = LoggerFactory.getLogger(AccessPathComparison.class);

    public static final String FULL_SCAN_LABEL = "Full table scan";

    private final AccessPathEstimator estimator;

    public AccessPathComparison(AccessPathEstimator estimator) {
        if (estimator == null) {
            throw new IllegalArgumentException("Estimator cannot be null");
        }
        this.estimator = estimator;
    }

    /**
     * 比较每张表的候选访问路径
     *
     * @param query 解析后的查询
     * @return 每张基表一项(CTE引用不参与比较)
     */
    public List<TableAccessComparison> compare(ParsedQuery query) {
        List<TableSource> sources = estimator.sources(query);
        List<TableAccessComparison> result = new ArrayList<>();
        for (TableSource source : sources) {
            if (source.isDerived()) {
                continue;
            }
            Collection<IndexDefinition> indexes = estimator.getDataset().getIndexes(source.getTable()).values();
            AccessPath chosen = estimator.choose(query, source, sources, indexes);

            List<AccessPathOption> options = new ArrayList<>();
            options.add(new AccessPathOption(FULL_SCAN_LABEL,
                    estimator.choose(query, source, sources, List.of()), false, null));
            for (IndexDefinition index : indexes) {
                options.add(new AccessPathOption(index.getName(),
                        estimator.choose(query, source, sources, List.of(index)), false, null));
            }
            Optional<IndexDefinition> hypothetical = estimator.getAdvisor().hypotheticalIndex(query, source, sources);
            if (hypothetical.isPresent()) {
                IndexDefinition index = hypothetical.get();
                options.add(new AccessPathOption(index.getName(),
                        estimator.choose(query, source, sources, List.of(index)), true,
                        IndexAdvisor.createIndexSql(source.getTable(), index.getColumn())));
            }

            // 代价相同时访问类型好的在前,再相同时保持原顺序
            options.sort(Comparator.comparingDouble(AccessPathOption::getCost)
                    .thenComparingInt(o -> o.getType().ordinal()));
            TableAccessComparison comparison = new TableAccessComparison(source.getTable(), chosen, options);
            logger.debug("Access path comparison for {}: chosen optimal={}, hypothetical better={}",
                    source, comparison.isChosenOptimal(), comparison.isHypotheticalBetter());
            result.add(comparison);
        }
        return result;
    }
}
