package com.minisql.executor;

import com.minisql.config.EngineConfig;
import com.minisql.dataset.Dataset;
import com.minisql.result.CteExecutionInfo;
import com.minisql.table.Row;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * ExecutionContext - 单次查询的执行上下文
 *
 * 每次execute调用创建一个新实例,查询结束后丢弃:
 * - CTE注册表(CTE名 → 物化的行集合),CTE优先于同名的数据集表
 * - 警告列表
 * - CTE执行信息
 *
 * 查询之间不共享任何可变状态。
 */
public class ExecutionContext {

    private final Dataset dataset;

    private final EngineConfig config;

    private final Map<String, RowSet> cteTables = new LinkedHashMap<>();

    private final Set<String> warnings = new LinkedHashSet<>();

    private final List<CteExecutionInfo> cteInfo = new ArrayList<>();

    public ExecutionContext(Dataset dataset, EngineConfig config) {
        if (dataset == null) {
            throw new IllegalArgumentException("Dataset cannot be null");
        }
        this.dataset = dataset;
        this.config = config != null ? config : EngineConfig.defaults();
    }

    public Dataset getDataset() {
        return dataset;
    }

    public EngineConfig getConfig() {
        return config;
    }

    // ==================== 表解析 ====================

    /**
     * 注册(或替换)CTE虚拟表
     */
    public void registerCte(String name, RowSet rows) {
        cteTables.put(key(name), rows);
    }

    public boolean isCte(String name) {
        return cteTables.containsKey(key(name));
    }

    public boolean hasTable(String name) {
        return isCte(name) || dataset.hasTable(name);
    }

    /**
     * 表的行(CTE优先)
     */
    public List<Row> getRows(String name) {
        RowSet cte = cteTables.get(key(name));
        return cte != null ? cte.getRows() : dataset.getTable(name);
    }

    /**
     * 表的列名(CTE优先)
     */
    public List<String> getColumns(String name) {
        RowSet cte = cteTables.get(key(name));
        return cte != null ? cte.getColumns() : dataset.getTableColumns(name);
    }

    /**
     * 可用的表名: 数据集表 + 已定义的CTE
     */
    public List<String> getAvailableTables() {
        List<String> tables = new ArrayList<>(dataset.getTableNames());
        for (String cte : cteTables.keySet()) {
            if (!tables.contains(cte)) {
                tables.add(cte);
            }
        }
        return tables;
    }

    public List<String> getCteNames() {
        return List.copyOf(cteTables.keySet());
    }

    // ==================== 警告和CTE信息 ====================

    /**
     * 添加警告(重复的警告只保留一次)
     */
    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public List<String> getWarnings() {
        return List.copyOf(warnings);
    }

    public void addCteInfo(CteExecutionInfo info) {
        cteInfo.add(info);
    }

    public List<CteExecutionInfo> getCteInfo() {
        return List.copyOf(cteInfo);
    }

    private static String key(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT);
    }
}
