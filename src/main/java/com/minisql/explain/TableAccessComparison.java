package com.minisql.explain;

import java.util.List;
import java.util.Optional;

/**
 * TableAccessComparison - 一张表所有候选访问路径的比较结果
 *
 * 候选按代价从低到高排列。
 */
public final class TableAccessComparison {

    /** 浮点代价比较的容差 */
    private static final double EPSILON = 1e-9;

    private final String table;

    /** EXPLAIN实际选择的路径 */
    private final AccessPath chosen;

    private final List<AccessPathOption> options;

    TableAccessComparison(String table, AccessPath chosen, List<AccessPathOption> options) {
        this.table = table;
        this.chosen = chosen;
        this.options = List.copyOf(options);
    }

    public String getTable() {
        return table;
    }

    public AccessPath getChosen() {
        return chosen;
    }

    public List<AccessPathOption> getOptions() {
        return options;
    }

    /**
     * 代价最低的候选(可能是假想索引)
     */
    public AccessPathOption getCheapest() {
        return options.get(0);
    }

    public Optional<AccessPathOption> getHypothetical() {
        return options.stream().filter(AccessPathOption::isHypothetical).findFirst();
    }

    /**
     * 选择的路径在已有的候选中是否代价最低
     */
    public boolean isChosenOptimal() {
        for (AccessPathOption option : options) {
            if (!option.isHypothetical() && option.getCost() < chosen.getCost() - EPSILON) {
                return false;
            }
        }
        return true;
    }

    /**
     * 顾问建议的索引是否比选择的路径更便宜
     */
    public boolean isHypotheticalBetter() {
        return getHypothetical().map(h -> h.getCost() < chosen.getCost() - EPSILON).orElse(false);
    }

    @Override
    public String toString() {
        return "TableAccessComparison{" +
                "table='" + table + '\'' +
                ", chosen=" + chosen +
                ", options=" + options +
                '}';
    }
}
