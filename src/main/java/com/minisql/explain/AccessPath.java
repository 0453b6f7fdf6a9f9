package com.minisql.explain;

import com.minisql.dataset.IndexDefinition;
import com.minisql.parser.Condition;

import java.util.Optional;

/**
 * AccessPath - 一张表的一种访问方式及其代价
 *
 * 由AccessPathEstimator用CostModel计算,EXPLAIN和访问路径比较共用。
 */
public final class AccessPath {

    private final String table;

    private final AccessType type;

    /** 使用的索引,全表扫描时为null */
    private final IndexDefinition index;

    /** ref列: const或另一张表的列 */
    private final String ref;

    /** 被索引消化掉的WHERE条件,可能为null */
    private final Condition keyCondition;

    private final long rows;

    private final double cost;

    /** 所需的列是否全部在索引中 */
    private final boolean covering;

    AccessPath(String table, AccessType type, IndexDefinition index, String ref, Condition keyCondition,
               long rows, double cost, boolean covering) {
        this.table = table;
        this.type = type;
        this.index = index;
        this.ref = ref;
        this.keyCondition = keyCondition;
        this.rows = rows;
        this.cost = cost;
        this.covering = covering;
    }

    public String getTable() {
        return table;
    }

    public AccessType getType() {
        return type;
    }

    public Optional<IndexDefinition> getIndex() {
        return Optional.ofNullable(index);
    }

    public Optional<String> getKeyName() {
        return getIndex().map(IndexDefinition::getName);
    }

    public Optional<String> getRef() {
        return Optional.ofNullable(ref);
    }

    public Optional<Condition> getKeyCondition() {
        return Optional.ofNullable(keyCondition);
    }

    public long getRows() {
        return rows;
    }

    public double getCost() {
        return cost;
    }

    public boolean isCovering() {
        return covering;
    }

    @Override
    public String toString() {
        return "AccessPath{" +
                "table='" + table + '\'' +
                ", type=" + type +
                ", key=" + getKeyName().orElse(null) +
                ", rows=" + rows +
                ", cost=" + cost +
                ", covering=" + covering +
                '}';
    }
}
