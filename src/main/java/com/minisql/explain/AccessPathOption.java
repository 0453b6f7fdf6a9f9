package com.minisql.explain;

import java.util.Optional;

/**
 * AccessPathOption - 访问路径比较中的一个候选
 *
 * 全表扫描、某个已有索引,或顾问建议的假想索引。
 */
public final class AccessPathOption {

    private final String label;

    private final AccessPath path;

    private final boolean hypothetical;

    /** 假想索引的建索引语句 */
    private final String createSql;

    AccessPathOption(String label, AccessPath path, boolean hypothetical, String createSql) {
        this.label = label;
        this.path = path;
        this.hypothetical = hypothetical;
        this.createSql = createSql;
    }

    public String getLabel() {
        return label;
    }

    public AccessPath getPath() {
        return path;
    }

    public AccessType getType() {
        return path.getType();
    }

    public long getRows() {
        return path.getRows();
    }

    public double getCost() {
        return path.getCost();
    }

    public boolean isHypothetical() {
        return hypothetical;
    }

    public Optional<String> getCreateSql() {
        return Optional.ofNullable(createSql);
    }

    @Override
    public String toString() {
        return String.format("%s: %s, rows=%d, cost=%.2f%s", label, path.getType(), path.getRows(),
                path.getCost(), hypothetical ? " (hypothetical)" : "");
    }
}
