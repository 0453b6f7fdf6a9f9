package com.minisql.index;

import com.minisql.table.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * LookupResult - 一次索引查找与全表扫描的对比
 *
 * B+树的比较次数按遍历轨迹的步数计(每访问一个节点算一次),
 * 全表扫描的比较次数等于表的行数。
 */
public class LookupResult {

    private final String table;

    private final String column;

    /** 查找条件的可读描述(如 "salary >= 70000") */
    private final String predicate;

    private final BTree tree;

    private final List<IndexEntry> matches;

    private final List<TraversalStep> trace;

    private final int fullScanComparisons;

    public LookupResult(String table, String column, String predicate, BTree tree,
                        List<IndexEntry> matches, List<TraversalStep> trace, int fullScanComparisons) {
        this.table = table;
        this.column = column;
        this.predicate = predicate;
        this.tree = tree;
        this.matches = List.copyOf(matches);
        this.trace = List.copyOf(trace);
        this.fullScanComparisons = fullScanComparisons;
    }

    public String getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }

    public String getPredicate() {
        return predicate;
    }

    public BTree getTree() {
        return tree;
    }

    public List<IndexEntry> getMatches() {
        return matches;
    }

    /**
     * 匹配行的行ID
     */
    public List<Value> getRowIds() {
        List<Value> rowIds = new ArrayList<>(matches.size());
        for (IndexEntry entry : matches) {
            rowIds.add(entry.getValue());
        }
        return rowIds;
    }

    public boolean isFound() {
        return !matches.isEmpty();
    }

    public List<TraversalStep> getTrace() {
        return trace;
    }

    public int getBTreeComparisons() {
        return trace.size();
    }

    public int getFullScanComparisons() {
        return fullScanComparisons;
    }

    /**
     * 比较次数减少的百分比描述,如 "85% fewer comparisons"
     */
    public String getEfficiency() {
        if (fullScanComparisons <= 0) {
            return "N/A";
        }
        long saved = Math.round((1 - (double) getBTreeComparisons() / fullScanComparisons) * 100);
        return saved + "% fewer comparisons";
    }

    @Override
    public String toString() {
        return "LookupResult{" +
                table + "." + column +
                ", predicate=" + predicate +
                ", matches=" + matches.size() +
                ", btree=" + getBTreeComparisons() +
                ", fullScan=" + fullScanComparisons +
                '}';
    }
}
