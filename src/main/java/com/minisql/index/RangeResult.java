package com.minisql.index;

import java.util.List;

/**
 * RangeResult - 范围查找结果(按键升序) + 遍历轨迹
 */
public class RangeResult {

    private final List<IndexEntry> entries;

    private final List<TraversalStep> trace;

    public RangeResult(List<IndexEntry> entries, List<TraversalStep> trace) {
        this.entries = List.copyOf(entries);
        this.trace = List.copyOf(trace);
    }

    public List<IndexEntry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public List<TraversalStep> getTrace() {
        return trace;
    }

    /**
     * 扫描过的叶子节点个数
     */
    public long getLeavesScanned() {
        return trace.stream().filter(step -> step.getAction() == TraversalAction.SCAN).count();
    }

    @Override
    public String toString() {
        return "RangeResult{entries=" + entries + ", steps=" + trace.size() + '}';
    }
}
