package com.minisql.index;

import com.minisql.table.Value;

import java.util.List;
import java.util.Optional;

/**
 * SearchResult - 等值查找结果 + 遍历轨迹
 */
public class SearchResult {

    private final Value value;

    private final List<TraversalStep> trace;

    public SearchResult(Value value, List<TraversalStep> trace) {
        this.value = value;
        this.trace = List.copyOf(trace);
    }

    public Optional<Value> getValue() {
        return Optional.ofNullable(value);
    }

    public boolean isFound() {
        return value != null;
    }

    public List<TraversalStep> getTrace() {
        return trace;
    }

    @Override
    public String toString() {
        return "SearchResult{value=" + value + ", steps=" + trace.size() + '}';
    }
}
