package com.minisql.result;

import java.util.List;

/**
 * CteExecutionInfo - 单个CTE的执行信息
 *
 * 递归CTE额外记录迭代次数,以及是否因达到迭代上限而被截断。
 */
public class CteExecutionInfo {

    private final String name;

    private final int rowCount;

    private final List<String> columns;

    private final boolean recursive;

    /** 递归成员的执行次数(非递归CTE为0) */
    private final int iterations;

    /** 是否因达到迭代上限而截断 */
    private final boolean truncated;

    public CteExecutionInfo(String name, int rowCount, List<String> columns,
                            boolean recursive, int iterations, boolean truncated) {
        this.name = name;
        this.rowCount = rowCount;
        this.columns = List.copyOf(columns);
        this.recursive = recursive;
        this.iterations = iterations;
        this.truncated = truncated;
    }

    public String getName() {
        return name;
    }

    public int getRowCount() {
        return rowCount;
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean isRecursive() {
        return recursive;
    }

    public int getIterations() {
        return iterations;
    }

    public boolean isTruncated() {
        return truncated;
    }

    @Override
    public String toString() {
        return "CteExecutionInfo{" +
                "name='" + name + '\'' +
                ", rowCount=" + rowCount +
                ", recursive=" + recursive +
                ", iterations=" + iterations +
                ", truncated=" + truncated +
                '}';
    }
}
