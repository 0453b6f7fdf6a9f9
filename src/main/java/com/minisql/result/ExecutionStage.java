package com.minisql.result;

import com.minisql.table.Row;

import java.util.List;

/**
 * ExecutionStage - 一个逻辑执行阶段的快照
 *
 * 记录算子树中一个阶段(FROM, JOIN, WHERE, GROUP BY, HAVING, ORDER BY, LIMIT, SELECT, DISTINCT)
 * 实际流过的行数和前几行样本。
 *
 * 火山模型按需拉取: LIMIT提前结束时,上游阶段只统计到实际被拉取的行。
 */
public class ExecutionStage {

    /** 阶段名(如"WHERE") */
    private final String name;

    /** 子句原文(如"WHERE salary > 50000") */
    private final String clause;

    private final int inputRows;

    private final int outputRows;

    /** 输出行样本 */
    private final List<Row> sample;

    public ExecutionStage(String name, String clause, int inputRows, int outputRows, List<Row> sample) {
        this.name = name;
        this.clause = clause;
        this.inputRows = inputRows;
        this.outputRows = outputRows;
        this.sample = List.copyOf(sample);
    }

    public String getName() {
        return name;
    }

    public String getClause() {
        return clause;
    }

    public int getInputRows() {
        return inputRows;
    }

    public int getOutputRows() {
        return outputRows;
    }

    public List<Row> getSample() {
        return sample;
    }

    @Override
    public String toString() {
        return name + ": " + inputRows + " -> " + outputRows + " rows";
    }
}
