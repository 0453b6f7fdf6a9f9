package com.minisql.executor.operator;

import com.minisql.executor.Operator;
import com.minisql.result.ExecutionStage;
import com.minisql.table.Row;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.IntSupplier;

/**
 * StageOperator - 执行阶段记录算子
 *
 * 透明地包装一个算子,统计它输出的行数并保留前几行作为样本,
 * 用于在结果中展示SQL的逻辑执行顺序(FROM → WHERE → GROUP BY → ...)。
 *
 * 输入行数由上一个阶段的输出行数提供。LIMIT提前结束时,
 * 上游阶段只统计到实际被拉取的行。
 */
public class StageOperator implements Operator {

    private final Operator child;

    private final String name;

    private final String clause;

    /** 输入行数(上一阶段的输出) */
    private final IntSupplier inputRows;

    private final int sampleSize;

    private final List<Row> sample = new ArrayList<>();

    private int outputRows;

    /**
     * @param child 被记录的算子
     * @param name 阶段名(FROM, WHERE, ...)
     * @param clause 对应的SQL片段
     * @param inputRows 输入行数
     * @param sampleSize 样本行数上限
     */
    public StageOperator(Operator child, String name, String clause, IntSupplier inputRows, int sampleSize) {
        if (child == null) {
            throw new IllegalArgumentException("Child operator cannot be null");
        }
        this.child = child;
        this.name = name;
        this.clause = clause;
        this.inputRows = inputRows;
        this.sampleSize = sampleSize;
    }

    @Override
    public boolean hasNext() {
        return child.hasNext();
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more rows");
        }
        Row row = child.next();
        outputRows++;
        if (sample.size() < sampleSize) {
            sample.add(row);
        }
        return row;
    }

    public int getOutputRows() {
        return outputRows;
    }

    /**
     * 生成执行阶段快照
     */
    public ExecutionStage toStage() {
        return new ExecutionStage(name, clause, inputRows.getAsInt(), outputRows, sample);
    }

    @Override
    public String toString() {
        return "StageOperator{" + name + ", child=" + child + '}';
    }
}
