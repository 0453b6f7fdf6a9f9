package com.minisql.executor;

import com.minisql.table.Row;

/**
 * Operator - 执行算子接口
 *
 * 定义所有执行算子的统一接口,基于火山模型(Volcano Model)的迭代器模式。
 *
 * 核心概念:
 * - 每个算子实现 hasNext() + next() 方法
 * - 算子可以串联形成执行管道(Operator Tree)
 * - 数据流从下往上: Scan → Join → Filter → Aggregate → Sort → Limit → Project
 *
 * 设计原则:
 * - "Good taste": 所有算子统一接口,消除if-else判断
 * - 迭代器模式: 按需拉取数据
 * - 可组合: 任何算子都可以包装另一个算子
 *
 * MySQL对应:
 * - MySQL Executor中的迭代器接口
 * - 火山模型是数据库执行引擎的经典模型
 *
 * 使用示例:
 * <pre>
 * Operator scan = new ScanOperator("e", "employees", columns, rows);
 * Operator filter = new FilterOperator(scan, conditions, evaluator);
 *
 * while (filter.hasNext()) {
 *     Row row = filter.next();
 * }
 * </pre>
 */
public interface Operator {

    /**
     * 检查是否还有下一行数据
     *
     * @return 如果还有下一行返回true,否则返回false
     */
    boolean hasNext();

    /**
     * 获取下一行数据
     *
     * 调用前必须先调用hasNext()检查。
     *
     * @return 行数据
     * @throws java.util.NoSuchElementException 如果没有下一行
     */
    Row next();

    /**
     * 重置算子状态(可选实现)
     *
     * 默认实现不支持重置,抛出UnsupportedOperationException。
     */
    default void reset() {
        throw new UnsupportedOperationException("Reset not supported");
    }

    /**
     * 关闭算子(可选实现)
     */
    default void close() {
        // 内存算子没有需要释放的资源
    }
}
