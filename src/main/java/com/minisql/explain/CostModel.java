package com.minisql.explain;

import com.minisql.dataset.IndexDefinition;

/**
 * CostModel - 访问路径的启发式代价模型
 *
 * EXPLAIN和访问路径比较共用这一个代价函数,两边给出的行数和代价永远一致。
 * 所有常数都是演示用的经验值,不是实测值。
 *
 * 估算规则:
 * - system/const/eq_ref: 1行
 * - ref: 非NULL键数 / 基数(无索引统计时取表行数的10%)
 * - range: 表行数的30%
 * - index/ALL: 表行数
 *
 * 代价 = 索引定位代价 + 读取的索引条目代价 + 回表读行代价
 *
 * MySQL对应: 优化器的cost model(server_cost/engine_cost表),这里只保留最粗的形状
 */
public class CostModel {

    /** range扫描读取的行比例 */
    public static final double RANGE_FRACTION = 0.30;

    /** 没有索引统计时ref读取的行比例 */
    public static final double REF_FRACTION = 0.10;

    /** filtered列下限(百分比) */
    public static final double MIN_FILTERED = 10.0;

    /** filtered列上限(百分比) */
    public static final double MAX_FILTERED = 100.0;

    /** 读一行表数据 */
    public static final double ROW_READ_COST = 1.0;

    /** 读一个索引条目 */
    public static final double INDEX_ENTRY_COST = 0.5;

    /** 从根到叶的一次索引定位 */
    public static final double INDEX_DIVE_COST = 1.0;

    public static final CostModel DEFAULT = new CostModel();

    /**
     * 估算读取的行数
     *
     * @param type 访问类型
     * @param tableRows 表的总行数
     * @param index 使用的索引,可能为null
     * @return 估算行数
     */
    public long estimateRows(AccessType type, long tableRows, IndexDefinition index) {
        switch (type) {
            case SYSTEM:
            case CONST:
            case EQ_REF:
                return 1;
            case REF:
                if (index != null && index.getCardinality() > 0) {
                    long nonNull = index.getSortedValues().stream().filter(v -> !v.isNull()).count();
                    return Math.max(1, Math.round((double) nonNull / index.getCardinality()));
                }
                return Math.max(1, (long) (tableRows * REF_FRACTION));
            case RANGE:
                return Math.max(1, (long) (tableRows * RANGE_FRACTION));
            case INDEX:
            case ALL:
            default:
                return tableRows;
        }
    }

    /**
     * 估算filtered百分比
     *
     * 访问方法没有消化掉的条件越多,留下的行越少。
     *
     * @param residualConditions 读取行之后还需要检查的条件数
     */
    public double filtered(int residualConditions) {
        if (residualConditions <= 0) {
            return MAX_FILTERED;
        }
        double factor = MAX_FILTERED / (residualConditions + 1);
        return Math.min(MAX_FILTERED, Math.max(MIN_FILTERED, factor));
    }

    /**
     * 访问代价
     *
     * @param type 访问类型
     * @param rows 估算行数
     * @param covering 是否覆盖索引(不需要回表)
     */
    public double cost(AccessType type, long rows, boolean covering) {
        switch (type) {
            case ALL:
                return rows * ROW_READ_COST;
            case INDEX:
                return rows * (covering ? INDEX_ENTRY_COST : INDEX_ENTRY_COST + ROW_READ_COST);
            default:
                double perRow = covering ? INDEX_ENTRY_COST : INDEX_ENTRY_COST + ROW_READ_COST;
                return INDEX_DIVE_COST + rows * perRow;
        }
    }
}
