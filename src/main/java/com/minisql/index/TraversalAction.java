package com.minisql.index;

/**
 * TraversalAction - B+树遍历步骤的动作
 */
public enum TraversalAction {

    /** 只比较,不移动(例如范围为空) */
    COMPARE,

    /** 下降到子节点 */
    DESCEND,

    /** 在叶子节点找到键 */
    FOUND,

    /** 到达叶子节点仍未找到 */
    NOT_FOUND,

    /** 扫描叶子节点收集范围内的键 */
    SCAN;

    /** 小写标签(用于展示) */
    public String label() {
        return name().toLowerCase();
    }
}
