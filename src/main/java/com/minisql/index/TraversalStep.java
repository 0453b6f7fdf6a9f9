package com.minisql.index;

import com.minisql.table.Value;

import java.util.List;

/**
 * TraversalStep - B+树遍历轨迹中的一步
 *
 * 记录访问的节点、节点上被检查的键、可读的比较描述和动作。
 * 例如: node 7, keys [20, 40], "35 >= 20, 35 &lt; 40 -> descend to child 1", DESCEND
 */
public class TraversalStep {

    private final long nodeId;

    private final List<Value> keysChecked;

    private final String comparison;

    private final TraversalAction action;

    public TraversalStep(long nodeId, List<Value> keysChecked, String comparison, TraversalAction action) {
        this.nodeId = nodeId;
        this.keysChecked = List.copyOf(keysChecked);
        this.comparison = comparison;
        this.action = action;
    }

    public long getNodeId() {
        return nodeId;
    }

    public List<Value> getKeysChecked() {
        return keysChecked;
    }

    public String getComparison() {
        return comparison;
    }

    public TraversalAction getAction() {
        return action;
    }

    @Override
    public String toString() {
        return "node " + nodeId + " " + keysChecked + " " + comparison + " [" + action.label() + "]";
    }
}
