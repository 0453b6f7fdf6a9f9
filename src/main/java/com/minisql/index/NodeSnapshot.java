package com.minisql.index;

import com.minisql.table.Value;

import java.util.List;
import java.util.Optional;

/**
 * NodeSnapshot - 节点的只读快照(用于可视化)
 *
 * 子节点和下一个叶子用节点ID表示,快照之间没有对象引用。
 */
public class NodeSnapshot {

    private final long id;

    private final List<Value> keys;

    /** 叶子节点的值,内部节点为空 */
    private final List<Value> values;

    private final boolean leaf;

    private final List<Long> childIds;

    private final Long nextLeafId;

    public NodeSnapshot(long id, List<Value> keys, List<Value> values, boolean leaf,
                        List<Long> childIds, Long nextLeafId) {
        this.id = id;
        this.keys = List.copyOf(keys);
        this.values = List.copyOf(values);
        this.leaf = leaf;
        this.childIds = List.copyOf(childIds);
        this.nextLeafId = nextLeafId;
    }

    public long getId() {
        return id;
    }

    public List<Value> getKeys() {
        return keys;
    }

    public List<Value> getValues() {
        return values;
    }

    public boolean isLeaf() {
        return leaf;
    }

    public List<Long> getChildIds() {
        return childIds;
    }

    public Optional<Long> getNextLeafId() {
        return Optional.ofNullable(nextLeafId);
    }

    @Override
    public String toString() {
        return "NodeSnapshot{" +
                "id=" + id +
                ", keys=" + keys +
                (leaf ? ", values=" + values : ", children=" + childIds) +
                '}';
    }
}
