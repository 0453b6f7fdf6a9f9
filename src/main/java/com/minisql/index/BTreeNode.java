package com.minisql.index;

import com.minisql.table.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * BTreeNode - B+树节点
 *
 * 节点存放在BTree的节点数组(arena)里,子节点和兄弟叶子用数组下标引用,
 * 不持有其他节点的对象引用。
 *
 * 节点结构:
 * - 内部节点: keys[0..n-1] + children[0..n] (children.size() == keys.size() + 1)
 * - 叶子节点: keys[0..n-1] + values[0..n-1] + nextLeaf (叶子链表)
 *
 * 节点ID在进程内唯一且单调递增,从不复用。
 */
final class BTreeNode {

    /** 全局节点ID生成器 */
    private static final AtomicLong ID_GENERATOR = new AtomicLong();

    /** 没有下一个叶子 */
    static final int NO_NODE = -1;

    private final long id;

    private final boolean leaf;

    private final List<Value> keys = new ArrayList<>();

    /** 叶子节点的值(与keys一一对应) */
    private final List<Value> values = new ArrayList<>();

    /** 内部节点的子节点(arena下标) */
    private final List<Integer> children = new ArrayList<>();

    /** 下一个叶子(arena下标) */
    private int nextLeaf = NO_NODE;

    BTreeNode(boolean leaf) {
        this.id = ID_GENERATOR.incrementAndGet();
        this.leaf = leaf;
    }

    long getId() {
        return id;
    }

    boolean isLeaf() {
        return leaf;
    }

    List<Value> getKeys() {
        return keys;
    }

    List<Value> getValues() {
        return values;
    }

    List<Integer> getChildren() {
        return children;
    }

    int getNextLeaf() {
        return nextLeaf;
    }

    void setNextLeaf(int nextLeaf) {
        this.nextLeaf = nextLeaf;
    }

    int getKeyCount() {
        return keys.size();
    }

    /**
     * 第一个大于key的键的位置(即小于等于key的键的个数)
     *
     * 内部节点用它选择子节点: 等于分隔键时走右子树。
     */
    int upperBound(Value key) {
        int i = 0;
        while (i < keys.size() && keys.get(i).compareTo(key) <= 0) {
            i++;
        }
        return i;
    }

    /**
     * 第一个大于等于key的键的位置
     */
    int lowerBound(Value key) {
        int i = 0;
        while (i < keys.size() && keys.get(i).compareTo(key) < 0) {
            i++;
        }
        return i;
    }

    @Override
    public String toString() {
        return (leaf ? "Leaf" : "Internal") + "#" + id + keys;
    }
}
