package com.minisql.index;

import com.minisql.table.Value;

import java.util.Objects;

/**
 * IndexEntry - 叶子节点中的一个(键, 值)对
 *
 * 二级索引中值是行ID,对应InnoDB二级索引叶子节点里的主键值。
 */
public final class IndexEntry {

    private final Value key;

    private final Value value;

    public IndexEntry(Value key, Value value) {
        this.key = key;
        this.value = value;
    }

    public Value getKey() {
        return key;
    }

    public Value getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndexEntry)) {
            return false;
        }
        IndexEntry other = (IndexEntry) o;
        return key.equals(other.key) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
