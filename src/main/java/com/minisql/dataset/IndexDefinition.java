package com.minisql.dataset;

import com.minisql.config.CommonConstant;
import com.minisql.table.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * IndexDefinition - 数据集声明的索引
 *
 * 单列索引: 索引名、索引列、排序后的列值、是否唯一。
 * PRIMARY索引总是唯一的。
 *
 * MySQL对应: SHOW INDEX FROM table 的一行
 */
public final class IndexDefinition {

    private final String name;

    private final String column;

    /** 排序后的键值(NULL在前) */
    private final List<Value> sortedValues;

    private final boolean unique;

    public IndexDefinition(String name, String column, List<Value> values, boolean unique) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Index name cannot be empty");
        }
        if (column == null || column.isEmpty()) {
            throw new IllegalArgumentException("Index column cannot be empty");
        }
        List<Value> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        this.name = name;
        this.column = column.toLowerCase();
        this.sortedValues = Collections.unmodifiableList(sorted);
        this.unique = unique || isPrimaryName(name);
    }

    public static boolean isPrimaryName(String indexName) {
        return CommonConstant.PRIMARY_INDEX.equalsIgnoreCase(indexName);
    }

    public String getName() {
        return name;
    }

    public String getColumn() {
        return column;
    }

    public List<Value> getSortedValues() {
        return sortedValues;
    }

    public boolean isUnique() {
        return unique;
    }

    public boolean isPrimary() {
        return isPrimaryName(name);
    }

    /**
     * 不同非NULL键值的个数(基数)
     */
    public long getCardinality() {
        return sortedValues.stream().filter(v -> !v.isNull()).distinct().count();
    }

    /**
     * 是否包含NULL键
     */
    public boolean hasNulls() {
        return !sortedValues.isEmpty() && sortedValues.get(0).isNull();
    }

    @Override
    public String toString() {
        return "IndexDefinition{" +
                "name='" + name + '\'' +
                ", column='" + column + '\'' +
                ", unique=" + unique +
                ", size=" + sortedValues.size() +
                '}';
    }
}
