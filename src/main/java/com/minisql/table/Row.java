package com.minisql.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row - 行数据
 *
 * 有序的 列名 → Value 映射。
 *
 * 设计原则:
 * - 不可变对象(创建后不可修改,通过Builder构建)
 * - 插入顺序只影响展示,不影响相等性
 * - 列名查找先精确匹配,再忽略大小写匹配
 *
 * 连接(JOIN)产生的行同时包含限定列名(e.employee_id)和裸列名(employee_id),
 * 由执行器负责写入,Row本身不区分。
 *
 * "Good taste": 行就是一个有序映射,没有特殊情况
 */
public final class Row {

    /** 空行(用于无FROM的字面量查询) */
    public static final Row EMPTY = new Row(new LinkedHashMap<>());

    /** 列名 → 值(保持插入顺序) */
    private final Map<String, Value> values;

    private Row(LinkedHashMap<String, Value> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * 从有序映射创建行
     *
     * @param values 列名 → 值
     * @return 行
     */
    public static Row of(Map<String, Value> values) {
        return new Row(new LinkedHashMap<>(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 获取列值
     *
     * @param columnName 列名
     * @return 列值,列不存在时返回Value.NULL
     */
    public Value get(String columnName) {
        Value value = lookup(columnName);
        return value != null ? value : Value.NULL;
    }

    /**
     * 按位置获取列值
     *
     * @param index 列索引(从0开始)
     */
    public Value getValue(int index) {
        if (index < 0 || index >= values.size()) {
            throw new IndexOutOfBoundsException("Column index out of bounds: " + index);
        }
        return new ArrayList<>(values.values()).get(index);
    }

    /**
     * 检查列是否存在(忽略大小写)
     */
    public boolean contains(String columnName) {
        return lookup(columnName) != null;
    }

    private Value lookup(String columnName) {
        if (columnName == null) {
            return null;
        }
        Value exact = values.get(columnName);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, Value> entry : values.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(columnName)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public List<String> getColumnNames() {
        return List.copyOf(values.keySet());
    }

    public List<Value> getValues() {
        return List.copyOf(values.values());
    }

    public int getColumnCount() {
        return values.size();
    }

    public Map<String, Value> asMap() {
        return values;
    }

    /**
     * 创建一个以当前行为起点的Builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.values.putAll(values);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Row)) {
            return false;
        }
        return values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    /**
     * Row构建器
     */
    public static final class Builder {

        private final LinkedHashMap<String, Value> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String columnName, Value value) {
            values.put(columnName, value != null ? value : Value.NULL);
            return this;
        }

        public Builder put(String columnName, Object value) {
            return put(columnName, Value.of(value));
        }

        /**
         * 仅当列不存在时写入(JOIN时左表的裸列名优先)
         */
        public Builder putIfAbsent(String columnName, Value value) {
            values.putIfAbsent(columnName, value != null ? value : Value.NULL);
            return this;
        }

        public Row build() {
            return new Row(new LinkedHashMap<>(values));
        }
    }
}
