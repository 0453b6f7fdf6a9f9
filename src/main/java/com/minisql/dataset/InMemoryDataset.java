package com.minisql.dataset;

import com.minisql.table.Row;
import com.minisql.table.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * InMemoryDataset - 内存数据集
 *
 * Dataset契约的参考实现。通过Builder一次性构建,之后只读。
 *
 * 使用示例:
 * <pre>
 * Dataset dataset = InMemoryDataset.builder()
 *     .table("departments", "id", "name")
 *     .row("departments", 1, "Engineering")
 *     .row("departments", 2, "Sales")
 *     .primaryKey("departments", "id")
 *     .build();
 * </pre>
 */
public final class InMemoryDataset implements Dataset {

    private final Map<String, List<String>> columns;

    private final Map<String, List<Row>> tables;

    private final Map<String, Map<String, IndexDefinition>> indexes;

    private InMemoryDataset(Map<String, List<String>> columns, Map<String, List<Row>> tables,
                            Map<String, Map<String, IndexDefinition>> indexes) {
        this.columns = columns;
        this.tables = tables;
        this.indexes = indexes;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<Row> getTable(String tableName) {
        return tables.getOrDefault(key(tableName), List.of());
    }

    @Override
    public List<String> getTableColumns(String tableName) {
        return columns.getOrDefault(key(tableName), List.of());
    }

    @Override
    public Map<String, IndexDefinition> getIndexes(String tableName) {
        return indexes.getOrDefault(key(tableName), Map.of());
    }

    @Override
    public List<String> getTableNames() {
        return List.copyOf(columns.keySet());
    }

    private static String key(String tableName) {
        return tableName == null ? "" : tableName.toLowerCase(Locale.ROOT);
    }

    /**
     * InMemoryDataset构建器
     */
    public static final class Builder {

        private final Map<String, List<String>> columns = new LinkedHashMap<>();

        private final Map<String, List<Row>> rows = new LinkedHashMap<>();

        /** 表 → (索引名 → [列名, 是否唯一]) */
        private final Map<String, Map<String, Object[]>> indexSpecs = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 定义表
         *
         * @param name 表名
         * @param columnNames 列名(有序)
         */
        public Builder table(String name, String... columnNames) {
            String table = key(name);
            if (columns.containsKey(table)) {
                throw new IllegalArgumentException("Table already defined: " + name);
            }
            if (columnNames.length == 0) {
                throw new IllegalArgumentException("Table must have at least one column: " + name);
            }
            List<String> lowered = new ArrayList<>();
            for (String column : columnNames) {
                lowered.add(column.toLowerCase(Locale.ROOT));
            }
            columns.put(table, List.copyOf(lowered));
            rows.put(table, new ArrayList<>());
            return this;
        }

        /**
         * 追加一行,值按列定义顺序给出
         */
        public Builder row(String tableName, Object... values) {
            String table = key(tableName);
            List<String> columnNames = requireTable(table);
            if (values.length != columnNames.size()) {
                throw new IllegalArgumentException("Row for " + tableName + " has " + values.length
                        + " values, expected " + columnNames.size());
            }
            Row.Builder row = Row.builder();
            for (int i = 0; i < values.length; i++) {
                row.put(columnNames.get(i), Value.of(values[i]));
            }
            rows.get(table).add(row.build());
            return this;
        }

        /**
         * 声明主键(名为PRIMARY的唯一索引)
         */
        public Builder primaryKey(String tableName, String column) {
            return index(tableName, "PRIMARY", column, true);
        }

        /**
         * 声明单列索引
         */
        public Builder index(String tableName, String indexName, String column, boolean unique) {
            String table = key(tableName);
            List<String> columnNames = requireTable(table);
            if (!columnNames.contains(column.toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Unknown column for index " + indexName + ": " + column);
            }
            indexSpecs.computeIfAbsent(table, t -> new LinkedHashMap<>())
                    .put(indexName, new Object[]{column.toLowerCase(Locale.ROOT), unique});
            return this;
        }

        private List<String> requireTable(String table) {
            List<String> columnNames = columns.get(table);
            if (columnNames == null) {
                throw new IllegalArgumentException("Unknown table: " + table);
            }
            return columnNames;
        }

        public InMemoryDataset build() {
            Map<String, List<Row>> tables = new LinkedHashMap<>();
            for (Map.Entry<String, List<Row>> entry : rows.entrySet()) {
                tables.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
            }

            // 索引键值在构建时从行数据计算
            Map<String, Map<String, IndexDefinition>> indexes = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, Object[]>> entry : indexSpecs.entrySet()) {
                Map<String, IndexDefinition> tableIndexes = new LinkedHashMap<>();
                for (Map.Entry<String, Object[]> declared : entry.getValue().entrySet()) {
                    String column = (String) declared.getValue()[0];
                    boolean unique = (Boolean) declared.getValue()[1];
                    List<Value> values = new ArrayList<>();
                    for (Row row : tables.get(entry.getKey())) {
                        values.add(row.get(column));
                    }
                    tableIndexes.put(declared.getKey(), new IndexDefinition(declared.getKey(), column, values, unique));
                }
                indexes.put(entry.getKey(), Collections.unmodifiableMap(tableIndexes));
            }

            return new InMemoryDataset(Collections.unmodifiableMap(new LinkedHashMap<>(columns)),
                    Collections.unmodifiableMap(tables),
                    Collections.unmodifiableMap(indexes));
        }
    }
}
