package com.minisql.explain;

import java.util.List;
import java.util.Optional;

/**
 * ExplainRow - EXPLAIN输出的一行(每张表一行)
 *
 * 列与MySQL一致: id, select_type, table, type, possible_keys, key, key_len,
 * ref, rows, filtered, Extra。另外带上代价模型算出的代价,
 * 方便和访问路径比较的结果对照。
 */
public final class ExplainRow {

    private final int id;

    private final String selectType;

    private final String table;

    private final AccessType type;

    private final List<String> possibleKeys;

    /** 实际使用的索引,可能为null */
    private final String key;

    /** 使用的索引键长度(字节),可能为null */
    private final Integer keyLength;

    /** 与索引比较的对象: const或另一张表的列,可能为null */
    private final String ref;

    private final long rows;

    private final double filtered;

    private final List<String> extra;

    private final double cost;

    public ExplainRow(int id, String selectType, String table, AccessType type, List<String> possibleKeys,
                      String key, Integer keyLength, String ref, long rows, double filtered,
                      List<String> extra, double cost) {
        if (table == null || type == null) {
            throw new IllegalArgumentException("Explain row needs a table and an access type");
        }
        this.id = id;
        this.selectType = selectType;
        this.table = table;
        this.type = type;
        this.possibleKeys = List.copyOf(possibleKeys);
        this.key = key;
        this.keyLength = keyLength;
        this.ref = ref;
        this.rows = rows;
        this.filtered = filtered;
        this.extra = List.copyOf(extra);
        this.cost = cost;
    }

    public int getId() {
        return id;
    }

    public String getSelectType() {
        return selectType;
    }

    public String getTable() {
        return table;
    }

    public AccessType getType() {
        return type;
    }

    public AccessType.Rating getTypeRating() {
        return type.getRating();
    }

    public List<String> getPossibleKeys() {
        return possibleKeys;
    }

    public Optional<String> getKey() {
        return Optional.ofNullable(key);
    }

    public Optional<Integer> getKeyLength() {
        return Optional.ofNullable(keyLength);
    }

    public Optional<String> getRef() {
        return Optional.ofNullable(ref);
    }

    public long getRows() {
        return rows;
    }

    public double getFiltered() {
        return filtered;
    }

    public List<String> getExtra() {
        return extra;
    }

    public boolean hasExtra(String note) {
        return extra.contains(note);
    }

    public double getCost() {
        return cost;
    }

    /**
     * 按EXPLAIN的列顺序输出单元格文本,NULL写作"NULL"
     */
    public List<String> cells() {
        return List.of(
                String.valueOf(id),
                selectType,
                table,
                type.label(),
                possibleKeys.isEmpty() ? "NULL" : String.join(",", possibleKeys),
                key != null ? key : "NULL",
                keyLength != null ? String.valueOf(keyLength) : "NULL",
                ref != null ? ref : "NULL",
                String.valueOf(rows),
                String.format("%.2f", filtered),
                String.join("; ", extra));
    }

    @Override
    public String toString() {
        return "ExplainRow{" +
                "table='" + table + '\'' +
                ", type=" + type +
                ", key=" + key +
                ", rows=" + rows +
                ", filtered=" + filtered +
                ", extra=" + extra +
                '}';
    }
}
