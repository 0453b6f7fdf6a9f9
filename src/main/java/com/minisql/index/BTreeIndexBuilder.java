package com.minisql.index;

import com.minisql.config.CommonConstant;
import com.minisql.table.Row;
import com.minisql.table.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * BTreeIndexBuilder - 从列数据构建B+树索引
 *
 * 先按(键, 行ID)排序再顺序插入,同样的输入总是得到同样的树形状。
 * NULL不进入索引。
 *
 * MySQL对应:
 * - CREATE INDEX时的排序构建(sorted index build)
 */
public final class BTreeIndexBuilder {

    private static final Comparator<IndexEntry> ENTRY_ORDER =
            Comparator.comparing(IndexEntry::getKey).thenComparing(IndexEntry::getValue);

    private BTreeIndexBuilder() {
    }

    /**
     * 从(键, 行ID)对构建索引
     *
     * @param entries 键值对(NULL键被跳过)
     * @param order 阶数
     * @return B+树
     */
    public static BTree build(List<IndexEntry> entries, int order) {
        List<IndexEntry> sorted = new ArrayList<>();
        for (IndexEntry entry : entries) {
            if (entry.getKey() != null && !entry.getKey().isNull()) {
                sorted.add(entry);
            }
        }
        sorted.sort(ENTRY_ORDER);

        BTree tree = new BTree(order);
        for (IndexEntry entry : sorted) {
            tree.insert(entry.getKey(), entry.getValue());
        }
        return tree;
    }

    /**
     * 为表的一列构建索引,行ID取id列,没有id列时取行序号(从1开始)
     *
     * @param rows 表的行
     * @param column 索引列
     * @param order 阶数
     * @return B+树
     */
    public static BTree fromColumn(List<Row> rows, String column, int order) {
        return build(columnEntries(rows, column), order);
    }

    /**
     * 提取一列的(键, 行ID)对
     */
    public static List<IndexEntry> columnEntries(List<Row> rows, String column) {
        List<IndexEntry> entries = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Row row = rows.get(i);
            Value key = row.get(column);
            if (key.isNull()) {
                continue;
            }
            Value rowId = row.get(CommonConstant.ROW_ID_COLUMN);
            entries.add(new IndexEntry(key, rowId.isNull() ? Value.ofInt(i + 1L) : rowId));
        }
        return entries;
    }
}
