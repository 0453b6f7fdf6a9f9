package com.minisql.dataset;

import com.minisql.table.Row;

import java.util.List;
import java.util.Map;

/**
 * Dataset - 数据集协作者契约
 *
 * 引擎只通过这个窄接口读取数据,从不修改它。
 * 实现方负责数据的生命周期,引擎不持有全局单例。
 *
 * 表名不区分大小写。
 */
public interface Dataset {

    /**
     * 获取表的全部行(有序)
     *
     * @param tableName 表名
     * @return 行列表,表不存在时返回空列表
     */
    List<Row> getTable(String tableName);

    /**
     * 获取表的列名(有序)
     *
     * @param tableName 表名
     * @return 列名列表,表不存在时返回空列表
     */
    List<String> getTableColumns(String tableName);

    /**
     * 获取表上的索引定义
     *
     * @param tableName 表名
     * @return 索引名 → 索引定义,无索引时返回空映射
     */
    Map<String, IndexDefinition> getIndexes(String tableName);

    /**
     * 所有表名(小写)
     */
    List<String> getTableNames();

    default boolean hasTable(String tableName) {
        return tableName != null && getTableNames().contains(tableName.toLowerCase());
    }
}
