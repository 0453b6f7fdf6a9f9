package com.minisql.parser;

import java.util.List;

/**
 * CteDefinition - WITH子句中的一个CTE
 *
 * name [(col1, col2)] AS (query)
 */
public class CteDefinition {

    /** CTE名(小写) */
    private final String name;

    /** 括号内的查询文本 */
    private final String query;

    /** 显式列名(可能为空) */
    private final List<String> columns;

    /** 是否引用自身 */
    private final boolean selfReferencing;

    public CteDefinition(String name, String query, List<String> columns, boolean selfReferencing) {
        this.name = name;
        this.query = query;
        this.columns = List.copyOf(columns);
        this.selfReferencing = selfReferencing;
    }

    public String getName() {
        return name;
    }

    public String getQuery() {
        return query;
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean isSelfReferencing() {
        return selfReferencing;
    }

    @Override
    public String toString() {
        return "CteDefinition{" +
                "name='" + name + '\'' +
                ", columns=" + columns +
                ", selfReferencing=" + selfReferencing +
                '}';
    }
}
