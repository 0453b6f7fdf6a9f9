package com.minisql.error;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * UnknownColumnException - 列不存在
 *
 * 建议只在该表的列中模糊匹配。
 */
public class UnknownColumnException extends QueryException {

    private final String columnName;

    private final String tableName;

    public UnknownColumnException(String columnName, String tableName, List<String> availableColumns) {
        super("Unknown column: '" + columnName + "' in table '" + tableName + "'",
                SuggestionMatcher.suggest(columnName, availableColumns,
                        "Available columns in " + tableName),
                ErrorSeverity.ERROR,
                context(columnName, tableName, availableColumns));
        this.columnName = columnName;
        this.tableName = tableName;
    }

    public String getColumnName() {
        return columnName;
    }

    public String getTableName() {
        return tableName;
    }

    private static Map<String, Object> context(String column, String table, List<String> available) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("column", column);
        context.put("table", table);
        context.put("available", List.copyOf(available));
        return context;
    }
}
