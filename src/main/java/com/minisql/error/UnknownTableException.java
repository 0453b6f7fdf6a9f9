package com.minisql.error;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * UnknownTableException - 表不存在
 *
 * 引用的表既不在数据集中,也不是已定义的CTE。
 * 建议通过模糊匹配已知表名给出。
 */
public class UnknownTableException extends QueryException {

    private final String tableName;

    public UnknownTableException(String tableName, List<String> availableTables) {
        super("Unknown table: '" + tableName + "'",
                SuggestionMatcher.suggest(tableName, availableTables, "Available tables"),
                ErrorSeverity.ERROR,
                context(tableName, availableTables));
        this.tableName = tableName;
    }

    private UnknownTableException(String tableName, String message, String suggestion,
                                  List<String> availableTables) {
        super(message, suggestion, ErrorSeverity.ERROR, context(tableName, availableTables));
        this.tableName = tableName;
    }

    /**
     * CTE在WITH列表中被提前引用(定义在引用者之后)
     *
     * @param cteName 被引用的CTE
     * @param referencedBy 引用它的CTE
     * @param definedSoFar 引用点之前已定义的CTE
     */
    public static UnknownTableException forwardReference(String cteName, String referencedBy,
                                                         List<String> definedSoFar) {
        return new UnknownTableException(cteName,
                "CTE '" + cteName + "' is referenced by '" + referencedBy + "' before it is defined",
                "Define '" + cteName + "' earlier in the WITH list than '" + referencedBy + "'",
                definedSoFar);
    }

    public String getTableName() {
        return tableName;
    }

    private static Map<String, Object> context(String tableName, List<String> available) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("table", tableName);
        context.put("available", List.copyOf(available));
        return context;
    }
}
