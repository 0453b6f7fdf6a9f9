package com.minisql.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * TypeMismatchException - 比较或运算的类型不兼容
 *
 * 逐行求值时被执行器就地吞掉(视为"不匹配"),不会中断整个查询。
 */
public class TypeMismatchException extends QueryException {

    private final String column;

    private final String expectedType;

    private final String actualType;

    /**
     * @param column 列名(未知时为null)
     * @param expectedType 期望的类型
     * @param actualType 实际的类型
     */
    public TypeMismatchException(String column, String expectedType, String actualType) {
        super(message(column, expectedType, actualType),
                "Use a " + expectedType + " value for comparison",
                ErrorSeverity.ERROR,
                context(column, expectedType, actualType));
        this.column = column;
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    /**
     * 附上列名重新抛出
     */
    public TypeMismatchException withColumn(String columnName) {
        return new TypeMismatchException(columnName, expectedType, actualType);
    }

    public String getColumn() {
        return column;
    }

    public String getExpectedType() {
        return expectedType;
    }

    public String getActualType() {
        return actualType;
    }

    private static String message(String column, String expected, String actual) {
        if (column == null) {
            return "Type mismatch: " + expected + " compared with " + actual;
        }
        return "Type mismatch: column '" + column + "' is " + expected + ", but compared with " + actual;
    }

    private static Map<String, Object> context(String column, String expected, String actual) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("column", column);
        context.put("expected", expected);
        context.put("got", actual);
        return context;
    }
}
