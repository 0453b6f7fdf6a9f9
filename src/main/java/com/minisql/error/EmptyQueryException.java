package com.minisql.error;

/**
 * EmptyQueryException - 空查询或只有空白字符
 */
public class EmptyQueryException extends QueryException {

    public EmptyQueryException() {
        super("Empty query",
                "Enter a SQL query like: SELECT * FROM employees",
                ErrorSeverity.INFO,
                null);
    }
}
