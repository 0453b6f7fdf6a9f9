package com.minisql.error;

/**
 * NoTablesException - 查询需要表但没有FROM子句
 */
public class NoTablesException extends QueryException {

    public NoTablesException() {
        super("No table specified in query",
                "Add a FROM clause: SELECT * FROM employees",
                ErrorSeverity.ERROR,
                null);
    }
}
