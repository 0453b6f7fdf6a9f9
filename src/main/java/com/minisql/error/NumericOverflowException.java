package com.minisql.error;

import java.util.Map;

/**
 * NumericOverflowException - 整数运算超出BIGINT范围
 *
 * 投影中的溢出就地转为NULL并附加警告;WHERE/JOIN/ORDER BY中的溢出中断查询。
 */
public class NumericOverflowException extends QueryException {

    public NumericOverflowException(long left, char operator, long right) {
        super("BIGINT value is out of range in '" + left + " " + operator + " " + right + "'",
                "Use a FLOAT operand, for example " + left + ".0 " + operator + " " + right,
                ErrorSeverity.ERROR,
                Map.of("left", left, "operator", String.valueOf(operator), "right", right));
    }
}
