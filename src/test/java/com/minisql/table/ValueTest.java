package com.minisql.table;

import com.minisql.error.ErrorSeverity;
import com.minisql.error.NumericOverflowException;
import com.minisql.error.TypeMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ValueTest - 带类型标签的值测试
 */
@DisplayName("Value类型与比较测试")
class ValueTest {

    @Test
    @DisplayName("测试Java对象映射到类型标签")
    void testOfJavaObjects() {
        assertAll(
                () -> assertEquals(ValueType.INTEGER, Value.of(42).getType()),
                () -> assertEquals(ValueType.INTEGER, Value.of(42L).getType()),
                () -> assertEquals(ValueType.FLOAT, Value.of(1.5).getType()),
                () -> assertEquals(ValueType.TEXT, Value.of("abc").getType()),
                () -> assertEquals(ValueType.BOOLEAN, Value.of(true).getType()),
                () -> assertEquals(ValueType.DATE, Value.of(LocalDate.of(2020, 1, 1)).getType()),
                () -> assertSame(Value.NULL, Value.of(null))
        );
        assertThrows(IllegalArgumentException.class, () -> Value.of(new Object()));
    }

    @Test
    @DisplayName("测试全序比较 - NULL最小,整数和浮点数按数值比较")
    void testTotalOrdering() {
        List<Value> values = new ArrayList<>(List.of(Value.ofInt(3), Value.NULL, Value.ofFloat(1.5), Value.ofInt(2)));
        Collections.sort(values);

        assertTrue(values.get(0).isNull());
        assertEquals(1.5, values.get(1).asDouble());
        assertEquals(2, values.get(2).asLong());
        assertEquals(3, values.get(3).asLong());
    }

    @Test
    @DisplayName("测试SQL比较 - 不兼容类型抛出TypeMismatchException")
    void testSqlCompareMismatch() {
        TypeMismatchException e = assertThrows(TypeMismatchException.class,
                () -> Value.ofInt(1).sqlCompare(Value.ofText("abc")));
        assertEquals("INT", e.getExpectedType());
        assertEquals("VARCHAR", e.getActualType());
    }

    @Test
    @DisplayName("测试SQL比较 - 日期与ISO格式字符串比较")
    void testDateComparedWithText() {
        Value date = Value.ofDate(LocalDate.of(2020, 6, 1));

        assertTrue(date.sqlCompare(Value.ofText("2020-01-01")) > 0);
        assertEquals(0, date.sqlCompare(Value.ofText("2020-06-01")));
        assertThrows(TypeMismatchException.class, () -> date.sqlCompare(Value.ofText("June")));
    }

    @Test
    @DisplayName("测试SQL比较 - NULL必须由调用方先处理")
    void testSqlCompareRejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> Value.NULL.sqlCompare(Value.ofInt(1)));
    }

    @Test
    @DisplayName("测试整数运算溢出抛出异常而不回绕")
    void testIntegerOverflow() {
        Value max = Value.ofInt(Long.MAX_VALUE);

        NumericOverflowException e = assertThrows(NumericOverflowException.class, () -> max.add(Value.ofInt(1)));
        assertEquals(ErrorSeverity.ERROR, e.getSeverity());
        assertThrows(NumericOverflowException.class, () -> Value.ofInt(Long.MIN_VALUE).subtract(Value.ofInt(1)));
        assertThrows(NumericOverflowException.class, () -> max.multiply(Value.ofInt(2)));
        assertEquals(Value.ofInt(Long.MAX_VALUE - 1), max.subtract(Value.ofInt(1)));
        assertEquals(ValueType.FLOAT, max.add(Value.ofFloat(1.0)).getType());
    }

    @Test
    @DisplayName("测试算术运算 - NULL传播、除法结果为浮点数、除以0为NULL")
    void testArithmetic() {
        assertAll(
                () -> assertEquals(Value.ofInt(5), Value.ofInt(2).add(Value.ofInt(3))),
                () -> assertEquals(ValueType.INTEGER, Value.ofInt(2).multiply(Value.ofInt(3)).getType()),
                () -> assertEquals(ValueType.FLOAT, Value.ofInt(2).add(Value.ofFloat(0.5)).getType()),
                () -> assertEquals(2.5, Value.ofInt(5).divide(Value.ofInt(2)).asDouble()),
                () -> assertTrue(Value.ofInt(5).divide(Value.ofInt(0)).isNull()),
                () -> assertTrue(Value.ofInt(5).modulo(Value.ofInt(0)).isNull()),
                () -> assertTrue(Value.NULL.add(Value.ofInt(1)).isNull()),
                () -> assertEquals(Value.ofInt(1), Value.ofInt(7).modulo(Value.ofInt(3)))
        );
        assertThrows(TypeMismatchException.class, () -> Value.ofText("a").add(Value.ofInt(1)));
    }

    @Test
    @DisplayName("测试相等性 - 整数1与浮点1.0相等且哈希一致")
    void testNumericEquality() {
        assertEquals(Value.ofInt(1), Value.ofFloat(1.0));
        assertEquals(Value.ofInt(1).hashCode(), Value.ofFloat(1.0).hashCode());
        assertEquals(Value.NULL, Value.of(null));
        assertNotEquals(Value.ofText("1"), Value.ofInt(1));
    }

    @Test
    @DisplayName("测试SQL字面量形式")
    void testSqlLiteral() {
        assertEquals("'O''Brien'", Value.ofText("O'Brien").toSqlLiteral());
        assertEquals("NULL", Value.NULL.toSqlLiteral());
        assertEquals("'2020-01-01'", Value.ofDate(LocalDate.of(2020, 1, 1)).toSqlLiteral());
        assertEquals("TRUE", Value.TRUE.toSqlLiteral());
    }
}
