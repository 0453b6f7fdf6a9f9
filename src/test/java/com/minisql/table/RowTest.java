package com.minisql.table;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RowTest - 行数据测试
 */
@DisplayName("Row行数据测试")
class RowTest {

    @Test
    @DisplayName("测试列名查找 - 先精确匹配再忽略大小写")
    void testLookup() {
        Row row = Row.builder().put("name", "Alice").put("Salary", 100).build();

        assertEquals("Alice", row.get("name").asText());
        assertEquals(100, row.get("salary").asLong());
        assertTrue(row.contains("NAME"));
        assertTrue(row.get("missing").isNull());
        assertFalse(row.contains("missing"));
    }

    @Test
    @DisplayName("测试插入顺序保留,相等性与顺序无关")
    void testOrderAndEquality() {
        Row first = Row.builder().put("a", 1).put("b", 2).build();
        Row second = Row.builder().put("b", 2).put("a", 1).build();

        assertEquals(List.of("a", "b"), first.getColumnNames());
        assertEquals(Value.ofInt(2), first.getValue(1));
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertThrows(IndexOutOfBoundsException.class, () -> first.getValue(2));
    }

    @Test
    @DisplayName("测试putIfAbsent不覆盖已有列")
    void testPutIfAbsent() {
        Row row = Row.builder().put("id", 1).putIfAbsent("id", Value.ofInt(2)).putIfAbsent("x", null).build();

        assertEquals(1, row.get("id").asLong());
        assertTrue(row.contains("x"));
        assertTrue(row.get("x").isNull());
    }

    @Test
    @DisplayName("测试行不可变,toBuilder生成新行")
    void testImmutability() {
        Row row = Row.builder().put("a", 1).build();
        Row copy = row.toBuilder().put("b", 2).build();

        assertEquals(1, row.getColumnCount());
        assertEquals(2, copy.getColumnCount());
        assertThrows(UnsupportedOperationException.class, () -> row.asMap().put("c", Value.NULL));
    }
}
