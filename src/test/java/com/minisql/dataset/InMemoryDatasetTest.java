package com.minisql.dataset;

import com.minisql.TestDatasets;
import com.minisql.table.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryDatasetTest - 内存数据集测试
 */
@DisplayName("内存数据集测试")
class InMemoryDatasetTest {

    private InMemoryDataset dataset;

    @BeforeEach
    void setUp() {
        dataset = TestDatasets.company();
    }

    @Test
    @DisplayName("测试表名和列名不区分大小写")
    void testCaseInsensitiveTables() {
        assertEquals(10, dataset.getTable("EMPLOYEES").size());
        assertEquals(List.of("id", "name", "budget"), dataset.getTableColumns("Departments"));
        assertTrue(dataset.hasTable("Employees"));
        assertFalse(dataset.hasTable(null));
        assertEquals(List.of("departments", "employees"), dataset.getTableNames());
    }

    @Test
    @DisplayName("测试不存在的表返回空结果")
    void testMissingTable() {
        assertTrue(dataset.getTable("nope").isEmpty());
        assertTrue(dataset.getTableColumns("nope").isEmpty());
        assertTrue(dataset.getIndexes("nope").isEmpty());
    }

    @Test
    @DisplayName("测试索引在构建时计算键值")
    void testIndexes() {
        IndexDefinition primary = dataset.getIndexes("employees").get("PRIMARY");
        IndexDefinition department = dataset.getIndexes("employees").get("idx_department");

        assertTrue(primary.isUnique());
        assertTrue(primary.isPrimary());
        assertEquals(10, primary.getCardinality());
        assertFalse(department.isUnique());
        assertEquals(3, department.getCardinality());
        assertTrue(department.hasNulls());
        assertEquals(Value.NULL, department.getSortedValues().get(0));
    }

    @Test
    @DisplayName("测试非法构建参数")
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> InMemoryDataset.builder().table("t", "a").row("t", 1, 2));
        assertThrows(IllegalArgumentException.class,
                () -> InMemoryDataset.builder().table("t", "a").index("t", "idx", "b", false));
        assertThrows(IllegalArgumentException.class,
                () -> InMemoryDataset.builder().row("missing", 1));
        assertThrows(IllegalArgumentException.class,
                () -> InMemoryDataset.builder().table("t", "a").table("T", "b"));
    }
}
