package com.minisql.explain;

import com.minisql.dataset.IndexDefinition;
import com.minisql.table.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CostModelTest - 代价模型测试
 */
@DisplayName("代价模型测试")
class CostModelTest {

    private final CostModel model = CostModel.DEFAULT;

    @Test
    @DisplayName("测试各访问类型的行数估算")
    void testEstimateRows() {
        assertAll(
                () -> assertEquals(1, model.estimateRows(AccessType.CONST, 1000, null)),
                () -> assertEquals(1, model.estimateRows(AccessType.EQ_REF, 1000, null)),
                () -> assertEquals(100, model.estimateRows(AccessType.REF, 1000, null)),
                () -> assertEquals(300, model.estimateRows(AccessType.RANGE, 1000, null)),
                () -> assertEquals(1000, model.estimateRows(AccessType.INDEX, 1000, null)),
                () -> assertEquals(1000, model.estimateRows(AccessType.ALL, 1000, null)),
                () -> assertEquals(1, model.estimateRows(AccessType.RANGE, 2, null))
        );
    }

    @Test
    @DisplayName("测试ref按索引基数估算")
    void testRefUsesCardinality() {
        IndexDefinition index = new IndexDefinition("idx", "c",
                List.of(Value.ofInt(1), Value.ofInt(1), Value.ofInt(2), Value.NULL), false);

        // 3个非NULL键 / 2个不同值
        assertEquals(2, model.estimateRows(AccessType.REF, 4, index));
    }

    @Test
    @DisplayName("测试filtered随剩余条件数下降并有下限")
    void testFiltered() {
        assertEquals(100.0, model.filtered(0), 1e-9);
        assertEquals(50.0, model.filtered(1), 1e-9);
        assertEquals(100.0 / 3, model.filtered(2), 1e-9);
        assertEquals(CostModel.MIN_FILTERED, model.filtered(20), 1e-9);
    }

    @Test
    @DisplayName("测试代价公式")
    void testCost() {
        assertEquals(100.0, model.cost(AccessType.ALL, 100, false), 1e-9);
        assertEquals(50.0, model.cost(AccessType.INDEX, 100, true), 1e-9);
        assertEquals(150.0, model.cost(AccessType.INDEX, 100, false), 1e-9);
        assertEquals(16.0, model.cost(AccessType.REF, 10, false), 1e-9);
        assertEquals(6.0, model.cost(AccessType.REF, 10, true), 1e-9);
    }

    @Test
    @DisplayName("测试访问类型优劣顺序")
    void testAccessTypeOrder() {
        assertTrue(AccessType.CONST.isBetterThan(AccessType.REF));
        assertTrue(AccessType.INDEX.isBetterThan(AccessType.ALL));
        assertFalse(AccessType.ALL.isBetterThan(AccessType.RANGE));
        assertEquals("eq_ref", AccessType.EQ_REF.label());
        assertEquals(AccessType.Rating.CAUTION, AccessType.INDEX.getRating());
    }
}
