package com.minisql.explain;

import com.minisql.TestDatasets;
import com.minisql.parser.SQLParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AccessPathComparisonTest - 访问路径比较测试
 */
@DisplayName("访问路径比较测试")
class AccessPathComparisonTest {

    private SQLParser parser;

    private AccessPathEstimator estimator;

    private AccessPathComparison comparison;

    @BeforeEach
    void setUp() {
        parser = new SQLParser();
        estimator = new AccessPathEstimator(TestDatasets.thousandRows());
        comparison = new AccessPathComparison(estimator);
    }

    @Test
    @DisplayName("测试假想索引比全表扫描便宜")
    void testHypotheticalIndexWins() {
        List<TableAccessComparison> tables = comparison.compare(parser.parse("SELECT * FROM t WHERE code = 'C7'"));

        assertEquals(1, tables.size());
        TableAccessComparison t = tables.get(0);
        assertAll(
                () -> assertEquals("t", t.getTable()),
                () -> assertEquals(AccessType.ALL, t.getChosen().getType()),
                () -> assertEquals(3, t.getOptions().size()),
                () -> assertEquals("idx_t_code", t.getCheapest().getLabel()),
                () -> assertTrue(t.getCheapest().isHypothetical()),
                () -> assertEquals(AccessType.REF, t.getCheapest().getType()),
                // 1000行, 50个不同的code
                () -> assertEquals(20, t.getCheapest().getRows()),
                () -> assertEquals("CREATE INDEX idx_t_code ON t(code);",
                        t.getCheapest().getCreateSql().orElseThrow()),
                () -> assertTrue(t.isChosenOptimal()),
                () -> assertTrue(t.isHypotheticalBetter())
        );
    }

    @Test
    @DisplayName("测试已有索引时选择的路径最优且没有假想索引")
    void testExistingIndexChosen() {
        TableAccessComparison t = comparison.compare(parser.parse("SELECT * FROM t WHERE id = 5")).get(0);

        assertEquals(2, t.getOptions().size());
        assertEquals("PRIMARY", t.getCheapest().getLabel());
        assertEquals(AccessType.CONST, t.getCheapest().getType());
        assertEquals(AccessPathComparison.FULL_SCAN_LABEL, t.getOptions().get(1).getLabel());
        assertTrue(t.getHypothetical().isEmpty());
        assertTrue(t.isChosenOptimal());
        assertFalse(t.isHypotheticalBetter());
    }

    @Test
    @DisplayName("测试比较结果与EXPLAIN行一致")
    void testConsistentWithExplain() {
        String sql = "SELECT * FROM t WHERE id BETWEEN 10 AND 20";
        ExplainRow row = estimator.explain(parser.parse(sql)).getRows().get(0);
        TableAccessComparison t = comparison.compare(parser.parse(sql)).get(0);

        assertEquals(row.getType(), t.getChosen().getType());
        assertEquals(row.getRows(), t.getChosen().getRows());
        assertEquals(row.getCost(), t.getChosen().getCost(), 1e-9);
    }

    @Test
    @DisplayName("测试选项按代价升序排列")
    void testOptionsSorted() {
        TableAccessComparison t = comparison.compare(parser.parse("SELECT * FROM t WHERE amount > 100")).get(0);

        for (int i = 1; i < t.getOptions().size(); i++) {
            assertTrue(t.getOptions().get(i - 1).getCost() <= t.getOptions().get(i).getCost());
        }
    }

    @Test
    @DisplayName("测试CTE引用不参与比较")
    void testCteSkipped() {
        AccessPathComparison companyComparison =
                new AccessPathComparison(new AccessPathEstimator(TestDatasets.company()));

        List<TableAccessComparison> tables = companyComparison.compare(parser.parse(
                "WITH x AS (SELECT id FROM departments) SELECT * FROM x"));

        assertTrue(tables.isEmpty());
    }
}
