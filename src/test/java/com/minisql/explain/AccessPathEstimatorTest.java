package com.minisql.explain;

import com.minisql.TestDatasets;
import com.minisql.error.UnknownTableException;
import com.minisql.error.UnsupportedFeatureException;
import com.minisql.parser.SQLParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AccessPathEstimatorTest - EXPLAIN模拟器测试
 *
 * 测试内容:
 * - 访问类型分类(const, eq_ref, ref, range, index, ALL)
 * - rows/filtered/key_len估算
 * - Extra列和教学注释
 * - CTE引用和没有表的查询
 */
@DisplayName("EXPLAIN模拟器测试")
class AccessPathEstimatorTest {

    private SQLParser parser;

    private AccessPathEstimator company;

    private AccessPathEstimator thousand;

    @BeforeEach
    void setUp() {
        parser = new SQLParser();
        company = new AccessPathEstimator(TestDatasets.company());
        thousand = new AccessPathEstimator(TestDatasets.thousandRows());
    }

    private ExplainReport explainCompany(String sql) {
        return company.explain(parser.parse(sql));
    }

    private ExplainReport explainThousand(String sql) {
        return thousand.explain(parser.parse(sql));
    }

    // ==================== 访问类型 ====================

    @Test
    @DisplayName("测试主键等值条件为const")
    void testConstLookup() {
        ExplainRow row = explainThousand("SELECT * FROM t WHERE id = 5").getRows().get(0);

        assertAll(
                () -> assertEquals(AccessType.CONST, row.getType()),
                () -> assertEquals("SIMPLE", row.getSelectType()),
                () -> assertEquals(1, row.getRows()),
                () -> assertEquals("PRIMARY", row.getKey().orElseThrow()),
                () -> assertEquals("const", row.getRef().orElseThrow()),
                () -> assertEquals(100.0, row.getFiltered(), 1e-9),
                () -> assertTrue(row.getExtra().isEmpty()),
                () -> assertEquals(2.5, row.getCost(), 1e-9)
        );
    }

    @Test
    @DisplayName("测试无索引列的条件为全表扫描")
    void testFullScan() {
        ExplainReport report = explainThousand("SELECT * FROM t WHERE amount > 500");
        ExplainRow row = report.getRows().get(0);

        assertEquals(AccessType.ALL, row.getType());
        assertEquals(1000, row.getRows());
        assertEquals(50.0, row.getFiltered(), 1e-9);
        assertEquals(List.of(AccessPathEstimator.USING_WHERE), row.getExtra());
        assertTrue(row.getKey().isEmpty());
        assertTrue(row.getPossibleKeys().isEmpty());
        assertEquals(AccessType.Rating.BAD, report.getWorstRating());
    }

    @Test
    @DisplayName("测试字面量写在左侧的条件同样参与估算")
    void testLiteralOnLeft() {
        ExplainRow constRow = explainThousand("SELECT * FROM t WHERE 5 = id").getRows().get(0);
        assertEquals(AccessType.CONST, constRow.getType());
        assertEquals(1, constRow.getRows());

        ExplainRow scanRow = explainThousand("SELECT * FROM t WHERE 'C5' = code").getRows().get(0);
        assertEquals(AccessType.ALL, scanRow.getType());
        assertEquals(50.0, scanRow.getFiltered(), 1e-9);
        assertEquals(List.of(AccessPathEstimator.USING_WHERE), scanRow.getExtra());

        ExplainRow rangeRow = explainThousand("SELECT * FROM t WHERE 3 < id").getRows().get(0);
        assertEquals(AccessType.RANGE, rangeRow.getType());
    }

    @Test
    @DisplayName("测试非唯一索引等值条件为ref,行数按基数估算")
    void testRefLookup() {
        ExplainRow row = explainCompany("SELECT name FROM employees WHERE department_id = 2").getRows().get(0);

        assertAll(
                () -> assertEquals(AccessType.REF, row.getType()),
                () -> assertEquals("idx_department", row.getKey().orElseThrow()),
                () -> assertEquals(List.of("idx_department"), row.getPossibleKeys()),
                () -> assertEquals(3, row.getRows()),
                // INT 4字节 + 可为NULL的1字节
                () -> assertEquals(5, row.getKeyLength().orElseThrow()),
                () -> assertEquals("const", row.getRef().orElseThrow())
        );
    }

    @Test
    @DisplayName("测试主键范围条件为range并下推索引条件")
    void testRange() {
        ExplainRow row = explainCompany("SELECT * FROM employees WHERE id > 3").getRows().get(0);

        assertEquals(AccessType.RANGE, row.getType());
        assertEquals(3, row.getRows());
        assertEquals(List.of(AccessPathEstimator.USING_INDEX_CONDITION), row.getExtra());
        assertTrue(row.getRef().isEmpty());
    }

    @Test
    @DisplayName("测试LIKE前缀可以走range,前导通配符不行")
    void testLikePrefix() {
        ExplainRow prefix = explainCompany("SELECT * FROM employees WHERE id LIKE '1%'").getRows().get(0);
        ExplainRow leading = explainCompany("SELECT * FROM employees WHERE id LIKE '%1'").getRows().get(0);

        assertEquals(AccessType.RANGE, prefix.getType());
        assertEquals(AccessType.ALL, leading.getType());
        assertEquals(List.of("PRIMARY"), leading.getPossibleKeys());
    }

    @Test
    @DisplayName("测试覆盖索引: ref查找不回表")
    void testCoveringRef() {
        ExplainRow row = explainCompany("SELECT id, department_id FROM employees WHERE department_id = 1")
                .getRows().get(0);

        assertEquals(AccessType.REF, row.getType());
        assertEquals(List.of(AccessPathEstimator.USING_INDEX), row.getExtra());
        assertEquals(2.5, row.getCost(), 1e-9);
    }

    @Test
    @DisplayName("测试没有条件但索引覆盖所需列时为index")
    void testFullIndexScan() {
        ExplainReport report = explainCompany("SELECT department_id FROM employees");
        ExplainRow row = report.getRows().get(0);

        assertEquals(AccessType.INDEX, row.getType());
        assertEquals("idx_department", row.getKey().orElseThrow());
        assertEquals(10, row.getRows());
        assertTrue(row.hasExtra(AccessPathEstimator.USING_INDEX));
        assertEquals(AnnotationSeverity.CAUTION, report.annotationsFor("employees").get(0).getSeverity());
    }

    // ==================== JOIN ====================

    @Test
    @DisplayName("测试JOIN目标的唯一索引为eq_ref")
    void testEqRefJoin() {
        ExplainReport report = explainCompany(
                "SELECT e.name, d.name FROM employees e JOIN departments d ON e.department_id = d.id");

        assertEquals(2, report.getRows().size());
        ExplainRow employees = report.getRows().get(0);
        ExplainRow departments = report.getRows().get(1);
        assertAll(
                () -> assertEquals(AccessType.ALL, employees.getType()),
                () -> assertEquals(1, employees.getId()),
                () -> assertEquals(2, departments.getId()),
                () -> assertEquals(AccessType.EQ_REF, departments.getType()),
                () -> assertEquals("e.department_id", departments.getRef().orElseThrow()),
                () -> assertEquals(1, departments.getRows()),
                () -> assertEquals(10, report.getEstimatedRowCombinations())
        );
    }

    @Test
    @DisplayName("测试JOIN列没有索引时使用join buffer")
    void testJoinBuffer() {
        ExplainReport report = explainCompany(
                "SELECT * FROM departments d JOIN employees e ON d.id = e.manager_id");
        ExplainRow employees = report.getRow("employees").orElseThrow();

        assertEquals(AccessType.ALL, employees.getType());
        assertEquals(List.of(AccessPathEstimator.USING_JOIN_BUFFER), employees.getExtra());

        Annotation buffer = report.annotationsFor("employees").stream()
                .filter(a -> a.getValue().equals(AccessPathEstimator.USING_JOIN_BUFFER))
                .findFirst().orElseThrow();
        assertEquals(AnnotationSeverity.WARNING, buffer.getSeverity());
        assertEquals("CREATE INDEX idx_employees_manager_id ON employees(manager_id);",
                buffer.getRecommendation().orElseThrow());
    }

    // ==================== Extra ====================

    @Test
    @DisplayName("测试ORDER BY无索引时Using filesort")
    void testFilesort() {
        ExplainReport report = explainCompany("SELECT * FROM employees ORDER BY salary");
        ExplainRow row = report.getRows().get(0);

        assertEquals(List.of(AccessPathEstimator.USING_FILESORT), row.getExtra());
        Annotation filesort = report.annotationsFor("employees").stream()
                .filter(a -> a.getField().equals("Extra"))
                .findFirst().orElseThrow();
        assertEquals("CREATE INDEX idx_employees_salary ON employees(salary);",
                filesort.getRecommendation().orElseThrow());
    }

    @Test
    @DisplayName("测试按主键排序不需要filesort")
    void testOrderByIndexedColumn() {
        ExplainRow row = explainCompany("SELECT * FROM employees WHERE id > 2 ORDER BY id").getRows().get(0);

        assertFalse(row.hasExtra(AccessPathEstimator.USING_FILESORT));
    }

    @Test
    @DisplayName("测试GROUP BY无索引时Using temporary")
    void testTemporary() {
        ExplainRow row = explainCompany("SELECT name, COUNT(*) FROM employees GROUP BY name").getRows().get(0);

        assertEquals(AccessType.ALL, row.getType());
        assertEquals(List.of(AccessPathEstimator.USING_TEMPORARY), row.getExtra());
    }

    // ==================== 注释 ====================

    @Test
    @DisplayName("测试全表扫描注释给出CREATE INDEX建议")
    void testAnnotations() {
        List<Annotation> annotations = explainThousand("SELECT * FROM t WHERE amount > 500").annotationsFor("t");

        Annotation type = annotations.get(0);
        assertEquals("type", type.getField());
        assertEquals("ALL", type.getValue());
        assertEquals(AnnotationSeverity.WARNING, type.getSeverity());
        assertEquals("CREATE INDEX idx_t_amount ON t(amount);", type.getRecommendation().orElseThrow());

        Annotation key = annotations.get(1);
        assertEquals("No index available on filtered column 'amount'", key.getExplanation());

        Annotation rows = annotations.get(2);
        assertEquals("MySQL estimates examining 1000 rows", rows.getExplanation());
        assertEquals(AnnotationSeverity.CAUTION, rows.getSeverity());
    }

    @Test
    @DisplayName("测试全表扫描且没有WHERE时建议加条件")
    void testNoWhereAdvice() {
        Annotation type = explainCompany("SELECT * FROM employees").annotationsFor("employees").get(0);

        assertTrue(type.getRecommendation().orElseThrow().startsWith("Add a WHERE clause"));
    }

    // ==================== 特殊查询 ====================

    @Test
    @DisplayName("测试没有表的查询")
    void testNoTables() {
        ExplainReport report = explainCompany("SELECT 1");

        assertTrue(report.getRows().isEmpty());
        assertEquals("No tables used", report.getAnnotations().get(0).getExplanation());
        assertEquals(0, report.getEstimatedRowCombinations());
    }

    @Test
    @DisplayName("测试CTE引用显示为DERIVED行")
    void testCteReference() {
        ExplainReport report = explainCompany(
                "WITH big AS (SELECT id FROM departments WHERE budget > 200000) "
                        + "SELECT e.name FROM employees e JOIN big b ON e.department_id = b.id");

        assertEquals(2, report.getRows().size());
        assertEquals("PRIMARY", report.getRows().get(0).getSelectType());
        ExplainRow derived = report.getRows().get(1);
        assertAll(
                () -> assertEquals("DERIVED", derived.getSelectType()),
                () -> assertEquals("big", derived.getTable()),
                () -> assertEquals(0, derived.getRows()),
                () -> assertEquals(List.of(AccessPathEstimator.MATERIALIZED_CTE), derived.getExtra())
        );
    }

    @Test
    @DisplayName("测试未知表和非SELECT语句")
    void testErrors() {
        UnknownTableException e = assertThrows(UnknownTableException.class,
                () -> explainCompany("SELECT * FROM employes"));
        assertEquals("Did you mean: employees?", e.getSuggestion());

        assertThrows(UnsupportedFeatureException.class, () -> explainCompany("DELETE FROM employees"));
    }

    @Test
    @DisplayName("测试文本表格输出")
    void testFormat() {
        String table = explainThousand("SELECT * FROM t WHERE id = 5").format();

        assertTrue(table.startsWith("+----"));
        assertTrue(table.contains("| id "));
        assertTrue(table.contains("| const "));
        assertTrue(table.contains("PRIMARY"));
    }
}
