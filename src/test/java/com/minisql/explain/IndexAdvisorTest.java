package com.minisql.explain;

import com.minisql.TestDatasets;
import com.minisql.parser.SQLParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IndexAdvisorTest - 索引顾问测试
 */
@DisplayName("索引顾问测试")
class IndexAdvisorTest {

    private SQLParser parser;

    private IndexAdvisor advisor;

    @BeforeEach
    void setUp() {
        parser = new SQLParser();
        advisor = new IndexAdvisor(TestDatasets.company());
    }

    @Test
    @DisplayName("测试建议按WHERE/ORDER BY/Composite顺序且最多3条")
    void testRecommendationOrder() {
        List<IndexRecommendation> recommendations = advisor.recommend(parser.parse(
                "SELECT name, salary FROM employees WHERE salary > 50000 ORDER BY hire_date"));

        assertEquals(IndexAdvisor.MAX_RECOMMENDATIONS, recommendations.size());
        assertAll(
                () -> assertEquals(IndexRecommendation.Kind.WHERE_FILTER, recommendations.get(0).getKind()),
                () -> assertEquals("CREATE INDEX idx_employees_salary ON employees(salary);",
                        recommendations.get(0).getSql()),
                () -> assertEquals(IndexRecommendation.Kind.ORDER_BY, recommendations.get(1).getKind()),
                () -> assertEquals("CREATE INDEX idx_employees_hire_date ON employees(hire_date);",
                        recommendations.get(1).getSql()),
                () -> assertEquals(IndexRecommendation.Kind.COMPOSITE, recommendations.get(2).getKind()),
                () -> assertEquals(List.of("salary", "hire_date"), recommendations.get(2).getColumns()),
                () -> assertEquals("CREATE INDEX idx_employees_composite ON employees(salary, hire_date);",
                        recommendations.get(2).getSql())
        );
    }

    @Test
    @DisplayName("测试已有索引的列不再建议")
    void testIndexedColumnSkipped() {
        assertTrue(advisor.recommend(parser.parse("SELECT * FROM employees WHERE department_id = 1")).isEmpty());
    }

    @Test
    @DisplayName("测试覆盖索引建议")
    void testCoveringRecommendation() {
        List<IndexRecommendation> recommendations = advisor.recommend(parser.parse(
                "SELECT name, phone FROM employees"));

        assertEquals(1, recommendations.size());
        assertEquals(IndexRecommendation.Kind.COVERING, recommendations.get(0).getKind());
        assertEquals("CREATE INDEX idx_employees_covering ON employees(name, phone);",
                recommendations.get(0).getSql());
    }

    @Test
    @DisplayName("测试没有表的查询没有建议")
    void testNoTables() {
        assertTrue(advisor.recommend(parser.parse("SELECT 1")).isEmpty());
    }

    @Test
    @DisplayName("测试索引命名")
    void testNaming() {
        assertEquals("idx_t_a_b", IndexAdvisor.indexName("t", List.of("a", "b")));
        assertEquals("CREATE INDEX idx_t_a ON t(a);", IndexAdvisor.createIndexSql("t", "a"));
    }
}
