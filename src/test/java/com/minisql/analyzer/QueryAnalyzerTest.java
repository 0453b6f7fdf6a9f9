package com.minisql.analyzer;

import com.minisql.TestDatasets;
import com.minisql.error.EmptyQueryException;
import com.minisql.error.UnknownTableException;
import com.minisql.error.UnsupportedFeatureException;
import com.minisql.executor.QueryExecutor;
import com.minisql.explain.AccessType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueryAnalyzerTest - 查询分析器测试
 *
 * 测试内容:
 * - 反模式检测和整体评级
 * - 执行失败时仍然给出分析
 * - 提示的生成
 */
@DisplayName("查询分析器测试")
class QueryAnalyzerTest {

    private QueryAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new QueryAnalyzer(new QueryExecutor(TestDatasets.company()));
    }

    @Test
    @DisplayName("测试SELECT *和前导通配符LIKE为CRITICAL")
    void testLeadingWildcard() {
        QueryAnalysis analysis = analyzer.analyze("SELECT * FROM employees WHERE name LIKE '%son'");

        assertAll(
                () -> assertTrue(analysis.getOutcome().isSuccess()),
                () -> assertTrue(analysis.hasIssue(QueryAnalyzer.SELECT_STAR)),
                () -> assertTrue(analysis.hasIssue(QueryAnalyzer.LEADING_WILDCARD)),
                () -> assertFalse(analysis.hasIssue(QueryAnalyzer.NO_WHERE)),
                () -> assertEquals(OverallSeverity.CRITICAL, analysis.getOverallSeverity()),
                () -> assertEquals(AccessType.Rating.BAD, analysis.getAccessRating()),
                () -> assertTrue(analysis.getTips().contains(
                        "Consider adding indexes on filtered columns to avoid full table scans")),
                () -> assertTrue(analysis.getTips().contains("Selecting specific columns reduces I/O and memory usage"))
        );
    }

    @Test
    @DisplayName("测试主键查找没有问题")
    void testCleanQuery() {
        QueryAnalysis analysis = analyzer.analyze("SELECT name FROM employees WHERE id = 3");

        assertTrue(analysis.getIssues().isEmpty());
        assertEquals(OverallSeverity.GOOD, analysis.getOverallSeverity());
        assertEquals(AccessType.Rating.GOOD, analysis.getAccessRating());
        assertEquals(1, analysis.getOutcome().getResult().orElseThrow().getRowCount());
        assertEquals(1, analysis.getTips().size());
        assertTrue(analysis.getTips().get(0).startsWith("Query looks reasonable!"));
    }

    @Test
    @DisplayName("测试ORDER BY没有LIMIT为WARNING并提示filesort")
    void testOrderWithoutLimit() {
        QueryAnalysis analysis = analyzer.analyze("SELECT name FROM employees ORDER BY salary");

        assertTrue(analysis.hasIssue(QueryAnalyzer.ORDER_WITHOUT_LIMIT));
        assertTrue(analysis.hasIssue(QueryAnalyzer.NO_WHERE));
        assertEquals(OverallSeverity.WARNING, analysis.getOverallSeverity());
        assertTrue(analysis.getTips().contains("Add an index that matches your ORDER BY to avoid filesort"));
        assertFalse(analysis.getRecommendations().isEmpty());
    }

    @Test
    @DisplayName("测试OR条件执行失败但仍有分析")
    void testOrConditions() {
        QueryAnalysis analysis = analyzer.analyze("SELECT name FROM employees WHERE id = 1 OR id = 2");

        assertFalse(analysis.getOutcome().isSuccess());
        assertTrue(analysis.getOutcome().getError().orElseThrow() instanceof UnsupportedFeatureException);
        assertTrue(analysis.hasIssue(QueryAnalyzer.OR_CONDITIONS));
        assertFalse(analysis.hasIssue(QueryAnalyzer.NO_WHERE));
    }

    @Test
    @DisplayName("测试列上的函数")
    void testFunctionOnColumn() {
        QueryAnalysis analysis = analyzer.analyze("SELECT name FROM employees WHERE UPPER(name) = 'ALICE'");

        assertTrue(analysis.hasIssue(QueryAnalyzer.FUNCTION_ON_COLUMN));
        assertTrue(analysis.getIssues().stream()
                .anyMatch(i -> i.getTitle().equals("Function on Column: UPPER()")));
        assertEquals(OverallSeverity.CRITICAL, analysis.getOverallSeverity());
    }

    @Test
    @DisplayName("测试NOT IN和DISTINCT")
    void testNotInAndDistinct() {
        assertTrue(analyzer.analyze("SELECT name FROM employees WHERE department_id NOT IN (1, 2)")
                .hasIssue(QueryAnalyzer.NOT_IN));

        QueryAnalysis distinct = analyzer.analyze("SELECT DISTINCT department_id FROM employees");
        assertTrue(distinct.hasIssue(QueryAnalyzer.DISTINCT));
        assertEquals(OverallSeverity.GOOD, distinct.getOverallSeverity());

        assertTrue(analyzer.analyze("SELECT COUNT(DISTINCT department_id) FROM employees")
                .hasIssue(QueryAnalyzer.DISTINCT));
    }

    @Test
    @DisplayName("测试子查询")
    void testSubquery() {
        QueryAnalysis analysis = analyzer.analyze(
                "SELECT name FROM employees WHERE department_id IN (SELECT id FROM departments)");

        assertTrue(analysis.hasIssue(QueryAnalyzer.SUBQUERY));
        assertFalse(analysis.getOutcome().isSuccess());
    }

    @Test
    @DisplayName("测试空查询")
    void testEmptyQuery() {
        QueryAnalysis analysis = analyzer.analyze("   ");

        assertTrue(analysis.getOutcome().getError().orElseThrow() instanceof EmptyQueryException);
        assertTrue(analysis.getIssues().isEmpty());
        assertTrue(analysis.getExplain().isEmpty());
    }

    @Test
    @DisplayName("测试未知表时没有EXPLAIN")
    void testUnknownTable() {
        QueryAnalysis analysis = analyzer.analyze("SELECT name FROM employes");

        assertTrue(analysis.getOutcome().getError().orElseThrow() instanceof UnknownTableException);
        assertTrue(analysis.getExplain().isEmpty());
        assertEquals(AccessType.Rating.GOOD, analysis.getAccessRating());
    }

    @Test
    @DisplayName("测试没有表的查询不报告缺少WHERE")
    void testLiteralSelect() {
        QueryAnalysis analysis = analyzer.analyze("SELECT 1 + 1 AS two");

        assertFalse(analysis.hasIssue(QueryAnalyzer.NO_WHERE));
        assertTrue(analysis.getExplain().isEmpty());
        assertTrue(analysis.getOutcome().isSuccess());
    }

    @Test
    @DisplayName("测试结果行数多时建议LIMIT")
    void testLargeResult() {
        QueryAnalyzer large = new QueryAnalyzer(new QueryExecutor(TestDatasets.thousandRows()));

        QueryAnalysis analysis = large.analyze("SELECT id FROM t");

        assertTrue(analysis.getTips().contains("Consider adding LIMIT if you don't need all rows"));
        assertEquals(AccessType.Rating.CAUTION, analysis.getAccessRating());
    }
}
