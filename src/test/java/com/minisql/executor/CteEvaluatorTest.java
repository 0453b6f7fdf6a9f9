package com.minisql.executor;

import com.minisql.TestDatasets;
import com.minisql.config.EngineConfig;
import com.minisql.error.SqlSyntaxException;
import com.minisql.error.UnknownTableException;
import com.minisql.result.CteExecutionInfo;
import com.minisql.result.QueryResult;
import com.minisql.table.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CteEvaluatorTest - CTE物化测试
 */
@DisplayName("CTE物化测试")
class CteEvaluatorTest {

    private static final String COUNT_TO_TEN =
            "WITH RECURSIVE nums(n) AS (SELECT 1 UNION ALL SELECT n + 1 FROM nums WHERE n < 10) "
                    + "SELECT n FROM nums";

    private QueryExecutor executor(int maxDepth) {
        return new QueryExecutor(TestDatasets.company(),
                EngineConfig.builder().maxRecursionDepth(maxDepth).build());
    }

    private List<Long> column(QueryResult result, String name) {
        return result.getRows().stream().map(r -> r.get(name).asLong()).collect(Collectors.toList());
    }

    @Test
    @DisplayName("测试递归CTE生成1到10")
    void testRecursiveSequence() {
        QueryResult result = executor(100).execute(COUNT_TO_TEN);

        assertEquals(List.of(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L, 10L), column(result, "n"));
        assertTrue(result.getWarnings().isEmpty());

        CteExecutionInfo info = result.getCteInfo().get(0);
        assertAll(
                () -> assertEquals("nums", info.getName()),
                () -> assertEquals(10, info.getRowCount()),
                () -> assertTrue(info.isRecursive()),
                () -> assertFalse(info.isTruncated()),
                () -> assertEquals(List.of("n"), info.getColumns())
        );
    }

    @Test
    @DisplayName("测试达到最大递归深度时截断并警告")
    void testRecursionLimit() {
        QueryResult result = executor(3).execute(COUNT_TO_TEN);

        assertEquals(List.of(1L, 2L, 3L, 4L), column(result, "n"));
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).contains("maximum recursion depth (3)"));
        assertTrue(result.getCteInfo().get(0).isTruncated());
        assertEquals(3, result.getCteInfo().get(0).getIterations());
    }

    @Test
    @DisplayName("测试没有终止条件的递归被上限截断")
    void testUnboundedRecursion() {
        QueryResult result = executor(50).execute(
                "WITH RECURSIVE r AS (SELECT 1 AS x UNION ALL SELECT x + 1 FROM r) SELECT COUNT(*) AS c FROM r");

        assertEquals(Value.ofInt(51), result.getRows().get(0).get("c"));
        assertFalse(result.getWarnings().isEmpty());
    }

    @Test
    @DisplayName("测试UNION去重使递归收敛")
    void testUnionDeduplication() {
        QueryResult result = executor(100).execute(
                "WITH RECURSIVE r AS (SELECT 1 AS x UNION SELECT x FROM r) SELECT x FROM r");

        assertEquals(List.of(1L), column(result, "x"));
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    @DisplayName("测试递归遍历管理链")
    void testHierarchy() {
        QueryResult result = executor(100).execute(
                "WITH RECURSIVE chain AS ("
                        + "SELECT id, name, manager_id FROM employees WHERE id = 7 "
                        + "UNION ALL "
                        + "SELECT e.id, e.name, e.manager_id FROM employees e JOIN chain c ON e.id = c.manager_id"
                        + ") SELECT name FROM chain");

        assertEquals(List.of("Grace", "Frank", "Carol", "Alice"),
                result.getRows().stream().map(r -> r.get("name").asText()).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("测试普通CTE可以被后面的CTE引用")
    void testChainedCtes() {
        QueryResult result = executor(100).execute(
                "WITH rich AS (SELECT id, name, salary FROM employees WHERE salary > 80000), "
                        + "top AS (SELECT name FROM rich WHERE salary > 100000) "
                        + "SELECT name FROM top");

        assertEquals(1, result.getRowCount());
        assertEquals("Eve", result.getRows().get(0).get("name").asText());
        assertEquals(2, result.getCteInfo().size());
        assertEquals(3, result.getCteInfo().get(0).getRowCount());
        assertFalse(result.getCteInfo().get(0).isRecursive());
    }

    @Test
    @DisplayName("测试CTE查询体中的UNION ALL保留重复")
    void testUnionAllInSimpleCte() {
        QueryResult result = executor(100).execute(
                "WITH x AS (SELECT 1 AS v UNION ALL SELECT 1 UNION ALL SELECT 2) SELECT v FROM x");

        assertEquals(List.of(1L, 1L, 2L), column(result, "v"));
    }

    @Test
    @DisplayName("测试前向引用报错")
    void testForwardReference() {
        UnknownTableException e = assertThrows(UnknownTableException.class, () -> executor(100).execute(
                "WITH a AS (SELECT id FROM b), b AS (SELECT id FROM employees) SELECT * FROM a"));

        assertEquals("b", e.getTableName());
        assertTrue(e.getMessage().contains("before it is defined"));
    }

    @Test
    @DisplayName("测试UNION成员列数不一致")
    void testColumnCountMismatch() {
        assertThrows(SqlSyntaxException.class, () -> executor(100).execute(
                "WITH x AS (SELECT 1 AS a UNION ALL SELECT 1, 2) SELECT * FROM x"));
    }

    @Test
    @DisplayName("测试CTE可以与数据集表JOIN")
    void testCteJoin() {
        QueryResult result = executor(100).execute(
                "WITH big AS (SELECT id FROM departments WHERE budget >= 300000) "
                        + "SELECT e.name FROM employees e JOIN big b ON e.department_id = b.id");

        assertEquals(4, result.getRowCount());
    }
}
