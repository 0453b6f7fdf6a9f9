package com.minisql;

import com.minisql.config.EngineConfig;
import com.minisql.error.QueryException;
import com.minisql.error.SqlSyntaxException;
import com.minisql.error.UnknownTableException;
import com.minisql.explain.AccessType;
import com.minisql.explain.ExplainReport;
import com.minisql.index.LookupResult;
import com.minisql.parser.QueryType;
import com.minisql.result.QueryOutcome;
import com.minisql.result.QueryResult;
import com.minisql.table.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MiniSQLTest - 引擎入口测试
 *
 * 只验证各组件能通过入口协同工作,细节在各组件自己的测试里。
 */
@DisplayName("引擎入口测试")
class MiniSQLTest {

    private MiniSQL engine;

    @BeforeEach
    void setUp() {
        engine = new MiniSQL(TestDatasets.company(), EngineConfig.builder().defaultBTreeOrder(3).build());
    }

    @Test
    @DisplayName("测试执行查询")
    void testExecute() {
        QueryResult result = engine.execute("SELECT name FROM employees WHERE salary > 90000 ORDER BY salary DESC");

        assertEquals(2, result.getRowCount());
        assertEquals("Eve", result.getRows().get(0).get("name").asText());
    }

    @Test
    @DisplayName("测试run把错误包装成结果")
    void testRunFailure() {
        QueryOutcome outcome = engine.run("SELECT * FROM employes");

        assertFalse(outcome.isSuccess());
        assertTrue(outcome.getResult().isEmpty());
        QueryException error = outcome.getError().orElseThrow();
        assertTrue(error instanceof UnknownTableException);
        assertEquals("Did you mean: employees?", error.getSuggestion());
    }

    @Test
    @DisplayName("测试未闭合的字符串报告语法错误")
    void testRunUnterminatedString() {
        QueryOutcome outcome = engine.run("SELECT 'abc FROM employees");

        assertFalse(outcome.isSuccess());
        assertTrue(outcome.getError().orElseThrow() instanceof SqlSyntaxException);
        assertEquals("Unterminated string literal", outcome.getError().orElseThrow().getMessage());
    }

    @Test
    @DisplayName("测试run成功")
    void testRunSuccess() {
        QueryOutcome outcome = engine.run("SELECT COUNT(*) AS n FROM departments");

        assertTrue(outcome.isSuccess());
        assertEquals(Value.ofInt(4), outcome.getResult().orElseThrow().getRows().get(0).get("n"));
    }

    @Test
    @DisplayName("测试解析不抛异常")
    void testParse() {
        assertEquals(QueryType.UNKNOWN, engine.parse("SELEC * FROM employees").getQueryType());
        assertEquals(QueryType.SELECT, engine.parse("SELECT * FROM employees").getQueryType());
    }

    @Test
    @DisplayName("测试EXPLAIN和访问路径比较")
    void testExplain() {
        ExplainReport report = engine.explain("SELECT * FROM employees WHERE id = 5");

        assertEquals(AccessType.CONST, report.getRows().get(0).getType());
        assertEquals(1, engine.compareAccessPaths("SELECT * FROM employees WHERE salary > 50000").size());
    }

    @Test
    @DisplayName("测试使用配置的B+树阶数查找")
    void testLookup() {
        LookupResult result = engine.lookup("SELECT * FROM employees WHERE department_id = 3");

        assertEquals(3, result.getTree().getOrder());
        assertEquals(2, result.getMatches().size());
        assertEquals(3, engine.buildIndex("employees", "salary").getOrder());
    }

    @Test
    @DisplayName("测试分析")
    void testAnalyze() {
        assertTrue(engine.analyze("SELECT * FROM employees").getOutcome().isSuccess());
    }

    @Test
    @DisplayName("测试参数校验")
    void testNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> new MiniSQL(null));
        assertThrows(IllegalArgumentException.class, () -> new MiniSQL(TestDatasets.company(), null));
    }
}
