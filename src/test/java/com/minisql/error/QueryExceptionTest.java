package com.minisql.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueryExceptionTest - 结构化错误与建议测试
 */
@DisplayName("错误分类与修复建议测试")
class QueryExceptionTest {

    @Test
    @DisplayName("测试未知表 - 相近表名给出Did you mean")
    void testUnknownTableSuggestion() {
        UnknownTableException e = new UnknownTableException("employes", List.of("employees", "departments"));

        assertEquals("Unknown table: 'employes'", e.getMessage());
        assertEquals("Did you mean: employees?", e.getSuggestion());
        assertEquals(ErrorSeverity.ERROR, e.getSeverity());
        assertEquals("employes", e.getContext().get("table"));
    }

    @Test
    @DisplayName("测试未知表 - 没有相近表名时列出所有表")
    void testUnknownTableListsAvailable() {
        UnknownTableException e = new UnknownTableException("xyz", List.of("employees", "departments"));

        assertEquals("Available tables: employees, departments", e.getSuggestion());
    }

    @Test
    @DisplayName("测试CTE前向引用 - 建议调整定义顺序")
    void testForwardReference() {
        UnknownTableException e = UnknownTableException.forwardReference("b", "a", List.of("a"));

        assertEquals("b", e.getTableName());
        assertTrue(e.getMessage().contains("before it is defined"));
        assertEquals("Define 'b' earlier in the WITH list than 'a'", e.getSuggestion());
    }

    @Test
    @DisplayName("测试未知列 - 只在该表的列中匹配")
    void testUnknownColumn() {
        UnknownColumnException e = new UnknownColumnException("salry", "employees",
                List.of("id", "name", "salary"));

        assertEquals("Unknown column: 'salry' in table 'employees'", e.getMessage());
        assertEquals("Did you mean: salary?", e.getSuggestion());
        assertEquals("employees", e.getTableName());
        assertEquals("salry", e.getColumnName());
    }

    @Test
    @DisplayName("测试语法错误 - 关键字拼写错误给出更正")
    void testSyntaxTypo() {
        assertEquals("Did you mean: SELECT?", new SqlSyntaxException("Unrecognized statement", "selec").getSuggestion());
        assertEquals("Did you mean: FROM?", new SqlSyntaxException("bad", "FORM").getSuggestion());
        assertEquals("Did you mean: GROUP?", new SqlSyntaxException("bad", "gruop").getSuggestion());
        assertNull(new SqlSyntaxException("bad", "banana").getSuggestion());
        assertNull(new SqlSyntaxException("bad").getSuggestion());
    }

    @Test
    @DisplayName("测试不支持的特性 - 固定WARNING且总有替代方案")
    void testUnsupportedFeature() {
        UnsupportedFeatureException withAlternative = new UnsupportedFeatureException("Subqueries", "Use a JOIN");
        UnsupportedFeatureException withoutAlternative = new UnsupportedFeatureException("CASE expressions");

        assertEquals(ErrorSeverity.WARNING, withAlternative.getSeverity());
        assertEquals("Use a JOIN", withAlternative.getSuggestion());
        assertNotNull(withoutAlternative.getSuggestion());
        assertEquals("Unsupported feature: CASE expressions", withoutAlternative.getMessage());
    }

    @Test
    @DisplayName("测试类型不匹配 - 附上列名")
    void testTypeMismatchWithColumn() {
        TypeMismatchException e = new TypeMismatchException(null, "INT", "VARCHAR").withColumn("salary");

        assertEquals("salary", e.getColumn());
        assertEquals("Type mismatch: column 'salary' is INT, but compared with VARCHAR", e.getMessage());
        assertEquals("VARCHAR", e.getContext().get("got"));
    }

    @Test
    @DisplayName("测试空查询与缺少FROM的严重程度")
    void testEmptyAndNoTables() {
        assertEquals(ErrorSeverity.INFO, new EmptyQueryException().getSeverity());
        assertEquals(ErrorSeverity.ERROR, new NoTablesException().getSeverity());
        assertTrue(new NoTablesException().getContext().isEmpty());
    }

    @Test
    @DisplayName("测试相似度计算")
    void testSimilarity() {
        assertEquals(1.0, SuggestionMatcher.similarity("abc", "abc"));
        assertEquals(0.0, SuggestionMatcher.similarity("abc", "xyz"));
        assertTrue(SuggestionMatcher.closestMatch("deparments", List.of("departments", "employees"),
                SuggestionMatcher.DEFAULT_CUTOFF).isPresent());
        assertTrue(SuggestionMatcher.closestMatch("zzz", List.of(), SuggestionMatcher.DEFAULT_CUTOFF).isEmpty());
    }
}
