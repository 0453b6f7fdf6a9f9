package com.minisql.executor;

import com.minisql.error.TypeMismatchException;
import com.minisql.parser.Condition;
import com.minisql.parser.Expression;
import com.minisql.parser.expressions.BinaryExpression;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.parser.expressions.LiteralExpression;
import com.minisql.parser.expressions.Operator;
import com.minisql.table.Row;
import com.minisql.table.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConditionEvaluatorTest - 谓词求值测试
 *
 * 重点是NULL语义和类型不匹配。
 */
@DisplayName("谓词求值测试")
class ConditionEvaluatorTest {

    private ConditionEvaluator evaluator;

    private Row row;

    @BeforeEach
    void setUp() {
        evaluator = new ConditionEvaluator(new ExpressionEvaluator());
        row = Row.builder()
                .put("age", 30)
                .put("name", "Alice")
                .put("score", 7.5)
                .put("phone", Value.NULL)
                .build();
    }

    private static Condition condition(String column, Operator operator, Object... values) {
        Expression[] right = Arrays.stream(values)
                .map(v -> new LiteralExpression(Value.of(v)))
                .toArray(Expression[]::new);
        return new Condition(new ColumnExpression(column), operator, List.of(right), column + " " + operator);
    }

    @Test
    @DisplayName("测试比较运算符")
    void testComparisons() {
        assertAll(
                () -> assertTrue(evaluator.matches(condition("age", Operator.EQUAL, 30), row)),
                () -> assertTrue(evaluator.matches(condition("age", Operator.NOT_EQUAL, 31), row)),
                () -> assertTrue(evaluator.matches(condition("age", Operator.GREATER_THAN, 29.5), row)),
                () -> assertTrue(evaluator.matches(condition("age", Operator.LESS_EQUAL, 30), row)),
                () -> assertFalse(evaluator.matches(condition("age", Operator.LESS_THAN, 30), row)),
                () -> assertTrue(evaluator.matches(condition("score", Operator.GREATER_EQUAL, 7), row))
        );
    }

    @Test
    @DisplayName("测试字符串相等区分大小写,LIKE不区分")
    void testStringMatching() {
        assertFalse(evaluator.matches(condition("name", Operator.EQUAL, "alice"), row));
        assertTrue(evaluator.matches(condition("name", Operator.LIKE, "al%"), row));
        assertTrue(evaluator.matches(condition("name", Operator.LIKE, "_lice"), row));
        assertTrue(evaluator.matches(condition("name", Operator.NOT_LIKE, "b%"), row));
    }

    @Test
    @DisplayName("测试LIKE中的正则字符按字面匹配")
    void testLikeQuotesRegex() {
        assertTrue(evaluator.like("a.b", "a.b"));
        assertFalse(evaluator.like("axb", "a.b"));
        assertTrue(evaluator.like("50% off", "50%"));
    }

    @Test
    @DisplayName("测试LIKE模式缓存有上限")
    void testLikeCacheBounded() {
        for (int i = 0; i < ConditionEvaluator.LIKE_CACHE_SIZE * 3; i++) {
            assertTrue(evaluator.like("item" + i, "item" + i + "%"));
        }

        assertEquals(ConditionEvaluator.LIKE_CACHE_SIZE, evaluator.cachedPatternCount());
        assertTrue(evaluator.like("item0", "item0%"));
    }

    @Test
    @DisplayName("测试NULL只被IS NULL匹配")
    void testNullSemantics() {
        assertAll(
                () -> assertFalse(evaluator.matches(condition("phone", Operator.EQUAL, (Object) null), row)),
                () -> assertFalse(evaluator.matches(condition("phone", Operator.NOT_EQUAL, "x"), row)),
                () -> assertFalse(evaluator.matches(condition("age", Operator.EQUAL, (Object) null), row)),
                () -> assertFalse(evaluator.matches(condition("phone", Operator.LIKE, "%"), row)),
                () -> assertTrue(evaluator.matches(condition("phone", Operator.IS_NULL), row)),
                () -> assertFalse(evaluator.matches(condition("phone", Operator.IS_NOT_NULL), row)),
                () -> assertFalse(evaluator.matches(condition("missing", Operator.EQUAL, 1), row))
        );
    }

    @Test
    @DisplayName("测试IN和NOT IN的NULL处理")
    void testInList() {
        assertTrue(evaluator.matches(condition("age", Operator.IN, null, 30), row));
        assertFalse(evaluator.matches(condition("age", Operator.IN, 1, 2), row));
        assertTrue(evaluator.matches(condition("age", Operator.NOT_IN, 1, 2), row));
        assertFalse(evaluator.matches(condition("age", Operator.NOT_IN, 1, null), row));
    }

    @Test
    @DisplayName("测试BETWEEN为闭区间")
    void testBetween() {
        assertTrue(evaluator.matches(condition("age", Operator.BETWEEN, 30, 40), row));
        assertTrue(evaluator.matches(condition("age", Operator.BETWEEN, 20, 30), row));
        assertFalse(evaluator.matches(condition("age", Operator.NOT_BETWEEN, 20, 30), row));
        assertFalse(evaluator.matches(condition("age", Operator.BETWEEN, null, 40), row));
    }

    @Test
    @DisplayName("测试类型不匹配带上列名")
    void testTypeMismatch() {
        TypeMismatchException e = assertThrows(TypeMismatchException.class,
                () -> evaluator.matches(condition("name", Operator.GREATER_THAN, 5), row));

        assertEquals("name", e.getColumn());
        assertEquals("VARCHAR", e.getExpectedType());
        assertEquals("INT", e.getActualType());
    }

    @Test
    @DisplayName("测试算术表达式作为左侧")
    void testArithmeticLeft() {
        Expression doubled = new BinaryExpression(new ColumnExpression("age"), Operator.MULTIPLY,
                new LiteralExpression(Value.ofInt(2)));
        Condition condition = new Condition(doubled, Operator.EQUAL,
                List.of(new LiteralExpression(Value.ofInt(60))), "age * 2 = 60");

        assertTrue(evaluator.matches(condition, row));
    }

    @Test
    @DisplayName("测试多个谓词按AND组合")
    void testMatchesAll() {
        assertTrue(evaluator.matchesAll(List.of(
                condition("age", Operator.GREATER_THAN, 18),
                condition("name", Operator.LIKE, "A%")), row));
        assertFalse(evaluator.matchesAll(List.of(
                condition("age", Operator.GREATER_THAN, 18),
                condition("phone", Operator.IS_NOT_NULL)), row));
        assertTrue(evaluator.matchesAll(List.of(), row));
    }
}
