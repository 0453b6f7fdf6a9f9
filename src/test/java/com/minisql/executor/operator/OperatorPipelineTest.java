package com.minisql.executor.operator;

import com.minisql.executor.ConditionEvaluator;
import com.minisql.executor.ExpressionEvaluator;
import com.minisql.executor.Operator;
import com.minisql.executor.operator.SortOperator.SortKey;
import com.minisql.parser.Condition;
import com.minisql.parser.Expression;
import com.minisql.parser.JoinClause;
import com.minisql.parser.SelectItem;
import com.minisql.parser.expressions.AggregateExpression;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.parser.expressions.LiteralExpression;
import com.minisql.table.Row;
import com.minisql.table.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OperatorPipelineTest - 火山模型算子测试
 *
 * 测试单个算子和算子组合:
 * - ScanOperator写入裸列名和限定列名
 * - FilterOperator跳过类型不匹配的行
 * - JoinOperator的INNER/LEFT/RIGHT/CROSS语义
 * - SortOperator稳定排序,LimitOperator的OFFSET
 * - AggregateOperator的分组和空输入
 */
@DisplayName("火山模型算子测试")
class OperatorPipelineTest {

    private static final List<String> USER_COLUMNS = List.of("id", "name", "age", "team");

    private static final List<String> TEAM_COLUMNS = List.of("id", "title");

    private List<Row> users;

    private List<Row> teams;

    private ExpressionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new ExpressionEvaluator();
        users = List.of(
                user(1, "Alice", 25, 10),
                user(2, "Bob", 17, 20),
                user(3, "Charlie", 30, 10),
                user(4, "David", 15, null),
                user(5, "Eve", 35, 30));
        teams = List.of(
                Row.builder().put("id", 10).put("title", "Core").build(),
                Row.builder().put("id", 20).put("title", "Web").build(),
                Row.builder().put("id", 40).put("title", "Ops").build());
    }

    private static Row user(int id, String name, int age, Integer team) {
        return Row.builder().put("id", id).put("name", name).put("age", age).put("team", team).build();
    }

    private ScanOperator scanUsers() {
        return new ScanOperator("u", "users", USER_COLUMNS, users);
    }

    private ScanOperator scanTeams() {
        return new ScanOperator("t", "teams", TEAM_COLUMNS, teams);
    }

    private static List<Row> drain(Operator operator) {
        List<Row> rows = new ArrayList<>();
        while (operator.hasNext()) {
            rows.add(operator.next());
        }
        return rows;
    }

    private static Condition greaterThan(String column, Object value) {
        return new Condition(new ColumnExpression(column), com.minisql.parser.expressions.Operator.GREATER_THAN,
                List.of(new LiteralExpression(Value.of(value))), column + " > " + value);
    }

    private static JoinClause join(JoinClause.JoinType type) {
        return new JoinClause(type, "teams", "t",
                new ColumnExpression(List.of("u", "team")), new ColumnExpression(List.of("t", "id")),
                "u.team = t.id");
    }

    // ==================== Scan ====================

    @Test
    @DisplayName("测试扫描输出裸列名和限定列名")
    void testScanKeys() {
        Row first = scanUsers().next();

        assertEquals(Value.ofText("Alice"), first.get("name"));
        assertEquals(Value.ofText("Alice"), first.get("u.name"));
        assertEquals(Value.ofText("Alice"), first.get("users.name"));
        assertEquals(List.of("id", "name", "age", "team", "u.id", "users.id", "u.name", "users.name",
                "u.age", "users.age", "u.team", "users.team"), scanUsers().outputKeys());
    }

    @Test
    @DisplayName("测试扫描耗尽后抛出NoSuchElementException并可重置")
    void testScanExhaustion() {
        ScanOperator scan = scanUsers();
        assertEquals(5, drain(scan).size());
        assertThrows(NoSuchElementException.class, scan::next);

        scan.reset();
        assertTrue(scan.hasNext());
    }

    // ==================== Filter ====================

    @Test
    @DisplayName("测试过滤")
    void testFilter() {
        FilterOperator filter = new FilterOperator(scanUsers(), List.of(greaterThan("age", 18)),
                new ConditionEvaluator(evaluator));

        List<Row> rows = drain(filter);
        assertEquals(3, rows.size());
        assertEquals("Alice", rows.get(0).get("name").asText());
    }

    @Test
    @DisplayName("测试类型不匹配的行被跳过")
    void testFilterSkipsMismatch() {
        FilterOperator filter = new FilterOperator(scanUsers(), List.of(greaterThan("name", 3)),
                new ConditionEvaluator(evaluator));

        assertFalse(filter.hasNext());
    }

    // ==================== Join ====================

    @Test
    @DisplayName("测试INNER JOIN")
    void testInnerJoin() {
        JoinOperator join = new JoinOperator(scanUsers(), scanUsers().outputKeys(), scanTeams(),
                join(JoinClause.JoinType.INNER), evaluator);

        List<Row> rows = drain(join);
        assertEquals(3, rows.size());
        assertEquals("Core", rows.get(0).get("t.title").asText());
        // 列名冲突时左侧的裸列名优先
        assertEquals(Value.ofInt(1), rows.get(0).get("id"));
        assertEquals(Value.ofInt(10), rows.get(0).get("t.id"));
    }

    @Test
    @DisplayName("测试LEFT JOIN为未匹配的左行补NULL")
    void testLeftJoin() {
        JoinOperator join = new JoinOperator(scanUsers(), scanUsers().outputKeys(), scanTeams(),
                join(JoinClause.JoinType.LEFT), evaluator);

        List<Row> rows = drain(join);
        assertEquals(5, rows.size());
        Row david = rows.get(3);
        assertEquals("David", david.get("name").asText());
        assertTrue(david.get("t.title").isNull());
        assertTrue(rows.get(4).get("t.title").isNull());
    }

    @Test
    @DisplayName("测试RIGHT JOIN在最后输出未匹配的右行")
    void testRightJoin() {
        JoinOperator join = new JoinOperator(scanUsers(), scanUsers().outputKeys(), scanTeams(),
                join(JoinClause.JoinType.RIGHT), evaluator);

        List<Row> rows = drain(join);
        assertEquals(4, rows.size());
        Row ops = rows.get(3);
        assertEquals("Ops", ops.get("t.title").asText());
        assertTrue(ops.get("u.name").isNull());
    }

    @Test
    @DisplayName("测试ON条件两侧顺序颠倒")
    void testSwappedOnColumns() {
        JoinClause swapped = new JoinClause(JoinClause.JoinType.INNER, "teams", "t",
                new ColumnExpression(List.of("t", "id")), new ColumnExpression(List.of("u", "team")),
                "t.id = u.team");
        JoinOperator join = new JoinOperator(scanUsers(), scanUsers().outputKeys(), scanTeams(), swapped, evaluator);

        assertEquals(3, drain(join).size());
    }

    @Test
    @DisplayName("测试CROSS JOIN")
    void testCrossJoin() {
        JoinClause cross = new JoinClause(JoinClause.JoinType.CROSS, "teams", "t", null, null, null);
        JoinOperator join = new JoinOperator(scanUsers(), scanUsers().outputKeys(), scanTeams(), cross, evaluator);

        assertEquals(15, drain(join).size());
        assertEquals(JoinClause.JoinType.CROSS, join.getJoinType());
    }

    // ==================== Sort / Limit ====================

    @Test
    @DisplayName("测试多键排序和NULL位置")
    void testSort() {
        SortOperator sort = new SortOperator(scanUsers(), List.of(
                new SortKey(new ColumnExpression("team"), false),
                new SortKey(new ColumnExpression("age"), true)), evaluator);

        List<String> names = new ArrayList<>();
        for (Row row : drain(sort)) {
            names.add(row.get("name").asText());
        }
        assertEquals(List.of("David", "Charlie", "Alice", "Bob", "Eve"), names);
    }

    @Test
    @DisplayName("测试LIMIT和OFFSET")
    void testLimit() {
        assertEquals(2, drain(new LimitOperator(scanUsers(), 2, 0)).size());
        List<Row> page = drain(new LimitOperator(scanUsers(), 2, 3));
        assertEquals(List.of("David", "Eve"), List.of(page.get(0).get("name").asText(), page.get(1).get("name").asText()));
        assertEquals(1, drain(new LimitOperator(scanUsers(), null, 4)).size());
        assertEquals(0, drain(new LimitOperator(scanUsers(), 0, 0)).size());
        assertThrows(IllegalArgumentException.class, () -> new LimitOperator(scanUsers(), -1, 0));
    }

    // ==================== Aggregate ====================

    @Test
    @DisplayName("测试分组聚合")
    void testGroupBy() {
        AggregateExpression count = AggregateExpression.countStar();
        AggregateExpression avg = new AggregateExpression(AggregateExpression.Function.AVG,
                new ColumnExpression("age"), false);
        List<Expression> groupBy = List.of(new ColumnExpression("team"));
        AggregateOperator aggregate = new AggregateOperator(scanUsers(), groupBy, List.of(count, avg),
                List.of(new SelectItem(count, "n", "COUNT(*)")), evaluator);

        List<Row> groups = drain(aggregate);
        assertEquals(4, groups.size());
        Row core = groups.get(0);
        assertEquals(Value.ofInt(10), core.get("team"));
        assertEquals(Value.ofInt(2), core.get(count.getKey()));
        assertEquals(Value.ofInt(2), core.get("n"));
        assertEquals(27.5, core.get(avg.getKey()).asDouble(), 1e-9);
    }

    @Test
    @DisplayName("测试没有GROUP BY时空输入产生一行")
    void testEmptyInputSingleGroup() {
        FilterOperator none = new FilterOperator(scanUsers(), List.of(greaterThan("age", 100)),
                new ConditionEvaluator(evaluator));
        AggregateExpression count = AggregateExpression.countStar();
        AggregateExpression max = new AggregateExpression(AggregateExpression.Function.MAX,
                new ColumnExpression("age"), false);
        AggregateOperator aggregate = new AggregateOperator(none, List.of(), List.of(count, max), List.of(), evaluator);

        List<Row> rows = drain(aggregate);
        assertEquals(1, rows.size());
        assertEquals(Value.ofInt(0), rows.get(0).get(count.getKey()));
        assertTrue(rows.get(0).get(max.getKey()).isNull());
    }

    @Test
    @DisplayName("测试DISTINCT保留第一次出现的顺序")
    void testDistinct() {
        ProjectOperator.Projection team = new ProjectOperator.Projection("team", new ColumnExpression("team"));
        DistinctOperator distinct = new DistinctOperator(
                new ProjectOperator(scanUsers(), List.of(team), evaluator, null));

        List<Row> rows = drain(distinct);
        assertEquals(4, rows.size());
        assertEquals(Value.ofInt(10), rows.get(0).get("team"));
        assertTrue(rows.get(2).get("team").isNull());
    }
}
