package com.minisql.executor.operator;

import com.minisql.error.TypeMismatchException;
import com.minisql.executor.ExpressionEvaluator;
import com.minisql.executor.Operator;
import com.minisql.parser.JoinClause;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.table.Row;
import com.minisql.table.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * JoinOperator - 嵌套循环连接算子
 *
 * 左侧是已有的算子管道(FROM表和之前的JOIN),右侧是本次JOIN的表(物化在内存中)。
 * 对左侧每一行扫描右侧所有行,ON条件为等值比较。
 *
 * 连接类型:
 * - INNER: 只输出匹配的行对
 * - LEFT: 左行没有任何匹配时,右侧列补NULL输出
 * - RIGHT: 左侧全部处理完后,输出从未被匹配的右行,左侧列补NULL
 * - CROSS: 笛卡尔积(没有ON条件的JOIN也按CROSS处理)
 *
 * 匹配规则:
 * - 任一侧的键为NULL都不匹配(NULL = NULL 不为真)
 * - 键类型不兼容按不匹配处理,不中断查询
 *
 * 列名冲突时左侧的裸列名优先,右侧列始终可以通过 别名.列名 访问。
 *
 * MySQL对应:
 * - Block Nested Loop Join,对应EXPLAIN Extra中的 "Using join buffer"
 *
 * 算子树示例:
 * <pre>
 * SQL: SELECT * FROM employees e JOIN departments d ON e.dept_id = d.id
 *
 * JoinOperator(INNER, ON e.dept_id = d.id)
 *   ├─ ScanOperator(employees AS e)
 *   └─ departments AS d (materialized)
 * </pre>
 */
public class JoinOperator implements Operator {

    private static final Logger logger = LoggerFactory.getLogger(JoinOperator.class);

    private final Operator left;

    /** 左侧输出行的所有列名(RIGHT JOIN补NULL用) */
    private final List<String> leftKeys;

    /** 右侧表的行(已经过ScanOperator加上限定列名) */
    private final List<Row> rightRows;

    /** 右侧输出行的所有列名(LEFT JOIN补NULL用) */
    private final List<String> rightKeys;

    private final JoinClause.JoinType joinType;

    /** ON条件中属于左侧的列,CROSS JOIN时为null */
    private final ColumnExpression leftColumn;

    /** ON条件中属于右侧的列,CROSS JOIN时为null */
    private final ColumnExpression rightColumn;

    private final ExpressionEvaluator evaluator;

    /** 右行是否被匹配过(RIGHT JOIN) */
    private final boolean[] rightMatched;

    /** 当前左行产生的结果 */
    private final List<Row> buffer = new ArrayList<>();

    private int bufferPos;

    private boolean leftExhausted;

    /** 左侧耗尽后,下一个待检查的右行(RIGHT JOIN) */
    private int unmatchedPos;

    /**
     * 创建连接算子
     *
     * @param left 左侧算子
     * @param leftKeys 左侧输出行的列名
     * @param right 右侧表的扫描算子
     * @param join JOIN子句
     * @param evaluator 表达式求值器
     */
    public JoinOperator(Operator left, List<String> leftKeys, ScanOperator right,
                        JoinClause join, ExpressionEvaluator evaluator) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Join inputs cannot be null");
        }
        if (join == null) {
            throw new IllegalArgumentException("Join clause cannot be null");
        }
        this.left = left;
        this.leftKeys = List.copyOf(leftKeys);
        this.rightKeys = right.outputKeys();
        this.rightRows = new ArrayList<>();
        while (right.hasNext()) {
            rightRows.add(right.next());
        }
        this.evaluator = evaluator;
        this.rightMatched = new boolean[rightRows.size()];

        if (join.getJoinType() == JoinClause.JoinType.CROSS || !join.hasOnCondition()) {
            this.joinType = JoinClause.JoinType.CROSS;
            this.leftColumn = null;
            this.rightColumn = null;
        } else {
            this.joinType = join.getJoinType();
            if (belongsTo(join.getRightColumn(), join) || !belongsTo(join.getLeftColumn(), join)) {
                this.leftColumn = join.getLeftColumn();
                this.rightColumn = join.getRightColumn();
            } else {
                this.leftColumn = join.getRightColumn();
                this.rightColumn = join.getLeftColumn();
            }
        }
        logger.debug("Join {} {} on {} = {}", joinType, join.getReference(), leftColumn, rightColumn);
    }

    /**
     * ON条件中的列是否属于被连接的表
     */
    private static boolean belongsTo(ColumnExpression column, JoinClause join) {
        if (column == null || !column.isQualified()) {
            return false;
        }
        String qualifier = column.getQualifier();
        return qualifier.equalsIgnoreCase(join.getReference())
                || qualifier.equalsIgnoreCase(join.getTable());
    }

    @Override
    public boolean hasNext() {
        while (bufferPos >= buffer.size()) {
            buffer.clear();
            bufferPos = 0;

            if (!leftExhausted && left.hasNext()) {
                probe(left.next());
                continue;
            }
            leftExhausted = true;

            if (joinType != JoinClause.JoinType.RIGHT) {
                return false;
            }
            while (unmatchedPos < rightRows.size() && rightMatched[unmatchedPos]) {
                unmatchedPos++;
            }
            if (unmatchedPos >= rightRows.size()) {
                return false;
            }
            buffer.add(padLeft(rightRows.get(unmatchedPos++)));
        }
        return true;
    }

    /**
     * 用一个左行探测右侧所有行
     */
    private void probe(Row leftRow) {
        boolean matched = false;
        Value leftKey = leftColumn != null ? evaluator.evaluate(leftColumn, leftRow) : null;

        for (int i = 0; i < rightRows.size(); i++) {
            Row rightRow = rightRows.get(i);
            if (joinType == JoinClause.JoinType.CROSS || keysMatch(leftKey, rightRow)) {
                buffer.add(combine(leftRow, rightRow));
                rightMatched[i] = true;
                matched = true;
            }
        }

        if (!matched && joinType == JoinClause.JoinType.LEFT) {
            buffer.add(padRight(leftRow));
        }
    }

    private boolean keysMatch(Value leftKey, Row rightRow) {
        Value rightKey = evaluator.evaluate(rightColumn, rightRow);
        if (leftKey.isNull() || rightKey.isNull()) {
            return false;
        }
        try {
            return leftKey.sqlCompare(rightKey) == 0;
        } catch (TypeMismatchException e) {
            logger.trace("Join keys not comparable: {} vs {}", leftKey, rightKey);
            return false;
        }
    }

    private static Row combine(Row leftRow, Row rightRow) {
        Row.Builder builder = leftRow.toBuilder();
        for (String key : rightRow.getColumnNames()) {
            builder.putIfAbsent(key, rightRow.get(key));
        }
        return builder.build();
    }

    private Row padRight(Row leftRow) {
        Row.Builder builder = leftRow.toBuilder();
        for (String key : rightKeys) {
            builder.putIfAbsent(key, Value.NULL);
        }
        return builder.build();
    }

    private Row padLeft(Row rightRow) {
        Row.Builder builder = Row.builder();
        for (String key : leftKeys) {
            if (key.contains(".")) {
                builder.put(key, Value.NULL);
            }
        }
        for (String key : rightRow.getColumnNames()) {
            builder.put(key, rightRow.get(key));
        }
        for (String key : leftKeys) {
            builder.putIfAbsent(key, Value.NULL);
        }
        return builder.build();
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more rows");
        }
        return buffer.get(bufferPos++);
    }

    /**
     * 连接后输出行的所有列名
     */
    public List<String> outputKeys() {
        List<String> keys = new ArrayList<>(leftKeys);
        for (String key : rightKeys) {
            if (!keys.contains(key)) {
                keys.add(key);
            }
        }
        return keys;
    }

    public JoinClause.JoinType getJoinType() {
        return joinType;
    }

    @Override
    public String toString() {
        return "JoinOperator{" +
                "type=" + joinType +
                ", on=" + leftColumn + " = " + rightColumn +
                ", left=" + left +
                '}';
    }
}
