package com.minisql.executor;

import com.minisql.error.TypeMismatchException;
import com.minisql.parser.Condition;
import com.minisql.parser.Expression;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.table.Row;
import com.minisql.table.Value;
import com.minisql.table.ValueType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * ConditionEvaluator - 谓词求值器
 *
 * SQL三值逻辑在这里折叠成两值: Unknown按false处理。
 *
 * NULL语义(MySQL):
 * - 任何与NULL的比较(=, <>, <, LIKE, BETWEEN...)都不为真
 * - IS NULL / IS NOT NULL 是唯一能匹配NULL的谓词
 * - IN列表中的NULL被忽略;NOT IN列表中只要有NULL,结果就不为真
 *
 * 其他规则:
 * - LIKE不区分大小写,%匹配任意串,_匹配单个字符
 * - BETWEEN为闭区间
 * - 字符串相等区分大小写
 *
 * 类型不兼容的比较抛出TypeMismatchException,由FilterOperator/JoinOperator
 * 按"不匹配"处理。
 */
public class ConditionEvaluator {

    /** LIKE模式缓存的最大条目数 */
    static final int LIKE_CACHE_SIZE = 64;

    /** LIKE模式缓存(LRU) */
    private final Map<String, Pattern> likePatterns = Collections.synchronizedMap(
            new LinkedHashMap<String, Pattern>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Pattern> eldest) {
                    return size() > LIKE_CACHE_SIZE;
                }
            });

    private final ExpressionEvaluator evaluator;

    public ConditionEvaluator(ExpressionEvaluator evaluator) {
        if (evaluator == null) {
            throw new IllegalArgumentException("Evaluator cannot be null");
        }
        this.evaluator = evaluator;
    }

    public ExpressionEvaluator getExpressionEvaluator() {
        return evaluator;
    }

    /**
     * 所有谓词都为真(AND)
     */
    public boolean matchesAll(List<Condition> conditions, Row row) {
        for (Condition condition : conditions) {
            if (!matches(condition, row)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 求值单个谓词
     *
     * @throws TypeMismatchException 比较的两侧类型不兼容
     */
    public boolean matches(Condition condition, Row row) {
        if (!condition.isParsed()) {
            throw new IllegalStateException("Cannot evaluate unparsed condition: " + condition.getText());
        }

        Value left = evaluate(condition.getLeft(), row);
        List<Expression> right = condition.getRight();

        switch (condition.getOperator()) {
            case IS_NULL:
                return left.isNull();
            case IS_NOT_NULL:
                return !left.isNull();
            default:
                break;
        }

        if (left.isNull()) {
            return false;
        }

        switch (condition.getOperator()) {
            case EQUAL:
            case NOT_EQUAL:
            case GREATER_THAN:
            case LESS_THAN:
            case GREATER_EQUAL:
            case LESS_EQUAL: {
                Value value = evaluate(right.get(0), row);
                if (value.isNull()) {
                    return false;
                }
                int cmp = compare(condition.getLeft(), left, value);
                return compareResult(condition, cmp);
            }
            case LIKE:
            case NOT_LIKE: {
                Value pattern = evaluate(right.get(0), row);
                if (pattern.isNull()) {
                    return false;
                }
                boolean matched = like(left.asText(), pattern.asText());
                return condition.getOperator() == com.minisql.parser.expressions.Operator.LIKE ? matched : !matched;
            }
            case IN:
                return inList(condition.getLeft(), left, right, row);
            case NOT_IN: {
                for (Expression expression : right) {
                    if (evaluate(expression, row).isNull()) {
                        return false;
                    }
                }
                return !inList(condition.getLeft(), left, right, row);
            }
            case BETWEEN:
            case NOT_BETWEEN: {
                Value low = evaluate(right.get(0), row);
                Value high = evaluate(right.get(1), row);
                if (low.isNull() || high.isNull()) {
                    return false;
                }
                boolean within = compare(condition.getLeft(), left, low) >= 0
                        && compare(condition.getLeft(), left, high) <= 0;
                return condition.getOperator() == com.minisql.parser.expressions.Operator.BETWEEN ? within : !within;
            }
            default:
                throw new IllegalStateException("Not a predicate operator: " + condition.getOperator());
        }
    }

    private Value evaluate(Expression expression, Row row) {
        return evaluator.evaluate(expression, row);
    }

    private static boolean compareResult(Condition condition, int cmp) {
        switch (condition.getOperator()) {
            case EQUAL:
                return cmp == 0;
            case NOT_EQUAL:
                return cmp != 0;
            case GREATER_THAN:
                return cmp > 0;
            case LESS_THAN:
                return cmp < 0;
            case GREATER_EQUAL:
                return cmp >= 0;
            case LESS_EQUAL:
                return cmp <= 0;
            default:
                throw new IllegalStateException("Not a comparison operator: " + condition.getOperator());
        }
    }

    /**
     * SQL比较,类型不兼容时附上列名重新抛出
     */
    private static int compare(Expression leftExpr, Value left, Value right) {
        try {
            return left.sqlCompare(right);
        } catch (TypeMismatchException e) {
            if (leftExpr instanceof ColumnExpression) {
                throw e.withColumn(((ColumnExpression) leftExpr).getFullName());
            }
            throw e;
        }
    }

    /**
     * IN列表: 忽略NULL元素,类型不兼容的元素视为不相等
     */
    private boolean inList(Expression leftExpr, Value left, List<Expression> list, Row row) {
        boolean anyComparable = false;
        TypeMismatchException mismatch = null;
        for (Expression expression : list) {
            Value candidate = evaluate(expression, row);
            if (candidate.isNull()) {
                continue;
            }
            try {
                if (compare(leftExpr, left, candidate) == 0) {
                    return true;
                }
                anyComparable = true;
            } catch (TypeMismatchException e) {
                mismatch = e;
            }
        }
        if (!anyComparable && mismatch != null) {
            throw mismatch;
        }
        return false;
    }

    /**
     * LIKE匹配(不区分大小写)
     */
    boolean like(String text, String pattern) {
        Pattern regex = likePatterns.computeIfAbsent(pattern, ConditionEvaluator::compileLike);
        return regex.matcher(text).matches();
    }

    int cachedPatternCount() {
        return likePatterns.size();
    }

    private static Pattern compileLike(String pattern) {
        StringBuilder regex = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '%') {
                regex.append(".*");
            } else if (c == '_') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    /**
     * LIKE模式是否以固定前缀开头(可以走索引范围扫描)
     */
    public static boolean isPrefixPattern(Value pattern) {
        if (pattern == null || pattern.getType() != ValueType.TEXT) {
            return false;
        }
        String text = pattern.asText();
        return !text.isEmpty() && text.charAt(0) != '%' && text.charAt(0) != '_';
    }
}
