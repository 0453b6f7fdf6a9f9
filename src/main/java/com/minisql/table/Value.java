package com.minisql.table;

import com.minisql.error.NumericOverflowException;
import com.minisql.error.TypeMismatchException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Value - 带类型标签的标量值
 *
 * 一个封闭的联合类型: {INTEGER, FLOAT, TEXT, BOOLEAN, DATE, DATETIME, NULL}。
 * 所有比较和运算都根据ValueType显式分派。
 *
 * 两种比较语义:
 * - compareTo(): 全序比较,用于排序和索引键。NULL最小,数值跨INTEGER/FLOAT比较,
 *   不同类型按类型序号排列。永不抛异常。
 * - sqlCompare(): SQL比较,用于WHERE/HAVING/JOIN。调用方必须先处理NULL
 *   (NULL比较结果为Unknown),不兼容类型抛出TypeMismatchException。
 *
 * 设计原则:
 * - 不可变对象
 * - "Good taste": 类型标签 + 统一的访问方法,消除instanceof链
 *
 * 使用示例:
 * <pre>
 * Value salary = Value.ofFloat(75000.0);
 * Value limit = Value.ofInt(50000);
 * salary.sqlCompare(limit); // > 0
 * Value.NULL.isNull();      // true
 * </pre>
 */
public final class Value implements Comparable<Value> {

    /** NULL单例 */
    public static final Value NULL = new Value(ValueType.NULL, null);

    public static final Value TRUE = new Value(ValueType.BOOLEAN, Boolean.TRUE);

    public static final Value FALSE = new Value(ValueType.BOOLEAN, Boolean.FALSE);

    /** 类型标签 */
    private final ValueType type;

    /** 实际值(NULL时为null) */
    private final Object value;

    private Value(ValueType type, Object value) {
        this.type = type;
        this.value = value;
    }

    // ==================== 工厂方法 ====================

    public static Value ofInt(long value) {
        return new Value(ValueType.INTEGER, value);
    }

    public static Value ofFloat(double value) {
        return new Value(ValueType.FLOAT, value);
    }

    public static Value ofText(String value) {
        return value == null ? NULL : new Value(ValueType.TEXT, value);
    }

    public static Value ofBoolean(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Value ofDate(LocalDate value) {
        return value == null ? NULL : new Value(ValueType.DATE, value);
    }

    public static Value ofDateTime(LocalDateTime value) {
        return value == null ? NULL : new Value(ValueType.DATETIME, value);
    }

    /**
     * 从Java对象创建Value
     *
     * @param object Java对象(null, 数字, String, Boolean, LocalDate, LocalDateTime或Value)
     * @return 对应的Value
     * @throws IllegalArgumentException 不支持的Java类型
     */
    public static Value of(Object object) {
        if (object == null) {
            return NULL;
        }
        if (object instanceof Value) {
            return (Value) object;
        }
        if (object instanceof Integer || object instanceof Long
                || object instanceof Short || object instanceof Byte) {
            return ofInt(((Number) object).longValue());
        }
        if (object instanceof Double || object instanceof Float || object instanceof BigDecimal) {
            return ofFloat(((Number) object).doubleValue());
        }
        if (object instanceof String) {
            return ofText((String) object);
        }
        if (object instanceof Boolean) {
            return ofBoolean((Boolean) object);
        }
        if (object instanceof LocalDate) {
            return ofDate((LocalDate) object);
        }
        if (object instanceof LocalDateTime) {
            return ofDateTime((LocalDateTime) object);
        }
        throw new IllegalArgumentException("Unsupported value type: " + object.getClass().getName());
    }

    // ==================== 访问方法 ====================

    public ValueType getType() {
        return type;
    }

    public boolean isNull() {
        return type == ValueType.NULL;
    }

    public boolean isNumeric() {
        return type.isNumeric();
    }

    public long asLong() {
        if (type == ValueType.INTEGER) {
            return (Long) value;
        }
        if (type == ValueType.FLOAT) {
            return (long) (double) (Double) value;
        }
        if (type == ValueType.BOOLEAN) {
            return ((Boolean) value) ? 1L : 0L;
        }
        throw new IllegalStateException("Not a numeric value: " + this);
    }

    public double asDouble() {
        if (type == ValueType.INTEGER) {
            return (Long) value;
        }
        if (type == ValueType.FLOAT) {
            return (Double) value;
        }
        if (type == ValueType.BOOLEAN) {
            return ((Boolean) value) ? 1.0 : 0.0;
        }
        throw new IllegalStateException("Not a numeric value: " + this);
    }

    public String asText() {
        return isNull() ? null : value.toString();
    }

    public boolean asBoolean() {
        switch (type) {
            case BOOLEAN:
                return (Boolean) value;
            case INTEGER:
            case FLOAT:
                return asDouble() != 0;
            case TEXT:
                return !((String) value).isEmpty();
            case NULL:
                return false;
            default:
                return true;
        }
    }

    /**
     * 转换为Java对象(NULL返回null)
     */
    public Object toJava() {
        return value;
    }

    // ==================== 全序比较 ====================

    /**
     * 全序比较,用于ORDER BY和B+树键
     *
     * NULL最小(升序时排在最前,降序时排在最后)。
     */
    @Override
    public int compareTo(Value other) {
        if (this.isNull() || other.isNull()) {
            return Boolean.compare(!this.isNull(), !other.isNull());
        }
        if (this.isNumeric() && other.isNumeric()) {
            return compareNumbers(this, other);
        }
        if (this.type.isTemporal() && other.type.isTemporal()) {
            return toDateTime(this).compareTo(toDateTime(other));
        }
        if (this.type != other.type) {
            return Integer.compare(this.type.ordinal(), other.type.ordinal());
        }
        switch (type) {
            case TEXT:
                return ((String) value).compareTo((String) other.value);
            case BOOLEAN:
                return Boolean.compare((Boolean) value, (Boolean) other.value);
            default:
                throw new IllegalStateException("Unexpected type: " + type);
        }
    }

    // ==================== SQL比较 ====================

    /**
     * SQL比较
     *
     * 调用方负责NULL语义(任一侧为NULL时结果为Unknown,不应调用本方法)。
     *
     * 兼容规则:
     * - 数值与数值(BOOLEAN按0/1参与数值比较)
     * - 字符串与字符串(区分大小写)
     * - 日期与日期,日期与可解析为ISO日期的字符串
     *
     * @param other 另一个值
     * @return 比较结果
     * @throws TypeMismatchException 类型不兼容
     */
    public int sqlCompare(Value other) {
        if (this.isNull() || other.isNull()) {
            throw new IllegalArgumentException("NULL has no SQL ordering, check isNull() first");
        }
        if (numericLike(this) && numericLike(other)) {
            return compareNumbers(this, other);
        }
        if (this.type == ValueType.TEXT && other.type == ValueType.TEXT) {
            return ((String) value).compareTo((String) other.value);
        }
        if (this.type.isTemporal() || other.type.isTemporal()) {
            LocalDateTime left = coerceTemporal(this);
            LocalDateTime right = coerceTemporal(other);
            if (left != null && right != null) {
                return left.compareTo(right);
            }
        }
        throw new TypeMismatchException(null, this.type.getSqlName(), other.type.getSqlName());
    }

    // ==================== 算术运算 ====================

    public Value add(Value other) {
        return arithmetic(other, '+');
    }

    public Value subtract(Value other) {
        return arithmetic(other, '-');
    }

    public Value multiply(Value other) {
        return arithmetic(other, '*');
    }

    public Value divide(Value other) {
        return arithmetic(other, '/');
    }

    public Value modulo(Value other) {
        return arithmetic(other, '%');
    }

    public Value negate() {
        if (isNull()) {
            return NULL;
        }
        if (type == ValueType.INTEGER) {
            return ofInt(-(Long) value);
        }
        if (type == ValueType.FLOAT) {
            return ofFloat(-(Double) value);
        }
        throw new TypeMismatchException(null, "INT", type.getSqlName());
    }

    /**
     * 算术运算
     *
     * MySQL语义:
     * - 任一操作数为NULL,结果为NULL
     * - 除法结果总是浮点数,除以0结果为NULL
     * - INTEGER与FLOAT混合运算结果为FLOAT
     * - INTEGER运算溢出抛NumericOverflowException,不回绕
     */
    private Value arithmetic(Value other, char op) {
        if (this.isNull() || other.isNull()) {
            return NULL;
        }
        if (!this.isNumeric() || !other.isNumeric()) {
            ValueType offending = this.isNumeric() ? other.type : this.type;
            throw new TypeMismatchException(null, "INT", offending.getSqlName());
        }

        if (op == '/') {
            double divisor = other.asDouble();
            return divisor == 0 ? NULL : ofFloat(this.asDouble() / divisor);
        }

        if (this.type == ValueType.INTEGER && other.type == ValueType.INTEGER) {
            long l = this.asLong();
            long r = other.asLong();
            try {
                switch (op) {
                    case '+':
                        return ofInt(Math.addExact(l, r));
                    case '-':
                        return ofInt(Math.subtractExact(l, r));
                    case '*':
                        return ofInt(Math.multiplyExact(l, r));
                    case '%':
                        return r == 0 ? NULL : ofInt(l % r);
                    default:
                        throw new IllegalArgumentException("Unknown operator: " + op);
                }
            } catch (ArithmeticException e) {
                throw new NumericOverflowException(l, op, r);
            }
        }

        double l = this.asDouble();
        double r = other.asDouble();
        switch (op) {
            case '+':
                return ofFloat(l + r);
            case '-':
                return ofFloat(l - r);
            case '*':
                return ofFloat(l * r);
            case '%':
                return r == 0 ? NULL : ofFloat(l % r);
            default:
                throw new IllegalArgumentException("Unknown operator: " + op);
        }
    }

    // ==================== 辅助方法 ====================

    private static boolean numericLike(Value v) {
        return v.isNumeric() || v.type == ValueType.BOOLEAN;
    }

    private static int compareNumbers(Value left, Value right) {
        if (left.type == ValueType.INTEGER && right.type == ValueType.INTEGER) {
            return Long.compare((Long) left.value, (Long) right.value);
        }
        return Double.compare(left.asDouble(), right.asDouble());
    }

    private static LocalDateTime toDateTime(Value v) {
        if (v.type == ValueType.DATE) {
            return ((LocalDate) v.value).atStartOfDay();
        }
        return (LocalDateTime) v.value;
    }

    /**
     * 将值转换为时间点,字符串按ISO格式解析,失败返回null
     */
    private static LocalDateTime coerceTemporal(Value v) {
        if (v.type.isTemporal()) {
            return toDateTime(v);
        }
        if (v.type != ValueType.TEXT) {
            return null;
        }
        String text = ((String) v.value).trim();
        try {
            if (text.length() <= 10) {
                return LocalDate.parse(text).atStartOfDay();
            }
            return LocalDateTime.parse(text.replace(' ', 'T'));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * SQL字面量形式(用于错误信息和建议)
     */
    public String toSqlLiteral() {
        switch (type) {
            case NULL:
                return "NULL";
            case TEXT:
                return "'" + ((String) value).replace("'", "''") + "'";
            case DATE:
            case DATETIME:
                return "'" + value + "'";
            case BOOLEAN:
                return ((Boolean) value) ? "TRUE" : "FALSE";
            default:
                return value.toString();
        }
    }

    /**
     * 相等性用于分组和去重: NULL与NULL相等,数值跨类型按数值相等
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value)) {
            return false;
        }
        Value other = (Value) o;
        if (this.isNumeric() && other.isNumeric()) {
            return compareNumbers(this, other) == 0;
        }
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (isNumeric()) {
            return Double.hashCode(asDouble());
        }
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return isNull() ? "NULL" : value.toString();
    }
}
