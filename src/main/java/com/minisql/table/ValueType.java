package com.minisql.table;

/**
 * ValueType - 值类型枚举
 *
 * 定义Mini SQL支持的标量类型,每个Value都带一个类型标签。
 *
 * 类型分类:
 * - 数值类型: INTEGER, FLOAT
 * - 字符串类型: TEXT
 * - 布尔类型: BOOLEAN
 * - 日期时间: DATE, DATETIME
 * - 空值: NULL
 *
 * 设计原则:
 * - "Good taste": 比较和运算根据标签显式分派,不依赖隐式类型转换
 * - 每种类型对应一个固定的Java类型
 */
public enum ValueType {

    /** 整数: 64位有符号整数 */
    INTEGER(Long.class, "INT"),

    /** 浮点数: IEEE 754双精度 */
    FLOAT(Double.class, "DOUBLE"),

    /** 字符串 */
    TEXT(String.class, "VARCHAR"),

    /** 布尔值 */
    BOOLEAN(Boolean.class, "BOOLEAN"),

    /** 日期 */
    DATE(java.time.LocalDate.class, "DATE"),

    /** 日期时间 */
    DATETIME(java.time.LocalDateTime.class, "DATETIME"),

    /** NULL值 */
    NULL(Void.class, "NULL");

    /** 对应的Java类型 */
    private final Class<?> javaType;

    /** MySQL中的类型名(用于错误信息和EXPLAIN) */
    private final String sqlName;

    ValueType(Class<?> javaType, String sqlName) {
        this.javaType = javaType;
        this.sqlName = sqlName;
    }

    public Class<?> getJavaType() {
        return javaType;
    }

    public String getSqlName() {
        return sqlName;
    }

    /**
     * 是否为数值类型
     */
    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    /**
     * 是否为时间类型
     */
    public boolean isTemporal() {
        return this == DATE || this == DATETIME;
    }
}
