package com.minisql.explain;

/**
 * AccessType - EXPLAIN中的访问类型(type列)
 *
 * 从好到坏排列: system > const > eq_ref > ref > range > index > ALL。
 * 枚举序号即优劣顺序,序号越小越好。
 *
 * MySQL对应: EXPLAIN输出的type列
 */
public enum AccessType {

    /** 表只有一行 */
    SYSTEM("system", Rating.GOOD,
            "Table has only one row. This is the best possible case."),

    /** 主键/唯一索引等值匹配,最多一行 */
    CONST("const", Rating.GOOD,
            "One row match using PRIMARY KEY or UNIQUE index. Very efficient."),

    /** JOIN时通过唯一索引每次只读一行 */
    EQ_REF("eq_ref", Rating.GOOD,
            "One row per join using unique index. Used in JOINs."),

    /** 非唯一索引等值匹配 */
    REF("ref", Rating.GOOD,
            "All rows with matching index value are read. Good for non-unique indexes."),

    /** 索引范围扫描 */
    RANGE("range", Rating.GOOD,
            "Index range scan. Retrieves rows in a given range."),

    /** 全索引扫描(覆盖索引) */
    INDEX("index", Rating.CAUTION,
            "Full index scan. Reads entire index, better than ALL."),

    /** 全表扫描 */
    ALL("ALL", Rating.BAD,
            "Full table scan. Reads every row in the table. Usually bad for large tables.");

    /**
     * 访问类型评级
     */
    public enum Rating {
        GOOD,
        CAUTION,
        BAD;

        public String label() {
            return name().toLowerCase();
        }
    }

    private final String label;

    private final Rating rating;

    private final String explanation;

    AccessType(String label, Rating rating, String explanation) {
        this.label = label;
        this.rating = rating;
        this.explanation = explanation;
    }

    /**
     * EXPLAIN输出中的写法(const, ref, ALL...)
     */
    public String label() {
        return label;
    }

    public Rating getRating() {
        return rating;
    }

    public String getExplanation() {
        return explanation;
    }

    /**
     * 是否通过索引定位行(而不是扫描整个索引或整张表)
     */
    public boolean isIndexLookup() {
        return this == CONST || this == EQ_REF || this == REF || this == RANGE;
    }

    /**
     * ref列是否有意义
     */
    public boolean isEquality() {
        return this == CONST || this == EQ_REF || this == REF;
    }

    /**
     * 是否优于另一个访问类型
     */
    public boolean isBetterThan(AccessType other) {
        return ordinal() < other.ordinal();
    }

    @Override
    public String toString() {
        return label;
    }
}
