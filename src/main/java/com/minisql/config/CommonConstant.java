package com.minisql.config;

/**
 * CommonConstant - 引擎公共常量
 */
public final class CommonConstant {

    private CommonConstant() {
    }

    // ==================== CTE ====================

    /** 递归CTE最大迭代次数(安全阀) */
    public static final int DEFAULT_MAX_RECURSION_DEPTH = 100;

    // ==================== B+树 ====================

    /** 默认B+树阶数 */
    public static final int DEFAULT_BTREE_ORDER = 4;

    /** 最小B+树阶数 */
    public static final int MIN_BTREE_ORDER = 3;

    // ==================== 执行阶段 ====================

    /** 每个执行阶段保留的样本行数 */
    public static final int DEFAULT_STAGE_SAMPLE_SIZE = 5;

    // ==================== 配置键 ====================

    /** classpath配置文件 */
    public static final String CONFIG_FILE = "minisql.properties";

    public static final String KEY_MAX_RECURSION_DEPTH = "minisql.cte.max-recursion-depth";

    public static final String KEY_BTREE_DEFAULT_ORDER = "minisql.btree.default-order";

    public static final String KEY_STAGE_SAMPLE_SIZE = "minisql.stage.sample-size";

    // ==================== 其他 ====================

    /** 行id列名(构建索引时使用) */
    public static final String ROW_ID_COLUMN = "id";

    /** 主键索引名 */
    public static final String PRIMARY_INDEX = "PRIMARY";
}
