package com.minisql.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * EngineConfig - 引擎配置
 *
 * 不可变对象,通过Builder构建或从配置加载。
 *
 * 加载顺序(后者覆盖前者):
 * 1. CommonConstant中的默认值
 * 2. classpath下的minisql.properties
 * 3. JVM系统属性(-Dminisql.cte.max-recursion-depth=50)
 *
 * 使用示例:
 * <pre>
 * EngineConfig config = EngineConfig.builder()
 *     .maxRecursionDepth(20)
 *     .build();
 * MiniSQL engine = new MiniSQL(dataset, config);
 * </pre>
 */
public final class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    /** 递归CTE最大迭代次数 */
    private final int maxRecursionDepth;

    /** 默认B+树阶数 */
    private final int defaultBTreeOrder;

    /** 执行阶段样本行数 */
    private final int stageSampleSize;

    private EngineConfig(Builder builder) {
        this.maxRecursionDepth = builder.maxRecursionDepth;
        this.defaultBTreeOrder = builder.defaultBTreeOrder;
        this.stageSampleSize = builder.stageSampleSize;
    }

    /**
     * 默认配置
     */
    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 从classpath配置文件和系统属性加载
     */
    public static EngineConfig load() {
        Properties properties = new Properties();
        try (InputStream in = EngineConfig.class.getClassLoader()
                .getResourceAsStream(CommonConstant.CONFIG_FILE)) {
            if (in != null) {
                properties.load(in);
                logger.info("Loaded engine configuration from {}", CommonConstant.CONFIG_FILE);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + CommonConstant.CONFIG_FILE, e);
        }
        properties.putAll(System.getProperties());
        return fromProperties(properties);
    }

    /**
     * 从Properties构建,缺失的键使用默认值
     *
     * @throws IllegalArgumentException 值不是整数或超出范围
     */
    public static EngineConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String depth = properties.getProperty(CommonConstant.KEY_MAX_RECURSION_DEPTH);
        if (depth != null) {
            builder.maxRecursionDepth(parseInt(CommonConstant.KEY_MAX_RECURSION_DEPTH, depth));
        }
        String order = properties.getProperty(CommonConstant.KEY_BTREE_DEFAULT_ORDER);
        if (order != null) {
            builder.defaultBTreeOrder(parseInt(CommonConstant.KEY_BTREE_DEFAULT_ORDER, order));
        }
        String sample = properties.getProperty(CommonConstant.KEY_STAGE_SAMPLE_SIZE);
        if (sample != null) {
            builder.stageSampleSize(parseInt(CommonConstant.KEY_STAGE_SAMPLE_SIZE, sample));
        }
        EngineConfig config = builder.build();
        logger.debug("Engine configuration: {}", config);
        return config;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    public int getMaxRecursionDepth() {
        return maxRecursionDepth;
    }

    public int getDefaultBTreeOrder() {
        return defaultBTreeOrder;
    }

    public int getStageSampleSize() {
        return stageSampleSize;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "maxRecursionDepth=" + maxRecursionDepth +
                ", defaultBTreeOrder=" + defaultBTreeOrder +
                ", stageSampleSize=" + stageSampleSize +
                '}';
    }

    /**
     * EngineConfig构建器
     */
    public static final class Builder {

        private int maxRecursionDepth = CommonConstant.DEFAULT_MAX_RECURSION_DEPTH;

        private int defaultBTreeOrder = CommonConstant.DEFAULT_BTREE_ORDER;

        private int stageSampleSize = CommonConstant.DEFAULT_STAGE_SAMPLE_SIZE;

        private Builder() {
        }

        public Builder maxRecursionDepth(int maxRecursionDepth) {
            if (maxRecursionDepth < 1) {
                throw new IllegalArgumentException("Max recursion depth must be at least 1");
            }
            this.maxRecursionDepth = maxRecursionDepth;
            return this;
        }

        public Builder defaultBTreeOrder(int defaultBTreeOrder) {
            if (defaultBTreeOrder < CommonConstant.MIN_BTREE_ORDER) {
                throw new IllegalArgumentException(
                        "B+ tree order must be at least " + CommonConstant.MIN_BTREE_ORDER);
            }
            this.defaultBTreeOrder = defaultBTreeOrder;
            return this;
        }

        public Builder stageSampleSize(int stageSampleSize) {
            if (stageSampleSize < 0) {
                throw new IllegalArgumentException("Stage sample size cannot be negative");
            }
            this.stageSampleSize = stageSampleSize;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
