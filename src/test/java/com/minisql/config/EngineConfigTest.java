package com.minisql.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EngineConfigTest - 引擎配置测试
 */
@DisplayName("引擎配置测试")
class EngineConfigTest {

    @Test
    @DisplayName("测试默认值")
    void testDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertAll(
                () -> assertEquals(CommonConstant.DEFAULT_MAX_RECURSION_DEPTH, config.getMaxRecursionDepth()),
                () -> assertEquals(CommonConstant.DEFAULT_BTREE_ORDER, config.getDefaultBTreeOrder()),
                () -> assertEquals(CommonConstant.DEFAULT_STAGE_SAMPLE_SIZE, config.getStageSampleSize())
        );
    }

    @Test
    @DisplayName("测试从classpath配置文件加载")
    void testLoadFromClasspath() {
        EngineConfig config = EngineConfig.load();

        // src/test/resources/minisql.properties
        assertEquals(3, config.getStageSampleSize());
        assertEquals(100, config.getMaxRecursionDepth());
    }

    @Test
    @DisplayName("测试Properties覆盖默认值,缺失的键使用默认值")
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(CommonConstant.KEY_MAX_RECURSION_DEPTH, " 20 ");
        properties.setProperty(CommonConstant.KEY_BTREE_DEFAULT_ORDER, "5");

        EngineConfig config = EngineConfig.fromProperties(properties);

        assertEquals(20, config.getMaxRecursionDepth());
        assertEquals(5, config.getDefaultBTreeOrder());
        assertEquals(CommonConstant.DEFAULT_STAGE_SAMPLE_SIZE, config.getStageSampleSize());
    }

    @Test
    @DisplayName("测试非法配置值被拒绝")
    void testInvalidValues() {
        Properties notANumber = new Properties();
        notANumber.setProperty(CommonConstant.KEY_MAX_RECURSION_DEPTH, "many");

        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromProperties(notANumber));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().maxRecursionDepth(0));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().defaultBTreeOrder(2));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().stageSampleSize(-1));
    }
}
