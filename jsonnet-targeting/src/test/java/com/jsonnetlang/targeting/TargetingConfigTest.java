package com.jsonnetlang.targeting;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TargetingConfig 单元测试
 */
class TargetingConfigTest {

    @Test
    @DisplayName("默认值")
    void testDefaults() {
        TargetingConfig config = new TargetingConfig();

        assertTrue(config.isSkipMinifiedFiles());
        assertEquals(0, config.getMaxTargetBytes());
        assertEquals(0.07, config.getMinWhitespaceFrequency());
        assertEquals(0.001, config.getMinLineFrequency());
        assertEquals(4096, config.getSampleBlockSize());
        assertEquals(1000, config.getMinSampleSize());
    }

    @Test
    @DisplayName("从 Properties 读取，缺失键保持默认")
    void testFromProperties() {
        Properties props = new Properties();
        props.setProperty("targeting.skipMinifiedFiles", "false");
        props.setProperty("targeting.maxTargetBytes", " 1048576 ");
        props.setProperty("targeting.minLineFrequency", "0.01");
        props.setProperty("other.maxTargetBytes", "1");

        TargetingConfig config = TargetingConfig.fromProperties(props);

        assertFalse(config.isSkipMinifiedFiles());
        assertEquals(1048576L, config.getMaxTargetBytes());
        assertEquals(0.01, config.getMinLineFrequency());
        assertEquals(0.07, config.getMinWhitespaceFrequency());
        assertEquals(4096, config.getSampleBlockSize());
    }

    @Test
    @DisplayName("非法数值抛出异常")
    void testInvalidNumber() {
        Properties props = new Properties();
        props.setProperty("targeting.sampleBlockSize", "big");

        assertThrows(NumberFormatException.class, () -> TargetingConfig.fromProperties(props));
    }
}
