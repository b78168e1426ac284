package com.jsonnetlang.targeting;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SkippedTargetReport 单元测试
 */
class SkippedTargetReportTest {

    private final SkippedTargetReport report = new SkippedTargetReport();

    @Test
    @DisplayName("单条记录字段")
    void testToJson() {
        SkippedTarget target = new SkippedTarget(Paths.get("lib/big.jsonnet"), SkipReason.TOO_BIG,
                "target file size exceeds 10 bytes at 11 bytes");

        JsonObject json = report.toJson(target);

        assertEquals("lib/big.jsonnet", json.get("path").getAsString());
        assertEquals("too_big", json.get("reason").getAsString());
        assertEquals("target file size exceeds 10 bytes at 11 bytes", json.get("details").getAsString());
        assertTrue(json.get("rule_id").isJsonNull());
    }

    @Test
    @DisplayName("渲染保留 null 字段")
    void testRender() {
        SkippedTarget target = new SkippedTarget(Paths.get("a.js"), SkipReason.MINIFIED, "m");

        String rendered = report.render(Collections.singletonList(target));

        assertThat(rendered)
                .contains("\"reason\":\"minified\"")
                .contains("\"rule_id\":null")
                .startsWith("[")
                .endsWith("]");
    }

    @Test
    @DisplayName("规则 ID 与多条记录")
    void testRuleIdAndList() {
        SkippedTarget first = new SkippedTarget(Paths.get("x"), SkipReason.INSUFFICIENT_PERMISSIONS,
                TargetFilter.FILE_NOT_ACCESSIBLE, "rule-1");
        SkippedTarget second = new SkippedTarget(Paths.get("y"), SkipReason.TOO_BIG, "d");

        JsonArray array = report.toJson(Arrays.asList(first, second));

        assertEquals(2, array.size());
        JsonObject json = array.get(0).getAsJsonObject();
        assertEquals("insufficient_permissions", json.get("reason").getAsString());
        assertEquals("rule-1", json.get("rule_id").getAsString());
        assertEquals("y", array.get(1).getAsJsonObject().get("path").getAsString());
    }

    @Test
    @DisplayName("toString 使用报告名称")
    void testToString() {
        SkippedTarget target = new SkippedTarget(Paths.get("a.js"), SkipReason.MINIFIED, "m");
        assertEquals("a.js (minified: m)", target.toString());
    }
}
