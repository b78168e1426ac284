package com.jsonnetlang.targeting;

import com.google.gson.*;

import java.util.List;

/**
 * 将跳过的目标序列化为 JSON：
 * {@code {"path": ..., "reason": "too_big", "details": ..., "rule_id": null}}
 */
public class SkippedTargetReport {
    private final Gson gson;

    public SkippedTargetReport() {
        this.gson = new GsonBuilder().serializeNulls().create();
    }

    public JsonObject toJson(SkippedTarget target) {
        JsonObject obj = new JsonObject();
        obj.addProperty("path", target.getPath().toString());
        obj.add("reason", gson.toJsonTree(target.getReason()));
        obj.addProperty("details", target.getDetails());
        obj.addProperty("rule_id", target.getRuleId());
        return obj;
    }

    public JsonArray toJson(List<SkippedTarget> targets) {
        JsonArray array = new JsonArray();
        for (SkippedTarget target : targets) {
            array.add(toJson(target));
        }
        return array;
    }

    /**
     * 渲染为 JSON 文本，null 字段保留
     */
    public String render(List<SkippedTarget> targets) {
        return gson.toJson(toJson(targets));
    }
}
