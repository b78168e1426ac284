package com.jsonnetlang.targeting;

import com.google.gson.annotations.SerializedName;

/**
 * 目标文件被跳过的原因
 */
public enum SkipReason {
    @SerializedName("minified")
    MINIFIED("minified"),

    @SerializedName("too_big")
    TOO_BIG("too_big"),

    @SerializedName("insufficient_permissions")
    INSUFFICIENT_PERMISSIONS("insufficient_permissions");

    private final String wireName;

    SkipReason(String wireName) {
        this.wireName = wireName;
    }

    /** 报告中使用的名称 */
    public String getWireName() {
        return wireName;
    }
}
