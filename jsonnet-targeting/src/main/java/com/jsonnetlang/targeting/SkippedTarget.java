package com.jsonnetlang.targeting;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 被跳过的目标及原因
 */
public final class SkippedTarget {
    private final Path path;
    private final SkipReason reason;
    private final String details;
    private final String ruleId;

    public SkippedTarget(Path path, SkipReason reason, String details) {
        this(path, reason, details, null);
    }

    public SkippedTarget(Path path, SkipReason reason, String details, String ruleId) {
        this.path = Objects.requireNonNull(path, "path");
        this.reason = Objects.requireNonNull(reason, "reason");
        this.details = details;
        this.ruleId = ruleId;
    }

    public Path getPath() {
        return path;
    }

    public SkipReason getReason() {
        return reason;
    }

    public String getDetails() {
        return details;
    }

    /**
     * 与具体规则相关的跳过才有 ruleId，文件级过滤恒为 null
     */
    public String getRuleId() {
        return ruleId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SkippedTarget)) return false;
        SkippedTarget that = (SkippedTarget) o;
        return path.equals(that.path) && reason == that.reason
                && Objects.equals(details, that.details) && Objects.equals(ruleId, that.ruleId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, reason, details, ruleId);
    }

    @Override
    public String toString() {
        return path + " (" + reason.getWireName() + (details != null ? ": " + details : "") + ")";
    }
}
