package com.jsonnetlang.targeting;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * 过滤结果：保留的路径与被跳过的目标，各自保持输入顺序
 */
public final class TargetPartition {
    private final List<Path> selected;
    private final List<SkippedTarget> skipped;

    public TargetPartition(List<Path> selected, List<SkippedTarget> skipped) {
        this.selected = Collections.unmodifiableList(selected);
        this.skipped = Collections.unmodifiableList(skipped);
    }

    public List<Path> getSelected() {
        return selected;
    }

    public List<SkippedTarget> getSkipped() {
        return skipped;
    }
}
