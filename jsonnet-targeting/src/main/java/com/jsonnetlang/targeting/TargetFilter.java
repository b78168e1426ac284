package com.jsonnetlang.targeting;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * 目标文件过滤：压缩文件、超大文件、无访问权限的文件和目录。
 *
 * <p>单个判定方法返回跳过记录，{@link Optional#empty()} 表示保留该路径；
 * exclude 系列方法将路径列表划分为保留与跳过两部分。</p>
 */
public class TargetFilter {

    private static final Logger LOG = Logger.getLogger(TargetFilter.class.getName());

    static final String FILE_NOT_ACCESSIBLE = "file lacks sufficient access permissions";
    static final String DIR_NOT_ACCESSIBLE = "folder lacks sufficient access permissions";

    private final TargetingConfig config;

    public TargetFilter(TargetingConfig config) {
        this.config = config;
    }

    public TargetFilter() {
        this(new TargetingConfig());
    }

    public TargetingConfig getConfig() {
        return config;
    }

    // ========== 压缩文件 ==========

    /**
     * 按文件首块的空白统计判断是否为压缩文件。
     * 较小的样本可能只是一段很长的 URL，不做判定。
     */
    public Optional<SkippedTarget> isMinified(Path path) {
        if (!config.isSkipMinifiedFiles()) {
            return Optional.empty();
        }
        WhitespaceStat stat = WhitespaceStat.of(readFirstBlock(path, config.getSampleBlockSize()));
        if (stat.getSampleSize() <= config.getMinSampleSize()) {
            return Optional.empty();
        }
        if (stat.getWhitespaceFrequency() < config.getMinWhitespaceFrequency()) {
            return skip(path, SkipReason.MINIFIED, String.format(Locale.ROOT,
                    "file contains too little whitespace: %.3f%% (min = %.1f%%)",
                    100.0 * stat.getWhitespaceFrequency(), 100.0 * config.getMinWhitespaceFrequency()));
        }
        if (stat.getLineFrequency() < config.getMinLineFrequency()) {
            return skip(path, SkipReason.MINIFIED, String.format(Locale.ROOT,
                    "file contains too few lines for its size: %.4f%% (min = %.2f%%)",
                    100.0 * stat.getLineFrequency(), 100.0 * config.getMinLineFrequency()));
        }
        return Optional.empty();
    }

    public TargetPartition excludeMinifiedFiles(List<Path> paths) {
        return partition(paths, this::isMinified);
    }

    // ========== 超大文件 ==========

    public Optional<SkippedTarget> isBig(Path path) {
        long maxBytes = config.getMaxTargetBytes();
        if (maxBytes <= 0) {
            return Optional.empty();
        }
        long size;
        try {
            size = Files.size(path);
        } catch (IOException e) {
            throw new UncheckedIOException("无法读取文件大小: " + path, e);
        }
        if (size > maxBytes) {
            return skip(path, SkipReason.TOO_BIG,
                    String.format(Locale.ROOT, "target file size exceeds %d bytes at %d bytes", maxBytes, size));
        }
        return Optional.empty();
    }

    public TargetPartition excludeBigFiles(List<Path> paths) {
        return partition(paths, this::isBig);
    }

    // ========== 访问权限 ==========

    /**
     * 文件需要可读
     */
    public Optional<SkippedTarget> filterFileAccess(Path file) {
        if (Files.isReadable(file)) {
            return Optional.empty();
        }
        return skip(file, SkipReason.INSUFFICIENT_PERMISSIONS, FILE_NOT_ACCESSIBLE);
    }

    /**
     * 目录需要可读且可进入
     */
    public Optional<SkippedTarget> filterDirAccess(Path dir) {
        if (Files.isReadable(dir) && Files.isExecutable(dir)) {
            return Optional.empty();
        }
        return skip(dir, SkipReason.INSUFFICIENT_PERMISSIONS, DIR_NOT_ACCESSIBLE);
    }

    public TargetPartition excludeInaccessibleFiles(List<Path> files) {
        return partition(files, this::filterFileAccess);
    }

    // ========== 辅助方法 ==========

    private static Optional<SkippedTarget> skip(Path path, SkipReason reason, String details) {
        LOG.fine("跳过目标 " + path + ": " + details);
        return Optional.of(new SkippedTarget(path, reason, details));
    }

    private static TargetPartition partition(List<Path> paths, Function<Path, Optional<SkippedTarget>> check) {
        List<Path> selected = new ArrayList<>();
        List<SkippedTarget> skipped = new ArrayList<>();
        for (Path path : paths) {
            Optional<SkippedTarget> result = check.apply(path);
            if (result.isPresent()) {
                skipped.add(result.get());
            } else {
                selected.add(path);
            }
        }
        return new TargetPartition(selected, skipped);
    }

    /**
     * 读取文件开头至多 blockSize 字节，按字节逐个映射为字符
     */
    static String readFirstBlock(Path path, int blockSize) {
        try (InputStream in = Files.newInputStream(path)) {
            byte[] block = in.readNBytes(blockSize);
            return new String(block, StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new UncheckedIOException("无法读取文件: " + path, e);
        }
    }
}
