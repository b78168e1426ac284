package com.jsonnetlang.compiler.ast;

/**
 * 源码位置信息
 *
 * <p>{@link #SYNTHETIC} 标记脱糖阶段注入的节点，它不对应任何真实源码位置，
 * 诊断信息不应将其归因到某一行某一列。</p>
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int offset;
    private final int length;
    private final boolean synthetic;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0, 0);

    public static final SourceLocation SYNTHETIC = new SourceLocation("<synthetic>", -1, -1, -1, 0, true);

    public SourceLocation(String file, int line, int column, int offset, int length) {
        this(file, line, column, offset, length, false);
    }

    private SourceLocation(String file, int line, int column, int offset, int length, boolean synthetic) {
        this.file = file != null ? file.intern() : null;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.length = length;
        this.synthetic = synthetic;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public int getLength() {
        return length;
    }

    public boolean isSynthetic() {
        return synthetic;
    }

    @Override
    public String toString() {
        if (synthetic) {
            return "<synthetic>";
        }
        return file + ":" + line + ":" + column;
    }
}
