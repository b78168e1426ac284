package com.jsonnetlang.compiler.formatter;

import java.util.Arrays;

/**
 * Jsonnet 格式化配置
 *
 * <p>选项含义与 jsonnetfmt 对应：缩进宽度、对象/数组括号内侧空格、尾逗号、最大行宽。</p>
 */
public class FormatConfig {
    private int indentSize = 2;
    private boolean useTabs = false;
    private int maxLineWidth = 100;
    private boolean trailingComma = true;
    /** { a: 1 } 而非 {a: 1} */
    private boolean padObjects = true;
    /** [ 1, 2 ] 而非 [1, 2] */
    private boolean padArrays = false;

    public FormatConfig() {
    }

    /**
     * 单行输出配置：对象和数组永不换行，用于诊断信息和日志
     */
    public static FormatConfig singleLine() {
        FormatConfig config = new FormatConfig();
        config.setMaxLineWidth(Integer.MAX_VALUE);
        config.setTrailingComma(false);
        return config;
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must not be negative: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    public boolean isUseTabs() {
        return useTabs;
    }

    public void setUseTabs(boolean useTabs) {
        this.useTabs = useTabs;
    }

    public int getMaxLineWidth() {
        return maxLineWidth;
    }

    public void setMaxLineWidth(int maxLineWidth) {
        this.maxLineWidth = maxLineWidth;
    }

    /**
     * 多行输出时最后一个成员后是否保留逗号
     */
    public boolean isTrailingComma() {
        return trailingComma;
    }

    public void setTrailingComma(boolean trailingComma) {
        this.trailingComma = trailingComma;
    }

    public boolean isPadObjects() {
        return padObjects;
    }

    public void setPadObjects(boolean padObjects) {
        this.padObjects = padObjects;
    }

    public boolean isPadArrays() {
        return padArrays;
    }

    public void setPadArrays(boolean padArrays) {
        this.padArrays = padArrays;
    }

    /**
     * 单层缩进：制表符，或 indentSize 个空格
     */
    public String getIndentUnit() {
        if (useTabs) {
            return "\t";
        }
        char[] spaces = new char[indentSize];
        Arrays.fill(spaces, ' ');
        return new String(spaces);
    }
}
