package com.jsonnetlang.compiler.formatter;

/**
 * 格式化输出缓冲区
 *
 * <p>记录缩进层级和当前行已输出的宽度。缩进在行首第一次追加文本时写入，
 * 因此空行不带尾随空白。</p>
 */
public class FormatterContext {
    private final StringBuilder output = new StringBuilder();
    private final FormatConfig config;
    private final String indentUnit;
    private int depth;
    private int column;
    private boolean pendingIndent;

    public FormatterContext(FormatConfig config) {
        this(config, 0, true);
    }

    private FormatterContext(FormatConfig config, int depth, boolean pendingIndent) {
        this.config = config;
        this.indentUnit = config.getIndentUnit();
        this.depth = depth;
        this.pendingIndent = pendingIndent;
    }

    public FormatConfig getConfig() {
        return config;
    }

    public void indent() {
        depth++;
    }

    public void dedent() {
        if (depth == 0) {
            throw new IllegalStateException("dedent below column 0");
        }
        depth--;
    }

    /**
     * 追加不含换行的文本
     */
    public void append(String text) {
        if (text.isEmpty()) {
            return;
        }
        if (pendingIndent) {
            for (int i = 0; i < depth; i++) {
                output.append(indentUnit);
            }
            column = depth * indentUnit.length();
            pendingIndent = false;
        }
        output.append(text);
        column += text.length();
    }

    public void newLine() {
        output.append('\n');
        column = 0;
        pendingIndent = true;
    }

    /**
     * 同配置、同缩进层级的空白缓冲区，用于试探单行渲染。
     * 试探结果从当前列开始，不写行首缩进。
     */
    public FormatterContext fork() {
        return new FormatterContext(config, depth, false);
    }

    /**
     * 在当前列追加 text 后是否不超过最大行宽
     */
    public boolean fitsOnLine(String text) {
        if (text.indexOf('\n') >= 0) {
            return false;
        }
        int start = pendingIndent ? depth * indentUnit.length() : column;
        return (long) start + text.length() <= config.getMaxLineWidth();
    }

    public int getColumn() {
        return column;
    }

    public String getOutput() {
        return output.toString();
    }
}
