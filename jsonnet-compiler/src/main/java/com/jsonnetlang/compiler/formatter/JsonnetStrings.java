package com.jsonnetlang.compiler.formatter;

import com.jsonnetlang.compiler.ast.expr.Literal.StringKind;

/**
 * Jsonnet 字符串字面量转义工具
 */
public final class JsonnetStrings {

    private JsonnetStrings() {}

    /**
     * 按引号风格将字符串值渲染为 Jsonnet 源码
     *
     * @param verbatim 是否为 @ 前缀的 verbatim 字符串（仅对单/双引号有效）
     */
    public static String quote(StringKind kind, boolean verbatim, String value) {
        switch (kind) {
            case TRIPLE_BAR:
                return textBlock(value);
            case SINGLE_QUOTE:
                return verbatim
                        ? "@'" + value.replace("'", "''") + "'"
                        : "'" + escapeString(value, '\'') + "'";
            case DOUBLE_QUOTE:
            default:
                return verbatim
                        ? "@\"" + value.replace("\"", "\"\"") + "\""
                        : "\"" + escapeString(value, '"') + "\"";
        }
    }

    /** 转义字符串内容（quote 为包裹字符串的引号） */
    public static String escapeString(String s, char quote) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\b': sb.append("\\b"); break;
                case '\f': sb.append("\\f"); break;
                default:
                    if (c == quote) {
                        sb.append('\\').append(c);
                    } else if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.toString();
    }

    private static String textBlock(String value) {
        StringBuilder sb = new StringBuilder("|||\n");
        String body = value.endsWith("\n") ? value.substring(0, value.length() - 1) : value;
        for (String line : body.split("\n", -1)) {
            if (!line.isEmpty()) {
                sb.append("  ").append(line);
            }
            sb.append('\n');
        }
        sb.append("|||");
        return sb.toString();
    }
}
