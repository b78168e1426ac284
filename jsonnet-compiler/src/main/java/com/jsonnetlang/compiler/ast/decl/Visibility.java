package com.jsonnetlang.compiler.ast.decl;

/**
 * 字段可见性
 */
public enum Visibility {
    /** : 默认可见（继承被合并对象的可见性） */
    VISIBLE(":"),
    /** :: 隐藏 */
    HIDDEN("::"),
    /** ::: 强制可见 */
    FORCED_VISIBLE(":::");

    private final String source;

    Visibility(String source) {
        this.source = source;
    }

    /** 返回 Jsonnet 源码中对应的分隔符 */
    public String toSourceString() {
        return source;
    }
}
