package com.jsonnetlang.ir.lowering;

import com.jsonnetlang.compiler.ast.SourceLocation;
import com.jsonnetlang.compiler.ast.expr.Expression;

/**
 * 脱糖异常：遇到尚未支持的表面语法构造（import、推导式、+: 字段）。
 * 抛出后不会产生任何部分 Core 树。
 */
public class UnsupportedConstructException extends RuntimeException {
    private final String construct;
    private final Expression node;
    private final String rendered;

    public UnsupportedConstructException(String construct, Expression node, String rendered) {
        super("construct not handled: " + construct);
        this.construct = construct;
        this.node = node;
        this.rendered = rendered;
    }

    public String getConstruct() {
        return construct;
    }

    public Expression getNode() {
        return node;
    }

    /**
     * 出错节点的单行源码渲染
     */
    public String getRendered() {
        return rendered;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (node != null) {
            SourceLocation loc = node.getLocation();
            if (!loc.isSynthetic()) {
                sb.append(" at line ").append(loc.getLine());
                sb.append(", column ").append(loc.getColumn());
            }
        }
        if (rendered != null) {
            sb.append(": ").append(rendered);
        }
        return sb.toString();
    }
}
