package com.jsonnetlang.ir.core;

import com.jsonnetlang.compiler.ast.SourceLocation;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * Core 表达式基类。
 * <p>
 * 每个节点保留来自表面语法树的主 token；脱糖时注入的节点持有合成 token。
 * 节点构造后不可变。
 */
public abstract class CoreExpr implements CoreNode {

    protected final Token token;

    protected CoreExpr(Token token) {
        this.token = token;
    }

    @Override
    public Token getToken() {
        return token;
    }

    @Override
    public SourceLocation getLocation() {
        return token != null ? token.getLocation() : SourceLocation.UNKNOWN;
    }

    /**
     * 是否为脱糖阶段注入、无源码位置的节点
     */
    public boolean isSynthetic() {
        return token != null && token.isSynthetic();
    }
}
