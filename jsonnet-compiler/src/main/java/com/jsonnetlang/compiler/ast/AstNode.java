package com.jsonnetlang.compiler.ast;

import com.jsonnetlang.compiler.lexer.Token;

/**
 * AST 节点基类
 *
 * <p>每个节点保留其主 token（如运算符、关键字或左括号），位置信息由该 token 给出。</p>
 */
public abstract class AstNode {
    protected final Token token;

    protected AstNode(Token token) {
        this.token = token;
    }

    public Token getToken() {
        return token;
    }

    public SourceLocation getLocation() {
        return token != null ? token.getLocation() : SourceLocation.UNKNOWN;
    }
}
