package com.jsonnetlang.compiler.ast;

import com.jsonnetlang.compiler.lexer.Token;

/**
 * 标识符出现（绑定名、参数名、字段名、成员名等）
 */
public final class Ident {
    private final String name;
    private final Token token;

    public Ident(String name, Token token) {
        this.name = name;
        this.token = token;
    }

    public Ident(Token token) {
        this(token.getLexeme(), token);
    }

    public String getName() {
        return name;
    }

    public Token getToken() {
        return token;
    }

    public SourceLocation getLocation() {
        return token.getLocation();
    }

    @Override
    public String toString() {
        return name;
    }
}
