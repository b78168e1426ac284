package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.ast.decl.Bind;
import com.jsonnetlang.compiler.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * 局部绑定块 local b1, b2, ...; body
 *
 * <p>同一块内的绑定互相可见（递归、惰性绑定）。</p>
 */
public class LocalExpr extends Expression {
    private final List<Bind> binds;
    private final Token semicolonToken;
    private final Expression body;

    public LocalExpr(Token localToken, List<Bind> binds, Token semicolonToken, Expression body) {
        super(localToken);
        this.binds = Collections.unmodifiableList(binds);
        this.semicolonToken = semicolonToken;
        this.body = body;
    }

    public Token getLocalToken() {
        return token;
    }

    public List<Bind> getBinds() {
        return binds;
    }

    public Token getSemicolonToken() {
        return semicolonToken;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLocalExpr(this, context);
    }
}
