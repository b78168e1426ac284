package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.ast.decl.Assertion;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 断言表达式 assert c [: m]; rest
 */
public class AssertExpr extends Expression {
    private final Assertion assertion;
    private final Token semicolonToken;
    private final Expression rest;

    public AssertExpr(Assertion assertion, Token semicolonToken, Expression rest) {
        super(assertion.getAssertToken());
        this.assertion = assertion;
        this.semicolonToken = semicolonToken;
        this.rest = rest;
    }

    public Assertion getAssertion() {
        return assertion;
    }

    public Token getSemicolonToken() {
        return semicolonToken;
    }

    public Expression getRest() {
        return rest;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssertExpr(this, context);
    }
}
