package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 括号表达式 (e)
 */
public class ParenExpr extends Expression {
    private final Expression inner;
    private final Token closeToken;

    public ParenExpr(Token openToken, Expression inner, Token closeToken) {
        super(openToken);
        this.inner = inner;
        this.closeToken = closeToken;
    }

    public Expression getInner() {
        return inner;
    }

    public Token getCloseToken() {
        return closeToken;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParenExpr(this, context);
    }
}
