package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 错误表达式 error e
 */
public class ErrorExpr extends Expression {
    private final Expression payload;

    public ErrorExpr(Token errorToken, Expression payload) {
        super(errorToken);
        this.payload = payload;
    }

    public Expression getPayload() {
        return payload;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitErrorExpr(this, context);
    }
}
