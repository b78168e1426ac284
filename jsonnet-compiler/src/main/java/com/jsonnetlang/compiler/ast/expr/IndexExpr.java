package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 索引访问表达式 e[i]
 */
public class IndexExpr extends Expression {
    private final Expression target;
    private final Expression index;
    private final Token closeToken;

    public IndexExpr(Expression target, Token openToken, Expression index, Token closeToken) {
        super(openToken);
        this.target = target;
        this.index = index;
        this.closeToken = closeToken;
    }

    public Expression getTarget() {
        return target;
    }

    public Token getOpenToken() {
        return token;
    }

    public Expression getIndex() {
        return index;
    }

    public Token getCloseToken() {
        return closeToken;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexExpr(this, context);
    }
}
