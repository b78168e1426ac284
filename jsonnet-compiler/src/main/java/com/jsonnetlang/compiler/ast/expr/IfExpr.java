package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * If 表达式 if c then t [else e]
 */
public class IfExpr extends Expression {
    private final Expression condition;
    private final Token thenToken;
    private final Expression thenExpr;
    private final Token elseToken;      // 可选
    private final Expression elseExpr;  // 可选

    public IfExpr(Token ifToken, Expression condition, Token thenToken, Expression thenExpr,
                  Token elseToken, Expression elseExpr) {
        super(ifToken);
        this.condition = condition;
        this.thenToken = thenToken;
        this.thenExpr = thenExpr;
        this.elseToken = elseToken;
        this.elseExpr = elseExpr;
    }

    public Token getIfToken() {
        return token;
    }

    public Expression getCondition() {
        return condition;
    }

    public Token getThenToken() {
        return thenToken;
    }

    public Expression getThenExpr() {
        return thenExpr;
    }

    public Token getElseToken() {
        return elseToken;
    }

    public Expression getElseExpr() {
        return elseExpr;
    }

    public boolean hasElse() {
        return elseExpr != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfExpr(this, context);
    }
}
