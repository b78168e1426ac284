package com.jsonnetlang.ir.core.expr;

import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.ir.core.CoreExpr;
import com.jsonnetlang.ir.core.CoreVisitor;

/**
 * if c then t else e，Core 中的条件表达式总是三元的。
 */
public class CoreIf extends CoreExpr {

    private final CoreExpr condition;
    private final Token thenToken;
    private final CoreExpr thenExpr;
    private final Token elseToken;
    private final CoreExpr elseExpr;

    public CoreIf(Token ifToken, CoreExpr condition, Token thenToken, CoreExpr thenExpr,
                  Token elseToken, CoreExpr elseExpr) {
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

    public CoreExpr getCondition() {
        return condition;
    }

    public Token getThenToken() {
        return thenToken;
    }

    public CoreExpr getThenExpr() {
        return thenExpr;
    }

    public Token getElseToken() {
        return elseToken;
    }

    public CoreExpr getElseExpr() {
        return elseExpr;
    }

    @Override
    public <R, C> R accept(CoreVisitor<R, C> visitor, C context) {
        return visitor.visitIf(this, context);
    }
}
