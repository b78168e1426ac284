package com.jsonnetlang.ir.core.expr;

import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.ir.core.CoreExpr;
import com.jsonnetlang.ir.core.CoreVisitor;

/**
 * 下标访问 target[index]，也是点号访问脱糖后的形式。
 */
public class CoreIndex extends CoreExpr {

    private final CoreExpr target;
    private final CoreExpr index;
    private final Token closeToken;

    public CoreIndex(CoreExpr target, Token openToken, CoreExpr index, Token closeToken) {
        super(openToken);
        this.target = target;
        this.index = index;
        this.closeToken = closeToken;
    }

    public CoreExpr getTarget() {
        return target;
    }

    public Token getOpenToken() {
        return token;
    }

    public CoreExpr getIndex() {
        return index;
    }

    public Token getCloseToken() {
        return closeToken;
    }

    @Override
    public <R, C> R accept(CoreVisitor<R, C> visitor, C context) {
        return visitor.visitIndex(this, context);
    }
}
