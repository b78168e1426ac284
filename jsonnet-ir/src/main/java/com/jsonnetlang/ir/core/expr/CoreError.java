package com.jsonnetlang.ir.core.expr;

import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.ir.core.CoreExpr;
import com.jsonnetlang.ir.core.CoreVisitor;

/**
 * error payload，payload 只在求值到该节点时才计算。
 */
public class CoreError extends CoreExpr {

    private final CoreExpr payload;

    public CoreError(Token errorToken, CoreExpr payload) {
        super(errorToken);
        this.payload = payload;
    }

    public CoreExpr getPayload() {
        return payload;
    }

    @Override
    public <R, C> R accept(CoreVisitor<R, C> visitor, C context) {
        return visitor.visitError(this, context);
    }
}
