package com.jsonnetlang.ir.core.decl;

import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.ir.core.CoreExpr;

/**
 * 对象断言，expr 已脱糖为 if c then true else error m。
 */
public class CoreObjectAssert {

    private final Token assertToken;
    private final CoreExpr expr;

    public CoreObjectAssert(Token assertToken, CoreExpr expr) {
        this.assertToken = assertToken;
        this.expr = expr;
    }

    public Token getAssertToken() {
        return assertToken;
    }

    public CoreExpr getExpr() {
        return expr;
    }
}
