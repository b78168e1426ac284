package com.jsonnetlang.ir.core.expr;

import com.jsonnetlang.compiler.ast.Ident;
import com.jsonnetlang.ir.core.CoreExpr;
import com.jsonnetlang.ir.core.CoreVisitor;

/**
 * 变量引用。{@code $} 在 Core 中也是普通标识符。
 */
public class CoreIdentifier extends CoreExpr {

    private final Ident ident;

    public CoreIdentifier(Ident ident) {
        super(ident.getToken());
        this.ident = ident;
    }

    public Ident getIdent() {
        return ident;
    }

    public String getName() {
        return ident.getName();
    }

    @Override
    public <R, C> R accept(CoreVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
