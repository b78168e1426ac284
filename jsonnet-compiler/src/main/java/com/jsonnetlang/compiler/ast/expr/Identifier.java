package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.ast.Ident;

/**
 * 标识符表达式
 */
public class Identifier extends Expression {
    private final Ident ident;

    public Identifier(Ident ident) {
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
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
