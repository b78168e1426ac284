package com.jsonnetlang.ir.core.expr;

import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.ir.core.CoreExpr;
import com.jsonnetlang.ir.core.CoreVisitor;

import java.util.Collections;
import java.util.List;

public class CoreArray extends CoreExpr {

    private final List<CoreExpr> elements;
    private final Token closeToken;

    public CoreArray(Token openToken, List<CoreExpr> elements, Token closeToken) {
        super(openToken);
        this.elements = Collections.unmodifiableList(elements);
        this.closeToken = closeToken;
    }

    public Token getOpenToken() {
        return token;
    }

    public List<CoreExpr> getElements() {
        return elements;
    }

    public Token getCloseToken() {
        return closeToken;
    }

    @Override
    public <R, C> R accept(CoreVisitor<R, C> visitor, C context) {
        return visitor.visitArray(this, context);
    }
}
