package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * 数组字面量 [e1, e2, ...]
 */
public class ArrayLiteralExpr extends Expression {
    private final List<Expression> elements;
    private final Token closeToken;

    public ArrayLiteralExpr(Token openToken, List<Expression> elements, Token closeToken) {
        super(openToken);
        this.elements = Collections.unmodifiableList(elements);
        this.closeToken = closeToken;
    }

    public Token getOpenToken() {
        return token;
    }

    public List<Expression> getElements() {
        return elements;
    }

    public Token getCloseToken() {
        return closeToken;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayLiteralExpr(this, context);
    }
}
