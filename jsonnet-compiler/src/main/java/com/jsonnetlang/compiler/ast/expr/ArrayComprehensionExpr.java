package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * 数组推导式 [e for x in arr if cond ...]
 */
public class ArrayComprehensionExpr extends Expression {
    private final Expression element;
    private final CompSpec.ForSpec firstFor;
    private final List<CompSpec> specs;
    private final Token closeToken;

    public ArrayComprehensionExpr(Token openToken, Expression element, CompSpec.ForSpec firstFor,
                                  List<CompSpec> specs, Token closeToken) {
        super(openToken);
        this.element = element;
        this.firstFor = firstFor;
        this.specs = Collections.unmodifiableList(specs);
        this.closeToken = closeToken;
    }

    public Expression getElement() {
        return element;
    }

    public CompSpec.ForSpec getFirstFor() {
        return firstFor;
    }

    public List<CompSpec> getSpecs() {
        return specs;
    }

    public Token getCloseToken() {
        return closeToken;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayComprehensionExpr(this, context);
    }
}
