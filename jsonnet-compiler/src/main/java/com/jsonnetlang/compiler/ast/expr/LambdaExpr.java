package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.ast.decl.Parameter;
import com.jsonnetlang.compiler.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * 函数表达式 function(params) body
 */
public class LambdaExpr extends Expression {
    private final Token openToken;
    private final List<Parameter> params;
    private final Token closeToken;
    private final Expression body;

    public LambdaExpr(Token functionToken, Token openToken, List<Parameter> params,
                      Token closeToken, Expression body) {
        super(functionToken);
        this.openToken = openToken;
        this.params = Collections.unmodifiableList(params);
        this.closeToken = closeToken;
        this.body = body;
    }

    public Token getFunctionToken() {
        return token;
    }

    public Token getOpenToken() {
        return openToken;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public Token getCloseToken() {
        return closeToken;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLambdaExpr(this, context);
    }
}
