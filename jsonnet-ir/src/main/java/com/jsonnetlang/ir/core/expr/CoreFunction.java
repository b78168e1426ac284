package com.jsonnetlang.ir.core.expr;

import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.ir.core.CoreExpr;
import com.jsonnetlang.ir.core.CoreVisitor;
import com.jsonnetlang.ir.core.decl.CoreParam;

import java.util.Collections;
import java.util.List;

/**
 * function(params) body，每个形参都带默认值表达式。
 */
public class CoreFunction extends CoreExpr {

    private final Token openToken;
    private final List<CoreParam> params;
    private final Token closeToken;
    private final CoreExpr body;

    public CoreFunction(Token functionToken, Token openToken, List<CoreParam> params,
                        Token closeToken, CoreExpr body) {
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

    public List<CoreParam> getParams() {
        return params;
    }

    public Token getCloseToken() {
        return closeToken;
    }

    public CoreExpr getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(CoreVisitor<R, C> visitor, C context) {
        return visitor.visitFunction(this, context);
    }
}
