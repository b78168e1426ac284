package com.jsonnetlang.ir.core.expr;

import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.ir.core.CoreExpr;
import com.jsonnetlang.ir.core.CoreVisitor;
import com.jsonnetlang.ir.core.decl.CoreBind;

import java.util.Collections;
import java.util.List;

/**
 * local b1, b2, ...; body
 * <p>
 * 同一组绑定互相可见（递归绑定），至少包含一个绑定。
 */
public class CoreLocal extends CoreExpr {

    private final List<CoreBind> binds;
    private final Token semicolonToken;
    private final CoreExpr body;

    public CoreLocal(Token localToken, List<CoreBind> binds, Token semicolonToken, CoreExpr body) {
        super(localToken);
        if (binds.isEmpty()) {
            throw new IllegalArgumentException("local requires at least one binding");
        }
        this.binds = Collections.unmodifiableList(binds);
        this.semicolonToken = semicolonToken;
        this.body = body;
    }

    public Token getLocalToken() {
        return token;
    }

    public List<CoreBind> getBinds() {
        return binds;
    }

    public Token getSemicolonToken() {
        return semicolonToken;
    }

    public CoreExpr getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(CoreVisitor<R, C> visitor, C context) {
        return visitor.visitLocal(this, context);
    }
}
