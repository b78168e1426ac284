package com.jsonnetlang.ir.core.decl;

import com.jsonnetlang.compiler.ast.Ident;
import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.ir.core.CoreExpr;

/**
 * local 绑定 name = value
 */
public class CoreBind {

    private final Ident name;
    private final Token assignToken;
    private final CoreExpr value;

    public CoreBind(Ident name, Token assignToken, CoreExpr value) {
        this.name = name;
        this.assignToken = assignToken;
        this.value = value;
    }

    public Ident getName() {
        return name;
    }

    public Token getAssignToken() {
        return assignToken;
    }

    public CoreExpr getValue() {
        return value;
    }
}
