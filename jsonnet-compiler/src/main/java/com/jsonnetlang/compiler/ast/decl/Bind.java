package com.jsonnetlang.compiler.ast.decl;

import com.jsonnetlang.compiler.ast.AstNode;
import com.jsonnetlang.compiler.ast.Ident;
import com.jsonnetlang.compiler.ast.expr.Expression;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 局部绑定 id = e
 *
 * <p>local f(x) = e 形式的方法绑定已由 Parser 转换为 f = function(x) e。</p>
 */
public class Bind extends AstNode {
    private final Ident name;
    private final Token assignToken;
    private final Expression value;

    public Bind(Ident name, Token assignToken, Expression value) {
        super(name.getToken());
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

    public Expression getValue() {
        return value;
    }
}
