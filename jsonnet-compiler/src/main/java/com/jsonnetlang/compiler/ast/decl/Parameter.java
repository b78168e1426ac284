package com.jsonnetlang.compiler.ast.decl;

import com.jsonnetlang.compiler.ast.AstNode;
import com.jsonnetlang.compiler.ast.Ident;
import com.jsonnetlang.compiler.ast.expr.Expression;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final Ident name;
    private final Token assignToken;        // 可选
    private final Expression defaultValue;  // 可选

    public Parameter(Ident name, Token assignToken, Expression defaultValue) {
        super(name.getToken());
        this.name = name;
        this.assignToken = assignToken;
        this.defaultValue = defaultValue;
    }

    public Parameter(Ident name) {
        this(name, null, null);
    }

    public Ident getName() {
        return name;
    }

    public Token getAssignToken() {
        return assignToken;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }
}
