package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstNode;
import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(Token token) {
        super(token);
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
