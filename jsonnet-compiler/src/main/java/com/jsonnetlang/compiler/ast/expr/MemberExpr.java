package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.ast.Ident;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 成员访问表达式 e.id
 */
public class MemberExpr extends Expression {
    private final Expression target;
    private final Ident member;

    public MemberExpr(Expression target, Token dotToken, Ident member) {
        super(dotToken);
        this.target = target;
        this.member = member;
    }

    public Expression getTarget() {
        return target;
    }

    public Token getDotToken() {
        return token;
    }

    public Ident getMember() {
        return member;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMemberExpr(this, context);
    }
}
