package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.ast.decl.ObjectMember;
import com.jsonnetlang.compiler.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * 对象字面量 { members }
 */
public class ObjectLiteralExpr extends Expression {
    private final List<ObjectMember> members;
    private final Token closeToken;

    public ObjectLiteralExpr(Token openToken, List<ObjectMember> members, Token closeToken) {
        super(openToken);
        this.members = Collections.unmodifiableList(members);
        this.closeToken = closeToken;
    }

    public Token getOpenToken() {
        return token;
    }

    public List<ObjectMember> getMembers() {
        return members;
    }

    public Token getCloseToken() {
        return closeToken;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitObjectLiteralExpr(this, context);
    }
}
