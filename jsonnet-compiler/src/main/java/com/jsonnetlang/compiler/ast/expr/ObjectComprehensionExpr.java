package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.ast.decl.ObjectMember;
import com.jsonnetlang.compiler.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * 对象推导式 { local ..., [k]: v, local ... for x in arr if cond ... }
 *
 * <p>members 中恰有一个动态名字段，其余均为 local 绑定。</p>
 */
public class ObjectComprehensionExpr extends Expression {
    private final List<ObjectMember> members;
    private final CompSpec.ForSpec firstFor;
    private final List<CompSpec> specs;
    private final Token closeToken;

    public ObjectComprehensionExpr(Token openToken, List<ObjectMember> members, CompSpec.ForSpec firstFor,
                                   List<CompSpec> specs, Token closeToken) {
        super(openToken);
        this.members = Collections.unmodifiableList(members);
        this.firstFor = firstFor;
        this.specs = Collections.unmodifiableList(specs);
        this.closeToken = closeToken;
    }

    public List<ObjectMember> getMembers() {
        return members;
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
        return visitor.visitObjectComprehensionExpr(this, context);
    }
}
