package com.jsonnetlang.compiler.ast.decl;

import com.jsonnetlang.compiler.ast.AstNode;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 对象体成员：局部绑定、断言或字段，按源码顺序交错出现
 */
public abstract class ObjectMember extends AstNode {

    protected ObjectMember(Token token) {
        super(token);
    }

    public abstract MemberKind getMemberKind();

    public enum MemberKind {
        LOCAL,
        ASSERT,
        FIELD
    }
}
