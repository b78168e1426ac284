package com.jsonnetlang.compiler.ast.decl;

import com.jsonnetlang.compiler.lexer.Token;

/**
 * 对象体内的 local 绑定
 */
public class ObjectLocal extends ObjectMember {
    private final Bind bind;

    public ObjectLocal(Token localToken, Bind bind) {
        super(localToken);
        this.bind = bind;
    }

    public Token getLocalToken() {
        return token;
    }

    public Bind getBind() {
        return bind;
    }

    @Override
    public MemberKind getMemberKind() {
        return MemberKind.LOCAL;
    }
}
