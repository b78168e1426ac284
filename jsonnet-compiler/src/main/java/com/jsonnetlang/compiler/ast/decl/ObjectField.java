package com.jsonnetlang.compiler.ast.decl;

import com.jsonnetlang.compiler.ast.expr.Expression;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 对象字段 name[+]:[:[:]] value
 *
 * <p>方法字段 f(x): e 已由 Parser 转换为 f: function(x) e。</p>
 */
public class ObjectField extends ObjectMember {
    private final FieldName name;
    private final Token plusToken;          // 可选，+ 合并属性
    private final Visibility visibility;
    private final Token visibilityToken;
    private final Expression value;

    public ObjectField(FieldName name, Token plusToken, Visibility visibility,
                       Token visibilityToken, Expression value) {
        super(name.getToken());
        this.name = name;
        this.plusToken = plusToken;
        this.visibility = visibility;
        this.visibilityToken = visibilityToken;
        this.value = value;
    }

    public FieldName getName() {
        return name;
    }

    public Token getPlusToken() {
        return plusToken;
    }

    public boolean isPlus() {
        return plusToken != null;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public Token getVisibilityToken() {
        return visibilityToken;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public MemberKind getMemberKind() {
        return MemberKind.FIELD;
    }
}
