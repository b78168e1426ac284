package com.jsonnetlang.compiler.ast.decl;

import com.jsonnetlang.compiler.ast.AstNode;
import com.jsonnetlang.compiler.ast.expr.Expression;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 断言 assert cond [: message]
 *
 * <p>同时用于断言表达式和对象体内的断言成员。</p>
 */
public class Assertion extends AstNode {
    private final Expression condition;
    private final Token colonToken;     // 可选
    private final Expression message;   // 可选

    public Assertion(Token assertToken, Expression condition, Token colonToken, Expression message) {
        super(assertToken);
        this.condition = condition;
        this.colonToken = colonToken;
        this.message = message;
    }

    public Assertion(Token assertToken, Expression condition) {
        this(assertToken, condition, null, null);
    }

    public Token getAssertToken() {
        return token;
    }

    public Expression getCondition() {
        return condition;
    }

    public Token getColonToken() {
        return colonToken;
    }

    public Expression getMessage() {
        return message;
    }

    public boolean hasMessage() {
        return message != null;
    }
}
