package com.jsonnetlang.compiler.ast.decl;

import com.jsonnetlang.compiler.ast.AstNode;
import com.jsonnetlang.compiler.ast.Ident;
import com.jsonnetlang.compiler.ast.expr.Expression;
import com.jsonnetlang.compiler.ast.expr.Literal;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 字段名：标识符、字符串字面量或 [expr] 动态计算
 */
public class FieldName extends AstNode {
    private final NameKind kind;
    private final Ident ident;              // 仅 IDENTIFIER
    private final Literal string;           // 仅 STRING
    private final Expression expression;    // 仅 DYNAMIC
    private final Token closeToken;         // 仅 DYNAMIC

    private FieldName(Token token, NameKind kind, Ident ident, Literal string,
                      Expression expression, Token closeToken) {
        super(token);
        this.kind = kind;
        this.ident = ident;
        this.string = string;
        this.expression = expression;
        this.closeToken = closeToken;
    }

    public static FieldName identifier(Ident ident) {
        return new FieldName(ident.getToken(), NameKind.IDENTIFIER, ident, null, null, null);
    }

    public static FieldName string(Literal string) {
        return new FieldName(string.getToken(), NameKind.STRING, null, string, null, null);
    }

    public static FieldName dynamic(Token openToken, Expression expression, Token closeToken) {
        return new FieldName(openToken, NameKind.DYNAMIC, null, null, expression, closeToken);
    }

    public NameKind getKind() {
        return kind;
    }

    public Ident getIdent() {
        return ident;
    }

    public Literal getString() {
        return string;
    }

    public Expression getExpression() {
        return expression;
    }

    public Token getOpenToken() {
        return token;
    }

    public Token getCloseToken() {
        return closeToken;
    }

    public enum NameKind {
        IDENTIFIER,
        STRING,
        DYNAMIC
    }
}
