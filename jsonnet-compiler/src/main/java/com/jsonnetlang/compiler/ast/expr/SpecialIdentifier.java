package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 特殊标识符：self、super、$
 */
public class SpecialIdentifier extends Expression {
    private final SpecialKind kind;

    public SpecialIdentifier(Token token, SpecialKind kind) {
        super(token);
        this.kind = kind;
    }

    public SpecialKind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSpecialIdentifier(this, context);
    }

    public enum SpecialKind {
        SELF("self"),
        SUPER("super"),
        DOLLAR("$");

        private final String source;

        SpecialKind(String source) {
            this.source = source;
        }

        /** 返回 Jsonnet 源码中对应的关键字 */
        public String toSourceString() {
            return source;
        }
    }
}
