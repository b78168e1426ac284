package com.jsonnetlang.ir.core.expr;

import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.ir.core.CoreExpr;
import com.jsonnetlang.ir.core.CoreVisitor;

/**
 * self / super
 */
public class CoreSpecial extends CoreExpr {

    private final Kind kind;

    public CoreSpecial(Token token, Kind kind) {
        super(token);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(CoreVisitor<R, C> visitor, C context) {
        return visitor.visitSpecial(this, context);
    }

    public enum Kind {
        SELF("self"),
        SUPER("super");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }
}
