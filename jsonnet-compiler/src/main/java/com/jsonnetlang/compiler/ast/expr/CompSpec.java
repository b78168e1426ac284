package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstNode;
import com.jsonnetlang.compiler.ast.Ident;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 推导式子句：for x in e 或 if e
 */
public abstract class CompSpec extends AstNode {

    protected CompSpec(Token token) {
        super(token);
    }

    /**
     * for x in e
     */
    public static final class ForSpec extends CompSpec {
        private final Ident variable;
        private final Token inToken;
        private final Expression source;

        public ForSpec(Token forToken, Ident variable, Token inToken, Expression source) {
            super(forToken);
            this.variable = variable;
            this.inToken = inToken;
            this.source = source;
        }

        public Ident getVariable() {
            return variable;
        }

        public Token getInToken() {
            return inToken;
        }

        public Expression getSource() {
            return source;
        }
    }

    /**
     * if e
     */
    public static final class IfSpec extends CompSpec {
        private final Expression condition;

        public IfSpec(Token ifToken, Expression condition) {
            super(ifToken);
            this.condition = condition;
        }

        public Expression getCondition() {
            return condition;
        }
    }
}
