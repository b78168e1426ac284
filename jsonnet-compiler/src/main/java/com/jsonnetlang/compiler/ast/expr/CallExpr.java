package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstNode;
import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.ast.Ident;
import com.jsonnetlang.compiler.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * 调用表达式
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Argument> args;
    private final Token closeToken;

    public CallExpr(Expression callee, Token openToken, List<Argument> args, Token closeToken) {
        super(openToken);
        this.callee = callee;
        this.args = Collections.unmodifiableList(args);
        this.closeToken = closeToken;
    }

    public Expression getCallee() {
        return callee;
    }

    public Token getOpenToken() {
        return token;
    }

    public List<Argument> getArgs() {
        return args;
    }

    public Token getCloseToken() {
        return closeToken;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }

    /**
     * 调用参数：位置参数 e 或命名参数 id = e
     */
    public static final class Argument extends AstNode {
        private final Ident name;           // 命名参数
        private final Token assignToken;    // 命名参数
        private final Expression value;

        private Argument(Token token, Ident name, Token assignToken, Expression value) {
            super(token);
            this.name = name;
            this.assignToken = assignToken;
            this.value = value;
        }

        public static Argument positional(Expression value) {
            return new Argument(value.getToken(), null, null, value);
        }

        public static Argument named(Ident name, Token assignToken, Expression value) {
            return new Argument(name.getToken(), name, assignToken, value);
        }

        public Ident getName() {
            return name;
        }

        public boolean isNamed() {
            return name != null;
        }

        public Token getAssignToken() {
            return assignToken;
        }

        public Expression getValue() {
            return value;
        }
    }
}
