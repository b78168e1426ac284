package com.jsonnetlang.ir.core.expr;

import com.jsonnetlang.compiler.ast.Ident;
import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.ir.core.CoreExpr;
import com.jsonnetlang.ir.core.CoreVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 函数调用 callee(args)，实参可以是位置参数或命名参数。
 */
public class CoreCall extends CoreExpr {

    private final CoreExpr callee;
    private final List<Argument> args;
    private final Token closeToken;

    public CoreCall(CoreExpr callee, Token openToken, List<Argument> args, Token closeToken) {
        super(openToken);
        this.callee = callee;
        this.args = Collections.unmodifiableList(args);
        this.closeToken = closeToken;
    }

    public CoreExpr getCallee() {
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
    public <R, C> R accept(CoreVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }

    /**
     * 调用实参
     */
    public static final class Argument {
        private final Ident name;
        private final Token assignToken;
        private final CoreExpr value;

        private Argument(Ident name, Token assignToken, CoreExpr value) {
            this.name = name;
            this.assignToken = assignToken;
            this.value = value;
        }

        public static Argument positional(CoreExpr value) {
            return new Argument(null, null, value);
        }

        public static Argument named(Ident name, Token assignToken, CoreExpr value) {
            return new Argument(name, assignToken, value);
        }

        public boolean isNamed() {
            return name != null;
        }

        public Ident getName() {
            return name;
        }

        public Token getAssignToken() {
            return assignToken;
        }

        public CoreExpr getValue() {
            return value;
        }
    }
}
