package com.jsonnetlang.ir.core.expr;

import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.ir.core.CoreExpr;
import com.jsonnetlang.ir.core.CoreVisitor;

/**
 * 二元运算。
 * <p>
 * Core 运算符集合不含 ==、!=、%、in，它们在脱糖时已改写为标准库调用。
 */
public class CoreBinary extends CoreExpr {

    private final CoreExpr left;
    private final Operator operator;
    private final CoreExpr right;

    public CoreBinary(CoreExpr left, Token operatorToken, Operator operator, CoreExpr right) {
        super(operatorToken);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public CoreExpr getLeft() {
        return left;
    }

    public Operator getOperator() {
        return operator;
    }

    public CoreExpr getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(CoreVisitor<R, C> visitor, C context) {
        return visitor.visitBinary(this, context);
    }

    /**
     * Core 二元运算符，precedence 越大结合越紧
     */
    public enum Operator {
        MUL("*", 80),
        DIV("/", 80),
        ADD("+", 70),
        SUB("-", 70),
        SHL("<<", 60),
        SHR(">>", 60),
        LT("<", 50),
        LE("<=", 50),
        GT(">", 50),
        GE(">=", 50),
        BIT_AND("&", 40),
        BIT_XOR("^", 35),
        BIT_OR("|", 30),
        AND("&&", 20),
        OR("||", 10);

        private final String symbol;
        private final int precedence;

        Operator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String getSymbol() {
            return symbol;
        }

        public int getPrecedence() {
            return precedence;
        }
    }
}
