package com.jsonnetlang.ir.core.expr;

import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.ir.core.CoreExpr;
import com.jsonnetlang.ir.core.CoreVisitor;

/**
 * 一元运算
 */
public class CoreUnary extends CoreExpr {

    private final Operator operator;
    private final CoreExpr operand;

    public CoreUnary(Token operatorToken, Operator operator, CoreExpr operand) {
        super(operatorToken);
        this.operator = operator;
        this.operand = operand;
    }

    public Operator getOperator() {
        return operator;
    }

    public CoreExpr getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(CoreVisitor<R, C> visitor, C context) {
        return visitor.visitUnary(this, context);
    }

    public enum Operator {
        PLUS("+"),
        MINUS("-"),
        NOT("!"),
        BIT_NOT("~");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }
}
