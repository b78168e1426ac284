package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 一元表达式
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;

    public UnaryExpr(Token operatorToken, UnaryOp operator, Expression operand) {
        super(operatorToken);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Token getOperatorToken() {
        return token;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        PLUS("+"),
        MINUS("-"),
        NOT("!"),
        BIT_NOT("~");

        private final String source;

        UnaryOp(String source) {
            this.source = source;
        }

        /** 返回 Jsonnet 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }
    }
}
