package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(Expression left, Token operatorToken, BinaryOp operator, Expression right) {
        super(operatorToken);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Token getOperatorToken() {
        return token;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),

        // 移位
        SHL("<<"),
        SHR(">>"),

        // 比较
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        EQ("=="),
        NE("!="),

        // 包含
        IN("in"),

        // 逻辑
        AND("&&"),
        OR("||"),

        // 位运算
        BIT_AND("&"),
        BIT_OR("|"),
        BIT_XOR("^");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        /** 返回 Jsonnet 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }
    }
}
