package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 切片表达式（如 arr[1:3], arr[::2]）
 */
public class SliceExpr extends Expression {
    private final Expression target;
    private final Expression start;   // 可选
    private final Expression end;     // 可选
    private final Expression step;    // 可选
    private final Token closeToken;

    public SliceExpr(Expression target, Token openToken,
                     Expression start, Expression end, Expression step, Token closeToken) {
        super(openToken);
        this.target = target;
        this.start = start;
        this.end = end;
        this.step = step;
        this.closeToken = closeToken;
    }

    public Expression getTarget() {
        return target;
    }

    public Token getOpenToken() {
        return token;
    }

    public Expression getStart() {
        return start;
    }

    public boolean hasStart() {
        return start != null;
    }

    public Expression getEnd() {
        return end;
    }

    public boolean hasEnd() {
        return end != null;
    }

    public Expression getStep() {
        return step;
    }

    public boolean hasStep() {
        return step != null;
    }

    public Token getCloseToken() {
        return closeToken;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSliceExpr(this, context);
    }
}
