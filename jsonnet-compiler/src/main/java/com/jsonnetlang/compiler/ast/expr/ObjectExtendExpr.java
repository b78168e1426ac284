package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;

/**
 * 对象扩展语法糖 e { ... }，等价于 e + { ... }
 */
public class ObjectExtendExpr extends Expression {
    private final Expression target;
    private final ObjectLiteralExpr object;

    public ObjectExtendExpr(Expression target, ObjectLiteralExpr object) {
        super(object.getToken());
        this.target = target;
        this.object = object;
    }

    public Expression getTarget() {
        return target;
    }

    public ObjectLiteralExpr getObject() {
        return object;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitObjectExtendExpr(this, context);
    }
}
