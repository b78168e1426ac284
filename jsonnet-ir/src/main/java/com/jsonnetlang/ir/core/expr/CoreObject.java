package com.jsonnetlang.ir.core.expr;

import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.ir.core.CoreExpr;
import com.jsonnetlang.ir.core.CoreVisitor;
import com.jsonnetlang.ir.core.decl.CoreField;
import com.jsonnetlang.ir.core.decl.CoreObjectAssert;

import java.util.Collections;
import java.util.List;

/**
 * 对象字面量。只包含断言和字段，对象内的 local 已在脱糖时并入各成员。
 */
public class CoreObject extends CoreExpr {

    private final List<CoreObjectAssert> asserts;
    private final List<CoreField> fields;
    private final Token closeToken;

    public CoreObject(Token openToken, List<CoreObjectAssert> asserts, List<CoreField> fields,
                      Token closeToken) {
        super(openToken);
        this.asserts = Collections.unmodifiableList(asserts);
        this.fields = Collections.unmodifiableList(fields);
        this.closeToken = closeToken;
    }

    public Token getOpenToken() {
        return token;
    }

    public List<CoreObjectAssert> getAsserts() {
        return asserts;
    }

    public List<CoreField> getFields() {
        return fields;
    }

    public Token getCloseToken() {
        return closeToken;
    }

    @Override
    public <R, C> R accept(CoreVisitor<R, C> visitor, C context) {
        return visitor.visitObject(this, context);
    }
}
