package com.jsonnetlang.ir.core.decl;

import com.jsonnetlang.compiler.ast.decl.Visibility;
import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.ir.core.CoreExpr;

/**
 * 对象字段 [name]: value。
 * <p>
 * 字段名统一为表达式；标识符和字符串字段名已转换为字符串字面量。
 */
public class CoreField {

    private final Token openToken;
    private final CoreExpr name;
    private final Token closeToken;
    private final Visibility visibility;
    private final Token visibilityToken;
    private final CoreExpr value;

    public CoreField(Token openToken, CoreExpr name, Token closeToken,
                     Visibility visibility, Token visibilityToken, CoreExpr value) {
        this.openToken = openToken;
        this.name = name;
        this.closeToken = closeToken;
        this.visibility = visibility;
        this.visibilityToken = visibilityToken;
        this.value = value;
    }

    public Token getOpenToken() {
        return openToken;
    }

    public CoreExpr getName() {
        return name;
    }

    public Token getCloseToken() {
        return closeToken;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public Token getVisibilityToken() {
        return visibilityToken;
    }

    public CoreExpr getValue() {
        return value;
    }
}
