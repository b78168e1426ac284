package com.jsonnetlang.ir.core.decl;

import com.jsonnetlang.compiler.ast.Ident;
import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.ir.core.CoreExpr;

/**
 * 函数形参。默认值总是存在：源码中没有默认值的形参，
 * 其默认值是一个求值即报错的 error 表达式。
 */
public class CoreParam {

    private final Ident name;
    private final Token assignToken;
    private final CoreExpr defaultValue;

    public CoreParam(Ident name, Token assignToken, CoreExpr defaultValue) {
        if (defaultValue == null) {
            throw new IllegalArgumentException("parameter '" + name.getName() + "' has no default expression");
        }
        this.name = name;
        this.assignToken = assignToken;
        this.defaultValue = defaultValue;
    }

    public Ident getName() {
        return name;
    }

    public Token getAssignToken() {
        return assignToken;
    }

    public CoreExpr getDefaultValue() {
        return defaultValue;
    }
}
