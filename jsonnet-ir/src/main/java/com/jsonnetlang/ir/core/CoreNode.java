package com.jsonnetlang.ir.core;

import com.jsonnetlang.compiler.ast.SourceLocation;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * Core 树节点接口。
 * Core 是表面语法树脱糖后的最小语法，只保留求值语义所需的结构。
 */
public interface CoreNode {

    Token getToken();

    SourceLocation getLocation();

    <R, C> R accept(CoreVisitor<R, C> visitor, C context);
}
