package com.jsonnetlang.ir.lowering;

import com.jsonnetlang.compiler.ast.Ident;
import com.jsonnetlang.compiler.ast.expr.Expression;
import com.jsonnetlang.compiler.ast.expr.Identifier;
import com.jsonnetlang.compiler.ast.expr.Literal;
import com.jsonnetlang.compiler.ast.expr.Literal.StringFragment;
import com.jsonnetlang.compiler.ast.expr.Literal.StringKind;
import com.jsonnetlang.compiler.ast.expr.MemberExpr;
import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.compiler.lexer.TokenType;

import java.util.Collections;

/**
 * AST → Core 降级上下文。
 * <p>
 * 只记录当前递归位置是否位于某个对象字面量内部。上下文不可变，
 * 进入对象体时通过 {@link #enterObject()} 得到新值。
 * 同时提供脱糖时构造合成节点的辅助方法。
 */
public final class LoweringContext {

    /** 顶层上下文 */
    public static final LoweringContext TOP = new LoweringContext(false);

    private static final LoweringContext IN_OBJECT = new LoweringContext(true);

    private final boolean withinObject;

    private LoweringContext(boolean withinObject) {
        this.withinObject = withinObject;
    }

    public boolean isWithinObject() {
        return withinObject;
    }

    /**
     * 进入对象体后的上下文
     */
    public LoweringContext enterObject() {
        return IN_OBJECT;
    }

    @Override
    public String toString() {
        return withinObject ? "LoweringContext[withinObject]" : "LoweringContext[top]";
    }

    // ========== 合成节点 ==========

    /**
     * 合成 token
     */
    public static Token synthetic(TokenType type, String lexeme) {
        return Token.synthetic(type, lexeme);
    }

    /**
     * 创建 null 字面量。
     */
    public static Literal nullLiteral() {
        return Literal.nullLiteral(synthetic(TokenType.KW_NULL, "null"));
    }

    /**
     * 创建 boolean 字面量。
     */
    public static Literal boolLiteral(boolean value) {
        return Literal.booleanLiteral(value
                ? synthetic(TokenType.KW_TRUE, "true")
                : synthetic(TokenType.KW_FALSE, "false"), value);
    }

    /**
     * 创建双引号字符串字面量，内容片段使用 fragmentToken，引号为合成 token。
     */
    public static Literal stringLiteral(String value, Token fragmentToken) {
        return Literal.stringLiteral(null, StringKind.DOUBLE_QUOTE,
                synthetic(TokenType.STRING_DOUBLE, "\""),
                Collections.singletonList(new StringFragment(value, fragmentToken)),
                synthetic(TokenType.STRING_DOUBLE, "\""));
    }

    /**
     * 创建 std.name，name 的 token 为 nameToken
     */
    public static Expression stdMember(String name, Token nameToken) {
        Identifier std = new Identifier(new Ident(StdlibNames.STD, synthetic(TokenType.IDENTIFIER, StdlibNames.STD)));
        return new MemberExpr(std, synthetic(TokenType.DOT, "."), new Ident(name, nameToken));
    }
}
