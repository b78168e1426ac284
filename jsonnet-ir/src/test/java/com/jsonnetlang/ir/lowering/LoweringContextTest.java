package com.jsonnetlang.ir.lowering;

import com.jsonnetlang.compiler.ast.expr.Literal;
import com.jsonnetlang.compiler.ast.expr.MemberExpr;
import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.compiler.lexer.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LoweringContext 单元测试
 */
class LoweringContextTest {

    @Test
    @DisplayName("顶层上下文不在对象内")
    void testTop() {
        assertFalse(LoweringContext.TOP.isWithinObject());
    }

    @Test
    @DisplayName("enterObject 返回新值，不修改原上下文")
    void testEnterObject() {
        LoweringContext inner = LoweringContext.TOP.enterObject();

        assertTrue(inner.isWithinObject());
        assertFalse(LoweringContext.TOP.isWithinObject());
        assertTrue(inner.enterObject().isWithinObject());
    }

    @Test
    @DisplayName("合成字符串字面量：引号合成，片段使用给定 token")
    void testStringLiteral() {
        Token fragment = new Token(TokenType.EQ, "==", "<test>", 3, 7, 20);
        Literal literal = LoweringContext.stringLiteral("equals", fragment);

        assertEquals("equals", literal.getStringValue());
        assertTrue(literal.getOpenToken().isSynthetic());
        assertTrue(literal.getCloseToken().isSynthetic());
        assertSame(fragment, literal.getFragments().get(0).getToken());
    }

    @Test
    @DisplayName("std.name 的 std 为合成标识符")
    void testStdMember() {
        Token name = new Token(TokenType.MOD, "%", "<test>", 1, 3, 2);
        MemberExpr member = (MemberExpr) LoweringContext.stdMember(StdlibNames.MOD, name);

        assertEquals(StdlibNames.MOD, member.getMember().getName());
        assertSame(name, member.getMember().getToken());
        assertTrue(member.getTarget().getToken().isSynthetic());
        assertTrue(member.getDotToken().isSynthetic());
    }

    @Test
    @DisplayName("null 与 boolean 字面量为合成节点")
    void testConstants() {
        assertTrue(LoweringContext.nullLiteral().getToken().isSynthetic());
        assertTrue(LoweringContext.boolLiteral(true).getBooleanValue());
        assertFalse(LoweringContext.boolLiteral(false).getBooleanValue());
    }
}
