package com.jsonnetlang.compiler.lexer;

import com.jsonnetlang.compiler.ast.SourceLocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Token 与合成位置测试
 */
class TokenTest {

    @Test
    @DisplayName("源码 token 携带位置")
    void testSourceToken() {
        Token token = new Token(TokenType.IDENTIFIER, "foo", "a.jsonnet", 3, 5, 40);

        assertFalse(token.isSynthetic());
        assertEquals(3, token.getLine());
        assertEquals(5, token.getColumn());
        assertEquals("a.jsonnet:3:5", token.getLocation().toString());
        assertEquals("IDENTIFIER(foo) at 3:5", token.toString());
    }

    @Test
    @DisplayName("合成 token 不对应源码位置")
    void testSyntheticToken() {
        Token token = Token.synthetic(TokenType.IDENTIFIER, "std");

        assertTrue(token.isSynthetic());
        assertSame(SourceLocation.SYNTHETIC, token.getLocation());
        assertEquals("<synthetic>", token.getLocation().toString());
        assertEquals("IDENTIFIER(std) <synthetic>", token.toString());
    }

    @Test
    @DisplayName("类型判断")
    void testIs() {
        Token token = new Token(TokenType.DOT, ".", "a.jsonnet", 1, 1, 0);

        assertTrue(token.is(TokenType.DOT));
        assertTrue(token.isOneOf(TokenType.COMMA, TokenType.DOT));
        assertFalse(token.isOneOf(TokenType.COMMA, TokenType.SEMICOLON));
    }
}
