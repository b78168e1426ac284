package com.jsonnetlang.compiler.lexer;

import com.jsonnetlang.compiler.ast.SourceLocation;

/**
 * 词法单元
 *
 * <p>由 Parser 产生的 token 携带真实源码位置；脱糖时注入的节点使用
 * {@link #synthetic(TokenType, String)} 创建的合成 token。</p>
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final SourceLocation location;

    public Token(TokenType type, String lexeme, SourceLocation location) {
        this.type = type;
        this.lexeme = lexeme;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public Token(TokenType type, String lexeme, String file, int line, int column, int offset) {
        this(type, lexeme, new SourceLocation(file, line, column, offset,
                lexeme != null ? lexeme.length() : 0));
    }

    /**
     * 创建无位置的合成 token
     */
    public static Token synthetic(TokenType type, String lexeme) {
        return new Token(type, lexeme, SourceLocation.SYNTHETIC);
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public int getLine() {
        return location.getLine();
    }

    public int getColumn() {
        return location.getColumn();
    }

    public int getOffset() {
        return location.getOffset();
    }

    public boolean isSynthetic() {
        return location.isSynthetic();
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        if (isSynthetic()) {
            return String.format("%s(%s) <synthetic>", type, lexeme);
        }
        return String.format("%s(%s) at %d:%d",
                type, lexeme, getLine(), getColumn());
    }
}
