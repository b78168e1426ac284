package com.jsonnetlang.compiler.lexer;

/**
 * Jsonnet 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    NUMBER,
    STRING_DOUBLE,          // "..."
    STRING_SINGLE,          // '...'
    STRING_BLOCK,           // |||...|||
    STRING_FRAGMENT,        // 字符串内容片段
    VERBATIM,               // @"..." 的 @

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 ===
    KW_ASSERT, KW_ELSE, KW_ERROR, KW_FALSE, KW_FOR,
    KW_FUNCTION, KW_IF, KW_IMPORT, KW_IMPORTSTR, KW_IN,
    KW_LOCAL, KW_NULL, KW_SELF, KW_SUPER, KW_TAILSTRICT,
    KW_THEN, KW_TRUE,

    // === 特殊标识符 ===
    DOLLAR,         // $

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %

    // === 操作符 - 位运算 ===
    SHL,            // <<
    SHR,            // >>
    AMP,            // &
    PIPE,           // |
    CARET,          // ^
    TILDE,          // ~

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 操作符 - 逻辑 ===
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // === 分隔符 ===
    LPAREN, RPAREN,
    LBRACKET, RBRACKET,
    LBRACE, RBRACE,
    COMMA,          // ,
    DOT,            // .
    SEMICOLON,      // ;
    COLON,          // :
    DOUBLE_COLON,   // ::
    TRIPLE_COLON,   // :::
    ASSIGN,         // =

    // === 特殊 ===
    EOF;

    /**
     * 是否为字符串字面量的定界符
     */
    public boolean isStringDelimiter() {
        switch (this) {
            case STRING_DOUBLE:
            case STRING_SINGLE:
            case STRING_BLOCK:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为对象字段可见性标记
     */
    public boolean isFieldSeparator() {
        switch (this) {
            case COLON:
            case DOUBLE_COLON:
            case TRIPLE_COLON:
                return true;
            default:
                return false;
        }
    }
}
