package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * 字面量表达式
 *
 * <p>字符串字面量保留 verbatim 标记（@）、引号风格、左右定界 token 以及逐段内容，
 * 每段内容带有自己的 token。</p>
 */
public class Literal extends Expression {
    private final LiteralKind kind;
    private final boolean booleanValue;
    private final String numberText;
    // 仅 STRING
    private final Token verbatimToken;
    private final StringKind stringKind;
    private final List<StringFragment> fragments;
    private final Token closeToken;

    private Literal(Token token, LiteralKind kind, boolean booleanValue, String numberText,
                    Token verbatimToken, StringKind stringKind,
                    List<StringFragment> fragments, Token closeToken) {
        super(token);
        this.kind = kind;
        this.booleanValue = booleanValue;
        this.numberText = numberText;
        this.verbatimToken = verbatimToken;
        this.stringKind = stringKind;
        this.fragments = fragments;
        this.closeToken = closeToken;
    }

    public static Literal nullLiteral(Token token) {
        return new Literal(token, LiteralKind.NULL, false, null, null, null, null, null);
    }

    public static Literal booleanLiteral(Token token, boolean value) {
        return new Literal(token, LiteralKind.BOOLEAN, value, null, null, null, null, null);
    }

    public static Literal numberLiteral(Token token, String text) {
        return new Literal(token, LiteralKind.NUMBER, false, text, null, null, null, null);
    }

    /**
     * @param verbatimToken @ 标记，非 verbatim 字符串为 null
     * @param openToken     左定界符
     * @param closeToken    右定界符
     */
    public static Literal stringLiteral(Token verbatimToken, StringKind stringKind, Token openToken,
                                        List<StringFragment> fragments, Token closeToken) {
        return new Literal(openToken, LiteralKind.STRING, false, null, verbatimToken, stringKind,
                Collections.unmodifiableList(fragments), closeToken);
    }

    public LiteralKind getKind() {
        return kind;
    }

    public boolean getBooleanValue() {
        return booleanValue;
    }

    public String getNumberText() {
        return numberText;
    }

    public Token getVerbatimToken() {
        return verbatimToken;
    }

    public boolean isVerbatim() {
        return verbatimToken != null;
    }

    public StringKind getStringKind() {
        return stringKind;
    }

    public Token getOpenToken() {
        return token;
    }

    public List<StringFragment> getFragments() {
        return fragments;
    }

    public Token getCloseToken() {
        return closeToken;
    }

    /**
     * 拼接所有内容片段得到的字符串值
     */
    public String getStringValue() {
        if (fragments == null) return null;
        StringBuilder sb = new StringBuilder();
        for (StringFragment f : fragments) {
            sb.append(f.getText());
        }
        return sb.toString();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        NULL,
        BOOLEAN,
        NUMBER,
        STRING
    }

    /**
     * 字符串引号风格
     */
    public enum StringKind {
        SINGLE_QUOTE("'"),
        DOUBLE_QUOTE("\""),
        TRIPLE_BAR("|||");

        private final String delimiter;

        StringKind(String delimiter) {
            this.delimiter = delimiter;
        }

        public String getDelimiter() {
            return delimiter;
        }
    }

    /**
     * 字符串内容片段
     */
    public static final class StringFragment {
        private final String text;
        private final Token token;

        public StringFragment(String text, Token token) {
            this.text = text;
            this.token = token;
        }

        public String getText() {
            return text;
        }

        public Token getToken() {
            return token;
        }
    }
}
