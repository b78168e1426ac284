package com.jsonnetlang.ir.core.expr;

import com.jsonnetlang.compiler.ast.expr.Literal.LiteralKind;
import com.jsonnetlang.compiler.ast.expr.Literal.StringFragment;
import com.jsonnetlang.compiler.ast.expr.Literal.StringKind;
import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.ir.core.CoreExpr;
import com.jsonnetlang.ir.core.CoreVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 字面量：null / true / false / 数字 / 字符串。
 * 字符串保留 verbatim 标记、引号风格和逐段 token。
 */
public class CoreLiteral extends CoreExpr {

    private final LiteralKind kind;
    private final boolean booleanValue;
    private final String numberText;
    private final Token verbatimToken;
    private final StringKind stringKind;
    private final List<StringFragment> fragments;
    private final Token closeToken;

    private CoreLiteral(Token token, LiteralKind kind, boolean booleanValue, String numberText,
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

    public static CoreLiteral nullLiteral(Token token) {
        return new CoreLiteral(token, LiteralKind.NULL, false, null, null, null, null, null);
    }

    public static CoreLiteral booleanLiteral(Token token, boolean value) {
        return new CoreLiteral(token, LiteralKind.BOOLEAN, value, null, null, null, null, null);
    }

    public static CoreLiteral numberLiteral(Token token, String text) {
        return new CoreLiteral(token, LiteralKind.NUMBER, false, text, null, null, null, null);
    }

    public static CoreLiteral stringLiteral(Token verbatimToken, StringKind stringKind, Token openToken,
                                            List<StringFragment> fragments, Token closeToken) {
        return new CoreLiteral(openToken, LiteralKind.STRING, false, null, verbatimToken, stringKind,
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

    public String getStringValue() {
        if (fragments == null) return null;
        StringBuilder sb = new StringBuilder();
        for (StringFragment f : fragments) {
            sb.append(f.getText());
        }
        return sb.toString();
    }

    @Override
    public <R, C> R accept(CoreVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }
}
