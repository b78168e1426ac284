package com.jsonnetlang.ir.lowering;

import com.jsonnetlang.compiler.ast.Ident;
import com.jsonnetlang.compiler.ast.decl.*;
import com.jsonnetlang.compiler.ast.expr.*;
import com.jsonnetlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.jsonnetlang.compiler.ast.expr.CallExpr.Argument;
import com.jsonnetlang.compiler.ast.expr.Literal.StringFragment;
import com.jsonnetlang.compiler.ast.expr.Literal.StringKind;
import com.jsonnetlang.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 测试用表面语法树构造器，代替 Parser。
 * 每个 token 分配递增的列号，便于区分不同 token 实例。
 */
class SurfaceTrees {

    private int column = 1;

    Token tok(TokenType type, String lexeme) {
        Token t = new Token(type, lexeme, "<test>", 1, column, column - 1);
        column += lexeme.length() + 1;
        return t;
    }

    // ============ 原子 ============

    Ident ident(String name) {
        return new Ident(tok(TokenType.IDENTIFIER, name));
    }

    Identifier id(String name) {
        return new Identifier(ident(name));
    }

    Literal num(String text) {
        return Literal.numberLiteral(tok(TokenType.NUMBER, text), text);
    }

    Literal str(String value) {
        Token open = tok(TokenType.STRING_DOUBLE, "\"");
        Token content = tok(TokenType.STRING_FRAGMENT, value);
        Token close = tok(TokenType.STRING_DOUBLE, "\"");
        return Literal.stringLiteral(null, StringKind.DOUBLE_QUOTE, open,
                Collections.singletonList(new StringFragment(value, content)), close);
    }

    Literal nul() {
        return Literal.nullLiteral(tok(TokenType.KW_NULL, "null"));
    }

    Literal bool(boolean value) {
        return Literal.booleanLiteral(value ? tok(TokenType.KW_TRUE, "true") : tok(TokenType.KW_FALSE, "false"), value);
    }

    SpecialIdentifier self() {
        return new SpecialIdentifier(tok(TokenType.KW_SELF, "self"), SpecialIdentifier.SpecialKind.SELF);
    }

    SpecialIdentifier sup() {
        return new SpecialIdentifier(tok(TokenType.KW_SUPER, "super"), SpecialIdentifier.SpecialKind.SUPER);
    }

    SpecialIdentifier dollar() {
        return new SpecialIdentifier(tok(TokenType.DOLLAR, "$"), SpecialIdentifier.SpecialKind.DOLLAR);
    }

    // ============ 绑定与访问 ============

    Bind bind(String name, Expression value) {
        return new Bind(ident(name), tok(TokenType.ASSIGN, "="), value);
    }

    LocalExpr local(List<Bind> binds, Expression body) {
        return new LocalExpr(tok(TokenType.KW_LOCAL, "local"), binds, tok(TokenType.SEMICOLON, ";"), body);
    }

    LocalExpr local(String name, Expression value, Expression body) {
        return local(Collections.singletonList(bind(name, value)), body);
    }

    MemberExpr member(Expression target, String name) {
        return new MemberExpr(target, tok(TokenType.DOT, "."), ident(name));
    }

    IndexExpr index(Expression target, Expression index) {
        return new IndexExpr(target, tok(TokenType.LBRACKET, "["), index, tok(TokenType.RBRACKET, "]"));
    }

    SliceExpr slice(Expression target, Expression start, Expression end, Expression step) {
        return new SliceExpr(target, tok(TokenType.LBRACKET, "["), start, end, step, tok(TokenType.RBRACKET, "]"));
    }

    CallExpr call(Expression callee, Argument... args) {
        return new CallExpr(callee, tok(TokenType.LPAREN, "("), Arrays.asList(args), tok(TokenType.RPAREN, ")"));
    }

    Argument arg(Expression value) {
        return Argument.positional(value);
    }

    Argument named(String name, Expression value) {
        return Argument.named(ident(name), tok(TokenType.ASSIGN, "="), value);
    }

    // ============ 运算 ============

    UnaryExpr unary(UnaryOp op, Expression operand) {
        return new UnaryExpr(tok(TokenType.NOT, op.toSourceString()), op, operand);
    }

    BinaryExpr binary(Expression left, BinaryOp op, Expression right) {
        return new BinaryExpr(left, tok(TokenType.PLUS, op.toSourceString()), op, right);
    }

    ObjectExtendExpr extend(Expression target, ObjectLiteralExpr object) {
        return new ObjectExtendExpr(target, object);
    }

    // ============ 控制与函数 ============

    IfExpr ifThen(Expression cond, Expression then) {
        return new IfExpr(tok(TokenType.KW_IF, "if"), cond, tok(TokenType.KW_THEN, "then"), then, null, null);
    }

    IfExpr ifThenElse(Expression cond, Expression then, Expression otherwise) {
        return new IfExpr(tok(TokenType.KW_IF, "if"), cond, tok(TokenType.KW_THEN, "then"), then,
                tok(TokenType.KW_ELSE, "else"), otherwise);
    }

    Parameter param(String name) {
        return new Parameter(ident(name));
    }

    Parameter param(String name, Expression defaultValue) {
        return new Parameter(ident(name), tok(TokenType.ASSIGN, "="), defaultValue);
    }

    LambdaExpr lambda(List<Parameter> params, Expression body) {
        return new LambdaExpr(tok(TokenType.KW_FUNCTION, "function"), tok(TokenType.LPAREN, "("), params,
                tok(TokenType.RPAREN, ")"), body);
    }

    ImportExpr importExpr(String path) {
        return new ImportExpr(tok(TokenType.KW_IMPORT, "import"), ImportExpr.ImportKind.IMPORT, str(path));
    }

    Assertion assertion(Expression cond) {
        return new Assertion(tok(TokenType.KW_ASSERT, "assert"), cond);
    }

    Assertion assertion(Expression cond, Expression message) {
        return new Assertion(tok(TokenType.KW_ASSERT, "assert"), cond, tok(TokenType.COLON, ":"), message);
    }

    AssertExpr assertExpr(Assertion assertion, Expression rest) {
        return new AssertExpr(assertion, tok(TokenType.SEMICOLON, ";"), rest);
    }

    ErrorExpr error(Expression payload) {
        return new ErrorExpr(tok(TokenType.KW_ERROR, "error"), payload);
    }

    ParenExpr paren(Expression inner) {
        return new ParenExpr(tok(TokenType.LPAREN, "("), inner, tok(TokenType.RPAREN, ")"));
    }

    // ============ 对象与数组 ============

    ObjectLiteralExpr object(ObjectMember... members) {
        return new ObjectLiteralExpr(tok(TokenType.LBRACE, "{"), Arrays.asList(members), tok(TokenType.RBRACE, "}"));
    }

    ObjectField field(String name, Expression value) {
        return new ObjectField(FieldName.identifier(ident(name)), null, Visibility.VISIBLE,
                tok(TokenType.COLON, ":"), value);
    }

    ObjectField hidden(String name, Expression value) {
        return new ObjectField(FieldName.identifier(ident(name)), null, Visibility.HIDDEN,
                tok(TokenType.DOUBLE_COLON, "::"), value);
    }

    ObjectField plusField(String name, Expression value) {
        return new ObjectField(FieldName.identifier(ident(name)), tok(TokenType.PLUS, "+"), Visibility.VISIBLE,
                tok(TokenType.COLON, ":"), value);
    }

    ObjectField stringField(String name, Expression value) {
        return new ObjectField(FieldName.string(str(name)), null, Visibility.FORCED_VISIBLE,
                tok(TokenType.TRIPLE_COLON, ":::"), value);
    }

    ObjectField dynamicField(Expression name, Expression value) {
        FieldName fieldName = FieldName.dynamic(tok(TokenType.LBRACKET, "["), name, tok(TokenType.RBRACKET, "]"));
        return new ObjectField(fieldName, null, Visibility.VISIBLE, tok(TokenType.COLON, ":"), value);
    }

    ObjectLocal objectLocal(String name, Expression value) {
        return new ObjectLocal(tok(TokenType.KW_LOCAL, "local"), bind(name, value));
    }

    ObjectAssert objectAssert(Assertion assertion) {
        return new ObjectAssert(assertion);
    }

    ArrayLiteralExpr array(Expression... elements) {
        return new ArrayLiteralExpr(tok(TokenType.LBRACKET, "["), new ArrayList<>(Arrays.asList(elements)),
                tok(TokenType.RBRACKET, "]"));
    }

    CompSpec.ForSpec forSpec(String var, Expression source) {
        return new CompSpec.ForSpec(tok(TokenType.KW_FOR, "for"), ident(var), tok(TokenType.KW_IN, "in"), source);
    }

    ArrayComprehensionExpr arrayComp(Expression element, CompSpec.ForSpec first) {
        return new ArrayComprehensionExpr(tok(TokenType.LBRACKET, "["), element, first,
                Collections.<CompSpec>emptyList(), tok(TokenType.RBRACKET, "]"));
    }

    ObjectComprehensionExpr objectComp(ObjectMember member, CompSpec.ForSpec first) {
        return new ObjectComprehensionExpr(tok(TokenType.LBRACE, "{"), Collections.singletonList(member), first,
                Collections.<CompSpec>emptyList(), tok(TokenType.RBRACE, "}"));
    }
}
