package com.jsonnetlang.ir.core;

import com.jsonnetlang.compiler.ast.Ident;
import com.jsonnetlang.compiler.ast.decl.Visibility;
import com.jsonnetlang.compiler.ast.expr.Literal.StringFragment;
import com.jsonnetlang.compiler.ast.expr.Literal.StringKind;
import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.compiler.lexer.TokenType;
import com.jsonnetlang.ir.core.decl.CoreBind;
import com.jsonnetlang.ir.core.decl.CoreField;
import com.jsonnetlang.ir.core.decl.CoreObjectAssert;
import com.jsonnetlang.ir.core.decl.CoreParam;
import com.jsonnetlang.ir.core.expr.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CorePrinter 单元测试
 */
class CorePrinterTest {

    private final CorePrinter printer = new CorePrinter();

    private static Token tok(String lexeme) {
        return Token.synthetic(TokenType.IDENTIFIER, lexeme);
    }

    private static CoreIdentifier id(String name) {
        return new CoreIdentifier(new Ident(name, tok(name)));
    }

    private static CoreLiteral num(String text) {
        return CoreLiteral.numberLiteral(tok(text), text);
    }

    private static CoreLiteral str(StringKind kind, boolean verbatim, String value) {
        return CoreLiteral.stringLiteral(verbatim ? tok("@") : null, kind, tok(kind.getDelimiter()),
                Collections.singletonList(new StringFragment(value, tok(value))), tok(kind.getDelimiter()));
    }

    private static CoreBinary bin(CoreExpr left, CoreBinary.Operator op, CoreExpr right) {
        return new CoreBinary(left, tok(op.getSymbol()), op, right);
    }

    private static CoreLocal local(String name, CoreExpr value, CoreExpr body) {
        return new CoreLocal(tok("local"),
                Collections.singletonList(new CoreBind(new Ident(name, tok(name)), tok("="), value)),
                tok(";"), body);
    }

    @Nested
    @DisplayName("括号补齐")
    class PrecedenceTests {

        @Test
        @DisplayName("低优先级左操作数加括号")
        void testLowerPrecedenceLeft() {
            CoreExpr expr = bin(bin(id("a"), CoreBinary.Operator.ADD, id("b")), CoreBinary.Operator.MUL, id("c"));
            assertEquals("(a + b) * c", printer.print(expr));
        }

        @Test
        @DisplayName("高优先级操作数不加括号")
        void testHigherPrecedence() {
            CoreExpr expr = bin(id("a"), CoreBinary.Operator.ADD, bin(id("b"), CoreBinary.Operator.MUL, id("c")));
            assertEquals("a + b * c", printer.print(expr));
        }

        @Test
        @DisplayName("左结合：同级右操作数加括号")
        void testLeftAssociative() {
            CoreExpr left = bin(bin(id("a"), CoreBinary.Operator.SUB, id("b")), CoreBinary.Operator.SUB, id("c"));
            CoreExpr right = bin(id("a"), CoreBinary.Operator.SUB, bin(id("b"), CoreBinary.Operator.SUB, id("c")));
            assertEquals("a - b - c", printer.print(left));
            assertEquals("a - (b - c)", printer.print(right));
        }

        @Test
        @DisplayName("一元运算作用于二元表达式")
        void testUnaryOnBinary() {
            CoreExpr expr = new CoreUnary(tok("-"), CoreUnary.Operator.MINUS,
                    bin(id("a"), CoreBinary.Operator.ADD, id("b")));
            assertEquals("-(a + b)", printer.print(expr));
        }

        @Test
        @DisplayName("local 作为操作数时加括号")
        void testLocalOperand() {
            CoreExpr expr = bin(local("x", num("1"), id("x")), CoreBinary.Operator.ADD, num("1"));
            assertEquals("(local x = 1; x) + 1", printer.print(expr));
        }

        @Test
        @DisplayName("下标目标为二元表达式时加括号")
        void testIndexTarget() {
            CoreExpr target = bin(id("a"), CoreBinary.Operator.ADD, id("b"));
            CoreExpr expr = new CoreIndex(target, tok("["), str(StringKind.DOUBLE_QUOTE, false, "k"), tok("]"));
            assertEquals("(a + b)[\"k\"]", printer.print(expr));
        }

        @Test
        @DisplayName("逻辑与位运算优先级")
        void testLogicalAndBitwise() {
            CoreExpr expr = bin(bin(id("a"), CoreBinary.Operator.OR, id("b")), CoreBinary.Operator.AND,
                    bin(id("c"), CoreBinary.Operator.BIT_OR, id("d")));
            assertEquals("(a || b) && c | d", printer.print(expr));
        }
    }

    @Nested
    @DisplayName("节点渲染")
    class NodeTests {

        @Test
        @DisplayName("字符串引号风格")
        void testStrings() {
            assertEquals("\"a\\\"b\"", printer.print(str(StringKind.DOUBLE_QUOTE, false, "a\"b")));
            assertEquals("'x'", printer.print(str(StringKind.SINGLE_QUOTE, false, "x")));
            assertEquals("@\"a\"\"b\"", printer.print(str(StringKind.DOUBLE_QUOTE, true, "a\"b")));
        }

        @Test
        @DisplayName("空对象与空数组")
        void testEmpty() {
            assertEquals("{}", printer.print(new CoreObject(tok("{"), new ArrayList<>(), new ArrayList<>(), tok("}"))));
            assertEquals("[]", printer.print(new CoreArray(tok("["), new ArrayList<>(), tok("]"))));
        }

        @Test
        @DisplayName("对象断言在字段之前")
        void testObject() {
            CoreField field = new CoreField(tok("["), str(StringKind.DOUBLE_QUOTE, false, "a"), tok("]"),
                    Visibility.HIDDEN, tok("::"), num("1"));
            CoreObjectAssert check = new CoreObjectAssert(tok("assert"), new CoreSpecial(tok("self"), CoreSpecial.Kind.SELF));
            CoreObject object = new CoreObject(tok("{"), Collections.singletonList(check),
                    Collections.singletonList(field), tok("}"));
            assertEquals("{ assert self, [\"a\"]:: 1 }", printer.print(object));
        }

        @Test
        @DisplayName("函数、条件与错误")
        void testFunctionIfError() {
            CoreParam param = new CoreParam(new Ident("x", tok("x")), tok("="), num("0"));
            CoreExpr body = new CoreIf(tok("if"), id("x"), tok("then"), id("x"), tok("else"),
                    new CoreError(tok("error"), str(StringKind.DOUBLE_QUOTE, false, "no")));
            CoreFunction fn = new CoreFunction(tok("function"), tok("("), Collections.singletonList(param), tok(")"), body);
            assertEquals("function(x=0) if x then x else error \"no\"", printer.print(fn));
        }

        @Test
        @DisplayName("调用与命名参数")
        void testCall() {
            CoreCall call = new CoreCall(id("f"), tok("("), Arrays.asList(
                    CoreCall.Argument.positional(num("1")),
                    CoreCall.Argument.named(new Ident("k", tok("k")), tok("="), num("2"))), tok(")"));
            assertEquals("f(1, k=2)", printer.print(call));
        }
    }

    @Nested
    @DisplayName("构造约束")
    class ConstraintTests {

        @Test
        @DisplayName("local 至少一个绑定")
        void testEmptyLocalRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> new CoreLocal(tok("local"), new ArrayList<>(), tok(";"), num("1")));
        }

        @Test
        @DisplayName("形参必须有默认值")
        void testParamWithoutDefaultRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> new CoreParam(new Ident("x", tok("x")), tok("="), null));
        }

        @Test
        @DisplayName("列表不可修改")
        void testUnmodifiable() {
            CoreArray array = new CoreArray(tok("["), new ArrayList<>(Collections.singletonList(num("1"))), tok("]"));
            assertThrows(UnsupportedOperationException.class, () -> array.getElements().add(num("2")));
        }
    }
}
