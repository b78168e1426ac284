package com.jsonnetlang.ir.core;

import com.jsonnetlang.compiler.formatter.FormatConfig;
import com.jsonnetlang.compiler.formatter.FormatterContext;
import com.jsonnetlang.compiler.formatter.JsonnetStrings;
import com.jsonnetlang.ir.core.decl.*;
import com.jsonnetlang.ir.core.expr.*;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * 将 Core 树渲染为单行 Jsonnet 文本。
 * <p>
 * Core 树不保留括号，打印时按运算符优先级补齐。字段名总是以 [expr] 形式输出。
 * 用于调试日志，以及测试中比较两棵 Core 树的结构。
 */
public class CorePrinter implements CoreVisitor<Void, FormatterContext> {

    private static final int PREC_ATOM = 100;
    private static final int PREC_UNARY = 90;
    private static final int PREC_OPEN = 0;

    /**
     * 渲染 Core 表达式
     */
    public String print(CoreExpr expr) {
        FormatterContext ctx = new FormatterContext(FormatConfig.singleLine());
        expr.accept(this, ctx);
        return ctx.getOutput();
    }

    // ============ 原子 ============

    @Override
    public Void visitLiteral(CoreLiteral node, FormatterContext ctx) {
        switch (node.getKind()) {
            case NULL:
                ctx.append("null");
                break;
            case BOOLEAN:
                ctx.append(node.getBooleanValue() ? "true" : "false");
                break;
            case NUMBER:
                ctx.append(node.getNumberText());
                break;
            case STRING:
                ctx.append(JsonnetStrings.quote(node.getStringKind(), node.isVerbatim(), node.getStringValue()));
                break;
        }
        return null;
    }

    @Override
    public Void visitIdentifier(CoreIdentifier node, FormatterContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitSpecial(CoreSpecial node, FormatterContext ctx) {
        ctx.append(node.getKind().getKeyword());
        return null;
    }

    // ============ 绑定与访问 ============

    @Override
    public Void visitLocal(CoreLocal node, FormatterContext ctx) {
        ctx.append("local ");
        printJoined(node.getBinds(), ctx, (bind, c) -> {
            c.append(bind.getName().getName());
            c.append(" = ");
            printOperand(bind.getValue(), PREC_OPEN, c);
        });
        ctx.append("; ");
        printOperand(node.getBody(), PREC_OPEN, ctx);
        return null;
    }

    @Override
    public Void visitIndex(CoreIndex node, FormatterContext ctx) {
        printOperand(node.getTarget(), PREC_ATOM, ctx);
        ctx.append("[");
        printOperand(node.getIndex(), PREC_OPEN, ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitCall(CoreCall node, FormatterContext ctx) {
        printOperand(node.getCallee(), PREC_ATOM, ctx);
        ctx.append("(");
        printJoined(node.getArgs(), ctx, (arg, c) -> {
            if (arg.isNamed()) {
                c.append(arg.getName().getName());
                c.append("=");
            }
            printOperand(arg.getValue(), PREC_OPEN, c);
        });
        ctx.append(")");
        return null;
    }

    // ============ 运算 ============

    @Override
    public Void visitUnary(CoreUnary node, FormatterContext ctx) {
        ctx.append(node.getOperator().getSymbol());
        printOperand(node.getOperand(), PREC_UNARY, ctx);
        return null;
    }

    @Override
    public Void visitBinary(CoreBinary node, FormatterContext ctx) {
        int prec = node.getOperator().getPrecedence();
        // 左结合：右操作数需要更高优先级
        printOperand(node.getLeft(), prec, ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().getSymbol());
        ctx.append(" ");
        printOperand(node.getRight(), prec + 1, ctx);
        return null;
    }

    // ============ 控制与函数 ============

    @Override
    public Void visitIf(CoreIf node, FormatterContext ctx) {
        ctx.append("if ");
        printOperand(node.getCondition(), PREC_OPEN, ctx);
        ctx.append(" then ");
        printOperand(node.getThenExpr(), PREC_OPEN, ctx);
        ctx.append(" else ");
        printOperand(node.getElseExpr(), PREC_OPEN, ctx);
        return null;
    }

    @Override
    public Void visitFunction(CoreFunction node, FormatterContext ctx) {
        ctx.append("function(");
        printJoined(node.getParams(), ctx, (param, c) -> {
            c.append(param.getName().getName());
            c.append("=");
            printOperand(param.getDefaultValue(), PREC_OPEN, c);
        });
        ctx.append(") ");
        printOperand(node.getBody(), PREC_OPEN, ctx);
        return null;
    }

    @Override
    public Void visitError(CoreError node, FormatterContext ctx) {
        ctx.append("error ");
        printOperand(node.getPayload(), PREC_OPEN, ctx);
        return null;
    }

    // ============ 复合值 ============

    @Override
    public Void visitObject(CoreObject node, FormatterContext ctx) {
        if (node.getAsserts().isEmpty() && node.getFields().isEmpty()) {
            ctx.append("{}");
            return null;
        }
        ctx.append("{ ");
        printJoined(node.getAsserts(), ctx, (a, c) -> {
            c.append("assert ");
            printOperand(a.getExpr(), PREC_OPEN, c);
        });
        if (!node.getAsserts().isEmpty() && !node.getFields().isEmpty()) {
            ctx.append(", ");
        }
        printJoined(node.getFields(), ctx, this::printField);
        ctx.append(" }");
        return null;
    }

    @Override
    public Void visitArray(CoreArray node, FormatterContext ctx) {
        ctx.append("[");
        printJoined(node.getElements(), ctx, (e, c) -> printOperand(e, PREC_OPEN, c));
        ctx.append("]");
        return null;
    }

    // ============ 辅助方法 ============

    private void printField(CoreField field, FormatterContext ctx) {
        ctx.append("[");
        printOperand(field.getName(), PREC_OPEN, ctx);
        ctx.append("]");
        ctx.append(field.getVisibility().toSourceString());
        ctx.append(" ");
        printOperand(field.getValue(), PREC_OPEN, ctx);
    }

    /**
     * 输出子表达式，优先级低于 minPrecedence 时加括号
     */
    private void printOperand(CoreExpr expr, int minPrecedence, FormatterContext ctx) {
        if (precedenceOf(expr) < minPrecedence) {
            ctx.append("(");
            expr.accept(this, ctx);
            ctx.append(")");
        } else {
            expr.accept(this, ctx);
        }
    }

    private static int precedenceOf(CoreExpr expr) {
        if (expr instanceof CoreBinary) {
            return ((CoreBinary) expr).getOperator().getPrecedence();
        }
        if (expr instanceof CoreUnary) {
            return PREC_UNARY;
        }
        // local / if / function / error 向右延伸到表达式末尾
        if (expr instanceof CoreLocal || expr instanceof CoreIf
                || expr instanceof CoreFunction || expr instanceof CoreError) {
            return PREC_OPEN;
        }
        return PREC_ATOM;
    }

    private <T> void printJoined(List<T> items, FormatterContext ctx, BiConsumer<T, FormatterContext> printer) {
        for (int i = 0; i < items.size(); i++) {
            printer.accept(items.get(i), ctx);
            if (i < items.size() - 1) {
                ctx.append(", ");
            }
        }
    }
}
