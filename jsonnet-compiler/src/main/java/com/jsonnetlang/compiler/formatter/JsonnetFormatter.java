package com.jsonnetlang.compiler.formatter;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.ast.decl.*;
import com.jsonnetlang.compiler.ast.expr.*;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Jsonnet 表面语法树格式化器
 *
 * <p>遍历 AST，按统一格式规则输出源码。括号只来自源码中的 {@link ParenExpr}，
 * 格式化器本身不插入括号。对象和数组在能放进一行时单行输出，否则逐成员换行。</p>
 */
public class JsonnetFormatter implements AstVisitor<Void, FormatterContext> {

    /**
     * 格式化表达式
     */
    public String format(Expression expr, FormatConfig config) {
        FormatterContext ctx = new FormatterContext(config);
        expr.accept(this, ctx);
        return ctx.getOutput();
    }

    /**
     * 使用默认配置格式化
     */
    public String format(Expression expr) {
        return format(expr, new FormatConfig());
    }

    /**
     * 单行渲染，用于诊断信息
     */
    public String formatSingleLine(Expression expr) {
        return format(expr, FormatConfig.singleLine());
    }

    // ============ 原子 ============

    @Override
    public Void visitIdentifier(Identifier node, FormatterContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitSpecialIdentifier(SpecialIdentifier node, FormatterContext ctx) {
        ctx.append(node.getKind().toSourceString());
        return null;
    }

    @Override
    public Void visitLiteral(Literal node, FormatterContext ctx) {
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

    // ============ 绑定与访问 ============

    @Override
    public Void visitLocalExpr(LocalExpr node, FormatterContext ctx) {
        ctx.append("local ");
        formatJoined(node.getBinds(), ctx, ", ", this::formatBind);
        ctx.append("; ");
        formatExpression(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitMemberExpr(MemberExpr node, FormatterContext ctx) {
        formatExpression(node.getTarget(), ctx);
        ctx.append(".");
        ctx.append(node.getMember().getName());
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, FormatterContext ctx) {
        formatExpression(node.getTarget(), ctx);
        ctx.append("[");
        formatExpression(node.getIndex(), ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitSliceExpr(SliceExpr node, FormatterContext ctx) {
        formatExpression(node.getTarget(), ctx);
        ctx.append("[");
        formatExpression(node.getStart(), ctx);
        ctx.append(":");
        formatExpression(node.getEnd(), ctx);
        if (node.hasStep()) {
            ctx.append(":");
            formatExpression(node.getStep(), ctx);
        }
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, FormatterContext ctx) {
        formatExpression(node.getCallee(), ctx);
        ctx.append("(");
        formatJoined(node.getArgs(), ctx, ", ", (arg, c) -> {
            if (arg.isNamed()) {
                c.append(arg.getName().getName());
                c.append("=");
            }
            formatExpression(arg.getValue(), c);
        });
        ctx.append(")");
        return null;
    }

    // ============ 运算 ============

    @Override
    public Void visitUnaryExpr(UnaryExpr node, FormatterContext ctx) {
        ctx.append(node.getOperator().toSourceString());
        formatExpression(node.getOperand(), ctx);
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, FormatterContext ctx) {
        formatExpression(node.getLeft(), ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        ctx.append(" ");
        formatExpression(node.getRight(), ctx);
        return null;
    }

    @Override
    public Void visitObjectExtendExpr(ObjectExtendExpr node, FormatterContext ctx) {
        formatExpression(node.getTarget(), ctx);
        ctx.append(" ");
        formatExpression(node.getObject(), ctx);
        return null;
    }

    // ============ 控制与函数 ============

    @Override
    public Void visitIfExpr(IfExpr node, FormatterContext ctx) {
        ctx.append("if ");
        formatExpression(node.getCondition(), ctx);
        ctx.append(" then ");
        formatExpression(node.getThenExpr(), ctx);
        if (node.hasElse()) {
            ctx.append(" else ");
            formatExpression(node.getElseExpr(), ctx);
        }
        return null;
    }

    @Override
    public Void visitLambdaExpr(LambdaExpr node, FormatterContext ctx) {
        ctx.append("function(");
        formatJoined(node.getParams(), ctx, ", ", (p, c) -> {
            c.append(p.getName().getName());
            if (p.hasDefaultValue()) {
                c.append("=");
                formatExpression(p.getDefaultValue(), c);
            }
        });
        ctx.append(") ");
        formatExpression(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitImportExpr(ImportExpr node, FormatterContext ctx) {
        ctx.append(node.getKind().getKeyword());
        ctx.append(" ");
        formatExpression(node.getPath(), ctx);
        return null;
    }

    @Override
    public Void visitAssertExpr(AssertExpr node, FormatterContext ctx) {
        formatAssertion(node.getAssertion(), ctx);
        ctx.append("; ");
        formatExpression(node.getRest(), ctx);
        return null;
    }

    @Override
    public Void visitErrorExpr(ErrorExpr node, FormatterContext ctx) {
        ctx.append("error ");
        formatExpression(node.getPayload(), ctx);
        return null;
    }

    @Override
    public Void visitParenExpr(ParenExpr node, FormatterContext ctx) {
        ctx.append("(");
        formatExpression(node.getInner(), ctx);
        ctx.append(")");
        return null;
    }

    // ============ 对象与数组 ============

    @Override
    public Void visitObjectLiteralExpr(ObjectLiteralExpr node, FormatterContext ctx) {
        formatBracketed("{", "}", node.getMembers(), ctx, this::formatMember, null);
        return null;
    }

    @Override
    public Void visitObjectComprehensionExpr(ObjectComprehensionExpr node, FormatterContext ctx) {
        formatBracketed("{", "}", node.getMembers(), ctx, this::formatMember, c -> {
            c.append(" ");
            formatCompSpecs(node.getFirstFor(), node.getSpecs(), c);
        });
        return null;
    }

    @Override
    public Void visitArrayLiteralExpr(ArrayLiteralExpr node, FormatterContext ctx) {
        formatBracketed("[", "]", node.getElements(), ctx, this::formatExpression, null);
        return null;
    }

    @Override
    public Void visitArrayComprehensionExpr(ArrayComprehensionExpr node, FormatterContext ctx) {
        ctx.append("[");
        formatExpression(node.getElement(), ctx);
        ctx.append(" ");
        formatCompSpecs(node.getFirstFor(), node.getSpecs(), ctx);
        ctx.append("]");
        return null;
    }

    // ============ 辅助方法 ============

    private void formatBind(Bind bind, FormatterContext ctx) {
        ctx.append(bind.getName().getName());
        ctx.append(" = ");
        formatExpression(bind.getValue(), ctx);
    }

    private void formatAssertion(Assertion assertion, FormatterContext ctx) {
        ctx.append("assert ");
        formatExpression(assertion.getCondition(), ctx);
        if (assertion.hasMessage()) {
            ctx.append(" : ");
            formatExpression(assertion.getMessage(), ctx);
        }
    }

    private void formatMember(ObjectMember member, FormatterContext ctx) {
        switch (member.getMemberKind()) {
            case LOCAL:
                ctx.append("local ");
                formatBind(((ObjectLocal) member).getBind(), ctx);
                break;
            case ASSERT:
                formatAssertion(((ObjectAssert) member).getAssertion(), ctx);
                break;
            case FIELD:
                ObjectField field = (ObjectField) member;
                formatFieldName(field.getName(), ctx);
                if (field.isPlus()) {
                    ctx.append("+");
                }
                ctx.append(field.getVisibility().toSourceString());
                ctx.append(" ");
                formatExpression(field.getValue(), ctx);
                break;
        }
    }

    private void formatFieldName(FieldName name, FormatterContext ctx) {
        switch (name.getKind()) {
            case IDENTIFIER:
                ctx.append(name.getIdent().getName());
                break;
            case STRING:
                formatExpression(name.getString(), ctx);
                break;
            case DYNAMIC:
                ctx.append("[");
                formatExpression(name.getExpression(), ctx);
                ctx.append("]");
                break;
        }
    }

    private void formatCompSpecs(CompSpec.ForSpec first, List<CompSpec> rest, FormatterContext ctx) {
        formatCompSpec(first, ctx);
        for (CompSpec spec : rest) {
            ctx.append(" ");
            formatCompSpec(spec, ctx);
        }
    }

    private void formatCompSpec(CompSpec spec, FormatterContext ctx) {
        if (spec instanceof CompSpec.ForSpec) {
            CompSpec.ForSpec forSpec = (CompSpec.ForSpec) spec;
            ctx.append("for ");
            ctx.append(forSpec.getVariable().getName());
            ctx.append(" in ");
            formatExpression(forSpec.getSource(), ctx);
        } else {
            ctx.append("if ");
            formatExpression(((CompSpec.IfSpec) spec).getCondition(), ctx);
        }
    }

    /**
     * 输出括号包裹的成员列表：能放进当前行则单行输出，否则每个成员一行。
     *
     * @param suffix 列表之后、右括号之前的附加内容（推导式子句），可为 null
     */
    private <T> void formatBracketed(String open, String close, List<T> items, FormatterContext ctx,
                                     BiConsumer<T, FormatterContext> formatter,
                                     Consumer<FormatterContext> suffix) {
        if (items.isEmpty() && suffix == null) {
            ctx.append(open);
            ctx.append(close);
            return;
        }
        FormatterContext inline = ctx.fork();
        boolean padded = "{".equals(open) ? ctx.getConfig().isPadObjects() : ctx.getConfig().isPadArrays();
        String pad = padded ? " " : "";
        inline.append(open);
        inline.append(pad);
        formatJoined(items, inline, ", ", formatter);
        if (suffix != null) suffix.accept(inline);
        inline.append(pad);
        inline.append(close);
        String rendered = inline.getOutput();
        if (ctx.fitsOnLine(rendered)) {
            ctx.append(rendered);
            return;
        }

        ctx.append(open);
        ctx.newLine();
        ctx.indent();
        for (int i = 0; i < items.size(); i++) {
            formatter.accept(items.get(i), ctx);
            if (i < items.size() - 1 || ctx.getConfig().isTrailingComma()) {
                ctx.append(",");
            }
            ctx.newLine();
        }
        if (suffix != null) {
            suffix.accept(ctx);
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append(close);
    }

    private <T> void formatJoined(List<T> items, FormatterContext ctx, String separator,
                                  BiConsumer<T, FormatterContext> formatter) {
        for (int i = 0; i < items.size(); i++) {
            formatter.accept(items.get(i), ctx);
            if (i < items.size() - 1) {
                ctx.append(separator);
            }
        }
    }

    private void formatExpression(Expression expr, FormatterContext ctx) {
        if (expr != null) {
            expr.accept(this, ctx);
        }
    }
}
