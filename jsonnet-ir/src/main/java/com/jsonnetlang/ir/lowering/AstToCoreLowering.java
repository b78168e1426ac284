package com.jsonnetlang.ir.lowering;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.ast.Ident;
import com.jsonnetlang.compiler.ast.decl.*;
import com.jsonnetlang.compiler.ast.expr.*;
import com.jsonnetlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.jsonnetlang.compiler.ast.expr.CallExpr.Argument;
import com.jsonnetlang.compiler.formatter.JsonnetFormatter;
import com.jsonnetlang.compiler.lexer.Token;
import com.jsonnetlang.compiler.lexer.TokenType;
import com.jsonnetlang.ir.core.CoreExpr;
import com.jsonnetlang.ir.core.CorePrinter;
import com.jsonnetlang.ir.core.decl.*;
import com.jsonnetlang.ir.core.expr.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.jsonnetlang.ir.lowering.LoweringContext.*;

/**
 * AST → Core 降级（脱糖）。
 * <p>
 * 实现 AstVisitor，将 21 种表面语法节点转换为 13 种 Core 节点。
 * 改写为另一种表面语法的规则（!=、==、%、in、切片、assert、对象扩展）
 * 先构造新的表面节点，再递归降级。
 * <p>
 * 本类无状态，可在多线程间共享。import 与推导式尚未支持，
 * 对应的 protected 方法抛出 {@link UnsupportedConstructException}，子类可覆盖。
 */
public class AstToCoreLowering implements AstVisitor<CoreExpr, LoweringContext> {

    private static final Logger LOG = Logger.getLogger(AstToCoreLowering.class.getName());

    static final String ASSERTION_FAILED = "Assertion failed";
    static final String OBJECT_ASSERTION_FAILED = "Object assertion failed";
    static final String PARAMETER_NOT_BOUND = "Parameter not bound";
    static final String DOLLAR = "$";
    static final String OUTER_SELF = "$outerself";
    static final String OUTER_SUPER = "$outersuper";

    private final JsonnetFormatter formatter = new JsonnetFormatter();

    // ========== 公共入口 ==========

    /**
     * 将顶层表达式降级为 Core 表达式。
     */
    public CoreExpr lower(Expression program) {
        CoreExpr core = lowerExpr(program, LoweringContext.TOP);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("脱糖结果: " + new CorePrinter().print(core));
        }
        return core;
    }

    public CoreExpr lowerExpr(Expression expr, LoweringContext ctx) {
        return expr.accept(this, ctx);
    }

    // ========== 原子 ==========

    @Override
    public CoreExpr visitIdentifier(Identifier node, LoweringContext ctx) {
        return new CoreIdentifier(node.getIdent());
    }

    @Override
    public CoreExpr visitSpecialIdentifier(SpecialIdentifier node, LoweringContext ctx) {
        switch (node.getKind()) {
            case SELF:
                return new CoreSpecial(node.getToken(), CoreSpecial.Kind.SELF);
            case SUPER:
                return new CoreSpecial(node.getToken(), CoreSpecial.Kind.SUPER);
            case DOLLAR:
                // $ 由对象的隐式绑定 $ = self 提供
                return new CoreIdentifier(new Ident(DOLLAR, node.getToken()));
            default:
                throw new IllegalStateException("Unhandled special identifier: " + node.getKind());
        }
    }

    @Override
    public CoreExpr visitLiteral(Literal node, LoweringContext ctx) {
        switch (node.getKind()) {
            case NULL:
                return CoreLiteral.nullLiteral(node.getToken());
            case BOOLEAN:
                return CoreLiteral.booleanLiteral(node.getToken(), node.getBooleanValue());
            case NUMBER:
                return CoreLiteral.numberLiteral(node.getToken(), node.getNumberText());
            case STRING:
                return CoreLiteral.stringLiteral(node.getVerbatimToken(), node.getStringKind(),
                        node.getOpenToken(), node.getFragments(), node.getCloseToken());
            default:
                throw new IllegalStateException("Unhandled literal kind: " + node.getKind());
        }
    }

    // ========== 绑定与访问 ==========

    @Override
    public CoreExpr visitLocalExpr(LocalExpr node, LoweringContext ctx) {
        return new CoreLocal(node.getLocalToken(), lowerBinds(node.getBinds(), ctx),
                node.getSemicolonToken(), lowerExpr(node.getBody(), ctx));
    }

    /**
     * 脱糖：e.id → e["id"]
     */
    @Override
    public CoreExpr visitMemberExpr(MemberExpr node, LoweringContext ctx) {
        Ident member = node.getMember();
        CoreExpr key = lowerExpr(stringLiteral(member.getName(), member.getToken()), ctx);
        return new CoreIndex(lowerExpr(node.getTarget(), ctx), node.getDotToken(), key, node.getDotToken());
    }

    @Override
    public CoreExpr visitIndexExpr(IndexExpr node, LoweringContext ctx) {
        return new CoreIndex(lowerExpr(node.getTarget(), ctx), node.getOpenToken(),
                lowerExpr(node.getIndex(), ctx), node.getCloseToken());
    }

    /**
     * 脱糖：e[a:b:c] → std.slice(e, a, b, c)，缺省部分为 null
     */
    @Override
    public CoreExpr visitSliceExpr(SliceExpr node, LoweringContext ctx) {
        Token open = node.getOpenToken();
        List<Argument> args = Arrays.asList(
                Argument.positional(node.getTarget()),
                Argument.positional(node.hasStart() ? node.getStart() : nullLiteral()),
                Argument.positional(node.hasEnd() ? node.getEnd() : nullLiteral()),
                Argument.positional(node.hasStep() ? node.getStep() : nullLiteral()));
        CallExpr call = new CallExpr(stdMember(StdlibNames.SLICE, open), open, args, node.getCloseToken());
        return lowerExpr(call, ctx);
    }

    @Override
    public CoreExpr visitCallExpr(CallExpr node, LoweringContext ctx) {
        List<CoreCall.Argument> args = new ArrayList<>(node.getArgs().size());
        for (Argument arg : node.getArgs()) {
            CoreExpr value = lowerExpr(arg.getValue(), ctx);
            args.add(arg.isNamed()
                    ? CoreCall.Argument.named(arg.getName(), arg.getAssignToken(), value)
                    : CoreCall.Argument.positional(value));
        }
        return new CoreCall(lowerExpr(node.getCallee(), ctx), node.getOpenToken(), args, node.getCloseToken());
    }

    // ========== 运算 ==========

    @Override
    public CoreExpr visitUnaryExpr(UnaryExpr node, LoweringContext ctx) {
        return new CoreUnary(node.getOperatorToken(), toCoreOperator(node.getOperator()),
                lowerExpr(node.getOperand(), ctx));
    }

    @Override
    public CoreExpr visitBinaryExpr(BinaryExpr node, LoweringContext ctx) {
        Token op = node.getOperatorToken();
        switch (node.getOperator()) {
            case NE:
                // a != b → !(a == b)
                return lowerExpr(new UnaryExpr(op, UnaryExpr.UnaryOp.NOT,
                        new BinaryExpr(node.getLeft(), op, BinaryOp.EQ, node.getRight())), ctx);
            case EQ:
                return lowerStdCall(StdlibNames.EQUALS, op, ctx, node.getLeft(), node.getRight());
            case MOD:
                return lowerStdCall(StdlibNames.MOD, op, ctx, node.getLeft(), node.getRight());
            case IN:
                // a in b → std.objectHasEx(b, a, true)，对象在前
                return lowerStdCall(StdlibNames.OBJECT_HAS_EX, op, ctx,
                        node.getRight(), node.getLeft(), boolLiteral(true));
            default:
                return new CoreBinary(lowerExpr(node.getLeft(), ctx), op,
                        toCoreOperator(node.getOperator()), lowerExpr(node.getRight(), ctx));
        }
    }

    /**
     * 脱糖：e { ... } → e + { ... }
     */
    @Override
    public CoreExpr visitObjectExtendExpr(ObjectExtendExpr node, LoweringContext ctx) {
        return lowerExpr(new BinaryExpr(node.getTarget(), synthetic(TokenType.PLUS, "+"),
                BinaryOp.ADD, node.getObject()), ctx);
    }

    // ========== 控制与函数 ==========

    @Override
    public CoreExpr visitIfExpr(IfExpr node, LoweringContext ctx) {
        CoreExpr elseExpr;
        Token elseToken;
        if (node.hasElse()) {
            elseExpr = lowerExpr(node.getElseExpr(), ctx);
            elseToken = node.getElseToken();
        } else {
            elseExpr = lowerExpr(nullLiteral(), ctx);
            elseToken = synthetic(TokenType.KW_ELSE, "else");
        }
        return new CoreIf(node.getIfToken(), lowerExpr(node.getCondition(), ctx),
                node.getThenToken(), lowerExpr(node.getThenExpr(), ctx), elseToken, elseExpr);
    }

    @Override
    public CoreExpr visitLambdaExpr(LambdaExpr node, LoweringContext ctx) {
        List<CoreParam> params = new ArrayList<>(node.getParams().size());
        for (Parameter param : node.getParams()) {
            params.add(lowerParam(param, ctx));
        }
        return new CoreFunction(node.getFunctionToken(), node.getOpenToken(), params,
                node.getCloseToken(), lowerExpr(node.getBody(), ctx));
    }

    @Override
    public CoreExpr visitImportExpr(ImportExpr node, LoweringContext ctx) {
        return lowerImport(node, ctx);
    }

    /**
     * 脱糖：assert c; rest → assert c : "Assertion failed"; rest
     * → if c then rest else error msg
     */
    @Override
    public CoreExpr visitAssertExpr(AssertExpr node, LoweringContext ctx) {
        Assertion assertion = node.getAssertion();
        Token assertToken = assertion.getAssertToken();
        Token colonToken;
        Expression message;
        if (assertion.hasMessage()) {
            colonToken = assertion.getColonToken();
            message = assertion.getMessage();
        } else {
            colonToken = synthetic(TokenType.COLON, ":");
            message = stringLiteral(ASSERTION_FAILED, assertToken);
        }
        IfExpr guard = new IfExpr(assertToken, assertion.getCondition(),
                synthetic(TokenType.KW_THEN, "then"), node.getRest(),
                colonToken, new ErrorExpr(synthetic(TokenType.KW_ERROR, "error"), message));
        return lowerExpr(guard, ctx);
    }

    @Override
    public CoreExpr visitErrorExpr(ErrorExpr node, LoweringContext ctx) {
        return new CoreError(node.getToken(), lowerExpr(node.getPayload(), ctx));
    }

    @Override
    public CoreExpr visitParenExpr(ParenExpr node, LoweringContext ctx) {
        return lowerExpr(node.getInner(), ctx);
    }

    // ========== 对象与数组 ==========

    /**
     * 对象脱糖：
     * <ol>
     *   <li>成员按 local / assert / 字段分组，组内保持源码顺序</li>
     *   <li>不在对象内时追加隐式绑定 $ = self</li>
     *   <li>断言与字段值包裹 local 绑定组，在对象内上下文中降级</li>
     *   <li>嵌套对象外包 local $outerself = self, $outersuper = super</li>
     * </ol>
     */
    @Override
    public CoreExpr visitObjectLiteralExpr(ObjectLiteralExpr node, LoweringContext ctx) {
        List<Bind> binds = new ArrayList<>();
        List<Assertion> assertions = new ArrayList<>();
        List<ObjectField> fields = new ArrayList<>();
        for (ObjectMember member : node.getMembers()) {
            switch (member.getMemberKind()) {
                case LOCAL:
                    binds.add(((ObjectLocal) member).getBind());
                    break;
                case ASSERT:
                    assertions.add(((ObjectAssert) member).getAssertion());
                    break;
                case FIELD:
                    fields.add((ObjectField) member);
                    break;
                default:
                    throw new IllegalStateException("Unhandled object member: " + member.getMemberKind());
            }
        }
        if (!ctx.isWithinObject()) {
            binds.add(new Bind(new Ident(DOLLAR, synthetic(TokenType.DOLLAR, DOLLAR)),
                    synthetic(TokenType.ASSIGN, "="),
                    new SpecialIdentifier(synthetic(TokenType.KW_SELF, "self"),
                            SpecialIdentifier.SpecialKind.SELF)));
        }

        LoweringContext inner = ctx.enterObject();
        List<CoreObjectAssert> coreAsserts = new ArrayList<>(assertions.size());
        for (Assertion assertion : assertions) {
            coreAsserts.add(new CoreObjectAssert(assertion.getAssertToken(),
                    lowerExpr(withBinds(binds, objectAssertBody(assertion)), inner)));
        }
        List<CoreField> coreFields = new ArrayList<>(fields.size());
        for (ObjectField field : fields) {
            coreFields.add(field.isPlus()
                    ? lowerPlusField(field, node, ctx)
                    : lowerField(field, binds, ctx));
        }

        CoreObject object = new CoreObject(node.getOpenToken(), coreAsserts, coreFields, node.getCloseToken());
        if (!ctx.isWithinObject()) {
            return object;
        }
        List<CoreBind> capture = new ArrayList<>(2);
        capture.add(new CoreBind(new Ident(OUTER_SELF, synthetic(TokenType.IDENTIFIER, OUTER_SELF)),
                synthetic(TokenType.ASSIGN, "="),
                new CoreSpecial(synthetic(TokenType.KW_SELF, "self"), CoreSpecial.Kind.SELF)));
        capture.add(new CoreBind(new Ident(OUTER_SUPER, synthetic(TokenType.IDENTIFIER, OUTER_SUPER)),
                synthetic(TokenType.ASSIGN, "="),
                new CoreSpecial(synthetic(TokenType.KW_SUPER, "super"), CoreSpecial.Kind.SUPER)));
        return new CoreLocal(synthetic(TokenType.KW_LOCAL, "local"), capture,
                synthetic(TokenType.SEMICOLON, ";"), object);
    }

    @Override
    public CoreExpr visitObjectComprehensionExpr(ObjectComprehensionExpr node, LoweringContext ctx) {
        return lowerObjectComprehension(node, ctx);
    }

    @Override
    public CoreExpr visitArrayLiteralExpr(ArrayLiteralExpr node, LoweringContext ctx) {
        List<CoreExpr> elements = new ArrayList<>(node.getElements().size());
        for (Expression e : node.getElements()) {
            elements.add(lowerExpr(e, ctx));
        }
        return new CoreArray(node.getOpenToken(), elements, node.getCloseToken());
    }

    @Override
    public CoreExpr visitArrayComprehensionExpr(ArrayComprehensionExpr node, LoweringContext ctx) {
        return lowerArrayComprehension(node, ctx);
    }

    // ========== 未支持的构造 ==========

    protected CoreExpr lowerImport(ImportExpr node, LoweringContext ctx) {
        throw unsupported(node.getKind().getKeyword(), node);
    }

    protected CoreExpr lowerArrayComprehension(ArrayComprehensionExpr node, LoweringContext ctx) {
        throw unsupported("array comprehension", node);
    }

    protected CoreExpr lowerObjectComprehension(ObjectComprehensionExpr node, LoweringContext ctx) {
        throw unsupported("object comprehension", node);
    }

    /**
     * +: 字段，owner 为所在对象
     */
    protected CoreField lowerPlusField(ObjectField field, ObjectLiteralExpr owner, LoweringContext ctx) {
        throw unsupported("+: field", owner);
    }

    protected UnsupportedConstructException unsupported(String construct, Expression node) {
        String rendered = formatter.formatSingleLine(node);
        LOG.warning("未支持的构造 " + construct + " (" + node.getLocation() + "): " + rendered);
        return new UnsupportedConstructException(construct, node, rendered);
    }

    // ========== 辅助方法 ==========

    private List<CoreBind> lowerBinds(List<Bind> binds, LoweringContext ctx) {
        List<CoreBind> result = new ArrayList<>(binds.size());
        for (Bind bind : binds) {
            result.add(new CoreBind(bind.getName(), bind.getAssignToken(), lowerExpr(bind.getValue(), ctx)));
        }
        return result;
    }

    /**
     * 形参没有默认值时，默认值为 error "Parameter not bound"
     */
    private CoreParam lowerParam(Parameter param, LoweringContext ctx) {
        if (param.hasDefaultValue()) {
            return new CoreParam(param.getName(), param.getAssignToken(),
                    lowerExpr(param.getDefaultValue(), ctx));
        }
        Token unbound = synthetic(TokenType.STRING_FRAGMENT, PARAMETER_NOT_BOUND);
        CoreExpr error = lowerExpr(new ErrorExpr(synthetic(TokenType.KW_ERROR, "error"),
                stringLiteral(PARAMETER_NOT_BOUND, unbound)), ctx);
        return new CoreParam(param.getName(), synthetic(TokenType.ASSIGN, "="), error);
    }

    private CoreExpr lowerStdCall(String function, Token opToken, LoweringContext ctx, Expression... args) {
        List<Argument> callArgs = new ArrayList<>(args.length);
        for (Expression arg : args) {
            callArgs.add(Argument.positional(arg));
        }
        CallExpr call = new CallExpr(stdMember(function, opToken),
                synthetic(TokenType.LPAREN, "("), callArgs, synthetic(TokenType.RPAREN, ")"));
        return lowerExpr(call, ctx);
    }

    /**
     * 字段名在对象外层上下文中降级，字段值在对象内上下文中降级
     */
    private CoreField lowerField(ObjectField field, List<Bind> binds, LoweringContext ctx) {
        FieldName name = field.getName();
        Token open;
        Token close;
        CoreExpr key;
        switch (name.getKind()) {
            case IDENTIFIER:
                open = synthetic(TokenType.LBRACKET, "[");
                close = synthetic(TokenType.RBRACKET, "]");
                key = lowerExpr(stringLiteral(name.getIdent().getName(), name.getIdent().getToken()), ctx);
                break;
            case STRING:
                open = synthetic(TokenType.LBRACKET, "[");
                close = synthetic(TokenType.RBRACKET, "]");
                key = lowerExpr(name.getString(), ctx);
                break;
            case DYNAMIC:
                open = name.getOpenToken();
                close = name.getCloseToken();
                key = lowerExpr(name.getExpression(), ctx);
                break;
            default:
                throw new IllegalStateException("Unhandled field name kind: " + name.getKind());
        }
        CoreExpr value = lowerExpr(withBinds(binds, field.getValue()), ctx.enterObject());
        return new CoreField(open, key, close, field.getVisibility(), field.getVisibilityToken(), value);
    }

    /**
     * assert c : m → if c then true else error m
     */
    private Expression objectAssertBody(Assertion assertion) {
        Token assertToken = assertion.getAssertToken();
        Expression message = assertion.hasMessage()
                ? assertion.getMessage()
                : stringLiteral(OBJECT_ASSERTION_FAILED, assertToken);
        Token elseToken = assertion.hasMessage()
                ? assertion.getColonToken()
                : synthetic(TokenType.KW_ELSE, "else");
        return new IfExpr(assertToken, assertion.getCondition(),
                synthetic(TokenType.KW_THEN, "then"), boolLiteral(true),
                elseToken, new ErrorExpr(synthetic(TokenType.KW_ERROR, "error"), message));
    }

    private static Expression withBinds(List<Bind> binds, Expression body) {
        if (binds.isEmpty()) {
            return body;
        }
        return new LocalExpr(synthetic(TokenType.KW_LOCAL, "local"), new ArrayList<>(binds),
                synthetic(TokenType.SEMICOLON, ";"), body);
    }

    private static CoreUnary.Operator toCoreOperator(UnaryExpr.UnaryOp op) {
        switch (op) {
            case PLUS: return CoreUnary.Operator.PLUS;
            case MINUS: return CoreUnary.Operator.MINUS;
            case NOT: return CoreUnary.Operator.NOT;
            case BIT_NOT: return CoreUnary.Operator.BIT_NOT;
            default:
                throw new IllegalStateException("Unhandled unary operator: " + op);
        }
    }

    private static CoreBinary.Operator toCoreOperator(BinaryOp op) {
        switch (op) {
            case ADD: return CoreBinary.Operator.ADD;
            case SUB: return CoreBinary.Operator.SUB;
            case MUL: return CoreBinary.Operator.MUL;
            case DIV: return CoreBinary.Operator.DIV;
            case SHL: return CoreBinary.Operator.SHL;
            case SHR: return CoreBinary.Operator.SHR;
            case LT: return CoreBinary.Operator.LT;
            case LE: return CoreBinary.Operator.LE;
            case GT: return CoreBinary.Operator.GT;
            case GE: return CoreBinary.Operator.GE;
            case AND: return CoreBinary.Operator.AND;
            case OR: return CoreBinary.Operator.OR;
            case BIT_AND: return CoreBinary.Operator.BIT_AND;
            case BIT_OR: return CoreBinary.Operator.BIT_OR;
            case BIT_XOR: return CoreBinary.Operator.BIT_XOR;
            // EQ / NE / MOD / IN 已在 visitBinaryExpr 中改写
            default:
                throw new IllegalStateException("Unhandled binary operator: " + op);
        }
    }
}
