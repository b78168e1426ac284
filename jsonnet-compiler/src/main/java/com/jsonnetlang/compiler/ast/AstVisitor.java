package com.jsonnetlang.compiler.ast;

import com.jsonnetlang.compiler.ast.expr.*;

/**
 * AST 访问者接口
 *
 * <p>每种表面语法表达式对应一个抽象方法，没有默认实现：新增表达式种类时，
 * 所有实现类都必须显式处理，否则无法通过编译。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 原子 ============

    R visitIdentifier(Identifier node, C ctx);

    R visitSpecialIdentifier(SpecialIdentifier node, C ctx);

    R visitLiteral(Literal node, C ctx);

    // ============ 绑定与访问 ============

    R visitLocalExpr(LocalExpr node, C ctx);

    R visitMemberExpr(MemberExpr node, C ctx);

    R visitIndexExpr(IndexExpr node, C ctx);

    R visitSliceExpr(SliceExpr node, C ctx);

    R visitCallExpr(CallExpr node, C ctx);

    // ============ 运算 ============

    R visitUnaryExpr(UnaryExpr node, C ctx);

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitObjectExtendExpr(ObjectExtendExpr node, C ctx);

    // ============ 控制与函数 ============

    R visitIfExpr(IfExpr node, C ctx);

    R visitLambdaExpr(LambdaExpr node, C ctx);

    R visitImportExpr(ImportExpr node, C ctx);

    R visitAssertExpr(AssertExpr node, C ctx);

    R visitErrorExpr(ErrorExpr node, C ctx);

    R visitParenExpr(ParenExpr node, C ctx);

    // ============ 对象与数组 ============

    R visitObjectLiteralExpr(ObjectLiteralExpr node, C ctx);

    R visitObjectComprehensionExpr(ObjectComprehensionExpr node, C ctx);

    R visitArrayLiteralExpr(ArrayLiteralExpr node, C ctx);

    R visitArrayComprehensionExpr(ArrayComprehensionExpr node, C ctx);
}
