package com.jsonnetlang.ir.core;

import com.jsonnetlang.ir.core.expr.*;

/**
 * Core 访问者接口，13 个 visit 方法。
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface CoreVisitor<R, C> {

    // ===== 原子 (3) =====
    R visitLiteral(CoreLiteral node, C context);
    R visitIdentifier(CoreIdentifier node, C context);
    R visitSpecial(CoreSpecial node, C context);

    // ===== 绑定与访问 (3) =====
    R visitLocal(CoreLocal node, C context);
    R visitIndex(CoreIndex node, C context);
    R visitCall(CoreCall node, C context);

    // ===== 运算 (2) =====
    R visitUnary(CoreUnary node, C context);
    R visitBinary(CoreBinary node, C context);

    // ===== 控制与函数 (3) =====
    R visitIf(CoreIf node, C context);
    R visitFunction(CoreFunction node, C context);
    R visitError(CoreError node, C context);

    // ===== 复合值 (2) =====
    R visitObject(CoreObject node, C context);
    R visitArray(CoreArray node, C context);
}
