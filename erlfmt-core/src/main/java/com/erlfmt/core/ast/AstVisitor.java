package com.erlfmt.core.ast;

import com.erlfmt.core.ast.expr.*;

/**
 * 抽象形式访问者接口
 *
 * <p>节点种类是封闭集合，实现类必须处理每一种。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 字面量 ============

    R visitIntegerLiteral(IntegerLiteral node, C ctx);

    R visitFloatLiteral(FloatLiteral node, C ctx);

    R visitCharLiteral(CharLiteral node, C ctx);

    R visitAtomLiteral(AtomLiteral node, C ctx);

    R visitStringLiteral(StringLiteral node, C ctx);

    // ============ 表达式 ============

    R visitVariable(Variable node, C ctx);

    R visitConcatExpr(ConcatExpr node, C ctx);

    R visitUnaryOpExpr(UnaryOpExpr node, C ctx);

    R visitBinaryOpExpr(BinaryOpExpr node, C ctx);

    // ============ 容器 ============

    R visitTupleExpr(TupleExpr node, C ctx);

    R visitListExpr(ListExpr node, C ctx);

    R visitConsExpr(ConsExpr node, C ctx);

    R visitBitstringExpr(BitstringExpr node, C ctx);

    R visitBinElement(BinElement node, C ctx);
}
