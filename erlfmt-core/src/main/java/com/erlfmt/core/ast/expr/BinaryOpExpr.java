package com.erlfmt.core.ast.expr;

import com.erlfmt.core.ast.AstVisitor;
import com.erlfmt.core.ast.SourceLocation;

/**
 * 二元运算
 */
public class BinaryOpExpr extends Expression {
    private final String operator;
    private final Expression left;
    private final Expression right;

    public BinaryOpExpr(SourceLocation location, String operator, Expression left, Expression right) {
        super(location);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    /** 运算符的源码符号 */
    public String getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public boolean isOperator() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryOpExpr(this, context);
    }
}
