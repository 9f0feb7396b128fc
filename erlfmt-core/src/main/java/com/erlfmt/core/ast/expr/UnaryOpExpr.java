package com.erlfmt.core.ast.expr;

import com.erlfmt.core.ast.AstVisitor;
import com.erlfmt.core.ast.SourceLocation;

/**
 * 前缀一元运算：{@code -X}、{@code not X}、{@code catch X}
 */
public class UnaryOpExpr extends Expression {
    private final String operator;
    private final Expression operand;

    public UnaryOpExpr(SourceLocation location, String operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    /** 运算符的源码符号 */
    public String getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public boolean isOperator() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryOpExpr(this, context);
    }
}
