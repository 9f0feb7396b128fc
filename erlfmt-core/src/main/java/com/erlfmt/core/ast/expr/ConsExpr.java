package com.erlfmt.core.ast.expr;

import com.erlfmt.core.ast.AstVisitor;
import com.erlfmt.core.ast.SourceLocation;

/**
 * 列表构造单元 {@code Head | Tail}，作为 {@link ListExpr} 的最后一个元素出现
 */
public class ConsExpr extends Expression {
    private final Expression head;
    private final Expression tail;

    public ConsExpr(SourceLocation location, Expression head, Expression tail) {
        super(location);
        this.head = head;
        this.tail = tail;
    }

    public Expression getHead() {
        return head;
    }

    public Expression getTail() {
        return tail;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConsExpr(this, context);
    }
}
