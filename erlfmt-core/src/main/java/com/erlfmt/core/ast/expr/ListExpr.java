package com.erlfmt.core.ast.expr;

import com.erlfmt.core.ast.AstVisitor;
import com.erlfmt.core.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 列表：{@code [A, B]}，尾部可以是 {@link ConsExpr}
 */
public class ListExpr extends Expression {
    private final List<Expression> elements;

    public ListExpr(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = Collections.unmodifiableList(elements);
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitListExpr(this, context);
    }
}
