package com.erlfmt.core.ast.expr;

import com.erlfmt.core.ast.AstVisitor;
import com.erlfmt.core.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 二进制：{@code <<A:8, B/binary>>}
 */
public class BitstringExpr extends Expression {
    private final List<BinElement> elements;

    public BitstringExpr(SourceLocation location, List<BinElement> elements) {
        super(location);
        this.elements = Collections.unmodifiableList(elements);
    }

    public List<BinElement> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBitstringExpr(this, context);
    }
}
