package com.erlfmt.core.ast.expr;

import com.erlfmt.core.ast.AstVisitor;
import com.erlfmt.core.ast.SourceLocation;

/**
 * 浮点字面量，如 {@code 1.0e10}
 */
public class FloatLiteral extends Literal {
    private final double value;

    public FloatLiteral(SourceLocation location, String text, double value) {
        super(location, text);
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFloatLiteral(this, context);
    }
}
