package com.erlfmt.core.ast.expr;

import com.erlfmt.core.ast.AstVisitor;
import com.erlfmt.core.ast.SourceLocation;

import java.math.BigInteger;

/**
 * 整数字面量，如 {@code 42}、{@code 16#FF}、{@code 1_000}
 */
public class IntegerLiteral extends Literal {
    private final BigInteger value;

    public IntegerLiteral(SourceLocation location, String text, BigInteger value) {
        super(location, text);
        this.value = value;
    }

    public BigInteger getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIntegerLiteral(this, context);
    }
}
