package com.erlfmt.core.ast.expr;

import com.erlfmt.core.ast.AstVisitor;
import com.erlfmt.core.ast.SourceLocation;

/**
 * 字符字面量，如 {@code $a}、{@code $\n}，值为 Unicode 码点
 */
public class CharLiteral extends Literal {
    private final int value;

    public CharLiteral(SourceLocation location, String text, int value) {
        super(location, text);
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCharLiteral(this, context);
    }
}
