package com.erlfmt.core.ast.expr;

import com.erlfmt.core.ast.AstVisitor;
import com.erlfmt.core.ast.SourceLocation;

/**
 * 字符串字面量，值为解码后的字符序列
 */
public class StringLiteral extends Literal {
    private final String value;

    public StringLiteral(SourceLocation location, String text, String value) {
        super(location, text);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStringLiteral(this, context);
    }
}
