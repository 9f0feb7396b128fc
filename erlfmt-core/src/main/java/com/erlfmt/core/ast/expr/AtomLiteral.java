package com.erlfmt.core.ast.expr;

import com.erlfmt.core.ast.AstVisitor;
import com.erlfmt.core.ast.SourceLocation;

/**
 * 原子字面量，文本可能带单引号，值为解码后的原子名
 */
public class AtomLiteral extends Literal {
    private final String name;

    public AtomLiteral(SourceLocation location, String text, String name) {
        super(location, text);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAtomLiteral(this, context);
    }
}
