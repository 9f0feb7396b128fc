package com.erlfmt.core.ast.expr;

import com.erlfmt.core.ast.SourceLocation;

/**
 * 字面量基类，保留源码中的原始文本
 */
public abstract class Literal extends Expression {
    private final String text;

    protected Literal(SourceLocation location, String text) {
        super(location);
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("literal text must not be empty");
        }
        this.text = text;
    }

    /** 源码中的原始片段（含引号、进制前缀等） */
    public String getText() {
        return text;
    }
}
