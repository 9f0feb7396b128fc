package com.erlfmt.core.parser;

import com.erlfmt.core.ast.SourceLocation;
import com.erlfmt.core.ast.expr.Expression;

/**
 * 顶层形式：一个以 {@code .} 结尾的表达式及其源码原文
 */
public final class Form {
    private final Expression expression;
    private final String sourceText;
    private final SourceLocation location;

    public Form(Expression expression, String sourceText, SourceLocation location) {
        this.expression = expression;
        this.sourceText = sourceText;
        this.location = location;
    }

    public Expression getExpression() {
        return expression;
    }

    /** 源码原文，包含结尾的点 */
    public String getSourceText() {
        return sourceText;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
