package com.erlfmt.core.ast.expr;

import com.erlfmt.core.ast.AstNode;
import com.erlfmt.core.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    /** 是否为运算符表达式（一元或二元） */
    public boolean isOperator() {
        return false;
    }
}
