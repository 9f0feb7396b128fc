package com.erlfmt.core.ast;

/**
 * 抽象形式节点基类
 *
 * <p>节点由解析器构造后不可变，格式化过程只读。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
