package com.erlfmt.core.ast.expr;

import com.erlfmt.core.ast.AstVisitor;
import com.erlfmt.core.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 相邻字符串拼接：{@code "abc" "def"}
 */
public class ConcatExpr extends Expression {
    private final List<Expression> parts;

    public ConcatExpr(SourceLocation location, List<Expression> parts) {
        super(location);
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("string concatenation needs at least one part");
        }
        this.parts = Collections.unmodifiableList(parts);
    }

    public List<Expression> getParts() {
        return parts;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConcatExpr(this, context);
    }
}
