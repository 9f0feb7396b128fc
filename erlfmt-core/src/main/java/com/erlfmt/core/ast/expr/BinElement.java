package com.erlfmt.core.ast.expr;

import com.erlfmt.core.ast.AstVisitor;
import com.erlfmt.core.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 二进制元素 {@code Expr:Size/Type-Type}，大小和类型说明都可省略
 */
public class BinElement extends Expression {
    private final Expression value;
    private final Expression size;          // nullable
    private final List<TypeSpec> types;     // nullable

    public BinElement(SourceLocation location, Expression value, Expression size, List<TypeSpec> types) {
        super(location);
        this.value = value;
        this.size = size;
        this.types = types != null ? Collections.unmodifiableList(types) : null;
    }

    public Expression getValue() {
        return value;
    }

    public Expression getSize() {
        return size;
    }

    public boolean hasSize() {
        return size != null;
    }

    public List<TypeSpec> getTypes() {
        return types;
    }

    public boolean hasTypes() {
        return types != null && !types.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinElement(this, context);
    }

    /**
     * 类型说明：裸名称（{@code binary}）或名称加数值（{@code unit:8}）
     */
    public static final class TypeSpec {
        private final AtomLiteral name;
        private final Expression size;  // nullable

        public TypeSpec(AtomLiteral name, Expression size) {
            this.name = name;
            this.size = size;
        }

        public AtomLiteral getName() {
            return name;
        }

        public Expression getSize() {
            return size;
        }

        public boolean hasSize() {
            return size != null;
        }
    }
}
