package com.erlfmt.core.formatter;

import com.erlfmt.algebra.Document;
import com.erlfmt.core.ast.AstVisitor;
import com.erlfmt.core.ast.expr.*;

import java.util.ArrayList;
import java.util.List;

import static com.erlfmt.algebra.Documents.*;

/**
 * 表达式到文档的转换
 *
 * <p>按节点种类分派：字面量交给 {@link LiteralFormatter}，运算符交给
 * {@link OperatorFormatter}，容器交给 {@link ContainerFormatter}。
 * 转换是纯函数，同一个实例可以在多个线程间共享。</p>
 */
public class ExprFormatter implements AstVisitor<Document, Void> {

    // === Helper 实例 ===
    final OperatorFormatter operators;
    final ContainerFormatter containers;

    public ExprFormatter(FormatConfig config) {
        this.operators = new OperatorFormatter(this, config.getIndentSize());
        this.containers = new ContainerFormatter(this, config.getIndentSize());
    }

    public ExprFormatter() {
        this(new FormatConfig());
    }

    /**
     * 将表达式转换为文档
     *
     * @throws EscapeMismatchException  字面量转义无法规范化
     * @throws UnknownOperatorException 运算符不在优先级表中
     */
    public Document exprToDocument(Expression expression) {
        return expression.accept(this, null);
    }

    // ============ 字面量 ============

    @Override
    public Document visitIntegerLiteral(IntegerLiteral node, Void ctx) {
        return text(LiteralFormatter.formatInteger(node.getText()));
    }

    @Override
    public Document visitFloatLiteral(FloatLiteral node, Void ctx) {
        return text(LiteralFormatter.formatFloat(node.getText()));
    }

    @Override
    public Document visitCharLiteral(CharLiteral node, Void ctx) {
        return text(LiteralFormatter.formatChar(node.getText(), node.getValue()));
    }

    @Override
    public Document visitAtomLiteral(AtomLiteral node, Void ctx) {
        return text(LiteralFormatter.formatAtom(node.getText(), node.getName()));
    }

    @Override
    public Document visitStringLiteral(StringLiteral node, Void ctx) {
        return text(LiteralFormatter.formatString(node.getText(), node.getValue()));
    }

    // ============ 表达式 ============

    @Override
    public Document visitVariable(Variable node, Void ctx) {
        return text(node.getName());
    }

    /**
     * 相邻字符串：放在一行或每行一个
     */
    @Override
    public Document visitConcatExpr(ConcatExpr node, Void ctx) {
        List<Document> parts = new ArrayList<>(node.getParts().size());
        for (Expression part : node.getParts()) {
            parts.add(exprToDocument(part));
        }
        return choice(
                reduce(Combinators::combineSpace, parts),
                reduce(Combinators::combineNewline, parts));
    }

    @Override
    public Document visitUnaryOpExpr(UnaryOpExpr node, Void ctx) {
        return operators.unary(node.getOperator(), node.getOperand());
    }

    @Override
    public Document visitBinaryOpExpr(BinaryOpExpr node, Void ctx) {
        return operators.binary(node.getOperator(), node.getLeft(), node.getRight());
    }

    // ============ 容器 ============

    @Override
    public Document visitTupleExpr(TupleExpr node, Void ctx) {
        return containers.container(node.getElements(), "{", "}");
    }

    @Override
    public Document visitListExpr(ListExpr node, Void ctx) {
        return containers.container(node.getElements(), "[", "]");
    }

    @Override
    public Document visitConsExpr(ConsExpr node, Void ctx) {
        return containers.cons(node);
    }

    @Override
    public Document visitBitstringExpr(BitstringExpr node, Void ctx) {
        return containers.container(node.getElements(), "<<", ">>");
    }

    @Override
    public Document visitBinElement(BinElement node, Void ctx) {
        return containers.binElement(node);
    }
}
