package com.erlfmt.core.ast;

import com.erlfmt.core.ast.expr.*;

import java.util.List;

/**
 * 把抽象形式打印为只含值与结构的 S 表达式
 *
 * <p>不包含源码原文，因此两棵值相等的树打印结果相同，可用于比较重新解析前后的树。</p>
 */
public class AstPrinter implements AstVisitor<String, Void> {

    public String print(AstNode node) {
        return node.accept(this, null);
    }

    @Override
    public String visitIntegerLiteral(IntegerLiteral node, Void ctx) {
        return "(integer " + node.getValue() + ")";
    }

    @Override
    public String visitFloatLiteral(FloatLiteral node, Void ctx) {
        return "(float " + node.getValue() + ")";
    }

    @Override
    public String visitCharLiteral(CharLiteral node, Void ctx) {
        return "(char " + node.getValue() + ")";
    }

    @Override
    public String visitAtomLiteral(AtomLiteral node, Void ctx) {
        return "(atom " + quote(node.getName()) + ")";
    }

    @Override
    public String visitStringLiteral(StringLiteral node, Void ctx) {
        return "(string " + quote(node.getValue()) + ")";
    }

    @Override
    public String visitVariable(Variable node, Void ctx) {
        return "(var " + node.getName() + ")";
    }

    @Override
    public String visitConcatExpr(ConcatExpr node, Void ctx) {
        return parenthesize("concat", node.getParts());
    }

    @Override
    public String visitUnaryOpExpr(UnaryOpExpr node, Void ctx) {
        return "(op " + node.getOperator() + " " + print(node.getOperand()) + ")";
    }

    @Override
    public String visitBinaryOpExpr(BinaryOpExpr node, Void ctx) {
        return "(op " + node.getOperator() + " " + print(node.getLeft()) + " " + print(node.getRight()) + ")";
    }

    @Override
    public String visitTupleExpr(TupleExpr node, Void ctx) {
        return parenthesize("tuple", node.getElements());
    }

    @Override
    public String visitListExpr(ListExpr node, Void ctx) {
        return parenthesize("list", node.getElements());
    }

    @Override
    public String visitConsExpr(ConsExpr node, Void ctx) {
        return "(cons " + print(node.getHead()) + " " + print(node.getTail()) + ")";
    }

    @Override
    public String visitBitstringExpr(BitstringExpr node, Void ctx) {
        return parenthesize("bin", node.getElements());
    }

    @Override
    public String visitBinElement(BinElement node, Void ctx) {
        StringBuilder sb = new StringBuilder("(bin_element ");
        sb.append(print(node.getValue()));
        sb.append(' ').append(node.hasSize() ? print(node.getSize()) : "default");
        sb.append(' ');
        if (node.hasTypes()) {
            sb.append('[');
            List<BinElement.TypeSpec> types = node.getTypes();
            for (int i = 0; i < types.size(); i++) {
                if (i > 0) sb.append(' ');
                BinElement.TypeSpec type = types.get(i);
                sb.append(print(type.getName()));
                if (type.hasSize()) {
                    sb.append(':').append(print(type.getSize()));
                }
            }
            sb.append(']');
        } else {
            sb.append("default");
        }
        return sb.append(')').toString();
    }

    private String parenthesize(String name, List<? extends AstNode> nodes) {
        StringBuilder sb = new StringBuilder("(").append(name);
        for (AstNode node : nodes) {
            sb.append(' ').append(print(node));
        }
        return sb.append(')').toString();
    }

    private static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        value.codePoints().forEach(cp -> {
            if (cp == '"' || cp == '\\') {
                sb.append('\\').appendCodePoint(cp);
            } else if (cp < 0x20 || cp == 0x7F) {
                sb.append("\\{").append(cp).append('}');
            } else {
                sb.appendCodePoint(cp);
            }
        });
        return sb.append('"').toString();
    }
}
