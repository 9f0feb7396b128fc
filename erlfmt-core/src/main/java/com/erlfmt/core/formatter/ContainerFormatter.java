package com.erlfmt.core.formatter;

import com.erlfmt.algebra.Document;
import com.erlfmt.algebra.Documents;
import com.erlfmt.core.ast.expr.*;

import java.util.ArrayList;
import java.util.List;

import static com.erlfmt.algebra.Documents.*;
import static com.erlfmt.core.formatter.Combinators.*;

/**
 * 容器格式化：元组、列表、cons 单元和二进制
 *
 * <p>非空容器在单行布局与每行一个元素的布局之间选择。</p>
 */
class ContainerFormatter {

    final ExprFormatter formatter;
    private final int indent;

    ContainerFormatter(ExprFormatter formatter, int indent) {
        this.formatter = formatter;
        this.indent = indent;
    }

    Document container(List<? extends Expression> elements, String open, String close) {
        if (elements.isEmpty()) {
            return text(open + close);
        }
        List<Document> docs = new ArrayList<>(elements.size());
        List<Document> flat = new ArrayList<>(elements.size());
        for (Expression element : elements) {
            Document doc = formatter.exprToDocument(element);
            docs.add(doc);
            flat.add(singleLine(doc));
        }

        Document horizontal = reduce(Combinators::combineCommaSpace, flat);
        Document vertical = reduce(Combinators::combineCommaNewline, docs);

        return choice(
                wrap(open, horizontal, close),
                wrapNested(open, vertical, close, indent));
    }

    /**
     * {@code Head | Tail}，括号由外层列表提供
     */
    Document cons(ConsExpr cons) {
        Document head = formatter.exprToDocument(cons.getHead());
        Document tail = combine(text("| "), formatter.exprToDocument(cons.getTail()));

        return choice(
                combineSpace(singleLine(head), singleLine(tail)),
                combineNewline(head, tail));
    }

    // ============ 二进制元素 ============

    Document binElement(BinElement element) {
        List<Document> docs = new ArrayList<>(3);
        docs.add(binValue(element.getValue()));
        if (element.hasSize()) {
            docs.add(combine(text(":"), formatter.operators.exprMax(element.getSize())));
        }
        if (element.hasTypes()) {
            List<Document> types = new ArrayList<>(element.getTypes().size());
            for (BinElement.TypeSpec type : element.getTypes()) {
                types.add(binType(type));
            }
            docs.add(combine(text("/"), reduce(Combinators::combineDash, types)));
        }
        return reduce(Documents::combine, docs);
    }

    // catch 以外的一元表达式可以直接出现在二进制元素中
    private Document binValue(Expression value) {
        if (value instanceof UnaryOpExpr && !"catch".equals(((UnaryOpExpr) value).getOperator())) {
            UnaryOpExpr unary = (UnaryOpExpr) value;
            return formatter.operators.unary(unary.getOperator(), unary.getOperand());
        }
        return formatter.operators.exprMax(value);
    }

    private Document binType(BinElement.TypeSpec type) {
        Document name = formatter.exprToDocument(type.getName());
        if (type.hasSize()) {
            return combineSeparated(name, ":", formatter.exprToDocument(type.getSize()));
        }
        return name;
    }
}
