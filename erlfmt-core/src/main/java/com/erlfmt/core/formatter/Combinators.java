package com.erlfmt.core.formatter;

import com.erlfmt.algebra.Document;

import static com.erlfmt.algebra.Documents.*;

/**
 * 格式化器共用的文档组合方式
 */
final class Combinators {

    private Combinators() {}

    static Document combineSpace(Document left, Document right) {
        return combineSeparated(left, " ", right);
    }

    static Document combineCommaSpace(Document left, Document right) {
        return combineSeparated(left, ", ", right);
    }

    static Document combineDash(Document left, Document right) {
        return combineSeparated(left, "-", right);
    }

    static Document combineSeparated(Document left, String separator, Document right) {
        return combine(left, combine(text(separator), right));
    }

    /** left 之后换行，right 从下一行开始 */
    static Document combineNewline(Document left, Document right) {
        return combine(flush(left), right);
    }

    /** left 后跟逗号并换行 */
    static Document combineCommaNewline(Document left, Document right) {
        return combine(flush(combine(left, text(","))), right);
    }

    static Document wrap(String open, Document content, String close) {
        return combine(text(open), combine(content, text(close)));
    }

    static Document wrapInParens(Document content) {
        return wrap("(", content, ")");
    }

    /**
     * 开括号独占一行，内容缩进 indent 列，闭括号独占一行
     */
    static Document wrapNested(String open, Document content, String close, int indent) {
        Document nested = combine(spaces(indent), content);
        return combineNewline(text(open), combineNewline(nested, text(close)));
    }
}
