package com.erlfmt.algebra;

import java.util.Iterator;
import java.util.List;
import java.util.function.BinaryOperator;

/**
 * 文档代数的基本构造操作
 */
public final class Documents {

    private Documents() {}

    public static Document text(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }
        if (text.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("text must not contain line breaks: " + text);
        }
        return new Document.Text(text);
    }

    /**
     * n 列空白，与 {@link #combine} 组合时充当缩进
     */
    public static Document spaces(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("negative indentation: " + count);
        }
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append(' ');
        }
        return new Document.Text(sb.toString());
    }

    public static Document combine(Document left, Document right) {
        return new Document.Combine(left, right);
    }

    public static Document flush(Document content) {
        return new Document.Flush(content);
    }

    /**
     * 渲染时若 preferred 能在剩余宽度内排下则选它，否则选 fallback
     */
    public static Document choice(Document preferred, Document fallback) {
        return new Document.Choice(preferred, fallback);
    }

    public static Document singleLine(Document content) {
        return new Document.SingleLine(content);
    }

    /**
     * 用 combinator 从左到右两两折叠
     *
     * @throws IllegalArgumentException 文档列表为空
     */
    public static Document reduce(BinaryOperator<Document> combinator, List<Document> documents) {
        Iterator<Document> it = documents.iterator();
        if (!it.hasNext()) {
            throw new IllegalArgumentException("cannot reduce an empty document list");
        }
        Document result = it.next();
        while (it.hasNext()) {
            result = combinator.apply(result, it.next());
        }
        return result;
    }
}
