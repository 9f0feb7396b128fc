package com.erlfmt.algebra;

/**
 * 与宽度无关的文档节点
 *
 * <p>文档只描述可能的排版方式，由 {@link DocumentRenderer} 在给定行宽下选出具体布局。
 * 节点不可变，可以在多个父节点之间共享。</p>
 */
public abstract class Document {

    Document() {
    }

    /** 不可断开的文本片段 */
    static final class Text extends Document {
        private final String text;

        Text(String text) {
            this.text = text;
        }

        String getText() {
            return text;
        }

        @Override
        public String toString() {
            return "text(\"" + text + "\")";
        }
    }

    /** 顺序拼接，右侧从左侧结束的列开始并悬挂缩进 */
    static final class Combine extends Document {
        private final Document left;
        private final Document right;

        Combine(Document left, Document right) {
            this.left = left;
            this.right = right;
        }

        Document getLeft() {
            return left;
        }

        Document getRight() {
            return right;
        }

        @Override
        public String toString() {
            return "combine(" + left + ", " + right + ")";
        }
    }

    /** 在内容之后强制换行 */
    static final class Flush extends Document {
        private final Document content;

        Flush(Document content) {
            this.content = content;
        }

        Document getContent() {
            return content;
        }

        @Override
        public String toString() {
            return "flush(" + content + ")";
        }
    }

    /** 渲染时二选一：优先 preferred，放不下时 fallback */
    static final class Choice extends Document {
        private final Document preferred;
        private final Document fallback;

        Choice(Document preferred, Document fallback) {
            this.preferred = preferred;
            this.fallback = fallback;
        }

        Document getPreferred() {
            return preferred;
        }

        Document getFallback() {
            return fallback;
        }

        @Override
        public String toString() {
            return "choice(" + preferred + ", " + fallback + ")";
        }
    }

    /** 只保留单行布局 */
    static final class SingleLine extends Document {
        private final Document content;

        SingleLine(Document content) {
            this.content = content;
        }

        Document getContent() {
            return content;
        }

        @Override
        public String toString() {
            return "single_line(" + content + ")";
        }
    }
}
