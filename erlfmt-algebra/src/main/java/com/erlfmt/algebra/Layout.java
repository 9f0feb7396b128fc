package com.erlfmt.algebra;

/**
 * 一种具体排版方案及其度量
 *
 * <p>度量都相对于布局自身的起始列：height 为换行次数，maxWidth 为最宽行，
 * lastWidth 为最后一行的宽度。</p>
 */
final class Layout {
    private final int height;
    private final int maxWidth;
    private final int lastWidth;
    private final Node node;

    private Layout(int height, int maxWidth, int lastWidth, Node node) {
        this.height = height;
        this.maxWidth = maxWidth;
        this.lastWidth = lastWidth;
        this.node = node;
    }

    static Layout text(String text) {
        int width = text.codePointCount(0, text.length());
        return new Layout(0, width, width, new TextNode(text));
    }

    static Layout combine(Layout left, Layout right) {
        return new Layout(
                left.height + right.height,
                Math.max(left.maxWidth, left.lastWidth + right.maxWidth),
                left.lastWidth + right.lastWidth,
                new CombineNode(left.node, right.node));
    }

    static Layout flush(Layout content) {
        return new Layout(content.height + 1, content.maxWidth, 0, new FlushNode(content.node));
    }

    int getHeight() {
        return height;
    }

    int getMaxWidth() {
        return maxWidth;
    }

    int getLastWidth() {
        return lastWidth;
    }

    /** 各项度量都不差于 other */
    boolean dominates(Layout other) {
        return height <= other.height
                && maxWidth <= other.maxWidth
                && lastWidth <= other.lastWidth;
    }

    String print() {
        Printer printer = new Printer();
        node.print(printer, 0);
        return printer.toString();
    }

    // ============ 布局树 ============

    private interface Node {
        void print(Printer printer, int indent);
    }

    private static final class TextNode implements Node {
        private final String text;

        TextNode(String text) {
            this.text = text;
        }

        @Override
        public void print(Printer printer, int indent) {
            printer.append(text);
        }
    }

    private static final class CombineNode implements Node {
        private final Node left;
        private final Node right;

        CombineNode(Node left, Node right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public void print(Printer printer, int indent) {
            left.print(printer, indent);
            // 右侧后续行悬挂在左侧结束的列
            right.print(printer, printer.column());
        }
    }

    private static final class FlushNode implements Node {
        private final Node content;

        FlushNode(Node content) {
            this.content = content;
        }

        @Override
        public void print(Printer printer, int indent) {
            content.print(printer, indent);
            printer.newLine(indent);
        }
    }

    /**
     * 输出缓冲区，行首缩进延迟到写入文本时才输出，避免行尾空白
     */
    private static final class Printer {
        private final StringBuilder output = new StringBuilder();
        private int column = 0;
        private int pendingIndent = 0;

        void append(String text) {
            if (text.isEmpty()) return;
            if (pendingIndent > 0) {
                for (int i = 0; i < pendingIndent; i++) {
                    output.append(' ');
                }
                pendingIndent = 0;
            }
            output.append(text);
            column += text.codePointCount(0, text.length());
        }

        void newLine(int indent) {
            // 空白行不保留缩进
            trimTrailingSpaces();
            output.append('\n');
            column = indent;
            pendingIndent = indent;
        }

        int column() {
            return column;
        }

        private void trimTrailingSpaces() {
            int len = output.length();
            while (len > 0 && output.charAt(len - 1) == ' ') {
                len--;
            }
            output.setLength(len);
        }

        @Override
        public String toString() {
            return output.toString();
        }
    }
}
