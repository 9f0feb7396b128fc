package com.erlfmt.core.ast;

/**
 * 源码区间
 *
 * <p>{@code line}/{@code column} 指向区间起点（从 1 开始）；
 * {@code start}/{@code end} 是源码中的半开偏移区间 {@code [start, end)}。
 * 顶层形式的区间从第一个 token 延伸到结尾的点。</p>
 */
public final class SourceLocation {
    private final String fileName;
    private final int line;
    private final int column;
    private final int start;
    private final int end;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0, 0);

    public SourceLocation(String fileName, int line, int column, int start, int end) {
        if (end < start) {
            throw new IllegalArgumentException("end " + end + " precedes start " + start);
        }
        this.fileName = fileName;
        this.line = line;
        this.column = column;
        this.start = start;
        this.end = end;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * 从本区间起点延伸到 {@code last} 终点的区间
     */
    public SourceLocation through(SourceLocation last) {
        return new SourceLocation(fileName, line, column, start, Math.max(end, last.end));
    }

    /** {@code file:line:column}，与 erlc 的诊断格式一致 */
    @Override
    public String toString() {
        return fileName + ":" + line + ":" + column;
    }
}
