package com.erlfmt.core.formatter;

/**
 * 转义规范化时源码与解码值无法同步推进
 */
public class EscapeMismatchException extends FormatException {
    private final String text;
    private final int offset;

    public EscapeMismatchException(String message, String text, int offset) {
        super(message);
        this.text = text;
        this.offset = offset;
    }

    /** 出错的字面量原文 */
    public String getText() {
        return text;
    }

    /** 出错位置（按码点计） */
    public int getOffset() {
        return offset;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " at offset " + offset + " in " + text;
    }
}
