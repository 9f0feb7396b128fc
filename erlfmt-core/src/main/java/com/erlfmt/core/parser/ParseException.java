package com.erlfmt.core.parser;

import com.erlfmt.core.ast.SourceLocation;

/**
 * 解析异常
 *
 * <p>消息形如 {@code file:line:column: 原因, syntax error before: 'x'}，
 * 位置指向出错的 token。</p>
 */
public class ParseException extends RuntimeException {
    private final SourceLocation location;
    private final String found;
    private final String expected;

    public ParseException(String message, SourceLocation location, String found, String expected) {
        super(message);
        this.location = location;
        this.found = found;
        this.expected = expected;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 期望的 token 类型，无明确期望时为 null */
    public String getExpected() {
        return expected;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(location).append(": ").append(super.getMessage());
        sb.append(", syntax error before: ").append(found);
        if (expected != null) {
            sb.append(" (expected ").append(expected).append(')');
        }
        return sb.toString();
    }
}
