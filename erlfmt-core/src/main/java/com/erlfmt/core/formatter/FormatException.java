package com.erlfmt.core.formatter;

/**
 * 格式化异常基类
 *
 * <p>表示格式化器自身的内部故障，而非输入的语法错误。</p>
 */
public class FormatException extends RuntimeException {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
