package com.erlfmt.core.formatter;

/**
 * 运算符不在优先级表中
 */
public class UnknownOperatorException extends FormatException {
    private final String operator;

    public UnknownOperatorException(String operator, String kind) {
        super("Unknown " + kind + " operator: " + operator);
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
