package com.erlfmt.core.formatter;

import com.erlfmt.core.lexer.Lexer;

import java.util.Locale;

/**
 * 字面量规范化
 */
public final class LiteralFormatter {

    private LiteralFormatter() {}

    /**
     * 整数：{@code Radix#Digits} 形式只把数字部分转为大写，十进制原样保留
     */
    public static String formatInteger(String text) {
        int hash = text.indexOf('#');
        if (hash < 0) {
            return text;
        }
        return text.substring(0, hash + 1) + text.substring(hash + 1).toUpperCase(Locale.ROOT);
    }

    /**
     * 浮点数：第一个小数点之后的部分（小数位和指数标记）转为小写
     */
    public static String formatFloat(String text) {
        int dot = text.indexOf('.');
        if (dot < 0) {
            return text;
        }
        return text.substring(0, dot + 1) + text.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * 字符：空格总是写作 {@code $\s}
     */
    public static String formatChar(String text, int value) {
        if (value == ' ') {
            return "$\\s";
        }
        if (text.isEmpty() || text.charAt(0) != '$') {
            throw new EscapeMismatchException("Expected '$'", text, 0);
        }
        return "$" + EscapeNormalizer.normalizeChar(text.substring(1), value);
    }

    /**
     * 原子：保留字或不是裸标识符时加单引号，否则输出原子名本身
     */
    public static String formatAtom(String text, String name) {
        if (needsQuotes(name)) {
            return EscapeNormalizer.normalizeQuoted(text, name.codePoints().toArray(), '\'');
        }
        return name;
    }

    public static String formatString(String text, String value) {
        return EscapeNormalizer.normalizeQuoted(text, value.codePoints().toArray(), '"');
    }

    /**
     * 原子是否必须加引号
     */
    public static boolean needsQuotes(String name) {
        if (Lexer.isReservedWord(name)) {
            return true;
        }
        if (name.isEmpty()) {
            return true;
        }
        char first = name.charAt(0);
        if (first < 'a' || first > 'z') {
            return true;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean bare = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                    || (c >= '0' && c <= '9') || c == '_' || c == '@';
            if (!bare) {
                return true;
            }
        }
        return false;
    }
}
