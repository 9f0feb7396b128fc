package com.erlfmt.core.formatter;

/**
 * 转义序列规范化
 *
 * <p>源码游标与解码值游标同步推进：十六进制转义改为大写，八进制转义按原样保留，
 * {@code \s} 展开为空格，其余不必要的反斜杠被去掉。规范化后的字面量解码值不变。</p>
 */
public final class EscapeNormalizer {

    /** 字符字面量上下文：没有引号 */
    static final int NO_QUOTE = -1;

    private EscapeNormalizer() {}

    /**
     * 规范化带引号的原子或字符串
     *
     * @param text   包含首尾引号的原文
     * @param values 解码后的码点序列
     * @param quote  引号字符
     * @throws EscapeMismatchException 原文与解码值无法对齐
     */
    public static String normalizeQuoted(String text, int[] values, char quote) {
        int[] source = text.codePoints().toArray();
        if (source.length == 0 || source[0] != quote) {
            throw new EscapeMismatchException("Expected opening " + quote, text, 0);
        }
        StringBuilder out = new StringBuilder(text.length());
        out.append(quote);
        walk(text, source, 1, values, quote, out);
        return out.toString();
    }

    /**
     * 规范化字符字面量 {@code $} 之后的部分
     *
     * @param body  {@code $} 之后的原文
     * @param value 字符的码点
     */
    public static String normalizeChar(String body, int value) {
        int[] source = body.codePoints().toArray();
        StringBuilder out = new StringBuilder(body.length());
        walk(body, source, 0, new int[]{value}, NO_QUOTE, out);
        return out.toString();
    }

    private static void walk(String text, int[] source, int pos, int[] values, int quote, StringBuilder out) {
        int index = 0;
        while (index < values.length) {
            if (pos >= source.length) {
                throw new EscapeMismatchException("Source ended before decoded value", text, pos);
            }
            int c = source[pos];
            int value = values[index];
            if (c != '\\') {
                if (c != value) {
                    throw new EscapeMismatchException("Character does not match decoded value", text, pos);
                }
                appendPlain(out, c);
                pos++;
            } else {
                if (pos + 1 >= source.length) {
                    throw new EscapeMismatchException("Dangling backslash", text, pos);
                }
                int escape = source[pos + 1];
                if (escape == 'x') {
                    pos = copyHex(text, source, pos + 2, out);
                } else if (isOctal(escape)) {
                    pos = copyOctal(source, pos + 1, out);
                } else if (escape == '^') {
                    if (pos + 2 >= source.length) {
                        throw new EscapeMismatchException("Unterminated control escape", text, pos);
                    }
                    out.append("\\^").appendCodePoint(source[pos + 2]);
                    pos += 3;
                } else if (escape == 's') {
                    appendPlain(out, value);
                    pos += 2;
                } else if (escape == quote || escape == '\\' || escape != value) {
                    out.append('\\').appendCodePoint(escape);
                    pos += 2;
                } else {
                    appendPlain(out, escape);
                    pos += 2;
                }
            }
            index++;
        }

        String rest = new String(source, pos, source.length - pos);
        String expected = quote == NO_QUOTE ? "" : String.valueOf((char) quote);
        if (!rest.equals(expected)) {
            throw new EscapeMismatchException("Unexpected trailing source '" + rest + "'", text, pos);
        }
        out.append(rest);
    }

    // 换行不能出现在文档文本中，改写为 \n
    private static void appendPlain(StringBuilder out, int c) {
        if (c == '\n') {
            out.append("\\n");
        } else {
            out.appendCodePoint(c);
        }
    }

    private static int copyHex(String text, int[] source, int pos, StringBuilder out) {
        out.append("\\x");
        if (pos < source.length && source[pos] == '{') {
            int end = pos + 1;
            while (end < source.length && source[end] != '}') end++;
            if (end >= source.length) {
                throw new EscapeMismatchException("Unterminated hex escape", text, pos);
            }
            out.append('{').append(new String(source, pos + 1, end - pos - 1).toUpperCase()).append('}');
            return end + 1;
        }
        if (pos + 2 > source.length) {
            throw new EscapeMismatchException("Truncated hex escape", text, pos);
        }
        out.append(new String(source, pos, 2).toUpperCase());
        return pos + 2;
    }

    private static int copyOctal(int[] source, int pos, StringBuilder out) {
        out.append('\\').appendCodePoint(source[pos]);
        int end = pos + 1;
        while (end < source.length && end < pos + 3 && isOctal(source[end])) {
            out.appendCodePoint(source[end]);
            end++;
        }
        return end;
    }

    private static boolean isOctal(int c) {
        return c >= '0' && c <= '7';
    }
}
