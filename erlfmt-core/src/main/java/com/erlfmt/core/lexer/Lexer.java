package com.erlfmt.core.lexer;

import java.io.PrintStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 表达式子集的词法分析器
 *
 * <p>每个字面量 token 同时保留源码原文（lexeme）和解码后的值（literal）。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    private final PrintStream errStream;

    // 保留字映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 运算符
        map.put("div", TokenType.KW_DIV);
        map.put("rem", TokenType.KW_REM);
        map.put("band", TokenType.KW_BAND);
        map.put("bor", TokenType.KW_BOR);
        map.put("bxor", TokenType.KW_BXOR);
        map.put("bsl", TokenType.KW_BSL);
        map.put("bsr", TokenType.KW_BSR);
        map.put("bnot", TokenType.KW_BNOT);
        map.put("and", TokenType.KW_AND);
        map.put("or", TokenType.KW_OR);
        map.put("xor", TokenType.KW_XOR);
        map.put("not", TokenType.KW_NOT);
        map.put("andalso", TokenType.KW_ANDALSO);
        map.put("orelse", TokenType.KW_ORELSE);
        map.put("catch", TokenType.KW_CATCH);

        // 其他保留字
        for (String word : new String[] {
                "after", "begin", "case", "cond", "end", "fun", "if",
                "let", "of", "receive", "try", "when"}) {
            map.put(word, TokenType.KW_RESERVED);
        }

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 保留字作为原子时必须加引号 */
    public static boolean isReservedWord(String word) {
        return KEYWORDS.containsKey(word);
    }

    public Lexer(String source, String fileName) {
        this(source, fileName, System.err);
    }

    public Lexer(String source, String fileName, PrintStream errStream) {
        this.source = source;
        this.fileName = fileName;
        this.errStream = errStream;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getSource() {
        return source;
    }

    /**
     * 获取下一个 Token（流式接口）
     */
    public Token nextToken() {
        while (tokens.isEmpty()) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                return new Token(TokenType.EOF, "", null, line, column, current);
            }
            markStart();
            scanToken();
        }
        return tokens.remove(0);
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> result = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            result.add(token);
        } while (token.getType() != TokenType.EOF);
        return result;
    }

    private void markStart() {
        start = current;
        startLine = line;
        startColumn = column;
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t' || c == '\n') {
                advance();
            } else if (c == '%') {
                // 行注释
                while (!isAtEnd() && peek() != '\n') advance();
            } else {
                break;
            }
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case '|': addToken(TokenType.PIPE); break;
            case ':': addToken(TokenType.COLON); break;
            case '.': addToken(TokenType.DOT); break;
            case '!': addToken(TokenType.SEND); break;
            case '*': addToken(TokenType.STAR); break;

            case '+':
                addToken(match('+') ? TokenType.PLUS_PLUS : TokenType.PLUS);
                break;

            case '-':
                addToken(match('-') ? TokenType.MINUS_MINUS : TokenType.MINUS);
                break;

            case '/':
                addToken(match('=') ? TokenType.NE : TokenType.SLASH);
                break;

            case '=':
                if (match('=')) {
                    addToken(TokenType.EQ);
                } else if (peek() == ':' && peekNext() == '=') {
                    advance();
                    advance();
                    addToken(TokenType.EXACT_EQ);
                } else if (peek() == '/' && peekNext() == '=') {
                    advance();
                    advance();
                    addToken(TokenType.EXACT_NE);
                } else if (match('<')) {
                    addToken(TokenType.LE);
                } else {
                    addToken(TokenType.MATCH);
                }
                break;

            case '<':
                addToken(match('<') ? TokenType.BIN_OPEN : TokenType.LT);
                break;

            case '>':
                if (match('>')) {
                    addToken(TokenType.BIN_CLOSE);
                } else {
                    addToken(match('=') ? TokenType.GE : TokenType.GT);
                }
                break;

            case '$':
                character();
                break;

            case '\'':
                quoted('\'', TokenType.ATOM);
                break;

            case '"':
                quoted('"', TokenType.STRING);
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isLower(c)) {
                    atom();
                } else if (isUpper(c) || c == '_') {
                    variable();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private char peekAt(int distance) {
        if (current + distance >= source.length()) return '\0';
        return source.charAt(current + distance);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLower(char c) {
        return c >= 'a' && c <= 'z';
    }

    private static boolean isUpper(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isNameChar(char c) {
        return isLower(c) || isUpper(c) || isDigit(c) || c == '_' || c == '@';
    }

    private static boolean isOctalDigit(char c) {
        return c >= '0' && c <= '7';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, startLine, startColumn, start));
    }

    // === 复杂 Token 扫描 ===

    private void atom() {
        while (isNameChar(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) {
            addToken(TokenType.ATOM, text);
        } else {
            addToken(type);
        }
    }

    private void variable() {
        while (isNameChar(peek())) advance();
        addToken(TokenType.VARIABLE);
    }

    /**
     * 引号包裹的原子或字符串，允许跨行
     */
    private void quoted(char quote, TokenType type) {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\\') {
                advance();
                int escaped = escape();
                if (escaped < 0) return;
                value.appendCodePoint(escaped);
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            error(type == TokenType.ATOM ? "Unterminated quoted atom" : "Unterminated string");
            return;
        }

        advance(); // 闭合引号
        addToken(type, value.toString());
    }

    private void character() {
        if (isAtEnd()) {
            error("Unterminated character literal");
            return;
        }

        int value;
        if (peek() == '\\') {
            advance();
            value = escape();
            if (value < 0) return;
        } else {
            char high = advance();
            if (Character.isHighSurrogate(high) && Character.isLowSurrogate(peek())) {
                value = Character.toCodePoint(high, advance());
            } else {
                value = high;
            }
        }
        addToken(TokenType.CHAR, value);
    }

    /**
     * 解码反斜杠之后的转义序列
     *
     * @return 码点；出错时返回 -1（已报告错误）
     */
    private int escape() {
        if (isAtEnd()) {
            error("Unterminated escape sequence");
            return -1;
        }
        char c = advance();
        switch (c) {
            case 'b': return '\b';
            case 'd': return 0x7F;
            case 'e': return 0x1B;
            case 'f': return '\f';
            case 'n': return '\n';
            case 'r': return '\r';
            case 's': return ' ';
            case 't': return '\t';
            case 'v': return 0x0B;
            case 'x': return hexEscape();
            case '^':
                if (isAtEnd()) {
                    error("Unterminated control escape");
                    return -1;
                }
                return advance() & 0x1F;
            default:
                if (isOctalDigit(c)) {
                    int value = c - '0';
                    for (int i = 0; i < 2 && isOctalDigit(peek()); i++) {
                        value = value * 8 + (advance() - '0');
                    }
                    return value;
                }
                if (Character.isHighSurrogate(c) && Character.isLowSurrogate(peek())) {
                    return Character.toCodePoint(c, advance());
                }
                return c;
        }
    }

    private int hexEscape() {
        StringBuilder hex = new StringBuilder();
        if (match('{')) {
            while (isHexDigit(peek())) hex.append(advance());
            if (!match('}') || hex.length() == 0) {
                error("Invalid hex escape: \\x{" + hex);
                return -1;
            }
        } else {
            for (int i = 0; i < 2; i++) {
                if (!isHexDigit(peek())) {
                    error("Invalid hex escape: \\x" + hex);
                    return -1;
                }
                hex.append(advance());
            }
        }
        try {
            int value = Integer.parseInt(hex.toString(), 16);
            if (value > Character.MAX_CODE_POINT) {
                error("Hex escape out of range: \\x{" + hex + "}");
                return -1;
            }
            return value;
        } catch (NumberFormatException e) {
            error("Hex escape out of range: \\x{" + hex + "}");
            return -1;
        }
    }

    /** 移除数字中的下划线分隔符 */
    private static String stripUnderscores(String text) {
        return text.indexOf('_') >= 0 ? text.replace("_", "") : text;
    }

    /** 消耗十进制数字和位于数字之间的下划线 */
    private void advanceDigits() {
        while (isDigit(peek()) || (peek() == '_' && isDigit(peekNext()))) advance();
    }

    private void number() {
        advanceDigits();

        if (peek() == '#') {
            radixNumber();
        } else if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消费 .
            advanceDigits();

            // 指数部分
            if (peek() == 'e' || peek() == 'E') {
                char sign = peekNext();
                if (isDigit(sign) || ((sign == '+' || sign == '-') && isDigit(peekAt(2)))) {
                    advance();
                    if (peek() == '+' || peek() == '-') advance();
                    advanceDigits();
                }
            }

            String text = stripUnderscores(source.substring(start, current));
            try {
                addToken(TokenType.FLOAT, Double.parseDouble(text));
            } catch (NumberFormatException e) {
                error("Invalid float literal: " + source.substring(start, current));
            }
        } else {
            String text = stripUnderscores(source.substring(start, current));
            addToken(TokenType.INTEGER, new BigInteger(text));
        }
    }

    private void radixNumber() {
        String baseText = stripUnderscores(source.substring(start, current));
        int base = baseText.length() > 2 ? -1 : Integer.parseInt(baseText);
        if (base < 2 || base > 36) {
            advance(); // 消费 #
            error("Invalid radix: " + baseText);
            return;
        }
        advance(); // 消费 #
        int digitsStart = current;
        while (Character.digit(peek(), base) >= 0
                || (peek() == '_' && Character.digit(peekNext(), base) >= 0)) {
            advance();
        }
        if (current == digitsStart) {
            error("Missing digits after radix prefix: " + source.substring(start, current));
            return;
        }
        String digits = stripUnderscores(source.substring(digitsStart, current));
        addToken(TokenType.INTEGER, new BigInteger(digits, base));
    }

    private void error(String message) {
        String errorMsg = String.format("[%s:%d:%d] Lexer error: %s",
                fileName, startLine, startColumn, message);
        errStream.println(errorMsg);
        addToken(TokenType.ERROR, message);
    }
}
