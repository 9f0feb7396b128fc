package com.erlfmt.core.lexer;

/**
 * 词法单元
 *
 * <p>lexeme 是源码中的原始片段；字面量的解码值保存在 literal 中：
 * INTEGER 为 {@link java.math.BigInteger}，FLOAT 为 {@link Double}，
 * CHAR 为码点 {@link Integer}，ATOM 与 STRING 为解码后的 {@link String}，
 * ERROR 为错误描述。</p>
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    /** 源码中紧随该 token 之后的偏移 */
    public int getEndOffset() {
        return offset + lexeme.length();
    }

    /**
     * 诊断信息中的写法，仿照 erl_parse 的 "syntax error before: ..."
     */
    public String describe() {
        switch (type) {
            case EOF:
                return "end of input";
            case DOT:
                return "'.'";
            case STRING:
                return lexeme;
            default:
                return "'" + lexeme + "'";
        }
    }

    @Override
    public String toString() {
        return type + " " + describe() + " at " + line + ":" + column;
    }
}
