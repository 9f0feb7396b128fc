package com.erlfmt.core.lexer;

/**
 * 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INTEGER,
    FLOAT,
    CHAR,
    ATOM,
    STRING,

    // === 标识符 ===
    VARIABLE,

    // === 括号 ===
    LPAREN, RPAREN,         // ( )
    LBRACE, RBRACE,         // { }
    LBRACKET, RBRACKET,     // [ ]
    BIN_OPEN, BIN_CLOSE,    // << >>

    // === 分隔符 ===
    COMMA,                  // ,
    PIPE,                   // |
    COLON,                  // :
    DOT,                    // 形式结束符 .

    // === 运算符 ===
    MATCH,                  // =
    SEND,                   // !
    EQ,                     // ==
    NE,                     // /=
    LE,                     // =<
    LT,                     // <
    GE,                     // >=
    GT,                     // >
    EXACT_EQ,               // =:=
    EXACT_NE,               // =/=
    PLUS_PLUS,              // ++
    MINUS_MINUS,            // --
    PLUS,                   // +
    MINUS,                  // -
    STAR,                   // *
    SLASH,                  // /

    // === 关键词运算符 ===
    KW_DIV, KW_REM,
    KW_BAND, KW_BOR, KW_BXOR, KW_BSL, KW_BSR, KW_BNOT,
    KW_AND, KW_OR, KW_XOR, KW_NOT,
    KW_ANDALSO, KW_ORELSE,
    KW_CATCH,

    // === 其他保留字（表达式子集中不出现） ===
    KW_RESERVED,

    // === 特殊 ===
    EOF,
    ERROR;

    /** 是否为 {@code ==} 等比较运算符 */
    public boolean isComparisonOp() {
        switch (this) {
            case EQ:
            case NE:
            case LE:
            case LT:
            case GE:
            case GT:
            case EXACT_EQ:
            case EXACT_NE:
                return true;
            default:
                return false;
        }
    }

    /** 是否为加法级左结合运算符 */
    public boolean isAdditiveOp() {
        switch (this) {
            case PLUS:
            case MINUS:
            case KW_BOR:
            case KW_BXOR:
            case KW_BSL:
            case KW_BSR:
            case KW_OR:
            case KW_XOR:
                return true;
            default:
                return false;
        }
    }

    /** 是否为乘法级左结合运算符 */
    public boolean isMultiplicativeOp() {
        switch (this) {
            case STAR:
            case SLASH:
            case KW_DIV:
            case KW_REM:
            case KW_BAND:
            case KW_AND:
                return true;
            default:
                return false;
        }
    }

    /** 是否为前缀运算符（不含 catch） */
    public boolean isPrefixOp() {
        switch (this) {
            case PLUS:
            case MINUS:
            case KW_BNOT:
            case KW_NOT:
                return true;
            default:
                return false;
        }
    }
}
