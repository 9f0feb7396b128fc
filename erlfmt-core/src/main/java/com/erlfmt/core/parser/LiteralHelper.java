package com.erlfmt.core.parser;

import com.erlfmt.core.ast.SourceLocation;
import com.erlfmt.core.ast.expr.*;
import com.erlfmt.core.lexer.Token;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.erlfmt.core.lexer.TokenType.*;

/**
 * 字面量解析辅助类：把字面量 token 转为携带原文和值的节点
 */
class LiteralHelper {

    final Parser parser;

    LiteralHelper(Parser parser) {
        this.parser = parser;
    }

    boolean isLiteralStart() {
        return parser.checkAny(INTEGER, FLOAT, CHAR, ATOM, STRING);
    }

    Expression parseLiteral() {
        Token token = parser.advance();
        SourceLocation loc = parser.locationOf(token);
        switch (token.getType()) {
            case INTEGER:
                return new IntegerLiteral(loc, token.getLexeme(), (BigInteger) token.getLiteral());
            case FLOAT:
                return new FloatLiteral(loc, token.getLexeme(), (Double) token.getLiteral());
            case CHAR:
                return new CharLiteral(loc, token.getLexeme(), (Integer) token.getLiteral());
            case ATOM:
                return new AtomLiteral(loc, token.getLexeme(), (String) token.getLiteral());
            case STRING:
                return parseStrings(token, loc);
            default:
                throw parser.error("Expected literal", token);
        }
    }

    /**
     * 相邻的字符串字面量合并为拼接节点
     */
    private Expression parseStrings(Token first, SourceLocation loc) {
        StringLiteral head = new StringLiteral(loc, first.getLexeme(), (String) first.getLiteral());
        if (!parser.check(STRING)) {
            return head;
        }
        List<Expression> parts = new ArrayList<>();
        parts.add(head);
        while (parser.check(STRING)) {
            Token token = parser.advance();
            parts.add(new StringLiteral(parser.locationOf(token), token.getLexeme(), (String) token.getLiteral()));
        }
        return new ConcatExpr(loc, parts);
    }

    AtomLiteral parseAtom(String message) {
        Token token = parser.expect(ATOM, message);
        return new AtomLiteral(parser.locationOf(token), token.getLexeme(), (String) token.getLiteral());
    }
}
