package com.erlfmt.core.parser;

import com.erlfmt.core.ast.SourceLocation;
import com.erlfmt.core.ast.expr.*;
import com.erlfmt.core.lexer.Token;
import com.erlfmt.core.lexer.TokenType;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.erlfmt.core.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>每个优先级一个方法，由低到高：catch、= !、orelse、andalso、比较、++ --、加法、乘法、前缀。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        if (parser.match(KW_CATCH)) {
            SourceLocation loc = parser.previousLocation();
            Expression operand = parseExpression();
            return new UnaryOpExpr(loc, "catch", operand);
        }
        return parseMatchExpr();
    }

    // 匹配 = 和发送 !（右结合）
    private Expression parseMatchExpr() {
        Expression left = parseOrelseExpr();

        if (parser.checkAny(MATCH, SEND)) {
            Token op = parser.advance();
            Expression right = parseMatchExpr();  // 右结合
            return new BinaryOpExpr(parser.locationOf(op), op.getLexeme(), left, right);
        }

        return left;
    }

    // orelse（右结合）
    private Expression parseOrelseExpr() {
        Expression left = parseAndalsoExpr();

        if (parser.check(KW_ORELSE)) {
            Token op = parser.advance();
            Expression right = parseOrelseExpr();
            return new BinaryOpExpr(parser.locationOf(op), op.getLexeme(), left, right);
        }

        return left;
    }

    // andalso（右结合）
    private Expression parseAndalsoExpr() {
        Expression left = parseComparisonExpr();

        if (parser.check(KW_ANDALSO)) {
            Token op = parser.advance();
            Expression right = parseAndalsoExpr();
            return new BinaryOpExpr(parser.locationOf(op), op.getLexeme(), left, right);
        }

        return left;
    }

    // 比较（不可结合）
    private Expression parseComparisonExpr() {
        Expression left = parseListOpExpr();

        if (parser.current.getType().isComparisonOp()) {
            Token op = parser.advance();
            Expression right = parseListOpExpr();
            if (parser.current.getType().isComparisonOp()) {
                throw parser.error("Comparison operators are not associative", parser.current);
            }
            return new BinaryOpExpr(parser.locationOf(op), op.getLexeme(), left, right);
        }

        return left;
    }

    // 列表运算 ++ --（右结合）
    private Expression parseListOpExpr() {
        Expression left = parseAdditiveExpr();

        if (parser.checkAny(PLUS_PLUS, MINUS_MINUS)) {
            Token op = parser.advance();
            Expression right = parseListOpExpr();
            return new BinaryOpExpr(parser.locationOf(op), op.getLexeme(), left, right);
        }

        return left;
    }

    // 加法级（左结合）
    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();

        while (parser.current.getType().isAdditiveOp()) {
            Token op = parser.advance();
            Expression right = parseMultiplicativeExpr();
            left = new BinaryOpExpr(parser.locationOf(op), op.getLexeme(), left, right);
        }

        return left;
    }

    // 乘法级（左结合）
    private Expression parseMultiplicativeExpr() {
        Expression left = parsePrefixExpr();

        while (parser.current.getType().isMultiplicativeOp()) {
            Token op = parser.advance();
            Expression right = parsePrefixExpr();
            left = new BinaryOpExpr(parser.locationOf(op), op.getLexeme(), left, right);
        }

        return left;
    }

    // 前缀 + - bnot not
    private Expression parsePrefixExpr() {
        if (parser.current.getType().isPrefixOp()) {
            Token op = parser.advance();
            Expression operand = parsePrefixExpr();
            return new UnaryOpExpr(parser.locationOf(op), op.getLexeme(), operand);
        }
        return parsePrimary();
    }

    // ============ 基本表达式 ============

    Expression parsePrimary() {
        if (parser.literalHelper.isLiteralStart()) {
            return parser.literalHelper.parseLiteral();
        }

        SourceLocation loc = parser.location();
        switch (parser.current.getType()) {
            case VARIABLE:
                return new Variable(loc, parser.advance().getLexeme());
            case LPAREN: {
                parser.advance();
                Expression inner = parseExpression();
                parser.expect(RPAREN, "Expected ')'");
                return inner;
            }
            case LBRACE:
                parser.advance();
                return new TupleExpr(loc, parseExpressionList(RBRACE, "Expected '}' to close tuple"));
            case LBRACKET:
                parser.advance();
                return parseList(loc);
            case BIN_OPEN:
                parser.advance();
                return parseBitstring(loc);
            case ERROR:
                throw parser.lexicalError();
            default:
                throw parser.error("Expected expression", parser.current);
        }
    }

    private List<Expression> parseExpressionList(TokenType close, String message) {
        List<Expression> elements = new ArrayList<>();
        if (!parser.check(close)) {
            do {
                elements.add(parseExpression());
            } while (parser.match(COMMA));
        }
        parser.expect(close, message);
        return elements;
    }

    /**
     * 列表，{@code [A, B | T]} 中最后一个元素与尾部组成 {@link ConsExpr}
     */
    private Expression parseList(SourceLocation loc) {
        List<Expression> elements = new ArrayList<>();
        if (!parser.check(RBRACKET)) {
            while (true) {
                Expression element = parseExpression();
                if (parser.match(PIPE)) {
                    Expression tail = parseExpression();
                    elements.add(new ConsExpr(element.getLocation(), element, tail));
                    break;
                }
                elements.add(element);
                if (!parser.match(COMMA)) break;
            }
        }
        parser.expect(RBRACKET, "Expected ']' to close list");
        return new ListExpr(loc, elements);
    }

    private Expression parseBitstring(SourceLocation loc) {
        List<BinElement> elements = new ArrayList<>();
        if (!parser.check(BIN_CLOSE)) {
            do {
                elements.add(parseBinElement());
            } while (parser.match(COMMA));
        }
        parser.expect(BIN_CLOSE, "Expected '>>' to close binary");
        return new BitstringExpr(loc, elements);
    }

    /**
     * 二进制元素：[前缀运算符] 基本表达式 [:大小] [/类型-类型...]
     */
    private BinElement parseBinElement() {
        SourceLocation loc = parser.location();
        Expression value;
        if (parser.current.getType().isPrefixOp()) {
            Token op = parser.advance();
            value = new UnaryOpExpr(parser.locationOf(op), op.getLexeme(), parsePrimary());
        } else {
            value = parsePrimary();
        }

        Expression size = null;
        if (parser.match(COLON)) {
            size = parsePrimary();
        }

        List<BinElement.TypeSpec> types = null;
        if (parser.match(SLASH)) {
            types = new ArrayList<>();
            do {
                AtomLiteral name = parser.literalHelper.parseAtom("Expected type specifier");
                Expression typeSize = null;
                if (parser.match(COLON)) {
                    Token token = parser.expect(INTEGER, "Expected integer after ':' in type specifier");
                    typeSize = new IntegerLiteral(parser.locationOf(token), token.getLexeme(),
                            (BigInteger) token.getLiteral());
                }
                types.add(new BinElement.TypeSpec(name, typeSize));
            } while (parser.match(MINUS));
        }

        return new BinElement(loc, value, size, types);
    }
}
