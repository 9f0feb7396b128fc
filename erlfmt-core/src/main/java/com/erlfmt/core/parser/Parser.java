package com.erlfmt.core.parser;

import com.erlfmt.core.ast.SourceLocation;
import com.erlfmt.core.ast.expr.Expression;
import com.erlfmt.core.lexer.Lexer;
import com.erlfmt.core.lexer.Token;
import com.erlfmt.core.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.erlfmt.core.lexer.TokenType.*;

/**
 * 表达式子集的语法分析器（递归下降）
 *
 * <p>源码中的括号只影响分组，不在树中保留。</p>
 */
public class Parser {

    final Lexer lexer;
    final String fileName;
    Token current;
    Token previous;

    // === Helper 实例 ===
    final LiteralHelper literalHelper = new LiteralHelper(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer, String fileName) {
        this.lexer = lexer;
        this.fileName = fileName;
        advance();  // 读取第一个 token
    }

    public Parser(Lexer lexer) {
        this(lexer, "<input>");
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        current = lexer.nextToken();
        return previous;
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        if (check(ERROR)) {
            throw lexicalError();
        }
        throw error(message, current, type.name());
    }

    ParseException lexicalError() {
        return error("Lexical error: " + current.getLiteral(), current, null);
    }

    ParseException error(String message, Token token) {
        return error(message, token, null);
    }

    ParseException error(String message, Token token, String expected) {
        return new ParseException(message, locationOf(token), token.describe(), expected);
    }

    /**
     * 创建当前 token 的源码位置
     */
    SourceLocation location() {
        return locationOf(current);
    }

    SourceLocation previousLocation() {
        return locationOf(previous);
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getEndOffset());
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    // ============ 入口 ============

    /**
     * 解析由若干 {@code Expr.} 组成的源码
     */
    public List<Form> parseForms() {
        List<Form> forms = new ArrayList<>();
        while (!isAtEnd()) {
            Token first = current;
            Expression expression = exprParser.parseExpression();
            Token dot = expect(DOT, "Expected '.' after form");
            SourceLocation span = locationOf(first).through(locationOf(dot));
            String text = lexer.getSource().substring(span.getStart(), span.getEnd());
            forms.add(new Form(expression, text, span));
        }
        return forms;
    }

    /**
     * 解析单个表达式，允许以 {@code .} 结尾
     */
    public Expression parseExpression() {
        Expression expression = exprParser.parseExpression();
        match(DOT);
        if (!isAtEnd()) {
            if (check(ERROR)) {
                throw lexicalError();
            }
            throw error("Unexpected token after expression", current, "EOF");
        }
        return expression;
    }

    /**
     * 便捷方法：解析单个表达式
     */
    public static Expression parse(String source) {
        return new Parser(new Lexer(source)).parseExpression();
    }
}
