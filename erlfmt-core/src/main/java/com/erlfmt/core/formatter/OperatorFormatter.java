package com.erlfmt.core.formatter;

import com.erlfmt.algebra.Document;
import com.erlfmt.core.ast.expr.BinaryOpExpr;
import com.erlfmt.core.ast.expr.Expression;
import com.erlfmt.core.ast.expr.UnaryOpExpr;
import com.erlfmt.core.formatter.OperatorTable.BinaryPrecedence;

import static com.erlfmt.algebra.Documents.*;
import static com.erlfmt.core.formatter.Combinators.*;

/**
 * 运算符表达式格式化：决定缩进、空格和最少的括号
 *
 * <p>一元运算符的二元操作数同样只按优先级加括号，因此 {@code catch A = B}
 * 原样输出，而不是写成 {@code catch (A = B)}。</p>
 */
class OperatorFormatter {

    final ExprFormatter formatter;
    private final int indent;

    OperatorFormatter(ExprFormatter formatter, int indent) {
        this.formatter = formatter;
        this.indent = indent;
    }

    // ============ 一元 ============

    Document unary(String operator, Expression operand) {
        Document opDoc = text(operator);
        Document operandDoc = unaryOperand(operator, operand);
        if (OperatorTable.isWordPrefix(operator)) {
            return combineSpace(opDoc, operandDoc);
        }
        return combine(opDoc, operandDoc);
    }

    private Document unaryOperand(String parent, Expression operand) {
        if (operand instanceof UnaryOpExpr) {
            UnaryOpExpr nested = (UnaryOpExpr) operand;
            String operator = nested.getOperator();
            // not not X、bnot bnot X 可以直接嵌套
            if (operator.equals(parent) && ("not".equals(operator) || "bnot".equals(operator))) {
                return unary(operator, nested.getOperand());
            }
            return wrapInParens(unary(operator, nested.getOperand()));
        }
        if (operand instanceof BinaryOpExpr) {
            BinaryOpExpr nested = (BinaryOpExpr) operand;
            BinaryPrecedence precedence = OperatorTable.binary(nested.getOperator());
            Document doc = binary(nested.getOperator(), nested.getLeft(), nested.getRight(), indent, precedence);
            // 只在优先级要求时加括号，catch 的任何二元操作数都不加：catch A = B
            if (precedence.getOperator() < OperatorTable.prefix(parent).getOperand()) {
                return wrapInParens(doc);
            }
            return doc;
        }
        return formatter.exprToDocument(operand);
    }

    // ============ 二元 ============

    Document binary(String operator, Expression left, Expression right) {
        return binary(operator, left, right, indent, OperatorTable.binary(operator));
    }

    /**
     * 左操作数沿用传入的缩进，右操作数的缩进由换行组合自身处理
     */
    private Document binary(String operator, Expression left, Expression right,
                            int propagated, BinaryPrecedence precedence) {
        Document opDoc = text(operator);
        Document leftDoc = binaryOperand(operator, left, propagated, precedence.getLeft());
        Document rightDoc = binaryOperand(operator, right, 0, precedence.getRight());
        Document leftOpDoc = combineSpace(leftDoc, opDoc);

        return choice(
                combineSpace(leftOpDoc, singleLine(rightDoc)),
                combineNewline(leftOpDoc, combine(spaces(propagated), rightDoc)));
    }

    private Document binaryOperand(String parent, Expression operand, int propagated, int slot) {
        if (operand instanceof UnaryOpExpr) {
            UnaryOpExpr nested = (UnaryOpExpr) operand;
            Document doc = unary(nested.getOperator(), nested.getOperand());
            return "catch".equals(nested.getOperator()) ? wrapInParens(doc) : doc;
        }
        if (!(operand instanceof BinaryOpExpr)) {
            return formatter.exprToDocument(operand);
        }

        BinaryOpExpr nested = (BinaryOpExpr) operand;
        String operator = nested.getOperator();
        BinaryPrecedence precedence = OperatorTable.binary(operator);

        if (operator.equals(parent)) {
            // 同一运算符位于结合方向一侧：展平成链
            if (precedence.chainsAt(slot)) {
                return binary(operator, nested.getLeft(), nested.getRight(), propagated, precedence);
            }
            return wrapInParens(binary(operator, nested.getLeft(), nested.getRight(), indent, precedence));
        }

        boolean needsParens = OperatorTable.requiresParens(parent)
                || (OperatorTable.isMixedBoolean(parent) && OperatorTable.isMixedBoolean(operator))
                || precedence.getOperator() < slot;
        Document doc = binary(operator, nested.getLeft(), nested.getRight(), indent, precedence);
        return needsParens ? wrapInParens(doc) : doc;
    }

    // ============ 最高优先级位置 ============

    /**
     * 运算符表达式总是加括号，其余表达式照常格式化
     */
    Document exprMax(Expression expression) {
        if (expression instanceof UnaryOpExpr) {
            UnaryOpExpr unary = (UnaryOpExpr) expression;
            return wrapInParens(unary(unary.getOperator(), unary.getOperand()));
        }
        if (expression instanceof BinaryOpExpr) {
            BinaryOpExpr binary = (BinaryOpExpr) expression;
            return wrapInParens(binary(binary.getOperator(), binary.getLeft(), binary.getRight()));
        }
        return formatter.exprToDocument(expression);
    }
}
