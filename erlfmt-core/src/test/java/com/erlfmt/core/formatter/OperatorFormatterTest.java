package com.erlfmt.core.formatter;

import com.erlfmt.core.ast.SourceLocation;
import com.erlfmt.core.ast.expr.BinaryOpExpr;
import com.erlfmt.core.ast.expr.IntegerLiteral;
import com.erlfmt.core.ast.expr.UnaryOpExpr;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 运算符表达式格式化测试
 */
class OperatorFormatterTest {

    private final ErlangFormatter formatter = new ErlangFormatter();

    private String format(String source) {
        return formatter.formatExpression(source);
    }

    private static IntegerLiteral integer(int value) {
        return new IntegerLiteral(SourceLocation.UNKNOWN, String.valueOf(value), BigInteger.valueOf(value));
    }

    @Nested
    @DisplayName("同一运算符")
    class SameOperatorTests {

        @Test
        @DisplayName("左结合链不加括号")
        void testLeftChain() {
            assertEquals("1 + 2 + 3", format("1 + 2 + 3"));
            assertEquals("1 + 2 + 3", format("(1 + 2) + 3"));
            assertEquals("A bor B bor C", format("A bor B bor C"));
        }

        @Test
        @DisplayName("左结合运算符在右槽位需要括号")
        void testLeftAssociativeRightSlot() {
            assertEquals("1 - (2 - 3)", format("1 - (2 - 3)"));
            assertEquals("1 * (2 * 3)", format("1 * (2 * 3)"));
        }

        @Test
        @DisplayName("右结合链不加括号")
        void testRightChain() {
            assertEquals("A ++ B ++ C", format("A ++ (B ++ C)"));
            assertEquals("A = B = c", format("A = B = c"));
        }

        @Test
        @DisplayName("右结合运算符在左槽位需要括号")
        void testRightAssociativeLeftSlot() {
            assertEquals("(A ++ B) ++ C", format("(A ++ B) ++ C"));
            assertEquals("(A = B) = c", format("(A = B) = c"));
        }

        @Test
        @DisplayName("不可结合的比较运算符总是加括号")
        void testNonAssociative() {
            assertEquals("(A == B) == C", format("(A == B) == C"));
            assertEquals("A == (B == C)", format("A == (B == C)"));
        }
    }

    @Nested
    @DisplayName("不同运算符")
    class DifferentOperatorTests {

        @Test
        @DisplayName("优先级足够时不加括号")
        void testTighterChild() {
            assertEquals("1 + 2 * 3", format("1 + (2 * 3)"));
            assertEquals("1 * 2 + 3", format("(1 * 2) + 3"));
            assertEquals("1 - 2 + 3", format("(1 - 2) + 3"));
            assertEquals("A == B andalso C", format("(A == B) andalso C"));
        }

        @Test
        @DisplayName("优先级不够时加括号")
        void testLooserChild() {
            assertEquals("(1 + 2) * 3", format("(1 + 2) * 3"));
            assertEquals("1 + (2 - 3)", format("1 + (2 - 3)"));
            assertEquals("(A < B) == C", format("(A < B) == C"));
        }

        @Test
        @DisplayName("位运算和列表运算的子表达式总是加括号")
        void testRequireParens() {
            assertEquals("A bor (B * C)", format("A bor B * C"));
            assertEquals("A ++ (B + C)", format("A ++ B + C"));
            assertEquals("(A * B) bsl 2", format("A * B bsl 2"));
            assertEquals("A band bnot B", format("A band (bnot B)"));
        }

        @Test
        @DisplayName("布尔运算符混用时加括号")
        void testMixedBoolean() {
            assertEquals("A or (B and C)", format("A or B and C"));
            assertEquals("(A andalso B) orelse C", format("A andalso B orelse C"));
            assertEquals("A orelse B orelse C", format("A orelse B orelse C"));
            assertEquals("A xor B and C", format("A xor B and C"));
        }
    }

    @Nested
    @DisplayName("一元运算符")
    class UnaryTests {

        @Test
        @DisplayName("符号前缀不加空格，单词前缀加空格")
        void testSpacing() {
            assertEquals("-1", format("- 1"));
            assertEquals("+X", format("+ X"));
            assertEquals("not A", format("not A"));
            assertEquals("bnot 5", format("bnot 5"));
        }

        @Test
        @DisplayName("not 与 bnot 可以直接嵌套")
        void testNestableUnary() {
            assertEquals("not not A", format("not not A"));
            assertEquals("bnot bnot 1", format("bnot bnot 1"));
        }

        @Test
        @DisplayName("其他一元嵌套加括号")
        void testOtherNestedUnary() {
            assertEquals("-(-1)", format("- - 1"));
            assertEquals("not (-A)", format("not -A"));
            assertEquals("-(bnot 1)", format("-(bnot 1)"));
        }

        @Test
        @DisplayName("一元运算符的二元操作数只在优先级需要时加括号，catch A = B 不写成 catch (A = B)")
        void testBinaryOperand() {
            assertEquals("-(1 + 2)", format("-(1 + 2)"));
            assertEquals("not (A or B)", format("not (A or B)"));
            assertEquals("catch A = 1 + 2", format("catch A = 1 + 2"));
        }

        @Test
        @DisplayName("二元运算中的一元操作数不加括号，catch 除外")
        void testUnaryInBinary() {
            assertEquals("-1 + 2", format("-1 + 2"));
            assertEquals("1 - -1", format("1 - -1"));
            assertEquals("not A orelse B", format("not A orelse B"));
            assertEquals("X = (catch Y)", format("X = (catch Y)"));
            assertEquals("(catch X) + 1", format("(catch X) + 1"));
        }
    }

    @Nested
    @DisplayName("换行")
    class BreakTests {

        @Test
        @DisplayName("放不下时运算符留在行尾，后续操作数缩进")
        void testBreakLeftChain() {
            FormatConfig config = new FormatConfig();
            config.setMaxLineWidth(10);
            String out = new ErlangFormatter(config).formatExpression("Alpha + Beta + Gamma");
            assertEquals("Alpha +\n    Beta +\n    Gamma", out);
        }

        @Test
        @DisplayName("缩进宽度来自配置")
        void testConfiguredIndent() {
            FormatConfig config = new FormatConfig();
            config.setMaxLineWidth(10);
            config.setIndentSize(2);
            String out = new ErlangFormatter(config).formatExpression("Alpha + Beta + Gamma");
            assertEquals("Alpha +\n  Beta +\n  Gamma", out);
        }
    }

    @Nested
    @DisplayName("运算符表")
    class TableTests {

        @Test
        @DisplayName("未知的二元运算符")
        void testUnknownBinary() {
            BinaryOpExpr expr = new BinaryOpExpr(SourceLocation.UNKNOWN, "<=>", integer(1), integer(2));
            UnknownOperatorException e = assertThrows(UnknownOperatorException.class,
                    () -> new ExprFormatter().exprToDocument(expr));
            assertEquals("<=>", e.getOperator());
        }

        @Test
        @DisplayName("未知的前缀运算符")
        void testUnknownPrefix() {
            UnaryOpExpr expr = new UnaryOpExpr(SourceLocation.UNKNOWN, "~",
                    new BinaryOpExpr(SourceLocation.UNKNOWN, "+", integer(1), integer(2)));
            assertThrows(UnknownOperatorException.class, () -> new ExprFormatter().exprToDocument(expr));
        }

        @Test
        @DisplayName("优先级三元组")
        void testTriples() {
            assertEquals(400, OperatorTable.binary("+").getLeft());
            assertEquals(500, OperatorTable.binary("+").getRight());
            assertEquals(300, OperatorTable.binary("++").getRight());
            assertEquals(100, OperatorTable.prefix("catch").getOperand());
            assertTrue(OperatorTable.requiresParens("bor"));
            assertFalse(OperatorTable.requiresParens("xor"));
            assertTrue(OperatorTable.isMixedBoolean("andalso"));
        }
    }
}
