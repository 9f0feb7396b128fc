package com.erlfmt.core.formatter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LiteralFormatter 单元测试
 */
class LiteralFormatterTest {

    @Nested
    @DisplayName("数字")
    class NumberTests {

        @Test
        @DisplayName("基数整数的数字部分转为大写")
        void testRadixInteger() {
            assertEquals("16#FF", LiteralFormatter.formatInteger("16#ff"));
            assertEquals("36#ZZ_Z", LiteralFormatter.formatInteger("36#zz_z"));
            assertEquals("2#1010", LiteralFormatter.formatInteger("2#1010"));
        }

        @Test
        @DisplayName("十进制整数保持不变")
        void testDecimalInteger() {
            assertEquals("1_000", LiteralFormatter.formatInteger("1_000"));
            assertEquals("42", LiteralFormatter.formatInteger("42"));
        }

        @Test
        @DisplayName("浮点数小数点之后转为小写")
        void testFloat() {
            assertEquals("1.0e2", LiteralFormatter.formatFloat("1.0E2"));
            assertEquals("1.5e-3", LiteralFormatter.formatFloat("1.5E-3"));
            assertEquals("3.14", LiteralFormatter.formatFloat("3.14"));
        }
    }

    @Nested
    @DisplayName("字符")
    class CharTests {

        @Test
        @DisplayName("空格总是写作 $\\s")
        void testSpace() {
            assertEquals("$\\s", LiteralFormatter.formatChar("$ ", ' '));
            assertEquals("$\\s", LiteralFormatter.formatChar("$\\s", ' '));
            assertEquals("$\\s", LiteralFormatter.formatChar("$\\040", ' '));
            assertEquals("$\\s", LiteralFormatter.formatChar("$\\x20", ' '));
        }

        @Test
        @DisplayName("其他字符规范化转义")
        void testOtherChars() {
            assertEquals("$a", LiteralFormatter.formatChar("$a", 'a'));
            assertEquals("$\\n", LiteralFormatter.formatChar("$\\n", '\n'));
            assertEquals("$q", LiteralFormatter.formatChar("$\\q", 'q'));
            assertEquals("$\\xFF", LiteralFormatter.formatChar("$\\xff", 0xFF));
            assertEquals("$\\\\", LiteralFormatter.formatChar("$\\\\", '\\'));
        }
    }

    @Nested
    @DisplayName("原子")
    class AtomTests {

        @Test
        @DisplayName("裸标识符不加引号")
        void testBare() {
            assertEquals("hello", LiteralFormatter.formatAtom("hello", "hello"));
            assertEquals("node@host", LiteralFormatter.formatAtom("node@host", "node@host"));
            assertEquals("hello", LiteralFormatter.formatAtom("'hello'", "hello"));
        }

        @Test
        @DisplayName("需要引号的原子保留引号")
        void testQuoted() {
            assertEquals("'Hello'", LiteralFormatter.formatAtom("'Hello'", "Hello"));
            assertEquals("'hello world'", LiteralFormatter.formatAtom("'hello world'", "hello world"));
            assertEquals("'hello world'", LiteralFormatter.formatAtom("'hello\\sworld'", "hello world"));
            assertEquals("'_x'", LiteralFormatter.formatAtom("'_x'", "_x"));
            assertEquals("''", LiteralFormatter.formatAtom("''", ""));
        }

        @Test
        @DisplayName("保留字必须加引号")
        void testReserved() {
            assertEquals("'and'", LiteralFormatter.formatAtom("'and'", "and"));
            assertEquals("'case'", LiteralFormatter.formatAtom("'case'", "case"));
            assertTrue(LiteralFormatter.needsQuotes("receive"));
            assertFalse(LiteralFormatter.needsQuotes("a_B@9"));
        }
    }

    @Nested
    @DisplayName("字符串")
    class StringTests {

        @Test
        @DisplayName("十六进制转义转为大写")
        void testHex() {
            String value = new String(Character.toChars(0x1F600));
            assertEquals("\"\\x{1F600}\"", LiteralFormatter.formatString("\"\\x{1f600}\"", value));
        }

        @Test
        @DisplayName("去掉不必要的转义")
        void testRedundant() {
            assertEquals("\"c d\"", LiteralFormatter.formatString("\"\\c\\sd\"", "c d"));
        }
    }
}
