package com.erlfmt.core.formatter;

import com.erlfmt.core.ast.AstPrinter;
import com.erlfmt.core.ast.SourceLocation;
import com.erlfmt.core.ast.expr.StringLiteral;
import com.erlfmt.core.lexer.Lexer;
import com.erlfmt.core.parser.Form;
import com.erlfmt.core.parser.ParseException;
import com.erlfmt.core.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ErlangFormatter 测试")
class ErlangFormatterTest {

    private static ErlangFormatter formatter(int width) {
        FormatConfig config = new FormatConfig();
        config.setMaxLineWidth(width);
        return new ErlangFormatter(config);
    }

    /** 每个形式的值树 */
    private static List<String> trees(String source) {
        AstPrinter printer = new AstPrinter();
        List<String> result = new ArrayList<>();
        for (Form form : new Parser(new Lexer(source, "<test>"), "<test>").parseForms()) {
            result.add(printer.print(form.getExpression()));
        }
        return result;
    }

    @Nested
    @DisplayName("输出布局")
    class LayoutTests {

        @Test
        @DisplayName("形式之间空一行，以换行结束")
        void testForms() {
            assertThat(new ErlangFormatter().format("X={1,2}.\nY=3 ."))
                    .isEqualTo("X = {1, 2}.\n\nY = 3.\n");
        }

        @Test
        @DisplayName("没有形式时输出为空")
        void testEmpty() {
            assertThat(new ErlangFormatter().format("% only a comment\n")).isEmpty();
        }

        @Test
        @DisplayName("规范化字面量")
        void testLiterals() {
            assertThat(new ErlangFormatter().format("[16#ff, 1.0E2, $ , 'hello', \"\\x{1f600}\"]."))
                    .isEqualTo("[16#FF, 1.0e2, $\\s, hello, \"\\x{1F600}\"].\n");
        }

        @Test
        @DisplayName("格式化后的形式不保留注释")
        void testCommentsDropped() {
            assertThat(new ErlangFormatter().format("A = \"x\" % c\n \"y\"."))
                    .isEqualTo("A = \"x\" \"y\".\n");
        }

        @Test
        @DisplayName("语法错误不被吞掉")
        void testParseError() {
            assertThatThrownBy(() -> new ErlangFormatter().format("1 + ."))
                    .isInstanceOf(ParseException.class);
        }
    }

    @Nested
    @DisplayName("逐形式隔离")
    class IsolationTests {

        @Test
        @DisplayName("失败的形式保留原文，其他形式照常格式化")
        void testFailingFormKeepsSource() {
            List<Form> forms = new ArrayList<>();
            forms.add(new Form(Parser.parse("{1,2}"), "{1,2}.", SourceLocation.UNKNOWN));
            // 原文与解码值不一致，转义规范化会失败
            forms.add(new Form(new StringLiteral(SourceLocation.UNKNOWN, "\"ab\"", "a"),
                    "\"ab\" .", SourceLocation.UNKNOWN));
            forms.add(new Form(Parser.parse("1+2"), "1+2.", SourceLocation.UNKNOWN));

            String out = new ErlangFormatter().formatForms(forms);

            assertThat(out).isEqualTo("{1, 2}.\n\n\"ab\" .\n\n1 + 2.\n");
        }

        @Test
        @DisplayName("单个表达式格式化失败时抛出 FormatException")
        void testFormatExpressionFails() {
            StringLiteral broken = new StringLiteral(SourceLocation.UNKNOWN, "\"ab\"", "a");
            assertThatThrownBy(() -> new ExprFormatter().exprToDocument(broken))
                    .isInstanceOf(FormatException.class);
        }
    }

    @Nested
    @DisplayName("幂等与保值")
    class PropertyTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "1 + 2 + 3.",
                "(1 + 2) + 3.",
                "1 - (2 - 3).",
                "A = B = {ok, [1, 2 | T]}.",
                "X = (catch foo) + 1.",
                "not not A andalso (B orelse C) andalso bnot bnot 1 == - - 2.",
                "Bin = <<X:8/integer-unit:8, (Y + 1):16/little, -1:8, \"abc\"/utf8>>.",
                "[16#ff, 2#1010, 1.5E-3, $ , $\\n, $\\101, 'Hello World', 'and', 'plain', \"a\\sb\\q\\x{1f600}\"].",
                "{alpha_value, [beta_value, gamma_value | Tail], <<delta>>, \"str\" \"ing\", {}}.",
                "A ++ B -- C ++ D.",
                "A bor B bxor C band D bsl 2.",
                "(A or B) and (C xor D).",
                "Result = case_value + very_long_operand_name * another_long_operand - third_operand_name."
        })
        @DisplayName("重新格式化得到相同文本，重新解析得到相同的树")
        void testIdempotentAndValuePreserving(String source) {
            for (int width : new int[]{100, 30, 12}) {
                ErlangFormatter formatter = formatter(width);
                String once = formatter.format(source);
                String twice = formatter.format(once);
                assertThat(twice).as("idempotent at width %d", width).isEqualTo(once);
                assertThat(trees(once)).as("value preserved at width %d", width).isEqualTo(trees(source));
            }
        }

        @Test
        @DisplayName("窄行宽下所有形式都保值")
        void testMultipleFormsNarrow() {
            String source = "{a, b}. [x, y, z]. <<1, 2, 3>>. A = 1 + 2 * 3.";
            String out = formatter(8).format(source);
            assertThat(trees(out)).isEqualTo(trees(source));
            assertThat(Arrays.asList(out.split("\n\n"))).hasSize(4);
        }
    }
}
