package com.erlfmt.algebra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.erlfmt.algebra.Documents.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * DocumentRenderer 单元测试
 */
class DocumentRendererTest {

    /** 先排 left，换行后再排 right */
    private static Document lines(String left, String right) {
        return combine(flush(text(left)), text(right));
    }

    @Nested
    @DisplayName("基本组合")
    class CombinatorTests {

        @Test
        @DisplayName("文本原样输出")
        void testText() {
            assertEquals("hello", DocumentRenderer.render(text("hello"), 80));
        }

        @Test
        @DisplayName("combine 在同一行连接")
        void testCombine() {
            assertEquals("abcd", DocumentRenderer.render(combine(text("ab"), text("cd")), 80));
        }

        @Test
        @DisplayName("flush 之后换行")
        void testFlush() {
            assertEquals("a\nb", DocumentRenderer.render(lines("a", "b"), 80));
        }

        @Test
        @DisplayName("右侧后续行悬挂在左侧结束的列")
        void testHangingIndent() {
            Document doc = combine(text("foo "), lines("a", "b"));
            assertEquals("foo a\n    b", DocumentRenderer.render(doc, 80));
        }

        @Test
        @DisplayName("spaces 与 combine 组合成缩进")
        void testSpacesIndent() {
            Document doc = combine(spaces(2), lines("x", "y"));
            assertEquals("  x\n  y", DocumentRenderer.render(doc, 80));
        }

        @Test
        @DisplayName("换行前去掉行尾空白")
        void testTrailingSpacesTrimmed() {
            Document doc = combine(flush(text("a ")), text("b"));
            assertEquals("a\nb", DocumentRenderer.render(doc, 80));
        }

        @Test
        @DisplayName("reduce 从左到右折叠")
        void testReduce() {
            Document doc = reduce((a, b) -> combine(a, combine(text(","), b)),
                    Arrays.asList(text("1"), text("2"), text("3")));
            assertEquals("1,2,3", DocumentRenderer.render(doc, 80));
        }
    }

    @Nested
    @DisplayName("choice 与行宽")
    class ChoiceTests {

        private final Document doc = choice(text("aaaa bbbb"), lines("aaaa", "bbbb"));

        @Test
        @DisplayName("放得下时选单行")
        void testPreferredFits() {
            assertEquals("aaaa bbbb", DocumentRenderer.render(doc, 20));
        }

        @Test
        @DisplayName("放不下时选换行方案")
        void testFallback() {
            assertEquals("aaaa\nbbbb", DocumentRenderer.render(doc, 5));
        }

        @Test
        @DisplayName("都放不下时选最窄的")
        void testNothingFits() {
            Document wide = choice(text("aaaaaaaaaa"), text("bbbbbbb"));
            assertEquals("bbbbbbb", DocumentRenderer.render(wide, 3));
        }

        @Test
        @DisplayName("singleLine 只保留单行方案")
        void testSingleLine() {
            Document flat = combine(text("x = "), singleLine(doc));
            assertEquals("x = aaaa bbbb", DocumentRenderer.render(flat, 20));
        }

        @Test
        @DisplayName("嵌套 choice 按整体宽度决定")
        void testNestedChoice() {
            Document inner = choice(text("b c"), lines("b", "c"));
            Document outer = choice(
                    combine(text("a "), singleLine(inner)),
                    combine(flush(text("a")), inner));
            assertEquals("a b c", DocumentRenderer.render(outer, 10));
            assertEquals("a\nb c", DocumentRenderer.render(outer, 3));
        }

        @Test
        @DisplayName("共享子文档只求值一次也能得到正确结果")
        void testSharedSubDocument() {
            Document shared = choice(text("x y"), lines("x", "y"));
            Document doc = combine(shared, combine(text(" "), shared));
            assertEquals("x y x y", DocumentRenderer.render(doc, 80));
        }
    }

    @Nested
    @DisplayName("错误处理")
    class ErrorTests {

        @Test
        @DisplayName("singleLine 包住必然换行的文档时没有布局")
        void testNoLayout() {
            Document doc = singleLine(lines("a", "b"));
            assertThrows(IllegalStateException.class, () -> DocumentRenderer.render(doc, 80));
        }

        @Test
        @DisplayName("非正行宽被拒绝")
        void testNonPositiveWidth() {
            assertThrows(IllegalArgumentException.class, () -> new DocumentRenderer(0));
        }

        @Test
        @DisplayName("文本不能包含换行")
        void testTextWithNewline() {
            assertThrows(IllegalArgumentException.class, () -> text("a\nb"));
        }

        @Test
        @DisplayName("负缩进被拒绝")
        void testNegativeSpaces() {
            assertThrows(IllegalArgumentException.class, () -> spaces(-1));
        }

        @Test
        @DisplayName("空列表不能 reduce")
        void testReduceEmpty() {
            assertThrows(IllegalArgumentException.class,
                    () -> reduce(Documents::combine, Collections.emptyList()));
        }
    }
}
