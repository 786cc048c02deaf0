package de.bsommerfeld.retronews.render;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextWrapperTest {

    // -- wrap --

    @Test
    void wrap_shouldFillLinesGreedily() {
        assertEquals(List.of("aaa bbb", "ccc"), TextWrapper.wrap("aaa bbb ccc", 7, ""));
    }

    @Test
    void wrap_shouldPutOverlongWordOnItsOwnLine() {
        assertEquals(List.of("a", "bbbbbbbbbb", "c"), TextWrapper.wrap("a bbbbbbbbbb c", 5, ""));
    }

    @Test
    void wrap_shouldNotSplitHyphenatedWords() {
        assertEquals(List.of("well-known", "fact"), TextWrapper.wrap("well-known fact", 8, ""));
    }

    @Test
    void wrap_shouldApplySubsequentIndentWithinWidth() {
        assertEquals(List.of("aaa bbb", "> ccc", "> ddd"), TextWrapper.wrap("aaa bbb ccc ddd", 7, "> "));
    }

    @Test
    void wrap_shouldExpandTabs() {
        assertEquals(List.of("a       b"), TextWrapper.wrap("a\tb", 20, ""));
    }

    @Test
    void wrap_shouldReturnNothingForBlankText() {
        assertTrue(TextWrapper.wrap("   ", 10, "").isEmpty());
    }

    @Test
    void wrap_shouldKeepLeadingWhitespaceOfFirstLine() {
        assertEquals(List.of(" x"), TextWrapper.wrap(" x", 10, ""));
    }

    // -- wrapParagraph --

    @Test
    void wrapParagraph_shouldKeepEmptyLine() {
        assertEquals(List.of(""), TextWrapper.wrapParagraph("", 10));
    }

    @Test
    void wrapParagraph_shouldLeaveCodeIndentedLinesAlone() {
        String code = "  for (int i = 0; i < n; i++) { total += values[i]; }";
        assertEquals(List.of(code), TextWrapper.wrapParagraph(code, 10));
    }

    @Test
    void wrapParagraph_shouldLeaveReferenceLinesAlone() {
        String reference = "[12]: https://example.com/some/long/path";
        assertEquals(List.of(reference), TextWrapper.wrapParagraph(reference, 10));
    }

    @Test
    void wrapParagraph_shouldWrapReferenceFollowedByText() {
        assertEquals(2, TextWrapper.wrapParagraph("[1] https://a.b and more", 18).size());
    }

    @Test
    void wrapParagraph_shouldRepeatQuotePrefix() {
        assertEquals(List.of("> one two", "> three"), TextWrapper.wrapParagraph("> one two three", 9));
    }

    @Test
    void wrapParagraph_shouldRepeatNestedQuotePrefix() {
        assertEquals(List.of("> > one", "> > two"), TextWrapper.wrapParagraph("> > one two", 8));
    }
}
