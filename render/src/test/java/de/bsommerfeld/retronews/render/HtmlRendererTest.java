package de.bsommerfeld.retronews.render;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behaviour of the full pipeline, driven through the public entry
 * point only.
 */
class HtmlRendererTest {

    private static final String LOREM = "Lorem ipsum dolor sit amet, consectetur adipiscing elit, "
            + "sed do eiusmod tempor incididunt ut labore et dolore magna aliqua. Ut enim ad "
            + "minim veniam, quis nostrud exercitation ullamco laboris nisi ut aliquip.";

    // -- Basics --

    @Test
    void render_shouldReturnEmptyStringForEmptyInput() {
        assertEquals("", HtmlRenderer.render(""));
    }

    @Test
    void render_shouldTrimShortParagraph() {
        assertEquals("Hello world", HtmlRenderer.render("<p>  Hello world  </p>"));
    }

    @Test
    void render_shouldKeepPlainTextWithoutMarkup() {
        assertEquals("just some text", HtmlRenderer.render("just some text"));
    }

    @Test
    void render_shouldSeparateParagraphsWithBlankLine() {
        assertEquals("first\n\nsecond\n\nthird", HtmlRenderer.render("first<p>second<p>third"));
    }

    @Test
    void render_shouldCollapseWhitespaceIdentically() {
        assertEquals(HtmlRenderer.render("<p>a b</p>"), HtmlRenderer.render("<p>a   \n  b</p>"));
    }

    @Test
    void render_shouldDecodeEntities() {
        assertEquals("Tom & Jerry <3 'quoted' \"x\"",
                HtmlRenderer.render("<p>Tom &amp; Jerry &lt;3 &#x27;quoted&#x27; &quot;x&quot;</p>"));
    }

    @Test
    void render_shouldStripControlCharacters() {
        assertEquals("abc", HtmlRenderer.render("<p>a\u0000b\u0007c</p>"));
    }

    @Test
    void render_shouldDropComments() {
        assertEquals("ab", HtmlRenderer.render("<p>a<!-- hidden -->b</p>"));
    }

    // -- Inline formatting --

    @Test
    void render_shouldMarkEmphasisStrongAndCode() {
        assertEquals("This is /very/ *important* and `x = 1`",
                HtmlRenderer.render("<p>This is <i>very</i> <b>important</b> and <code>x = 1</code></p>"));
    }

    @Test
    void render_shouldTreatEmAndStrongLikeIAndB() {
        assertEquals("/a/ *b*", HtmlRenderer.render("<em>a</em> <strong>b</strong>"));
    }

    @Test
    void render_shouldBreakLinesAtBr() {
        assertEquals("line one\nline two", HtmlRenderer.render("<p>line one<br>line two</p>"));
    }

    @Test
    void render_shouldHandleSelfClosingBr() {
        assertEquals("one\ntwo", HtmlRenderer.render("one <br/> two"));
    }

    // -- Links --

    @Test
    void render_shouldExpandShortenedLink() {
        assertEquals("https://example.com/foo/bar",
                HtmlRenderer.render("<a href=\"https://example.com/foo/bar\">https://example.com/foo...</a>"));
    }

    @Test
    void render_shouldPrintIdenticalLinkOnce() {
        assertEquals("see https://example.com",
                HtmlRenderer.render("see <a href=\"https://example.com\">https://example.com</a>"));
    }

    @Test
    void render_shouldAppendTargetToLinkText() {
        assertEquals("the site https://example.com",
                HtmlRenderer.render("<a href=\"https://example.com\">the site</a>"));
    }

    @Test
    void render_shouldKeepTextOfLinkWithoutHref() {
        assertEquals("plain", HtmlRenderer.render("<a name=\"x\">plain</a>"));
    }

    @Test
    void render_shouldKeepReferenceLineUnwrapped() {
        String url = "https://example.com/a/very/long/path/that/keeps/going/and/going/forever";
        String html = "<p>[0]: <a href=\"" + url + "\">" + url + "</a></p>";

        assertEquals("[0]: " + url, HtmlRenderer.render(html, 30));
    }

    // -- Wrapping --

    @Test
    void render_shouldWrapToWidth() {
        String rendered = HtmlRenderer.render("<p>" + LOREM + "</p>", 30);

        String[] lines = rendered.split("\n");
        assertTrue(lines.length > 1);
        for (String line : lines) {
            assertTrue(line.length() <= 30, "Line too long: " + line);
        }
        assertEquals(LOREM, String.join(" ", lines));
    }

    @Test
    void render_shouldNotBreakLongWords() {
        String word = "x".repeat(100);
        assertEquals(word, HtmlRenderer.render("<p>" + word + "</p>", 20));
    }

    @Test
    void render_shouldRepeatQuotePrefixOnContinuationLines() {
        String rendered = HtmlRenderer.render("<p>&gt;&gt;" + LOREM + "</p>", 40);

        String[] lines = rendered.split("\n");
        assertTrue(lines.length > 2);
        for (String line : lines) {
            assertTrue(line.startsWith(">>"), "Missing quote prefix: " + line);
            assertFalse(line.startsWith("> >"));
        }
    }

    // -- Blocks --

    @Test
    void render_shouldJoinListItemsWithoutBlankLine() {
        assertEquals("- A\n- B", HtmlRenderer.render("<ul><li>A</li><li>B</li></ul>"));
    }

    @Test
    void render_shouldIgnoreWhitespaceBetweenListItems() {
        assertEquals("- A\n- B", HtmlRenderer.render("<ul>\n  <li>A</li>\n  <li>B</li>\n</ul>"));
    }

    @Test
    void render_shouldHangIndentWrappedListItem() {
        assertEquals("- aaa bbb\n  ccc ddd", HtmlRenderer.render("<ol><li>aaa bbb ccc ddd</li></ol>", 9));
    }

    @Test
    void render_shouldPrefixBlockquoteLines() {
        assertEquals("> quoted text\n\nreply",
                HtmlRenderer.render("<blockquote><p>quoted text</p></blockquote><p>reply</p>"));
    }

    @Test
    void render_shouldNestBlockquotePrefixes() {
        assertEquals("> > deep", HtmlRenderer.render("<blockquote><blockquote>deep</blockquote></blockquote>"));
    }

    @Test
    void render_shouldNarrowBlockquoteContent() {
        String rendered = HtmlRenderer.render("<blockquote>" + LOREM + "</blockquote>", 30);

        for (String line : rendered.split("\n")) {
            assertTrue(line.startsWith("> "));
            assertTrue(line.length() <= 30, "Line too long: " + line);
        }
    }

    @Test
    void render_shouldKeepPreformattedCodeVerbatim() {
        String html = "<pre><code>def f():\n    return 1\n\n  x = 2\n</code></pre>";

        assertEquals("| def f():\n|     return 1\n| \n|   x = 2", HtmlRenderer.render(html));
    }

    @Test
    void render_shouldNotWrapPreformattedLines() {
        String longLine = "y".repeat(20) + " " + "z".repeat(20);
        assertEquals("| " + longLine, HtmlRenderer.render("<pre>" + longLine + "</pre>", 20));
    }

    @Test
    void render_shouldDrawHorizontalRuleAcrossWidth() {
        assertEquals("a\n\n----------\n\nb", HtmlRenderer.render("<p>a</p><hr><p>b</p>", 10));
    }

    // -- Malformed input --

    @Test
    void render_shouldSurviveUnclosedTagsAndUnknownElements() {
        assertEquals("unclosedtext", HtmlRenderer.render("<p>unclosed<div>text"));
    }

    @Test
    void render_shouldIgnoreUnmatchedClosingTags() {
        assertEquals("hello", assertDoesNotThrow(() -> HtmlRenderer.render("</p></blockquote>hello</i>")));
    }

    @Test
    void render_shouldCloseOutOfOrderTags() {
        assertEquals("*/bold italic/* after", HtmlRenderer.render("<b><i>bold italic</b></i> after"));
    }

    @Test
    void render_shouldTreatStrayLessThanAsText() {
        assertEquals("a < b and c <", HtmlRenderer.render("a < b and c <"));
    }

    @Test
    void render_shouldKeepUnterminatedTagAsText() {
        assertEquals("text <a href=\"x", HtmlRenderer.render("text <a href=\"x"));
    }

    @Test
    void render_shouldSurviveDeepNesting() {
        String html = "<blockquote>".repeat(60) + "deep" + "</blockquote>".repeat(60);
        assertTrue(assertDoesNotThrow(() -> HtmlRenderer.render(html)).contains("deep"));
    }

    @Test
    void render_shouldSurviveVeryDeepInlineNesting() {
        String html = "<b>".repeat(10000) + "x" + "</b>".repeat(10000);

        String text = assertDoesNotThrow(() -> HtmlRenderer.render(html));
        assertEquals("x", text.replace("*", ""));
    }

    @Test
    void render_shouldSurviveVeryDeepBlockNesting() {
        String html = "<blockquote>".repeat(10000) + "x" + "</blockquote>".repeat(10000);

        String text = assertDoesNotThrow(() -> HtmlRenderer.render(html));
        assertTrue(text.startsWith("> "));
        assertTrue(text.contains("x"));
    }

    @Test
    void render_shouldCollapseNonBreakingSpaces() {
        assertEquals("a b", HtmlRenderer.render("<p>a&nbsp;&nbsp; b</p>"));
    }

    // -- Contract --

    @Test
    void render_shouldRejectNonPositiveWidth() {
        assertThrows(IllegalArgumentException.class, () -> HtmlRenderer.render("<p>x</p>", 0));
    }

    @Test
    void render_shouldRejectNullInput() {
        assertThrows(NullPointerException.class, () -> HtmlRenderer.render(null));
    }
}
