package de.bsommerfeld.retronews.render;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HtmlTokenizerTest {

    private static List<String> tokens(String html) {
        List<String> events = new ArrayList<>();
        HtmlTokenizer.tokenize(html, new TokenHandler() {
            @Override
            public void startTag(String name, Map<String, String> attributes, boolean selfClosing) {
                events.add("start:" + name + (attributes.isEmpty() ? "" : attributes) + (selfClosing ? "/" : ""));
            }

            @Override
            public void endTag(String name) {
                events.add("end:" + name);
            }

            @Override
            public void text(String data) {
                events.add("text:" + data);
            }
        });
        return events;
    }

    @Test
    void tokenize_shouldEmitTagsAndText() {
        assertEquals(List.of("start:p", "text:hello", "end:p"), tokens("<p>hello</p>"));
    }

    @Test
    void tokenize_shouldLowerCaseNames() {
        assertEquals(List.of("start:a{href=X}", "end:a"), tokens("<A HREF=\"X\"></A>"));
    }

    @Test
    void tokenize_shouldParseAttributeForms() {
        assertEquals(List.of("start:a{href=u, title=t, rel=x y, hidden=null}"),
                tokens("<a href=u title='t' rel=\"x y\" hidden>"));
    }

    @Test
    void tokenize_shouldDecodeEntitiesInAttributes() {
        assertEquals(List.of("start:a{href=/q?a=1&b=2}"), tokens("<a href=\"/q?a=1&amp;b=2\">"));
    }

    @Test
    void tokenize_shouldKeepTrailingSlashOfUnquotedValue() {
        assertEquals(List.of("start:a{href=http://x/}"), tokens("<a href=http://x/>"));
    }

    @Test
    void tokenize_shouldFlagSelfClosingTags() {
        assertEquals(List.of("text:a", "start:br/", "text:b"), tokens("a<br/>b"));
    }

    @Test
    void tokenize_shouldBufferDataAcrossComments() {
        assertEquals(List.of("text:a&b"), tokens("a&amp;<!-- c -->b"));
    }

    @Test
    void tokenize_shouldSkipDeclarationsAndProcessingInstructions() {
        assertEquals(List.of("text:x"), tokens("<!DOCTYPE html><?xml version=\"1.0\"?>x"));
    }

    @Test
    void tokenize_shouldTreatScriptContentAsRawText() {
        assertEquals(List.of("start:script", "text:if (a < b) &amp;", "end:script", "text:z"),
                tokens("<script>if (a < b) &amp;</script>z"));
    }

    @Test
    void tokenize_shouldNotEndRawTextOnLongerTagName() {
        assertEquals(List.of("start:script", "text:a</scriptx>b", "end:script"),
                tokens("<script>a</scriptx>b</script>"));
    }

    @Test
    void tokenize_shouldEndRawTextOnMixedCaseEndTag() {
        assertEquals(List.of("start:script", "text:x", "end:script", "text:y"),
                tokens("<script>x</SCRIPT >y"));
    }

    @Test
    void tokenize_shouldTreatUnterminatedCommentAsText() {
        assertEquals(List.of("text:a <!-- b"), tokens("a <!-- b"));
    }

    @Test
    void tokenize_shouldTreatEndTagWithoutNameAsText() {
        assertEquals(List.of("text:a </ b"), tokens("a </ b"));
    }

    @Test
    void tokenize_shouldIgnoreJunkInEndTag() {
        assertEquals(List.of("start:p", "end:p"), tokens("<p></p foo=\"bar\">"));
    }

    @Test
    void tokenize_shouldEmitNothingForEmptyInput() {
        assertTrue(tokens("").isEmpty());
    }
}
