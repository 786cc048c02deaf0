package de.bsommerfeld.retronews.render;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InlineFlattenerTest {

    private static NodeTree flattened(String html) {
        NodeTree tree = TreeBuilder.build(html);
        InlineFlattener.flatten(tree);
        return tree;
    }

    // -- Tree shape --

    @Test
    void flatten_shouldLeaveOnlyBlockAndTextNodes() {
        NodeTree tree = flattened("<p>a <b>b <i>c</i></b> <a href=\"u\">d</a><br>e</p><ul><li><code>x</code></li></ul>");

        for (int id = 0; id < tree.size(); id++) {
            Tag tag = tree.node(id).tag;
            assertTrue(tag.isBlock() || tag == Tag.TEXT, "Unexpected tag " + tag);
        }
    }

    @Test
    void flatten_shouldJoinManyInlineSiblingsInOrder() {
        NodeTree tree = flattened("<b>" + "<i>x</i>".repeat(20000) + "</b>");

        int b = tree.children(NodeTree.ROOT).get(0);
        assertEquals(Tag.TEXT, tree.node(b).tag);
        assertEquals("*" + "/x/".repeat(20000) + "*", tree.node(b).text.plainText());
    }

    @Test
    void flatten_shouldCompactDetachedNodes() {
        NodeTree tree = flattened("<b><i><code>x</code></i></b>");

        assertEquals(2, tree.size());
        assertEquals("*/`x`/*", tree.node(1).text.plainText());
    }

    @Test
    void flatten_shouldFlattenBlocksNestedInsideInlineTags() {
        NodeTree tree = flattened("<a href=\"u\"><p>text</p></a>");

        assertEquals(1, tree.children(NodeTree.ROOT).size());
        assertTrue(tree.node(tree.children(NodeTree.ROOT).get(0)).isText());
    }

    @Test
    void flatten_shouldKeepCodeInsidePreUnmarked() {
        NodeTree tree = flattened("<pre><code>x</code></pre>");

        int pre = tree.children(NodeTree.ROOT).get(0);
        assertEquals("x", tree.node(tree.children(pre).get(0)).text.plainText());
    }

    @Test
    void flatten_shouldEncodeBrAsLineBreakSegment() {
        NodeTree tree = flattened("a<br>b");

        InlineText br = tree.node(tree.children(NodeTree.ROOT).get(1)).text;
        assertEquals(1, br.segments().size());
        assertEquals(InlineText.Kind.LINE_BREAK, br.segments().get(0).kind());
    }

    // -- Links --

    @Test
    void rewriteLink_shouldKeepTextWithoutHref() {
        assertEquals("x", InlineFlattener.rewriteLink(InlineText.of("x"), null).plainText());
    }

    @Test
    void rewriteLink_shouldPrintTargetOnceWhenTextMatches() {
        assertEquals("https://a.b", InlineFlattener.rewriteLink(InlineText.of("https://a.b"), "https://a.b").plainText());
    }

    @Test
    void rewriteLink_shouldExpandEllipsizedText() {
        assertEquals("https://a.b/long/path",
                InlineFlattener.rewriteLink(InlineText.of("https://a.b/lo..."), "https://a.b/long/path").plainText());
    }

    @Test
    void rewriteLink_shouldNotExpandEllipsisThatIsNotAPrefix() {
        assertEquals("read more... https://a.b",
                InlineFlattener.rewriteLink(InlineText.of("read more..."), "https://a.b").plainText());
    }

    @Test
    void rewriteLink_shouldAppendTargetToOtherText() {
        assertEquals("docs https://a.b", InlineFlattener.rewriteLink(InlineText.of("docs"), "https://a.b").plainText());
    }

    @Test
    void rewriteLink_shouldAppendTargetToEmptyText() {
        assertEquals(" https://a.b", InlineFlattener.rewriteLink(InlineText.EMPTY, "https://a.b").plainText());
    }
}
