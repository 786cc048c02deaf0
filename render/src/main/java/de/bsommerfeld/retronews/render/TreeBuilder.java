package de.bsommerfeld.retronews.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Builds a {@link NodeTree} from the token stream of {@link HtmlTokenizer}
 * using "tag soup" rules: malformed markup never fails, at worst the tree ends
 * up flatter than the author intended.
 *
 * <ul>
 * <li>Unrecognized tags are neither opened nor matched on close; their data
 * attaches to the nearest enclosing recognized node.</li>
 * <li>An open {@code br} or {@code hr} is closed implicitly by whatever comes
 * next, since those tags never carry children.</li>
 * <li>A closing tag closes every node up to and including the nearest open
 * node with the same tag. Without such a node everything up to the root is
 * closed.</li>
 * <li>Nodes created inside a {@code pre} element are marked preformatted.</li>
 * <li>At most {@value #MAX_DEPTH} elements are open at once. Beyond that a
 * recognized start tag is skipped like an unrecognized one, which keeps the
 * recursive passes over the tree within a bounded stack depth.</li>
 * </ul>
 */
final class TreeBuilder implements TokenHandler {

    private static final Logger LOG = LoggerFactory.getLogger(TreeBuilder.class);

    static final int MAX_DEPTH = 256;

    private final NodeTree tree = new NodeTree();
    private int current = NodeTree.ROOT;
    private int preDepth;
    private int depth;

    private TreeBuilder() {
    }

    static NodeTree build(String html) {
        TreeBuilder builder = new TreeBuilder();
        HtmlTokenizer.tokenize(html, builder);
        return builder.tree;
    }

    @Override
    public void startTag(String name, Map<String, String> attributes, boolean selfClosing) {
        Tag tag = Tag.fromName(name);
        if (tag == null) {
            LOG.trace("Skipping unrecognized tag <{}>", name);
            return;
        }

        closeAutoClosing();
        if (depth >= MAX_DEPTH) {
            LOG.trace("Nesting limit reached, skipping <{}>", name);
            return;
        }
        String href = tag == Tag.A ? attributes.get("href") : null;
        current = tree.add(current, tag, href, preDepth > 0);
        depth++;
        if (tag == Tag.PRE)
            preDepth++;

        if (selfClosing)
            endTag(name);
    }

    @Override
    public void endTag(String name) {
        Tag tag = Tag.fromName(name);
        if (tag == null)
            return;

        while (current != NodeTree.ROOT) {
            Tag closed = close();
            if (closed == tag)
                return;
        }
        LOG.trace("No open <{}> to close, closed everything up to root", name);
    }

    @Override
    public void text(String data) {
        if (data.isEmpty())
            return;
        closeAutoClosing();
        tree.addText(current, InlineText.of(data), preDepth > 0);
    }

    private void closeAutoClosing() {
        if (tree.node(current).tag.isAutoClosing())
            close();
    }

    /** Closes the current node and returns its tag. */
    private Tag close() {
        Node node = tree.node(current);
        if (node.tag == Tag.PRE)
            preDepth--;
        current = node.parent;
        depth--;
        return node.tag;
    }
}
