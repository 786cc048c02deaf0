package de.bsommerfeld.retronews.render;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses every inline subtree into a single {@link Tag#TEXT} node, leaving
 * a tree of block tags and text only.
 *
 * <p>
 * A node is flattened when it is not a block tag, or when an ancestor already
 * was. Inline mode is inherited downward and never switched off again, so a
 * {@code <p>} nested inside an {@code <a>} becomes plain text as well.
 * Children are flattened first, their text is concatenated left to right and
 * then rewritten according to the tag:
 *
 * <pre>
 *   br            line break
 *   em, i         /text/
 *   strong, b     *text*
 *   code          `text`      (not inside pre)
 *   a             see {@link #rewriteLink}
 *   anything else text unchanged
 * </pre>
 */
final class InlineFlattener {

    private static final String ELLIPSIS = "...";

    private InlineFlattener() {
    }

    static void flatten(NodeTree tree) {
        flatten(tree, NodeTree.ROOT, false);
        tree.compact();
    }

    private static void flatten(NodeTree tree, int id, boolean inherited) {
        Node node = tree.node(id);
        boolean inline = inherited || !node.tag.isBlock();

        for (int child : new ArrayList<>(tree.children(id))) {
            flatten(tree, child, inline);
        }
        if (!inline)
            return;

        List<InlineText> parts = new ArrayList<>();
        parts.add(node.text);
        for (int child : tree.children(id)) {
            parts.add(tree.node(child).text);
        }
        InlineText inner = InlineText.concat(parts);

        node.text = rewrite(node, inner);
        node.tag = Tag.TEXT;
        tree.clearChildren(id);
    }

    private static InlineText rewrite(Node node, InlineText inner) {
        return switch (node.tag) {
            case BR -> InlineText.lineBreak().append(inner);
            case EM, I -> inner.wrap("/", "/");
            case STRONG, B -> inner.wrap("*", "*");
            case CODE -> node.preformatted ? inner : inner.wrap("`", "`");
            case A -> rewriteLink(inner, node.href);
            default -> inner;
        };
    }

    /**
     * Shows the link target next to its text. Two shortcuts avoid printing the
     * same URL twice: a text identical to the target prints the target alone,
     * and a text shortened with a trailing {@code ...} (as Hacker News
     * displays long URLs) is replaced by the full target.
     */
    static InlineText rewriteLink(InlineText inner, String href) {
        if (href == null)
            return inner;

        String visible = inner.plainText();
        if (visible.equals(href))
            return InlineText.of(href);

        if (visible.endsWith(ELLIPSIS)
                && href.startsWith(visible.substring(0, visible.length() - ELLIPSIS.length()))) {
            return InlineText.of(href);
        }
        return inner.append(" " + href);
    }
}
