package de.bsommerfeld.retronews.render;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out a block-only tree (output of {@link TextNormalizer}) as text.
 *
 * <p>
 * Children of a node are rendered one after another, separated by a blank
 * line. Consecutive list items are the exception and follow each other
 * directly, their markers separate them. A child that renders to nothing is
 * skipped entirely. The joined block is then indented as a whole:
 *
 * <pre>
 *   blockquote   "&gt; " on every line
 *   pre          "| " on every line
 *   li           "- " on the first line, "  " on the rest
 * </pre>
 *
 * Because of that prefix, {@code blockquote}, {@code pre} and {@code li} give
 * their children two columns less. An {@code hr} fills its whole width with
 * dashes.
 */
final class BlockRenderer {

    private BlockRenderer() {
    }

    static String render(NodeTree tree, int width) {
        return render(tree, NodeTree.ROOT, width);
    }

    private static String render(NodeTree tree, int id, int width) {
        Node node = tree.node(id);
        if (node.isText())
            return renderText(node, width);
        if (node.tag == Tag.HR)
            return "-".repeat(width);

        int childWidth = node.tag.indentsChildren() ? Math.max(1, width - 2) : width;

        StringBuilder out = new StringBuilder();
        Tag previous = null;
        for (int child : tree.children(id)) {
            String rendered = render(tree, child, childWidth);
            if (rendered.isEmpty())
                continue;

            Tag tag = tree.node(child).tag;
            if (previous != null)
                out.append(previous == Tag.LI && tag == Tag.LI ? "\n" : "\n\n");
            out.append(rendered);
            previous = tag;
        }
        return indent(node.tag, out.toString());
    }

    private static String renderText(Node node, int width) {
        String text = node.text.plainText();
        if (node.preformatted)
            return text;

        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            lines.addAll(TextWrapper.wrapParagraph(line, width));
        }
        return String.join("\n", lines);
    }

    private static String indent(Tag tag, String block) {
        if (block.isEmpty())
            return block;
        return switch (tag) {
            case BLOCKQUOTE -> prefixLines(block, "> ", "> ");
            case PRE -> prefixLines(block, "| ", "| ");
            case LI -> prefixLines(block, "- ", "  ");
            default -> block;
        };
    }

    private static String prefixLines(String block, String first, String rest) {
        String[] lines = block.split("\n", -1);
        StringBuilder sb = new StringBuilder(block.length() + lines.length * first.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0)
                sb.append('\n');
            sb.append(i == 0 ? first : rest).append(lines[i]);
        }
        return sb.toString();
    }
}
