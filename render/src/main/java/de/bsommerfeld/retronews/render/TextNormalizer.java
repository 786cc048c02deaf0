package de.bsommerfeld.retronews.render;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Whitespace policy for a flattened tree. Works on sibling lists only:
 * <ol>
 * <li>adjacent text siblings with the same preformatted flag are merged,</li>
 * <li>every text node is trimmed (see {@link #normalizeFlowText} and
 * {@link #normalizePreformatted}),</li>
 * <li>text nodes left empty are removed.</li>
 * </ol>
 * Afterwards line breaks are literal {@code \n} characters and the block
 * renderer never sees empty or split text runs.
 *
 * <p>
 * Collapsing treats every Unicode whitespace character, the no-break space
 * included, as whitespace. Trimming at the ends of a run only removes
 * {@code \r\n\t} and the ASCII space.
 */
final class TextNormalizer {

    private static final String TRIM_CHARS = "\r\n\t ";
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextNormalizer() {
    }

    static void normalize(NodeTree tree) {
        normalize(tree, NodeTree.ROOT);
        tree.compact();
    }

    private static void normalize(NodeTree tree, int id) {
        List<Integer> kept = new ArrayList<>();
        List<Integer> children = tree.children(id);
        int i = 0;
        while (i < children.size()) {
            int first = children.get(i);
            Node node = tree.node(first);
            if (!node.isText()) {
                kept.add(first);
                i++;
                continue;
            }

            List<InlineText> run = new ArrayList<>();
            while (i < children.size() && isMergeable(node, tree.node(children.get(i)))) {
                run.add(tree.node(children.get(i)).text);
                i++;
            }
            String text = node.preformatted
                    ? normalizePreformatted(InlineText.concat(run))
                    : normalizeFlowText(InlineText.concat(run));
            if (!text.isEmpty()) {
                node.text = InlineText.of(text);
                kept.add(first);
            }
        }
        tree.retainChildren(id, kept);

        for (int child : kept) {
            if (!tree.node(child).isText())
                normalize(tree, child);
        }
    }

    private static boolean isMergeable(Node first, Node candidate) {
        return candidate.isText() && candidate.preformatted == first.preformatted;
    }

    /** Keeps preformatted text as authored apart from trailing whitespace. */
    static String normalizePreformatted(InlineText text) {
        return stripTrailing(text.plainText());
    }

    /**
     * Normalizes flowing text: trims both ends, collapses whitespace runs to a
     * single space, resolves line breaks to {@code \n} and drops the spaces
     * that would otherwise surround each newline.
     */
    static String normalizeFlowText(InlineText text) {
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (InlineText.Segment segment : text.segments()) {
            if (segment.kind() == InlineText.Kind.LINE_BREAK) {
                lines.add(current.toString());
                current.setLength(0);
            } else {
                current.append(segment.value());
            }
        }
        lines.add(current.toString());

        int last = lines.size() - 1;
        lines.set(0, stripLeading(lines.get(0)));
        lines.set(last, stripTrailing(lines.get(last)));

        StringBuilder out = new StringBuilder();
        for (int i = 0; i <= last; i++) {
            String line = WHITESPACE_RUN.matcher(lines.get(i)).replaceAll(" ");
            if (i > 0) {
                out.append('\n');
                line = stripSpaces(line, true, false);
            }
            if (i < last) {
                line = stripSpaces(line, false, true);
            }
            out.append(line);
        }
        return out.toString();
    }

    private static String stripLeading(String s) {
        int start = 0;
        while (start < s.length() && TRIM_CHARS.indexOf(s.charAt(start)) >= 0) {
            start++;
        }
        return s.substring(start);
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && TRIM_CHARS.indexOf(s.charAt(end - 1)) >= 0) {
            end--;
        }
        return s.substring(0, end);
    }

    private static String stripSpaces(String s, boolean leading, boolean trailing) {
        int start = 0;
        int end = s.length();
        while (leading && start < end && s.charAt(start) == ' ') {
            start++;
        }
        while (trailing && end > start && s.charAt(end - 1) == ' ') {
            end--;
        }
        return s.substring(start, end);
    }
}
