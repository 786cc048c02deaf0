package de.bsommerfeld.retronews.render;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Greedy line breaking for fixed-width output.
 *
 * <p>
 * {@link #wrap} is the plain algorithm: words are separated by spaces only,
 * hyphenated words are never split and a word longer than the line is placed
 * on a line of its own instead of being cut. {@link #wrapParagraph} adds the
 * heuristics for discussion-thread text on top of it.
 */
public final class TextWrapper {

    private static final Pattern QUOTE_PREFIX = Pattern.compile("^(> ?)+");
    private static final Pattern REFERENCE_LINE = Pattern.compile("^\\[\\d+\\][ :-]*https?://[^ ]*$");
    private static final Pattern CHUNK = Pattern.compile(" +|[^ ]+");
    private static final Pattern OTHER_WHITESPACE = Pattern.compile("[\\n\\r\\f\\u000B]");
    private static final int TAB_SIZE = 8;

    private TextWrapper() {
    }

    /**
     * Wraps one logical line of flowing text.
     * <ul>
     * <li>an empty line stays a single empty line</li>
     * <li>a line indented by two spaces is taken to be code and left alone</li>
     * <li>a numbered reference followed by a bare URL ({@code [3]: https://...})
     * is left alone so the number stays next to its link</li>
     * <li>otherwise the line is wrapped and a leading quote marker such as
     * {@code >} or {@code >>} is repeated on every continuation line</li>
     * </ul>
     * Trailing whitespace is stripped from every produced line.
     *
     * @return the wrapped lines; empty if the line held only whitespace
     */
    public static List<String> wrapParagraph(String line, int width) {
        if (line.isEmpty())
            return List.of("");
        if (line.startsWith("  "))
            return List.of(line);
        if (REFERENCE_LINE.matcher(line).matches())
            return List.of(line);

        Matcher quote = QUOTE_PREFIX.matcher(line);
        String indent = quote.find() ? quote.group() : "";

        List<String> wrapped = wrap(line, width, indent);
        wrapped.replaceAll(TextWrapper::stripTrailing);
        return wrapped;
    }

    /**
     * Greedily fills lines up to {@code width} columns. Tabs are expanded,
     * other whitespace characters count as spaces. Whitespace at the start of
     * continuation lines and at the end of every line is dropped.
     *
     * @param subsequentIndent prefix for every line but the first; it counts
     *                         towards the width
     * @return the wrapped lines, empty if {@code text} holds only whitespace
     */
    public static List<String> wrap(String text, int width, String subsequentIndent) {
        String prepared = OTHER_WHITESPACE.matcher(expandTabs(text)).replaceAll(" ");

        Deque<String> chunks = new ArrayDeque<>();
        Matcher matcher = CHUNK.matcher(prepared);
        while (matcher.find()) {
            chunks.add(matcher.group());
        }
        if (chunks.isEmpty())
            return new ArrayList<>();

        List<String> lines = new ArrayList<>();
        while (!chunks.isEmpty()) {
            String indent = lines.isEmpty() ? "" : subsequentIndent;
            int lineWidth = width - indent.length();

            if (!lines.isEmpty() && isSpace(chunks.peekFirst()))
                chunks.pollFirst();

            List<String> line = new ArrayList<>();
            int length = 0;
            while (!chunks.isEmpty() && length + chunks.peekFirst().length() <= lineWidth) {
                String chunk = chunks.pollFirst();
                line.add(chunk);
                length += chunk.length();
            }

            if (!chunks.isEmpty() && chunks.peekFirst().length() > lineWidth && line.isEmpty()) {
                line.add(chunks.pollFirst());
            }

            if (!line.isEmpty() && isSpace(line.get(line.size() - 1)))
                line.remove(line.size() - 1);

            if (!line.isEmpty())
                lines.add(indent + String.join("", line));
        }
        return lines;
    }

    private static boolean isSpace(String chunk) {
        return chunk != null && !chunk.isEmpty() && chunk.charAt(0) == ' ';
    }

    private static String expandTabs(String text) {
        if (text.indexOf('\t') == -1)
            return text;

        StringBuilder sb = new StringBuilder();
        int column = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\t') {
                int spaces = TAB_SIZE - (column % TAB_SIZE);
                sb.append(" ".repeat(spaces));
                column += spaces;
            } else {
                sb.append(c);
                column = (c == '\n' || c == '\r') ? 0 : column + 1;
            }
        }
        return sb.toString();
    }

    private static String stripTrailing(String line) {
        int end = line.length();
        while (end > 0 && Character.isWhitespace(line.charAt(end - 1))) {
            end--;
        }
        return line.substring(0, end);
    }
}
