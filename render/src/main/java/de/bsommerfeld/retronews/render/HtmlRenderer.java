package de.bsommerfeld.retronews.render;

import java.util.Objects;

/**
 * Converts snippet-level HTML (story bodies, comments) into fixed-width plain
 * text for a terminal pager.
 *
 * <p>
 * Rendering is a pure function of its arguments: every call builds its own
 * tree, so the class is safe to use from any number of threads. Malformed
 * markup never raises, it only degrades the structure of the result.
 *
 * <p>
 * Output lines stay within the requested width under normal wrapping. Lines of
 * preformatted blocks, lines indented as code and numbered reference lines are
 * never wrapped and may be longer.
 *
 * @see de.bsommerfeld.retronews.render
 */
public final class HtmlRenderer {

    public static final int DEFAULT_WIDTH = 70;

    private HtmlRenderer() {
    }

    public static String render(String html) {
        return render(html, DEFAULT_WIDTH);
    }

    /**
     * @param html  markup to render, well-formed or not
     * @param width target column count, must be positive
     * @return the rendered text as {@code \n}-separated lines, without a
     *         trailing newline
     */
    public static String render(String html, int width) {
        Objects.requireNonNull(html, "html");
        if (width < 1)
            throw new IllegalArgumentException("width must be positive: " + width);

        NodeTree tree = TreeBuilder.build(Sanitizer.stripControlCharacters(html));
        InlineFlattener.flatten(tree);
        TextNormalizer.normalize(tree);
        return BlockRenderer.render(tree, width);
    }
}
