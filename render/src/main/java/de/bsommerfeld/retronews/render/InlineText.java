package de.bsommerfeld.retronews.render;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable run of character data as it flows through flattening. Forced line
 * breaks ({@code <br>}) are kept as their own segment kind instead of being
 * encoded as a marker character, so they can never collide with input text and
 * whitespace collapsing can treat them separately.
 */
final class InlineText {

    enum Kind {
        TEXT,
        LINE_BREAK
    }

    record Segment(Kind kind, String value) {
    }

    static final InlineText EMPTY = new InlineText(Collections.emptyList());

    private static final Segment BREAK = new Segment(Kind.LINE_BREAK, "\n");

    private final List<Segment> segments;

    private InlineText(List<Segment> segments) {
        this.segments = segments;
    }

    static InlineText of(String text) {
        if (text == null || text.isEmpty())
            return EMPTY;
        return new InlineText(List.of(new Segment(Kind.TEXT, text)));
    }

    static InlineText lineBreak() {
        return new InlineText(List.of(BREAK));
    }

    List<Segment> segments() {
        return segments;
    }

    boolean isEmpty() {
        return segments.isEmpty();
    }

    /** Returns a new run holding this run's segments followed by {@code other}'s. */
    InlineText append(InlineText other) {
        if (other.isEmpty())
            return this;
        if (isEmpty())
            return other;
        List<Segment> joined = new ArrayList<>(segments.size() + other.segments.size());
        joined.addAll(segments);
        joined.addAll(other.segments);
        return new InlineText(Collections.unmodifiableList(joined));
    }

    /** Joins many runs in one copy, left to right. */
    static InlineText concat(List<InlineText> parts) {
        int size = 0;
        InlineText only = EMPTY;
        for (InlineText part : parts) {
            if (!part.isEmpty()) {
                size += part.segments.size();
                only = part;
            }
        }
        if (size == only.segments.size())
            return only;

        List<Segment> joined = new ArrayList<>(size);
        for (InlineText part : parts) {
            joined.addAll(part.segments);
        }
        return new InlineText(Collections.unmodifiableList(joined));
    }

    InlineText append(String text) {
        return append(of(text));
    }

    /** Surrounds the run with literal markers, e.g. {@code *bold*}. */
    InlineText wrap(String prefix, String suffix) {
        return of(prefix).append(this).append(suffix);
    }

    /** Flattens the run to a string, line breaks become {@code \n}. */
    String plainText() {
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            sb.append(segment.value());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return plainText();
    }
}
