package de.bsommerfeld.retronews.reader;

/**
 * Display class of a pager line, derived from its leading characters only.
 */
public enum PagerLineStyle {
    LOCATION,
    DATE,
    AUTHOR,
    SUBJECT,
    NESTED_QUOTE,
    QUOTE,
    /** Indented code or a preformatted block. */
    CODE,
    /** Padding below the last line of a message. */
    FILLER,
    PLAIN;

    public static final String FILLER_LINE = "~";

    public static PagerLineStyle classify(String line) {
        if (line.startsWith("Content-Location: "))
            return LOCATION;
        if (line.startsWith("Date: "))
            return DATE;
        if (line.startsWith("From: "))
            return AUTHOR;
        if (line.startsWith("Subject: "))
            return SUBJECT;
        if (line.startsWith(">>") || line.startsWith("> >"))
            return NESTED_QUOTE;
        if (line.startsWith(">"))
            return QUOTE;
        if (line.startsWith("  ") || line.startsWith("| "))
            return CODE;
        if (line.equals(FILLER_LINE))
            return FILLER;
        return PLAIN;
    }

    /** Words are highlighted as links only on {@link #PLAIN} lines. */
    public static boolean isUrl(String word) {
        return word.startsWith("http://") || word.startsWith("https://");
    }
}
