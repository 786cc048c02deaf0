package de.bsommerfeld.retronews.reader;

import de.bsommerfeld.retronews.core.domain.Message;

/**
 * Formats one line of the message index:
 *
 * <pre>
 * [2024-01-31 18:04]  [dhouston  ]  [  12]  ├─> Re: My YC app
 * </pre>
 *
 * The unread column is only filled for thread roots and is clamped to four
 * digits.
 */
public final class IndexRow {

    static final int AUTHOR_WIDTH = 10;
    static final int MAX_UNREAD = 9999;

    private IndexRow() {
    }

    public static String format(Message message, boolean hideTitle) {
        String author = message.getAuthor() == null ? "" : message.getAuthor();
        if (author.length() > AUTHOR_WIDTH)
            author = author.substring(0, AUTHOR_WIDTH);

        String unread = "    ";
        if (message.isThread()) {
            int count = Math.max(0, Math.min(message.getTotalComments() - message.getReadComments(), MAX_UNREAD));
            unread = String.format("%4d", count);
        }

        String title = hideTitle || message.getTitle() == null ? "" : message.getTitle();
        return "[" + MessageLines.DATE_FORMAT.format(message.getDate()) + "]  ["
                + String.format("%-" + AUTHOR_WIDTH + "s", author) + "]  [" + unread + "]  "
                + message.getIndexTree() + title;
    }

    /**
     * Replies repeat their parent's subject; below the first visible row the
     * title is hidden unless the reply is starred or selected.
     */
    public static boolean hidesTitle(Message message, boolean firstRow, boolean selected) {
        boolean response = message.getTitle() != null && message.getTitle().startsWith("Re:") && !message.isThread();
        return response && !firstRow && !message.getFlags().isStarred() && !selected;
    }
}
