package de.bsommerfeld.retronews.reader;

import de.bsommerfeld.retronews.core.domain.Message;
import de.bsommerfeld.retronews.render.HtmlRenderer;
import de.bsommerfeld.retronews.render.Sanitizer;
import de.bsommerfeld.retronews.render.TextWrapper;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the pager lines of a message: either a mail-like header block followed
 * by the rendered body, or the raw body HTML wrapped at a fixed width.
 */
public final class MessageLines {

    static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneId.systemDefault());

    /** Entities the site escapes in raw bodies that are worth showing plain. */
    private static final Map<String, String> RAW_REPLACEMENTS = Map.of(
            "&#x2F;", "/",
            "&#x27;", "'",
            "&quot;", "\"");

    private MessageLines() {
    }

    public static List<String> build(Message message, int width) {
        List<String> lines = new ArrayList<>();
        lines.add("Content-Location: " + nullToEmpty(message.getContentLocation()));
        lines.add("Date: " + DATE_FORMAT.format(message.getDate()));
        lines.add("From: " + nullToEmpty(message.getAuthor()));
        lines.add("Subject: " + nullToEmpty(message.getTitle()));
        lines.add("");

        String rendered = HtmlRenderer.render(nullToEmpty(message.getBody()), width);
        if (!rendered.isEmpty()) {
            lines.addAll(List.of(rendered.split("\n", -1)));
        }
        return lines;
    }

    public static List<String> buildRaw(Message message, int rawWidth) {
        String text = nullToEmpty(message.getBody());
        for (Map.Entry<String, String> replacement : RAW_REPLACEMENTS.entrySet()) {
            text = text.replace(replacement.getKey(), replacement.getValue());
        }

        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            lines.addAll(TextWrapper.wrap(line, rawWidth, ""));
        }
        return lines;
    }

    public static List<String> sanitize(List<String> lines) {
        List<String> sanitized = new ArrayList<>(lines.size());
        for (String line : lines) {
            sanitized.add(Sanitizer.stripControlCharacters(line));
        }
        return sanitized;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
