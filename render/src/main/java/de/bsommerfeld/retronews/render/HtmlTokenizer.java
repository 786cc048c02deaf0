package de.bsommerfeld.retronews.render;

import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Permissive streaming tokenizer for snippet-level HTML. It never rejects
 * input: anything that does not form valid markup is handed on as character
 * data.
 *
 * <h3>Recognized markup</h3>
 * <ul>
 * <li>start tags with double-quoted, single-quoted, unquoted and valueless
 * attributes, plus the self-closing form {@code <br/>}</li>
 * <li>end tags; anything after the name up to {@code >} is ignored</li>
 * <li>comments, declarations ({@code <!DOCTYPE ...>}) and processing
 * instructions, all dropped</li>
 * <li>{@code script} and {@code style}, whose content is raw text up to the
 * matching end tag</li>
 * </ul>
 *
 * <h3>Data</h3>
 * Consecutive character data is buffered and emitted as one token right
 * before the next tag, so an entity can never be split. Named and numeric
 * character references are decoded with jsoup's entity tables, both in data
 * and in attribute values. A {@code <} that does not start markup, and any
 * construct left unterminated at the end of input, is literal data.
 */
final class HtmlTokenizer {

    private static final Logger LOG = LoggerFactory.getLogger(HtmlTokenizer.class);

    private static final Set<String> RAW_TEXT_ELEMENTS = Set.of("script", "style");

    private final String html;
    private final TokenHandler handler;
    private final StringBuilder pendingData = new StringBuilder();
    private int pos;

    private HtmlTokenizer(String html, TokenHandler handler) {
        this.html = html;
        this.handler = handler;
    }

    static void tokenize(String html, TokenHandler handler) {
        new HtmlTokenizer(html, handler).run();
    }

    private void run() {
        while (pos < html.length()) {
            int lt = html.indexOf('<', pos);
            if (lt == -1) {
                pendingData.append(html, pos, html.length());
                break;
            }
            pendingData.append(html, pos, lt);
            pos = lt;

            int next = readMarkup();
            if (next == -1) {
                pendingData.append('<');
                pos++;
            } else {
                pos = next;
            }
        }
        flushData();
    }

    /**
     * Tries to consume markup starting at the {@code <} under the cursor.
     *
     * @return the index just past the consumed markup, or {@code -1} if the
     *         {@code <} is literal data
     */
    private int readMarkup() {
        if (html.startsWith("<!--", pos)) {
            return skipPast("-->", pos + 4);
        }
        if (html.startsWith("<!", pos) || html.startsWith("<?", pos)) {
            return skipPast(">", pos + 2);
        }
        if (html.startsWith("</", pos)) {
            return readEndTag();
        }
        if (pos + 1 < html.length() && isAsciiLetter(html.charAt(pos + 1))) {
            return readStartTag();
        }
        return -1;
    }

    private int skipPast(String terminator, int from) {
        int end = html.indexOf(terminator, from);
        if (end == -1) {
            LOG.trace("Unterminated markup at offset {}, keeping it as text", pos);
            return -1;
        }
        return end + terminator.length();
    }

    private int readEndTag() {
        int nameStart = pos + 2;
        if (nameStart >= html.length() || !isAsciiLetter(html.charAt(nameStart)))
            return -1;

        int nameEnd = scanName(nameStart);
        int close = html.indexOf('>', nameEnd);
        if (close == -1)
            return -1;

        flushData();
        handler.endTag(html.substring(nameStart, nameEnd).toLowerCase(Locale.ROOT));
        return close + 1;
    }

    private int readStartTag() {
        int nameStart = pos + 1;
        int cursor = scanName(nameStart);
        String name = html.substring(nameStart, cursor).toLowerCase(Locale.ROOT);
        Map<String, String> attributes = new LinkedHashMap<>();
        boolean selfClosing = false;

        while (true) {
            cursor = skipWhitespace(cursor);
            if (cursor >= html.length())
                return -1;

            char c = html.charAt(cursor);
            if (c == '>') {
                cursor++;
                break;
            }
            if (c == '/') {
                if (cursor + 1 < html.length() && html.charAt(cursor + 1) == '>') {
                    selfClosing = true;
                    cursor += 2;
                    break;
                }
                cursor++;
                continue;
            }

            int attrStart = cursor;
            while (cursor < html.length() && !isAttributeNameEnd(html.charAt(cursor))) {
                cursor++;
            }
            String attrName = html.substring(attrStart, cursor).toLowerCase(Locale.ROOT);

            int afterName = skipWhitespace(cursor);
            if (afterName < html.length() && html.charAt(afterName) == '=') {
                cursor = skipWhitespace(afterName + 1);
                if (cursor >= html.length())
                    return -1;

                char quote = html.charAt(cursor);
                String rawValue;
                if (quote == '"' || quote == '\'') {
                    int closingQuote = html.indexOf(quote, cursor + 1);
                    if (closingQuote == -1)
                        return -1;
                    rawValue = html.substring(cursor + 1, closingQuote);
                    cursor = closingQuote + 1;
                } else {
                    int valueStart = cursor;
                    while (cursor < html.length() && html.charAt(cursor) != '>'
                            && !Character.isWhitespace(html.charAt(cursor))) {
                        cursor++;
                    }
                    rawValue = html.substring(valueStart, cursor);
                }
                attributes.putIfAbsent(attrName, Parser.unescapeEntities(rawValue, true));
            } else {
                attributes.putIfAbsent(attrName, null);
            }
        }

        flushData();
        handler.startTag(name, attributes, selfClosing);

        if (!selfClosing && RAW_TEXT_ELEMENTS.contains(name)) {
            return readRawText(name, cursor);
        }
        return cursor;
    }

    /**
     * Emits everything up to {@code </name} undecoded, then the end tag. An
     * element that is never closed swallows the rest of the input.
     */
    private int readRawText(String name, int from) {
        int end = findRawTextEnd(name, from);
        if (end == -1) {
            handler.text(html.substring(from));
            return html.length();
        }
        if (end > from) {
            handler.text(html.substring(from, end));
        }
        int close = html.indexOf('>', end);
        handler.endTag(name);
        return close == -1 ? html.length() : close + 1;
    }

    /**
     * Finds {@code </name} case-insensitively, where the name has to end at
     * whitespace, {@code /}, {@code >} or the end of input.
     */
    private int findRawTextEnd(String name, int from) {
        int candidate = html.indexOf("</", from);
        while (candidate != -1) {
            int nameEnd = candidate + 2 + name.length();
            if (html.regionMatches(true, candidate + 2, name, 0, name.length())
                    && (nameEnd == html.length() || isRawTextNameEnd(html.charAt(nameEnd)))) {
                return candidate;
            }
            candidate = html.indexOf("</", candidate + 2);
        }
        return -1;
    }

    private static boolean isRawTextNameEnd(char c) {
        return Character.isWhitespace(c) || c == '/' || c == '>';
    }

    private void flushData() {
        if (pendingData.length() == 0)
            return;
        handler.text(Parser.unescapeEntities(pendingData.toString(), false));
        pendingData.setLength(0);
    }

    private int scanName(int from) {
        int i = from;
        while (i < html.length()) {
            char c = html.charAt(i);
            if (Character.isWhitespace(c) || c == '/' || c == '>')
                break;
            i++;
        }
        return i;
    }

    private int skipWhitespace(int from) {
        int i = from;
        while (i < html.length() && Character.isWhitespace(html.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isAttributeNameEnd(char c) {
        return Character.isWhitespace(c) || c == '=' || c == '>' || c == '/';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
