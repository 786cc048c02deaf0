package de.bsommerfeld.retronews.render;

import java.util.Map;

/**
 * Receives the token stream produced by {@link HtmlTokenizer}. Names arrive
 * lower-cased, character data and attribute values arrive entity-decoded.
 */
interface TokenHandler {

    /**
     * @param attributes  attribute name to value; a valueless attribute maps to
     *                    {@code null}
     * @param selfClosing whether the tag was written as {@code <name/>}
     */
    void startTag(String name, Map<String, String> attributes, boolean selfClosing);

    void endTag(String name);

    void text(String data);
}
