package de.bsommerfeld.retronews.render;

/**
 * Removes control characters that would corrupt a character-grid terminal.
 * Newlines and tabs are kept since later stages give them meaning.
 */
public final class Sanitizer {

    private Sanitizer() {
    }

    public static String stripControlCharacters(String text) {
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean drop = Character.getType(c) == Character.CONTROL && c != '\n' && c != '\t';
            if (drop && sb == null) {
                sb = new StringBuilder(text.length());
                sb.append(text, 0, i);
            } else if (!drop && sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? text : sb.toString();
    }
}
