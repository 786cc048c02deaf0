/**
 * HTML-to-plain-text rendering for the message pager.
 *
 * <h2>Pipeline</h2>
 *
 * <pre>
 *   raw html
 *      │
 *      ▼
 *   Sanitizer          control characters removed (\n and \t kept)
 *      │
 *      ▼
 *   TreeBuilder        HtmlTokenizer events → NodeTree (tag soup rules)
 *      │
 *      ▼
 *   InlineFlattener    inline subtrees → single text nodes
 *      │
 *      ▼
 *   TextNormalizer     merge, trim, collapse whitespace, prune
 *      │
 *      ▼
 *   BlockRenderer      wrap (TextWrapper), indent, join → String
 * </pre>
 *
 * <p>
 * The only public entry points are {@link de.bsommerfeld.retronews.render.HtmlRenderer},
 * {@link de.bsommerfeld.retronews.render.TextWrapper} and
 * {@link de.bsommerfeld.retronews.render.Sanitizer}. Every other type lives
 * for the duration of a single render call.
 *
 * <h2>Recognized tags</h2>
 * Block: {@code p pre blockquote ul ol li hr}. Inline:
 * {@code code a em i strong b br}. Everything else is dropped while its text
 * is kept.
 */
package de.bsommerfeld.retronews.render;
