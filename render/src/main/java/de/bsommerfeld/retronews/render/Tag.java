package de.bsommerfeld.retronews.render;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The closed set of element kinds the renderer understands. Anything else in
 * the markup is skipped by the {@link TreeBuilder}, only its character data
 * survives.
 *
 * <p>
 * Block tags start a new structural unit and are laid out by the
 * {@link BlockRenderer}. Inline tags are collapsed into their surrounding text
 * by the {@link InlineFlattener}. {@link #TEXT} and {@link #ROOT} are synthetic
 * and never matched against markup.
 */
enum Tag {

    ROOT(null, true, false),
    P("p", true, false),
    PRE("pre", true, false),
    BLOCKQUOTE("blockquote", true, false),
    UL("ul", true, false),
    OL("ol", true, false),
    LI("li", true, false),
    HR("hr", true, true),

    CODE("code", false, false),
    A("a", false, false),
    EM("em", false, false),
    I("i", false, false),
    STRONG("strong", false, false),
    B("b", false, false),
    BR("br", false, true),

    TEXT(null, false, false);

    private static final Map<String, Tag> BY_NAME = new HashMap<>();

    static {
        for (Tag tag : values()) {
            if (tag.htmlName != null)
                BY_NAME.put(tag.htmlName, tag);
        }
    }

    private final String htmlName;
    private final boolean block;
    private final boolean autoClosing;

    Tag(String htmlName, boolean block, boolean autoClosing) {
        this.htmlName = htmlName;
        this.block = block;
        this.autoClosing = autoClosing;
    }

    /**
     * Looks up a tag by its markup name, ignoring case.
     *
     * @return the recognized tag, or {@code null} for anything the renderer
     *         does not handle
     */
    static Tag fromName(String name) {
        if (name == null)
            return null;
        return BY_NAME.get(name.toLowerCase(Locale.ROOT));
    }

    boolean isBlock() {
        return block;
    }

    /**
     * Tags that never carry children or a closing tag in the wild. The builder
     * closes them implicitly as soon as anything else arrives.
     */
    boolean isAutoClosing() {
        return autoClosing;
    }

    /** Whether children of this tag are rendered two columns narrower. */
    boolean indentsChildren() {
        return this == BLOCKQUOTE || this == LI || this == PRE;
    }
}
