package de.bsommerfeld.retronews.render;

import java.util.ArrayList;
import java.util.List;

/**
 * Single slot in a {@link NodeTree} arena. Parent and children are arena
 * indices, never object references.
 */
final class Node {

    Tag tag;
    final String href;
    final boolean preformatted;
    InlineText text = InlineText.EMPTY;
    int parent = NodeTree.NO_PARENT;
    final List<Integer> children = new ArrayList<>();

    Node(Tag tag, String href, boolean preformatted) {
        this.tag = tag;
        this.href = href;
        this.preformatted = preformatted;
    }

    boolean isText() {
        return tag == Tag.TEXT;
    }
}
