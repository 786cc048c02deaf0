package de.bsommerfeld.retronews.render;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Arena holding every node of one render call, addressed by index. Slot
 * {@value #ROOT} is always the {@link Tag#ROOT} node.
 *
 * <p>
 * Passes detach nodes by dropping them from their parent's child list; the
 * slot stays allocated until {@link #compact()} rebuilds the arena from what is
 * still reachable from the root. A tree instance belongs to exactly one render
 * call and is not thread-safe.
 */
final class NodeTree {

    static final int ROOT = 0;
    static final int NO_PARENT = -1;

    private List<Node> nodes = new ArrayList<>();

    NodeTree() {
        nodes.add(new Node(Tag.ROOT, null, false));
    }

    /** Appends a new element node as the last child of {@code parent}. */
    int add(int parent, Tag tag, String href, boolean preformatted) {
        return attach(parent, new Node(tag, href, preformatted));
    }

    /** Appends a new {@link Tag#TEXT} node as the last child of {@code parent}. */
    int addText(int parent, InlineText text, boolean preformatted) {
        Node node = new Node(Tag.TEXT, null, preformatted);
        node.text = text;
        return attach(parent, node);
    }

    private int attach(int parent, Node node) {
        int id = nodes.size();
        node.parent = parent;
        nodes.add(node);
        nodes.get(parent).children.add(id);
        return id;
    }

    Node node(int id) {
        return nodes.get(id);
    }

    /** Live child list of {@code id}; mutations detach or reorder children. */
    List<Integer> children(int id) {
        return nodes.get(id).children;
    }

    int parent(int id) {
        return nodes.get(id).parent;
    }

    /** Detaches every child of {@code id}. */
    void clearChildren(int id) {
        for (int child : nodes.get(id).children) {
            nodes.get(child).parent = NO_PARENT;
        }
        nodes.get(id).children.clear();
    }

    /**
     * Replaces the child list of {@code id} in one step. Children missing from
     * {@code kept} are detached.
     */
    void retainChildren(int id, List<Integer> kept) {
        List<Integer> children = nodes.get(id).children;
        for (int child : children) {
            nodes.get(child).parent = NO_PARENT;
        }
        for (int child : kept) {
            nodes.get(child).parent = id;
        }
        children.clear();
        children.addAll(kept);
    }

    /** Number of allocated slots, including detached ones not yet compacted. */
    int size() {
        return nodes.size();
    }

    /**
     * Rebuilds the arena so it holds only nodes reachable from the root, in
     * pre-order, with every index rewritten. Indices obtained before the call
     * are invalid afterwards.
     */
    void compact() {
        List<Node> reachable = new ArrayList<>();
        int[] remap = new int[nodes.size()];
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(ROOT);
        while (!stack.isEmpty()) {
            int id = stack.pop();
            remap[id] = reachable.size();
            reachable.add(nodes.get(id));
            List<Integer> children = nodes.get(id).children;
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        for (Node node : reachable) {
            node.parent = node.parent == NO_PARENT ? NO_PARENT : remap[node.parent];
            node.children.replaceAll(child -> remap[child]);
        }
        nodes = reachable;
    }
}
