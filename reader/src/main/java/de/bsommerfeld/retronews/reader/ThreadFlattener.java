package de.bsommerfeld.retronews.reader;

import de.bsommerfeld.retronews.core.domain.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a loaded message tree into the depth-first order shown in the index
 * and assigns every reply its tree prefix:
 *
 * <pre>
 * Story
 * ├─> first reply
 * │ └─> nested reply
 * └─> last reply
 * </pre>
 */
public final class ThreadFlattener {

    private ThreadFlattener() {
    }

    public static List<Message> flatten(Message root) {
        List<Message> out = new ArrayList<>();
        visit(root, "", false, out);
        return out;
    }

    private static void visit(Message message, String prefix, boolean lastChild, List<Message> out) {
        if (message.isThread()) {
            message.setIndexTree("");
        } else {
            message.setIndexTree(prefix + (lastChild ? "└─" : "├─") + "> ");
        }
        out.add(message);

        String childPrefix = message.isThread() ? "" : prefix + (lastChild ? "  " : "│ ");
        List<Message> children = message.getChildren();
        for (int i = 0; i < children.size(); i++) {
            visit(children.get(i), childPrefix, i == children.size() - 1, out);
        }
    }
}
