package de.bsommerfeld.retronews.reader;

import de.bsommerfeld.retronews.core.domain.Message;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ThreadFlattenerTest {

    private static Message message(String id, String threadId, Message... children) {
        Message message = new Message(id, threadId, "", Instant.EPOCH, "a", "t");
        message.setBody("");
        message.setChildren(List.of(children));
        return message;
    }

    @Test
    void flatten_shouldVisitDepthFirst() {
        Message root = message("1@hn", "1@hn",
                message("2@hn", "1@hn", message("3@hn", "1@hn")),
                message("4@hn", "1@hn"));

        List<String> ids = ThreadFlattener.flatten(root).stream().map(Message::getMsgId)
                .collect(Collectors.toList());

        assertEquals(List.of("1@hn", "2@hn", "3@hn", "4@hn"), ids);
    }

    @Test
    void flatten_shouldBuildTreePrefixes() {
        Message root = message("1@hn", "1@hn",
                message("2@hn", "1@hn",
                        message("3@hn", "1@hn"),
                        message("4@hn", "1@hn", message("5@hn", "1@hn"))),
                message("6@hn", "1@hn", message("7@hn", "1@hn")));

        List<String> trees = ThreadFlattener.flatten(root).stream().map(Message::getIndexTree)
                .collect(Collectors.toList());

        assertEquals(List.of(
                "",
                "├─> ",
                "│ ├─> ",
                "│ └─> ",
                "│   └─> ",
                "└─> ",
                "  └─> "), trees);
    }

    @Test
    void flatten_shouldReturnLoneRoot() {
        Message root = message("1@hn", "1@hn");

        assertEquals(List.of(root), ThreadFlattener.flatten(root));
        assertEquals("", root.getIndexTree());
    }
}
