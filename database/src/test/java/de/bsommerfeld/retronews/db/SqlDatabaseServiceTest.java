package de.bsommerfeld.retronews.db;

import de.bsommerfeld.retronews.core.domain.Message;
import de.bsommerfeld.retronews.core.domain.MessageFlags;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for SqlDatabaseService against a real temporary SQLite
 * database.
 */
class SqlDatabaseServiceTest {

    @TempDir
    Path tempDir;

    private SqlDatabaseService db;

    @BeforeEach
    void setUp() {
        db = new SqlDatabaseService(tempDir.resolve("test.db"));
    }

    // -- Schema --

    @Test
    void constructor_shouldBeIdempotentOnExistingFile() {
        db.saveMessage(message("1@hn", "1@hn", 100, true, false));

        SqlDatabaseService reopened = new SqlDatabaseService(tempDir.resolve("test.db"));

        assertEquals(Set.of("1@hn"), reopened.loadFlags(List.of("1@hn")).keySet());
    }

    @Test
    void constructor_shouldCreateMissingDirectories() {
        SqlDatabaseService nested = new SqlDatabaseService(tempDir.resolve("a").resolve("b").resolve("x.db"));

        assertTrue(nested.loadFlags(List.of("1@hn")).isEmpty());
    }

    // -- Flags --

    @Test
    void saveMessage_shouldStoreFlagsAsJson() throws Exception {
        db.saveMessage(message("1@hn", "1@hn", 100, true, false));

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT flags, date FROM messages WHERE msg_id = ?")) {
            ps.setString(1, "1@hn");
            try (ResultSet rs = ps.executeQuery()) {
                assertTrue(rs.next());
                assertEquals("{\"read\":true,\"starred\":false}", rs.getString("flags"));
                assertEquals(100, rs.getLong("date"));
            }
        }
    }

    @Test
    void saveMessage_shouldReplaceExistingFlags() {
        db.saveMessage(message("1@hn", "1@hn", 100, true, false));
        db.saveMessage(message("1@hn", "1@hn", 100, true, true));

        assertEquals(new MessageFlags(true, true), db.loadFlags(List.of("1@hn")).get("1@hn"));
    }

    @Test
    void loadFlags_shouldOnlyReturnStoredIds() {
        db.saveMessage(message("1@hn", "1@hn", 100, true, false));
        db.saveMessage(message("2@hn", "1@hn", 101, false, true));

        Map<String, MessageFlags> flags = db.loadFlags(List.of("1@hn", "2@hn", "3@hn"));

        assertEquals(2, flags.size());
        assertTrue(flags.get("1@hn").isRead());
        assertTrue(flags.get("2@hn").isStarred());
        assertFalse(flags.containsKey("3@hn"));
    }

    @Test
    void loadFlags_shouldReturnEmptyForNoIds() {
        assertTrue(db.loadFlags(List.of()).isEmpty());
    }

    // -- Read counts --

    @Test
    void countReadComments_shouldCountReadMessagesPerThread() {
        db.saveMessage(message("1@hn", "1@hn", 100, true, false));
        db.saveMessage(message("2@hn", "1@hn", 101, true, false));
        db.saveMessage(message("3@hn", "1@hn", 102, false, true));
        db.saveMessage(message("10@hn", "10@hn", 200, true, false));
        db.saveMessage(message("20@hn", "20@hn", 300, true, false));

        Map<String, Integer> counts = db.countReadComments(List.of("1@hn", "10@hn", "99@hn"));

        assertEquals(Map.of("1@hn", 2, "10@hn", 1), counts);
    }

    @Test
    void countReadComments_shouldReturnEmptyForNoIds() {
        assertTrue(db.countReadComments(List.of()).isEmpty());
    }

    // -- Starred threads --

    @Test
    void getStarredThreadIds_shouldGroupByThreadNewestFirst() {
        db.saveMessage(message("1@hn", "1@hn", 100, false, true));
        db.saveMessage(message("2@hn", "1@hn", 150, false, true));
        db.saveMessage(message("10@hn", "10@hn", 120, false, true));
        db.saveMessage(message("20@hn", "20@hn", 500, true, false));

        assertEquals(List.of("1@hn", "10@hn"), db.getStarredThreadIds(1));
    }

    @Test
    void getStarredThreadIds_shouldForgetUnstarredMessages() {
        db.saveMessage(message("1@hn", "1@hn", 100, false, true));
        db.saveMessage(message("1@hn", "1@hn", 100, false, false));

        assertTrue(db.getStarredThreadIds(1).isEmpty());
    }

    @Test
    void getStarredThreadIds_shouldPage() {
        for (int i = 0; i < DatabaseService.STARRED_PAGE_SIZE + 5; i++) {
            db.saveMessage(message(i + "@hn", i + "@hn", 1000 - i, false, true));
        }

        List<String> first = db.getStarredThreadIds(1);
        List<String> second = db.getStarredThreadIds(2);

        assertEquals(DatabaseService.STARRED_PAGE_SIZE, first.size());
        assertEquals(5, second.size());
        assertEquals("0@hn", first.get(0));
        assertEquals("30@hn", second.get(0));
    }

    @Test
    void getStarredThreadIds_shouldRejectPageBelowOne() {
        assertThrows(IllegalArgumentException.class, () -> db.getStarredThreadIds(0));
    }

    // -- Helpers --

    private static Message message(String id, String threadId, long date, boolean read, boolean starred) {
        Message msg = new Message(id, threadId, "https://news.ycombinator.com/item?id=" + id,
                Instant.ofEpochSecond(date), "author", "title");
        msg.setFlags(new MessageFlags(read, starred));
        return msg;
    }
}
