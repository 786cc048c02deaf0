package de.bsommerfeld.retronews.db;

import com.google.inject.Singleton;
import de.bsommerfeld.retronews.core.domain.Message;
import de.bsommerfeld.retronews.core.domain.MessageFlags;
import de.bsommerfeld.retronews.core.util.TestDataGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory {@link DatabaseService} for TEST mode: no disk I/O, no SQLite.
 * State is lost when the process exits.
 *
 * <h3>Startup behavior</h3>
 * The store is pre-seeded with a few starred thread roots from
 * {@link TestDataGenerator}, so the Starred tab shows content immediately.
 *
 * <h3>Copy semantics</h3>
 * Flags are copied on save and on load, like a round trip through the database
 * would. Mutating a message after saving it does not change what is stored.
 */
@Singleton
public class TestDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(TestDatabaseService.class);

    static final int SEEDED_STARRED_THREADS = 5;

    private record Row(String msgId, String threadId, long date, MessageFlags flags) {
    }

    private final Map<String, Row> store = new ConcurrentHashMap<>();

    public TestDatabaseService() {
        this(true);
    }

    TestDatabaseService(boolean seed) {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Flag persistence is DISABLED     #");
        LOG.warn("#######################################################");

        if (seed) {
            for (Message thread : TestDataGenerator.generateThreads(SEEDED_STARRED_THREADS)) {
                thread.getFlags().setStarred(true);
                saveMessage(thread);
            }
        }
    }

    @Override
    public void saveMessage(Message message) {
        MessageFlags flags = message.getFlags();
        store.put(message.getMsgId(), new Row(message.getMsgId(), message.getThreadId(),
                message.getDate().getEpochSecond(), new MessageFlags(flags.isRead(), flags.isStarred())));
    }

    @Override
    public Map<String, MessageFlags> loadFlags(Collection<String> msgIds) {
        Map<String, MessageFlags> result = new HashMap<>();
        for (String id : msgIds) {
            Row row = store.get(id);
            if (row != null)
                result.put(id, new MessageFlags(row.flags().isRead(), row.flags().isStarred()));
        }
        return result;
    }

    @Override
    public Map<String, Integer> countReadComments(Collection<String> threadIds) {
        return store.values().stream()
                .filter(row -> row.flags().isRead() && threadIds.contains(row.threadId()))
                .collect(Collectors.groupingBy(Row::threadId, Collectors.summingInt(row -> 1)));
    }

    @Override
    public List<String> getStarredThreadIds(int page) {
        if (page < 1)
            throw new IllegalArgumentException("page must be >= 1: " + page);

        Map<String, Long> newestStarredByThread = store.values().stream()
                .filter(row -> row.flags().isStarred())
                .collect(Collectors.toMap(Row::threadId, Row::date, Math::max));

        return newestStarredByThread.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .skip((long) (page - 1) * STARRED_PAGE_SIZE)
                .limit(STARRED_PAGE_SIZE)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
