package de.bsommerfeld.retronews.hn;

import com.google.inject.Singleton;
import de.bsommerfeld.retronews.core.config.HackerNewsConfig;
import de.bsommerfeld.retronews.core.domain.Message;
import de.bsommerfeld.retronews.core.util.TestDataGenerator;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Offline stub that replaces the real {@link HackerNewsClient} when the
 * reader runs in TEST mode.
 *
 * <h3>No network access</h3>
 * Every method returns synthetic data from {@link TestDataGenerator}.
 *
 * <h3>Stable threads</h3>
 * A thread tree is generated on first access and then served from memory,
 * so reopening a thread yields the same comment ids and stored read flags
 * keep matching. Headers report the comment total of their tree once it
 * exists.
 *
 * @see TestDataGenerator
 */
@Singleton
public class TestHackerNewsClient extends HackerNewsClient {

    private static final Logger LOG = LoggerFactory.getLogger(TestHackerNewsClient.class);

    private final Map<String, Message> threads = new ConcurrentHashMap<>();
    private final int pageSize;

    @Inject
    public TestHackerNewsClient(HackerNewsConfig config) {
        super(config);
        this.pageSize = config.getPageSize();
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Hacker News client is OFFLINE   #");
        LOG.warn("#  Using Dummy Data Generator for all requests        #");
        LOG.warn("#######################################################");
    }

    @Override
    public List<Message> fetchThreads(String listing, int page) {
        LOG.debug("[TEST] Simulating listing '{}' page {}", listing, page);
        return TestDataGenerator.generateThreads(pageSize);
    }

    @Override
    public List<Message> fetchNewThreads(int page) {
        LOG.debug("[TEST] Simulating newest stories page {}", page);
        return TestDataGenerator.generateThreads(pageSize);
    }

    @Override
    public List<Message> fetchThreadsById(List<String> sourceIds) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        List<Message> headers = new ArrayList<>();
        for (int i = 0; i < sourceIds.size(); i++) {
            String sourceId = sourceIds.get(i);
            Message header = TestDataGenerator.generateThread(sourceId, now.minusSeconds(3600L * i));
            Message tree = threads.get(sourceId);
            if (tree != null)
                header.setTotalComments(tree.getTotalComments());
            headers.add(header);
        }
        headers.sort(Comparator.comparing(Message::getDate).reversed());
        return headers;
    }

    /**
     * Returns a deep copy of the cached tree, so a caller unloading or
     * re-flagging the result does not change what the next fetch returns.
     */
    @Override
    public Message fetchThread(String sourceId) {
        Message tree = threads.computeIfAbsent(sourceId,
                id -> TestDataGenerator.generateThreadTree(id, 10 + (int) (Math.random() * 20)));
        return copy(tree);
    }

    private static Message copy(Message source) {
        Message target = new Message(source.getMsgId(), source.getThreadId(), source.getContentLocation(),
                source.getDate(), source.getAuthor(), source.getTitle());
        target.setBody(source.getBody());
        target.setTotalComments(source.getTotalComments());
        for (Message child : source.getChildren()) {
            target.getChildren().add(copy(child));
        }
        return target;
    }
}
