package de.bsommerfeld.retronews.core.util;

import de.bsommerfeld.retronews.core.domain.Message;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates Hacker News-like threads for offline development and TEST mode.
 *
 * <h3>What the output looks like</h3>
 * <ul>
 * <li><strong>Thread headers</strong>: unloaded roots ({@code body == null})
 * with numeric ids ({@code <n>@hn}), titles composed from three pools and
 * comment counts between 1 and 120, just like a search API page</li>
 * <li><strong>Thread trees</strong>: a loaded root whose body starts with the
 * story link, followed by nested comments. Comment bodies use the markup real
 * comments carry: paragraphs, {@code >} quotes, links, inline code and
 * {@code pre} blocks</li>
 * </ul>
 *
 * <p>
 * {@code TestDatabaseService} and {@code TestHackerNewsClient} are the only
 * consumers.
 */
public class TestDataGenerator {

    private static final Random RND = new Random();
    private static final AtomicLong NEXT_ID = new AtomicLong(40_000_000L + RND.nextInt(1_000_000));

    public static final String PROVIDER = "hn";
    private static final String ITEM_URL = "https://news.ycombinator.com/item?id=";

    // --- Data Pools ---

    private static final String[] TITLES_PART_1 = { "Show HN:", "Ask HN:", "", "", "Launch HN:" };
    private static final String[] TITLES_PART_2 = { "A terminal reader", "Why SQLite", "The case for plain text",
            "A tiny HTML parser", "Lessons from a decade of", "How we cut latency" };
    private static final String[] TITLES_PART_3 = { "in 500 lines", "(2019)", "for Usenet fans", "that fits on a floppy",
            "written in a weekend", "" };

    private static final String[] AUTHORS = { "pg", "dang", "tptacek", "patio11", "jacquesm", "throwaway42",
            "retro_fan", "kernel_hacker" };

    private static final String[] COMMENTS = {
            "<p>This is really neat. How does it handle malformed markup?</p>",
            "<p>&gt; How does it handle malformed markup?<p>It doesn&#x27;t crash, that&#x27;s the main thing.",
            "<p>I tried something similar years ago, see <a href=\"https://example.com/post\">my write-up</a>.</p>",
            "<p>The trick is to call <code>fsync</code> only once per batch.</p>",
            "<p>Minimal example:</p><pre><code>  for line in lines:\n      print(line)\n</code></pre>",
            "<p>Counterpoint: <i>most</i> people will never notice the difference.</p>",
            "<p>Reminds me of reading Usenet over a 2400 baud modem.</p><p>Good times.</p>",
            "<p>Source: <a href=\"https://en.wikipedia.org/wiki/Hacker_News\">https://en.wikipedia.org/wiki/Hacker_...</a></p>",
    };

    // --- Generator Methods ---

    /**
     * Generates an unloaded thread header dated now.
     *
     * @return a thread root with {@code msgId == threadId} and no body
     */
    public static Message generateThread() {
        return generateThread(Instant.now());
    }

    private static Message generateThread(Instant date) {
        return generateThread(String.valueOf(NEXT_ID.getAndIncrement()), date);
    }

    /**
     * Generates an unloaded thread header for a given story id.
     *
     * @param sourceId numeric story id, without provider suffix
     */
    public static Message generateThread(String sourceId, Instant date) {
        String threadId = sourceId + "@" + PROVIDER;
        Message thread = new Message(threadId, threadId, ITEM_URL + sourceId, date, randomElement(AUTHORS),
                generateTitle());
        thread.setTotalComments(1 + RND.nextInt(120));
        return thread;
    }

    /**
     * Generates thread headers spread linearly across the last 24 hours.
     *
     * @return headers sorted newest first
     */
    public static List<Message> generateThreads(int count) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        List<Message> list = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            long age = (long) ((i / (double) count) * 3600 * 24);
            list.add(generateThread(now.minusSeconds(age)));
        }
        list.sort(Comparator.comparing(Message::getDate).reversed());
        return list;
    }

    /**
     * Generates a fully loaded thread with {@code commentCount} comments.
     *
     * <p>
     * About 40% of the comments reply to the root. Every further comment picks a
     * random parent from a growing pool, and half of the replies join the pool
     * themselves, which gives varying depths without an explicit limit.
     *
     * @param sourceId numeric story id, without provider suffix
     */
    public static Message generateThreadTree(String sourceId, int commentCount) {
        String threadId = sourceId + "@" + PROVIDER;
        Instant created = Instant.now().truncatedTo(ChronoUnit.SECONDS).minusSeconds(RND.nextInt(3600 * 24));

        String title = generateTitle();
        Message root = new Message(threadId, threadId, ITEM_URL + sourceId, created, randomElement(AUTHORS), title);
        root.setBody("<p>https://example.com/" + sourceId + "</p>" + randomElement(COMMENTS));

        int rootReplies = Math.max(1, (int) (commentCount * 0.4));
        List<Message> pool = new ArrayList<>();
        for (int i = 0; i < Math.min(rootReplies, commentCount); i++) {
            Message reply = generateComment(threadId, title, created);
            root.getChildren().add(reply);
            pool.add(reply);
        }

        int remaining = commentCount - pool.size();
        while (remaining > 0 && !pool.isEmpty()) {
            Message parent = pool.get(RND.nextInt(pool.size()));
            Message reply = generateComment(threadId, title, parent.getDate());
            parent.getChildren().add(reply);
            if (RND.nextBoolean()) {
                pool.add(reply);
            }
            remaining--;
        }

        root.setTotalComments(commentCount + 1);
        return root;
    }

    private static Message generateComment(String threadId, String threadTitle, Instant after) {
        String id = String.valueOf(NEXT_ID.getAndIncrement());
        Message comment = new Message(id + "@" + PROVIDER, threadId, ITEM_URL + id,
                after.plusSeconds(1 + RND.nextInt(3600)), randomElement(AUTHORS), "Re: " + threadTitle);
        comment.setBody(randomElement(COMMENTS));
        return comment;
    }

    private static String generateTitle() {
        return String.join(" ", randomElement(TITLES_PART_1), randomElement(TITLES_PART_2),
                randomElement(TITLES_PART_3)).trim().replaceAll(" +", " ");
    }

    private static <T> T randomElement(T[] array) {
        return array[RND.nextInt(array.length)];
    }
}
