package de.bsommerfeld.retronews.db;

import de.bsommerfeld.retronews.core.domain.Message;
import de.bsommerfeld.retronews.core.domain.MessageFlags;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Persistence contract for per-message user state. Only identifiers, the
 * thread relation, the date and the {@link MessageFlags} are stored; message
 * content always comes from the provider.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlDatabaseService}: SQLite file in the app data directory</li>
 * <li>{@link TestDatabaseService}: in-memory store for TEST mode</li>
 * </ul>
 * Both are thread-safe. Switching between them is done at the Guice module
 * level.
 */
public interface DatabaseService {

    /** Page size of {@link #getStarredThreadIds(int)}. */
    int STARRED_PAGE_SIZE = 30;

    /**
     * Stores the current flags of a message, replacing whatever was stored for
     * the same id before.
     */
    void saveMessage(Message message);

    /**
     * Returns the stored flags for those of the given ids that have been saved.
     * Ids never saved are absent from the result.
     */
    Map<String, MessageFlags> loadFlags(Collection<String> msgIds);

    /**
     * Counts, per thread, the saved messages whose flags mark them read. The
     * thread root counts as well. Threads without any read message are absent
     * from the result.
     */
    Map<String, Integer> countReadComments(Collection<String> threadIds);

    /**
     * Returns ids of threads containing at least one starred message, most
     * recent first.
     *
     * @param page 1-based page of {@value #STARRED_PAGE_SIZE} ids
     */
    List<String> getStarredThreadIds(int page);
}
