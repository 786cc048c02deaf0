package de.bsommerfeld.retronews.reader;

import de.bsommerfeld.retronews.core.config.ReaderConfig;
import de.bsommerfeld.retronews.core.domain.Group;
import de.bsommerfeld.retronews.core.domain.Message;
import de.bsommerfeld.retronews.core.domain.MessageFlags;
import de.bsommerfeld.retronews.db.DatabaseService;
import de.bsommerfeld.retronews.hn.HackerNewsClient;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * State of one reading session, independent of any terminal: the loaded group,
 * the message index, the selection, the pager and a one-line flash message.
 *
 * <h3>Index</h3>
 * The index normally lists thread headers. Opening a thread fetches the full
 * tree and splices it in place of its header, closing it collapses the index
 * back to headers. At most one thread is open at a time.
 *
 * <h3>Read state</h3>
 * A message is marked read and persisted whenever it is selected while the
 * pager is visible; the read count of its thread is reloaded right after.
 *
 * <h3>Failures</h3>
 * Fetch failures never escape: they leave the previous state untouched and
 * set the flash to {@code Error: <message>}.
 *
 * <p>
 * Not thread-safe; a session is driven by a single input loop.
 */
public class ReaderSession {

    private static final Logger LOG = LoggerFactory.getLogger(ReaderSession.class);

    public static final String HELP_MENU = "q:Quit  ?:Help  p:Prev  n:Next  N:Next-Unread  j:Down  k:Up  x:Close  s:Star";

    /** Rows taken by the top menu, the bottom menu and the flash line. */
    private static final int MENU_ROWS = 3;

    private final DatabaseService database;
    private final HackerNewsClient hackerNews;
    private final ReaderConfig config;

    private Group group = GroupTabs.ALL.get(0);
    private List<Message> messages = new ArrayList<>();
    private Map<String, Message> messagesById = new LinkedHashMap<>();
    private Message selected;
    private boolean pagerVisible;
    private int pagerOffset;
    private boolean rawMode;
    private String flash;
    private int lines;
    private int columns;

    @Inject
    public ReaderSession(DatabaseService database, HackerNewsClient hackerNews, ReaderConfig config) {
        this.database = database;
        this.hackerNews = hackerNews;
        this.config = config;
        this.lines = config.getMinLines();
        this.columns = config.getMinColumns();
    }

    // =====================================================================
    // Groups
    // =====================================================================

    /** @param tab 1-based tab number; unknown tabs are ignored */
    public void loadTab(int tab) {
        GroupTabs.get(tab).ifPresent(this::loadGroup);
    }

    public void loadGroup(Group target) {
        String progress = "Fetching stories from '" + target.label() + "' (page " + target.page() + ")...";
        List<Message> fetched = safeRun(() -> fetchThreads(target), progress);
        if (fetched == null)
            return;

        loadMessages(fetched, null, false);
        this.group = target;
    }

    public void reloadPage() {
        loadGroup(group);
    }

    public void loadPrevPage() {
        loadGroup(group.advancePage(-1));
    }

    public void loadNextPage() {
        loadGroup(group.advancePage(1));
    }

    /**
     * Jumps to a page typed by the user. Blank input cancels, anything but a
     * positive number sets the flash.
     */
    public void loadPage(String input) {
        String trimmed = input == null ? "" : input.trim();
        if (trimmed.isEmpty())
            return;

        int page;
        try {
            page = Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            page = 0;
        }
        if (page < 1) {
            flash = "Invalid page number";
            return;
        }
        loadGroup(group.withPage(page));
    }

    List<Message> fetchThreads(Group target) {
        switch (target.provider()) {
            case HN:
                return hackerNews.fetchThreads(target.name(), target.page());
            case HN_NEW:
                return hackerNews.fetchNewThreads(target.page());
            case STARRED:
                return fetchStarredThreads(target.page());
            default:
                return new ArrayList<>();
        }
    }

    private List<Message> fetchStarredThreads(int page) {
        Map<String, List<String>> sourceIdsByProvider = new LinkedHashMap<>();
        for (String threadId : database.getStarredThreadIds(page)) {
            String[] parts = Message.splitId(threadId);
            sourceIdsByProvider.computeIfAbsent(parts[1], k -> new ArrayList<>()).add(parts[0]);
        }

        List<Message> threads = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : sourceIdsByProvider.entrySet()) {
            if (HackerNewsClient.PROVIDER.equals(entry.getKey())) {
                threads.addAll(hackerNews.fetchThreadsById(entry.getValue()));
            } else {
                LOG.warn("Skipping {} starred threads of unknown provider '{}'", entry.getValue().size(),
                        entry.getKey());
            }
        }
        threads.sort(Comparator.comparing(Message::getDate).reversed());
        return threads;
    }

    private Message fetchThread(String threadId) {
        String[] parts = Message.splitId(threadId);
        if (!HackerNewsClient.PROVIDER.equals(parts[1]))
            throw new IllegalArgumentException("Unknown provider '" + parts[1] + "'");
        return hackerNews.fetchThread(parts[0]);
    }

    // =====================================================================
    // Index
    // =====================================================================

    /**
     * Replaces the index. The selection is kept by id if possible, otherwise
     * the first message is selected. Stored flags and read counts are applied
     * before selecting.
     *
     * @param selectedId id to select, or {@code null} to keep the current one
     */
    void loadMessages(List<Message> newMessages, String selectedId, boolean showPager) {
        if (selectedId == null && selected != null)
            selectedId = selected.getMsgId();

        Message toSelect = null;
        Map<String, Message> byId = new LinkedHashMap<>();
        for (int i = 0; i < newMessages.size(); i++) {
            Message message = newMessages.get(i);
            message.setIndexPosition(i);
            byId.put(message.getMsgId(), message);
            if (message.getMsgId().equals(selectedId))
                toSelect = message;
        }
        if (toSelect == null && !newMessages.isEmpty())
            toSelect = newMessages.get(0);

        this.messages = newMessages;
        this.messagesById = byId;

        applyStoredFlags();
        applyReadCounts(threadIdsOf(newMessages));

        selectMessage(toSelect, showPager);
    }

    private void applyStoredFlags() {
        Map<String, MessageFlags> stored = database.loadFlags(messagesById.keySet());
        stored.forEach((id, flags) -> {
            Message message = messagesById.get(id);
            if (message != null)
                message.setFlags(flags);
        });
    }

    private void applyReadCounts(List<String> threadIds) {
        if (threadIds.isEmpty())
            return;
        database.countReadComments(threadIds).forEach((threadId, count) -> {
            Message thread = messagesById.get(threadId);
            if (thread != null)
                thread.setReadComments(count);
        });
    }

    private static List<String> threadIdsOf(List<Message> messages) {
        List<String> ids = new ArrayList<>();
        for (Message message : messages) {
            if (message.isThread())
                ids.add(message.getMsgId());
        }
        return ids;
    }

    /**
     * Selects a message and rebuilds its pager lines. Messages without a body
     * hide the pager.
     */
    void selectMessage(Message message, boolean showPager) {
        this.selected = message;
        refreshMessage();

        if (message == null || !message.isLoaded()) {
            pagerVisible = false;
            return;
        }
        if (showPager)
            pagerVisible = true;

        if (pagerVisible) {
            message.getFlags().setRead(true);
            database.saveMessage(message);
            applyReadCounts(List.of(message.getThreadId()));
        }
    }

    private void refreshMessage() {
        pagerOffset = 0;
        if (selected == null)
            return;

        List<String> built = rawMode
                ? MessageLines.buildRaw(selected, config.getRawWidth())
                : MessageLines.build(selected, config.getWidth());
        selected.setLines(MessageLines.sanitize(built));
    }

    public void openThread(Message threadMessage) {
        String threadId = threadMessage.getThreadId();
        Message loaded = safeRun(() -> fetchThread(threadId), "Fetching thread '" + threadId + "'...");
        if (loaded == null)
            return;

        closeThread();

        int position = threadMessage.getIndexPosition();
        List<Message> flattened = ThreadFlattener.flatten(loaded);
        loaded.setTotalComments(flattened.size());

        List<Message> spliced = new ArrayList<>(messages.subList(0, position));
        spliced.addAll(flattened);
        spliced.addAll(messages.subList(position + 1, messages.size()));

        LOG.debug("Opened thread {} with {} messages", threadId, flattened.size());
        loadMessages(spliced, threadMessage.getMsgId(), true);
    }

    /** Collapses the index back to unloaded thread headers. */
    public void closeThread() {
        String selectedThreadId = selected == null ? null : selected.getThreadId();
        List<Message> headers = new ArrayList<>();
        for (Message message : messages) {
            if (message.isThread())
                headers.add(message.unload());
        }
        loadMessages(headers, selectedThreadId, false);
    }

    // =====================================================================
    // Commands
    // =====================================================================

    public void open() {
        if (selected == null)
            return;
        if (selected.isThread())
            openThread(selected);
        else
            selectMessage(selected, true);
    }

    /** Hides the pager, or closes the open thread if the pager is hidden. */
    public void close() {
        if (pagerVisible)
            pagerVisible = false;
        else
            closeThread();
    }

    public void up() {
        if (pagerVisible)
            pagerUp();
        else
            prev();
    }

    public void down() {
        if (pagerVisible)
            pagerDown();
        else
            next();
    }

    public void prev() {
        int position = selected == null ? 0 : selected.getIndexPosition() - 1;
        selectMessage(messageAt(position), false);
    }

    public void next() {
        int position = selected == null ? 0 : selected.getIndexPosition() + 1;
        selectMessage(messageAt(position), false);
    }

    /** Selects the next message after the current one that is shown as unread. */
    public void nextUnread() {
        int position = selected == null ? 0 : selected.getIndexPosition() + 1;
        for (int i = Math.max(position, 0); i < messages.size(); i++) {
            if (!messages.get(i).isShownAsRead()) {
                selectMessage(messages.get(i), false);
                return;
            }
        }
    }

    public void pageUp() {
        if (pagerVisible)
            pagerPageUp();
        else
            indexPageUp();
    }

    public void pageDown() {
        if (pagerVisible)
            pagerPageDown();
        else
            indexPageDown();
    }

    private void indexPageUp() {
        int position = selected == null ? 0 : selected.getIndexPosition() - layout().indexHeight();
        selectMessage(messageAt(Math.max(position, 0)), false);
    }

    private void indexPageDown() {
        int position = selected == null ? 0 : selected.getIndexPosition() + layout().indexHeight();
        selectMessage(messageAt(Math.min(position, messages.size() - 1)), false);
    }

    public void pagerUp() {
        pagerOffset = Math.max(0, pagerOffset - 1);
    }

    public void pagerDown() {
        int height = layout().pagerHeight();
        if (selected != null && height > 0)
            pagerOffset = Math.min(pagerOffset + 1, maxPagerOffset(height));
    }

    public void pagerPageUp() {
        int height = layout().pagerHeight();
        if (height > 0)
            pagerOffset = Math.max(0, pagerOffset - height);
    }

    public void pagerPageDown() {
        int height = layout().pagerHeight();
        if (selected != null && height > 0)
            pagerOffset = Math.min(pagerOffset + height, maxPagerOffset(height));
    }

    private int maxPagerOffset(int height) {
        return Math.max(0, selected.getLines().size() - height);
    }

    /** Toggles the star of the selected message and moves on. */
    public void star() {
        if (selected == null)
            return;
        selected.getFlags().toggleStarred();
        database.saveMessage(selected);
        next();
    }

    /** Toggles the star of the selected message's thread root and moves on. */
    public void starThread() {
        if (selected == null)
            return;
        Message thread = messagesById.get(selected.getThreadId());
        if (thread == null)
            return;
        thread.getFlags().toggleStarred();
        database.saveMessage(thread);
        next();
    }

    public void toggleRawMode() {
        rawMode = !rawMode;
        selectMessage(selected, false);
    }

    /** Records a new terminal size and rebuilds the pager lines. */
    public void resize(int lines, int columns) {
        this.lines = lines;
        this.columns = columns;
        refreshMessage();
    }

    private Message messageAt(int position) {
        if (position < 0 || position >= messages.size())
            return selected;
        return messages.get(position);
    }

    // =====================================================================
    // Presentation
    // =====================================================================

    /**
     * Row split of the terminal: top menu, index, an optional status bar and
     * pager, bottom menu and flash line.
     *
     * @throws IllegalStateException if the terminal is below the configured
     *                               minimum size
     */
    public Layout layout() {
        if (lines < config.getMinLines() || columns < config.getMinColumns()) {
            throw new IllegalStateException("At least " + config.getMinColumns() + "x" + config.getMinLines()
                    + " terminal is required");
        }
        int maxIndexHeight = lines - MENU_ROWS;
        int indexHeight = pagerVisible ? maxIndexHeight / 3 : maxIndexHeight;
        int pagerHeight = 0;
        if (pagerVisible) {
            int pagerStart = 1 + indexHeight + 1;
            pagerHeight = lines - pagerStart - 2;
        }
        return new Layout(lines, columns, indexHeight, pagerHeight);
    }

    /** Index rows around the selection, as many as fit the index height. */
    public List<String> indexRows() {
        int height = layout().indexHeight();
        int offset = selected == null ? 0 : selected.getIndexPosition() - height / 2;
        offset = Math.max(Math.min(offset, messages.size() - height), 0);

        List<String> rows = new ArrayList<>();
        int count = Math.min(height, messages.size() - offset);
        for (int i = 0; i < count; i++) {
            Message message = messages.get(i + offset);
            boolean hide = IndexRow.hidesTitle(message, i == 0, message == selected);
            rows.add(IndexRow.format(message, hide));
        }
        return rows;
    }

    /** Visible pager lines, padded with filler lines below the message. */
    public List<String> pagerLines() {
        int height = layout().pagerHeight();
        List<String> visible = new ArrayList<>();
        if (selected == null || height == 0)
            return visible;

        List<String> all = selected.getLines();
        for (int i = 0; i < height; i++) {
            int index = i + pagerOffset;
            visible.add(index < all.size() ? all.get(index) : PagerLineStyle.FILLER_LINE);
        }
        return visible;
    }

    /**
     * Status bar between index and pager, e.g.
     * {@code --(3/12 unread)--(starred thread)-----}, padded to the terminal
     * width. Empty if nothing is selected.
     */
    public String threadStatus() {
        if (selected == null)
            return "";
        Message thread = messagesById.get(selected.getThreadId());
        if (thread == null)
            return "";

        int total = thread.getTotalComments();
        StringBuilder text = new StringBuilder()
                .append("--(").append(total - thread.getReadComments()).append('/').append(total)
                .append(" unread)");
        if (thread.getFlags().isStarred())
            text.append("--(starred thread)");
        return pad(text.toString(), columns, '-');
    }

    /** Bottom menu: numbered tabs on the left, the page on the right. */
    public String groupMenu() {
        StringBuilder tabs = new StringBuilder();
        for (int i = 0; i < GroupTabs.ALL.size(); i++) {
            tabs.append(i + 1).append(':').append(GroupTabs.ALL.get(i).label()).append("  ");
        }
        String page = "page: " + group.page();
        int gap = Math.max(1, columns - tabs.length() - page.length());
        return tabs + " ".repeat(gap) + page;
    }

    private static String pad(String text, int width, char fill) {
        if (text.length() >= width)
            return text.substring(0, width);
        return text + String.valueOf(fill).repeat(width - text.length());
    }

    /**
     * Runs a fetch with a progress flash. The flash is cleared on success and
     * replaced by the error on failure.
     *
     * @return the result, or {@code null} if the fetch failed
     */
    private <T> T safeRun(Supplier<T> fetch, String progress) {
        flash = progress;
        try {
            T result = fetch.get();
            flash = null;
            return result;
        } catch (RuntimeException e) {
            LOG.warn("{} failed", progress, e);
            flash = "Error: " + e.getMessage();
            return null;
        }
    }

    // =====================================================================
    // Accessors
    // =====================================================================

    public Group getGroup() {
        return group;
    }

    public List<Message> getMessages() {
        return messages;
    }

    public Message getSelected() {
        return selected;
    }

    public boolean isPagerVisible() {
        return pagerVisible;
    }

    public int getPagerOffset() {
        return pagerOffset;
    }

    public boolean isRawMode() {
        return rawMode;
    }

    /** Current flash message, or {@code null} if there is none. */
    public String getFlash() {
        return flash;
    }

    public void setFlash(String flash) {
        this.flash = flash;
    }

    /**
     * Terminal rows and columns split into index and pager heights.
     * {@code pagerHeight} is 0 while the pager is hidden.
     */
    public record Layout(int lines, int columns, int indexHeight, int pagerHeight) {
    }
}
