package de.bsommerfeld.retronews.core.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A story or comment as shown in the index and the pager.
 *
 * <p>
 * Identifiers have the form {@code <sourceId>@<provider>}, e.g.
 * {@code 8863@hn}. A message whose id equals its thread id is the thread root.
 *
 * <h3>Loaded vs. unloaded</h3>
 * Listing pages only deliver thread headers: {@link #getBody()} is
 * {@code null} and there are no children. Opening a thread replaces the header
 * with the fully loaded tree; closing it {@link #unload() unloads} the root
 * again. For unloaded thread roots the read state shown in the index is
 * derived from the comment counters instead of the root's own flag.
 *
 * <p>
 * Instances are mutable and owned by a single reader session, they are not
 * thread-safe.
 */
public class Message {

    private final String msgId;
    private final String threadId;
    private final String contentLocation;
    private final Instant date;
    private final String author;
    private final String title;

    private String body;
    private List<String> lines = new ArrayList<>();
    private List<Message> children = new ArrayList<>();
    private MessageFlags flags = new MessageFlags();
    private int readComments;
    private int totalComments;
    private int indexPosition;
    private String indexTree = "";

    public Message(String msgId, String threadId, String contentLocation, Instant date, String author,
            String title) {
        this.msgId = Objects.requireNonNull(msgId, "msgId");
        this.threadId = Objects.requireNonNull(threadId, "threadId");
        this.contentLocation = contentLocation;
        this.date = Objects.requireNonNull(date, "date");
        this.author = author;
        this.title = title;
    }

    public String getMsgId() {
        return msgId;
    }

    public String getThreadId() {
        return threadId;
    }

    public String getContentLocation() {
        return contentLocation;
    }

    public Instant getDate() {
        return date;
    }

    public String getAuthor() {
        return author;
    }

    public String getTitle() {
        return title;
    }

    /** HTML body, {@code null} while the message is not loaded. */
    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    /** Pager lines built for the current render mode. */
    public List<String> getLines() {
        return lines;
    }

    public void setLines(List<String> lines) {
        this.lines = lines;
    }

    public List<Message> getChildren() {
        return children;
    }

    public void setChildren(List<Message> children) {
        this.children = children;
    }

    public MessageFlags getFlags() {
        return flags;
    }

    public void setFlags(MessageFlags flags) {
        this.flags = Objects.requireNonNull(flags, "flags");
    }

    public int getReadComments() {
        return readComments;
    }

    public void setReadComments(int readComments) {
        this.readComments = readComments;
    }

    /** Number of messages in the thread, root included. */
    public int getTotalComments() {
        return totalComments;
    }

    public void setTotalComments(int totalComments) {
        this.totalComments = totalComments;
    }

    public int getIndexPosition() {
        return indexPosition;
    }

    public void setIndexPosition(int indexPosition) {
        this.indexPosition = indexPosition;
    }

    /** Tree prefix drawn in front of the subject in the index, e.g. {@code "│ └─> "}. */
    public String getIndexTree() {
        return indexTree;
    }

    public void setIndexTree(String indexTree) {
        this.indexTree = indexTree;
    }

    // =====================================================================
    // Derived state
    // =====================================================================

    public boolean isLoaded() {
        return body != null;
    }

    public boolean isRead() {
        return flags.isRead();
    }

    public boolean isThread() {
        return msgId.equals(threadId);
    }

    /**
     * Read state as displayed: an unloaded thread counts as read once all of
     * its messages are, anything else uses its own flag.
     */
    public boolean isShownAsRead() {
        if (isThread() && !isLoaded())
            return readComments >= totalComments;
        return isRead();
    }

    /** Drops body and children, turning a loaded thread back into a header. */
    public Message unload() {
        this.children = new ArrayList<>();
        this.body = null;
        return this;
    }

    /** The id without its provider suffix. */
    public String sourceId() {
        return splitId(msgId)[0];
    }

    public String provider() {
        return splitId(msgId)[1];
    }

    /**
     * Splits {@code <sourceId>@<provider>}.
     *
     * @throws IllegalArgumentException if the id carries no provider
     */
    public static String[] splitId(String id) {
        int at = id.lastIndexOf('@');
        if (at <= 0 || at == id.length() - 1)
            throw new IllegalArgumentException("Not a provider-qualified id: " + id);
        return new String[] { id.substring(0, at), id.substring(at + 1) };
    }

    @Override
    public String toString() {
        return "Message{" + msgId + ", thread=" + threadId + ", title=" + title + "}";
    }
}
