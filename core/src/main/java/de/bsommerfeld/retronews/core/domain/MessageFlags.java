package de.bsommerfeld.retronews.core.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * User state attached to a message. Persisted as a JSON object
 * ({@code {"read":false,"starred":false}}), which is why the field names are
 * part of the storage format.
 */
@JsonPropertyOrder({ "read", "starred" })
public class MessageFlags {

    @JsonProperty("read")
    private boolean read;

    @JsonProperty("starred")
    private boolean starred;

    public MessageFlags() {
    }

    public MessageFlags(boolean read, boolean starred) {
        this.read = read;
        this.starred = starred;
    }

    public boolean isRead() {
        return read;
    }

    public void setRead(boolean read) {
        this.read = read;
    }

    public boolean isStarred() {
        return starred;
    }

    public void setStarred(boolean starred) {
        this.starred = starred;
    }

    public void toggleStarred() {
        this.starred = !starred;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MessageFlags))
            return false;
        MessageFlags other = (MessageFlags) o;
        return read == other.read && starred == other.starred;
    }

    @Override
    public int hashCode() {
        return (read ? 1 : 0) * 31 + (starred ? 1 : 0);
    }

    @Override
    public String toString() {
        return "MessageFlags{read=" + read + ", starred=" + starred + "}";
    }
}
