package de.bsommerfeld.retronews.core.domain;

/**
 * Where the threads of a {@link Group} come from.
 */
public enum GroupProvider {

    /** A Hacker News listing page such as {@code news}, {@code ask} or {@code show}. */
    HN("hn"),
    /** Newest stories, paged through the search API. */
    HN_NEW("hn-new"),
    /** Threads the user starred locally. */
    STARRED("starred");

    private final String id;

    GroupProvider(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
