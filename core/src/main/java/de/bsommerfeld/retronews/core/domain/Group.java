package de.bsommerfeld.retronews.core.domain;

import java.util.Objects;

/**
 * One page of a thread listing, e.g. page 2 of the Hacker News front page.
 *
 * @param provider source of the threads
 * @param name     listing name passed to the provider, empty if it has none
 * @param label    human-readable tab title
 * @param page     1-based page number
 */
public record Group(GroupProvider provider, String name, String label, int page) {

    public Group {
        Objects.requireNonNull(provider, "provider");
        name = name == null ? "" : name;
        label = label == null ? "" : label;
        if (page < 1)
            throw new IllegalArgumentException("page must be >= 1: " + page);
    }

    public Group(GroupProvider provider, String name, String label) {
        this(provider, name, label, 1);
    }

    public Group withPage(int page) {
        return new Group(provider, name, label, page);
    }

    /** Moves {@code offset} pages forward (or backward if negative), never below page 1. */
    public Group advancePage(int offset) {
        return withPage(Math.max(1, page + offset));
    }
}
