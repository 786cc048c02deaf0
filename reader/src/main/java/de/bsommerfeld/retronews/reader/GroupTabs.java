package de.bsommerfeld.retronews.reader;

import de.bsommerfeld.retronews.core.domain.Group;
import de.bsommerfeld.retronews.core.domain.GroupProvider;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The fixed set of groups reachable through the number keys.
 */
public final class GroupTabs {

    public static final List<Group> ALL = List.of(
            new Group(GroupProvider.HN, "news", "Front Page"),
            new Group(GroupProvider.HN_NEW, "", "New"),
            new Group(GroupProvider.HN, "ask", "Ask HN"),
            new Group(GroupProvider.HN, "show", "Show HN"),
            new Group(GroupProvider.STARRED, "", "Starred"));

    private GroupTabs() {
    }

    /** @param tab 1-based tab number */
    public static Optional<Group> get(int tab) {
        if (tab < 1 || tab > ALL.size())
            return Optional.empty();
        return Optional.of(ALL.get(tab - 1));
    }

    /**
     * Resolves a tab by number, label or group name, ignoring case, e.g.
     * {@code 1}, {@code "Ask HN"} or {@code "show"}.
     */
    public static Optional<Group> find(String key) {
        String trimmed = key.trim();
        if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
            try {
                return get(Integer.parseInt(trimmed));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }

        String normalized = trimmed.toLowerCase(Locale.ROOT);
        for (Group group : ALL) {
            if (group.label().toLowerCase(Locale.ROOT).equals(normalized)
                    || (!group.name().isEmpty() && group.name().equals(normalized))
                    || (group.name().isEmpty() && group.provider().id().equals(normalized))) {
                return Optional.of(group);
            }
        }
        return Optional.empty();
    }

    /** Whether two groups show the same listing, regardless of page. */
    public static boolean sameListing(Group a, Group b) {
        return a.provider() == b.provider() && a.name().equals(b.name());
    }
}
