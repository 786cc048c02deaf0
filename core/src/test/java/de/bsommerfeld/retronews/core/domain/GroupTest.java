package de.bsommerfeld.retronews.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GroupTest {

    private final Group frontPage = new Group(GroupProvider.HN, "news", "Front Page");

    @Test
    void constructor_shouldDefaultToFirstPage() {
        assertEquals(1, frontPage.page());
    }

    @Test
    void constructor_shouldRejectPageBelowOne() {
        assertThrows(IllegalArgumentException.class, () -> frontPage.withPage(0));
    }

    @Test
    void withPage_shouldKeepEverythingElse() {
        Group page3 = frontPage.withPage(3);

        assertEquals(3, page3.page());
        assertEquals(GroupProvider.HN, page3.provider());
        assertEquals("news", page3.name());
        assertEquals("Front Page", page3.label());
        assertEquals(1, frontPage.page());
    }

    @Test
    void advancePage_shouldMoveInBothDirections() {
        assertEquals(2, frontPage.advancePage(1).page());
        assertEquals(4, frontPage.withPage(5).advancePage(-1).page());
    }

    @Test
    void advancePage_shouldClampAtFirstPage() {
        assertEquals(1, frontPage.advancePage(-1).page());
        assertEquals(1, frontPage.withPage(2).advancePage(-10).page());
    }

    @Test
    void constructor_shouldNormalizeNullNameToEmpty() {
        assertEquals("", new Group(GroupProvider.STARRED, null, "Starred").name());
    }
}
