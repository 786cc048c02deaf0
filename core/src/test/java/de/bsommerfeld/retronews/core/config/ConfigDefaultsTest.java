package de.bsommerfeld.retronews.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDefaultsTest {

    @Test
    void globalConfig_shouldInitializeWithDefaults() {
        var config = new GlobalConfig();

        assertFalse(config.isDebugMode());
        assertNotNull(config.getReader());
        assertNotNull(config.getHackerNews());
        assertNotNull(config.getDatabase());
    }

    @Test
    void readerConfig_shouldMatchPagerLayout() {
        var config = new ReaderConfig();

        assertEquals(70, config.getWidth());
        assertEquals(120, config.getRawWidth());
        assertEquals(80, config.getMinColumns());
        assertEquals(25, config.getMinLines());
    }

    @Test
    void hackerNewsConfig_shouldPointAtPublicEndpoints() {
        var config = new HackerNewsConfig();

        assertEquals("https://news.ycombinator.com", config.getSiteUrl());
        assertEquals("https://hn.algolia.com/api/v1", config.getApiUrl());
        assertEquals(10, config.getRequestTimeoutSeconds());
        assertEquals(30, config.getPageSize());
    }

    @Test
    void databaseConfig_shouldDefaultFileName() {
        assertEquals("retronews.db", new DatabaseConfig().getFileName());
    }
}
