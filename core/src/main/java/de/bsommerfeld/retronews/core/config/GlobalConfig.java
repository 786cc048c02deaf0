package de.bsommerfeld.retronews.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Every section is pre-populated with defaults, so
 * a missing or partial file still yields a fully usable configuration.
 */
public class GlobalConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("reader")
    private ReaderConfig reader = new ReaderConfig();

    @JsonProperty("hackernews")
    private HackerNewsConfig hackerNews = new HackerNewsConfig();

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public ReaderConfig getReader() {
        return reader;
    }

    public HackerNewsConfig getHackerNews() {
        return hackerNews;
    }

    public DatabaseConfig getDatabase() {
        return database;
    }
}
