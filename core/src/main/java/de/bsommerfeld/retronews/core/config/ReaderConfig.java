package de.bsommerfeld.retronews.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pager layout parameters. Values are persisted in config.toml and loaded at
 * startup.
 */
public class ReaderConfig {

    /** Column width message bodies are rendered at. */
    @JsonProperty("width")
    private int width = 70;

    /** Column width raw HTML lines are wrapped at. */
    @JsonProperty("raw-width")
    private int rawWidth = 120;

    @JsonProperty("min-columns")
    private int minColumns = 80;

    @JsonProperty("min-lines")
    private int minLines = 25;

    public int getWidth() {
        return width;
    }

    public int getRawWidth() {
        return rawWidth;
    }

    public int getMinColumns() {
        return minColumns;
    }

    public int getMinLines() {
        return minLines;
    }
}
