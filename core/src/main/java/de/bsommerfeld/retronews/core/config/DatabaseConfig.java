package de.bsommerfeld.retronews.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public class DatabaseConfig {

    /** File name of the SQLite database, resolved inside the app data directory. */
    @JsonProperty("file-name")
    private String fileName = "retronews.db";

    public String getFileName() {
        return fileName;
    }
}
