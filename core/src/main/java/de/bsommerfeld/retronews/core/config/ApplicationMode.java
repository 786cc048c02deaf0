package de.bsommerfeld.retronews.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Running mode of the reader.
 *
 * <ul>
 * <li>{@link #PROD}: flags persist to SQLite, threads come from the live
 * Hacker News API</li>
 * <li>{@link #TEST}: in-memory flag store and an offline client serving
 * generated threads, no file or network access</li>
 * </ul>
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the mode from the system property {@code app.mode}, falling back
     * to the environment variable {@code APP_MODE}. Defaults to {@link #PROD}.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty("app.mode");
        if (mode == null || mode.isEmpty()) {
            mode = System.getenv("APP_MODE");
        }
        return parse(mode);
    }

    /** Case-insensitive lookup; blank or unknown values resolve to {@link #PROD}. */
    static ApplicationMode parse(String mode) {
        if (mode == null || mode.isBlank()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', falling back to PROD", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
