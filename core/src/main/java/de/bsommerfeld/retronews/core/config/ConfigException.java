package de.bsommerfeld.retronews.core.config;

/**
 * Raised when the configuration file exists but cannot be read or parsed, or
 * when the defaults cannot be written.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
