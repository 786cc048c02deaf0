package de.bsommerfeld.retronews.hn;

/**
 * A Hacker News request failed: the connection broke, the server answered
 * with a non-200 status, or the payload could not be parsed.
 */
public class HackerNewsException extends RuntimeException {

    public HackerNewsException(String message) {
        super(message);
    }

    public HackerNewsException(String message, Throwable cause) {
        super(message, cause);
    }
}
