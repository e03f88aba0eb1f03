package com.neowatch.common.exception;

/**
 * Base type for upstream feed failures. None of these reach a feed consumer: the
 * fetcher resolves each of them into stale or fallback data.
 */
public class NeoFeedException extends RuntimeException {
    private final String source;

    public NeoFeedException(String source, String message) {
        super("[" + source + "] " + message);
        this.source = source;
    }

    public NeoFeedException(String source, String message, Throwable cause) {
        super("[" + source + "] " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
