package com.neowatch.common.exception;

/** Network error, timeout, 5xx or any other unexpected upstream status. */
public class UpstreamUnavailableException extends NeoFeedException {
    private final int statusCode;

    public UpstreamUnavailableException(String source, String message, int statusCode) {
        super(source, message);
        this.statusCode = statusCode;
    }

    public UpstreamUnavailableException(String source, String message, Throwable cause) {
        super(source, message, cause);
        this.statusCode = -1;
    }

    /** @return the HTTP status, or {@code -1} when no response was received */
    public int getStatusCode() {
        return statusCode;
    }
}
