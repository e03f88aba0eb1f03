package com.neowatch.common.exception;

/**
 * The upstream body, or a single entry inside it, could not be understood.
 */
public class UpstreamMalformedException extends NeoFeedException {

    public UpstreamMalformedException(String source, String message) {
        super(source, message);
    }

    public UpstreamMalformedException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
