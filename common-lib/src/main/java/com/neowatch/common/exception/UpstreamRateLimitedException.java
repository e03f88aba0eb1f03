package com.neowatch.common.exception;

/** Upstream answered 429. */
public class UpstreamRateLimitedException extends NeoFeedException {

    public UpstreamRateLimitedException(String source, String message) {
        super(source, message);
    }
}
