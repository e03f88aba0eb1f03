package com.neowatch.feed.model;

import com.neowatch.common.model.FeedStatus;

/**
 * Outcome of one feed fetch. {@code realData} is {@code false} only when the static
 * sample set had to be served.
 */
public record FetchResult(
    NeoFeedPayload payload,
    boolean        realData,
    FeedStatus     status
) {

    public static FetchResult of(NeoFeedPayload payload, FeedStatus status) {
        return new FetchResult(payload, status.isRealData(), status);
    }
}
