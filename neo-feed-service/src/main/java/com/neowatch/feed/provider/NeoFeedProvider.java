package com.neowatch.feed.provider;

import com.neowatch.common.model.FeedSnapshot;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * Source of scored feed snapshots for the rest of the system.
 */
public interface NeoFeedProvider {
    Mono<FeedSnapshot> fetchFeed(LocalDate startDate, LocalDate endDate);
}
