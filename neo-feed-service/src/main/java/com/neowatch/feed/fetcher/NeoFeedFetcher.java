package com.neowatch.feed.fetcher;

import com.neowatch.common.cache.CacheLookup;
import com.neowatch.common.cache.ReactiveCacheStore;
import com.neowatch.common.exception.NeoFeedException;
import com.neowatch.common.exception.UpstreamRateLimitedException;
import com.neowatch.common.model.FeedStatus;
import com.neowatch.feed.client.NeoFeedWebClient;
import com.neowatch.feed.fallback.FallbackNeoCatalog;
import com.neowatch.feed.model.FetchResult;
import com.neowatch.feed.model.NeoFeedPayload;
import com.neowatch.feed.parse.NeoFeedParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Cached, degradation-aware access to the upstream feed.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Validate the date range; a bad range fails immediately.</li>
 *   <li>Look up {@code neo-feed:<start>:<end>} in the {@link ReactiveCacheStore}. A
 *       fresh entry is served without an upstream call ({@link FeedStatus#CACHED}).</li>
 *   <li>On miss, one upstream call is made for the key no matter how many callers are
 *       waiting; all of them get its result ({@link FeedStatus#LIVE}).</li>
 *   <li>If that call fails (429, 5xx, network, timeout, unreadable body) the last cached
 *       payload for the key is served ({@link FeedStatus#STALE}); without one, the static
 *       sample set ({@link FeedStatus#FALLBACK}).</li>
 * </ol>
 *
 * <p>Every path past validation ends in a usable {@link FetchResult}.
 */
@Component
public class NeoFeedFetcher {

    private static final Logger log = LoggerFactory.getLogger(NeoFeedFetcher.class);

    private final NeoFeedWebClient client;
    private final NeoFeedParser parser;
    private final FallbackNeoCatalog fallbackCatalog;
    private final ReactiveCacheStore<String, NeoFeedPayload> cache;
    private final Clock clock;
    private final Duration cacheTtl;
    private final int maxRangeDays;

    public NeoFeedFetcher(NeoFeedWebClient client,
                          NeoFeedParser parser,
                          FallbackNeoCatalog fallbackCatalog,
                          ReactiveCacheStore<String, NeoFeedPayload> neoFeedCache,
                          Clock clock,
                          @Value("${neo.feed.cache-ttl-seconds:300}") long cacheTtlSeconds,
                          @Value("${neo.feed.max-range-days:7}") int maxRangeDays) {
        this.client          = client;
        this.parser          = parser;
        this.fallbackCatalog = fallbackCatalog;
        this.cache           = neoFeedCache;
        this.clock           = clock;
        this.cacheTtl        = Duration.ofSeconds(cacheTtlSeconds);
        this.maxRangeDays    = maxRangeDays;
    }

    /**
     * @throws IllegalArgumentException when a date is null, {@code startDate} is after
     *         {@code endDate}, or the range spans more than the configured maximum
     */
    public Mono<FetchResult> fetchFeed(LocalDate startDate, LocalDate endDate) {
        validateRange(startDate, endDate);
        String key = cacheKey(startDate, endDate);

        return cache.lookupOrCompute(key, cacheTtl, () -> loadFromUpstream(startDate, endDate))
            .map(lookup -> FetchResult.of(lookup.value(),
                lookup.origin() == CacheLookup.Origin.HIT ? FeedStatus.CACHED : FeedStatus.LIVE))
            .onErrorResume(NeoFeedException.class, e -> Mono.fromSupplier(() -> degraded(key, startDate, e)));
    }

    public static String cacheKey(LocalDate startDate, LocalDate endDate) {
        return "neo-feed:" + startDate + ":" + endDate;
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private Mono<NeoFeedPayload> loadFromUpstream(LocalDate startDate, LocalDate endDate) {
        return client.fetchFeedJson(startDate, endDate)
            .map(json -> parser.parse(json, clock.instant()));
    }

    private FetchResult degraded(String key, LocalDate startDate, NeoFeedException cause) {
        String reason = cause instanceof UpstreamRateLimitedException ? "RATE_LIMITED" : "UNAVAILABLE";
        return cache.getStale(key)
            .map(payload -> {
                log.warn("FEED_DEGRADED key={} status={} reason={} fetchedAt={} cause={}",
                         key, FeedStatus.STALE, reason, payload.fetchedAt(), cause.getMessage());
                return FetchResult.of(payload, FeedStatus.STALE);
            })
            .orElseGet(() -> {
                log.warn("FEED_DEGRADED key={} status={} reason={} cause={}",
                         key, FeedStatus.FALLBACK, reason, cause.getMessage());
                return FetchResult.of(fallbackCatalog.forDate(startDate, clock.instant()), FeedStatus.FALLBACK);
            });
    }

    private void validateRange(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("start and end dates are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException(
                "start date " + startDate + " is after end date " + endDate);
        }
        long days = ChronoUnit.DAYS.between(startDate, endDate) + 1;
        if (days > maxRangeDays) {
            throw new IllegalArgumentException(
                "date range " + startDate + ".." + endDate + " spans " + days
                + " days; at most " + maxRangeDays + " are allowed");
        }
    }
}
