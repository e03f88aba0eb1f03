package com.neowatch.feed.service;

import com.neowatch.common.cache.CacheStats;
import com.neowatch.common.cache.ReactiveCacheStore;
import com.neowatch.common.model.FeedSnapshot;
import com.neowatch.common.model.NearEarthObject;
import com.neowatch.common.model.RiskAssessment;
import com.neowatch.common.model.ScoredNearEarthObject;
import com.neowatch.common.risk.RiskScoringEngine;
import com.neowatch.feed.fetcher.NeoFeedFetcher;
import com.neowatch.feed.model.NeoFeedPayload;
import com.neowatch.feed.processor.FeedProcessor;
import com.neowatch.feed.provider.NeoFeedProvider;
import com.neowatch.feed.query.CloseApproachReport;
import com.neowatch.feed.query.FeedPage;
import com.neowatch.feed.query.FeedQuery;
import com.neowatch.feed.query.FeedSearch;
import com.neowatch.feed.query.HazardousSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Primary entry point for scored feed data: fetch (cached, single-flight, degradable)
 * followed by scoring and statistics.
 */
@Service
public class NeoFeedService implements NeoFeedProvider {

    private static final Logger log = LoggerFactory.getLogger(NeoFeedService.class);

    private final NeoFeedFetcher fetcher;
    private final FeedProcessor processor;
    private final ReactiveCacheStore<String, NeoFeedPayload> cache;
    private final Clock clock;

    public NeoFeedService(NeoFeedFetcher fetcher,
                          FeedProcessor processor,
                          ReactiveCacheStore<String, NeoFeedPayload> neoFeedCache,
                          Clock clock) {
        this.fetcher   = fetcher;
        this.processor = processor;
        this.cache     = neoFeedCache;
        this.clock     = clock;
    }

    @Override
    public Mono<FeedSnapshot> fetchFeed(LocalDate startDate, LocalDate endDate) {
        return fetcher.fetchFeed(startDate, endDate)
            .map(result -> processor.process(result, startDate, endDate))
            .doOnNext(snapshot -> log.info(
                "FEED_SNAPSHOT start={} end={} status={} total={} hazardous={} skipped={}",
                startDate, endDate, snapshot.status(), snapshot.statistics().total(),
                snapshot.statistics().hazardousCount(), snapshot.skippedEntries()));
    }

    public Mono<FeedSnapshot> fetchToday() {
        LocalDate today = LocalDate.now(clock);
        return fetchFeed(today, today);
    }

    /**
     * Feed from today through {@code days} days ahead.
     */
    public Mono<FeedSnapshot> fetchUpcoming(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must be >= 0, got " + days);
        }
        LocalDate today = LocalDate.now(clock);
        return fetchFeed(today, today.plusDays(days));
    }

    /**
     * Hazardous objects of the range, highest score first.
     */
    public Mono<List<ScoredNearEarthObject>> fetchHazardous(LocalDate startDate, LocalDate endDate) {
        return fetchFeed(startDate, endDate)
            .map(snapshot -> snapshot.objects().stream()
                .filter(o -> o.object().hazardous())
                .sorted(Comparator.comparingDouble(ScoredNearEarthObject::score).reversed())
                .toList());
    }

    /**
     * The {@code limit} highest-scoring hazardous objects with a tally of their threat levels.
     */
    public Mono<HazardousSummary> topHazardous(LocalDate startDate, LocalDate endDate, int limit) {
        HazardousSummary.requireLimit(limit);
        return fetchFeed(startDate, endDate)
            .map(snapshot -> HazardousSummary.top(snapshot.objects(), limit));
    }

    /**
     * Close approaches within {@code maxDistanceLd} lunar distances, nearest first, with the
     * average distance and closest approach over all matches.
     */
    public Mono<CloseApproachReport> closeApproaches(LocalDate startDate, LocalDate endDate,
                                                     double maxDistanceLd, boolean hazardousOnly,
                                                     int page, int size) {
        FeedQuery query = FeedQuery.closeApproaches(maxDistanceLd, hazardousOnly, page, size);
        return fetchFeed(startDate, endDate)
            .map(snapshot -> CloseApproachReport.of(query, snapshot.objects()));
    }

    public Mono<List<ScoredNearEarthObject>> search(LocalDate startDate, LocalDate endDate,
                                                    String text, int limit) {
        FeedSearch.requireArguments(text, limit);
        return fetchFeed(startDate, endDate)
            .map(snapshot -> FeedSearch.search(snapshot.objects(), text, limit));
    }

    public Mono<FeedPage> query(LocalDate startDate, LocalDate endDate, FeedQuery query) {
        return fetchFeed(startDate, endDate).map(snapshot -> query.apply(snapshot.objects()));
    }

    public RiskAssessment score(NearEarthObject object) {
        return RiskScoringEngine.score(object);
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public void evict(LocalDate startDate, LocalDate endDate) {
        cache.invalidate(NeoFeedFetcher.cacheKey(startDate, endDate));
    }
}
