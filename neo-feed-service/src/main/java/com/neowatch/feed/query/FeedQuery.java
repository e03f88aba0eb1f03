package com.neowatch.feed.query;

import com.neowatch.common.model.ScoredNearEarthObject;

import java.util.List;

/**
 * Filter, sort and page over the objects of a snapshot. {@code null} bounds are not
 * applied; a {@code null} sort keeps the upstream order.
 *
 * @param maxDistanceLd upper bound on the miss distance in lunar distances
 * @param page 1-based page number
 * @param size page size, 1–100
 */
public record FeedQuery(
    boolean  hazardousOnly,
    Double   minDiameterKm,
    Double   maxDistanceKm,
    Double   maxDistanceLd,
    Double   minRiskScore,
    Double   maxRiskScore,
    FeedSort sort,
    int      page,
    int      size
) {

    public static final int MAX_PAGE_SIZE = 100;

    public FeedQuery {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1, got " + page);
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("size must be within 1.." + MAX_PAGE_SIZE + ", got " + size);
        }
        requireNonNegative("minDiameterKm", minDiameterKm);
        requireNonNegative("maxDistanceKm", maxDistanceKm);
        requireNonNegative("maxDistanceLd", maxDistanceLd);
        requireScore("minRiskScore", minRiskScore);
        requireScore("maxRiskScore", maxRiskScore);
        if (sort == null) {
            sort = FeedSort.AS_LISTED;
        }
    }

    public FeedQuery(boolean hazardousOnly, Double minDiameterKm, Double maxDistanceKm,
                     Double minRiskScore, Double maxRiskScore, int page, int size) {
        this(hazardousOnly, minDiameterKm, maxDistanceKm, null, minRiskScore, maxRiskScore,
             FeedSort.AS_LISTED, page, size);
    }

    /**
     * Close approaches within {@code maxDistanceLd} lunar distances, nearest first.
     */
    public static FeedQuery closeApproaches(double maxDistanceLd, boolean hazardousOnly, int page, int size) {
        return new FeedQuery(hazardousOnly, null, null, maxDistanceLd, null, null,
                             FeedSort.NEAREST_FIRST, page, size);
    }

    public boolean matches(ScoredNearEarthObject candidate) {
        if (hazardousOnly && !candidate.object().hazardous()) {
            return false;
        }
        if (minDiameterKm != null && candidate.object().diameterKm() < minDiameterKm) {
            return false;
        }
        if (maxDistanceKm != null && candidate.object().missDistanceKm() > maxDistanceKm) {
            return false;
        }
        if (maxDistanceLd != null && candidate.object().missDistanceLunar() > maxDistanceLd) {
            return false;
        }
        if (minRiskScore != null && candidate.score() < minRiskScore) {
            return false;
        }
        return maxRiskScore == null || candidate.score() <= maxRiskScore;
    }

    /**
     * Every matching object in {@link #sort()} order, before paging.
     */
    public List<ScoredNearEarthObject> select(List<ScoredNearEarthObject> objects) {
        List<ScoredNearEarthObject> filtered = objects.stream().filter(this::matches).toList();
        return sort.comparator()
            .map(order -> filtered.stream().sorted(order).toList())
            .orElse(filtered);
    }

    public FeedPage apply(List<ScoredNearEarthObject> objects) {
        return page(select(objects));
    }

    FeedPage page(List<ScoredNearEarthObject> selected) {
        int total = selected.size();
        int from = Math.min(total, (page - 1) * size);
        int to = Math.min(total, from + size);
        int totalPages = (total + size - 1) / size;
        return new FeedPage(selected.subList(from, to), total, page, size, totalPages, to < total, page > 1);
    }

    private static void requireNonNegative(String field, Double value) {
        if (value != null && (value.isNaN() || value < 0)) {
            throw new IllegalArgumentException(field + " must be >= 0, got " + value);
        }
    }

    private static void requireScore(String field, Double value) {
        if (value != null && (value.isNaN() || value < 0 || value > 100)) {
            throw new IllegalArgumentException(field + " must be within 0..100, got " + value);
        }
    }
}
