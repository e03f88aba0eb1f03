package com.neowatch.feed.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neowatch.common.model.ScoredNearEarthObject;
import com.neowatch.common.model.ThreatLevel;

import java.util.List;

/**
 * The highest-risk hazardous objects of a feed. The threat-level counts cover the
 * returned objects only; {@code totalHazardous} counts the whole feed.
 */
public record HazardousSummary(
    @JsonProperty("objects")        List<ScoredNearEarthObject> objects,
    @JsonProperty("totalHazardous") int                         totalHazardous,
    @JsonProperty("critical")       int                         critical,
    @JsonProperty("high")           int                         high,
    @JsonProperty("moderate")       int                         moderate
) {

    public static final int MAX_LIMIT = 50;

    public HazardousSummary {
        objects = List.copyOf(objects);
    }

    public static HazardousSummary top(List<ScoredNearEarthObject> objects, int limit) {
        requireLimit(limit);
        List<ScoredNearEarthObject> hazardous = new FeedQuery(true, null, null, null, null, null,
                                                              FeedSort.HIGHEST_RISK_FIRST, 1, 1)
            .select(objects);
        List<ScoredNearEarthObject> top = hazardous.subList(0, Math.min(limit, hazardous.size()));
        return new HazardousSummary(top, hazardous.size(),
                                    count(top, ThreatLevel.CRITICAL),
                                    count(top, ThreatLevel.HIGH),
                                    count(top, ThreatLevel.MODERATE));
    }

    public static void requireLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be within 1.." + MAX_LIMIT + ", got " + limit);
        }
    }

    private static int count(List<ScoredNearEarthObject> objects, ThreatLevel level) {
        return (int) objects.stream().filter(o -> o.assessment().threatLevel() == level).count();
    }
}
