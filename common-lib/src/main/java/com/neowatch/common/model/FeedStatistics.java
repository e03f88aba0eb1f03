package com.neowatch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregates over one scored feed.
 *
 * <p>{@code closestApproach} is {@code null} for an empty feed; every numeric field is
 * {@code 0} in that case.
 */
public record FeedStatistics(
    @JsonProperty("total")               int             total,
    @JsonProperty("hazardousCount")      int             hazardousCount,
    @JsonProperty("hazardousPercentage") double          hazardousPercentage,
    @JsonProperty("averageRisk")         double          averageRisk,
    @JsonProperty("maxRisk")             double          maxRisk,
    @JsonProperty("minRisk")             double          minRisk,
    @JsonProperty("closestApproach")     ClosestApproach closestApproach
) {

    public static FeedStatistics empty() {
        return new FeedStatistics(0, 0, 0.0, 0.0, 0.0, 0.0, null);
    }
}
