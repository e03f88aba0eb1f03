package com.neowatch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Immutable result of one fetch + score cycle over {@code [startDate, endDate]}.
 * Objects keep the order in which the upstream listed them.
 */
public record FeedSnapshot(
    @JsonProperty("startDate")      LocalDate                   startDate,
    @JsonProperty("endDate")        LocalDate                   endDate,
    @JsonProperty("objects")        List<ScoredNearEarthObject> objects,
    @JsonProperty("statistics")     FeedStatistics              statistics,
    @JsonProperty("status")         FeedStatus                  status,
    @JsonProperty("realData")       boolean                     realData,
    @JsonProperty("skippedEntries") int                         skippedEntries,
    @JsonProperty("generatedAt")    Instant                     generatedAt
) {

    public FeedSnapshot {
        objects = List.copyOf(objects);
    }

    /**
     * Returns the closest occurrence of the given asteroid in this snapshot; the first
     * one listed wins a tie. Empty when the asteroid is not part of the feed.
     */
    public Optional<ScoredNearEarthObject> findClosest(String asteroidId) {
        ScoredNearEarthObject best = null;
        for (ScoredNearEarthObject candidate : objects) {
            if (!candidate.id().equals(asteroidId)) {
                continue;
            }
            if (best == null || candidate.object().missDistanceKm() < best.object().missDistanceKm()) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }
}
