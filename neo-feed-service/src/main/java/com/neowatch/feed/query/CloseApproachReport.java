package com.neowatch.feed.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neowatch.common.model.ClosestApproach;
import com.neowatch.common.model.NearEarthObject;
import com.neowatch.common.model.ScoredNearEarthObject;

import java.util.List;

/**
 * One page of close approaches plus aggregates over every matching approach.
 * {@code closestApproach} is {@code null} when nothing matched.
 */
public record CloseApproachReport(
    @JsonProperty("page")              FeedPage        page,
    @JsonProperty("averageDistanceLd") double          averageDistanceLd,
    @JsonProperty("closestApproach")   ClosestApproach closestApproach
) {

    public static CloseApproachReport of(FeedQuery query, List<ScoredNearEarthObject> objects) {
        List<ScoredNearEarthObject> selected = query.select(objects);
        if (selected.isEmpty()) {
            return new CloseApproachReport(query.page(selected), 0.0, null);
        }

        double sum = 0.0;
        ScoredNearEarthObject closest = null;
        for (ScoredNearEarthObject candidate : selected) {
            sum += roundThree(candidate.object().missDistanceLunar());
            if (closest == null || candidate.object().missDistanceKm() < closest.object().missDistanceKm()) {
                closest = candidate;
            }
        }
        NearEarthObject nearest = closest.object();
        return new CloseApproachReport(
            query.page(selected),
            roundThree(sum / selected.size()),
            new ClosestApproach(nearest.id(), nearest.name(), nearest.missDistanceKm(),
                                roundThree(nearest.missDistanceLunar()), nearest.closeApproachDate())
        );
    }

    private static double roundThree(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
