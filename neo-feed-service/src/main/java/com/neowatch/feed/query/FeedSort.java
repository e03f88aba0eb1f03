package com.neowatch.feed.query;

import com.neowatch.common.model.ScoredNearEarthObject;

import java.util.Comparator;
import java.util.Optional;

/**
 * Result order of a {@link FeedQuery}. Sorting is stable, so ties keep upstream order.
 */
public enum FeedSort {

    AS_LISTED(null),
    NEAREST_FIRST(Comparator.comparingDouble(o -> o.object().missDistanceKm())),
    HIGHEST_RISK_FIRST(Comparator.comparingDouble(ScoredNearEarthObject::score).reversed());

    private final Comparator<ScoredNearEarthObject> comparator;

    FeedSort(Comparator<ScoredNearEarthObject> comparator) {
        this.comparator = comparator;
    }

    Optional<Comparator<ScoredNearEarthObject>> comparator() {
        return Optional.ofNullable(comparator);
    }
}
