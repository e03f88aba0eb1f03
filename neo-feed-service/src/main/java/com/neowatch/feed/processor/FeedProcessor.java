package com.neowatch.feed.processor;

import com.neowatch.common.model.ClosestApproach;
import com.neowatch.common.model.FeedSnapshot;
import com.neowatch.common.model.FeedStatistics;
import com.neowatch.common.model.FeedStatus;
import com.neowatch.common.model.NearEarthObject;
import com.neowatch.common.model.ScoredNearEarthObject;
import com.neowatch.common.risk.RiskScoringEngine;
import com.neowatch.feed.model.FetchResult;
import com.neowatch.feed.model.NeoFeedPayload;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a parsed feed into a {@link FeedSnapshot}: scores each object and derives the
 * feed statistics. Pure: no I/O, no clock, input order preserved.
 */
@Component
public class FeedProcessor {

    public FeedSnapshot process(FetchResult result, LocalDate startDate, LocalDate endDate) {
        return process(result.payload(), startDate, endDate, result.status());
    }

    public FeedSnapshot process(NeoFeedPayload payload, LocalDate startDate, LocalDate endDate,
                                FeedStatus status) {
        List<ScoredNearEarthObject> scored = new ArrayList<>(payload.objects().size());
        for (NearEarthObject object : payload.objects()) {
            scored.add(new ScoredNearEarthObject(object, RiskScoringEngine.score(object)));
        }
        return new FeedSnapshot(
            startDate,
            endDate,
            scored,
            statistics(scored),
            status,
            status.isRealData(),
            payload.skippedEntries(),
            payload.fetchedAt()
        );
    }

    /**
     * Aggregates over the scored objects. The closest approach is the object with the
     * smallest miss distance; the first one listed wins a tie.
     */
    public FeedStatistics statistics(List<ScoredNearEarthObject> scored) {
        if (scored.isEmpty()) {
            return FeedStatistics.empty();
        }

        int hazardous = 0;
        double sum = 0.0;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        ScoredNearEarthObject closest = null;

        for (ScoredNearEarthObject candidate : scored) {
            if (candidate.object().hazardous()) {
                hazardous++;
            }
            double score = candidate.score();
            sum += score;
            max = Math.max(max, score);
            min = Math.min(min, score);
            if (closest == null
                || candidate.object().missDistanceKm() < closest.object().missDistanceKm()) {
                closest = candidate;
            }
        }

        int total = scored.size();
        return new FeedStatistics(
            total,
            hazardous,
            round(hazardous * 100.0 / total, 1),
            round(sum / total, 1),
            max,
            min,
            toClosestApproach(closest.object())
        );
    }

    private static ClosestApproach toClosestApproach(NearEarthObject object) {
        return new ClosestApproach(
            object.id(),
            object.name(),
            object.missDistanceKm(),
            round(object.missDistanceLunar(), 3),
            object.closeApproachDate()
        );
    }

    private static double round(double value, int decimals) {
        if (!Double.isFinite(value)) {
            return value;
        }
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
