package com.neowatch.alert.evaluator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neowatch.common.model.FeedStatus;

import java.util.List;

/**
 * Tally of one alert cycle. {@code feedStatus} is {@code null} when no feed was fetched
 * (no active rules, or the cycle was skipped).
 */
public record AlertCycleReport(
    @JsonProperty("rulesChecked")         int        rulesChecked,
    @JsonProperty("triggered")            int        triggered,
    @JsonProperty("suppressedByCooldown") int        suppressedByCooldown,
    @JsonProperty("unmatched")            int        unmatched,
    @JsonProperty("belowThreshold")       int        belowThreshold,
    @JsonProperty("failed")               int        failed,
    @JsonProperty("skippedNoRealData")    int        skippedNoRealData,
    @JsonProperty("feedStatus")           FeedStatus feedStatus
) {

    public static AlertCycleReport empty() {
        return new AlertCycleReport(0, 0, 0, 0, 0, 0, 0, null);
    }

    public static AlertCycleReport of(List<RuleOutcome> outcomes, FeedStatus feedStatus) {
        int triggered = 0, suppressed = 0, unmatched = 0, below = 0, failed = 0, skipped = 0;
        for (RuleOutcome outcome : outcomes) {
            switch (outcome) {
                case TRIGGERED              -> triggered++;
                case SUPPRESSED_BY_COOLDOWN -> suppressed++;
                case UNMATCHED              -> unmatched++;
                case BELOW_THRESHOLD        -> below++;
                case FAILED                 -> failed++;
                case SKIPPED_NO_REAL_DATA   -> skipped++;
            }
        }
        return new AlertCycleReport(outcomes.size(), triggered, suppressed, unmatched, below, failed, skipped,
                                    feedStatus);
    }
}
