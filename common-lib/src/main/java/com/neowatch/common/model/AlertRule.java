package com.neowatch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * User-defined watch on a single asteroid. Owned by the persistence layer; the alert
 * evaluator only reads it and reports triggers back through the repository.
 *
 * <p>{@code lastTriggeredAt} is {@code null} until the rule fires for the first time.
 */
public record AlertRule(
    @JsonProperty("id")                  String  id,
    @JsonProperty("userId")              String  userId,
    @JsonProperty("name")                String  name,
    @JsonProperty("asteroidId")          String  asteroidId,
    @JsonProperty("thresholdDistanceKm") double  thresholdDistanceKm,
    @JsonProperty("thresholdRiskScore")  double  thresholdRiskScore,
    @JsonProperty("isActive")            boolean active,
    @JsonProperty("lastTriggeredAt")     Instant lastTriggeredAt
) {

    public AlertRule withLastTriggeredAt(Instant when) {
        return new AlertRule(id, userId, name, asteroidId,
                             thresholdDistanceKm, thresholdRiskScore, active, when);
    }
}
