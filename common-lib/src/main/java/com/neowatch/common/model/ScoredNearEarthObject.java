package com.neowatch.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A feed object paired with the assessment computed for it.
 */
public record ScoredNearEarthObject(
    @JsonProperty("object")     NearEarthObject object,
    @JsonProperty("assessment") RiskAssessment  assessment
) {

    @JsonIgnore
    public String id() {
        return object.id();
    }

    @JsonIgnore
    public double score() {
        return assessment.score();
    }
}
