package com.neowatch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Derived view of a {@link NearEarthObject}. Never stored on its own; recomputed
 * from the object whenever it is needed.
 */
public record RiskAssessment(
    @JsonProperty("score")            double           score,
    @JsonProperty("threatLevel")      ThreatLevel      threatLevel,
    @JsonProperty("sizeCategory")     SizeCategory     sizeCategory,
    @JsonProperty("distanceCategory") DistanceCategory distanceCategory
) {}
