package com.neowatch.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One close approach of an asteroid, as reported by the upstream feed for a single date.
 *
 * <p>Absent upstream values are normalised at construction time: unknown diameter and
 * velocity become {@code 0}, unknown miss distance becomes {@link Double#POSITIVE_INFINITY}.
 */
public record NearEarthObject(
    @JsonProperty("id")                String    id,
    @JsonProperty("name")              String    name,
    @JsonProperty("isHazardous")       boolean   hazardous,
    @JsonProperty("diameterKm")        double    diameterKm,
    @JsonProperty("missDistanceKm")    double    missDistanceKm,
    @JsonProperty("velocityKph")       double    velocityKph,
    @JsonProperty("closeApproachDate") LocalDate closeApproachDate
) {

    /** Average Earth–Moon distance. */
    public static final double KM_PER_LUNAR_DISTANCE = 384_400.0;

    public NearEarthObject {
        Objects.requireNonNull(id, "id");
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (!(diameterKm > 0)) {
            diameterKm = 0.0;
        }
        if (Double.isNaN(missDistanceKm) || missDistanceKm < 0) {
            missDistanceKm = Double.POSITIVE_INFINITY;
        }
        if (!(velocityKph > 0)) {
            velocityKph = 0.0;
        }
    }

    /** Miss distance expressed in lunar distances; infinite when the distance is unknown. */
    @JsonIgnore
    public double missDistanceLunar() {
        return missDistanceKm / KM_PER_LUNAR_DISTANCE;
    }

    @JsonIgnore
    public boolean hasKnownMissDistance() {
        return Double.isFinite(missDistanceKm);
    }
}
