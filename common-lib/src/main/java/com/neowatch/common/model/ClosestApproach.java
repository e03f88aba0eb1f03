package com.neowatch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record ClosestApproach(
    @JsonProperty("asteroidId")    String    asteroidId,
    @JsonProperty("asteroidName")  String    asteroidName,
    @JsonProperty("distanceKm")    double    distanceKm,
    @JsonProperty("distanceLunar") double    distanceLunar,
    @JsonProperty("date")          LocalDate date
) {}
