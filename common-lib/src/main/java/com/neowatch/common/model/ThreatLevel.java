package com.neowatch.common.model;

/**
 * Discrete threat label derived from a 0–100 risk score.
 *
 * <p>Bands are half-open: a score sitting exactly on a lower bound belongs to the
 * higher band (e.g. {@code 70.0 → CRITICAL}, {@code 69.9 → HIGH}).
 */
public enum ThreatLevel {
    MINIMAL(0.0),
    LOW(10.0),
    MODERATE(30.0),
    HIGH(50.0),
    CRITICAL(70.0);

    private final double lowerBound;

    ThreatLevel(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public double lowerBound() {
        return lowerBound;
    }

    public static ThreatLevel fromScore(double score) {
        if (score >= CRITICAL.lowerBound) return CRITICAL;
        if (score >= HIGH.lowerBound)     return HIGH;
        if (score >= MODERATE.lowerBound) return MODERATE;
        if (score >= LOW.lowerBound)      return LOW;
        return MINIMAL;
    }
}
