package com.neowatch.common.model;

/**
 * Proximity bucket over the miss distance in lunar distances (LD).
 * An unknown (infinite) distance is {@link #DISTANT}.
 */
public enum DistanceCategory {
    EXTREMELY_CLOSE,
    VERY_CLOSE,
    CLOSE,
    NEARBY,
    DISTANT;

    public static DistanceCategory fromLunarDistance(double lunarDistance) {
        if (lunarDistance <= 0.1) return EXTREMELY_CLOSE;
        if (lunarDistance <= 0.5) return VERY_CLOSE;
        if (lunarDistance <= 1.0) return CLOSE;
        if (lunarDistance <= 5.0) return NEARBY;
        return DISTANT;
    }
}
