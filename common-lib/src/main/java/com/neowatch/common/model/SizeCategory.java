package com.neowatch.common.model;

public enum SizeCategory {
    SMALL,
    MEDIUM,
    LARGE;

    public static SizeCategory fromDiameterKm(double diameterKm) {
        if (diameterKm >= 1.0) return LARGE;
        if (diameterKm >= 0.1) return MEDIUM;
        return SMALL;
    }
}
