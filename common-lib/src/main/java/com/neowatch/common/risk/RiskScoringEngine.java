package com.neowatch.common.risk;

import com.neowatch.common.model.DistanceCategory;
import com.neowatch.common.model.NearEarthObject;
import com.neowatch.common.model.RiskAssessment;
import com.neowatch.common.model.SizeCategory;
import com.neowatch.common.model.ThreatLevel;

/**
 * Pure stateless scorer that maps a {@link NearEarthObject} to a 0–100 risk score and
 * its {@link ThreatLevel}.
 *
 * <p>The score is the sum of four terms, clamped to {@code [0, 100]} and rounded to one
 * decimal:
 * <ol>
 *   <li><strong>Hazard</strong>: {@value #HAZARD_POINTS} points when the upstream flags
 *       the object as potentially hazardous.</li>
 *   <li><strong>Size</strong>: {@code min(30, 10 * log10(diameterKm * 1000))}, never
 *       negative; {@code 0} when the diameter is unknown.</li>
 *   <li><strong>Distance</strong>: 25/20/15/10/5/0 points for a miss distance of
 *       ≤0.05/≤0.1/≤0.5/≤1/≤5/&gt;5 lunar distances; {@code 0} when unknown.</li>
 *   <li><strong>Velocity</strong>: 10/7/4/2 points above 80,000/60,000/40,000 km/h
 *       or otherwise.</li>
 * </ol>
 *
 * <p>Every method is total over the whole {@link NearEarthObject} domain, including
 * zero, unknown and non-finite fields. No logging. No side-effects.
 */
public final class RiskScoringEngine {

    static final double HAZARD_POINTS = 35.0;
    static final double MAX_SIZE_POINTS = 30.0;
    static final double MAX_SCORE = 100.0;

    private static final double[] LUNAR_DISTANCE_BOUNDS = {0.05, 0.1, 0.5, 1.0, 5.0};
    private static final double[] DISTANCE_POINTS       = {25.0, 20.0, 15.0, 10.0, 5.0};

    private RiskScoringEngine() { /* utility class */ }

    public static RiskAssessment score(NearEarthObject object) {
        double score = riskScore(object);
        return new RiskAssessment(
            score,
            ThreatLevel.fromScore(score),
            SizeCategory.fromDiameterKm(object.diameterKm()),
            DistanceCategory.fromLunarDistance(object.missDistanceLunar())
        );
    }

    /**
     * @return the clamped, one-decimal risk score for the object
     */
    public static double riskScore(NearEarthObject object) {
        double raw = hazardTerm(object.hazardous())
                   + sizeTerm(object.diameterKm())
                   + distanceTerm(object.missDistanceKm())
                   + velocityTerm(object.velocityKph());
        return roundOneDecimal(clamp(raw));
    }

    // ── individual terms ───────────────────────────────────────────────────

    static double hazardTerm(boolean hazardous) {
        return hazardous ? HAZARD_POINTS : 0.0;
    }

    static double sizeTerm(double diameterKm) {
        if (!(diameterKm > 0)) {
            return 0.0;
        }
        double points = 10.0 * Math.log10(diameterKm * 1000.0);
        return Math.max(0.0, Math.min(MAX_SIZE_POINTS, points));
    }

    static double distanceTerm(double missDistanceKm) {
        if (!Double.isFinite(missDistanceKm) || missDistanceKm < 0) {
            return 0.0;
        }
        double lunar = missDistanceKm / NearEarthObject.KM_PER_LUNAR_DISTANCE;
        for (int i = 0; i < LUNAR_DISTANCE_BOUNDS.length; i++) {
            if (lunar <= LUNAR_DISTANCE_BOUNDS[i]) {
                return DISTANCE_POINTS[i];
            }
        }
        return 0.0;
    }

    static double velocityTerm(double velocityKph) {
        if (velocityKph > 80_000) return 10.0;
        if (velocityKph > 60_000) return 7.0;
        if (velocityKph > 40_000) return 4.0;
        return 2.0;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static double clamp(double raw) {
        if (Double.isNaN(raw)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(MAX_SCORE, raw));
    }

    private static double roundOneDecimal(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
