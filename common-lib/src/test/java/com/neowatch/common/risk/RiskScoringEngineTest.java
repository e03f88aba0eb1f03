package com.neowatch.common.risk;

import com.neowatch.common.model.DistanceCategory;
import com.neowatch.common.model.NearEarthObject;
import com.neowatch.common.model.RiskAssessment;
import com.neowatch.common.model.SizeCategory;
import com.neowatch.common.model.ThreatLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link RiskScoringEngine}.
 */
class RiskScoringEngineTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 15);

    private static NearEarthObject neo(boolean hazardous, double diameterKm,
                                       double missDistanceKm, double velocityKph) {
        return new NearEarthObject("2465633", "465633 (2009 JR5)", hazardous,
                                   diameterKm, missDistanceKm, velocityKph, DATE);
    }

    // ── canonical example ─────────────────────────────────────────────────

    @Test
    @DisplayName("1.2 km hazardous object at 32.5 LD, 58,900 km/h → 69.0 HIGH (not CRITICAL)")
    void referenceObjectScoresHigh() {
        RiskAssessment assessment = RiskScoringEngine.score(neo(true, 1.2, 12_500_000, 58_900));

        assertEquals(69.0, assessment.score());
        assertEquals(ThreatLevel.HIGH, assessment.threatLevel());
        assertEquals(SizeCategory.LARGE, assessment.sizeCategory());
        assertEquals(DistanceCategory.DISTANT, assessment.distanceCategory());
    }

    // ── individual terms ──────────────────────────────────────────────────

    @Nested
    @DisplayName("terms")
    class Terms {

        @Test
        @DisplayName("hazard term is 35 or 0")
        void hazardTerm() {
            assertEquals(35.0, RiskScoringEngine.hazardTerm(true));
            assertEquals(0.0, RiskScoringEngine.hazardTerm(false));
        }

        @Test
        @DisplayName("size term caps at 30 and never goes negative")
        void sizeTermBounds() {
            assertEquals(30.0, RiskScoringEngine.sizeTerm(5.0));
            assertEquals(20.0, RiskScoringEngine.sizeTerm(0.1), 1e-9);
            assertEquals(0.0, RiskScoringEngine.sizeTerm(0.0005));
            assertEquals(0.0, RiskScoringEngine.sizeTerm(0.0));
            assertEquals(0.0, RiskScoringEngine.sizeTerm(Double.NaN));
        }

        @Test
        @DisplayName("distance term follows lunar-distance bands")
        void distanceTermBands() {
            assertEquals(25.0, RiskScoringEngine.distanceTerm(19_220));
            assertEquals(20.0, RiskScoringEngine.distanceTerm(38_440));
            assertEquals(15.0, RiskScoringEngine.distanceTerm(192_200));
            assertEquals(10.0, RiskScoringEngine.distanceTerm(384_400));
            assertEquals(5.0, RiskScoringEngine.distanceTerm(1_922_000));
            assertEquals(0.0, RiskScoringEngine.distanceTerm(1_930_000));
        }

        @Test
        @DisplayName("unknown distance contributes nothing")
        void unknownDistance() {
            assertEquals(0.0, RiskScoringEngine.distanceTerm(Double.POSITIVE_INFINITY));
            assertEquals(0.0, RiskScoringEngine.distanceTerm(Double.NaN));
        }

        @Test
        @DisplayName("velocity term thresholds are strict")
        void velocityTerm() {
            assertEquals(10.0, RiskScoringEngine.velocityTerm(80_001));
            assertEquals(7.0, RiskScoringEngine.velocityTerm(80_000));
            assertEquals(4.0, RiskScoringEngine.velocityTerm(60_000));
            assertEquals(2.0, RiskScoringEngine.velocityTerm(40_000));
            assertEquals(2.0, RiskScoringEngine.velocityTerm(0));
        }
    }

    // ── bounds and monotonicity ───────────────────────────────────────────

    @Nested
    @DisplayName("properties")
    class Properties {

        @Test
        @DisplayName("score stays within [0, 100] across extreme inputs")
        void scoreIsBounded() {
            double[] diameters = {0, 0.0001, 0.05, 1, 1000, Double.MAX_VALUE, Double.POSITIVE_INFINITY};
            double[] distances = {0, 1, 50_000, 1e9, Double.POSITIVE_INFINITY};
            double[] velocities = {0, 50_000, 1e7};
            for (double d : diameters) {
                for (double m : distances) {
                    for (double v : velocities) {
                        for (boolean h : new boolean[]{true, false}) {
                            double score = RiskScoringEngine.riskScore(neo(h, d, m, v));
                            assertTrue(score >= 0 && score <= 100,
                                () -> "out of range for d=" + d + " m=" + m + " v=" + v);
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("score is non-decreasing in diameter")
        void monotonicInDiameter() {
            double previous = -1;
            for (double d = 0; d <= 3.0; d += 0.01) {
                double score = RiskScoringEngine.riskScore(neo(false, d, 1_000_000, 45_000));
                assertTrue(score >= previous, "diameter " + d);
                previous = score;
            }
        }

        @Test
        @DisplayName("score is non-increasing in miss distance")
        void monotonicInDistance() {
            double previous = Double.MAX_VALUE;
            for (double m = 0; m <= 3_000_000; m += 5_000) {
                double score = RiskScoringEngine.riskScore(neo(true, 0.3, m, 45_000));
                assertTrue(score <= previous, "distance " + m);
                previous = score;
            }
            assertTrue(RiskScoringEngine.riskScore(neo(true, 0.3, Double.POSITIVE_INFINITY, 45_000)) <= previous);
        }

        @Test
        @DisplayName("object with every field unknown still scores")
        void allUnknownFields() {
            NearEarthObject unknown = new NearEarthObject("x", null, false, 0, Double.NaN, -1, null);
            RiskAssessment assessment = RiskScoringEngine.score(unknown);
            assertEquals(2.0, assessment.score());
            assertEquals(ThreatLevel.MINIMAL, assessment.threatLevel());
            assertEquals(SizeCategory.SMALL, assessment.sizeCategory());
            assertEquals(DistanceCategory.DISTANT, assessment.distanceCategory());
        }

        @Test
        @DisplayName("every term at its maximum sums to exactly 100")
        void maximumContributions() {
            assertEquals(100.0, RiskScoringEngine.riskScore(neo(true, 10, 1_000, 100_000)));
        }
    }

    // ── threat bands ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("threat level bands")
    class Bands {

        @Test
        @DisplayName("exact band boundaries")
        void boundaries() {
            assertEquals(ThreatLevel.CRITICAL, ThreatLevel.fromScore(70.0));
            assertEquals(ThreatLevel.HIGH, ThreatLevel.fromScore(69.9));
            assertEquals(ThreatLevel.HIGH, ThreatLevel.fromScore(50.0));
            assertEquals(ThreatLevel.MODERATE, ThreatLevel.fromScore(49.9));
            assertEquals(ThreatLevel.MODERATE, ThreatLevel.fromScore(30.0));
            assertEquals(ThreatLevel.LOW, ThreatLevel.fromScore(29.9));
            assertEquals(ThreatLevel.LOW, ThreatLevel.fromScore(10.0));
            assertEquals(ThreatLevel.MINIMAL, ThreatLevel.fromScore(9.9));
            assertEquals(ThreatLevel.MINIMAL, ThreatLevel.fromScore(0.0));
        }

        @Test
        @DisplayName("size categories")
        void sizeCategories() {
            assertEquals(SizeCategory.LARGE, SizeCategory.fromDiameterKm(1.0));
            assertEquals(SizeCategory.MEDIUM, SizeCategory.fromDiameterKm(0.999));
            assertEquals(SizeCategory.MEDIUM, SizeCategory.fromDiameterKm(0.1));
            assertEquals(SizeCategory.SMALL, SizeCategory.fromDiameterKm(0.099));
        }

        @Test
        @DisplayName("distance categories")
        void distanceCategories() {
            assertEquals(DistanceCategory.EXTREMELY_CLOSE, DistanceCategory.fromLunarDistance(0.1));
            assertEquals(DistanceCategory.VERY_CLOSE, DistanceCategory.fromLunarDistance(0.5));
            assertEquals(DistanceCategory.CLOSE, DistanceCategory.fromLunarDistance(1.0));
            assertEquals(DistanceCategory.NEARBY, DistanceCategory.fromLunarDistance(5.0));
            assertEquals(DistanceCategory.DISTANT, DistanceCategory.fromLunarDistance(5.1));
        }
    }
}
