package com.neowatch.alert.notification;

import com.neowatch.common.model.AlertRule;
import com.neowatch.common.model.NearEarthObject;
import com.neowatch.common.model.ScoredNearEarthObject;
import com.neowatch.common.risk.RiskScoringEngine;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class AlertMessageFormatterTest {

    private static final NearEarthObject JR5 = new NearEarthObject(
        "2465633", "465633 (2009 JR5)", true, 1.2, 12_500_000, 58_900, LocalDate.of(2024, 3, 16));

    private final ScoredNearEarthObject match = new ScoredNearEarthObject(JR5, RiskScoringEngine.score(JR5));
    private final AlertRule rule = new AlertRule(
        "r1", "u1", "Big rocks", "2465633", 20_000_000, 60, true, null);

    @Test
    void subjectNamesTheAsteroid() {
        assertEquals("COSMIC WATCH ALERT: 465633 (2009 JR5)", AlertMessageFormatter.subject(match));
    }

    @Test
    void bodyCarriesObjectDetailsAndRuleThresholds() {
        String body = AlertMessageFormatter.body(rule, match);

        assertTrue(body.contains("Alert: Big rocks"));
        assertTrue(body.contains("Asteroid: 465633 (2009 JR5) (2465633)"));
        assertTrue(body.contains("Close Approach: 2024-03-16"));
        assertTrue(body.contains("Estimated Diameter: 1.200 km"));
        assertTrue(body.contains("Miss Distance: 12,500,000 km"));
        assertTrue(body.contains("Relative Velocity: 58,900 km/h"));
        assertTrue(body.contains("Risk Score: 69.0/100"));
        assertTrue(body.contains("Threat Level: HIGH"));
        assertTrue(body.contains("- Miss distance: 20,000,000 km"));
        assertTrue(body.contains("- Risk score: 60.0/100"));
    }

    @Test
    void unknownDistanceIsSpelledOut() {
        NearEarthObject unknown = new NearEarthObject("1", "x", false, 0.1, Double.NaN, 0, LocalDate.of(2024, 3, 16));
        String body = AlertMessageFormatter.body(rule, new ScoredNearEarthObject(unknown, RiskScoringEngine.score(unknown)));

        assertTrue(body.contains("Miss Distance: unknown km"));
    }
}
