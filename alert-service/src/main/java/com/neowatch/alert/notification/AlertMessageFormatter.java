package com.neowatch.alert.notification;

import com.neowatch.common.model.AlertRule;
import com.neowatch.common.model.NearEarthObject;
import com.neowatch.common.model.ScoredNearEarthObject;

import java.util.Locale;

public final class AlertMessageFormatter {

    public static final String SUBJECT_PREFIX = "COSMIC WATCH ALERT: ";

    private AlertMessageFormatter() { /* utility class */ }

    public static String subject(ScoredNearEarthObject match) {
        return SUBJECT_PREFIX + match.object().name();
    }

    public static String body(AlertRule rule, ScoredNearEarthObject match) {
        NearEarthObject object = match.object();
        StringBuilder sb = new StringBuilder();
        sb.append("ASTEROID ALERT TRIGGERED\n\n");
        sb.append(String.format(Locale.ROOT, "Alert: %s%n", rule.name()));
        sb.append(String.format(Locale.ROOT, "Asteroid: %s (%s)%n", object.name(), object.id()));
        sb.append(String.format(Locale.ROOT, "Close Approach: %s%n%n", object.closeApproachDate()));
        sb.append("Details:\n");
        sb.append(String.format(Locale.ROOT, "- Estimated Diameter: %.3f km%n", object.diameterKm()));
        sb.append(String.format(Locale.ROOT, "- Miss Distance: %s km%n", kilometres(object.missDistanceKm())));
        sb.append(String.format(Locale.ROOT, "- Relative Velocity: %,.0f km/h%n", object.velocityKph()));
        sb.append(String.format(Locale.ROOT, "- Risk Score: %.1f/100%n", match.score()));
        sb.append(String.format(Locale.ROOT, "- Threat Level: %s%n%n", match.assessment().threatLevel()));
        sb.append("Triggered by thresholds:\n");
        sb.append(String.format(Locale.ROOT, "- Miss distance: %s km%n", kilometres(rule.thresholdDistanceKm())));
        sb.append(String.format(Locale.ROOT, "- Risk score: %.1f/100%n", rule.thresholdRiskScore()));
        return sb.toString();
    }

    private static String kilometres(double km) {
        return Double.isFinite(km) ? String.format(Locale.ROOT, "%,.0f", km) : "unknown";
    }
}
