package com.neowatch.feed.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neowatch.common.exception.UpstreamMalformedException;
import com.neowatch.common.model.NearEarthObject;
import com.neowatch.feed.client.NeoFeedWebClient;
import com.neowatch.feed.model.NeoFeedPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads the upstream feed body into {@link NearEarthObject}s.
 *
 * <p>A body that is not a JSON object, or has no {@code near_earth_objects} object, is
 * rejected as a whole. Inside it every entry is read on its own: absent numbers default
 * to {@code 0}, an absent miss distance to infinity and an absent hazard flag to
 * {@code false}; an entry that is present but unreadable (no id, non-numeric text,
 * negative values) is skipped and counted.
 */
@Component
public class NeoFeedParser {

    private static final Logger log = LoggerFactory.getLogger(NeoFeedParser.class);

    private static final String SOURCE = NeoFeedWebClient.SOURCE;

    private final ObjectMapper objectMapper;

    public NeoFeedParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public NeoFeedPayload parse(String json, Instant fetchedAt) {
        JsonNode root = readRoot(json);
        JsonNode byDate = root.path("near_earth_objects");
        if (!byDate.isObject()) {
            throw new UpstreamMalformedException(SOURCE, "near_earth_objects is missing or not an object");
        }

        // ISO dates sort chronologically as strings
        TreeMap<String, JsonNode> sorted = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = byDate.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            sorted.put(field.getKey(), field.getValue());
        }

        List<NearEarthObject> objects = new ArrayList<>();
        int skipped = 0;
        for (Map.Entry<String, JsonNode> day : sorted.entrySet()) {
            JsonNode entries = day.getValue();
            if (!entries.isArray()) {
                log.debug("Skipping non-array feed day. date={}", day.getKey());
                continue;
            }
            for (JsonNode entry : entries) {
                try {
                    objects.add(parseEntry(entry, day.getKey()));
                } catch (UpstreamMalformedException e) {
                    skipped++;
                    log.debug("Skipping malformed feed entry. date={} reason={}", day.getKey(), e.getMessage());
                }
            }
        }
        if (skipped > 0) {
            log.warn("FEED_PARSE_SKIPPED skipped={} parsed={}", skipped, objects.size());
        }

        int elementCount = root.path("element_count").asInt(objects.size() + skipped);
        return new NeoFeedPayload(elementCount, objects, skipped, fetchedAt);
    }

    /**
     * Reads a single feed entry.
     *
     * @throws UpstreamMalformedException when the entry cannot be read
     */
    public NearEarthObject parseEntry(JsonNode entry, String dateKey) {
        if (entry == null || !entry.isObject()) {
            throw malformed("entry is not an object");
        }

        String id = text(entry.path("id"));
        if (id == null || id.isBlank()) {
            throw malformed("entry has no id");
        }
        String name = text(entry.path("name"));
        boolean hazardous = bool(entry.path("is_potentially_hazardous_asteroid"), id);
        double diameterKm = number(entry.path("estimated_diameter").path("kilometers")
                                        .path("estimated_diameter_max"), 0.0, id, "estimated_diameter_max");

        JsonNode approach = entry.path("close_approach_data").path(0);
        double missDistanceKm = number(approach.path("miss_distance").path("kilometers"),
                                       Double.POSITIVE_INFINITY, id, "miss_distance");
        double velocityKph = number(approach.path("relative_velocity").path("kilometers_per_hour"),
                                    0.0, id, "relative_velocity");

        String approachDate = text(approach.path("close_approach_date"));
        LocalDate date = date(approachDate != null ? approachDate : dateKey, id);

        return new NearEarthObject(id, name, hazardous, diameterKm, missDistanceKm, velocityKph, date);
    }

    // ── field readers ─────────────────────────────────────────────────────────

    private JsonNode readRoot(String json) {
        if (json == null || json.isBlank()) {
            throw new UpstreamMalformedException(SOURCE, "empty response body");
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new UpstreamMalformedException(SOURCE, "response body is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new UpstreamMalformedException(SOURCE, "response body is not valid JSON", e);
        }
    }

    private static String text(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : null;
    }

    private static boolean bool(JsonNode node, String id) {
        if (node.isMissingNode() || node.isNull()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual() && ("true".equalsIgnoreCase(node.asText()) || "false".equalsIgnoreCase(node.asText()))) {
            return Boolean.parseBoolean(node.asText());
        }
        throw malformed("id=" + id + " hazard flag is not a boolean: " + node);
    }

    /** Upstream sends distances and velocities as strings, diameters as numbers. */
    private static double number(JsonNode node, double absent, String id, String field) {
        if (node.isMissingNode() || node.isNull()) {
            return absent;
        }
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new UpstreamMalformedException(SOURCE,
                    "id=" + id + " " + field + " is not numeric: '" + node.asText() + "'", e);
            }
        } else {
            throw malformed("id=" + id + " " + field + " has unexpected type " + node.getNodeType());
        }
        if (Double.isNaN(value) || value < 0) {
            throw malformed("id=" + id + " " + field + " is out of range: " + value);
        }
        return value;
    }

    private static LocalDate date(String text, String id) {
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new UpstreamMalformedException(SOURCE, "id=" + id + " invalid close approach date '" + text + "'", e);
        }
    }

    private static UpstreamMalformedException malformed(String message) {
        return new UpstreamMalformedException(SOURCE, message);
    }
}
