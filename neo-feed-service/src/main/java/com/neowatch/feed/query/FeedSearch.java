package com.neowatch.feed.query;

import com.neowatch.common.model.ScoredNearEarthObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring search over object ids and names. Names carry the
 * provisional designation, e.g. {@code "465633 (2009 JR5)"}.
 */
public final class FeedSearch {

    public static final int MAX_LIMIT = 100;

    private FeedSearch() { /* utility class */ }

    /**
     * @return at most {@code limit} matches, in feed order
     */
    public static List<ScoredNearEarthObject> search(List<ScoredNearEarthObject> objects, String text, int limit) {
        requireArguments(text, limit);
        String needle = text.trim().toLowerCase(Locale.ROOT);
        List<ScoredNearEarthObject> results = new ArrayList<>();
        for (ScoredNearEarthObject candidate : objects) {
            if (candidate.id().toLowerCase(Locale.ROOT).contains(needle)
                || candidate.object().name().toLowerCase(Locale.ROOT).contains(needle)) {
                results.add(candidate);
                if (results.size() >= limit) {
                    break;
                }
            }
        }
        return results;
    }

    public static void requireArguments(String text, int limit) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("search text must not be blank");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be within 1.." + MAX_LIMIT + ", got " + limit);
        }
    }
}
