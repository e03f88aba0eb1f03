package com.neowatch.feed.model;

import com.neowatch.common.model.NearEarthObject;

import java.time.Instant;
import java.util.List;

/**
 * Parsed upstream feed: every entry that could be read, in upstream order (dates
 * ascending, then as listed per date). {@code skippedEntries} counts entries that were
 * dropped because they could not be read.
 */
public record NeoFeedPayload(
    int                   elementCount,
    List<NearEarthObject> objects,
    int                   skippedEntries,
    Instant               fetchedAt
) {

    public NeoFeedPayload {
        objects = List.copyOf(objects);
    }
}
