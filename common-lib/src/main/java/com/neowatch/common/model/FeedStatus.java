package com.neowatch.common.model;

/**
 * Where the objects of a feed came from.
 */
public enum FeedStatus {
    /** Fetched from upstream by this request. */
    LIVE,
    /** Served from a fresh cache entry; no upstream call was made. */
    CACHED,
    /** Upstream failed; an expired cache entry of real data was served. */
    STALE,
    /** Upstream failed with nothing cached; the static sample set was served. */
    FALLBACK;

    public boolean isRealData() {
        return this != FALLBACK;
    }

    public boolean isDegraded() {
        return this == STALE || this == FALLBACK;
    }
}
