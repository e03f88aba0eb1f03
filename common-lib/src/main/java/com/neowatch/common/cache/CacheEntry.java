package com.neowatch.common.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cache entry. Expiry is decided by comparing {@code insertedAt + ttl} with
 * the store's clock at read time; nothing sweeps entries in the background.
 */
public record CacheEntry<K, V>(
    K        key,
    V        value,
    Instant  insertedAt,
    Duration ttl
) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(insertedAt.plus(ttl));
    }
}
