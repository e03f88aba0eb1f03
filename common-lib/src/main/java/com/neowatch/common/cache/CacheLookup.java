package com.neowatch.common.cache;

/**
 * A value returned by {@link ReactiveCacheStore#lookupOrCompute} together with how the
 * caller obtained it.
 */
public record CacheLookup<V>(V value, Origin origin) {

    public enum Origin {
        /** A fresh entry was already cached. */
        HIT,
        /** This caller's subscription ran the compute function. */
        LOADED,
        /** Another caller was already computing the value; this one waited for it. */
        JOINED
    }

    static <V> CacheLookup<V> of(V value, Origin origin) {
        return new CacheLookup<>(value, origin);
    }
}
