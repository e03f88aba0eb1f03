package com.neowatch.common.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * Reactive in-memory key → value store with per-entry TTL and single-flight loading.
 *
 * <p><strong>Fetch Once → Serve Many:</strong> {@link #getOrCompute} runs the compute
 * function at most once per key at a time. Callers that miss while a computation is
 * already running attach to it through an in-flight registry and receive the very same
 * result (or the same error). No lock is held while the computation runs.
 *
 * <p><strong>Lazy expiry:</strong> an entry is only checked against its TTL when it is
 * read. An expired entry behaves as absent for {@link #get} and {@link #getOrCompute},
 * and is moved to a side slot that {@link #getStale} still serves, so callers can fall
 * back to the last known value when a reload fails.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}. The store owns its entries; values are
 * handed out, never the entries themselves.
 */
public class ReactiveCacheStore<K, V> {

    private static final Logger log = LoggerFactory.getLogger(ReactiveCacheStore.class);

    private final String name;
    private final Clock clock;

    private final ConcurrentHashMap<K, CacheEntry<K, V>>     entries  = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<K, CacheEntry<K, V>>     stale    = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<K, Mono<CacheLookup<V>>> inFlight = new ConcurrentHashMap<>();

    private final LongAdder hits   = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public ReactiveCacheStore(String name, Clock clock) {
        this.name  = Objects.requireNonNull(name, "name");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the cached value, or empty when the key is absent or its entry has expired.
     */
    public Optional<V> get(K key) {
        requireKey(key);
        CacheEntry<K, V> entry = freshEntry(key);
        if (entry == null) {
            misses.increment();
            return Optional.empty();
        }
        hits.increment();
        return Optional.of(entry.value());
    }

    public void set(K key, V value, Duration ttl) {
        requireKey(key);
        Objects.requireNonNull(value, "value");
        requireTtl(ttl);
        entries.put(key, new CacheEntry<>(key, value, clock.instant(), ttl));
        stale.remove(key);
        log.info("CACHE_REFRESH cache={} key={} ttlSeconds={}", name, key, ttl.toSeconds());
    }

    /**
     * Returns the last value stored under {@code key}, whether it is still fresh or has
     * already expired. Empty only when nothing was ever stored or it was invalidated.
     */
    public Optional<V> getStale(K key) {
        requireKey(key);
        CacheEntry<K, V> entry = entries.get(key);
        if (entry == null) {
            entry = stale.get(key);
        }
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    /**
     * Returns the fresh cached value, or computes, stores and returns it.
     *
     * @param loader invoked lazily, at most once per key while a computation is running
     */
    public Mono<V> getOrCompute(K key, Duration ttl, Supplier<Mono<V>> loader) {
        return lookupOrCompute(key, ttl, loader).map(CacheLookup::value);
    }

    /**
     * Same as {@link #getOrCompute} but also reports whether the value was a hit, was
     * loaded by this caller, or was shared from another caller's load.
     */
    public Mono<CacheLookup<V>> lookupOrCompute(K key, Duration ttl, Supplier<Mono<V>> loader) {
        requireKey(key);
        requireTtl(ttl);
        Objects.requireNonNull(loader, "loader");

        return Mono.<CacheLookup<V>>defer(() -> {
            CacheEntry<K, V> fresh = freshEntry(key);
            if (fresh != null) {
                hits.increment();
                log.info("CACHE_HIT cache={} key={} insertedAt={}", name, key, fresh.insertedAt());
                return Mono.just(CacheLookup.of(fresh.value(), CacheLookup.Origin.HIT));
            }
            misses.increment();

            AtomicBoolean created = new AtomicBoolean(false);
            Mono<CacheLookup<V>> flight = inFlight.computeIfAbsent(key, k -> {
                created.set(true);
                return newFlight(k, ttl, loader);
            });
            if (created.get()) {
                log.info("CACHE_MISS cache={} key={}", name, key);
                return flight;
            }
            log.info("CACHE_JOIN cache={} key={}", name, key);
            return flight.map(lookup -> lookup.origin() == CacheLookup.Origin.LOADED
                ? CacheLookup.of(lookup.value(), CacheLookup.Origin.JOINED)
                : lookup);
        });
    }

    public void invalidate(K key) {
        requireKey(key);
        entries.remove(key);
        stale.remove(key);
        log.info("CACHE_INVALIDATE cache={} key={}", name, key);
    }

    public void clear() {
        int size = entries.size();
        entries.clear();
        stale.clear();
        log.info("CACHE_CLEAR cache={} removed={}", name, size);
    }

    public CacheStats stats() {
        long h = hits.sum();
        long m = misses.sum();
        double hitRate = (h + m) == 0 ? 0.0 : Math.round(h * 1000.0 / (h + m)) / 10.0;
        return new CacheStats(name, entries.size(), h, m, hitRate);
    }

    // ── internals ─────────────────────────────────────────────────────────────

    /**
     * One shared load for {@code key}. The registry slot is released once the load
     * terminates; the value is stored before that, so a caller that missed just before
     * the release finds it on its own re-check instead of loading again.
     */
    private Mono<CacheLookup<V>> newFlight(K key, Duration ttl, Supplier<Mono<V>> loader) {
        return Mono.<CacheLookup<V>>defer(() -> {
                CacheEntry<K, V> fresh = freshEntry(key);
                if (fresh != null) {
                    return Mono.just(CacheLookup.of(fresh.value(), CacheLookup.Origin.HIT));
                }
                return Mono.defer(loader)
                    .map(value -> {
                        set(key, value, ttl);
                        return CacheLookup.of(value, CacheLookup.Origin.LOADED);
                    });
            })
            .doFinally(signal -> inFlight.remove(key))
            .cache();
    }

    private CacheEntry<K, V> freshEntry(K key) {
        CacheEntry<K, V> entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            if (entries.remove(key, entry)) {
                stale.put(key, entry);
                log.debug("CACHE_EXPIRED cache={} key={} insertedAt={}", name, key, entry.insertedAt());
            }
            return null;
        }
        return entry;
    }

    private static void requireKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("cache key must not be null");
        }
    }

    private static void requireTtl(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got " + ttl);
        }
    }
}
