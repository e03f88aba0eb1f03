package com.neowatch.common.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ReactiveCacheStoreTest {

    private static final Duration TTL = Duration.ofSeconds(300);

    private MutableClock clock;
    private ReactiveCacheStore<String, String> store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-15T12:00:00Z"));
        store = new ReactiveCacheStore<>("test", clock);
    }

    // ── get / set / expiry ────────────────────────────────────────────────

    @Nested
    @DisplayName("get / set")
    class GetSet {

        @Test
        @DisplayName("absent key → empty")
        void absentKey() {
            assertEquals(Optional.empty(), store.get("feed:2024-03-15:2024-03-15"));
        }

        @Test
        @DisplayName("value is served until its TTL elapses, then behaves as absent")
        void lazyExpiry() {
            store.set("k", "v", TTL);
            clock.advance(Duration.ofSeconds(299));
            assertEquals(Optional.of("v"), store.get("k"));

            clock.advance(Duration.ofSeconds(1));
            assertEquals(Optional.empty(), store.get("k"));
        }

        @Test
        @DisplayName("expired value remains reachable through getStale")
        void staleSlot() {
            store.set("k", "v", TTL);
            clock.advance(Duration.ofMinutes(10));

            assertTrue(store.get("k").isEmpty());
            assertEquals(Optional.of("v"), store.getStale("k"));
        }

        @Test
        @DisplayName("getStale also returns a fresh value")
        void staleReturnsFresh() {
            store.set("k", "v", TTL);
            assertEquals(Optional.of("v"), store.getStale("k"));
        }

        @Test
        @DisplayName("invalidate removes both the entry and its stale copy")
        void invalidate() {
            store.set("k", "v", TTL);
            clock.advance(Duration.ofMinutes(10));
            store.get("k");

            store.invalidate("k");
            assertTrue(store.getStale("k").isEmpty());
        }

        @Test
        @DisplayName("clear empties the store")
        void clear() {
            store.set("a", "1", TTL);
            store.set("b", "2", TTL);
            store.clear();
            assertEquals(0, store.stats().size());
            assertTrue(store.getStale("a").isEmpty());
        }

        @Test
        @DisplayName("null key and non-positive TTL are rejected")
        void contractViolations() {
            assertThrows(IllegalArgumentException.class, () -> store.get(null));
            assertThrows(IllegalArgumentException.class, () -> store.set("k", "v", Duration.ZERO));
            assertThrows(IllegalArgumentException.class,
                () -> store.getOrCompute("k", Duration.ofSeconds(-1), () -> Mono.just("v")));
        }
    }

    // ── getOrCompute ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("getOrCompute")
    class GetOrCompute {

        @Test
        @DisplayName("second call within TTL is served from cache")
        void computesOnceWithinTtl() {
            AtomicInteger loads = new AtomicInteger();

            CacheLookup<String> first = store.lookupOrCompute("k", TTL,
                () -> Mono.fromCallable(() -> "v" + loads.incrementAndGet())).block();
            CacheLookup<String> second = store.lookupOrCompute("k", TTL,
                () -> Mono.fromCallable(() -> "v" + loads.incrementAndGet())).block();

            assertEquals(1, loads.get());
            assertEquals(CacheLookup.Origin.LOADED, first.origin());
            assertEquals(CacheLookup.Origin.HIT, second.origin());
            assertEquals("v1", second.value());
        }

        @Test
        @DisplayName("expired entry triggers a reload")
        void reloadsAfterExpiry() {
            AtomicInteger loads = new AtomicInteger();
            store.getOrCompute("k", TTL, () -> Mono.fromCallable(() -> "v" + loads.incrementAndGet())).block();
            clock.advance(TTL);

            String value = store.getOrCompute("k", TTL,
                () -> Mono.fromCallable(() -> "v" + loads.incrementAndGet())).block();

            assertEquals("v2", value);
            assertEquals(2, loads.get());
        }

        @Test
        @DisplayName("waiters issued before completion share one load")
        void singleFlight() {
            AtomicInteger loads = new AtomicInteger();
            Sinks.One<String> upstream = Sinks.one();

            List<CompletableFuture<CacheLookup<String>>> waiters = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                waiters.add(store.lookupOrCompute("k", TTL, () -> {
                    loads.incrementAndGet();
                    return upstream.asMono();
                }).toFuture());
            }
            assertTrue(waiters.stream().noneMatch(CompletableFuture::isDone));

            upstream.tryEmitValue("payload");

            assertEquals(1, loads.get());
            long loaded = waiters.stream().map(CompletableFuture::join)
                .filter(l -> l.origin() == CacheLookup.Origin.LOADED).count();
            long joined = waiters.stream().map(CompletableFuture::join)
                .filter(l -> l.origin() == CacheLookup.Origin.JOINED).count();
            assertEquals(1, loaded);
            assertEquals(4, joined);
            waiters.forEach(w -> assertEquals("payload", w.join().value()));
        }

        @Test
        @DisplayName("concurrent callers on many threads issue exactly one load")
        void singleFlightAcrossThreads() throws Exception {
            AtomicInteger loads = new AtomicInteger();
            int callers = 16;
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            try {
                List<Future<String>> results = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    results.add(pool.submit(() -> {
                        start.await();
                        return store.getOrCompute("k", TTL, () -> Mono.fromCallable(() -> {
                                loads.incrementAndGet();
                                return "payload";
                            })
                            .delayElement(Duration.ofMillis(100))
                            .subscribeOn(Schedulers.boundedElastic()))
                            .block(Duration.ofSeconds(5));
                    }));
                }
                start.countDown();
                for (Future<String> result : results) {
                    assertEquals("payload", result.get(5, TimeUnit.SECONDS));
                }
            } finally {
                pool.shutdownNow();
            }
            assertEquals(1, loads.get());
        }

        @Test
        @DisplayName("a failed load reaches every waiter and is not cached")
        void failureIsSharedButNotCached() {
            Sinks.One<String> upstream = Sinks.one();
            CompletableFuture<String> a = store.getOrCompute("k", TTL, upstream::asMono).toFuture();
            CompletableFuture<String> b = store.getOrCompute("k", TTL, upstream::asMono).toFuture();

            upstream.tryEmitError(new IllegalStateException("boom"));

            assertTrue(a.isCompletedExceptionally());
            assertTrue(b.isCompletedExceptionally());
            assertTrue(store.getStale("k").isEmpty());

            String retried = store.getOrCompute("k", TTL, () -> Mono.just("ok")).block();
            assertEquals("ok", retried);
        }

        @Test
        @DisplayName("loads for different keys run independently")
        void independentKeys() {
            Sinks.One<String> slow = Sinks.one();
            CompletableFuture<String> pending = store.getOrCompute("slow", TTL, slow::asMono).toFuture();

            assertEquals("fast", store.getOrCompute("fast", TTL, () -> Mono.just("fast")).block());
            assertFalse(pending.isDone());

            slow.tryEmitValue("slow");
            assertEquals("slow", pending.join());
        }
    }

    @Test
    @DisplayName("stats count hits and misses")
    void stats() {
        store.getOrCompute("k", TTL, () -> Mono.just("v")).block();
        store.getOrCompute("k", TTL, () -> Mono.just("v")).block();
        store.get("k");
        store.get("other");

        CacheStats stats = store.stats();
        assertEquals("test", stats.name());
        assertEquals(1, stats.size());
        assertEquals(2, stats.hits());
        assertEquals(2, stats.misses());
        assertEquals(50.0, stats.hitRate());
    }
}
