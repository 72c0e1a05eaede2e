package com.sonarlink.service.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.sonarlink.exception.NotFoundException;
import com.sonarlink.exception.UnknownResourceTypeException;
import com.sonarlink.exception.UpstreamTimeoutException;
import com.sonarlink.model.CacheKey;
import com.sonarlink.service.ratelimit.TokenBucketRateLimiter;
import com.sonarlink.service.retry.RetryOrchestrator;
import com.sonarlink.service.retry.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for single-flight behaviour of CacheCoordinator.
 */
class CacheCoordinatorTest {

    private static final CacheKey KEY = CacheKey.of("metrics", "proj");

    private VirtualTimeScheduler scheduler;
    private CacheStore store;
    private CacheCoordinator coordinator;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        store = new CacheStore(new TtlPolicy(Map.of("metrics", Duration.ofSeconds(300))), 100, Clock.systemUTC());
        coordinator = newCoordinator(scheduler, Duration.ofSeconds(5));
    }

    @Test
    void testConcurrentCallersShareOneFetch() {
        Sinks.One<JsonNode> upstream = Sinks.one();
        AtomicInteger calls = new AtomicInteger();

        List<AtomicReference<JsonNode>> results = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            AtomicReference<JsonNode> result = new AtomicReference<>();
            coordinator.getOrFetch(KEY, () -> {
                calls.incrementAndGet();
                return upstream.asMono();
            }).subscribe(result::set);
            results.add(result);
        }

        assertEquals(1, calls.get());
        assertEquals(1, coordinator.inFlightCount());

        upstream.tryEmitValue(payload("42"));

        for (AtomicReference<JsonNode> result : results) {
            assertEquals(payload("42"), result.get());
        }
        assertEquals(0, coordinator.inFlightCount());
        assertEquals(payload("42"), store.get(KEY).orElseThrow());
    }

    @Test
    void testFreshEntryServedWithoutFetch() {
        store.put(KEY, payload("cached"));
        AtomicInteger calls = new AtomicInteger();

        JsonNode value = coordinator.getOrFetch(KEY, () -> {
            calls.incrementAndGet();
            return Mono.just(payload("fresh"));
        }).block(Duration.ofSeconds(1));

        assertEquals(payload("cached"), value);
        assertEquals(0, calls.get());
    }

    @Test
    void testErrorSharedAndNotCached() {
        Sinks.One<JsonNode> upstream = Sinks.one();
        AtomicInteger calls = new AtomicInteger();

        AtomicReference<Throwable> first = new AtomicReference<>();
        AtomicReference<Throwable> second = new AtomicReference<>();
        coordinator.getOrFetch(KEY, () -> {
            calls.incrementAndGet();
            return upstream.asMono();
        }).subscribe(v -> { }, first::set);
        coordinator.getOrFetch(KEY, () -> {
            calls.incrementAndGet();
            return upstream.asMono();
        }).subscribe(v -> { }, second::set);

        upstream.tryEmitError(new NotFoundException("Component key 'proj' not found"));

        assertInstanceOf(NotFoundException.class, first.get());
        assertSame(first.get(), second.get());
        assertEquals(1, calls.get());
        assertEquals(0, store.size());
        assertEquals(0, coordinator.inFlightCount());

        // next caller starts a new fetch
        JsonNode value = coordinator.getOrFetch(KEY, () -> {
            calls.incrementAndGet();
            return Mono.just(payload("recovered"));
        }).block(Duration.ofSeconds(1));

        assertEquals(payload("recovered"), value);
        assertEquals(2, calls.get());
    }

    @Test
    void testCallerTimeoutDoesNotCancelFetch() {
        Sinks.One<JsonNode> upstream = Sinks.one();
        AtomicReference<Throwable> error = new AtomicReference<>();

        coordinator.getOrFetch(KEY, upstream::asMono).subscribe(v -> { }, error::set);
        scheduler.advanceTimeBy(Duration.ofSeconds(5));

        assertInstanceOf(UpstreamTimeoutException.class, error.get());
        assertEquals(1, coordinator.inFlightCount());

        upstream.tryEmitValue(payload("late"));

        assertEquals(0, coordinator.inFlightCount());
        assertEquals(payload("late"), store.get(KEY).orElseThrow());
    }

    @Test
    void testDifferentKeysFetchIndependently() {
        AtomicInteger calls = new AtomicInteger();
        CacheKey other = CacheKey.of("metrics", "other");

        coordinator.getOrFetch(KEY, () -> {
            calls.incrementAndGet();
            return Mono.just(payload("a"));
        }).block(Duration.ofSeconds(1));
        coordinator.getOrFetch(other, () -> {
            calls.incrementAndGet();
            return Mono.just(payload("b"));
        }).block(Duration.ofSeconds(1));

        assertEquals(2, calls.get());
        assertEquals(2, store.size());
    }

    @Test
    void testSingleFetchUnderRealConcurrency() throws Exception {
        CacheCoordinator concurrent = newCoordinator(Schedulers.parallel(), Duration.ofSeconds(5));
        AtomicInteger calls = new AtomicInteger();
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<JsonNode>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return concurrent.getOrFetch(KEY, () -> Mono.fromCallable(() -> {
                                calls.incrementAndGet();
                                return payload("shared");
                            }).delayElement(Duration.ofMillis(50)))
                            .block(Duration.ofSeconds(5));
                }));
            }
            start.countDown();

            for (Future<JsonNode> future : futures) {
                assertEquals(payload("shared"), future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, calls.get());
    }

    @Test
    void testInvalidationDuringFetchDiscardsStaleValue() {
        List<Sinks.One<JsonNode>> upstreams = new ArrayList<>();
        Supplier<Mono<JsonNode>> loader = () -> {
            Sinks.One<JsonNode> upstream = Sinks.one();
            upstreams.add(upstream);
            return upstream.asMono();
        };

        AtomicReference<JsonNode> early = new AtomicReference<>();
        coordinator.getOrFetch(KEY, loader).subscribe(early::set);
        assertEquals(1, upstreams.size());

        store.invalidatePrefix(null, "proj");
        upstreams.get(0).tryEmitValue(payload("pre-write"));

        // the caller that started the fetch still gets its answer, the store does not
        assertEquals(payload("pre-write"), early.get());
        assertTrue(store.peek(KEY).isEmpty());
        assertEquals(0, coordinator.inFlightCount());

        AtomicReference<JsonNode> late = new AtomicReference<>();
        coordinator.getOrFetch(KEY, loader).subscribe(late::set);
        assertEquals(2, upstreams.size());

        upstreams.get(1).tryEmitValue(payload("post-write"));

        assertEquals(payload("post-write"), late.get());
        assertEquals(payload("post-write"), store.get(KEY).orElseThrow());
    }

    @Test
    void testCallerAfterInvalidationDoesNotJoinStaleFetch() {
        List<Sinks.One<JsonNode>> upstreams = new ArrayList<>();
        Supplier<Mono<JsonNode>> loader = () -> {
            Sinks.One<JsonNode> upstream = Sinks.one();
            upstreams.add(upstream);
            return upstream.asMono();
        };

        AtomicReference<JsonNode> early = new AtomicReference<>();
        AtomicReference<JsonNode> late = new AtomicReference<>();
        coordinator.getOrFetch(KEY, loader).subscribe(early::set);
        store.invalidatePrefix(null, "proj");
        coordinator.getOrFetch(KEY, loader).subscribe(late::set);

        assertEquals(2, upstreams.size());
        assertEquals(1, coordinator.inFlightCount());

        // the detached fetch finishing must not release the fresh one's waiters or unregister it
        upstreams.get(0).tryEmitValue(payload("pre-write"));
        assertEquals(payload("pre-write"), early.get());
        assertNull(late.get());
        assertEquals(1, coordinator.inFlightCount());
        assertTrue(store.peek(KEY).isEmpty());

        upstreams.get(1).tryEmitValue(payload("post-write"));
        assertEquals(payload("post-write"), late.get());
        assertEquals(0, coordinator.inFlightCount());
        assertEquals(payload("post-write"), store.peek(KEY).orElseThrow());
    }

    @Test
    void testValueStoredByRacingFetchServedWithoutNewFetch() {
        // the first lookup misses although a concurrent fetch has already stored the value
        store = new CacheStore(new TtlPolicy(Map.of("metrics", Duration.ofSeconds(300))), 100, Clock.systemUTC()) {
            @Override
            public Optional<JsonNode> get(CacheKey key) {
                return Optional.empty();
            }
        };
        store.put(KEY, payload("raced"));
        coordinator = newCoordinator(scheduler, Duration.ofSeconds(5));
        AtomicInteger calls = new AtomicInteger();

        JsonNode value = coordinator.getOrFetch(KEY, () -> {
            calls.incrementAndGet();
            return Mono.just(payload("fresh"));
        }).block(Duration.ofSeconds(1));

        assertEquals(payload("raced"), value);
        assertEquals(0, calls.get());
        assertEquals(0, coordinator.inFlightCount());
    }

    @Test
    void testUnknownTypeRejectedBeforeFetch() {
        AtomicInteger calls = new AtomicInteger();
        AtomicReference<Throwable> error = new AtomicReference<>();

        coordinator.getOrFetch(CacheKey.of("widgets", "proj"), () -> {
            calls.incrementAndGet();
            return Mono.just(payload("w"));
        }).subscribe(v -> { }, error::set);

        assertInstanceOf(UnknownResourceTypeException.class, error.get());
        assertEquals(0, calls.get());
        assertEquals(0, coordinator.inFlightCount());
    }

    @Test
    void testStoreFailureReachesWaiters() {
        store = new CacheStore(new TtlPolicy(Map.of("metrics", Duration.ofSeconds(300))), 100, Clock.systemUTC()) {
            @Override
            public boolean putIfCurrent(CacheKey key, JsonNode value, long generation) {
                throw new IllegalStateException("store unavailable");
            }
        };
        coordinator = newCoordinator(scheduler, Duration.ofSeconds(5));
        Sinks.One<JsonNode> upstream = Sinks.one();

        AtomicReference<Throwable> first = new AtomicReference<>();
        AtomicReference<Throwable> second = new AtomicReference<>();
        coordinator.getOrFetch(KEY, upstream::asMono).subscribe(v -> { }, first::set);
        coordinator.getOrFetch(KEY, upstream::asMono).subscribe(v -> { }, second::set);

        upstream.tryEmitValue(payload("42"));

        assertInstanceOf(IllegalStateException.class, first.get());
        assertSame(first.get(), second.get());
        assertEquals(0, coordinator.inFlightCount());
    }

    @Test
    void testSharedTierHitSkipsUpstream() {
        InMemorySharedTier sharedTier = new InMemorySharedTier();
        sharedTier.values.put(KEY, payload("shared"));
        coordinator = newCoordinator(scheduler, Duration.ofSeconds(5), sharedTier);
        AtomicInteger calls = new AtomicInteger();

        JsonNode value = coordinator.getOrFetch(KEY, () -> {
            calls.incrementAndGet();
            return Mono.just(payload("upstream"));
        }).block(Duration.ofSeconds(1));

        assertEquals(payload("shared"), value);
        assertEquals(0, calls.get());
        assertEquals(payload("shared"), store.peek(KEY).orElseThrow());
        assertEquals(0, sharedTier.writes.get());
    }

    @Test
    void testUpstreamValueWrittenThroughToSharedTier() {
        InMemorySharedTier sharedTier = new InMemorySharedTier();
        coordinator = newCoordinator(scheduler, Duration.ofSeconds(5), sharedTier);

        JsonNode value = coordinator.getOrFetch(KEY, () -> Mono.just(payload("upstream")))
                .block(Duration.ofSeconds(1));

        assertEquals(payload("upstream"), value);
        assertEquals(payload("upstream"), sharedTier.values.get(KEY));
        assertEquals(Duration.ofSeconds(300), sharedTier.lastTtl.get());
        assertEquals(1, sharedTier.writes.get());
    }

    private CacheCoordinator newCoordinator(Scheduler timeScheduler, Duration waitTimeout, SharedCacheTier sharedTier) {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(100, 10.0, Duration.ofSeconds(5), timeScheduler);
        RetryOrchestrator orchestrator = new RetryOrchestrator(RetryPolicy.defaults(), limiter, timeScheduler, () -> 0.0);
        return new CacheCoordinator(store, orchestrator, waitTimeout, timeScheduler, sharedTier);
    }

    private CacheCoordinator newCoordinator(Scheduler timeScheduler, Duration waitTimeout) {
        return newCoordinator(timeScheduler, waitTimeout, SharedCacheTier.none());
    }

    private static JsonNode payload(String value) {
        return JsonNodeFactory.instance.objectNode().put("value", value);
    }

    /**
     * Shared tier held in a map.
     */
    static final class InMemorySharedTier implements SharedCacheTier {

        final Map<CacheKey, JsonNode> values = new ConcurrentHashMap<>();
        final AtomicInteger writes = new AtomicInteger();
        final AtomicReference<Duration> lastTtl = new AtomicReference<>();

        @Override
        public String name() {
            return "memory";
        }

        @Override
        public Mono<JsonNode> get(CacheKey key) {
            return Mono.justOrEmpty(values.get(key));
        }

        @Override
        public Mono<Void> put(CacheKey key, JsonNode value, Duration ttl) {
            return Mono.fromRunnable(() -> {
                values.put(key, value);
                lastTtl.set(ttl);
                writes.incrementAndGet();
            });
        }

        @Override
        public Mono<Long> invalidate(String resourceType, String resourceId) {
            return removeWhere(k -> k.matches(resourceType, resourceId));
        }

        @Override
        public Mono<Long> clearType(String resourceType) {
            return removeWhere(k -> k.getResourceType().equals(resourceType));
        }

        @Override
        public Mono<Long> clearAll() {
            return removeWhere(k -> true);
        }

        private Mono<Long> removeWhere(Predicate<CacheKey> predicate) {
            return Mono.fromCallable(() -> {
                long before = values.size();
                values.keySet().removeIf(predicate);
                return before - values.size();
            });
        }
    }
}
