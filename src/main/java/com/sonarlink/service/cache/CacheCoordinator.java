package com.sonarlink.service.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.sonarlink.exception.UpstreamTimeoutException;
import com.sonarlink.model.CacheKey;
import com.sonarlink.service.retry.RetryOrchestrator;
import com.sonarlink.service.retry.RetryResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Single-flight access to the cache.
 *
 * <p>Per key: Empty → Fetching → Valid, or back to Empty on error. The first caller
 * to miss registers an {@link InFlightRequest} (atomic {@code putIfAbsent}) and starts
 * the fetch; every later caller for that key attaches to it and receives the same
 * value or error. The fetch is subscribed independently of the callers, so a caller
 * timing out or cancelling never cancels it.</p>
 *
 * <p>On success the value is stored before the in-flight entry is removed, so a caller
 * arriving after resolution finds it in the store. Errors are never stored.</p>
 *
 * <p>A fetch started before its key was invalidated is detached: its value still reaches
 * the callers already waiting on it, but it is not stored, and new callers start a fresh
 * fetch instead of joining it.</p>
 *
 * <p>With a {@link SharedCacheTier} configured, a local miss is looked up there before going
 * upstream, and upstream results are written through to it.</p>
 */
@Slf4j
public class CacheCoordinator {

    private final CacheStore cacheStore;
    private final RetryOrchestrator retryOrchestrator;
    private final Duration waitTimeout;
    private final Scheduler scheduler;
    private final SharedCacheTier sharedTier;

    private final ConcurrentHashMap<CacheKey, InFlightRequest> inFlight = new ConcurrentHashMap<>();

    public CacheCoordinator(
            CacheStore cacheStore,
            RetryOrchestrator retryOrchestrator,
            Duration waitTimeout,
            Scheduler scheduler) {
        this(cacheStore, retryOrchestrator, waitTimeout, scheduler, SharedCacheTier.none());
    }

    public CacheCoordinator(
            CacheStore cacheStore,
            RetryOrchestrator retryOrchestrator,
            Duration waitTimeout,
            Scheduler scheduler,
            SharedCacheTier sharedTier) {
        this.cacheStore = cacheStore;
        this.retryOrchestrator = retryOrchestrator;
        this.waitTimeout = waitTimeout;
        this.scheduler = scheduler;
        this.sharedTier = sharedTier;
    }

    /**
     * @throws com.sonarlink.exception.UnknownResourceTypeException (as an error signal) before
     *         any fetch starts when the key's type has no TTL policy
     */
    public Mono<JsonNode> getOrFetch(CacheKey key, Supplier<Mono<JsonNode>> loader) {
        return Mono.defer(() -> {
            cacheStore.getTtlPolicy().ttlFor(key.getResourceType());

            Optional<JsonNode> cached = cacheStore.get(key);
            if (cached.isPresent()) {
                return Mono.just(cached.get());
            }
            return joinOrStart(key, loader)
                    .timeout(waitTimeout, scheduler)
                    .onErrorMap(TimeoutException.class, e -> new UpstreamTimeoutException(
                            "Gave up waiting " + waitTimeout.toMillis() + "ms for " + key, e));
        });
    }

    private Mono<JsonNode> joinOrStart(CacheKey key, Supplier<Mono<JsonNode>> loader) {
        while (true) {
            long generation = cacheStore.generationOf(key);
            InFlightRequest candidate = new InFlightRequest(key, generation);
            InFlightRequest existing = inFlight.putIfAbsent(key, candidate);
            if (existing == null) {
                return startOwned(candidate, loader);
            }
            if (existing.getGeneration() == generation) {
                log.debug("Joining in-flight fetch for key: {}", key);
                return existing.join();
            }
            if (inFlight.replace(key, existing, candidate)) {
                log.debug("Detached in-flight fetch for key {} invalidated while running", key);
                return startOwned(candidate, loader);
            }
            // lost a race with another caller; look again
        }
    }

    private Mono<JsonNode> startOwned(InFlightRequest request, Supplier<Mono<JsonNode>> loader) {
        CacheKey key = request.getKey();
        Mono<JsonNode> result = request.join();

        // A fetch may have resolved between our miss and registration
        Optional<JsonNode> raced = cacheStore.peek(key);
        if (raced.isPresent()) {
            inFlight.remove(key, request);
            request.succeed(raced.get());
            return result;
        }

        start(request, loader);
        return result;
    }

    private void start(InFlightRequest request, Supplier<Mono<JsonNode>> loader) {
        CacheKey key = request.getKey();
        log.debug("Fetching from upstream for key: {}", key);

        // zero attempts marks a value served by the shared tier
        sharedTier.get(key)
                .map(value -> RetryResult.success(value, 0))
                .switchIfEmpty(Mono.defer(() -> retryOrchestrator.execute(loader)))
                .subscribe(
                        outcome -> complete(request, outcome),
                        error -> complete(request, RetryResult.failure(error, 0)));
    }

    private void complete(InFlightRequest request, RetryResult<JsonNode> outcome) {
        CacheKey key = request.getKey();
        if (!outcome.isSuccess()) {
            inFlight.remove(key, request);
            log.debug("Fetch for key {} failed after {} attempt(s), releasing {} waiter(s)",
                    key, outcome.getAttempts(), request.getWaiters());
            request.fail(outcome.getError());
            return;
        }

        JsonNode value = outcome.getValue();
        boolean stored;
        try {
            stored = cacheStore.putIfCurrent(key, value, request.getGeneration());
        } catch (RuntimeException e) {
            inFlight.remove(key, request);
            log.error("Failed to store fetched value for key: {}", key, e);
            request.fail(e);
            return;
        }
        inFlight.remove(key, request);

        if (stored && outcome.getAttempts() > 0) {
            sharedTier.put(key, value, cacheStore.getTtlPolicy().ttlFor(key.getResourceType())).subscribe();
        }
        log.debug("Fetch for key {} succeeded after {} attempt(s), releasing {} waiter(s)",
                key, outcome.getAttempts(), request.getWaiters());
        request.succeed(value);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public SharedCacheTier getSharedTier() {
        return sharedTier;
    }
}
