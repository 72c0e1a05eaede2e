package com.sonarlink.service.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.sonarlink.model.CacheKey;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * One upstream fetch shared by every caller waiting on the same key.
 * The sink replays the single outcome to each subscriber.
 */
final class InFlightRequest {

    private final CacheKey key;
    // store generation when the fetch was registered
    private final long generation;
    private final Sinks.One<JsonNode> outcome = Sinks.one();
    private final AtomicInteger waiters = new AtomicInteger();

    InFlightRequest(CacheKey key, long generation) {
        this.key = key;
        this.generation = generation;
    }

    Mono<JsonNode> join() {
        waiters.incrementAndGet();
        return outcome.asMono();
    }

    void succeed(JsonNode value) {
        outcome.emitValue(value, Sinks.EmitFailureHandler.FAIL_FAST);
    }

    void fail(Throwable error) {
        outcome.emitError(error, Sinks.EmitFailureHandler.FAIL_FAST);
    }

    CacheKey getKey() {
        return key;
    }

    long getGeneration() {
        return generation;
    }

    int getWaiters() {
        return waiters.get();
    }
}
