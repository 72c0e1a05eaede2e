package com.sonarlink.service.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.sonarlink.model.CacheKey;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Optional second cache level shared between SonarLink instances.
 *
 * <p>The in-process {@link CacheStore} stays the first level. Implementations treat
 * their own failures as misses and log them; a broken shared tier never fails a request.</p>
 */
public interface SharedCacheTier {

    String name();

    /**
     * @return the cached value, or empty on a miss or a tier failure
     */
    Mono<JsonNode> get(CacheKey key);

    Mono<Void> put(CacheKey key, JsonNode value, Duration ttl);

    /**
     * Remove every entry keyed by {@code resourceId}, across all types when {@code resourceType} is null.
     */
    Mono<Long> invalidate(String resourceType, String resourceId);

    Mono<Long> clearType(String resourceType);

    Mono<Long> clearAll();

    static SharedCacheTier none() {
        return LocalOnly.INSTANCE;
    }

    /**
     * No shared tier configured: every lookup misses, every removal removes nothing.
     */
    final class LocalOnly implements SharedCacheTier {

        private static final LocalOnly INSTANCE = new LocalOnly();

        private LocalOnly() {
        }

        @Override
        public String name() {
            return "none";
        }

        @Override
        public Mono<JsonNode> get(CacheKey key) {
            return Mono.empty();
        }

        @Override
        public Mono<Void> put(CacheKey key, JsonNode value, Duration ttl) {
            return Mono.empty();
        }

        @Override
        public Mono<Long> invalidate(String resourceType, String resourceId) {
            return Mono.just(0L);
        }

        @Override
        public Mono<Long> clearType(String resourceType) {
            return Mono.just(0L);
        }

        @Override
        public Mono<Long> clearAll() {
            return Mono.just(0L);
        }
    }
}
