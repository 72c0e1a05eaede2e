package com.sonarlink.service.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sonarlink.model.CacheKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Redis-backed shared cache tier.
 * Key pattern: {prefix}{type}:{id}[?{params}], value is the JSON payload, TTL set per write.
 */
@Slf4j
public class RedisSharedCacheTier implements SharedCacheTier {

    private static final long SCAN_COUNT = 500;

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final TtlPolicy ttlPolicy;
    private final String keyPrefix;

    public RedisSharedCacheTier(
            ReactiveStringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            TtlPolicy ttlPolicy,
            String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttlPolicy = ttlPolicy;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public Mono<JsonNode> get(CacheKey key) {
        String redisKey = redisKey(key);
        return redisTemplate.opsForValue().get(redisKey)
                .flatMap(json -> Mono.fromCallable(() -> objectMapper.readTree(json)))
                .doOnNext(value -> log.debug("Redis cache hit: {}", redisKey))
                .onErrorResume(e -> {
                    log.error("Error retrieving from Redis cache: key={}", redisKey, e);
                    return Mono.empty();
                });
    }

    @Override
    public Mono<Void> put(CacheKey key, JsonNode value, Duration ttl) {
        String redisKey = redisKey(key);
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(value))
                .flatMap(json -> redisTemplate.opsForValue().set(redisKey, json, ttl))
                .doOnNext(stored -> log.debug("Stored in Redis cache: key={}, ttl={}", redisKey, ttl))
                .onErrorResume(e -> {
                    log.error("Error storing to Redis cache: key={}", redisKey, e);
                    return Mono.empty();
                })
                .then();
    }

    @Override
    public Mono<Long> invalidate(String resourceType, String resourceId) {
        Collection<String> types = resourceType == null ? ttlPolicy.resourceTypes() : List.of(resourceType);
        Flux<String> keys = Flux.fromIterable(types)
                .flatMap(type -> {
                    String exact = keyPrefix + type + ":" + resourceId;
                    return Flux.concat(Mono.just(exact), scan(escapeGlob(exact) + "\\?*"));
                });
        return delete(keys, "resource " + resourceId);
    }

    @Override
    public Mono<Long> clearType(String resourceType) {
        return delete(scan(escapeGlob(keyPrefix + resourceType + ":") + "*"), "type " + resourceType);
    }

    @Override
    public Mono<Long> clearAll() {
        return delete(scan(escapeGlob(keyPrefix) + "*"), "all entries");
    }

    String redisKey(CacheKey key) {
        return keyPrefix + key;
    }

    private Flux<String> scan(String pattern) {
        return redisTemplate.scan(ScanOptions.scanOptions().match(pattern).count(SCAN_COUNT).build());
    }

    private Mono<Long> delete(Flux<String> keys, String description) {
        return redisTemplate.delete(keys)
                .defaultIfEmpty(0L)
                .doOnNext(removed -> log.info("Removed {} Redis cache entries for {}", removed, description))
                .onErrorResume(e -> {
                    log.error("Error removing Redis cache entries for {}", description, e);
                    return Mono.just(0L);
                });
    }

    /**
     * Escape Redis glob metacharacters so ids match literally.
     */
    static String escapeGlob(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
