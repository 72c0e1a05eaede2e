package com.sonarlink.service.cache;

import com.sonarlink.exception.UnknownResourceTypeException;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Freshness window per resource type. Types without an entry are rejected
 * rather than given a silent default.
 */
public final class TtlPolicy {

    private final Map<String, Duration> ttlByType;

    public TtlPolicy(Map<String, Duration> ttlByType) {
        if (ttlByType == null || ttlByType.isEmpty()) {
            throw new IllegalArgumentException("TTL policy needs at least one resource type");
        }
        Map<String, Duration> copy = new LinkedHashMap<>();
        ttlByType.forEach((type, ttl) -> {
            if (type == null || type.isBlank()) {
                throw new IllegalArgumentException("Resource type in TTL policy must not be blank");
            }
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("TTL for '" + type + "' must be positive, got " + ttl);
            }
            copy.put(type, ttl);
        });
        this.ttlByType = Collections.unmodifiableMap(copy);
    }

    public Duration ttlFor(String resourceType) {
        Duration ttl = ttlByType.get(resourceType);
        if (ttl == null) {
            throw new UnknownResourceTypeException(resourceType);
        }
        return ttl;
    }

    public boolean contains(String resourceType) {
        return ttlByType.containsKey(resourceType);
    }

    public Set<String> resourceTypes() {
        return ttlByType.keySet();
    }

    public Map<String, Duration> asMap() {
        return ttlByType;
    }
}
