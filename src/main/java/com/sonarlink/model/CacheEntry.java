package com.sonarlink.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A cached upstream payload with its freshness window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    private CacheKey key;

    /**
     * The SonarQube response body, opaque to this layer.
     */
    private JsonNode value;

    private String resourceType;

    private Instant createdAt;

    private Instant expiresAt;

    /**
     * Approximate size of the serialized payload in bytes.
     */
    private long sizeEstimate;

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
