package com.sonarlink.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time cache counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    private long hits;

    private long misses;

    /**
     * Entries removed by the size bound (LRU).
     */
    private long evictions;

    /**
     * Entries removed because their TTL had passed.
     */
    private long expirations;

    private long puts;

    private int entryCount;

    /**
     * hits / (hits + misses), 0.0 when nothing was looked up yet.
     */
    private double hitRatio;

    private long estimatedSizeBytes;
}
