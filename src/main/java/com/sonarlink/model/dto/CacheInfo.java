package com.sonarlink.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Cache statistics together with the configuration they were produced under.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheInfo {

    private CacheStatistics statistics;

    /**
     * TTL in seconds by resource type.
     */
    private Map<String, Long> ttlByType;

    private int maxEntries;

    private int inFlightRequests;

    /**
     * Name of the shared tier behind the local store, {@code none} when caching is in-process only.
     */
    private String sharedCache;
}
