package com.sonarlink.service.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.sonarlink.model.CacheEntry;
import com.sonarlink.model.CacheKey;
import com.sonarlink.model.dto.CacheStatistics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Bounded, TTL-aware store of SonarQube payloads.
 *
 * <p>Entries live in an access-ordered map so the head is always the least
 * recently used one. Inserting past {@code maxEntries} evicts from the head
 * regardless of remaining TTL. Expiry never evicts: an expired entry is a miss
 * and is dropped when touched or by {@link #purgeExpired()}.</p>
 *
 * <p>Every invalidation advances a generation stamp (global, per type, per resource id).
 * A fetch records {@link #generationOf(CacheKey)} before going upstream and stores its
 * result with {@link #putIfCurrent}, which refuses the write if the key was invalidated
 * in the meantime.</p>
 *
 * <p>All state is guarded by one lock; no I/O happens while it is held.</p>
 */
@Slf4j
public class CacheStore {

    private final TtlPolicy ttlPolicy;
    private final int maxEntries;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<CacheKey, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);

    // guarded by lock
    private long hits;
    private long misses;
    private long evictions;
    private long expirations;
    private long puts;
    private long sizeBytes;
    private long globalGeneration;
    // only ids and types that were ever invalidated appear here
    private final Map<String, Long> typeGenerations = new HashMap<>();
    private final Map<String, Long> idGenerations = new HashMap<>();

    public CacheStore(TtlPolicy ttlPolicy, int maxEntries, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1, got " + maxEntries);
        }
        this.ttlPolicy = ttlPolicy;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    /**
     * @return the cached value if present and not expired
     */
    public Optional<JsonNode> get(CacheKey key) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                misses++;
                log.debug("Cache miss for key: {}", key);
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                removeEntry(key);
                expirations++;
                misses++;
                log.debug("Cache entry expired for key: {}", key);
                return Optional.empty();
            }
            hits++;
            log.debug("Cache hit for key: {}", key);
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Lookup that leaves statistics untouched, for re-checks after a miss was already counted.
     */
    Optional<JsonNode> peek(CacheKey key) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null || entry.isExpired(clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store a value with the TTL of the key's resource type.
     *
     * @throws com.sonarlink.exception.UnknownResourceTypeException if the type has no TTL policy
     */
    public void put(CacheKey key, JsonNode value) {
        CacheEntry entry = newEntry(key, value);
        lock.lock();
        try {
            store(entry);
        } finally {
            lock.unlock();
        }
        log.debug("Cache set for key: {} (expires {})", key, entry.getExpiresAt());
    }

    /**
     * Store a value only if nothing invalidated the key since {@code generation} was taken.
     *
     * @return whether the value was stored
     */
    public boolean putIfCurrent(CacheKey key, JsonNode value, long generation) {
        CacheEntry entry = newEntry(key, value);
        lock.lock();
        try {
            if (generationOf(key) != generation) {
                log.debug("Discarding value for key {} fetched before an invalidation", key);
                return false;
            }
            store(entry);
        } finally {
            lock.unlock();
        }
        log.debug("Cache set for key: {} (expires {})", key, entry.getExpiresAt());
        return true;
    }

    /**
     * Stamp that changes whenever the key could have been invalidated.
     */
    public long generationOf(CacheKey key) {
        lock.lock();
        try {
            return globalGeneration
                    + typeGenerations.getOrDefault(key.getResourceType(), 0L)
                    + idGenerations.getOrDefault(key.getResourceId(), 0L);
        } finally {
            lock.unlock();
        }
    }

    public boolean invalidate(CacheKey key) {
        lock.lock();
        try {
            idGenerations.merge(key.getResourceId(), 1L, Long::sum);
            return removeEntry(key) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every entry keyed by {@code resourceId}, limited to {@code resourceType}
     * unless it is null.
     *
     * @return number of entries removed
     */
    public int invalidatePrefix(String resourceType, String resourceId) {
        int removed = removeIf(key -> key.matches(resourceType, resourceId),
                () -> idGenerations.merge(resourceId, 1L, Long::sum));
        log.debug("Invalidated {} entries for {}:{}", removed, resourceType == null ? "*" : resourceType, resourceId);
        return removed;
    }

    public int clearType(String resourceType) {
        int removed = removeIf(key -> key.getResourceType().equals(resourceType),
                () -> typeGenerations.merge(resourceType, 1L, Long::sum));
        log.info("Cleared {} cache entries of type: {}", removed, resourceType);
        return removed;
    }

    public int clearAll() {
        lock.lock();
        try {
            int removed = entries.size();
            globalGeneration++;
            entries.clear();
            sizeBytes = 0;
            log.info("Cleared all {} cache entries", removed);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop every expired entry. Counted as expirations, never as evictions.
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        lock.lock();
        try {
            int removed = 0;
            Iterator<Map.Entry<CacheKey, CacheEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                CacheEntry entry = it.next().getValue();
                if (entry.isExpired(now)) {
                    it.remove();
                    sizeBytes -= entry.getSizeEstimate();
                    removed++;
                }
            }
            expirations += removed;
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public CacheStatistics stats() {
        lock.lock();
        try {
            long lookups = hits + misses;
            return CacheStatistics.builder()
                    .hits(hits)
                    .misses(misses)
                    .evictions(evictions)
                    .expirations(expirations)
                    .puts(puts)
                    .entryCount(entries.size())
                    .hitRatio(lookups == 0 ? 0.0 : (double) hits / lookups)
                    .estimatedSizeBytes(sizeBytes)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public TtlPolicy getTtlPolicy() {
        return ttlPolicy;
    }

    private int removeIf(Predicate<CacheKey> predicate, Runnable advanceGeneration) {
        lock.lock();
        try {
            advanceGeneration.run();
            int removed = 0;
            Iterator<Map.Entry<CacheKey, CacheEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<CacheKey, CacheEntry> next = it.next();
                if (predicate.test(next.getKey())) {
                    it.remove();
                    sizeBytes -= next.getValue().getSizeEstimate();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    private CacheEntry newEntry(CacheKey key, JsonNode value) {
        Instant now = clock.instant();
        return CacheEntry.builder()
                .key(key)
                .value(value)
                .resourceType(key.getResourceType())
                .createdAt(now)
                .expiresAt(now.plus(ttlPolicy.ttlFor(key.getResourceType())))
                .sizeEstimate(estimateSize(value))
                .build();
    }

    // caller holds lock
    private void store(CacheEntry entry) {
        CacheEntry previous = entries.put(entry.getKey(), entry);
        if (previous != null) {
            sizeBytes -= previous.getSizeEstimate();
        }
        sizeBytes += entry.getSizeEstimate();
        puts++;
        evictOverflow();
    }

    private void evictOverflow() {
        Iterator<Map.Entry<CacheKey, CacheEntry>> it = entries.entrySet().iterator();
        while (entries.size() > maxEntries && it.hasNext()) {
            Map.Entry<CacheKey, CacheEntry> eldest = it.next();
            it.remove();
            sizeBytes -= eldest.getValue().getSizeEstimate();
            evictions++;
            log.debug("Evicted least recently used entry: {}", eldest.getKey());
        }
    }

    private CacheEntry removeEntry(CacheKey key) {
        CacheEntry removed = entries.remove(key);
        if (removed != null) {
            sizeBytes -= removed.getSizeEstimate();
        }
        return removed;
    }

    private static long estimateSize(JsonNode value) {
        return value == null ? 0 : value.toString().length();
    }
}
