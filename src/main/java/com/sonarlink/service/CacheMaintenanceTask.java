package com.sonarlink.service;

import com.sonarlink.model.dto.CacheStatistics;
import com.sonarlink.service.cache.CacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background housekeeping: purges expired entries and logs cache statistics.
 */
@Slf4j
@Component
public class CacheMaintenanceTask {

    private final CacheStore cacheStore;

    public CacheMaintenanceTask(CacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    @Scheduled(
            fixedDelayString = "${sonarlink.cache.cleanup-interval:PT5M}",
            initialDelayString = "${sonarlink.cache.cleanup-interval:PT5M}")
    public void purgeExpired() {
        int removed = cacheStore.purgeExpired();
        if (removed > 0) {
            log.debug("Cleaned up {} expired cache entries", removed);
        }
    }

    @Scheduled(
            fixedDelayString = "${sonarlink.cache.stats-log-interval:PT10M}",
            initialDelayString = "${sonarlink.cache.stats-log-interval:PT10M}")
    public void logStatistics() {
        CacheStatistics stats = cacheStore.stats();
        log.info("Cache statistics: entries={}, hits={}, misses={}, hitRatio={}, evictions={}, expirations={}, sizeBytes={}",
                stats.getEntryCount(), stats.getHits(), stats.getMisses(),
                String.format("%.2f", stats.getHitRatio()),
                stats.getEvictions(), stats.getExpirations(), stats.getEstimatedSizeBytes());
    }
}
