package com.costguard.service;

import com.costguard.config.CacheTtl;
import com.costguard.exception.CacheDisabledException;
import com.costguard.exception.CacheException;
import com.costguard.model.dto.CacheStatistics;
import com.costguard.repository.FileCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Periodic expiry sweep and statistics for the file cache.
 */
@Slf4j
@Service
public class CacheMaintenanceService {

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final FileCacheStore cacheStore;

    public CacheMaintenanceService(FileCacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    /**
     * Remove expired entries on a fixed delay.
     */
    @Scheduled(fixedDelayString = "${costguard.cache.cleanup-interval:PT15M}",
            initialDelayString = "${costguard.cache.cleanup-interval:PT15M}")
    public void evictExpired() {
        try {
            int removed = cacheStore.cleanupExpired();
            log.debug("Scheduled cache sweep removed {} entries", removed);
        } catch (CacheDisabledException e) {
            log.debug("Cache disabled, skipping scheduled sweep");
        } catch (CacheException e) {
            log.error("Scheduled cache sweep failed", e);
        }
    }

    /**
     * Remove every cache entry.
     *
     * @return false if the cache is disabled
     */
    public boolean clear() throws CacheException {
        if (!cacheStore.isEnabled()) {
            return false;
        }
        cacheStore.clear();
        return true;
    }

    public CacheStatistics getStatistics() throws CacheException {
        if (!cacheStore.isEnabled()) {
            return CacheStatistics.builder()
                    .enabled(false)
                    .build();
        }

        long totalBytes = cacheStore.size();
        long maxBytes = cacheStore.getMaxSizeMb() * BYTES_PER_MB;

        return CacheStatistics.builder()
                .enabled(true)
                .directory(cacheStore.getDirectory().toString())
                .totalEntries(cacheStore.count())
                .totalBytes(totalBytes)
                .maxBytes(maxBytes)
                .overSizeBudget(maxBytes > 0 && totalBytes > maxBytes)
                .ttlSeconds(cacheStore.getTtlSeconds())
                .ttl(CacheTtl.format(Duration.ofSeconds(cacheStore.getTtlSeconds())))
                .build();
    }
}
