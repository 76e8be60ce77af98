package com.costguard.config;

import com.costguard.exception.CacheException;
import com.costguard.repository.FileCacheStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;

/**
 * Cache configuration for the file-backed query cache.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    private final CostguardProperties properties;

    public CacheConfiguration(CostguardProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FileCacheStore fileCacheStore(ObjectMapper objectMapper, Clock clock) throws CacheException {
        CostguardProperties.CacheConfig cache = properties.getCache();

        if (!cache.isEnabled()) {
            log.info("Query cache disabled by configuration");
            return FileCacheStore.disabled();
        }

        int ttlSeconds = CacheTtl.sanitizeTtl(cache.getTtlSeconds());
        int maxSizeMb = CacheTtl.sanitizeMaxSize(cache.getMaxSizeMb());

        FileCacheStore store = new FileCacheStore(
                Paths.get(cache.getDirectory()), true, ttlSeconds, maxSizeMb, objectMapper, clock);

        log.info("Configured file cache: dir={}, ttl={}, maxSize={}MB",
                store.getDirectory(), CacheTtl.format(Duration.ofSeconds(ttlSeconds)), maxSizeMb);
        return store;
    }
}
