package com.costguard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.time.Duration;

/**
 * Configuration properties for Costguard.
 */
@Data
@Component
@ConfigurationProperties(prefix = "costguard")
public class CostguardProperties {

    private CacheConfig cache = new CacheConfig();

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private String directory = Paths.get(System.getProperty("user.home"), ".costguard", "cache").toString();
        private int ttlSeconds = CacheTtl.DEFAULT_TTL_SECONDS;
        private int maxSizeMb = CacheTtl.DEFAULT_MAX_SIZE_MB;
        private Duration cleanupInterval = Duration.ofMinutes(15);
    }
}
