package com.costguard.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of the query cache contents.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    private boolean enabled;

    private String directory;

    /**
     * Number of entry files, including expired ones not yet swept.
     */
    private int totalEntries;

    private long totalBytes;

    /**
     * Configured size budget in bytes (0 = unlimited). Advisory only.
     */
    private long maxBytes;

    /**
     * True when totalBytes exceeds a non-zero maxBytes.
     */
    private boolean overSizeBudget;

    private int ttlSeconds;

    private String ttl;
}
