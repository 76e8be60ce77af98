package com.costguard.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * A single cached payload with TTL metadata, persisted as one JSON file per entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    /**
     * Original (unsanitized) cache key.
     */
    private String key;

    /**
     * Opaque cached payload.
     */
    private byte[] data;

    @JsonProperty("ttl_seconds")
    private int ttlSeconds;

    @JsonProperty("created_at")
    private Instant createdAt;

    /**
     * createdAt + ttlSeconds, stored for readability of cache files.
     */
    @JsonProperty("expires_at")
    private Instant expiresAt;

    public static CacheEntry create(String key, byte[] data, int ttlSeconds, Instant now) {
        return CacheEntry.builder()
                .key(key)
                .data(data)
                .ttlSeconds(ttlSeconds)
                .createdAt(now)
                .expiresAt(now.plusSeconds(ttlSeconds))
                .build();
    }

    /**
     * An entry is expired once now >= createdAt + ttlSeconds.
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(createdAt.plusSeconds(ttlSeconds));
    }

    public Duration ageAt(Instant now) {
        return Duration.between(createdAt, now);
    }

    /**
     * Time left before expiry, never negative.
     */
    public Duration timeUntilExpirationAt(Instant now) {
        Duration remaining = Duration.between(now, createdAt.plusSeconds(ttlSeconds));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
