package com.costguard.service.canonicalization;

import com.costguard.exception.CacheKeyException;
import com.costguard.model.QueryKeyParams;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

/**
 * Generates fixed-width cache keys (SHA-256, 64 hex chars).
 *
 * Three entry points with different determinism guarantees:
 * - {@link #generateKey}: canonical, order and case insensitive where the canonicalizer says so
 * - {@link #generateSimpleKey}: fields joined in call order, order sensitive
 * - {@link #generateKeyFromQuery}: raw string, whitespace sensitive
 */
@Slf4j
@Service
public class CacheKeyGenerator {

    private static final String SEPARATOR = ":";

    private final QueryKeyCanonicalizer canonicalizer;

    public CacheKeyGenerator(QueryKeyCanonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    /**
     * Generate canonical cache key for query parameters.
     *
     * @param params query key parameters
     * @return SHA-256 hash (64 hex chars)
     * @throws CacheKeyException if the parameters cannot be serialized
     */
    public String generateKey(QueryKeyParams params) {
        try {
            String canonical = canonicalizer.canonicalize(params);
            String key = DigestUtils.sha256Hex(canonical);
            log.debug("Generated cache key {} for operation={}", key.substring(0, 8), params.getOperation());
            return key;
        } catch (JsonProcessingException e) {
            throw new CacheKeyException("failed to serialize cache key parameters", e);
        }
    }

    /**
     * Generate key from operation, provider and extra fields, in call order.
     * Callers must pass extras in a stable order.
     *
     * Each field is written as {@code <length>:<value>}, so values containing the
     * separator cannot shift field boundaries ("aws:x" is not "aws", "x").
     */
    public String generateSimpleKey(String operation, String provider, String... extra) {
        StringBuilder sb = new StringBuilder();
        appendField(sb, operation);
        appendField(sb, provider);

        for (String part : extra) {
            appendField(sb, part);
        }

        return DigestUtils.sha256Hex(sb.toString());
    }

    private static void appendField(StringBuilder sb, String value) {
        String field = value == null ? "" : value;
        sb.append(field.length()).append(SEPARATOR).append(field);
    }

    /**
     * Hash a raw query string verbatim, without any normalization.
     */
    public String generateKeyFromQuery(String query) {
        return DigestUtils.sha256Hex(query);
    }

    /**
     * Start a fluent key builder.
     */
    public CacheKeyBuilder builder(String operation, String provider) {
        return new CacheKeyBuilder(this, operation, provider);
    }
}
