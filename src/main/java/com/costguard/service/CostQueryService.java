package com.costguard.service;

import com.costguard.exception.CacheDisabledException;
import com.costguard.exception.CacheException;
import com.costguard.exception.CacheExpiredException;
import com.costguard.exception.CacheNotFoundException;
import com.costguard.model.CacheEntry;
import com.costguard.model.CostLineItem;
import com.costguard.model.CostQueryResult;
import com.costguard.model.QueryKeyParams;
import com.costguard.model.budget.BudgetsConfig;
import com.costguard.model.budget.ScopedBudgetResult;
import com.costguard.repository.FileCacheStore;
import com.costguard.service.budget.ScopedBudgetEvaluator;
import com.costguard.service.canonicalization.CacheKeyGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Cost query engine.
 *
 * Flow:
 * 1. Derive the canonical cache key from the query parameters
 * 2. Look up the file cache; on a hit return the stored result
 * 3. On a miss fetch line items from the {@link CostSource}
 * 4. Evaluate them against the budget hierarchy
 * 5. Store the combined result under the same key and return it
 *
 * Cache failures never fail a query: every cache condition is logged and treated as a miss.
 */
@Slf4j
@Service
public class CostQueryService {

    private final CacheKeyGenerator keyGenerator;
    private final FileCacheStore cacheStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired(required = false)
    private CostSource costSource;

    public CostQueryService(
            CacheKeyGenerator keyGenerator,
            FileCacheStore cacheStore,
            ObjectMapper objectMapper,
            Clock clock) {
        this.keyGenerator = keyGenerator;
        this.cacheStore = cacheStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void setCostSource(CostSource costSource) {
        this.costSource = costSource;
    }

    /**
     * Run a query, serving it from the cache when possible.
     *
     * @param params  query parameters (also the cache key material)
     * @param budgets budget hierarchy to evaluate, may be null
     * @return the cached or freshly computed result
     * @throws IllegalStateException if the result is not cached and no cost source is configured
     */
    public CostQueryResult query(QueryKeyParams params, BudgetsConfig budgets) {
        String key = keyGenerator.generateKey(params);

        Optional<CostQueryResult> cached = lookup(key);
        if (cached.isPresent()) {
            log.info("Cost query served from cache: operation={}, key={}", params.getOperation(), shortKey(key));
            return cached.get();
        }

        if (costSource == null) {
            throw new IllegalStateException("No cost source configured and no cached result for key " + key);
        }

        List<CostLineItem> items = costSource.fetchCosts(params);
        ScopedBudgetResult evaluation = new ScopedBudgetEvaluator(budgets, clock).evaluate(items);

        CostQueryResult result = CostQueryResult.builder()
                .cacheKey(key)
                .lineItems(items)
                .budgets(evaluation)
                .generatedAt(clock.instant())
                .build();

        store(key, result);

        log.info("Cost query computed: operation={}, items={}, health={}",
                params.getOperation(), items.size(), evaluation.getOverallHealth());
        return result;
    }

    /**
     * Drop the cached result for a query, if any.
     */
    public void invalidate(QueryKeyParams params) {
        String key = keyGenerator.generateKey(params);
        try {
            cacheStore.delete(key);
        } catch (CacheDisabledException e) {
            log.debug("Cache disabled, nothing to invalidate");
        } catch (CacheException e) {
            log.warn("Failed to invalidate cache entry {}: {}", shortKey(key), e.getMessage());
        }
    }

    private Optional<CostQueryResult> lookup(String key) {
        CacheEntry entry;
        try {
            entry = cacheStore.get(key);
        } catch (CacheNotFoundException | CacheExpiredException | CacheDisabledException e) {
            log.debug("Cache miss for {}: {}", shortKey(key), e.getMessage());
            return Optional.empty();
        } catch (CacheException e) {
            log.warn("Cache read failed for {}, treating as miss: {}", shortKey(key), e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            // Cache failures shouldn't break queries
            log.error("Unexpected error reading cache entry {}, treating as miss", shortKey(key), e);
            return Optional.empty();
        }

        if (entry.getData() == null) {
            log.warn("Cache entry {} has no payload, treating as miss", shortKey(key));
            return Optional.empty();
        }

        try {
            CostQueryResult result = objectMapper.readValue(entry.getData(), CostQueryResult.class);
            if (result == null) {
                log.warn("Cache entry {} holds an empty result, treating as miss", shortKey(key));
                return Optional.empty();
            }
            result.setFromCache(true);
            return Optional.of(result);
        } catch (IOException e) {
            log.warn("Cached payload for {} could not be decoded, treating as miss: {}",
                    shortKey(key), e.getMessage());
            return Optional.empty();
        }
    }

    private void store(String key, CostQueryResult result) {
        if (!cacheStore.isEnabled()) {
            return;
        }

        try {
            byte[] payload = objectMapper.writeValueAsBytes(result);
            cacheStore.set(key, payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize cost query result for {}", shortKey(key), e);
        } catch (CacheException e) {
            // Cache failures shouldn't break queries
            log.warn("Failed to cache cost query result for {}: {}", shortKey(key), e.getMessage());
        }
    }

    private static String shortKey(String key) {
        return key.length() > 8 ? key.substring(0, 8) : key;
    }
}
