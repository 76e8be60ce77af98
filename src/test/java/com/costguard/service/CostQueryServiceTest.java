package com.costguard.service;

import com.costguard.config.JacksonConfiguration;
import com.costguard.model.CostLineItem;
import com.costguard.model.CostQueryResult;
import com.costguard.model.QueryKeyParams;
import com.costguard.model.budget.BudgetHealth;
import com.costguard.model.budget.BudgetsConfig;
import com.costguard.model.budget.ScopedBudget;
import com.costguard.repository.FileCacheStore;
import com.costguard.service.canonicalization.CacheKeyGenerator;
import com.costguard.service.canonicalization.QueryKeyCanonicalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for CostQueryService.
 */
class CostQueryServiceTest {

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC);

    private ObjectMapper objectMapper;
    private CacheKeyGenerator keyGenerator;
    private FileCacheStore store;
    private CostSource costSource;
    private CostQueryService service;

    private final QueryKeyParams params = QueryKeyParams.builder()
            .operation("projected_cost")
            .provider("aws")
            .resourceTypes(List.of("aws:ec2/instance"))
            .build();

    private final BudgetsConfig budgets = BudgetsConfig.builder()
            .global(ScopedBudget.of(1000, "USD"))
            .providers(Map.of("aws", ScopedBudget.of(500, "USD")))
            .build();

    @BeforeEach
    void setUp() throws Exception {
        objectMapper = JacksonConfiguration.createObjectMapper();
        keyGenerator = new CacheKeyGenerator(new QueryKeyCanonicalizer());
        store = new FileCacheStore(tempDir, true, 3600, 100, objectMapper, clock);

        costSource = mock(CostSource.class);
        when(costSource.fetchCosts(any())).thenReturn(List.of(
                CostLineItem.builder()
                        .resourceId("i-1")
                        .resourceType("aws:ec2/instance")
                        .monthlyCost(475.0)
                        .tags(Map.of("team", "platform"))
                        .build()));

        service = new CostQueryService(keyGenerator, store, objectMapper, clock);
        service.setCostSource(costSource);
    }

    @Test
    void testMissComputesAndStores() throws Exception {
        CostQueryResult result = service.query(params, budgets);

        assertFalse(result.isFromCache());
        assertEquals(keyGenerator.generateKey(params), result.getCacheKey());
        assertEquals(1, result.getLineItems().size());
        assertEquals(475.0, result.getBudgets().getByProvider().get("aws").getCurrentSpend(), 1e-9);
        assertEquals(BudgetHealth.CRITICAL, result.getBudgets().getOverallHealth());
        assertEquals(1, store.count());
        verify(costSource, times(1)).fetchCosts(params);
    }

    @Test
    void testHitSkipsCostSource() {
        service.query(params, budgets);
        CostQueryResult cached = service.query(params, budgets);

        assertTrue(cached.isFromCache());
        assertEquals(List.of("provider:aws"), cached.getBudgets().getCriticalScopes());
        assertEquals(clock.instant(), cached.getGeneratedAt());
        verify(costSource, times(1)).fetchCosts(any());
    }

    @Test
    void testEquivalentQueriesShareCacheEntry() {
        service.query(params, budgets);
        service.query(params.toBuilder().operation("PROJECTED_COST").provider(" AWS ").build(), budgets);

        verify(costSource, times(1)).fetchCosts(any());
    }

    @Test
    void testCorruptPayloadTreatedAsMiss() throws Exception {
        String key = keyGenerator.generateKey(params);
        store.set(key, "not json".getBytes(StandardCharsets.UTF_8));

        CostQueryResult result = service.query(params, budgets);

        assertFalse(result.isFromCache());
        verify(costSource, times(1)).fetchCosts(any());
    }

    @Test
    void testUnreadableCacheFileTreatedAsMiss() throws Exception {
        String key = keyGenerator.generateKey(params);
        Files.writeString(tempDir.resolve(key + ".json"), "{broken");

        assertFalse(service.query(params, budgets).isFromCache());
    }

    @Test
    void testCacheFileWithoutEntryMetadataTreatedAsMiss() throws Exception {
        String key = keyGenerator.generateKey(params);
        Files.writeString(tempDir.resolve(key + ".json"), "{}");

        CostQueryResult result = assertDoesNotThrow(() -> service.query(params, budgets));

        assertFalse(result.isFromCache());
        assertTrue(service.query(params, budgets).isFromCache());
        verify(costSource, times(1)).fetchCosts(any());
    }

    @Test
    void testJsonNullPayloadTreatedAsMiss() throws Exception {
        String key = keyGenerator.generateKey(params);
        store.set(key, "null".getBytes(StandardCharsets.UTF_8));

        assertFalse(service.query(params, budgets).isFromCache());
    }

    @Test
    void testDisabledCacheAlwaysComputes() {
        CostQueryService uncached = new CostQueryService(keyGenerator, FileCacheStore.disabled(), objectMapper, clock);
        uncached.setCostSource(costSource);

        uncached.query(params, budgets);
        uncached.query(params, budgets);

        verify(costSource, times(2)).fetchCosts(any());
    }

    @Test
    void testInvalidateForcesRecompute() {
        service.query(params, budgets);
        service.invalidate(params);
        service.query(params, budgets);

        verify(costSource, times(2)).fetchCosts(any());
    }

    @Test
    void testMissWithoutCostSourceFails() {
        CostQueryService sourceless = new CostQueryService(keyGenerator, store, objectMapper, clock);

        assertThrows(IllegalStateException.class, () -> sourceless.query(params, budgets));
    }

    @Test
    void testNullBudgetsStillReturnsItems() {
        CostQueryResult result = service.query(params, null);

        assertEquals(1, result.getLineItems().size());
        assertEquals(BudgetHealth.UNSPECIFIED, result.getBudgets().getOverallHealth());
    }
}
