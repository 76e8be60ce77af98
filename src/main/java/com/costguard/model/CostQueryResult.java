package com.costguard.model;

import com.costguard.model.budget.ScopedBudgetResult;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Combined result of a cost query: priced line items plus their budget evaluation.
 * This is the payload stored in the query cache.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CostQueryResult {

    private String cacheKey;

    private List<CostLineItem> lineItems;

    private ScopedBudgetResult budgets;

    private Instant generatedAt;

    /**
     * Whether this instance was served from the cache. Never persisted.
     */
    @JsonIgnore
    private boolean fromCache;
}
