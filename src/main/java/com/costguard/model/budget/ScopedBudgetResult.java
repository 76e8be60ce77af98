package com.costguard.model.budget;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * All evaluated scopes of one budget evaluation plus the rolled-up health.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScopedBudgetResult {

    /**
     * Present only when a global budget is configured.
     */
    private ScopedBudgetStatus global;

    @Builder.Default
    private Map<String, ScopedBudgetStatus> byProvider = new LinkedHashMap<>();

    /**
     * Tag statuses in priority order.
     */
    @Builder.Default
    private List<ScopedBudgetStatus> byTag = new ArrayList<>();

    @Builder.Default
    private Map<String, ScopedBudgetStatus> byType = new LinkedHashMap<>();

    @Builder.Default
    private BudgetHealth overallHealth = BudgetHealth.UNSPECIFIED;

    @Builder.Default
    private List<String> criticalScopes = new ArrayList<>();

    @Builder.Default
    private List<BudgetAllocation> allocations = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    /**
     * Per-health scope counts. Filled by evaluation.
     */
    private ExtendedBudgetSummary summary;

    public boolean hasExceededBudgets() {
        return overallHealth == BudgetHealth.EXCEEDED;
    }

    public boolean hasCriticalBudgets() {
        return overallHealth.isCriticalOrExceeded();
    }

    /**
     * Flat list: global, providers by key, tags in priority order, types by key.
     */
    public List<ScopedBudgetStatus> allScopes() {
        List<ScopedBudgetStatus> scopes = new ArrayList<>();
        if (global != null) {
            scopes.add(global);
        }
        scopes.addAll(new TreeMap<>(byProvider).values());
        scopes.addAll(byTag);
        scopes.addAll(new TreeMap<>(byType).values());
        return scopes;
    }
}
