package com.costguard.model.budget;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Health counts broken down by scope type and currency, with the scopes that need attention.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtendedBudgetSummary {

    private BudgetSummary summary;

    /**
     * Keyed by scope type prefix: "global", "provider", "tag", "type".
     */
    @Builder.Default
    private Map<String, BudgetSummary> byScopeType = new TreeMap<>();

    /**
     * Keyed by ISO currency code. Scopes without a currency are left out.
     */
    @Builder.Default
    private Map<String, BudgetSummary> byCurrency = new TreeMap<>();

    /**
     * Identifiers of CRITICAL and EXCEEDED scopes.
     */
    @Builder.Default
    private List<String> criticalScopes = new ArrayList<>();

    @Builder.Default
    private BudgetHealth overallHealth = BudgetHealth.UNSPECIFIED;
}
