package com.costguard.model.budget;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Budget hierarchy: an optional global budget plus provider, tag and resource type scopes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetsConfig {

    private ScopedBudget global;

    /**
     * Provider name to budget. Names match case-insensitively.
     */
    @Builder.Default
    private Map<String, ScopedBudget> providers = new HashMap<>();

    @Builder.Default
    private List<TagBudget> tags = new ArrayList<>();

    /**
     * Exact, case-sensitive resource type to budget.
     */
    @Builder.Default
    private Map<String, ScopedBudget> types = new HashMap<>();

    public boolean hasGlobalBudget() {
        return global != null && global.isEnabled();
    }

    public boolean hasScopedBudgets() {
        return (providers != null && !providers.isEmpty())
                || (tags != null && !tags.isEmpty())
                || (types != null && !types.isEmpty());
    }

    public String globalCurrency() {
        return global == null ? null : global.getCurrency();
    }
}
