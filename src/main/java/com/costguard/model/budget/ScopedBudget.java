package com.costguard.model.budget;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Budget limit for a global, provider or resource type scope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScopedBudget {

    public static final String DEFAULT_PERIOD = "monthly";

    /**
     * Limit in {@link #currency}. Zero disables the budget.
     */
    private double amount;

    /**
     * ISO 4217 code. Empty inherits the global currency.
     */
    private String currency;

    /**
     * Only "monthly" is supported; empty means monthly.
     */
    private String period;

    /**
     * Empty means the default thresholds (50%, 80%, 100% actual).
     */
    @Builder.Default
    private List<AlertConfig> alerts = new ArrayList<>();

    public static ScopedBudget of(double amount, String currency) {
        return ScopedBudget.builder().amount(amount).currency(currency).build();
    }

    @JsonIgnore
    public boolean isEnabled() {
        return amount > 0;
    }

    public String effectivePeriod() {
        return period == null || period.isEmpty() ? DEFAULT_PERIOD : period;
    }
}
