package com.costguard.model.budget;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluated state of one budget scope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScopedBudgetStatus {

    private ScopeType scopeType;

    /**
     * Provider name, tag selector or resource type. Empty for global.
     */
    private String scopeKey;

    private ScopedBudget budget;

    private double currentSpend;

    /**
     * 100 * currentSpend / amount, 0 when the amount is not positive.
     */
    private double percentage;

    private double forecastedSpend;

    private double forecastPercentage;

    private BudgetHealth health;

    @Builder.Default
    private List<ThresholdStatus> alerts = new ArrayList<>();

    private int matchedResources;

    private String currency;

    @JsonIgnore
    public String getScopeIdentifier() {
        return scopeType == null ? scopeKey : scopeType.identifier(scopeKey);
    }

    @JsonIgnore
    public boolean isOverBudget() {
        return percentage >= 100.0;
    }

    public boolean hasExceededAlerts() {
        return alerts.stream().anyMatch(alert -> alert.getStatus() == ThresholdStatus.State.EXCEEDED);
    }
}
