package com.costguard.model.budget;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Scope counts per health state.
 *
 * totalBudgets counts every scope; a scope without a health (or UNSPECIFIED) is
 * in the total but in none of the per-state counts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetSummary {

    private int totalBudgets;

    private int budgetsOk;

    private int budgetsWarning;

    private int budgetsCritical;

    private int budgetsExceeded;

    /**
     * Count one scope with the given health.
     */
    public void record(BudgetHealth health) {
        totalBudgets++;
        if (health == null) {
            return;
        }
        switch (health) {
            case OK:
                budgetsOk++;
                break;
            case WARNING:
                budgetsWarning++;
                break;
            case CRITICAL:
                budgetsCritical++;
                break;
            case EXCEEDED:
                budgetsExceeded++;
                break;
            default:
                break;
        }
    }

    /**
     * Scopes that fall into one of the four health states.
     */
    @JsonIgnore
    public int getHealthCounted() {
        return budgetsOk + budgetsWarning + budgetsCritical + budgetsExceeded;
    }
}
