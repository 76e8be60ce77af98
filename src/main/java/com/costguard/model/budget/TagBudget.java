package com.costguard.model.budget;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Budget scoped by a tag selector.
 *
 * When a resource matches several selectors, only the highest priority receives its cost;
 * ties go to the selector that sorts first alphabetically.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TagBudget {

    /**
     * "key:value" for an exact tag, "key:*" for any value of key.
     */
    private String selector;

    private int priority;

    private ScopedBudget budget;

    public static TagBudget of(String selector, int priority, double amount, String currency) {
        return new TagBudget(selector, priority, ScopedBudget.of(amount, currency));
    }

    @JsonIgnore
    public double getAmount() {
        return budget == null ? 0 : budget.getAmount();
    }

    @JsonIgnore
    public String getCurrency() {
        return budget == null ? null : budget.getCurrency();
    }
}
