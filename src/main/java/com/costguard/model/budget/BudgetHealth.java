package com.costguard.model.budget;

/**
 * Health of a budget scope, ordered by severity.
 *
 * UNSPECIFIED is a sentinel for "no statuses to aggregate" and ranks below OK.
 */
public enum BudgetHealth {
    UNSPECIFIED(0),
    OK(1),
    WARNING(2),
    CRITICAL(3),
    EXCEEDED(4);

    private final int severity;

    BudgetHealth(int severity) {
        this.severity = severity;
    }

    public int getSeverity() {
        return severity;
    }

    public boolean isWorseThan(BudgetHealth other) {
        return severity > other.severity;
    }

    public boolean isCriticalOrExceeded() {
        return this == CRITICAL || this == EXCEEDED;
    }
}
